package com.autoresearch.research.search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlNormalizerTest {

    @Test
    void testSchemeWwwFragmentAndTrailingSlashIgnored() {
        String expected = "example.com/articles/tea";
        assertEquals(expected, UrlNormalizer.normalize("https://www.example.com/articles/tea/"));
        assertEquals(expected, UrlNormalizer.normalize("http://example.com/articles/tea#section-2"));
        assertEquals(expected, UrlNormalizer.normalize("HTTPS://WWW.EXAMPLE.COM/articles/tea"));
    }

    @Test
    void testTrackingParametersDroppedAndRestSorted() {
        assertEquals("example.com/search?a=1&b=2",
                UrlNormalizer.normalize("https://example.com/search?b=2&utm_source=x&a=1&fbclid=abc"));
    }

    @Test
    void testNonDefaultPortKept() {
        assertEquals("example.com:8443/x", UrlNormalizer.normalize("https://example.com:8443/x"));
    }

    @Test
    void testBlankAndUnparseable() {
        assertEquals("", UrlNormalizer.normalize(null));
        assertEquals("", UrlNormalizer.normalize("  "));
        assertEquals("example.com/a b", UrlNormalizer.normalize("https://www.example.com/a b/"));
    }
}
