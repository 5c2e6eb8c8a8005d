package com.autoresearch.research.cache;

import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.text.Tokenizer;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.TreeSet;

@Component
public class QueryFingerprinter {

    /**
     * Word order, case, punctuation, stop words and plural forms do not change the fingerprint. The mode does.
     */
    public Fingerprint fingerprint(String queryText, ResearchMode mode) {
        List<String> tokens = Tokenizer.contentTokens(queryText);
        TreeSet<String> sorted = new TreeSet<>(tokens);
        String canonical = sorted.isEmpty() ? Tokenizer.normalize(queryText) : String.join(" ", sorted);
        String key = mode.name() + "|" + canonical;
        String hash = DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
        return new Fingerprint(hash, sorted, mode);
    }
}
