package com.autoresearch.research.handoff;

import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.SourceRecord;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Numbered references. Premium budgets get APA style, everyone else a basic title and URL list.
 */
@Component
public class DefaultCitationFormatter implements CitationFormatter {

    public static final String STYLE_BASIC = "basic";
    public static final String STYLE_APA = "apa";

    private static final DateTimeFormatter ACCESS_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    private final Clock clock;

    public DefaultCitationFormatter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Citations format(List<SourceRecord> sources, Budget budget) {
        boolean apa = budget.premiumFeaturesEnabled();
        List<String> references = new ArrayList<>();
        int index = 1;
        for (SourceRecord source : sources) {
            String reference = apa ? apa(source) : basic(source);
            references.add("[" + index++ + "] " + reference);
        }
        return new Citations(apa ? STYLE_APA : STYLE_BASIC, references);
    }

    private String basic(SourceRecord source) {
        String title = StringUtils.hasText(source.title()) ? source.title() : source.url();
        return title + ". " + source.url();
    }

    private String apa(SourceRecord source) {
        String author = StringUtils.hasText(source.author()) ? source.author() : siteName(source.url());
        String year = source.publishedAt() == null
                ? "n.d."
                : String.valueOf(source.publishedAt().atZone(ZoneOffset.UTC).getYear());
        String accessed = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).format(ACCESS_DATE);
        return author + ". (" + year + "). " + source.title() + ". Retrieved " + accessed + ", from " + source.url();
    }

    private static String siteName(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return url;
            }
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException ex) {
            return url;
        }
    }
}
