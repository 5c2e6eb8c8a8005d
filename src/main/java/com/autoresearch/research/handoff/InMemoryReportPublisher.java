package com.autoresearch.research.handoff;

import com.autoresearch.research.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
public class InMemoryReportPublisher implements ReportPublisher {

    private final Map<String, Report> publications = new ConcurrentHashMap<>();

    @Override
    public String publish(String runId, Report report) {
        String publicationId = UUID.randomUUID().toString();
        publications.put(publicationId, report);
        log.info("Published report {} for run {} ({} words, {} references).", publicationId, runId,
                report.wordCount(), report.references().size());
        return publicationId;
    }

    @Override
    public Optional<Report> find(String publicationId) {
        return Optional.ofNullable(publications.get(publicationId));
    }
}
