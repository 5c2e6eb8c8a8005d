package com.autoresearch.research.handoff;

import com.autoresearch.research.model.Report;

import java.util.Optional;

public interface ReportPublisher {

    /**
     * @return the publication id
     */
    String publish(String runId, Report report);

    Optional<Report> find(String publicationId);
}
