package com.autoresearch.repository;

import com.autoresearch.entity.CacheEntryRecord;
import com.autoresearch.research.model.ResearchMode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for managing {@link CacheEntryRecord} entities.
 */
public interface CacheEntryRecordRepository extends JpaRepository<CacheEntryRecord, String> {

    List<CacheEntryRecord> findByModeOrderByCreatedAtDesc(ResearchMode mode, Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query("delete from CacheEntryRecord e where e.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("delete from CacheEntryRecord e where e.fingerprint = :fingerprint and e.expiresAt <= :now")
    int deleteIfExpired(@Param("fingerprint") String fingerprint, @Param("now") Instant now);
}
