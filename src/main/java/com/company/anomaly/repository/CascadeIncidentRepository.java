package com.company.anomaly.repository;

import com.company.anomaly.domain.CascadeIncident;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;

public interface CascadeIncidentRepository {

    /**
     * Persists the incident and its ordered member references
     *
     * @throws DuplicateKeyException when an incident with the same dedupe key exists
     */
    CascadeIncident save(CascadeIncident incident) throws DuplicateKeyException;

    boolean existsByDedupeKey(String dedupeKey);

    /**
     * Incidents whose [startTime, endTime] overlaps [from, to], newest first
     */
    List<CascadeIncident> findOverlapping(Instant from, Instant to);
}
