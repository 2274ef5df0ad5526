package com.company.anomaly.repository;

import com.company.anomaly.domain.AnomalyCount;
import com.company.anomaly.domain.AnomalyCriteria;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.enums.Severity;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only anomaly log. Events are never deleted; only resolvedAt and the
 * cascade back-reference are patched.
 */
public interface AnomalyEventRepository {

    /**
     * At-least-once append; also increments the hourly anomaly rollup
     */
    AnomalyEvent append(AnomalyEvent event);

    Optional<AnomalyEvent> findById(String id);

    List<AnomalyEvent> findByIds(Collection<String> ids);

    /**
     * Matching events, newest first
     */
    List<AnomalyEvent> find(AnomalyCriteria criteria);

    /**
     * Events with timestamp in [from, to], oldest first
     */
    List<AnomalyEvent> findBetween(Instant from, Instant to);

    List<AnomalyEvent> findOpenOlderThan(Severity severity, Instant cutoff, int limit);

    /**
     * Sets resolvedAt if the event is still open
     *
     * @return true when this call resolved the event
     */
    boolean resolve(String id, Instant resolvedAt);

    /**
     * Sets the cascade back-reference on events that have none
     *
     * @return number of events linked
     */
    int linkToIncident(Collection<String> eventIds, String incidentId);

    /**
     * Raw scan over events with timestamp in [from, to)
     */
    List<AnomalyCount> summarize(Instant from, Instant to);

    /**
     * Hourly rollup rows for hours starting in [fromHour, toHour)
     */
    List<AnomalyCount> summarizeHourly(Instant fromHour, Instant toHour);
}
