package com.arielplatform.common.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A diagnosed symptom. Derived on every {@code diagnose()} call, never stored.
 *
 * <p>{@code subject} is the metric key for critical issues and the error type for
 * recurring ones. {@code occurrenceCount} is null for critical issues.
 * {@code errorIds} are the unhealed error records the issue was derived from; they
 * are the records marked healed once a strategy has acted on the issue.
 */
public record Issue(
    @JsonProperty("kind")             IssueKind kind,
    @JsonProperty("subject")          String subject,
    @JsonProperty("severity")         double severity,
    @JsonProperty("occurrenceCount")  Integer occurrenceCount,
    @JsonProperty("description")      String description,
    @JsonIgnore                       List<Long> errorIds
) {

    public Issue {
        errorIds = errorIds == null ? List.of() : List.copyOf(errorIds);
    }

    /** e.g. {@code critical_memory_integrity}, {@code recurring_memory_corruption}. */
    @JsonProperty("label")
    public String label() {
        return kind.prefix() + subject;
    }
}
