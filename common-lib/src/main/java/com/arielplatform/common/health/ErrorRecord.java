package com.arielplatform.common.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logged error. Only the healed flag changes after creation.
 * Detail values may be null, as they arrive from JSON.
 */
public final class ErrorRecord {

    private final long id;
    private final String type;
    private final double severity;
    private final Instant timestamp;
    private final Map<String, Object> details;
    private boolean healed;

    public ErrorRecord(long id, String type, double severity, Instant timestamp, Map<String, Object> details) {
        this.id        = id;
        this.type      = type;
        this.severity  = severity;
        this.timestamp = timestamp;
        this.details   = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @JsonProperty("id")        public long id()                     { return id; }
    @JsonProperty("type")      public String type()                 { return type; }
    @JsonProperty("severity")  public double severity()             { return severity; }
    @JsonProperty("timestamp") public Instant timestamp()           { return timestamp; }
    @JsonProperty("details")   public Map<String, Object> details() { return details; }
    @JsonProperty("healed")    public boolean healed()              { return healed; }

    void markHealed() {
        this.healed = true;
    }
}
