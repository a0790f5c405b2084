package dev.nishisan.nstate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;

/**
 * Query defaults, deserialized from YAML.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryPolicyConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    @JsonProperty("max-records")
    private int maxRecords = 100_000;

    private String timeout = "30s";

    /**
     * Whether object creation callsites are recorded by the local source. Object summaries
     * group by callsite only when this is on.
     */
    @JsonProperty("record-callsite")
    private boolean recordCallsite;

    private int workers = 16;

    public int getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public String getTimeout() {
        return timeout;
    }

    public void setTimeout(String timeout) {
        this.timeout = timeout;
    }

    public boolean isRecordCallsite() {
        return recordCallsite;
    }

    public void setRecordCallsite(boolean recordCallsite) {
        this.recordCallsite = recordCallsite;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }
}
