package dev.nishisan.nstate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LogPolicyConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    @JsonProperty("tail-lines")
    private int tailLines = 1000;

    @JsonProperty("poll-interval")
    private String pollInterval = "500ms";

    @JsonProperty("chunk-bytes")
    private int chunkBytes = 64 * 1024;

    public int getTailLines() {
        return tailLines;
    }

    public void setTailLines(int tailLines) {
        this.tailLines = tailLines;
    }

    public String getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(String pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getChunkBytes() {
        return chunkBytes;
    }

    public void setChunkBytes(int chunkBytes) {
        this.chunkBytes = chunkBytes;
    }
}
