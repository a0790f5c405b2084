package dev.nishisan.nstate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Membership settings, deserialized from YAML. Durations are kept as text and parsed by
 * {@link NStateConfigLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterPolicyConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * {@code host:port} of nodes contacted at startup.
     */
    private List<String> seeds;

    @JsonProperty("heartbeat-interval")
    private String heartbeatInterval;

    @JsonProperty("heartbeat-timeout")
    private String heartbeatTimeout;

    @JsonProperty("connect-timeout")
    private String connectTimeout;

    public List<String> getSeeds() {
        return seeds;
    }

    public void setSeeds(List<String> seeds) {
        this.seeds = seeds;
    }

    public String getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(String heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public String getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    public void setHeartbeatTimeout(String heartbeatTimeout) {
        this.heartbeatTimeout = heartbeatTimeout;
    }

    public String getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(String connectTimeout) {
        this.connectTimeout = connectTimeout;
    }
}
