package dev.nishisan.nstate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class NStateYamlConfig {

    @JsonProperty("node")
    private NodeIdentityConfig node;

    @JsonProperty("cluster")
    private ClusterPolicyConfig cluster;

    @JsonProperty("query")
    private QueryPolicyConfig query;

    @JsonProperty("logs")
    private LogPolicyConfig logs;

    public NodeIdentityConfig getNode() {
        return node;
    }

    public void setNode(NodeIdentityConfig node) {
        this.node = node;
    }

    public ClusterPolicyConfig getCluster() {
        return cluster;
    }

    public void setCluster(ClusterPolicyConfig cluster) {
        this.cluster = cluster;
    }

    public QueryPolicyConfig getQuery() {
        return query;
    }

    public void setQuery(QueryPolicyConfig query) {
        this.query = query;
    }

    public LogPolicyConfig getLogs() {
        return logs;
    }

    public void setLogs(LogPolicyConfig logs) {
        this.logs = logs;
    }
}
