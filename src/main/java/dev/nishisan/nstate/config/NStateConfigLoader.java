/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.nstate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.nstate.NStateConfig;
import dev.nishisan.nstate.common.NodeId;
import dev.nishisan.nstate.common.NodeInfo;
import dev.nishisan.nstate.logs.LogStreamOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the YAML configuration of a node and turns it into an {@link NStateConfig}.
 *
 * <p>{@code ${VAR}} and {@code ${VAR:default}} placeholders are replaced from the environment
 * before the document is parsed.
 */
public final class NStateConfigLoader {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private NStateConfigLoader() {
    }

    public static NStateYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static NStateYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        String content = Files.readString(yamlFile);
        return mapper.readValue(resolveVariables(content, envProvider), NStateYamlConfig.class);
    }

    public static void save(Path yamlFile, NStateYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    static String resolveVariables(String content, Function<String, String> envProvider) {
        Matcher matcher = VARIABLE.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            builder.append(content, i, matcher.start());
            builder.append(replacement(matcher.group(1), envProvider));
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String replacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String value = envProvider.apply(parts[0]);
        if (value != null) {
            return value;
        }
        if (parts.length > 1) {
            return parts[1];
        }
        throw new IllegalArgumentException(
                "Environment variable '" + parts[0] + "' not found and no default value provided.");
    }

    public static NStateConfig convertToDomain(NStateYamlConfig yamlConfig) {
        NodeIdentityConfig nodeConfig = yamlConfig.getNode();
        if (nodeConfig == null) {
            throw new IllegalArgumentException("Node configuration is missing");
        }
        if (nodeConfig.getHost() == null || nodeConfig.getHost().isBlank()) {
            throw new IllegalArgumentException("node.host is required");
        }
        NodeId nodeId = nodeConfig.getId() != null ? NodeId.of(nodeConfig.getId()) : NodeId.randomId();
        Set<String> roles = nodeConfig.getRoles() == null || nodeConfig.getRoles().isEmpty()
                ? Set.of(NodeInfo.ROLE_NODE)
                : nodeConfig.getRoles();
        NodeInfo local = new NodeInfo(nodeId, nodeConfig.getHost(), nodeConfig.getPort(), roles);
        NStateConfig.Builder builder = NStateConfig.builder(local);

        if (nodeConfig.getLogDir() != null && !nodeConfig.getLogDir().isBlank()) {
            builder.logDirectory(Path.of(nodeConfig.getLogDir()));
        }

        ClusterPolicyConfig cluster = yamlConfig.getCluster();
        if (cluster != null) {
            if (cluster.getSeeds() != null) {
                for (String seed : cluster.getSeeds()) {
                    NodeInfo seedInfo = parseSeed(seed);
                    if (seedInfo.host().equals(local.host()) && seedInfo.port() == local.port()) {
                        continue;
                    }
                    builder.addSeed(seedInfo);
                }
            }
            Duration interval = parseDuration(cluster.getHeartbeatInterval());
            if (interval != null) {
                builder.heartbeatInterval(interval);
            }
            Duration timeout = parseDuration(cluster.getHeartbeatTimeout());
            if (timeout != null) {
                builder.heartbeatTimeout(timeout);
            }
            Duration connect = parseDuration(cluster.getConnectTimeout());
            if (connect != null) {
                builder.connectTimeout(connect);
            }
        }

        QueryPolicyConfig query = yamlConfig.getQuery();
        if (query != null) {
            builder.maxRecords(query.getMaxRecords());
            builder.recordCallsite(query.isRecordCallsite());
            builder.queryWorkers(query.getWorkers());
            Duration timeout = parseDuration(query.getTimeout());
            if (timeout != null) {
                builder.queryTimeout(timeout);
            }
        }

        LogPolicyConfig logs = yamlConfig.getLogs();
        if (logs != null) {
            LogStreamOptions.Builder options = LogStreamOptions.builder()
                    .tailLines(logs.getTailLines())
                    .chunkBytes(logs.getChunkBytes());
            Duration poll = parseDuration(logs.getPollInterval());
            if (poll != null) {
                options.pollInterval(poll);
            }
            builder.logOptions(options.build());
        }
        return builder.build();
    }

    /**
     * Seed entries name an address only; the real node id is learned during the handshake.
     */
    private static NodeInfo parseSeed(String seed) {
        int separator = seed.lastIndexOf(':');
        if (separator <= 0 || separator == seed.length() - 1) {
            throw new IllegalArgumentException("Seed must be host:port, got '" + seed + "'");
        }
        String host = seed.substring(0, separator).trim();
        int port;
        try {
            port = Integer.parseInt(seed.substring(separator + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in seed '" + seed + "'", e);
        }
        return new NodeInfo(NodeId.of("seed-" + host + ":" + port), host, port);
    }

    /**
     * Parses ISO-8601 durations ({@code PT30S}) and the short forms {@code 500ms},
     * {@code 30s}, {@code 10m} and {@code 2h}.
     *
     * @return null for a missing or blank value
     */
    public static Duration parseDuration(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String value = s.trim().toUpperCase(Locale.ROOT);
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            try {
                if (value.endsWith("MS")) {
                    return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
                } else if (value.endsWith("H")) {
                    return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                } else if (value.endsWith("M")) {
                    return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                } else if (value.endsWith("S")) {
                    return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                }
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Invalid duration '" + s + "'", nfe);
            }
            throw new IllegalArgumentException("Invalid duration '" + s + "'", e);
        }
    }
}
