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

package dev.nishisan.nstate.logs;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Describes which log file(s) a caller wants. Instances are created through the static
 * factories, one per way of addressing a log.
 */
public final class LogSelector {

    public enum Mode {
        /**
         * Every file on a node whose name matches a glob.
         */
        NODE_GLOB,
        /**
         * One file on a node, by exact name.
         */
        FILE,
        /**
         * Output of the worker process hosting an actor.
         */
        ACTOR,
        /**
         * Output of a worker process, by pid.
         */
        WORKER
    }

    private final Mode mode;
    private final String node;
    private final String pattern;
    private final String actorId;
    private final Integer pid;
    private final LogOutput output;

    private LogSelector(Mode mode, String node, String pattern, String actorId, Integer pid, LogOutput output) {
        this.mode = mode;
        this.node = node;
        this.pattern = pattern;
        this.actorId = actorId;
        this.pid = pid;
        this.output = output;
    }

    /**
     * @param node node id or IP; null selects the head node
     */
    public static LogSelector nodeGlob(String node, String glob) {
        return new LogSelector(Mode.NODE_GLOB, node, Objects.requireNonNull(glob, "glob"), null, null, LogOutput.OUT);
    }

    /**
     * Files matching a glob on the head node.
     */
    public static LogSelector headGlob(String glob) {
        return nodeGlob(null, glob);
    }

    public static LogSelector file(String node, String filename) {
        return new LogSelector(Mode.FILE, Objects.requireNonNull(node, "node"),
                Objects.requireNonNull(filename, "filename"), null, null, LogOutput.OUT);
    }

    public static LogSelector actor(String actorId) {
        return actor(actorId, LogOutput.OUT);
    }

    public static LogSelector actor(String actorId, LogOutput output) {
        return new LogSelector(Mode.ACTOR, null, null, Objects.requireNonNull(actorId, "actorId"), null,
                Objects.requireNonNull(output, "output"));
    }

    public static LogSelector worker(int pid) {
        return worker(pid, null, LogOutput.OUT);
    }

    /**
     * @param nodeIp IP of the machine running the process; may be null when the cluster has
     *               a single machine
     */
    public static LogSelector worker(int pid, String nodeIp, LogOutput output) {
        if (pid <= 0) {
            throw new IllegalArgumentException("pid must be > 0");
        }
        return new LogSelector(Mode.WORKER, nodeIp, null, null, pid, Objects.requireNonNull(output, "output"));
    }

    public Mode mode() {
        return mode;
    }

    public Optional<String> node() {
        return Optional.ofNullable(node);
    }

    /**
     * Glob for {@link Mode#NODE_GLOB}, file name for {@link Mode#FILE}.
     */
    public Optional<String> pattern() {
        return Optional.ofNullable(pattern);
    }

    public Optional<String> actorId() {
        return Optional.ofNullable(actorId);
    }

    public OptionalInt pid() {
        return pid == null ? OptionalInt.empty() : OptionalInt.of(pid);
    }

    public LogOutput output() {
        return output;
    }

    /**
     * Name of the output file of a process, relative to its machine's log directory.
     */
    static String processGlob(long pid, LogOutput output) {
        return "*-" + pid + output.suffix();
    }

    public String describe() {
        return switch (mode) {
            case NODE_GLOB -> "'" + pattern + "' on " + (node == null ? "the head node" : "node " + node);
            case FILE -> "file " + pattern + " on node " + node;
            case ACTOR -> "actor " + actorId + " (" + output + ")";
            case WORKER -> "worker pid " + pid + (node == null ? "" : " on " + node) + " (" + output + ")";
        };
    }

    @Override
    public String toString() {
        return "LogSelector{" + describe() + '}';
    }
}
