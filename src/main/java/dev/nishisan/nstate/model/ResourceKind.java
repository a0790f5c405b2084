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

package dev.nishisan.nstate.model;

/**
 * The resource categories that can be observed. Each kind is owned either by the head source
 * (cluster-wide records) or by every machine source (per-machine records); the fan-out
 * coordinator uses {@link #scope()} to pick its targets.
 */
public enum ResourceKind {
    ACTOR(Scope.CLUSTER),
    TASK(Scope.MACHINE),
    OBJECT(Scope.MACHINE),
    NODE(Scope.CLUSTER),
    WORKER(Scope.MACHINE),
    JOB(Scope.CLUSTER),
    PLACEMENT_GROUP(Scope.CLUSTER),
    RUNTIME_ENV(Scope.MACHINE);

    public enum Scope {
        CLUSTER,
        MACHINE
    }

    private final Scope scope;

    ResourceKind(Scope scope) {
        this.scope = scope;
    }

    public Scope scope() {
        return scope;
    }

    public boolean isClusterWide() {
        return scope == Scope.CLUSTER;
    }
}
