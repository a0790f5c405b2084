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

package dev.nishisan.nstate.query;

import dev.nishisan.nstate.model.ResourceKind;

import java.util.Optional;

/**
 * Raised by by-id lookups and log resolution when nothing matches.
 *
 * <p>{@link #stale()} distinguishes resources that did exist but whose data the owning source
 * has already reclaimed; that is an expected outcome, not a bug.
 */
public final class ResourceNotFoundException extends RuntimeException {
    private final ResourceKind kind;
    private final String id;
    private final boolean stale;

    private ResourceNotFoundException(String message, ResourceKind kind, String id, boolean stale) {
        super(message);
        this.kind = kind;
        this.id = id;
        this.stale = stale;
    }

    public static ResourceNotFoundException absent(ResourceKind kind, String id) {
        return new ResourceNotFoundException(kind + " " + id + " not found", kind, id, false);
    }

    public static ResourceNotFoundException absent(ResourceKind kind, String id, String note) {
        return new ResourceNotFoundException(kind + " " + id + " not found: " + note, kind, id, false);
    }

    public static ResourceNotFoundException reclaimed(ResourceKind kind, String id) {
        return new ResourceNotFoundException(kind + " " + id
                + " not found: the owning data source has already garbage collected its data", kind, id, true);
    }

    public static ResourceNotFoundException logTarget(String description) {
        return new ResourceNotFoundException("No log file matches " + description, null, description, false);
    }

    public Optional<ResourceKind> kind() {
        return Optional.ofNullable(kind);
    }

    public String id() {
        return id;
    }

    public boolean stale() {
        return stale;
    }
}
