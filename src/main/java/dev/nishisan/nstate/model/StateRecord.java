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

import java.io.Serial;
import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Common envelope of every observed resource.
 *
 * <p>The set of variants is closed: the constructor is package private and each
 * {@link ResourceKind} has exactly one final subclass. Records are transient copies of
 * state owned by a data source; {@link #mutableState()} may already be outdated when a
 * caller reads it.
 *
 * <p>{@link #field(String)} gives the filter engine and the summarizer a uniform, string
 * typed view over the envelope, the mutable state and the immutable metadata (looked up in
 * that order).
 */
public abstract class StateRecord implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public static final String FIELD_ID = "id";
    public static final String FIELD_KIND = "kind";
    public static final String FIELD_DETAIL_LEVEL = "detail_level";
    public static final String FIELD_STATE = "state";

    private final String id;
    private final Map<String, Object> immutableMetadata;
    private final Map<String, Object> mutableState;
    private final DetailLevel detailLevel;

    StateRecord(String id,
                Map<String, ?> immutableMetadata,
                Map<String, ?> mutableState,
                DetailLevel detailLevel) {
        this.id = Objects.requireNonNull(id, "id");
        this.immutableMetadata = copyOf(immutableMetadata, "immutableMetadata");
        this.mutableState = copyOf(mutableState, "mutableState");
        this.detailLevel = Objects.requireNonNull(detailLevel, "detailLevel");
    }

    public abstract ResourceKind kind();

    /**
     * Field names kept when the record is reduced to its summary view.
     */
    abstract Set<String> summaryFields();

    abstract StateRecord rebuild(Map<String, Object> immutableMetadata,
                                 Map<String, Object> mutableState,
                                 DetailLevel detailLevel);

    public String id() {
        return id;
    }

    public Map<String, Object> immutableMetadata() {
        return immutableMetadata;
    }

    public Map<String, Object> mutableState() {
        return mutableState;
    }

    public DetailLevel detailLevel() {
        return detailLevel;
    }

    /**
     * @return the current {@code state} value as last reported by the owning source
     */
    public Optional<String> state() {
        return field(FIELD_STATE);
    }

    /**
     * Raw value of a field, resolving envelope fields first, then mutable state, then
     * immutable metadata. A key mapped to {@code null} counts as absent.
     */
    public Optional<Object> value(String name) {
        Objects.requireNonNull(name, "name");
        switch (name) {
            case FIELD_ID:
                return Optional.of(id);
            case FIELD_KIND:
                return Optional.of(kind());
            case FIELD_DETAIL_LEVEL:
                return Optional.of(detailLevel);
            default:
                break;
        }
        Object value = mutableState.get(name);
        if (value == null) {
            value = immutableMetadata.get(name);
        }
        return Optional.ofNullable(value);
    }

    /**
     * String form of {@link #value(String)}; enums by name, everything else through
     * {@link String#valueOf(Object)}.
     */
    public Optional<String> field(String name) {
        return value(name).map(StateRecord::coerce);
    }

    public boolean isDetailed() {
        return detailLevel == DetailLevel.DETAIL;
    }

    /**
     * Copy restricted to the summary fields of this kind. Summary records are returned as is.
     */
    public StateRecord toSummary() {
        if (detailLevel == DetailLevel.SUMMARY) {
            return this;
        }
        Set<String> keep = summaryFields();
        return rebuild(retain(immutableMetadata, keep), retain(mutableState, keep), DetailLevel.SUMMARY);
    }

    /**
     * Copy with the given state entries merged over the current mutable state. Identity and
     * immutable metadata are carried over untouched.
     */
    public StateRecord withState(Map<String, ?> changes) {
        Map<String, Object> merged = new LinkedHashMap<>(mutableState);
        merged.putAll(changes);
        return rebuild(immutableMetadata, merged, detailLevel);
    }

    StateRecord withoutField(String name) {
        Map<String, Object> metadata = new LinkedHashMap<>(immutableMetadata);
        Map<String, Object> state = new LinkedHashMap<>(mutableState);
        metadata.remove(name);
        state.remove(name);
        return rebuild(metadata, state, detailLevel);
    }

    static String coerce(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(value);
    }

    private static Map<String, Object> retain(Map<String, Object> source, Set<String> keep) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (keep.contains(key)) {
                result.put(key, value);
            }
        });
        return result;
    }

    private static Map<String, Object> copyOf(Map<String, ?> source, String name) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            Objects.requireNonNull(key, name + " key");
            if (value != null && !(value instanceof Serializable)) {
                throw new IllegalArgumentException(name + "." + key + " is not serializable: "
                        + value.getClass().getName());
            }
            copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateRecord other)) return false;
        return kind() == other.kind()
                && id.equals(other.id)
                && detailLevel == other.detailLevel
                && immutableMetadata.equals(other.immutableMetadata)
                && mutableState.equals(other.mutableState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), id, detailLevel, immutableMetadata, mutableState);
    }

    @Override
    public String toString() {
        return kind() + "[" + id + ", " + detailLevel + "] state=" + mutableState + " metadata=" + immutableMetadata;
    }
}
