package com.datalake.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied source identifier: {@code file:NAME}, {@code table:NAME} or a bare {@code NAME}.
 * A bare name carries no kind and is resolved by the catalog.
 */
public final class SourceRef {

    private final SourceKind kind;
    private final String name;

    private SourceRef(SourceKind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    /**
     * Parse an identifier. Returns empty for blank input or an unknown kind prefix.
     */
    public static Optional<SourceRef> parse(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String trimmed = identifier.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            return Optional.of(new SourceRef(null, trimmed));
        }
        String prefix = trimmed.substring(0, colon);
        String name = trimmed.substring(colon + 1).trim();
        if (name.isEmpty()) {
            return Optional.empty();
        }
        for (SourceKind candidate : SourceKind.values()) {
            if (candidate.getValue().equalsIgnoreCase(prefix)) {
                return Optional.of(new SourceRef(candidate, name));
            }
        }
        return Optional.empty();
    }

    public static SourceRef of(SourceKind kind, String name) {
        return new SourceRef(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(name, "name"));
    }

    public Optional<SourceKind> getKind() {
        return Optional.ofNullable(kind);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRef)) return false;
        SourceRef that = (SourceRef) o;
        return kind == that.kind && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return kind == null ? name : kind.getValue() + ":" + name;
    }
}
