package com.cad.dxfcleaner.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Explicit allow-list of entity kinds kept by the cleaner. Kinds are never
 * inferred from the input.
 */
@ToString
@EqualsAndHashCode
public final class EntityWhitelist {

    public static final Set<String> DEFAULT_KINDS = Set.of("LINE", "CIRCLE", "ARC");

    private final Set<String> kinds;

    private EntityWhitelist(Set<String> kinds) {
        this.kinds = kinds;
    }

    public static EntityWhitelist defaults() {
        return of(DEFAULT_KINDS);
    }

    public static EntityWhitelist of(Collection<String> kinds) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String kind : kinds) {
            if (kind != null && !kind.isBlank()) {
                normalized.add(kind.trim().toUpperCase(Locale.ROOT));
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Entity whitelist must name at least one entity kind");
        }
        return new EntityWhitelist(Set.copyOf(normalized));
    }

    public boolean allows(String kind) {
        return kinds.contains(kind);
    }

    public Set<String> getKinds() {
        return kinds;
    }
}
