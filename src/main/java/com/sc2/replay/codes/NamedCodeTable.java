package com.sc2.replay.codes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.sc2.replay.exception.UnknownCodeException;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Immutable mapping from the short codes stored in attribute values (for example "Terr")
 * to their display labels (for example "Terran").
 */
@Getter
@ToString(of = "name")
public final class NamedCodeTable {

    private final String name;
    private final Map<String, String> entries;

    public NamedCodeTable(@NonNull String name, @NonNull Map<String, String> entries) {
        this.name = name;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Optional<String> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Resolve a short code to its label.
     *
     * @throws UnknownCodeException when the table has no entry for {@code key}
     */
    public String resolve(String key) {
        String label = entries.get(key);
        if (label == null) {
            throw new UnknownCodeException(name, key);
        }
        return label;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }
}
