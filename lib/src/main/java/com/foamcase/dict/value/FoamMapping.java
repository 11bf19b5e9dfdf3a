package com.foamcase.dict.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keyed entries in insertion order. Replacing the value of an existing key keeps the key where it was,
 * so a document edited in place builds back with its original entry order.
 */
public sealed abstract class FoamMapping extends FoamValue permits FoamDict, FoamDictTuple {
    private final LinkedHashMap<String, FoamValue> entries = new LinkedHashMap<>();

    FoamMapping() {}

    FoamMapping(Map<String, ? extends FoamValue> initial) {
        for (Map.Entry<String, ? extends FoamValue> entry : initial.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    public FoamValue get(String key) {
        return entries.get(key);
    }

    /** Returns the entry as a nested {@code {...}} dictionary, or null when absent or shaped differently. */
    public FoamDict getDict(String key) {
        FoamValue value = entries.get(key);
        return value instanceof FoamDict dict ? dict : null;
    }

    /** Returns the text of a string entry, or null when absent or not a string. */
    public String getString(String key) {
        FoamValue value = entries.get(key);
        return value instanceof FoamString string ? string.getValue() : null;
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public FoamValue put(String key, FoamValue value) {
        return entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    /**
     * Inserts only when the key is new.
     *
     * @return the value already stored under {@code key}, or null if the entry was inserted
     */
    public FoamValue putIfAbsent(String key, FoamValue value) {
        return entries.putIfAbsent(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    public FoamValue remove(String key) {
        return entries.remove(key);
    }

    public List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    public Set<Map.Entry<String, FoamValue>> entries() {
        return Collections.unmodifiableSet(entries.entrySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return new ArrayList<>(entries.entrySet())
                .equals(new ArrayList<>(((FoamMapping) obj).entries.entrySet()));
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + entries.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName().substring("Foam".length()) + entries;
    }
}
