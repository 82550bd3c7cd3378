package io.proofcheck.p2;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metavariable assignments produced by one successful {@link PatternMatcher#match} call.
 */
public final class Bindings {
    private final Map<Character, Formula> map;

    Bindings() {
        this.map = new TreeMap<>();
    }

    private Bindings(Map<Character, Formula> map) {
        this.map = map;
    }

    public Formula get(char metavariable) {
        return map.get(metavariable);
    }

    public boolean isBound(char metavariable) {
        return map.containsKey(metavariable);
    }

    public int size() {
        return map.size();
    }

    public Map<Character, Formula> asMap() {
        return Collections.unmodifiableMap(map);
    }

    void put(char metavariable, Formula value) {
        map.put(metavariable, value);
    }

    Bindings freeze() {
        return new Bindings(Collections.unmodifiableMap(new TreeMap<>(map)));
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
