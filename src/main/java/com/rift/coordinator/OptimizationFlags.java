package com.rift.coordinator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pass enablement flags keyed by pass name. Absent names are disabled.
 */
public final class OptimizationFlags {

    private final Map<String, Boolean> flags;

    public OptimizationFlags(Map<String, Boolean> flags) {
        this.flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public static OptimizationFlags none() {
        return new OptimizationFlags(Map.of());
    }

    public static OptimizationFlags enabling(String... passNames) {
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (String name : passNames) {
            map.put(name, true);
        }
        return new OptimizationFlags(map);
    }

    public boolean isEnabled(String passName) {
        return Boolean.TRUE.equals(flags.get(passName));
    }

    public Map<String, Boolean> asMap() {
        return flags;
    }

    @Override
    public String toString() {
        return "OptimizationFlags" + flags;
    }
}
