package com.rift.parser;

import com.rift.exception.ConfigurationException;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Operator sets for the two binary precedence tiers of the grammar.
 *
 * @param additive       Operators combined at expression level (lower precedence)
 * @param multiplicative Operators combined at term level (higher precedence)
 */
public record OperatorTiers(Set<String> additive, Set<String> multiplicative) {

    public OperatorTiers {
        additive = Set.copyOf(additive);
        multiplicative = Set.copyOf(multiplicative);
    }

    /**
     * Standard arithmetic tiers: + - below * /.
     */
    public static OperatorTiers arithmetic() {
        return new OperatorTiers(Set.of("+", "-"), Set.of("*", "/"));
    }

    /**
     * Derive tiers from a precedence table (operator symbol to level).
     * The table must define exactly two distinct levels.
     *
     * @throws ConfigurationException if the table is empty or does not have two levels
     */
    public static OperatorTiers fromPrecedenceTable(Map<String, Integer> table) {
        if (table == null || table.isEmpty()) {
            throw new ConfigurationException("Precedence table is empty");
        }
        TreeSet<Integer> levels = new TreeSet<>(table.values());
        if (levels.size() != 2) {
            throw new ConfigurationException("Precedence table must define exactly 2 levels, found "
                    + levels.size() + ": " + table);
        }
        int high = levels.last();
        Set<String> multiplicative = table.entrySet().stream()
                .filter(e -> e.getValue() == high)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
        Set<String> additive = table.entrySet().stream()
                .filter(e -> e.getValue() != high)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
        return new OperatorTiers(additive, multiplicative);
    }
}
