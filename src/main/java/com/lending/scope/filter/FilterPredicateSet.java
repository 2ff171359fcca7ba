package com.lending.scope.filter;

import com.lending.scope.query.Condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized filter predicates, one per option, reused unchanged by every downstream query.
 */
public final class FilterPredicateSet {

    private final Map<FilterOption, Condition> predicates;

    FilterPredicateSet(Map<FilterOption, Condition> predicates) {
        this.predicates = Collections.unmodifiableMap(new EnumMap<>(predicates));
    }

    public static FilterPredicateSet none() {
        return new FilterPredicateSet(new EnumMap<>(FilterOption.class));
    }

    public Map<FilterOption, Condition> getPredicates() {
        return predicates;
    }

    public Condition get(FilterOption option) {
        return predicates.getOrDefault(option, Condition.alwaysTrue());
    }

    /** Conjunction of all option predicates. */
    public Condition toCondition() {
        List<Condition> parts = new ArrayList<>(predicates.values());
        return Condition.and(parts);
    }

    @Override
    public String toString() {
        return "FilterPredicateSet" + predicates;
    }
}
