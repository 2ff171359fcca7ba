package com.lending.scope.filter;

import com.lending.scope.query.Column;
import com.lending.scope.query.Condition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves {@link LoanFilterOptions} into backend column predicates. Defaults: completed dispositions,
 * primary occupancy, 1-4 units, site-built, every loan category, every loan purpose and reverse
 * mortgages excluded. Never throws; an unrecognized value is used as a literal code, so a caller
 * mistake shows up as zero matching rows.
 */
@Slf4j
@Component
public class FilterSpecificationTranslator {

    static final List<String> ONE_TO_FOUR_UNITS = List.of("1", "2", "3", "4");
    static final List<String> ALL_LOAN_TYPES = List.of("1", "2", "3", "4");
    static final List<String> ALL_ACTIONS = List.of("1", "2", "3", "4", "5");
    private static final String REVERSE_MORTGAGE_FLAG = "1";
    private static final String FIVE_PLUS = "5+ unit";

    private static final Map<String, List<String>> DISPOSITION_CODES = Map.of(
            "completed", List.of("1"),
            "origination", List.of("1"),
            "all-stages", ALL_ACTIONS,
            "application", ALL_ACTIONS);

    private static final Map<String, String> OCCUPANCY_CODES = Map.of(
            "primary", "1",
            "owner-occupied", "1",
            "second-home", "2",
            "investment", "3",
            "investor", "3");

    private static final Map<String, String> PROPERTY_TYPES = Map.of(
            "1-4 unit", "1-4 unit",
            "1-4", "1-4 unit",
            "5+ unit", FIVE_PLUS,
            "5+", FIVE_PLUS);

    private static final Map<String, String> FINANCING_CODES = Map.of(
            "site-built", "1",
            "manufactured", "2");

    private static final Map<String, String> LOAN_TYPE_CODES = Map.of(
            "conventional", "1",
            "fha", "2",
            "va", "3",
            "rhs", "4");

    private static final Map<String, List<String>> LOAN_PURPOSE_CODES = Map.of(
            "purchase", List.of("1"),
            "home-purchase", List.of("1"),
            "refinance", List.of("31", "32"),
            "home-equity", List.of("2", "4"),
            "equity", List.of("2", "4"));

    public FilterPredicateSet translate(LoanFilterOptions options) {
        LoanFilterOptions o = options != null ? options : LoanFilterOptions.defaults();
        Map<FilterOption, Condition> predicates = new EnumMap<>(FilterOption.class);

        predicates.put(FilterOption.DISPOSITION, Condition.in(Column.ACTION_TAKEN, disposition(o.getDisposition())));
        predicates.put(FilterOption.OCCUPANCY, Condition.in(Column.OCCUPANCY_TYPE,
                codes(o.getOccupancy(), OCCUPANCY_CODES, List.of("1"))));
        predicates.put(FilterOption.PROPERTY_TYPE, propertyType(o.getPropertyType()));
        predicates.put(FilterOption.FINANCING_METHOD, Condition.in(Column.CONSTRUCTION_METHOD,
                codes(o.getFinancingMethod(), FINANCING_CODES, List.of("1"))));
        predicates.put(FilterOption.LOAN_CATEGORY, Condition.in(Column.LOAN_TYPE,
                codes(o.getLoanCategory(), LOAN_TYPE_CODES, ALL_LOAN_TYPES)));
        Condition purpose = loanPurpose(o.getLoanPurpose());
        if (purpose != null) {
            predicates.put(FilterOption.LOAN_PURPOSE, purpose);
        }
        if (o.getExcludeRescissionEligible() == null || o.getExcludeRescissionEligible()) {
            predicates.put(FilterOption.RESCISSION, Condition.or(
                    Condition.isNull(Column.REVERSE_MORTGAGE),
                    Condition.notEq(Column.REVERSE_MORTGAGE, REVERSE_MORTGAGE_FLAG)));
        }

        FilterPredicateSet set = new FilterPredicateSet(predicates);
        log.debug("Translated filters {} -> {}", o, set);
        return set;
    }

    private static List<String> disposition(String value) {
        if (isBlank(value)) {
            return DISPOSITION_CODES.get("completed");
        }
        List<String> codes = DISPOSITION_CODES.get(key(value));
        return codes != null ? codes : List.of(value.trim());
    }

    private static Condition propertyType(List<String> values) {
        List<String> types = codes(values, PROPERTY_TYPES, List.of("1-4 unit"));
        List<Condition> alternatives = new ArrayList<>();
        List<String> literals = new ArrayList<>();
        for (String type : types) {
            if ("1-4 unit".equals(type)) {
                alternatives.add(Condition.in(Column.TOTAL_UNITS, ONE_TO_FOUR_UNITS));
            } else if (FIVE_PLUS.equals(type)) {
                alternatives.add(Condition.and(
                        Condition.isNotNull(Column.TOTAL_UNITS),
                        Condition.notIn(Column.TOTAL_UNITS, ONE_TO_FOUR_UNITS)));
            } else {
                literals.add(type);
            }
        }
        if (!literals.isEmpty()) {
            alternatives.add(Condition.in(Column.TOTAL_UNITS, literals));
        }
        return alternatives.size() == 1 ? alternatives.get(0) : Condition.or(alternatives.toArray(new Condition[0]));
    }

    private static Condition loanPurpose(List<String> values) {
        if (values == null || values.stream().allMatch(FilterSpecificationTranslator::isBlank)) {
            return null;
        }
        Set<String> codes = new LinkedHashSet<>();
        for (String value : values) {
            if (isBlank(value)) {
                continue;
            }
            List<String> mapped = LOAN_PURPOSE_CODES.get(key(value));
            if (mapped != null) {
                codes.addAll(mapped);
            } else {
                codes.add(value.trim());
            }
        }
        return Condition.in(Column.LOAN_PURPOSE, new ArrayList<>(codes));
    }

    /**
     * Maps each value through the lookup, passing unknown values through, de-duplicated in input order.
     * Null or all-blank input yields the defaults.
     */
    private static List<String> codes(List<String> values, Map<String, String> lookup, List<String> defaults) {
        if (values == null || values.stream().allMatch(FilterSpecificationTranslator::isBlank)) {
            return defaults;
        }
        Set<String> codes = new LinkedHashSet<>();
        for (String value : values) {
            if (isBlank(value)) {
                continue;
            }
            codes.add(lookup.getOrDefault(key(value), value.trim()));
        }
        return new ArrayList<>(codes);
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
