package com.lending.scope.filter;

import com.lending.scope.query.Column;
import com.lending.scope.query.Condition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FilterSpecificationTranslator: business options to column predicates.
 */
class FilterSpecificationTranslatorTest {

    private FilterSpecificationTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new FilterSpecificationTranslator();
    }

    @Test
    void defaultsResolveToCompletedPrimarySiteBuiltOneToFourUnits() {
        FilterPredicateSet set = translator.translate(null);

        assertThat(set.get(FilterOption.DISPOSITION)).isEqualTo(Condition.eq(Column.ACTION_TAKEN, "1"));
        assertThat(set.get(FilterOption.OCCUPANCY)).isEqualTo(Condition.eq(Column.OCCUPANCY_TYPE, "1"));
        assertThat(set.get(FilterOption.FINANCING_METHOD)).isEqualTo(Condition.eq(Column.CONSTRUCTION_METHOD, "1"));
        assertThat(set.get(FilterOption.PROPERTY_TYPE))
                .isEqualTo(Condition.in(Column.TOTAL_UNITS, List.of("1", "2", "3", "4")));
        assertThat(set.get(FilterOption.LOAN_CATEGORY))
                .isEqualTo(Condition.in(Column.LOAN_TYPE, List.of("1", "2", "3", "4")));
        assertThat(set.getPredicates()).doesNotContainKey(FilterOption.LOAN_PURPOSE);
        assertThat(set.get(FilterOption.RESCISSION)).isEqualTo(Condition.or(
                Condition.isNull(Column.REVERSE_MORTGAGE),
                Condition.notEq(Column.REVERSE_MORTGAGE, "1")));
    }

    @Test
    void allStagesBecomesInListOfEveryAction() {
        FilterPredicateSet set = translator.translate(LoanFilterOptions.builder().disposition("all-stages").build());

        assertThat(set.get(FilterOption.DISPOSITION))
                .isEqualTo(Condition.in(Column.ACTION_TAKEN, List.of("1", "2", "3", "4", "5")));
    }

    @Test
    void fivePlusUnitsBecomesNegatedInList() {
        FilterPredicateSet set = translator.translate(LoanFilterOptions.builder().propertyType(List.of("5+ unit")).build());

        assertThat(set.get(FilterOption.PROPERTY_TYPE)).isEqualTo(Condition.and(
                Condition.isNotNull(Column.TOTAL_UNITS),
                Condition.notIn(Column.TOTAL_UNITS, List.of("1", "2", "3", "4"))));
    }

    @Test
    void bothPropertyTypesAreAlternatives() {
        FilterPredicateSet set = translator.translate(LoanFilterOptions.builder()
                .propertyType(List.of("1-4 unit", "5+ unit"))
                .build());

        Condition condition = set.get(FilterOption.PROPERTY_TYPE);
        assertThat(condition).isInstanceOf(Condition.Junction.class);
        assertThat(((Condition.Junction) condition).conjunction()).isFalse();
        assertThat(((Condition.Junction) condition).children()).hasSize(2);
    }

    @Test
    void occupancySubsetMapsEachValueAndDeduplicates() {
        FilterPredicateSet set = translator.translate(LoanFilterOptions.builder()
                .occupancy(List.of("Primary", "investment", "primary"))
                .build());

        assertThat(set.get(FilterOption.OCCUPANCY)).isEqualTo(Condition.in(Column.OCCUPANCY_TYPE, List.of("1", "3")));
    }

    @Test
    void loanCategoryAndPurposeMapToCodes() {
        FilterPredicateSet set = translator.translate(LoanFilterOptions.builder()
                .loanCategory(List.of("fha", "va"))
                .loanPurpose(List.of("refinance"))
                .build());

        assertThat(set.get(FilterOption.LOAN_CATEGORY)).isEqualTo(Condition.in(Column.LOAN_TYPE, List.of("2", "3")));
        assertThat(set.get(FilterOption.LOAN_PURPOSE)).isEqualTo(Condition.in(Column.LOAN_PURPOSE, List.of("31", "32")));
    }

    @Test
    void unrecognizedValuesPassThroughAsLiterals() {
        FilterPredicateSet set = translator.translate(LoanFilterOptions.builder()
                .disposition(" 6 ")
                .financingMethod(List.of("floating"))
                .build());

        assertThat(set.get(FilterOption.DISPOSITION)).isEqualTo(Condition.eq(Column.ACTION_TAKEN, "6"));
        assertThat(set.get(FilterOption.FINANCING_METHOD)).isEqualTo(Condition.eq(Column.CONSTRUCTION_METHOD, "floating"));
    }

    @Test
    void rescissionPredicateOmittedWhenNotExcluded() {
        FilterPredicateSet set = translator.translate(LoanFilterOptions.builder().excludeRescissionEligible(false).build());

        assertThat(set.getPredicates()).doesNotContainKey(FilterOption.RESCISSION);
        assertThat(set.toCondition().columns()).doesNotContain(Column.REVERSE_MORTGAGE);
    }
}
