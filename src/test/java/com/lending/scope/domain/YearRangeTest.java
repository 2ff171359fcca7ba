package com.lending.scope.domain;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YearRangeTest {

    @Test
    void sortsAndDeduplicates() {
        YearRange range = YearRange.of(List.of(2024, 2022, 2023, 2022), 5);

        assertThat(range.getYears()).containsExactly(2022, 2023, 2024);
        assertThat(range.label()).isEqualTo("2022-2024");
    }

    @Test
    void singleYearLabel() {
        assertThat(YearRange.of(List.of(2023), 5).label()).isEqualTo("2023");
    }

    @Test
    void rejectsEmptyOutOfRangeAndTooMany() {
        assertThatThrownBy(() -> YearRange.of(List.of(), 5))
                .isInstanceOf(InvalidAnalysisRequestException.class);
        assertThatThrownBy(() -> YearRange.of(List.of(1999), 5))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("1999");
        assertThatThrownBy(() -> YearRange.of(Arrays.asList(2022, null), 5))
                .isInstanceOf(InvalidAnalysisRequestException.class);
        assertThatThrownBy(() -> YearRange.between(2018, 2024, 5))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("Maximum 5");
    }
}
