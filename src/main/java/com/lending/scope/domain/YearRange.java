package com.lending.scope.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Validated, sorted, de-duplicated set of activity years.
 */
public final class YearRange {

    public static final int MIN_YEAR = 2000;
    public static final int MAX_YEAR = 2030;

    private final List<Integer> years;

    private YearRange(List<Integer> years) {
        this.years = years;
    }

    public static YearRange of(Collection<Integer> years, int maxYears) {
        if (years == null || years.isEmpty()) {
            throw new InvalidAnalysisRequestException("Years list cannot be empty");
        }
        TreeSet<Integer> normalized = new TreeSet<>();
        for (Integer year : years) {
            if (year == null) {
                throw new InvalidAnalysisRequestException("Years list cannot contain null");
            }
            if (year < MIN_YEAR || year > MAX_YEAR) {
                throw new InvalidAnalysisRequestException(
                        "Invalid year: " + year + ". Years must be between " + MIN_YEAR + " and " + MAX_YEAR + ".");
            }
            normalized.add(year);
        }
        if (normalized.size() > maxYears) {
            throw new InvalidAnalysisRequestException(
                    "Maximum " + maxYears + " years allowed. Received " + normalized.size() + " years.");
        }
        return new YearRange(List.copyOf(normalized));
    }

    public static YearRange between(int firstYear, int lastYear, int maxYears) {
        List<Integer> years = new ArrayList<>();
        for (int y = firstYear; y <= lastYear; y++) {
            years.add(y);
        }
        return of(years, maxYears);
    }

    public List<Integer> getYears() {
        return years;
    }

    public int first() {
        return years.get(0);
    }

    public int last() {
        return years.get(years.size() - 1);
    }

    /** "2022-2024" or "2024". */
    public String label() {
        return years.size() > 1 ? first() + "-" + last() : String.valueOf(first());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YearRange)) return false;
        return years.equals(((YearRange) o).years);
    }

    @Override
    public int hashCode() {
        return years.hashCode();
    }

    @Override
    public String toString() {
        return "YearRange" + years;
    }
}
