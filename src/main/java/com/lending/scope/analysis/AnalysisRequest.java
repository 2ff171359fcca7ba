package com.lending.scope.analysis;

import com.lending.scope.domain.ComparisonGroup;
import com.lending.scope.domain.ScopeSpecification;
import com.lending.scope.filter.LoanFilterOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Input for a lender analysis.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisRequest {

    @NotBlank(message = "lenderId is required")
    String lenderId;

    @NotNull(message = "scope is required")
    @Valid
    ScopeSpecification scope;

    @NotEmpty(message = "years is required")
    @Singular
    List<Integer> years;

    /** Null means all defaults. */
    LoanFilterOptions filters;

    @Builder.Default
    ComparisonGroup comparisonGroup = ComparisonGroup.PEERS;
}
