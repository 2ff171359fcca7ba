package com.lending.scope.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One reported lending event as stored in the analytical backend. Never mutated by the engine.
 */
@Value
@Builder
public class TransactionRecord {

    String lenderId;
    /** Raw five-digit county code, before boundary normalization. */
    String geoCode;
    /** Eleven-digit census tract GEOID (may be null or unpadded). */
    String censusTract;
    int activityYear;
    String actionTaken;
    String occupancyType;
    String totalUnits;
    String constructionMethod;
    String loanType;
    String loanPurpose;
    String reverseMortgage;
    BigDecimal loanAmount;
}
