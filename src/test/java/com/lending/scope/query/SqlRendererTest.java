package com.lending.scope.query;

import com.lending.scope.boundary.BoundaryRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SqlRenderer: joins, named parameters and normalized geo code expression.
 */
class SqlRendererTest {

    private SqlRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new SqlRenderer(TableNames.defaults(), new BoundaryRule("09", "091", 2024, 6));
    }

    @Test
    void valuesAreBoundAsNamedParameters() {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = renderer.renderCondition(Condition.and(
                Condition.eq(Column.LENDER_ID, "X'; DROP TABLE t; --"),
                Condition.in(Column.ACTIVITY_YEAR, List.of(2022, 2023))), params);

        assertThat(sql).isEqualTo("(t.lender_id = :p0 AND t.activity_year IN (:p1))");
        assertThat(params.getValue("p0")).isEqualTo("X'; DROP TABLE t; --");
        assertThat(params.getValue("p1")).isEqualTo(List.of(2022, 2023));
    }

    @Test
    void emptyInListsRenderAsConstants() {
        MapSqlParameterSource params = new MapSqlParameterSource();

        assertThat(renderer.renderCondition(Condition.notIn(Column.LOAN_TYPE, List.of()), params)).isEqualTo("1=1");
        assertThat(renderer.renderCondition(Condition.in(Column.LOAN_TYPE, List.of()), params)).isEqualTo("1=0");
    }

    @Test
    void geoGroupingJoinsCrosswalkAndUsesNormalizedExpression() {
        RenderedQuery query = renderer.render(AggregationQuery.builder()
                .groupKey(GroupKey.GEO_CODE)
                .where(Condition.eq(Column.LENDER_ID, "L1"))
                .build());

        assertThat(query.sql()).contains("LEFT JOIN boundary_crosswalk cw ON");
        assertThat(query.sql()).contains("RIGHT(LPAD(t.census_tract, 11, '0'), 6)");
        assertThat(query.sql()).contains("GROUP BY COALESCE(cw.canonical_geo_code, t.geo_code)");
        assertThat(query.sql()).doesNotContain("geography_reference");
        assertThat(query.parameters().getValues()).containsValues("09%", "091%", 2024, "L1");
    }

    @Test
    void metroGroupingJoinsGeographyOnNormalizedCode() {
        RenderedQuery query = renderer.render(AggregationQuery.builder()
                .groupKey(GroupKey.METRO_CODE)
                .build());

        assertThat(query.sql()).contains("LEFT JOIN geography_reference g ON g.geo_code = COALESCE(cw.canonical_geo_code, t.geo_code)");
        assertThat(query.sql()).contains("g.metro_code AS metro_code");
        assertThat(query.sql()).endsWith("WHERE 1=1\nGROUP BY g.metro_code");
    }

    @Test
    void lenderQueryWithoutGeoSkipsAllJoins() {
        RenderedQuery query = renderer.render(AggregationQuery.builder()
                .groupKey(GroupKey.LENDER_ID)
                .where(Condition.eq(Column.LOAN_TYPE, "1"))
                .build());

        assertThat(query.sql()).doesNotContain("JOIN");
        assertThat(query.sql()).startsWith("SELECT t.lender_id AS lender_id, COALESCE(SUM(t.loan_amount), 0) AS total_amount");
    }

    @Test
    void categoryGroupingJoinsLenders() {
        RenderedQuery query = renderer.render(AggregationQuery.builder()
                .groupKey(GroupKey.LENDER_ID)
                .groupKey(GroupKey.LENDER_CATEGORY)
                .build());

        assertThat(query.sql()).contains("LEFT JOIN lenders l ON l.lender_id = t.lender_id");
        assertThat(query.sql()).contains("l.type_name AS lender_category");
    }

    @Test
    void expandedLengthCountsCollectionPlaceholders() {
        RenderedQuery query = renderer.render(AggregationQuery.builder()
                .where(Condition.in(Column.LENDER_ID, List.of("a", "b", "c", "d")))
                .build());

        assertThat(query.expandedLength()).isEqualTo(query.sql().length() + 12);
    }
}
