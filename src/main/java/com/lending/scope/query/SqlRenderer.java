package com.lending.scope.query;

import com.lending.scope.boundary.BoundaryRule;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@link AggregationQuery} and {@link Condition} trees into SQL. This is the only place SQL text
 * is assembled: values always travel as named parameters, identifiers come from {@link Column},
 * {@link GroupKey} and validated {@link TableNames}.
 * <p>
 * Every query that touches the geo code joins the boundary crosswalk, so the normalized code is the
 * same expression everywhere.
 */
@Component
public class SqlRenderer {

    static final String NORMALIZED_GEO_CODE = "COALESCE(cw.canonical_geo_code, t.geo_code)";

    private final TableNames tables;
    private final BoundaryRule boundaryRule;

    public SqlRenderer(TableNames tables, BoundaryRule boundaryRule) {
        this.tables = tables;
        this.boundaryRule = boundaryRule;
    }

    public RenderedQuery render(AggregationQuery query) {
        Params params = new Params();
        List<String> keyExpressions = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");
        for (GroupKey key : query.getGroupKeys()) {
            String expression = expression(key.column());
            keyExpressions.add(expression);
            sql.append(expression).append(" AS ").append(key.alias()).append(", ");
        }
        sql.append("COALESCE(SUM(t.loan_amount), 0) AS total_amount, COUNT(*) AS total_count");
        appendFromAndWhere(sql, query.referencedColumns(), query.getWhere(), params);
        if (!keyExpressions.isEmpty()) {
            sql.append("\nGROUP BY ").append(String.join(", ", keyExpressions));
        }
        return new RenderedQuery(sql.toString(), params.source);
    }

    /** Record count and number of distinct normalized geo codes matching a condition. */
    public RenderedQuery renderAvailability(Condition where) {
        Params params = new Params();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) AS total_count, COUNT(DISTINCT ")
                .append(NORMALIZED_GEO_CODE).append(") AS geo_count");
        List<Column> columns = new ArrayList<>(where.columns());
        columns.add(Column.GEO_CODE);
        appendFromAndWhere(sql, columns, where, params);
        return new RenderedQuery(sql.toString(), params.source);
    }

    /** Renders a single condition against the transaction alias {@code t}; exposed for tests. */
    String renderCondition(Condition condition, MapSqlParameterSource into) {
        Params params = new Params(into);
        return condition(condition, params);
    }

    private void appendFromAndWhere(StringBuilder sql, List<Column> columns, Condition where, Params params) {
        boolean crosswalk = columns.stream().anyMatch(Column::needsCrosswalkJoin);
        boolean geography = columns.stream().anyMatch(Column::needsGeographyJoin);
        boolean lenders = columns.stream().anyMatch(Column::needsLenderJoin);

        sql.append("\nFROM ").append(tables.transactions()).append(" t");
        if (crosswalk) {
            sql.append("\nLEFT JOIN ").append(tables.boundaryCrosswalk()).append(" cw ON ")
                    .append(crosswalkJoin(params));
        }
        if (geography) {
            sql.append("\nLEFT JOIN ").append(tables.geographyReference()).append(" g ON g.geo_code = ")
                    .append(NORMALIZED_GEO_CODE);
        }
        if (lenders) {
            sql.append("\nLEFT JOIN ").append(tables.lenders()).append(" l ON l.lender_id = t.lender_id");
        }
        sql.append("\nWHERE ").append(condition(where, params));
    }

    private String crosswalkJoin(Params params) {
        return "t.geo_code LIKE " + params.bind(boundaryRule.jurisdictionPrefix() + "%")
                + " AND t.geo_code NOT LIKE " + params.bind(boundaryRule.canonicalPrefix() + "%")
                + " AND t.activity_year < " + params.bind(boundaryRule.cutoverYear())
                + " AND cw.tract_suffix = RIGHT(LPAD(t.census_tract, " + BoundaryRule.TRACT_GEOID_LENGTH + ", '0'), "
                + boundaryRule.tractSuffixLength() + ")";
    }

    private String expression(Column column) {
        return column == Column.GEO_CODE ? NORMALIZED_GEO_CODE : column.qualifiedName();
    }

    private String condition(Condition condition, Params params) {
        if (condition instanceof Condition.Comparison) {
            Condition.Comparison c = (Condition.Comparison) condition;
            return expression(c.column()) + " " + c.operator().symbol() + " " + params.bind(c.value());
        }
        if (condition instanceof Condition.InList) {
            Condition.InList c = (Condition.InList) condition;
            if (c.values().isEmpty()) {
                return c.negated() ? "1=1" : "1=0";
            }
            return expression(c.column()) + (c.negated() ? " NOT IN (" : " IN (") + params.bind(c.values()) + ")";
        }
        if (condition instanceof Condition.NullCheck) {
            Condition.NullCheck c = (Condition.NullCheck) condition;
            return expression(c.column()) + (c.negated() ? " IS NOT NULL" : " IS NULL");
        }
        if (condition instanceof Condition.Junction) {
            Condition.Junction j = (Condition.Junction) condition;
            List<String> parts = new ArrayList<>();
            for (Condition child : j.children()) {
                parts.add(condition(child, params));
            }
            return "(" + String.join(j.conjunction() ? " AND " : " OR ", parts) + ")";
        }
        if (condition instanceof Condition.AlwaysTrue) {
            return "1=1";
        }
        throw new IllegalArgumentException("Unsupported condition type: " + condition.getClass().getName());
    }

    private static final class Params {
        private final MapSqlParameterSource source;
        private int next;

        Params() {
            this(new MapSqlParameterSource());
        }

        Params(MapSqlParameterSource source) {
            this.source = source;
            this.next = source.getParameterNames().length;
        }

        String bind(Object value) {
            String name = "p" + next++;
            source.addValue(name, value);
            return ":" + name;
        }
    }
}
