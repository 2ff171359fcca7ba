package com.lending.scope.backend;

import com.lending.scope.domain.BoundaryCrosswalkEntry;
import com.lending.scope.query.AggregateRow;
import com.lending.scope.query.GroupKey;
import com.lending.scope.query.RenderedQuery;
import com.lending.scope.query.TableNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AnalyticalBackend} over JDBC. Aggregation SQL comes pre-rendered; the few reference lookups
 * issued here only splice in validated table names.
 */
@Slf4j
@Repository
public class JdbcAnalyticalBackend implements AnalyticalBackend {

    private final NamedParameterJdbcTemplate jdbc;
    private final TableNames tables;

    public JdbcAnalyticalBackend(NamedParameterJdbcTemplate jdbc, TableNames tables) {
        this.jdbc = jdbc;
        this.tables = tables;
    }

    @Override
    public List<AggregateRow> aggregate(RenderedQuery query, List<GroupKey> groupKeys) {
        log.debug("Running aggregation: keys={} sqlLength={}", groupKeys, query.sql().length());
        return jdbc.query(query.sql(), query.parameters(), (rs, rowNum) -> {
            Map<GroupKey, Object> keys = new EnumMap<>(GroupKey.class);
            for (GroupKey key : groupKeys) {
                if (key == GroupKey.YEAR) {
                    int year = rs.getInt(key.alias());
                    keys.put(key, rs.wasNull() ? null : year);
                } else {
                    keys.put(key, rs.getString(key.alias()));
                }
            }
            BigDecimal amount = rs.getBigDecimal("total_amount");
            return new AggregateRow(keys, amount, rs.getLong("total_count"));
        });
    }

    @Override
    public AvailabilityCounts availability(RenderedQuery query) {
        List<AvailabilityCounts> rows = jdbc.query(query.sql(), query.parameters(),
                (rs, rowNum) -> new AvailabilityCounts(rs.getLong("total_count"), rs.getLong("geo_count")));
        return rows.isEmpty() ? AvailabilityCounts.EMPTY : rows.get(0);
    }

    @Override
    public List<MetroMembership> loadMetroMembership() {
        String sql = "SELECT geo_code, metro_code, metro_name FROM " + tables.geographyReference()
                + " WHERE metro_code IS NOT NULL";
        List<MetroMembership> rows = jdbc.query(sql, new MapSqlParameterSource(), (rs, rowNum) ->
                new MetroMembership(rs.getString("geo_code"), rs.getString("metro_code"), rs.getString("metro_name")));
        log.info("Loaded geography reference: {} metro memberships", rows.size());
        return rows;
    }

    @Override
    public Optional<Integer> latestBranchReportYear(String lenderId) {
        String sql = "SELECT MAX(report_year) FROM " + tables.branchLocations() + " WHERE lender_id = :lenderId";
        Integer year = jdbc.queryForObject(sql, new MapSqlParameterSource("lenderId", lenderId), Integer.class);
        return Optional.ofNullable(year);
    }

    @Override
    public BranchPresence branchPresence(String lenderId, int reportYear) {
        String sql = "SELECT g.metro_code AS metro_code, COUNT(*) AS branch_count"
                + " FROM " + tables.branchLocations() + " b"
                + " LEFT JOIN " + tables.geographyReference() + " g ON g.geo_code = b.geo_code"
                + " WHERE b.lender_id = :lenderId AND b.report_year = :reportYear"
                + " GROUP BY g.metro_code";
        MapSqlParameterSource params = new MapSqlParameterSource("lenderId", lenderId)
                .addValue("reportYear", reportYear);
        Map<String, Long> byMetro = new HashMap<>();
        long[] total = {0};
        jdbc.query(sql, params, rs -> {
            long count = rs.getLong("branch_count");
            total[0] += count;
            String metro = rs.getString("metro_code");
            if (metro != null) {
                byMetro.merge(metro, count, Long::sum);
            }
        });
        return new BranchPresence(reportYear, byMetro, total[0]);
    }

    @Override
    public List<BoundaryCrosswalkEntry> loadCrosswalk() {
        String sql = "SELECT tract_suffix, canonical_geo_code FROM " + tables.boundaryCrosswalk();
        return jdbc.query(sql, new MapSqlParameterSource(), (rs, rowNum) ->
                new BoundaryCrosswalkEntry(rs.getString("tract_suffix"), rs.getString("canonical_geo_code")));
    }
}
