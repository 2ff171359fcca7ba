package com.lending.scope.query;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.Collection;

/**
 * SQL text with named parameters, ready for {@code NamedParameterJdbcTemplate}.
 */
public record RenderedQuery(String sql, MapSqlParameterSource parameters) {

    /**
     * Length of the statement once collection parameters are expanded to one placeholder each,
     * which is what the backend's query-text limit applies to.
     */
    public int expandedLength() {
        int length = sql.length();
        for (String name : parameters.getParameterNames()) {
            Object value = parameters.getValue(name);
            if (value instanceof Collection) {
                length += ((Collection<?>) value).size() * 3;
            }
        }
        return length;
    }
}
