package com.lending.scope.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Typed predicate tree. Built once per request from business filters and reused by every query;
 * turned into SQL only by {@link SqlRenderer}.
 */
public interface Condition {

    /** Columns referenced anywhere in this condition (used to decide which joins are needed). */
    List<Column> columns();

    static Condition eq(Column column, Object value) {
        return new Comparison(column, Operator.EQ, value);
    }

    static Condition notEq(Column column, Object value) {
        return new Comparison(column, Operator.NE, value);
    }

    /** Single value collapses to equality; several values become an IN-list. */
    static Condition in(Column column, List<?> values) {
        if (values.size() == 1) {
            return eq(column, values.get(0));
        }
        return new InList(column, List.copyOf(values), false);
    }

    static Condition notIn(Column column, List<?> values) {
        return new InList(column, List.copyOf(values), true);
    }

    static Condition isNull(Column column) {
        return new NullCheck(column, false);
    }

    static Condition isNotNull(Column column) {
        return new NullCheck(column, true);
    }

    static Condition and(Condition... conditions) {
        return and(Arrays.asList(conditions));
    }

    static Condition and(List<Condition> conditions) {
        return Junction.of(true, conditions);
    }

    static Condition or(Condition... conditions) {
        return Junction.of(false, Arrays.asList(conditions));
    }

    static Condition alwaysTrue() {
        return AlwaysTrue.INSTANCE;
    }

    enum Operator {
        EQ("="), NE("<>");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    record Comparison(Column column, Operator operator, Object value) implements Condition {
        public Comparison {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(operator, "operator");
        }

        @Override
        public List<Column> columns() {
            return List.of(column);
        }
    }

    record InList(Column column, List<?> values, boolean negated) implements Condition {
        @Override
        public List<Column> columns() {
            return List.of(column);
        }
    }

    record NullCheck(Column column, boolean negated) implements Condition {
        @Override
        public List<Column> columns() {
            return List.of(column);
        }
    }

    record Junction(boolean conjunction, List<Condition> children) implements Condition {

        static Condition of(boolean conjunction, List<Condition> conditions) {
            List<Condition> flat = new ArrayList<>();
            for (Condition c : conditions) {
                if (c == null || c == AlwaysTrue.INSTANCE && conjunction) {
                    continue;
                }
                if (c instanceof Junction && ((Junction) c).conjunction() == conjunction) {
                    flat.addAll(((Junction) c).children());
                } else {
                    flat.add(c);
                }
            }
            if (flat.isEmpty()) {
                return AlwaysTrue.INSTANCE;
            }
            if (flat.size() == 1) {
                return flat.get(0);
            }
            return new Junction(conjunction, List.copyOf(flat));
        }

        @Override
        public List<Column> columns() {
            List<Column> out = new ArrayList<>();
            children.forEach(c -> out.addAll(c.columns()));
            return out;
        }
    }

    final class AlwaysTrue implements Condition {
        static final AlwaysTrue INSTANCE = new AlwaysTrue();

        private AlwaysTrue() {
        }

        @Override
        public List<Column> columns() {
            return List.of();
        }

        @Override
        public String toString() {
            return "TRUE";
        }
    }
}
