package com.lending.scope.query;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One grouped row: the group-key values plus the summed amount and record count. Key values are
 * strings except {@link GroupKey#YEAR}, which is an {@link Integer}; any of them may be null (for
 * example a geography outside every metro).
 */
public final class AggregateRow {

    private final Map<GroupKey, Object> keys;
    private final BigDecimal totalAmount;
    private final long totalCount;

    public AggregateRow(Map<GroupKey, Object> keys, BigDecimal totalAmount, long totalCount) {
        EnumMap<GroupKey, Object> copy = new EnumMap<>(GroupKey.class);
        copy.putAll(keys);
        this.keys = Collections.unmodifiableMap(copy);
        this.totalAmount = totalAmount != null ? totalAmount : BigDecimal.ZERO;
        this.totalCount = totalCount;
    }

    public Map<GroupKey, Object> getKeys() {
        return keys;
    }

    public String getString(GroupKey key) {
        Object value = keys.get(key);
        return value != null ? value.toString() : null;
    }

    public Integer getInt(GroupKey key) {
        Object value = keys.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.valueOf(value.toString().trim());
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public long getTotalCount() {
        return totalCount;
    }

    /** Key values in {@link GroupKey} declaration order; rows with equal identities merge. */
    public List<Object> identity() {
        return new ArrayList<>(keys.values());
    }

    /** Sum of this row and another row with the same identity. */
    public AggregateRow plus(AggregateRow other) {
        return new AggregateRow(keys, totalAmount.add(other.totalAmount), totalCount + other.totalCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateRow)) return false;
        AggregateRow that = (AggregateRow) o;
        return totalCount == that.totalCount
                && keys.equals(that.keys)
                && totalAmount.compareTo(that.totalAmount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, totalAmount.stripTrailingZeros(), totalCount);
    }

    @Override
    public String toString() {
        return "AggregateRow{" + keys + ", amount=" + totalAmount + ", count=" + totalCount + "}";
    }
}
