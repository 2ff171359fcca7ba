package com.lending.scope.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One grouped-sum query over the transaction table: group keys plus a condition. Measures are
 * always the summed loan amount and the record count.
 */
@Value
@Builder(toBuilder = true)
public class AggregationQuery {

    @Singular
    List<GroupKey> groupKeys;
    @Builder.Default
    Condition where = Condition.alwaysTrue();

    List<Column> referencedColumns() {
        List<Column> columns = new ArrayList<>();
        groupKeys.forEach(k -> columns.add(k.column()));
        columns.addAll(where.columns());
        return columns;
    }
}
