package com.example.pipelinesync.repository;

import com.example.pipelinesync.entity.MirroredEntity;
import lombok.Getter;

import java.util.List;
import java.util.function.Function;

/**
 * Typed columns of one mirror table, next to the columns every mirror table shares
 * (tenant_id, source_id, source_modified_on, raw_payload, fetched_at).
 */
@Getter
public class MirrorTable<E extends MirroredEntity> {

    private final String tableName;
    private final List<String> columns;
    private final Function<E, List<Object>> binder;

    /**
     * @param binder values for {@code columns}, in the same order; may contain nulls
     */
    public MirrorTable(String tableName, List<String> columns, Function<E, List<Object>> binder) {
        this.tableName = tableName;
        this.columns = List.copyOf(columns);
        this.binder = binder;
    }

    List<Object> bind(E record) {
        List<Object> values = binder.apply(record);
        if (values.size() != columns.size()) {
            throw new IllegalStateException(String.format("%s binder produced %d values for %d columns",
                    tableName, values.size(), columns.size()));
        }
        return values;
    }
}
