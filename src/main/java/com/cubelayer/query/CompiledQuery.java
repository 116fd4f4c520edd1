package com.cubelayer.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译结果：SQL、按顺序绑定的参数、输出列清单
 */
public class CompiledQuery {
    private final String cube;
    private final String sql;
    private final List<Object> parameters;
    private final List<ColumnManifest> columns;

    public CompiledQuery(String cube, String sql, List<Object> parameters, List<ColumnManifest> columns) {
        this.cube = cube;
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.columns = List.copyOf(columns);
    }

    public String getCube() {
        return cube;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public List<ColumnManifest> getColumns() {
        return columns;
    }

    public ColumnManifest getColumn(String alias) {
        for (ColumnManifest column : columns) {
            if (column.getAlias().equals(alias)) {
                return column;
            }
        }
        return null;
    }
}
