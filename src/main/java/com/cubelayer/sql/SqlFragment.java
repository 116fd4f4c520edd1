package com.cubelayer.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一段编译好的 SQL 及其按顺序绑定的参数
 */
public final class SqlFragment {
    private final String sql;
    private final List<Object> parameters;

    public SqlFragment(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static SqlFragment of(String sql) {
        return new SqlFragment(sql, List.of());
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? sql : sql + " " + parameters;
    }
}
