package com.cubelayer.query;

import com.cubelayer.model.DimensionDefinition;
import com.cubelayer.model.ValueType;
import com.cubelayer.sql.SqlFragment;
import com.cubelayer.sql.TimeGrain;

/**
 * 维度编译
 */
public class DimensionCompiler {

    public String expression(DimensionDefinition dimension, CompileContext ctx) {
        return ctx.column(dimension.getSourceExpression());
    }

    /**
     * SELECT 列：表达式 AS "维度名"
     */
    public SqlFragment compile(DimensionDefinition dimension, CompileContext ctx) {
        return SqlFragment.of(expression(dimension, ctx) + " AS " + ctx.quote(dimension.getName()));
    }

    /**
     * 时间维度截断到粒度起点，SELECT、GROUP BY 共用同一表达式
     */
    public String truncateToGrain(DimensionDefinition dimension, TimeGrain grain, CompileContext ctx) {
        if (dimension.getValueType() != ValueType.TIME) {
            throw new IllegalArgumentException("dimension '" + dimension.getName() + "' is not a time dimension");
        }
        return ctx.getDialect().truncate(grain, expression(dimension, ctx));
    }

    /**
     * 带粒度的时间维度列别名：scanDateTime__day
     */
    public static String grainAlias(String dimensionName, TimeGrain grain) {
        return dimensionName + "__" + grain.getDeclaredName();
    }
}
