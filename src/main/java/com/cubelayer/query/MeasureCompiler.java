package com.cubelayer.query;

import com.cubelayer.model.AggregationKind;
import com.cubelayer.model.MeasureDefinition;
import com.cubelayer.sql.SqlFragment;

import java.util.stream.Collectors;

/**
 * 度量编译：把度量定义编译为聚合表达式。
 * <p>
 * 带过滤条件的度量不使用子查询，而是把聚合参数包进
 * {@code CASE WHEN <条件> THEN <参数> END}，只扫描一次结果集。
 * 不匹配的行产生 NULL，聚合函数会忽略它们：计数得 0，AVG/SUM 等在空集上得 NULL。
 */
public class MeasureCompiler {

    public SqlFragment compile(MeasureDefinition measure, CompileContext ctx) {
        return SqlFragment.of(aggregate(measure, ctx) + " AS " + ctx.quote(measure.getName()));
    }

    public String aggregate(MeasureDefinition measure, CompileContext ctx) {
        AggregationKind kind = measure.getAggregationKind();
        if (kind == AggregationKind.NUMBER) {
            // 除数在加载时已经包上 NULLIF，见 DivisionGuard
            return "(" + ctx.expand(measure.getSourceExpression()) + ")";
        }

        String argument = measure.getSourceExpression() != null ? ctx.column(measure.getSourceExpression()) : null;
        if (!measure.getFilters().isEmpty()) {
            argument = "CASE WHEN " + filterPredicate(measure, ctx) + " THEN "
                + (argument != null ? argument : "1") + " END";
        }

        switch (kind) {
            case COUNT:
                return "COUNT(" + (argument != null ? argument : "*") + ")";
            case COUNT_DISTINCT:
                return "COUNT(DISTINCT " + argument + ")";
            default:
                return kind.getSqlFunction() + "(" + argument + ")";
        }
    }

    /**
     * 度量声明的过滤条件，AND 连接；没有过滤条件时返回 null
     */
    public String filterPredicate(MeasureDefinition measure, CompileContext ctx) {
        if (measure.getFilters().isEmpty()) {
            return null;
        }
        return measure.getFilters().stream()
            .map(filter -> "(" + ctx.expand(filter) + ")")
            .collect(Collectors.joining(" AND "));
    }
}
