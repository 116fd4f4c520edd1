package com.cubelayer.query;

import com.cubelayer.model.ValueType;
import com.cubelayer.sql.SqlFragment;
import com.cubelayer.sql.TimeValues;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 过滤条件编译。值全部以 ? 占位，参数按出现顺序返回。
 * 时间区间左闭右开：inDateRange [a, b] 编译为 x >= a AND x < b。
 */
public class FilterCompiler {

    /**
     * @param member     请求中的成员名，用于错误信息
     * @param expression 已编译的列或聚合表达式
     */
    public SqlFragment compile(String member, String expression, ValueType valueType,
                               FilterOperator operator, List<Object> values) throws QueryException {
        if (!operator.supports(valueType)) {
            throw new QueryException(QueryException.Kind.TYPE_MISMATCH,
                "operator '" + operator.getDeclaredName() + "' cannot be applied to "
                    + valueType.getDeclaredName() + " member '" + member + "'");
        }
        List<Object> raw = values != null ? values : Collections.emptyList();
        if (!operator.isUnary() && raw.isEmpty()) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "filter on '" + member + "' with operator '" + operator.getDeclaredName() + "' requires values");
        }

        switch (operator) {
            case SET:
                return SqlFragment.of(expression + " IS NOT NULL");
            case NOT_SET:
                return SqlFragment.of(expression + " IS NULL");
            case EQUALS:
            case NOT_EQUALS:
                return equality(member, expression, valueType, operator == FilterOperator.NOT_EQUALS, raw);
            case CONTAINS:
                return textMatch(expression, raw, "%", "%", false);
            case NOT_CONTAINS:
                return textMatch(expression, raw, "%", "%", true);
            case STARTS_WITH:
                return textMatch(expression, raw, "", "%", false);
            case ENDS_WITH:
                return textMatch(expression, raw, "%", "", false);
            case GT:
                return comparison(member, expression, ">", raw);
            case GTE:
                return comparison(member, expression, ">=", raw);
            case LT:
                return comparison(member, expression, "<", raw);
            case LTE:
                return comparison(member, expression, "<=", raw);
            case IN_DATE_RANGE:
            case NOT_IN_DATE_RANGE:
                List<Object> range = dateRange(member, raw);
                String sql = operator == FilterOperator.IN_DATE_RANGE
                    ? "(" + expression + " >= ? AND " + expression + " < ?)"
                    : "(" + expression + " < ? OR " + expression + " >= ?)";
                return new SqlFragment(sql, range);
            case BEFORE_DATE:
                return new SqlFragment(expression + " < ?", List.of(singleTime(member, raw)));
            case AFTER_DATE:
                return new SqlFragment(expression + " >= ?", List.of(singleTime(member, raw)));
            default:
                throw new QueryException(QueryException.Kind.UNSUPPORTED,
                    "operator '" + operator.getDeclaredName() + "' is not supported here");
        }
    }

    private SqlFragment equality(String member, String expression, ValueType valueType, boolean negate,
                                 List<Object> raw) throws QueryException {
        List<Object> parameters = new ArrayList<>();
        for (Object value : raw) {
            parameters.add(convert(member, valueType, value));
        }
        String predicate;
        if (parameters.size() == 1) {
            predicate = expression + (negate ? " <> ?" : " = ?");
        } else {
            predicate = expression + (negate ? " NOT IN (" : " IN (") + placeholders(parameters.size()) + ")";
        }
        // NULL 不等于任何值，notEquals 需要显式保留 NULL 行
        return new SqlFragment(negate ? "(" + predicate + " OR " + expression + " IS NULL)" : predicate, parameters);
    }

    private SqlFragment textMatch(String expression, List<Object> raw, String prefix, String suffix, boolean negate) {
        List<Object> parameters = new ArrayList<>();
        List<String> predicates = new ArrayList<>();
        for (Object value : raw) {
            parameters.add(prefix + escapeLike(String.valueOf(value).toLowerCase()) + suffix);
            predicates.add("LOWER(" + expression + ")" + (negate ? " NOT LIKE ?" : " LIKE ?"));
        }
        if (negate) {
            return new SqlFragment("(" + expression + " IS NULL OR (" + String.join(" AND ", predicates) + "))",
                parameters);
        }
        String sql = predicates.size() == 1 ? predicates.get(0) : "(" + String.join(" OR ", predicates) + ")";
        return new SqlFragment(sql, parameters);
    }

    private SqlFragment comparison(String member, String expression, String sqlOperator, List<Object> raw)
            throws QueryException {
        if (raw.size() != 1) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "comparison filter on '" + member + "' takes exactly one value");
        }
        return new SqlFragment(expression + " " + sqlOperator + " ?", List.of(number(member, raw.get(0))));
    }

    private List<Object> dateRange(String member, List<Object> raw) throws QueryException {
        if (raw.size() != 2) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "date range on '" + member + "' takes exactly two values");
        }
        LocalDateTime start = time(member, raw.get(0));
        LocalDateTime end = time(member, raw.get(1));
        if (end.isBefore(start)) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "date range on '" + member + "' ends before it starts");
        }
        return List.of(start, end);
    }

    private LocalDateTime singleTime(String member, List<Object> raw) throws QueryException {
        if (raw.size() != 1) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "date filter on '" + member + "' takes exactly one value");
        }
        return time(member, raw.get(0));
    }

    private Object convert(String member, ValueType valueType, Object value) throws QueryException {
        if (value == null) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "null value in filter on '" + member + "', use notSet instead");
        }
        switch (valueType) {
            case NUMBER:
                return number(member, value);
            case TIME:
                return time(member, value);
            default:
                return String.valueOf(value);
        }
    }

    static BigDecimal number(String member, Object value) throws QueryException {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new QueryException(QueryException.Kind.TYPE_MISMATCH,
                "value '" + value + "' for '" + member + "' is not a number", e);
        }
    }

    static LocalDateTime time(String member, Object value) throws QueryException {
        try {
            return TimeValues.parse(value);
        } catch (DateTimeParseException e) {
            throw new QueryException(QueryException.Kind.TYPE_MISMATCH,
                "value '" + value + "' for '" + member + "' is not a timestamp", e);
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
