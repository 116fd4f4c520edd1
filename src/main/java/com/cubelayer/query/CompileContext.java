package com.cubelayer.query;

import com.cubelayer.model.CubeDefinition;
import com.cubelayer.model.DimensionDefinition;
import com.cubelayer.model.MeasureDefinition;
import com.cubelayer.sql.MacroResolver;
import com.cubelayer.sql.SqlDialectAdapter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单个立方体的编译上下文：表别名、方言，以及成员引用的展开。
 * 不持有可变状态，可在线程间共享。
 */
public final class CompileContext {
    private static final Pattern COLUMN_PATH = Pattern.compile("^[\\w.]+$");

    private final CubeDefinition cube;
    private final SqlDialectAdapter dialect;
    private final MeasureCompiler measureCompiler;
    private final DimensionCompiler dimensionCompiler;

    public CompileContext(CubeDefinition cube, SqlDialectAdapter dialect,
                          MeasureCompiler measureCompiler, DimensionCompiler dimensionCompiler) {
        this.cube = cube;
        this.dialect = dialect;
        this.measureCompiler = measureCompiler;
        this.dimensionCompiler = dimensionCompiler;
    }

    public CubeDefinition getCube() {
        return cube;
    }

    public String getAlias() {
        return cube.getAlias();
    }

    public SqlDialectAdapter getDialect() {
        return dialect;
    }

    public String quote(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    /**
     * 成员的列表达式：单个列名按别名限定，其余展开宏
     */
    public String column(String sourceExpression) {
        return expand(MacroResolver.qualify(sourceExpression, getAlias()));
    }

    /**
     * 先展开成员引用，再把立方体宏替换成别名。结果不含任何宏。
     */
    public String expand(String template) {
        if (!MacroResolver.containsToken(template)) {
            return template;
        }
        String withMembers = MacroResolver.resolveMembers(template, this::memberSql);
        return MacroResolver.resolve(withMembers,
            cubeName -> cube.getName().equals(cubeName) ? getAlias() : null,
            cube.getName());
    }

    private String memberSql(String body) {
        String member = localMember(body);
        if (member == null) {
            return null;
        }
        MeasureDefinition measure = cube.getMeasure(member);
        if (measure != null) {
            return measureCompiler.aggregate(measure, this);
        }
        DimensionDefinition dimension = cube.getDimension(member);
        if (dimension != null) {
            String expression = dimensionCompiler.expression(dimension, this);
            return COLUMN_PATH.matcher(expression).matches() ? expression : "(" + expression + ")";
        }
        return null;
    }

    /**
     * 宏内容指向本立方体成员时返回成员名；立方体宏或其他立方体的引用返回 null
     */
    private String localMember(String body) {
        Matcher matcher = MacroResolver.REFERENCE_BODY.matcher(body);
        if (!matcher.matches()) {
            return null;
        }
        String head = matcher.group(1);
        String tail = matcher.group(2);
        boolean self = MacroResolver.CUBE_TOKEN.equals(head) || cube.getName().equals(head);
        if (tail == null) {
            return self || cube.getJoins().containsKey(head) ? null : head;
        }
        return self ? tail : null;
    }

    /**
     * 本立方体成员的定义（递归）中第一个指向其他立方体的引用；没有则返回 null
     */
    public String foreignReferenceOfMember(String member) {
        return foreignReference(memberTemplates(member), new HashSet<>(Set.of(member)));
    }

    /**
     * 模板（含其引用的本立方体成员，递归）中第一个指向其他立方体的引用；没有则返回 null
     */
    public String foreignReference(String template) {
        return foreignReference(template, new HashSet<>());
    }

    private String foreignReference(String template, Set<String> visited) {
        for (String body : MacroResolver.tokens(template)) {
            Matcher matcher = MacroResolver.REFERENCE_BODY.matcher(body);
            if (!matcher.matches()) {
                continue;
            }
            String head = matcher.group(1);
            boolean self = MacroResolver.CUBE_TOKEN.equals(head) || cube.getName().equals(head);
            if (!self && (matcher.group(2) != null || cube.getJoins().containsKey(head))) {
                return body;
            }
            String member = localMember(body);
            if (member != null && visited.add(member)) {
                String found = foreignReference(memberTemplates(member), visited);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private String memberTemplates(String member) {
        MeasureDefinition measure = cube.getMeasure(member);
        if (measure != null) {
            StringBuilder all = new StringBuilder();
            if (measure.getSourceExpression() != null) {
                all.append(measure.getSourceExpression());
            }
            List<String> filters = measure.getFilters();
            for (String filter : filters) {
                all.append(' ').append(filter);
            }
            return all.toString();
        }
        DimensionDefinition dimension = cube.getDimension(member);
        return dimension != null ? dimension.getSourceExpression() : "";
    }
}
