package com.cubelayer.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL 片段中的宏替换。
 * <ul>
 *   <li>{@code ${CUBE}} / {@code ${CubeName}}：立方体的表别名</li>
 *   <li>{@code ${member}} / {@code ${CubeName.member}}：成员引用，由调用方提供替换结果</li>
 * </ul>
 * 纯字符串替换，无状态。
 */
public final class MacroResolver {
    public static final String CUBE_TOKEN = "CUBE";
    public static final Pattern REFERENCE_PATTERN = Pattern.compile("\\$\\{([^}]*)}");
    /**
     * 宏内容：member、CubeName 或 CubeName.member
     */
    public static final Pattern REFERENCE_BODY = Pattern.compile(
        "^([\\p{L}_][\\p{L}\\p{N}_]*)(?:\\.([\\p{L}_][\\p{L}\\p{N}_]*))?$");
    private static final Pattern BARE_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private MacroResolver() {
    }

    /**
     * 把立方体宏替换为别名。{@code ${CUBE}} 指向 currentCube。
     * 成员引用（带点或非立方体名）必须在调用前已经替换掉。
     *
     * @throws UnresolvedTokenException aliasForCube 对某个宏返回 null
     */
    public static String resolve(String template, Function<String, String> aliasForCube, String currentCube) {
        if (template == null) {
            return null;
        }
        Matcher matcher = REFERENCE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String token = matcher.group(1).trim();
            String cubeName = CUBE_TOKEN.equals(token) ? currentCube : token;
            String alias = cubeName != null ? aliasForCube.apply(cubeName) : null;
            if (alias == null) {
                throw new UnresolvedTokenException(token, template);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(alias));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * 替换成员引用。memberSql 对不是成员的宏（例如 ${CUBE}）返回 null，这些宏保持原样。
     */
    public static String resolveMembers(String template, Function<String, String> memberSql) {
        if (template == null) {
            return null;
        }
        Matcher matcher = REFERENCE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = memberSql.apply(matcher.group(1).trim());
            matcher.appendReplacement(result, Matcher.quoteReplacement(
                replacement != null ? replacement : matcher.group()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * 单个列名按立方体别名限定：quality_score -> radiology_audits.quality_score
     */
    public static String qualify(String expression, String alias) {
        if (expression != null && BARE_IDENTIFIER.matcher(expression).matches()) {
            return alias + "." + expression;
        }
        return expression;
    }

    public static boolean containsToken(String template) {
        return template != null && REFERENCE_PATTERN.matcher(template).find();
    }

    /**
     * 模板中出现的全部宏内容（去掉 ${ }），按出现顺序
     */
    public static List<String> tokens(String template) {
        List<String> tokens = new ArrayList<>();
        if (template == null) {
            return tokens;
        }
        Matcher matcher = REFERENCE_PATTERN.matcher(template);
        while (matcher.find()) {
            tokens.add(matcher.group(1).trim());
        }
        return tokens;
    }
}
