package com.cubelayer.sql;

import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.SqlParserPos;
import org.apache.calcite.sql.util.SqlBasicVisitor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 自定义数值表达式的除零保护：把每个除数改写成 {@code NULLIF(除数, 0)}，
 * 分母为 0（例如空结果集上的 COUNT）时整个表达式得到 NULL。
 * <p>
 * 用 Calcite 解析表达式只是为了定位除数，NULLIF 直接插入到原文中，
 * 其余文本（类型名、方言函数、引号）保持声明时的写法。
 * 解析前宏替换为占位标识符，插入后还原。
 */
public final class DivisionGuard {
    private static final String PLACEHOLDER_PREFIX = "MEMBER_REF_";
    private static final Pattern PLACEHOLDER = Pattern.compile(PLACEHOLDER_PREFIX + "(\\d+)_");

    private DivisionGuard() {
    }

    /**
     * 返回加了除零保护的表达式。已经是 NULLIF(...) 的除数和非零数字常量保持不变；
     * 没有需要保护的除数时原样返回。
     *
     * @throws SqlParseException 表达式无法被解析
     */
    public static String guard(String expression) throws SqlParseException {
        if (expression == null || expression.indexOf('/') < 0) {
            return expression;
        }
        List<String> macros = new ArrayList<>();
        String text = withPlaceholders(normalize(expression), macros);

        SqlNode node = SqlParser.create(text, SqlParser.config()).parseExpression();
        DivisorCollector collector = new DivisorCollector(lineStarts(text));
        node.accept(collector);
        if (collector.spans.isEmpty()) {
            return expression;
        }
        return restore(wrap(text, collector.spans), macros);
    }

    /**
     * Calcite 按 tab 宽度计算列号，统一成空格和 \n 后列号与字符偏移一一对应
     */
    private static String normalize(String expression) {
        return expression.replace("\r\n", "\n").replace('\r', '\n').replace('\t', ' ');
    }

    private static String withPlaceholders(String expression, List<String> macros) {
        Matcher matcher = MacroResolver.REFERENCE_PATTERN.matcher(expression);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, PLACEHOLDER_PREFIX + macros.size() + "_");
            macros.add(matcher.group());
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String restore(String text, List<String> macros) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String macro = macros.get(Integer.parseInt(matcher.group(1)));
            matcher.appendReplacement(result, Matcher.quoteReplacement(macro));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static List<Integer> lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }

    /**
     * 区间可以嵌套（除数里还有除法）：同一位置先闭合内层，再打开外层
     */
    private static String wrap(String text, List<Span> spans) {
        StringBuilder result = new StringBuilder(text.length() + spans.size() * 12);
        for (int i = 0; i <= text.length(); i++) {
            final int position = i;
            spans.stream()
                .filter(span -> span.end == position)
                .sorted(Comparator.comparingInt(Span::length))
                .forEach(span -> result.append(", 0)"));
            if (i == text.length()) {
                break;
            }
            spans.stream()
                .filter(span -> span.start == position)
                .sorted(Comparator.comparingInt(Span::length).reversed())
                .forEach(span -> result.append("NULLIF("));
            result.append(text.charAt(i));
        }
        return result.toString();
    }

    private static final class Span {
        private final int start;
        private final int end;

        private Span(int start, int end) {
            this.start = start;
            this.end = end;
        }

        private int length() {
            return end - start;
        }
    }

    private static final class DivisorCollector extends SqlBasicVisitor<Void> {
        private final List<Integer> lineStarts;
        private final List<Span> spans = new ArrayList<>();

        private DivisorCollector(List<Integer> lineStarts) {
            this.lineStarts = lineStarts;
        }

        @Override
        public Void visit(SqlCall call) {
            if (call.getKind() == SqlKind.DIVIDE && call.operandCount() == 2) {
                SqlNode divisor = call.operand(1);
                if (needsGuard(divisor)) {
                    SqlParserPos pos = divisor.getParserPosition();
                    spans.add(new Span(
                        offset(pos.getLineNum(), pos.getColumnNum()),
                        offset(pos.getEndLineNum(), pos.getEndColumnNum()) + 1));
                }
            }
            return super.visit(call);
        }

        private int offset(int line, int column) {
            return lineStarts.get(line - 1) + column - 1;
        }

        private static boolean needsGuard(SqlNode divisor) {
            if (divisor instanceof SqlCall) {
                return !"NULLIF".equalsIgnoreCase(((SqlCall) divisor).getOperator().getName());
            }
            if (divisor instanceof SqlNumericLiteral) {
                BigDecimal value = ((SqlLiteral) divisor).getValueAs(BigDecimal.class);
                return value == null || value.signum() == 0;
            }
            return true;
        }
    }
}
