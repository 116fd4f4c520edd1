package com.cubelayer.sql;

import org.apache.calcite.sql.SqlDialect;
import org.apache.calcite.sql.dialect.AnsiSqlDialect;
import org.apache.calcite.sql.dialect.H2SqlDialect;
import org.apache.calcite.sql.dialect.MysqlSqlDialect;
import org.apache.calcite.sql.dialect.PostgresqlSqlDialect;

import java.util.regex.Pattern;

/**
 * SQL 方言适配器
 * 处理不同数据库的标识符引用、时间截断和分页语法差异
 */
public class SqlDialectAdapter {

    public enum DatabaseType {
        POSTGRESQL,
        MYSQL,
        H2,
        ANSI
    }

    private static final Pattern OFFSET_FETCH_PATTERN = Pattern.compile(
        "OFFSET\\s+(\\d+)\\s+ROWS?\\s+FETCH\\s+(?:NEXT|FIRST)\\s+(\\d+)\\s+ROWS?\\s+ONLY",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern FETCH_PATTERN = Pattern.compile(
        "FETCH\\s+(?:NEXT|FIRST)\\s+(\\d+)\\s+ROWS?\\s+ONLY",
        Pattern.CASE_INSENSITIVE
    );

    private final DatabaseType databaseType;
    private final SqlDialect dialect;

    public SqlDialectAdapter(DatabaseType databaseType) {
        this.databaseType = databaseType;
        this.dialect = calciteDialect(databaseType);
    }

    public static SqlDialectAdapter forName(String dbType) {
        return new SqlDialectAdapter(getDatabaseType(dbType));
    }

    /**
     * 根据数据库类型字符串获取 DatabaseType
     */
    public static DatabaseType getDatabaseType(String dbType) {
        if (dbType == null || dbType.isEmpty()) {
            return DatabaseType.POSTGRESQL; // 默认 PostgreSQL
        }

        String lowerType = dbType.trim().toLowerCase();
        switch (lowerType) {
            case "postgresql":
            case "postgres":
                return DatabaseType.POSTGRESQL;
            case "mysql":
                return DatabaseType.MYSQL;
            case "h2":
                return DatabaseType.H2;
            case "ansi":
                return DatabaseType.ANSI;
            default:
                // 根据 JDBC URL 判断
                if (lowerType.contains("postgres")) {
                    return DatabaseType.POSTGRESQL;
                } else if (lowerType.contains("mysql")) {
                    return DatabaseType.MYSQL;
                } else if (lowerType.contains("h2")) {
                    return DatabaseType.H2;
                }
                throw new IllegalArgumentException("unsupported sql dialect: " + dbType);
        }
    }

    private static SqlDialect calciteDialect(DatabaseType type) {
        switch (type) {
            case POSTGRESQL:
                return PostgresqlSqlDialect.DEFAULT;
            case MYSQL:
                return MysqlSqlDialect.DEFAULT;
            case H2:
                return H2SqlDialect.DEFAULT;
            default:
                return AnsiSqlDialect.DEFAULT;
        }
    }

    public DatabaseType getDatabaseType() {
        return databaseType;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    /**
     * 输出列别名按方言加引号，保留大小写
     */
    public String quoteIdentifier(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    /**
     * 把时间表达式截断到粒度起点
     */
    public String truncate(TimeGrain grain, String expression) {
        switch (databaseType) {
            case H2:
                String field = grain == TimeGrain.WEEK ? "ISO_WEEK" : grain.name();
                return "DATE_TRUNC(" + field + ", " + expression + ")";
            case MYSQL:
                return truncateMySql(grain, expression);
            default:
                return "DATE_TRUNC('" + grain.getDeclaredName() + "', " + expression + ")";
        }
    }

    private static String truncateMySql(TimeGrain grain, String expression) {
        switch (grain) {
            case SECOND:
                return mysqlFormat(expression, "%Y-%m-%d %H:%i:%s");
            case MINUTE:
                return mysqlFormat(expression, "%Y-%m-%d %H:%i:00");
            case HOUR:
                return mysqlFormat(expression, "%Y-%m-%d %H:00:00");
            case DAY:
                return mysqlFormat(expression, "%Y-%m-%d 00:00:00");
            case WEEK:
                return mysqlFormat("DATE_SUB(" + expression + ", INTERVAL WEEKDAY(" + expression + ") DAY)",
                    "%Y-%m-%d 00:00:00");
            case MONTH:
                return mysqlFormat(expression, "%Y-%m-01 00:00:00");
            case QUARTER:
                return "CAST(CONCAT(YEAR(" + expression + "), '-', LPAD((QUARTER(" + expression
                    + ") - 1) * 3 + 1, 2, '0'), '-01 00:00:00') AS DATETIME)";
            case YEAR:
                return mysqlFormat(expression, "%Y-01-01 00:00:00");
            default:
                throw new IllegalArgumentException("unknown grain " + grain);
        }
    }

    private static String mysqlFormat(String expression, String pattern) {
        return "CAST(DATE_FORMAT(" + expression + ", '" + pattern + "') AS DATETIME)";
    }

    /**
     * 标准分页子句：OFFSET n ROWS FETCH NEXT m ROWS ONLY，offset 为 0 时省略 OFFSET
     */
    public static String pagingClause(int limit, int offset) {
        StringBuilder clause = new StringBuilder();
        if (offset > 0) {
            clause.append("OFFSET ").append(offset).append(" ROWS ");
        }
        clause.append("FETCH NEXT ").append(limit).append(" ROWS ONLY");
        return clause.toString();
    }

    public String adaptSql(String sql) {
        return adaptSql(sql, databaseType);
    }

    /**
     * 转换 SQL 以适配目标数据库
     * @param sql 标准 SQL
     * @param targetType 目标数据库类型
     * @return 转换后的 SQL
     */
    public static String adaptSql(String sql, DatabaseType targetType) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }

        switch (targetType) {
            case POSTGRESQL:
            case MYSQL:
            case H2:
                return toLimitOffset(sql);
            default:
                return sql;
        }
    }

    /**
     * OFFSET ... FETCH NEXT ... 必须先于单独的 FETCH NEXT 处理
     */
    private static String toLimitOffset(String sql) {
        String result = OFFSET_FETCH_PATTERN.matcher(sql).replaceAll("LIMIT $2 OFFSET $1");
        return FETCH_PATTERN.matcher(result).replaceAll("LIMIT $1");
    }
}
