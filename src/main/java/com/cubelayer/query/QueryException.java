package com.cubelayer.query;

/**
 * 查询请求无法编译。失败的请求不会产生任何 SQL。
 */
public class QueryException extends Exception {
    public enum Kind {
        UNKNOWN_CUBE,
        UNKNOWN_FIELD,
        UNKNOWN_SEGMENT,
        TYPE_MISMATCH,
        INVALID_REQUEST,
        UNSUPPORTED
    }

    private final Kind kind;

    public QueryException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
