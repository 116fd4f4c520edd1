package com.cubelayer.sql;

/**
 * 模板中的宏在编译后仍未被替换。属于调用方接线错误，不是用户输入错误。
 */
public class UnresolvedTokenException extends IllegalStateException {
    private final String token;

    public UnresolvedTokenException(String token, String template) {
        super("unresolved token '${" + token + "}' in: " + template);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
