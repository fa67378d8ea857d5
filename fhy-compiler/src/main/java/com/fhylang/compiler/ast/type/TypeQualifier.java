package com.fhylang.compiler.ast.type;

/**
 * How a declared variable is used.
 */
public enum TypeQualifier {
    INPUT("input"),
    OUTPUT("output"),
    STATE("state"),
    PARAM("param"),
    TEMP("temp");

    private final String keyword;

    TypeQualifier(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static TypeQualifier fromKeyword(String keyword) {
        for (TypeQualifier q : values()) {
            if (q.keyword.equals(keyword)) {
                return q;
            }
        }
        return null;
    }
}
