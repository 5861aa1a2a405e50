package com.scimserver.scim.filter;

import java.util.Locale;

/**
 * SCIM attribute operators (RFC 7644 Section 3.4.2.2, Table 3).
 */
public enum CompareOperator {
    EQ,
    NE,
    CO,
    SW,
    EW,
    GT,
    GE,
    LT,
    LE,
    PR;

    /**
     * @return the operator as written in a filter, e.g. {@code "eq"}
     */
    public String getKeyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Look up an operator by its keyword, ignoring case.
     *
     * @param keyword the operator keyword
     * @return the operator
     * @throws IllegalArgumentException if the keyword is not an operator
     */
    public static CompareOperator fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
