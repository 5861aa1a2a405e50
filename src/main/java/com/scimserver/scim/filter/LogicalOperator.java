package com.scimserver.scim.filter;

import java.util.Locale;

/**
 * Logical operators combining two filter expressions.
 */
public enum LogicalOperator {
    AND,
    OR;

    public String getKeyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
