package com.scimserver.scim.filter;

/**
 * Token types produced by {@link ScimFilterTokenizer}.
 */
public enum TokenType {
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    AND,
    OR,
    NOT,
    OP,
    PR,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    ATTR,
    EOF
}
