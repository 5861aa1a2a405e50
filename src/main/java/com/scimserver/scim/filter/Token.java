package com.scimserver.scim.filter;

/**
 * A single lexical token of a SCIM filter expression.
 *
 * The position is the offset of the token's first character in the
 * filter string and is only used for error messages.
 */
public final class Token {

    private final TokenType type;
    private final String value;
    private final int position;

    public Token(TokenType type, String value, int position) {
        this.type = type;
        this.value = value;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return type + "(\"" + value + "\")@" + position;
    }
}
