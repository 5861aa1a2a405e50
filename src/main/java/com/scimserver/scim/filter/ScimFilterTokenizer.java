package com.scimserver.scim.filter;

import com.scimserver.scim.exceptions.InvalidFilterException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexer for SCIM filter expressions (RFC 7644 Section 3.4.2.2).
 *
 * <p>Keywords ({@code and}, {@code or}, {@code not}, {@code pr}, {@code true},
 * {@code false}, {@code null}) and the comparison operators are matched
 * case-insensitively. Everything else made of {@code [A-Za-z0-9_.:-]} and
 * starting with a letter, underscore or colon is an attribute path, which keeps
 * its original casing. URNs lex as a single attribute token because {@code :}
 * and {@code -} are identifier characters.</p>
 */
public final class ScimFilterTokenizer {

    static final Set<String> COMPARE_OPS = Set.of("eq", "ne", "co", "sw", "ew", "gt", "ge", "lt", "le");

    private ScimFilterTokenizer() {
    }

    /**
     * Tokenize a filter string. The returned list always ends with an EOF token.
     *
     * @param input the filter expression
     * @return the token stream
     * @throws InvalidFilterException on an unterminated string or an unexpected character
     */
    public static List<Token> tokenize(String input) throws InvalidFilterException {
        List<Token> tokens = new ArrayList<>();
        int length = input.length();
        int i = 0;

        while (i < length) {
            char c = input.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            int position = i;

            switch (c) {
                case '(':
                    tokens.add(new Token(TokenType.LPAREN, "(", position));
                    i++;
                    continue;
                case ')':
                    tokens.add(new Token(TokenType.RPAREN, ")", position));
                    i++;
                    continue;
                case '[':
                    tokens.add(new Token(TokenType.LBRACKET, "[", position));
                    i++;
                    continue;
                case ']':
                    tokens.add(new Token(TokenType.RBRACKET, "]", position));
                    i++;
                    continue;
                case '"':
                    i = readString(input, i, tokens);
                    continue;
                default:
                    break;
            }

            if (isNumberStart(input, i)) {
                int end = scanNumber(input, i);
                if (end > 0) {
                    tokens.add(new Token(TokenType.NUMBER, input.substring(i, end), position));
                    i = end;
                    continue;
                }
            }

            if (isIdentifierStart(c)) {
                int end = i;
                while (end < length && isIdentifierPart(input.charAt(end))) {
                    end++;
                }
                String ident = input.substring(i, end);
                tokens.add(classifyIdentifier(ident, position));
                i = end;
                continue;
            }

            throw new InvalidFilterException(
                    "Unexpected character '" + c + "' at position " + position, position);
        }

        tokens.add(new Token(TokenType.EOF, "", length));
        return tokens;
    }

    /**
     * Read a double-quoted string starting at {@code start}. A backslash makes the
     * following character literal; there are no other escape sequences.
     *
     * @return the index just past the closing quote
     */
    private static int readString(String input, int start, List<Token> tokens) throws InvalidFilterException {
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < input.length() && input.charAt(i) != '"') {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length()) {
                value.append(input.charAt(i + 1));
                i += 2;
            } else {
                value.append(c);
                i++;
            }
        }
        if (i >= input.length()) {
            throw new InvalidFilterException("Unterminated string at position " + start, start);
        }
        tokens.add(new Token(TokenType.STRING, value.toString(), start));
        return i + 1;
    }

    private static boolean isNumberStart(String input, int i) {
        char c = input.charAt(i);
        if (Character.isDigit(c)) {
            return true;
        }
        return c == '-' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1));
    }

    /**
     * Scan a numeric literal ({@code -?[0-9.]+} with at most one dot).
     *
     * @return the end index, or -1 when the literal runs into something other
     *         than whitespace, a bracket, a parenthesis or the end of input
     */
    private static int scanNumber(String input, int start) {
        int i = start;
        if (input.charAt(i) == '-') {
            i++;
        }
        boolean seenDot = false;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isDigit(c)) {
                i++;
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                i++;
            } else {
                break;
            }
        }
        if (i < input.length() && !isNumberTerminator(input.charAt(i))) {
            return -1;
        }
        return i;
    }

    private static boolean isNumberTerminator(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '[' || c == ']';
    }

    private static boolean isIdentifierStart(char c) {
        return isAsciiLetter(c) || c == '_' || c == ':';
    }

    private static boolean isIdentifierPart(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '_' || c == '.' || c == ':' || c == '-';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static Token classifyIdentifier(String ident, int position) {
        String lower = ident.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "and":
                return new Token(TokenType.AND, lower, position);
            case "or":
                return new Token(TokenType.OR, lower, position);
            case "not":
                return new Token(TokenType.NOT, lower, position);
            case "pr":
                return new Token(TokenType.PR, lower, position);
            case "true":
            case "false":
                return new Token(TokenType.BOOLEAN, lower, position);
            case "null":
                return new Token(TokenType.NULL, lower, position);
            default:
                if (COMPARE_OPS.contains(lower)) {
                    return new Token(TokenType.OP, lower, position);
                }
                return new Token(TokenType.ATTR, ident, position);
        }
    }
}
