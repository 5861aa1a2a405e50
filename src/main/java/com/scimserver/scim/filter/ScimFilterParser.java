package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.scimserver.scim.exceptions.InvalidFilterException;

import java.math.BigInteger;
import java.util.List;
import java.util.logging.Logger;

/**
 * Recursive-descent parser for SCIM filter expressions (RFC 7644 Section 3.4.2.2).
 *
 * <pre>
 *   filter   := orExpr
 *   orExpr   := andExpr ("or" andExpr)*
 *   andExpr  := primary ("and" primary)*
 *   primary  := "not" "(" filter ")" | "(" filter ")" | attrExpr
 *   attrExpr := ATTR "[" filter "]" | ATTR "pr" | ATTR OP compValue
 *   compValue:= STRING | NUMBER | BOOLEAN | NULL
 * </pre>
 *
 * <p>{@code and} binds tighter than {@code or}; both are left-associative, so
 * {@code a or b and c} parses as {@code a or (b and c)}.</p>
 *
 * <p>Instances are single-use; {@link #parse(String)} is the entry point and is
 * safe to call from any thread.</p>
 */
public final class ScimFilterParser {

    private static final Logger LOGGER = Logger.getLogger(ScimFilterParser.class.getName());

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final List<Token> tokens;
    private int pos;

    private ScimFilterParser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse a SCIM filter string into an AST.
     *
     * <pre>
     *   parse("userName eq \"john\"")
     *   parse("name.familyName co \"doe\" and active eq true")
     *   parse("emails[type eq \"work\" and value co \"@example.com\"]")
     *   parse("not (active eq false)")
     * </pre>
     *
     * @param filter the filter expression
     * @return the root node
     * @throws InvalidFilterException if the filter is empty or malformed
     */
    public static FilterNode parse(String filter) throws InvalidFilterException {
        if (filter == null || filter.trim().isEmpty()) {
            throw new InvalidFilterException("Filter expression cannot be empty");
        }
        List<Token> tokens = ScimFilterTokenizer.tokenize(filter.trim());
        FilterNode root = new ScimFilterParser(tokens).parseFilter();
        LOGGER.fine("Parsed SCIM filter: " + root);
        return root;
    }

    private FilterNode parseFilter() throws InvalidFilterException {
        FilterNode node = parseOrExpr();
        Token trailing = current();
        if (trailing.getType() != TokenType.EOF) {
            throw new InvalidFilterException(
                    "Unexpected token \"" + trailing.getValue() + "\" at position " + trailing.getPosition(),
                    trailing.getPosition());
        }
        return node;
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private Token expect(TokenType type) throws InvalidFilterException {
        Token token = current();
        if (token.getType() != type) {
            throw new InvalidFilterException(
                    "Expected " + type + " but got " + token.getType() + " (\"" + token.getValue()
                            + "\") at position " + token.getPosition(),
                    token.getPosition());
        }
        return advance();
    }

    // orExpr := andExpr ("or" andExpr)*
    private FilterNode parseOrExpr() throws InvalidFilterException {
        FilterNode left = parseAndExpr();
        while (current().getType() == TokenType.OR) {
            advance();
            FilterNode right = parseAndExpr();
            left = new LogicalNode(LogicalOperator.OR, left, right);
        }
        return left;
    }

    // andExpr := primary ("and" primary)*
    private FilterNode parseAndExpr() throws InvalidFilterException {
        FilterNode left = parsePrimary();
        while (current().getType() == TokenType.AND) {
            advance();
            FilterNode right = parsePrimary();
            left = new LogicalNode(LogicalOperator.AND, left, right);
        }
        return left;
    }

    private FilterNode parsePrimary() throws InvalidFilterException {
        TokenType type = current().getType();

        if (type == TokenType.NOT) {
            advance();
            expect(TokenType.LPAREN);
            FilterNode inner = parseOrExpr();
            expect(TokenType.RPAREN);
            return new NotNode(inner);
        }

        if (type == TokenType.LPAREN) {
            advance();
            FilterNode inner = parseOrExpr();
            expect(TokenType.RPAREN);
            return inner;
        }

        return parseAttrExpr();
    }

    private FilterNode parseAttrExpr() throws InvalidFilterException {
        String attrPath = expect(TokenType.ATTR).getValue();

        if (current().getType() == TokenType.LBRACKET) {
            advance();
            FilterNode inner = parseOrExpr();
            expect(TokenType.RBRACKET);
            return new ValuePathNode(attrPath, inner);
        }

        if (current().getType() == TokenType.PR) {
            advance();
            return CompareNode.present(attrPath);
        }

        CompareOperator operator = CompareOperator.fromKeyword(expect(TokenType.OP).getValue());
        return new CompareNode(attrPath, operator, parseCompValue());
    }

    private JsonNode parseCompValue() throws InvalidFilterException {
        Token token = current();
        switch (token.getType()) {
            case STRING:
                advance();
                return NODES.textNode(token.getValue());
            case NUMBER:
                advance();
                return parseNumber(token);
            case BOOLEAN:
                advance();
                return NODES.booleanNode("true".equals(token.getValue()));
            case NULL:
                advance();
                return NODES.nullNode();
            default:
                throw new InvalidFilterException(
                        "Expected comparison value but got " + token.getType() + " (\"" + token.getValue()
                                + "\") at position " + token.getPosition(),
                        token.getPosition());
        }
    }

    /**
     * Literals with a dot become doubles; others the narrowest integral node that holds them.
     */
    private static JsonNode parseNumber(Token token) throws InvalidFilterException {
        String literal = token.getValue();
        try {
            if (literal.indexOf('.') >= 0) {
                return NODES.numberNode(Double.parseDouble(literal));
            }
            BigInteger integral = new BigInteger(literal);
            if (integral.bitLength() < Integer.SIZE) {
                return NODES.numberNode(integral.intValue());
            }
            if (integral.bitLength() < Long.SIZE) {
                return NODES.numberNode(integral.longValue());
            }
            return NODES.numberNode(integral);
        } catch (NumberFormatException e) {
            throw new InvalidFilterException(
                    "Invalid number \"" + literal + "\" at position " + token.getPosition(), token.getPosition());
        }
    }
}
