package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Renders a filter AST back to SCIM filter syntax.
 *
 * The output uses lower-case keywords and operators, quotes and escapes string
 * values, and parenthesizes every nested logical expression, so parsing the
 * output yields an equal tree. Used for log output and error details.
 */
public final class ScimFilterFormatter implements FilterNodeVisitor<String> {

    private static final ScimFilterFormatter INSTANCE = new ScimFilterFormatter();

    private ScimFilterFormatter() {
    }

    /**
     * Format a filter tree.
     *
     * @param node the root node
     * @return the canonical filter string
     */
    public static String format(FilterNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitCompare(CompareNode node) {
        if (node.getOperator() == CompareOperator.PR) {
            return node.getAttrPath() + " pr";
        }
        return String.format("%s %s %s",
                node.getAttrPath(), node.getOperator().getKeyword(), formatValue(node.getValue()));
    }

    @Override
    public String visitLogical(LogicalNode node) {
        // (a or b) and c -> keep the grouping explicit on both sides
        return operand(node.getLeft()) + " " + node.getOperator().getKeyword() + " " + operand(node.getRight());
    }

    @Override
    public String visitNot(NotNode node) {
        return "not (" + node.getFilter().accept(this) + ")";
    }

    @Override
    public String visitValuePath(ValuePathNode node) {
        return node.getAttrPath() + "[" + node.getFilter().accept(this) + "]";
    }

    private String operand(FilterNode node) {
        String rendered = node.accept(this);
        return node.getType() == FilterNodeType.LOGICAL ? "(" + rendered + ")" : rendered;
    }

    /**
     * Format a comparison value: strings quoted, decimals in plain notation, everything else as its
     * JSON text.
     */
    private static String formatValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return "null";
        }
        if (value.isTextual()) {
            return "\"" + escapeString(value.asText()) + "\"";
        }
        if (value.isBoolean()) {
            return value.asBoolean() ? "true" : "false";
        }
        if (value.isFloatingPointNumber()) {
            // no exponent, and keep the point so the literal reads back as a decimal
            String plain = value.decimalValue().toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        return value.asText();
    }

    /**
     * Escape backslashes and double quotes.
     */
    private static String escapeString(String input) {
        return input.replace("\\", "\\\\")
                .replace("\"", "\\\"");
    }
}
