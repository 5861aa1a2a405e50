package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Evaluates a parsed SCIM filter against an in-memory resource.
 *
 * <p>Comparison rules (RFC 7644 Section 3.4.2.2, attributes with caseExact=false):</p>
 * <ul>
 *   <li>String comparisons ignore case.</li>
 *   <li>A multi-valued attribute matches when any of its values matches.</li>
 *   <li>{@code pr} is false for a missing or null attribute, an empty string and an empty array.</li>
 *   <li>{@code eq null} matches a missing attribute; {@code ne} matches a missing attribute
 *       unless the expected value is null.</li>
 *   <li>Ordering operators compare strings with strings (ISO-8601 timestamps sort
 *       lexicographically) and numbers with numbers; any other pairing is false.</li>
 * </ul>
 *
 * <p>Evaluation is pure and never throws for a well-formed tree.</p>
 */
public final class ScimFilterEvaluator {

    private static final Logger LOGGER = Logger.getLogger(ScimFilterEvaluator.class.getName());

    private ScimFilterEvaluator() {
    }

    /**
     * Evaluate a filter tree against a resource.
     *
     * <pre>
     *   FilterNode ast = ScimFilterParser.parse("userName eq \"john\" and active eq true");
     *   ScimFilterEvaluator.evaluate(ast, user); // true for {"userName":"John","active":true}
     * </pre>
     *
     * @param node the root node
     * @param resource the resource as a JSON object
     * @return true if the resource matches
     */
    public static boolean evaluate(FilterNode node, JsonNode resource) {
        FilterNodeType type = node.getType();
        if (type != null) {
            switch (type) {
                case COMPARE:
                    return evaluateCompare((CompareNode) node, resource);
                case LOGICAL: {
                    LogicalNode logical = (LogicalNode) node;
                    boolean left = evaluate(logical.getLeft(), resource);
                    boolean right = evaluate(logical.getRight(), resource);
                    return logical.getOperator() == LogicalOperator.AND ? left && right : left || right;
                }
                case NOT:
                    return !evaluate(((NotNode) node).getFilter(), resource);
                case VALUE_PATH:
                    return evaluateValuePath((ValuePathNode) node, resource);
                default:
                    break;
            }
        }
        // fail closed
        LOGGER.warning("Unsupported filter node type " + type + "; treating as no match");
        return false;
    }

    private static boolean evaluateCompare(CompareNode node, JsonNode resource) {
        JsonNode actual = AttributePathResolver.resolve(resource, node.getAttrPath());
        if (actual != null && actual.isArray()) {
            for (JsonNode element : actual) {
                if (compareValues(node.getOperator(), element, node.getValue())) {
                    return true;
                }
            }
            return false;
        }
        return compareValues(node.getOperator(), actual, node.getValue());
    }

    private static boolean evaluateValuePath(ValuePathNode node, JsonNode resource) {
        JsonNode values = AttributePathResolver.resolve(resource, node.getAttrPath());
        if (values == null || !values.isArray()) {
            return false;
        }
        for (JsonNode element : values) {
            if (element.isObject() && evaluate(node.getFilter(), element)) {
                return true;
            }
        }
        return false;
    }

    static boolean compareValues(CompareOperator operator, JsonNode actual, JsonNode expected) {
        switch (operator) {
            case PR:
                return isPresent(actual);
            case EQ:
                if (isAbsent(actual)) {
                    return isAbsent(expected);
                }
                return scimEquals(actual, expected);
            case NE:
                if (isAbsent(actual)) {
                    return !isAbsent(expected);
                }
                return !scimEquals(actual, expected);
            case CO:
                return bothText(actual, expected) && lower(actual).contains(lower(expected));
            case SW:
                return bothText(actual, expected) && lower(actual).startsWith(lower(expected));
            case EW:
                return bothText(actual, expected) && lower(actual).endsWith(lower(expected));
            case GT:
            case GE:
            case LT:
            case LE:
                return compareOrdered(operator, actual, expected);
            default:
                return false;
        }
    }

    private static boolean isPresent(JsonNode actual) {
        if (isAbsent(actual)) {
            return false;
        }
        if (actual.isTextual() && actual.textValue().isEmpty()) {
            return false;
        }
        return !(actual.isArray() && actual.size() == 0);
    }

    private static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    private static boolean scimEquals(JsonNode actual, JsonNode expected) {
        if (expected == null) {
            return false;
        }
        if (actual.isTextual() && expected.isTextual()) {
            return lower(actual).equals(lower(expected));
        }
        if (actual.isNumber() && expected.isNumber()) {
            return actual.decimalValue().compareTo(expected.decimalValue()) == 0;
        }
        if (actual.isBoolean() && expected.isBoolean()) {
            return actual.booleanValue() == expected.booleanValue();
        }
        return false;
    }

    private static boolean compareOrdered(CompareOperator operator, JsonNode actual, JsonNode expected) {
        int cmp;
        if (bothText(actual, expected)) {
            cmp = lower(actual).compareTo(lower(expected));
        } else if (actual != null && expected != null && actual.isNumber() && expected.isNumber()) {
            cmp = actual.decimalValue().compareTo(expected.decimalValue());
        } else {
            return false;
        }
        return switch (operator) {
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            default -> false;
        };
    }

    private static boolean bothText(JsonNode actual, JsonNode expected) {
        return actual != null && expected != null && actual.isTextual() && expected.isTextual();
    }

    private static String lower(JsonNode node) {
        return node.textValue().toLowerCase(Locale.ROOT);
    }
}
