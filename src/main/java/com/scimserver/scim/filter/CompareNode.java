package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Comparison expression: {@code attrPath op compValue} or {@code attrPath pr}.
 *
 * <p>The comparison value is a JSON scalar (text, number, boolean or null node)
 * and is {@code null} exactly when the operator is {@link CompareOperator#PR}.</p>
 */
public final class CompareNode implements FilterNode {

    private final String attrPath;
    private final CompareOperator operator;
    private final JsonNode value;

    public CompareNode(String attrPath, CompareOperator operator, JsonNode value) {
        this.attrPath = Objects.requireNonNull(attrPath, "attrPath");
        this.operator = Objects.requireNonNull(operator, "operator");
        if ((operator == CompareOperator.PR) != (value == null)) {
            throw new IllegalArgumentException("A comparison value is required for every operator except pr");
        }
        this.value = value;
    }

    /**
     * Create a presence test, e.g. {@code title pr}.
     */
    public static CompareNode present(String attrPath) {
        return new CompareNode(attrPath, CompareOperator.PR, null);
    }

    @Override
    public FilterNodeType getType() {
        return FilterNodeType.COMPARE;
    }

    @Override
    public <R> R accept(FilterNodeVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    public String getAttrPath() {
        return attrPath;
    }

    public CompareOperator getOperator() {
        return operator;
    }

    /**
     * @return the comparison value, or {@code null} for {@code pr}
     */
    public JsonNode getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompareNode)) {
            return false;
        }
        CompareNode that = (CompareNode) o;
        return attrPath.equals(that.attrPath)
                && operator == that.operator
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attrPath, operator, value);
    }

    @Override
    public String toString() {
        return ScimFilterFormatter.format(this);
    }
}
