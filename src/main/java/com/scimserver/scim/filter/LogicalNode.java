package com.scimserver.scim.filter;

import java.util.Objects;

/**
 * Logical expression: {@code left and right} or {@code left or right}.
 */
public final class LogicalNode implements FilterNode {

    private final LogicalOperator operator;
    private final FilterNode left;
    private final FilterNode right;

    public LogicalNode(LogicalOperator operator, FilterNode left, FilterNode right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public FilterNodeType getType() {
        return FilterNodeType.LOGICAL;
    }

    @Override
    public <R> R accept(FilterNodeVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public FilterNode getLeft() {
        return left;
    }

    public FilterNode getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogicalNode)) {
            return false;
        }
        LogicalNode that = (LogicalNode) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return ScimFilterFormatter.format(this);
    }
}
