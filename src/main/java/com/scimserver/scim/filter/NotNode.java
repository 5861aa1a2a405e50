package com.scimserver.scim.filter;

import java.util.Objects;

/**
 * Negation: {@code not (filter)}.
 */
public final class NotNode implements FilterNode {

    private final FilterNode filter;

    public NotNode(FilterNode filter) {
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    @Override
    public FilterNodeType getType() {
        return FilterNodeType.NOT;
    }

    @Override
    public <R> R accept(FilterNodeVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    public FilterNode getFilter() {
        return filter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NotNode && filter.equals(((NotNode) o).filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(FilterNodeType.NOT, filter);
    }

    @Override
    public String toString() {
        return ScimFilterFormatter.format(this);
    }
}
