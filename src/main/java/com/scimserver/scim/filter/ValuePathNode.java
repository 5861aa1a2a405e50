package com.scimserver.scim.filter;

import java.util.Objects;

/**
 * Value path expression: {@code attrPath[valFilter]}, e.g. {@code emails[type eq "work"]}.
 *
 * <p>The inner filter is evaluated against each element of the multi-valued
 * attribute, with the element standing in for the resource.</p>
 */
public final class ValuePathNode implements FilterNode {

    private final String attrPath;
    private final FilterNode filter;

    public ValuePathNode(String attrPath, FilterNode filter) {
        this.attrPath = Objects.requireNonNull(attrPath, "attrPath");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    @Override
    public FilterNodeType getType() {
        return FilterNodeType.VALUE_PATH;
    }

    @Override
    public <R> R accept(FilterNodeVisitor<R> visitor) {
        return visitor.visitValuePath(this);
    }

    public String getAttrPath() {
        return attrPath;
    }

    public FilterNode getFilter() {
        return filter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValuePathNode)) {
            return false;
        }
        ValuePathNode that = (ValuePathNode) o;
        return attrPath.equals(that.attrPath) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attrPath, filter);
    }

    @Override
    public String toString() {
        return ScimFilterFormatter.format(this);
    }
}
