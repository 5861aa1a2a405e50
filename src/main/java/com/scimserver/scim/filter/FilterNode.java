package com.scimserver.scim.filter;

/**
 * Node of a parsed SCIM filter expression.
 *
 * <p>The tree is immutable and strictly hierarchical. Consumers either switch on
 * {@link #getType()} or implement a {@link FilterNodeVisitor}.</p>
 */
public interface FilterNode {

    /**
     * @return the tag identifying the concrete node kind
     */
    FilterNodeType getType();

    /**
     * Dispatch to the visitor method matching this node kind.
     */
    <R> R accept(FilterNodeVisitor<R> visitor);
}
