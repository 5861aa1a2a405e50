package com.scimserver.scim.filter;

/**
 * Visitor over the four filter node kinds.
 *
 * @param <R> the result type
 */
public interface FilterNodeVisitor<R> {

    R visitCompare(CompareNode node);

    R visitLogical(LogicalNode node);

    R visitNot(NotNode node);

    R visitValuePath(ValuePathNode node);
}
