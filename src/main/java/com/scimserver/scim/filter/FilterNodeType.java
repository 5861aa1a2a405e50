package com.scimserver.scim.filter;

/**
 * Discriminator tag of a {@link FilterNode}.
 */
public enum FilterNodeType {
    COMPARE,
    LOGICAL,
    NOT,
    VALUE_PATH
}
