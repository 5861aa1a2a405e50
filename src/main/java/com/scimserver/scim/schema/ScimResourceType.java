package com.scimserver.scim.schema;

/**
 * Resource types served under each endpoint.
 */
public enum ScimResourceType {

    USER("User", "Users", ScimSchemaUrns.CORE_USER_SCHEMA, "userName"),
    GROUP("Group", "Groups", ScimSchemaUrns.CORE_GROUP_SCHEMA, "displayName");

    private final String name;
    private final String endpoint;
    private final String coreSchema;
    private final String uniqueAttribute;

    ScimResourceType(String name, String endpoint, String coreSchema, String uniqueAttribute) {
        this.name = name;
        this.endpoint = endpoint;
        this.coreSchema = coreSchema;
        this.uniqueAttribute = uniqueAttribute;
    }

    /**
     * @return the value of {@code meta.resourceType}, e.g. "User"
     */
    public String getName() {
        return name;
    }

    /**
     * @return the path segment under an endpoint, e.g. "Users"
     */
    public String getEndpoint() {
        return endpoint;
    }

    public String getCoreSchema() {
        return coreSchema;
    }

    /**
     * @return the required attribute that must be unique (case-insensitively) per endpoint
     */
    public String getUniqueAttribute() {
        return uniqueAttribute;
    }
}
