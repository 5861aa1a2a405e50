package com.scimserver.scim.schema;

/**
 * Constants for SCIM 2.0 schema URNs used throughout the application.
 *
 * <p>These URNs are defined in RFC 7643 (SCIM Core Schema) and RFC 7644 (SCIM Protocol).</p>
 */
public final class ScimSchemaUrns {

    // ========================================================================
    // Resource schemas (RFC 7643)
    // ========================================================================

    /** Core User schema URN */
    public static final String CORE_USER_SCHEMA = "urn:ietf:params:scim:schemas:core:2.0:User";

    /** Core Group schema URN */
    public static final String CORE_GROUP_SCHEMA = "urn:ietf:params:scim:schemas:core:2.0:Group";

    /** Enterprise User extension schema URN (RFC 7643 Section 4.3) */
    public static final String ENTERPRISE_USER_SCHEMA = "urn:ietf:params:scim:schemas:extension:enterprise:2.0:User";

    /** Service Provider Configuration schema URN */
    public static final String SERVICE_PROVIDER_CONFIG = "urn:ietf:params:scim:schemas:core:2.0:ServiceProviderConfig";

    // ========================================================================
    // Protocol message schemas (RFC 7644)
    // ========================================================================

    /** Error response schema URN */
    public static final String ERROR = "urn:ietf:params:scim:api:messages:2.0:Error";

    /** List response schema URN */
    public static final String LIST_RESPONSE = "urn:ietf:params:scim:api:messages:2.0:ListResponse";

    /** Search request schema URN */
    public static final String SEARCH_REQUEST = "urn:ietf:params:scim:api:messages:2.0:SearchRequest";

    private ScimSchemaUrns() {
        throw new AssertionError("Cannot instantiate constants class");
    }
}
