package com.scimserver.scim.repository;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.schema.ScimResourceType;

import java.time.Instant;
import java.util.Locale;

/**
 * A stored SCIM resource scoped to one endpoint (tenant).
 *
 * <p>{@code scimId}, {@code externalId}, {@code userName} and {@code displayName} are
 * the queryable columns; everything else lives in the payload.</p>
 */
public class ScimResourceRecord {

    /** Column names accepted in a storage predicate. */
    public static final String COLUMN_SCIM_ID = "scimId";
    public static final String COLUMN_EXTERNAL_ID = "externalId";
    public static final String COLUMN_USER_NAME = "userName";
    public static final String COLUMN_DISPLAY_NAME = "displayName";

    private final String endpointId;
    private final ScimResourceType resourceType;
    private final String scimId;
    private final String externalId;
    private final String userName;
    private final String displayName;
    private final ObjectNode payload;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    public ScimResourceRecord(String endpointId, ScimResourceType resourceType, String scimId, String externalId,
                              String userName, String displayName, ObjectNode payload,
                              Instant createdAt, Instant updatedAt, long version) {
        this.endpointId = endpointId;
        this.resourceType = resourceType;
        this.scimId = scimId;
        this.externalId = externalId;
        this.userName = userName;
        this.displayName = displayName;
        this.payload = payload;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }

    public String getEndpointId() {
        return endpointId;
    }

    public ScimResourceType getResourceType() {
        return resourceType;
    }

    public String getScimId() {
        return scimId;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getUserName() {
        return userName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return the client-supplied attributes, without {@code id} and {@code meta}
     */
    public ObjectNode getPayload() {
        return payload;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Test a column against a pushed-down predicate value.
     *
     * <p>Every pushable column holds text and matches the way the filter evaluator compares
     * strings: ignoring case. A number or boolean never equals stored text, so non-string
     * values never match. Unknown columns never match.</p>
     */
    public boolean columnMatches(String column, Object value) {
        if (!(value instanceof String)) {
            return false;
        }
        String expected = (String) value;
        switch (column) {
            case COLUMN_SCIM_ID:
                return equalsIgnoreCase(scimId, expected);
            case COLUMN_EXTERNAL_ID:
                return equalsIgnoreCase(externalId, expected);
            case COLUMN_USER_NAME:
                return equalsIgnoreCase(userName, expected);
            case COLUMN_DISPLAY_NAME:
                return equalsIgnoreCase(displayName, expected);
            default:
                return false;
        }
    }

    private static boolean equalsIgnoreCase(String stored, String expected) {
        return stored != null && stored.toLowerCase(Locale.ROOT).equals(expected.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "ScimResourceRecord{" +
                "endpointId='" + endpointId + '\'' +
                ", resourceType=" + resourceType +
                ", scimId='" + scimId + '\'' +
                ", externalId='" + externalId + '\'' +
                ", userName='" + userName + '\'' +
                ", displayName='" + displayName + '\'' +
                '}';
    }
}
