package com.scimserver.scim.repository;

import com.scimserver.scim.schema.ScimResourceType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage port for SCIM resources.
 *
 * <p>Every query is scoped to one endpoint and one resource type. Predicate keys are
 * column names from {@link ScimResourceRecord}; an empty predicate selects every row.</p>
 */
public interface ScimResourceRepository {

    /**
     * Store a new resource.
     *
     * @param record the record to store
     * @return the stored record
     */
    ScimResourceRecord create(ScimResourceRecord record);

    /**
     * Find a resource by its SCIM id.
     */
    Optional<ScimResourceRecord> findByScimId(String endpointId, ScimResourceType type, String scimId);

    /**
     * Find the resources matching every column of the predicate.
     *
     * @param endpointId the endpoint (tenant)
     * @param type the resource type
     * @param predicate column name to required value; empty for all rows
     * @return matching records ordered by creation time, oldest first
     */
    List<ScimResourceRecord> findAll(String endpointId, ScimResourceType type, Map<String, Object> predicate);

    /**
     * Find a resource that would violate uniqueness of a new resource.
     *
     * @param uniqueName the userName (Users) or displayName (Groups); compared ignoring case
     * @param externalId the externalId, may be null
     * @return the conflicting record, if any
     */
    Optional<ScimResourceRecord> findConflict(String endpointId, ScimResourceType type, String uniqueName,
                                              String externalId);
}
