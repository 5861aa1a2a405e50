package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Outcome of planning a SCIM filter against storage.
 *
 * <p>Either the filter was pushed down as a single equality predicate
 * ({@code fetchAll == false}, predicate possibly empty when there is no filter),
 * or every row of the tenant's resource type must be fetched and tested with
 * {@link #getInMemoryFilter()} ({@code fetchAll == true}, predicate empty).</p>
 */
public final class DbFilterResult {

    private static final DbFilterResult UNFILTERED = new DbFilterResult(Collections.emptyMap(), false, null);

    private final Map<String, Object> dbPredicate;
    private final boolean fetchAll;
    private final Predicate<JsonNode> inMemoryFilter;

    private DbFilterResult(Map<String, Object> dbPredicate, boolean fetchAll, Predicate<JsonNode> inMemoryFilter) {
        this.dbPredicate = dbPredicate;
        this.fetchAll = fetchAll;
        this.inMemoryFilter = inMemoryFilter;
    }

    /**
     * No filter: all rows for the tenant and resource type.
     */
    public static DbFilterResult unfiltered() {
        return UNFILTERED;
    }

    /**
     * The filter is fully expressed by {@code column = value}.
     */
    public static DbFilterResult pushedDown(String column, Object value) {
        Map<String, Object> predicate = new LinkedHashMap<>();
        predicate.put(column, value);
        return new DbFilterResult(Collections.unmodifiableMap(predicate), false, null);
    }

    /**
     * The filter must be evaluated in memory over all rows.
     */
    public static DbFilterResult inMemory(Predicate<JsonNode> inMemoryFilter) {
        if (inMemoryFilter == null) {
            throw new IllegalArgumentException("An in-memory filter is required when fetching all rows");
        }
        return new DbFilterResult(Collections.emptyMap(), true, inMemoryFilter);
    }

    /**
     * @return column name to required value; empty when nothing is pushed down
     */
    public Map<String, Object> getDbPredicate() {
        return dbPredicate;
    }

    public boolean isFetchAll() {
        return fetchAll;
    }

    /**
     * @return the residual filter, or {@code null} when the predicate is exact
     */
    public Predicate<JsonNode> getInMemoryFilter() {
        return inMemoryFilter;
    }

    /**
     * Apply the residual filter, if any, to a rendered resource.
     */
    public boolean matches(JsonNode resource) {
        return inMemoryFilter == null || inMemoryFilter.test(resource);
    }

    @Override
    public String toString() {
        return "DbFilterResult{" +
                "dbPredicate=" + dbPredicate +
                ", fetchAll=" + fetchAll +
                ", inMemoryFilter=" + (inMemoryFilter != null) +
                '}';
    }
}
