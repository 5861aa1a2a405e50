package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.scimserver.scim.exceptions.InvalidFilterException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Decides how a SCIM filter is applied to storage.
 *
 * A filter that is exactly {@code attr eq <string|number|boolean>} on an attribute
 * present in the resource type's column map is pushed down as a single
 * {@code column = value} predicate. Anything else (logical combinations, other
 * operators, unmapped attributes, null values) falls back to fetching all rows of
 * the tenant and evaluating the parsed filter in memory.
 *
 * The value is passed through unchanged; case-insensitive matching of the stored
 * column is the repository's responsibility.
 */
public class ScimDbFilterBuilder {

    private static final Logger LOGGER = Logger.getLogger(ScimDbFilterBuilder.class.getName());

    /** Pushable User attributes (lowercased SCIM name -> column). */
    public static final Map<String, String> USER_DB_COLUMNS = Map.of(
            "username", "userName",
            "externalid", "externalId",
            "id", "scimId");

    /** Pushable Group attributes (lowercased SCIM name -> column). */
    public static final Map<String, String> GROUP_DB_COLUMNS = Map.of(
            "externalid", "externalId",
            "id", "scimId",
            "displayname", "displayName");

    private static final ScimDbFilterBuilder USERS = new ScimDbFilterBuilder(USER_DB_COLUMNS);
    private static final ScimDbFilterBuilder GROUPS = new ScimDbFilterBuilder(GROUP_DB_COLUMNS);

    // Attribute name mappings (lowercased SCIM attribute -> storage column)
    private final Map<String, String> columnMap;

    /**
     * Constructor with a resource-type specific column map.
     *
     * @param columnMap SCIM attribute name to storage column; keys are matched ignoring case
     */
    public ScimDbFilterBuilder(Map<String, String> columnMap) {
        Map<String, String> normalized = new HashMap<>();
        for (Map.Entry<String, String> entry : columnMap.entrySet()) {
            normalized.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        this.columnMap = Collections.unmodifiableMap(normalized);
    }

    /**
     * Plan a User filter.
     *
     * @param filter the SCIM filter, may be null or blank
     * @return the storage plan
     * @throws InvalidFilterException if the filter is malformed
     */
    public static DbFilterResult buildUserFilter(String filter) throws InvalidFilterException {
        return USERS.build(filter);
    }

    /**
     * Plan a Group filter.
     *
     * @param filter the SCIM filter, may be null or blank
     * @return the storage plan
     * @throws InvalidFilterException if the filter is malformed
     */
    public static DbFilterResult buildGroupFilter(String filter) throws InvalidFilterException {
        return GROUPS.build(filter);
    }

    /**
     * Parse a SCIM filter and decide between push-down and in-memory evaluation.
     *
     * @param filter the SCIM filter expression (e.g., 'userName eq "john"'), may be null or blank
     * @return the storage plan
     * @throws InvalidFilterException if the filter is malformed
     */
    public DbFilterResult build(String filter) throws InvalidFilterException {
        if (filter == null || filter.trim().isEmpty()) {
            return DbFilterResult.unfiltered();
        }

        FilterNode ast;
        try {
            ast = ScimFilterParser.parse(filter);
        } catch (InvalidFilterException e) {
            LOGGER.warning("Rejected SCIM filter '" + filter + "': " + e.getMessage());
            throw new InvalidFilterException("Invalid filter: " + filter + " (" + e.getMessage() + ")", e);
        }

        DbFilterResult pushed = tryPushDown(ast);
        if (pushed != null) {
            LOGGER.fine("Pushed SCIM filter to storage: " + pushed.getDbPredicate());
            return pushed;
        }

        LOGGER.fine("SCIM filter requires in-memory evaluation: " + ast);
        return DbFilterResult.inMemory(resource -> ScimFilterEvaluator.evaluate(ast, resource));
    }

    /**
     * @return the storage column for a SCIM attribute, or {@code null} if it is not pushable
     */
    public String getColumn(String attrPath) {
        return columnMap.get(attrPath.toLowerCase(Locale.ROOT));
    }

    private DbFilterResult tryPushDown(FilterNode ast) {
        if (ast.getType() != FilterNodeType.COMPARE) {
            return null;
        }
        CompareNode node = (CompareNode) ast;
        if (node.getOperator() != CompareOperator.EQ) {
            return null;
        }
        Object value = toScalar(node.getValue());
        if (value == null) {
            return null;
        }
        String column = getColumn(node.getAttrPath());
        if (column == null) {
            return null;
        }
        return DbFilterResult.pushedDown(column, value);
    }

    /**
     * Convert a comparison value to a storage value: text, number or boolean only.
     */
    private static Object toScalar(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return null;
    }
}
