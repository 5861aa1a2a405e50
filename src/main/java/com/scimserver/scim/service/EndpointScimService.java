package com.scimserver.scim.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.config.ScimServerConfig;
import com.scimserver.scim.exceptions.InvalidFilterException;
import com.scimserver.scim.filter.AttributePathResolver;
import com.scimserver.scim.filter.DbFilterResult;
import com.scimserver.scim.filter.ScimDbFilterBuilder;
import com.scimserver.scim.projection.ScimAttributeProjector;
import com.scimserver.scim.repository.ScimResourceRecord;
import com.scimserver.scim.repository.ScimResourceRepository;
import com.scimserver.scim.schema.ScimResourceType;
import com.unboundid.scim2.common.GenericScimResource;
import com.unboundid.scim2.common.exceptions.BadRequestException;
import com.unboundid.scim2.common.exceptions.ResourceConflictException;
import com.unboundid.scim2.common.exceptions.ResourceNotFoundException;
import com.unboundid.scim2.common.exceptions.ScimException;
import com.unboundid.scim2.common.messages.ListResponse;
import com.unboundid.scim2.common.messages.SearchRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Endpoint-scoped SCIM operations for Users and Groups.
 *
 * <p>List and search requests follow one pipeline:</p>
 * <ol>
 *   <li>Plan the filter with {@link ScimDbFilterBuilder}: push a single equality down to
 *       the repository, or fetch every row of the endpoint.</li>
 *   <li>Render each row as a SCIM resource ({@code id}, {@code meta}, payload).</li>
 *   <li>Apply the in-memory filter when the plan has one.</li>
 *   <li>Count, paginate, then project {@code attributes}/{@code excludedAttributes}.</li>
 * </ol>
 */
public class EndpointScimService {

    private static final Logger LOGGER = Logger.getLogger(EndpointScimService.class.getName());

    private static final Set<String> SERVER_MANAGED = Set.of("id", "meta");

    private final ScimResourceRepository repository;
    private final int defaultCount;
    private final int maxCount;
    private final Clock clock;

    /**
     * Constructor using paging limits from {@link ScimServerConfig}.
     */
    public EndpointScimService(ScimResourceRepository repository, ScimServerConfig config) {
        this(repository, config.getDefaultCount(), config.getMaxCount(), Clock.systemUTC());
    }

    public EndpointScimService(ScimResourceRepository repository, int defaultCount, int maxCount, Clock clock) {
        this.repository = repository;
        this.defaultCount = defaultCount;
        this.maxCount = maxCount;
        this.clock = clock;
    }

    /**
     * List resources of one type under an endpoint.
     *
     * @param endpointId the endpoint (tenant)
     * @param type Users or Groups
     * @param filter SCIM filter, may be null
     * @param startIndex 1-based index of the first result, null or &lt; 1 means 1
     * @param count page size, null means the default; capped at the maximum
     * @param attributes comma-separated attributes to return, may be null
     * @param excludedAttributes comma-separated attributes to omit, may be null
     * @param baseUrl endpoint base URL used for {@code meta.location}
     * @return the list response
     * @throws ScimException with scimType {@code invalidFilter} for a malformed filter
     */
    public ListResponse<GenericScimResource> listResources(String endpointId, ScimResourceType type, String filter,
                                                           Integer startIndex, Integer count, String attributes,
                                                           String excludedAttributes, String baseUrl)
            throws ScimException {

        int start = (startIndex != null && startIndex > 0) ? startIndex : 1;
        int pageSize = resolveCount(count);

        LOGGER.info(String.format("Listing %s for endpoint %s: filter=%s, startIndex=%d, count=%d",
                type.getEndpoint(), endpointId, filter, start, pageSize));

        DbFilterResult plan = planFilter(type, filter);

        List<ObjectNode> matches = new ArrayList<>();
        for (ScimResourceRecord record : repository.findAll(endpointId, type, plan.getDbPredicate())) {
            ObjectNode resource = toScimResource(record, baseUrl);
            if (plan.matches(resource)) {
                matches.add(resource);
            }
        }

        int totalResults = matches.size();
        int from = Math.min(start - 1, totalResults);
        int to = (int) Math.min((long) from + pageSize, totalResults);
        List<ObjectNode> page = ScimAttributeProjector.applyAttributeProjectionToList(
                matches.subList(from, to), attributes, excludedAttributes);

        List<GenericScimResource> resources = new ArrayList<>(page.size());
        for (ObjectNode resource : page) {
            resources.add(new GenericScimResource(resource));
        }

        LOGGER.fine("Listed " + type.getEndpoint() + " for endpoint " + endpointId + ": totalResults="
                + totalResults + ", returned=" + resources.size());
        return new ListResponse<>(totalResults, resources, start, resources.size());
    }

    /**
     * Run a POST {@code /.search} request.
     */
    public ListResponse<GenericScimResource> search(String endpointId, ScimResourceType type, SearchRequest request,
                                                    String baseUrl) throws ScimException {
        return listResources(endpointId, type,
                request.getFilter(),
                request.getStartIndex(),
                request.getCount(),
                joinAttributes(request.getAttributes()),
                joinAttributes(request.getExcludedAttributes()),
                baseUrl);
    }

    /**
     * Get one resource by id.
     *
     * @throws ResourceNotFoundException if no such resource exists under the endpoint
     */
    public GenericScimResource getResource(String endpointId, ScimResourceType type, String scimId,
                                           String attributes, String excludedAttributes, String baseUrl)
            throws ScimException {
        ScimResourceRecord record = repository.findByScimId(endpointId, type, scimId)
                .orElseThrow(() -> new ResourceNotFoundException("Resource " + scimId + " not found."));

        ObjectNode resource = toScimResource(record, baseUrl);
        return new GenericScimResource(
                ScimAttributeProjector.applyAttributeProjection(resource, attributes, excludedAttributes));
    }

    /**
     * Create a resource.
     *
     * @param payload the request body
     * @return the created resource
     * @throws BadRequestException if the core schema or the required attribute is missing, or
     *         {@code externalId} is not a string
     * @throws ResourceConflictException if the userName/displayName or externalId is taken
     */
    public GenericScimResource createResource(String endpointId, ScimResourceType type, ObjectNode payload,
                                              String baseUrl) throws ScimException {
        ensureSchema(payload, type.getCoreSchema());

        String uniqueName = requireText(payload, type.getUniqueAttribute());
        String externalId = optionalText(payload, "externalId");

        Optional<ScimResourceRecord> conflict = repository.findConflict(endpointId, type, uniqueName, externalId);
        if (conflict.isPresent()) {
            LOGGER.warning("Uniqueness conflict creating " + type.getName() + " '" + uniqueName
                    + "' in endpoint " + endpointId + " with " + conflict.get().getScimId());
            throw new ResourceConflictException("A resource with " + type.getUniqueAttribute() + " '" + uniqueName
                    + "' or externalId '" + externalId + "' already exists; values must be unique.");
        }

        ObjectNode stored = payload.deepCopy();
        stored.remove(SERVER_MANAGED);

        Instant now = clock.instant();
        ScimResourceRecord record = new ScimResourceRecord(
                endpointId,
                type,
                UUID.randomUUID().toString(),
                externalId,
                type == ScimResourceType.USER ? uniqueName : null,
                type == ScimResourceType.GROUP ? uniqueName : null,
                stored,
                now,
                now,
                1L);
        repository.create(record);

        LOGGER.info("Created " + type.getName() + " " + record.getScimId() + " in endpoint " + endpointId);
        return new GenericScimResource(toScimResource(record, baseUrl));
    }

    private DbFilterResult planFilter(ScimResourceType type, String filter) throws BadRequestException {
        try {
            return type == ScimResourceType.USER
                    ? ScimDbFilterBuilder.buildUserFilter(filter)
                    : ScimDbFilterBuilder.buildGroupFilter(filter);
        } catch (InvalidFilterException e) {
            throw BadRequestException.invalidFilter("Unsupported or invalid filter expression: '" + filter + "'.");
        }
    }

    private int resolveCount(Integer count) {
        if (count == null) {
            return defaultCount;
        }
        return Math.max(0, Math.min(count, maxCount));
    }

    /**
     * Render a stored record as a SCIM resource.
     */
    ObjectNode toScimResource(ScimResourceRecord record, String baseUrl) {
        ScimResourceType type = record.getResourceType();
        ObjectNode payload = record.getPayload();
        ObjectNode resource = JsonNodeFactory.instance.objectNode();

        String schemasKey = AttributePathResolver.findKey(payload, "schemas");
        if (schemasKey != null) {
            resource.set("schemas", payload.get(schemasKey));
        } else {
            resource.putArray("schemas").add(type.getCoreSchema());
        }
        resource.put("id", record.getScimId());
        if (record.getExternalId() != null) {
            resource.put("externalId", record.getExternalId());
        }

        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String lower = field.getKey().toLowerCase(Locale.ROOT);
            if (lower.equals("schemas") || lower.equals("externalid")) {
                continue;
            }
            resource.set(field.getKey(), normalizeBooleanStrings(field.getValue()));
        }

        ObjectNode meta = resource.putObject("meta");
        meta.put("resourceType", type.getName());
        meta.put("created", record.getCreatedAt().toString());
        meta.put("lastModified", record.getUpdatedAt().toString());
        meta.put("location", baseUrl + "/" + type.getEndpoint() + "/" + record.getScimId());
        meta.put("version", "W/\"" + record.getVersion() + "\"");
        return resource;
    }

    /**
     * Entra ID sends {@code "primary": "True"} inside multi-valued attributes; convert
     * such strings to booleans so {@code emails[primary eq true]} matches.
     */
    private static JsonNode normalizeBooleanStrings(JsonNode value) {
        if (!value.isArray()) {
            return value;
        }
        ArrayNode copy = JsonNodeFactory.instance.arrayNode();
        for (JsonNode element : value) {
            if (!element.isObject()) {
                copy.add(element);
                continue;
            }
            ObjectNode item = element.deepCopy();
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode v = field.getValue();
                if (v.isTextual() && (v.textValue().equalsIgnoreCase("true")
                        || v.textValue().equalsIgnoreCase("false"))) {
                    field.setValue(BooleanNode.valueOf(Boolean.parseBoolean(v.textValue())));
                }
            }
            copy.add(item);
        }
        return copy;
    }

    private static void ensureSchema(ObjectNode payload, String requiredSchema) throws BadRequestException {
        JsonNode schemas = AttributePathResolver.getIgnoreCase(payload, "schemas");
        if (schemas != null && schemas.isArray()) {
            for (JsonNode schema : schemas) {
                if (schema.isTextual() && schema.textValue().equalsIgnoreCase(requiredSchema)) {
                    return;
                }
            }
        }
        throw BadRequestException.invalidSyntax("Missing required schema '" + requiredSchema + "'.");
    }

    private static String requireText(ObjectNode payload, String attribute) throws BadRequestException {
        JsonNode value = AttributePathResolver.getIgnoreCase(payload, attribute);
        if (value == null || !value.isTextual() || value.textValue().trim().isEmpty()) {
            throw BadRequestException.invalidValue("Attribute '" + attribute + "' is required.");
        }
        return value.textValue();
    }

    private static String optionalText(ObjectNode payload, String attribute) throws BadRequestException {
        JsonNode value = AttributePathResolver.getIgnoreCase(payload, attribute);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw BadRequestException.invalidValue("Attribute '" + attribute + "' must be a string.");
        }
        return value.textValue();
    }

    private static String joinAttributes(Collection<String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return null;
        }
        return String.join(",", attributes);
    }
}
