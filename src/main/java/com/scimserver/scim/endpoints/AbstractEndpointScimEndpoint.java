package com.scimserver.scim.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.schema.ScimResourceType;
import com.scimserver.scim.service.EndpointScimService;
import com.unboundid.scim2.common.GenericScimResource;
import com.unboundid.scim2.common.exceptions.BadRequestException;
import com.unboundid.scim2.common.exceptions.ScimException;
import com.unboundid.scim2.common.messages.ListResponse;
import com.unboundid.scim2.common.messages.SearchRequest;
import com.unboundid.scim2.common.utils.JsonUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Routes shared by the per-endpoint Users and Groups resources.
 *
 * <p>Subclasses bind the path and the resource type; exceptions are turned into
 * SCIM error bodies by {@link com.scimserver.scim.exceptions.ScimExceptionMapper}.</p>
 */
public abstract class AbstractEndpointScimEndpoint {

    private static final Logger LOGGER = Logger.getLogger(AbstractEndpointScimEndpoint.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Inject
    private EndpointScimService scimService;

    @Context
    private UriInfo uriInfo;

    @Context
    private HttpHeaders httpHeaders;

    protected abstract ScimResourceType getResourceType();

    /**
     * GET /endpoints/{endpointId}/{type}?filter=&amp;startIndex=&amp;count=&amp;attributes=&amp;excludedAttributes=
     */
    @GET
    public Response list(
            @PathParam("endpointId") String endpointId,
            @QueryParam("filter") String filter,
            @QueryParam("startIndex") Integer startIndex,
            @QueryParam("count") Integer count,
            @QueryParam("attributes") String attributes,
            @QueryParam("excludedAttributes") String excludedAttributes) throws ScimException {

        ListResponse<GenericScimResource> response = scimService.listResources(endpointId, getResourceType(),
                filter, startIndex, count, attributes, excludedAttributes, baseUrl(endpointId));
        return Response.ok(response).build();
    }

    /**
     * POST /endpoints/{endpointId}/{type}/.search
     */
    @POST
    @Path("/.search")
    public Response search(@PathParam("endpointId") String endpointId, String body) throws ScimException {
        SearchRequest request;
        try {
            request = JsonUtils.getObjectReader().forType(SearchRequest.class).readValue(body);
        } catch (IOException e) {
            LOGGER.warning("Invalid SearchRequest body: " + e.getMessage());
            throw BadRequestException.invalidSyntax("Invalid SearchRequest: " + e.getMessage());
        }
        ListResponse<GenericScimResource> response =
                scimService.search(endpointId, getResourceType(), request, baseUrl(endpointId));
        return Response.ok(response).build();
    }

    /**
     * GET /endpoints/{endpointId}/{type}/{id}
     */
    @GET
    @Path("/{id}")
    public Response get(
            @PathParam("endpointId") String endpointId,
            @PathParam("id") String id,
            @QueryParam("attributes") String attributes,
            @QueryParam("excludedAttributes") String excludedAttributes) throws ScimException {

        GenericScimResource resource = scimService.getResource(endpointId, getResourceType(), id,
                attributes, excludedAttributes, baseUrl(endpointId));
        return Response.ok(resource).build();
    }

    /**
     * POST /endpoints/{endpointId}/{type}
     */
    @POST
    public Response create(@PathParam("endpointId") String endpointId, String body) throws ScimException {
        ObjectNode payload = parseObject(body);
        GenericScimResource created =
                scimService.createResource(endpointId, getResourceType(), payload, baseUrl(endpointId));

        String location = created.getObjectNode().path("meta").path("location").asText(null);
        Response.ResponseBuilder builder = Response.status(Response.Status.CREATED).entity(created);
        if (location != null) {
            builder.header("Location", location);
        }
        return builder.build();
    }

    private ObjectNode parseObject(String body) throws BadRequestException {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOGGER.warning("Invalid JSON in request: " + e.getOriginalMessage());
            throw BadRequestException.invalidSyntax("Invalid JSON format: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw BadRequestException.invalidSyntax("Request body must be a JSON object");
        }
        return (ObjectNode) node;
    }

    private String baseUrl(String endpointId) {
        return ScimBaseUrl.forEndpoint(uriInfo, httpHeaders, endpointId);
    }
}
