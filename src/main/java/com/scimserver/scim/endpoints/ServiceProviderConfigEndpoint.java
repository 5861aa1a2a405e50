package com.scimserver.scim.endpoints;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.config.ScimServerConfig;
import com.scimserver.scim.schema.ScimSchemaUrns;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import java.util.logging.Logger;

/**
 * JAX-RS endpoint for SCIM 2.0 Service Provider Configuration (RFC 7643 Section 5).
 *
 * Path: /scim/v2/ServiceProviderConfig
 *
 * Returned as a plain ObjectNode so no null id/externalId attributes are added.
 * meta.location is taken from the request URL so it matches the public URL behind proxies.
 */
@Path("/ServiceProviderConfig")
@Produces({"application/scim+json", "application/json"})
public class ServiceProviderConfigEndpoint {

    private static final Logger LOGGER = Logger.getLogger(ServiceProviderConfigEndpoint.class.getName());

    private static final String SERVICE_PROVIDER_CONFIG_ID = "ServiceProviderConfig";

    private final int maxResults;

    public ServiceProviderConfigEndpoint() {
        this(ScimServerConfig.getInstance().getMaxCount());
    }

    ServiceProviderConfigEndpoint(int maxResults) {
        this.maxResults = maxResults;
    }

    /**
     * GET /ServiceProviderConfig
     *
     * @param uriInfo injected by JAX-RS to get the actual request URI
     * @return the service provider configuration
     */
    @GET
    public Response getServiceProviderConfig(@Context UriInfo uriInfo) {
        LOGGER.fine("Getting service provider configuration");
        return Response.ok(buildServiceProviderConfig(uriInfo.getAbsolutePath().toString())).build();
    }

    ObjectNode buildServiceProviderConfig(String location) {
        ObjectNode spConfig = JsonNodeFactory.instance.objectNode();

        ArrayNode schemas = spConfig.putArray("schemas");
        schemas.add(ScimSchemaUrns.SERVICE_PROVIDER_CONFIG);
        spConfig.put("id", SERVICE_PROVIDER_CONFIG_ID);
        spConfig.put("documentationUri", "https://datatracker.ietf.org/doc/html/rfc7644");

        // PATCH application is not offered
        spConfig.putObject("patch").put("supported", false);

        ObjectNode bulk = spConfig.putObject("bulk");
        bulk.put("supported", false);
        bulk.put("maxOperations", 0);
        bulk.put("maxPayloadSize", 0);

        ObjectNode filter = spConfig.putObject("filter");
        filter.put("supported", true);
        filter.put("maxResults", maxResults);

        spConfig.putObject("changePassword").put("supported", false);
        spConfig.putObject("sort").put("supported", false);
        spConfig.putObject("etag").put("supported", false);

        // Authentication is terminated in front of this server
        spConfig.putArray("authenticationSchemes");

        ObjectNode meta = spConfig.putObject("meta");
        meta.put("resourceType", "ServiceProviderConfig");
        meta.put("location", location);
        return spConfig;
    }
}
