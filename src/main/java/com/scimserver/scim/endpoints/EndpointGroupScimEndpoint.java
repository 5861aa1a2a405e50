package com.scimserver.scim.endpoints;

import com.scimserver.scim.schema.ScimResourceType;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;

/**
 * SCIM Group resources of one endpoint (tenant).
 *
 * <p>Path: /scim/v2/endpoints/{endpointId}/Groups</p>
 */
@Path("/endpoints/{endpointId}/Groups")
@Produces({"application/scim+json", "application/json"})
@Consumes({"application/scim+json", "application/json"})
public class EndpointGroupScimEndpoint extends AbstractEndpointScimEndpoint {

    @Override
    protected ScimResourceType getResourceType() {
        return ScimResourceType.GROUP;
    }
}
