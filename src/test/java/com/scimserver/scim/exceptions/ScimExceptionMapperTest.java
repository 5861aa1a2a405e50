package com.scimserver.scim.exceptions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scimserver.scim.schema.ScimSchemaUrns;
import com.unboundid.scim2.common.exceptions.BadRequestException;
import com.unboundid.scim2.common.exceptions.ResourceConflictException;
import com.unboundid.scim2.common.exceptions.ResourceNotFoundException;
import com.unboundid.scim2.common.exceptions.ServerErrorException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ScimExceptionMapper.
 */
class ScimExceptionMapperTest {

    private final ScimExceptionMapper mapper = new ScimExceptionMapper();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode body(Response response) throws Exception {
        return objectMapper.readTree((String) response.getEntity());
    }

    @Test
    @DisplayName("Should map an invalid filter to 400 invalidFilter")
    void testInvalidFilter() throws Exception {
        // Act
        Response response = mapper.toResponse(
                BadRequestException.invalidFilter("Unsupported or invalid filter expression: 'userName eq'."));

        // Assert
        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(response.getMediaType().toString()).isEqualTo(ScimExceptionMapper.SCIM_MEDIA_TYPE);
        JsonNode error = body(response);
        assertThat(error.path("schemas").get(0).asText()).isEqualTo(ScimSchemaUrns.ERROR);
        assertThat(error.path("status").asText()).isEqualTo("400");
        assertThat(error.path("scimType").asText()).isEqualTo("invalidFilter");
        assertThat(error.path("detail").asText()).contains("userName eq");
    }

    @Test
    @DisplayName("Should map not found to 404 without scimType")
    void testNotFound() throws Exception {
        // Act
        Response response = mapper.toResponse(new ResourceNotFoundException("Resource u1 not found."));

        // Assert
        assertThat(response.getStatus()).isEqualTo(404);
        JsonNode error = body(response);
        assertThat(error.has("scimType")).isFalse();
        assertThat(error.path("detail").asText()).isEqualTo("Resource u1 not found.");
    }

    @Test
    @DisplayName("Should infer uniqueness for a conflict")
    void testConflict() throws Exception {
        // Act
        Response response = mapper.toResponse(
                new ResourceConflictException("A resource with userName 'john' already exists; values must be unique."));

        // Assert
        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(body(response).path("scimType").asText()).isEqualTo("uniqueness");
    }

    @Test
    @DisplayName("Should map server errors to 500")
    void testServerError() throws Exception {
        // Act
        Response response = mapper.toResponse(new ServerErrorException("storage unavailable"));

        // Assert
        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response).path("status").asText()).isEqualTo("500");
    }
}
