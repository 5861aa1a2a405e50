package com.scimserver.scim.exceptions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.schema.ScimSchemaUrns;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builder for SCIM-compliant error responses.
 *
 * SCIM error responses follow the format defined in RFC 7644 Section 3.12:
 * {
 *   "schemas": ["urn:ietf:params:scim:api:messages:2.0:Error"],
 *   "status": "400",
 *   "scimType": "invalidFilter",
 *   "detail": "Unsupported or invalid filter expression: 'userName eq'."
 * }
 */
public class ScimErrorResponseBuilder {

    private static final Logger LOGGER = Logger.getLogger(ScimErrorResponseBuilder.class.getName());

    private static final int MAX_DETAIL_LENGTH = 500;

    private final ObjectMapper objectMapper;

    public ScimErrorResponseBuilder() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Build a SCIM error response with status code, detail message, and SCIM type.
     *
     * @param statusCode the HTTP status code
     * @param detail the error detail message
     * @param scimType the SCIM error type (optional, can be null)
     * @return JSON string representing the SCIM error response
     */
    public String buildErrorResponse(int statusCode, String detail, String scimType) {
        try {
            return objectMapper.writeValueAsString(buildErrorResponseNode(statusCode, detail, scimType));
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.SEVERE, "Failed to build SCIM error response", e);
            return buildFallbackErrorResponse(statusCode);
        }
    }

    /**
     * Build an error response object node.
     *
     * @param statusCode the HTTP status code
     * @param detail the error detail message
     * @param scimType the SCIM error type (optional)
     * @return ObjectNode representing the error response
     */
    public ObjectNode buildErrorResponseNode(int statusCode, String detail, String scimType) {
        ObjectNode errorNode = objectMapper.createObjectNode();

        ArrayNode schemas = errorNode.putArray("schemas");
        schemas.add(ScimSchemaUrns.ERROR);

        // status is a string in SCIM error bodies
        errorNode.put("status", String.valueOf(statusCode));

        if (scimType != null && !scimType.trim().isEmpty()) {
            errorNode.put("scimType", scimType);
        }

        if (detail != null && !detail.trim().isEmpty()) {
            errorNode.put("detail", sanitizeDetail(detail));
        } else {
            errorNode.put("detail", getDefaultDetailForStatus(statusCode));
        }
        return errorNode;
    }

    /**
     * Remove control characters and cap the length of a detail message.
     */
    private String sanitizeDetail(String detail) {
        String sanitized = detail.replaceAll("[\\p{Cntrl}&&[^\r\n\t]]", "");
        if (sanitized.length() > MAX_DETAIL_LENGTH) {
            sanitized = sanitized.substring(0, MAX_DETAIL_LENGTH - 3) + "...";
        }
        return sanitized;
    }

    private String getDefaultDetailForStatus(int statusCode) {
        return switch (statusCode) {
            case 400 -> "Bad Request: The request is malformed or contains invalid data";
            case 404 -> "Not Found: The specified resource does not exist";
            case 409 -> "Conflict: The request could not be completed due to a conflict with the current state of the resource";
            case 500 -> "Internal Server Error: An unexpected error occurred on the server";
            case 501 -> "Not Implemented: The requested operation is not supported";
            default -> "An error occurred while processing the request";
        };
    }

    private String buildFallbackErrorResponse(int statusCode) {
        return String.format(
                "{\"schemas\":[\"%s\"],\"status\":\"%d\",\"detail\":\"%s\"}",
                ScimSchemaUrns.ERROR,
                statusCode,
                getDefaultDetailForStatus(statusCode));
    }
}
