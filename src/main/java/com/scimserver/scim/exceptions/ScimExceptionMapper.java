package com.scimserver.scim.exceptions;

import com.unboundid.scim2.common.exceptions.ScimException;
import com.unboundid.scim2.common.messages.ErrorResponse;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JAX-RS exception mapper for SCIM exceptions.
 *
 * Converts ScimException instances thrown by endpoints or services into
 * RFC 7644 Section 3.12 error responses.
 */
@Provider
public class ScimExceptionMapper implements ExceptionMapper<ScimException> {

    static final String SCIM_MEDIA_TYPE = "application/scim+json";

    private static final Logger LOGGER = Logger.getLogger(ScimExceptionMapper.class.getName());

    private final ScimErrorResponseBuilder errorBuilder;

    public ScimExceptionMapper() {
        this.errorBuilder = new ScimErrorResponseBuilder();
    }

    /**
     * Convert a ScimException to an HTTP Response.
     *
     * @param exception the SCIM exception
     * @return HTTP response with SCIM error format
     */
    @Override
    public Response toResponse(ScimException exception) {
        ErrorResponse scimError = exception.getScimError();
        int statusCode = scimError.getStatus();

        if (statusCode >= 500) {
            LOGGER.log(Level.SEVERE, "SCIM request failed: " + exception.getMessage(), exception);
        } else {
            LOGGER.warning("SCIM request rejected (" + statusCode + "): " + exception.getMessage());
        }

        String detail = scimError.getDetail() != null ? scimError.getDetail() : exception.getMessage();
        String scimType = scimError.getScimType() != null ? scimError.getScimType() : inferScimType(detail);

        return Response.status(statusCode)
                .entity(errorBuilder.buildErrorResponse(statusCode, detail, scimType))
                .type(SCIM_MEDIA_TYPE)
                .build();
    }

    /**
     * Guess the scimType of an exception raised without one.
     */
    private String inferScimType(String detail) {
        String message = detail != null ? detail.toLowerCase(Locale.ROOT) : "";

        if (message.contains("filter")) {
            return "invalidFilter";
        } else if (message.contains("unique")) {
            return "uniqueness";
        } else if (message.contains("syntax")) {
            return "invalidSyntax";
        } else if (message.contains("path")) {
            return "invalidPath";
        }
        return null;
    }
}
