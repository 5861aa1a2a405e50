package com.scimserver.scim.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.ws.rs.ext.ContextResolver;
import jakarta.ws.rs.ext.Provider;

/**
 * Jackson ObjectMapper used by every JAX-RS endpoint.
 *
 * <p>RFC 7643 Section 2.5: unassigned attributes are represented by their absence,
 * so null values are never serialized. This also keeps the null {@code id},
 * {@code externalId} and {@code meta} of the SDK's ListResponse out of list output.</p>
 */
@Provider
public class ScimObjectMapperProvider implements ContextResolver<ObjectMapper> {

    private final ObjectMapper objectMapper;

    public ScimObjectMapperProvider() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * Returns the configured ObjectMapper for the given type.
     *
     * @param type the class type being serialized/deserialized
     * @return the configured ObjectMapper instance
     */
    @Override
    public ObjectMapper getContext(Class<?> type) {
        return objectMapper;
    }

    /**
     * Get the configured ObjectMapper for use outside JAX-RS.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
