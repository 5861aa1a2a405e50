package com.scimserver.scim.endpoints;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;

import java.net.URI;

/**
 * Builds the public base URL of an endpoint, e.g. {@code https://host/scim/v2/endpoints/e1}.
 *
 * <p>{@code X-Forwarded-Proto} and {@code X-Forwarded-Host} override the scheme and host
 * of the request URI so locations stay correct behind a proxy.</p>
 */
final class ScimBaseUrl {

    static final String FORWARDED_PROTO = "X-Forwarded-Proto";
    static final String FORWARDED_HOST = "X-Forwarded-Host";

    private ScimBaseUrl() {
    }

    static String forEndpoint(UriInfo uriInfo, HttpHeaders headers, String endpointId) {
        URI base = uriInfo.getBaseUri();
        String scheme = base.getScheme();
        String authority = base.getRawAuthority();

        if (headers != null) {
            String proto = firstValue(headers.getHeaderString(FORWARDED_PROTO));
            String host = firstValue(headers.getHeaderString(FORWARDED_HOST));
            if (proto != null) {
                scheme = proto;
            }
            if (host != null) {
                authority = host;
            }
        }

        String path = base.getRawPath() != null ? base.getRawPath() : "";
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return scheme + "://" + authority + path + "/endpoints/" + endpointId;
    }

    // proxies may append a comma-separated chain
    private static String firstValue(String header) {
        if (header == null || header.trim().isEmpty()) {
            return null;
        }
        int comma = header.indexOf(',');
        return (comma == -1 ? header : header.substring(0, comma)).trim();
    }
}
