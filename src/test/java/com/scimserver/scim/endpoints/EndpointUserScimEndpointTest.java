package com.scimserver.scim.endpoints;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.schema.ScimResourceType;
import com.scimserver.scim.service.EndpointScimService;
import com.unboundid.scim2.common.GenericScimResource;
import com.unboundid.scim2.common.exceptions.BadRequestException;
import com.unboundid.scim2.common.exceptions.ResourceNotFoundException;
import com.unboundid.scim2.common.messages.ListResponse;
import com.unboundid.scim2.common.messages.SearchRequest;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EndpointUserScimEndpoint.
 */
@ExtendWith(MockitoExtension.class)
class EndpointUserScimEndpointTest {

    private static final String BASE_URL = "http://localhost:8080/scim/v2/endpoints/e1";

    @Mock
    private EndpointScimService scimService;

    @Mock
    private UriInfo uriInfo;

    @Mock
    private HttpHeaders httpHeaders;

    @InjectMocks
    private EndpointUserScimEndpoint endpoint;

    private void stubBaseUri() {
        when(uriInfo.getBaseUri()).thenReturn(URI.create("http://localhost:8080/scim/v2/"));
    }

    @Test
    @DisplayName("Should list Users with query parameters passed through")
    void testList_Success() throws Exception {
        // Arrange
        stubBaseUri();
        ListResponse<GenericScimResource> listResponse = new ListResponse<>(0, new ArrayList<>(), 1, 0);
        when(scimService.listResources("e1", ScimResourceType.USER, "userName eq \"john\"", 1, 10,
                "userName", null, BASE_URL)).thenReturn(listResponse);

        // Act
        Response response = endpoint.list("e1", "userName eq \"john\"", 1, 10, "userName", null);

        // Assert
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isSameAs(listResponse);
    }

    @Test
    @DisplayName("Should build base URL from forwarded headers")
    void testList_ForwardedHeaders() throws Exception {
        // Arrange
        stubBaseUri();
        when(httpHeaders.getHeaderString("X-Forwarded-Proto")).thenReturn("https");
        when(httpHeaders.getHeaderString("X-Forwarded-Host")).thenReturn("scim.example.com");
        when(scimService.listResources(anyString(), any(), isNull(), isNull(), isNull(), isNull(), isNull(),
                anyString())).thenReturn(new ListResponse<>(0, new ArrayList<>(), 1, 0));

        // Act
        endpoint.list("e1", null, null, null, null, null);

        // Assert
        verify(scimService).listResources(eq("e1"), eq(ScimResourceType.USER), isNull(), isNull(), isNull(),
                isNull(), isNull(), eq("https://scim.example.com/scim/v2/endpoints/e1"));
    }

    @Test
    @DisplayName("Should parse a SearchRequest body")
    void testSearch_Success() throws Exception {
        // Arrange
        stubBaseUri();
        when(scimService.search(eq("e1"), eq(ScimResourceType.USER), any(SearchRequest.class), eq(BASE_URL)))
                .thenReturn(new ListResponse<>(0, new ArrayList<>(), 1, 0));
        String body = "{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:SearchRequest\"],"
                + "\"filter\":\"userName sw \\\"j\\\"\",\"startIndex\":2,\"count\":5,"
                + "\"attributes\":[\"userName\"]}";

        // Act
        Response response = endpoint.search("e1", body);

        // Assert
        assertThat(response.getStatus()).isEqualTo(200);
        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(scimService).search(eq("e1"), eq(ScimResourceType.USER), captor.capture(), eq(BASE_URL));
        assertThat(captor.getValue().getFilter()).isEqualTo("userName sw \"j\"");
        assertThat(captor.getValue().getStartIndex()).isEqualTo(2);
        assertThat(captor.getValue().getCount()).isEqualTo(5);
        assertThat(captor.getValue().getAttributes()).containsExactly("userName");
    }

    @Test
    @DisplayName("Should reject a malformed SearchRequest body")
    void testSearch_InvalidBody() {
        // Act & Assert
        assertThatThrownBy(() -> endpoint.search("e1", "{not json"))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(scimService);
    }

    @Test
    @DisplayName("Should get a User by id")
    void testGet_Success() throws Exception {
        // Arrange
        stubBaseUri();
        GenericScimResource user = new GenericScimResource(JsonNodeFactory.instance.objectNode().put("id", "u1"));
        when(scimService.getResource("e1", ScimResourceType.USER, "u1", null, "emails", BASE_URL))
                .thenReturn(user);

        // Act
        Response response = endpoint.get("e1", "u1", null, "emails");

        // Assert
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isSameAs(user);
    }

    @Test
    @DisplayName("Should propagate not found from the service")
    void testGet_NotFound() throws Exception {
        // Arrange
        stubBaseUri();
        when(scimService.getResource("e1", ScimResourceType.USER, "missing", null, null, BASE_URL))
                .thenThrow(new ResourceNotFoundException("Resource missing not found."));

        // Act & Assert
        assertThatThrownBy(() -> endpoint.get("e1", "missing", null, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Should return 201 with Location on create")
    void testCreate_Success() throws Exception {
        // Arrange
        stubBaseUri();
        ObjectNode created = JsonNodeFactory.instance.objectNode().put("id", "u1");
        created.putObject("meta").put("location", BASE_URL + "/Users/u1");
        when(scimService.createResource(eq("e1"), eq(ScimResourceType.USER), any(ObjectNode.class), eq(BASE_URL)))
                .thenReturn(new GenericScimResource(created));

        // Act
        Response response = endpoint.create("e1", "{\"userName\":\"john\"}");

        // Assert
        assertThat(response.getStatus()).isEqualTo(201);
        assertThat(response.getHeaderString("Location")).isEqualTo(BASE_URL + "/Users/u1");
        ArgumentCaptor<ObjectNode> captor = ArgumentCaptor.forClass(ObjectNode.class);
        verify(scimService).createResource(eq("e1"), eq(ScimResourceType.USER), captor.capture(), eq(BASE_URL));
        assertThat(captor.getValue().path("userName").asText()).isEqualTo("john");
    }

    @Test
    @DisplayName("Should reject invalid JSON and non-object bodies on create")
    void testCreate_InvalidBody() {
        // Act & Assert
        assertThatThrownBy(() -> endpoint.create("e1", "{\"userName\":"))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Invalid JSON");
        assertThatThrownBy(() -> endpoint.create("e1", "[1,2]"))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("JSON object");
        verifyNoInteractions(scimService);
    }

    @Test
    @DisplayName("Should bind the User resource type")
    void testResourceType() {
        assertThat(endpoint.getResourceType()).isEqualTo(ScimResourceType.USER);
        assertThat(new EndpointGroupScimEndpoint().getResourceType()).isEqualTo(ScimResourceType.GROUP);
    }
}
