package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AttributePathResolver.
 */
class AttributePathResolverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode user;

    @BeforeEach
    void setUp() throws Exception {
        user = objectMapper.readTree("{"
                + "\"userName\":\"john\","
                + "\"name\":{\"givenName\":\"John\",\"familyName\":\"Doe\"},"
                + "\"emails\":[{\"value\":\"john@example.com\",\"type\":\"work\"}],"
                + "\"nickName\":null,"
                + "\"urn:ietf:params:scim:schemas:extension:enterprise:2.0:User\":{\"department\":\"Sales\","
                + "\"manager\":{\"value\":\"m1\"}}"
                + "}");
    }

    @Test
    @DisplayName("Should resolve simple and dotted paths ignoring case")
    void testResolve_CaseInsensitive() {
        assertThat(AttributePathResolver.resolve(user, "USERNAME").textValue()).isEqualTo("john");
        assertThat(AttributePathResolver.resolve(user, "name.givenname").textValue()).isEqualTo("John");
        assertThat(AttributePathResolver.resolve(user, "Name.FamilyName").textValue()).isEqualTo("Doe");
    }

    @Test
    @DisplayName("Should resolve URN-qualified extension attributes")
    void testResolve_Urn() {
        assertThat(AttributePathResolver.resolve(user,
                "urn:ietf:params:scim:schemas:extension:enterprise:2.0:User:department").textValue())
                .isEqualTo("Sales");
        assertThat(AttributePathResolver.resolve(user,
                "urn:ietf:params:scim:schemas:extension:enterprise:2.0:user:manager.value").textValue())
                .isEqualTo("m1");
    }

    @Test
    @DisplayName("Should return null for missing segments and not traverse arrays")
    void testResolve_Missing() {
        assertThat(AttributePathResolver.resolve(user, "title")).isNull();
        assertThat(AttributePathResolver.resolve(user, "name.middleName")).isNull();
        assertThat(AttributePathResolver.resolve(user, "userName.first")).isNull();
        assertThat(AttributePathResolver.resolve(user, "emails.value")).isNull();
        assertThat(AttributePathResolver.resolve(user,
                "urn:ietf:params:scim:schemas:extension:other:2.0:User:department")).isNull();
    }

    @Test
    @DisplayName("Should return the array itself for a multi-valued attribute")
    void testResolve_Array() {
        assertThat(AttributePathResolver.resolve(user, "emails").isArray()).isTrue();
    }

    @Test
    @DisplayName("Should distinguish a JSON null attribute from a missing one")
    void testResolve_JsonNull() {
        assertThat(AttributePathResolver.resolve(user, "nickName").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should pick the first key in field order when keys differ only by case")
    void testFindKey_DuplicateCase() throws Exception {
        JsonNode node = objectMapper.readTree("{\"Title\":\"first\",\"title\":\"second\"}");

        assertThat(AttributePathResolver.findKey(node, "TITLE")).isEqualTo("Title");
        assertThat(AttributePathResolver.resolve(node, "title").textValue()).isEqualTo("first");
    }

    @Test
    @DisplayName("Should split URN paths into schema and attribute")
    void testSplitUrnPath() {
        assertThat(AttributePathResolver.splitUrnPath(
                "urn:ietf:params:scim:schemas:extension:enterprise:2.0:User:department"))
                .containsExactly("urn:ietf:params:scim:schemas:extension:enterprise:2.0:User", "department");
        assertThat(AttributePathResolver.splitUrnPath("name.givenName")).isNull();
    }
}
