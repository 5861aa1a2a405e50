package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.exceptions.InvalidFilterException;
import com.scimserver.scim.repository.ScimResourceRecord;
import com.scimserver.scim.schema.ScimResourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for ScimDbFilterBuilder.
 */
class ScimDbFilterBuilderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should return an empty predicate without fetch-all when there is no filter")
    void testBuild_NoFilter() throws InvalidFilterException {
        for (String filter : new String[] {null, "", "   "}) {
            DbFilterResult result = ScimDbFilterBuilder.buildUserFilter(filter);

            assertThat(result.getDbPredicate()).isEmpty();
            assertThat(result.isFetchAll()).isFalse();
            assertThat(result.getInMemoryFilter()).isNull();
        }
    }

    @Test
    @DisplayName("Should push a userName equality down with the value unchanged")
    void testBuild_UserNamePushDown() throws InvalidFilterException {
        // Given: an Entra-style lookup with mixed case
        String filter = "userName eq \"John.Doe@example.com\"";

        // When: Planning the filter
        DbFilterResult result = ScimDbFilterBuilder.buildUserFilter(filter);

        // Then: Pushed to the userName column, not lowercased
        assertThat(result.getDbPredicate()).containsExactly(entry("userName", "John.Doe@example.com"));
        assertThat(result.isFetchAll()).isFalse();
        assertThat(result.getInMemoryFilter()).isNull();
    }

    @Test
    @DisplayName("Should map attribute names ignoring case")
    void testBuild_ColumnMappingCaseInsensitive() throws InvalidFilterException {
        assertThat(ScimDbFilterBuilder.buildUserFilter("EXTERNALID eq \"ext-1\"").getDbPredicate())
                .containsExactly(entry("externalId", "ext-1"));
        assertThat(ScimDbFilterBuilder.buildUserFilter("id eq \"abc\"").getDbPredicate())
                .containsExactly(entry("scimId", "abc"));
        assertThat(ScimDbFilterBuilder.buildGroupFilter("displayname eq \"Admins\"").getDbPredicate())
                .containsExactly(entry("displayName", "Admins"));
    }

    @Test
    @DisplayName("Should pass numbers and booleans through as storage values")
    void testBuild_NonStringValues() throws InvalidFilterException {
        assertThat(ScimDbFilterBuilder.buildUserFilter("externalId eq 42").getDbPredicate())
                .containsExactly(entry("externalId", 42));
        assertThat(ScimDbFilterBuilder.buildUserFilter("externalId eq true").getDbPredicate())
                .containsExactly(entry("externalId", true));
    }

    @Test
    @DisplayName("Should fall back to in-memory evaluation for non-equality operators")
    void testBuild_ContainsFallsBack() throws InvalidFilterException {
        DbFilterResult result = ScimDbFilterBuilder.buildUserFilter("userName co \"john\"");

        assertThat(result.getDbPredicate()).isEmpty();
        assertThat(result.isFetchAll()).isTrue();
        assertThat(result.getInMemoryFilter()).isNotNull();
    }

    @Test
    @DisplayName("Should fall back for logical filters, unmapped attributes and null values")
    void testBuild_OtherFallbacks() throws InvalidFilterException {
        assertThat(ScimDbFilterBuilder.buildUserFilter("userName eq \"a\" and active eq true").isFetchAll()).isTrue();
        assertThat(ScimDbFilterBuilder.buildUserFilter("displayName eq \"John\"").isFetchAll()).isTrue();
        assertThat(ScimDbFilterBuilder.buildGroupFilter("userName eq \"john\"").isFetchAll()).isTrue();
        assertThat(ScimDbFilterBuilder.buildUserFilter("externalId eq null").isFetchAll()).isTrue();
        assertThat(ScimDbFilterBuilder.buildUserFilter("not (userName eq \"a\")").isFetchAll()).isTrue();
        assertThat(ScimDbFilterBuilder.buildUserFilter("emails[type eq \"work\"]").isFetchAll()).isTrue();
    }

    @Test
    @DisplayName("Should use a caller-supplied column map")
    void testBuild_CustomColumnMap() throws InvalidFilterException {
        ScimDbFilterBuilder builder = new ScimDbFilterBuilder(Map.of("Title", "job_title"));

        assertThat(builder.build("title eq \"Engineer\"").getDbPredicate())
                .containsExactly(entry("job_title", "Engineer"));
        assertThat(builder.getColumn("TITLE")).isEqualTo("job_title");
        assertThat(builder.getColumn("userName")).isNull();
    }

    @Test
    @DisplayName("Should wrap parser errors with the offending filter")
    void testBuild_InvalidFilter() {
        assertThatThrownBy(() -> ScimDbFilterBuilder.buildUserFilter("userName eq \"john"))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageStartingWith("Invalid filter: userName eq \"john")
                .hasMessageContaining("Unterminated");
    }

    @Test
    @DisplayName("Should select the same resources whether pushed down or evaluated in memory")
    void testBuild_PushDownAgreesWithEvaluator() throws Exception {
        List<JsonNode> users = List.of(
                objectMapper.readTree("{\"userName\":\"John.Doe@example.com\",\"externalId\":\"e1\"}"),
                objectMapper.readTree("{\"userName\":\"jane@example.com\",\"externalId\":\"e2\"}"),
                objectMapper.readTree("{\"userName\":\"JOHN.DOE@EXAMPLE.COM\",\"externalId\":\"E1\"}"));

        for (String filter : new String[] {"userName eq \"john.doe@example.com\"", "externalId eq \"e1\""}) {
            DbFilterResult pushed = ScimDbFilterBuilder.buildUserFilter(filter);
            Map.Entry<String, Object> predicate = pushed.getDbPredicate().entrySet().iterator().next();

            List<JsonNode> byColumn = users.stream()
                    .filter(u -> recordOf(u).columnMatches(predicate.getKey(), predicate.getValue()))
                    .collect(Collectors.toList());

            FilterNode ast = ScimFilterParser.parse(filter);
            List<JsonNode> byEvaluator = users.stream()
                    .filter(u -> ScimFilterEvaluator.evaluate(ast, u))
                    .collect(Collectors.toList());

            assertThat(byColumn).as(filter).isEqualTo(byEvaluator).hasSize(2);
        }
    }

    private static ScimResourceRecord recordOf(JsonNode user) {
        return new ScimResourceRecord("e1", ScimResourceType.USER, "id", user.get("externalId").asText(),
                user.get("userName").asText(), null, (ObjectNode) user, Instant.EPOCH, Instant.EPOCH, 1L);
    }

    @Test
    @DisplayName("Should evaluate the fallback predicate against rendered resources")
    void testBuild_InMemoryPredicate() throws Exception {
        DbFilterResult result = ScimDbFilterBuilder.buildUserFilter("userName co \"john\"");

        assertThat(result.matches(objectMapper.readTree("{\"userName\":\"Big.JOHN\"}"))).isTrue();
        assertThat(result.matches(objectMapper.readTree("{\"userName\":\"jane\"}"))).isFalse();
    }
}
