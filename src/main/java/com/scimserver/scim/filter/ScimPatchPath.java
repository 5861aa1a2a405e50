package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.scimserver.scim.exceptions.InvalidFilterException;
import com.unboundid.scim2.common.exceptions.BadRequestException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Parsed SCIM PATCH {@code path} (RFC 7644 Section 3.5.2).
 *
 * <p>Supported forms:</p>
 * <ul>
 *   <li>Attribute: {@code displayName}, {@code name.givenName}</li>
 *   <li>Extension attribute: {@code urn:ietf:params:scim:schemas:extension:enterprise:2.0:User:manager}</li>
 *   <li>Value path: {@code emails[type eq "work"]}, {@code emails[type eq "work" and primary eq true].value}</li>
 * </ul>
 *
 * <p>Any filter accepted by {@link ScimFilterParser} may appear inside the brackets.
 * This class only locates the targeted values; it does not apply operations.</p>
 */
public final class ScimPatchPath {

    private static final Logger LOGGER = Logger.getLogger(ScimPatchPath.class.getName());

    private static final String NAME = "[A-Za-z_$][A-Za-z0-9_$-]*";
    private static final Pattern ATTRIBUTE_PATH = Pattern.compile("^" + NAME + "(\\." + NAME + ")*$");
    private static final Pattern SUB_ATTRIBUTE = Pattern.compile("^" + NAME + "$");

    private final String attributePath;
    private final FilterNode valueFilter;
    private final String subAttribute;

    private ScimPatchPath(String attributePath, FilterNode valueFilter, String subAttribute) {
        this.attributePath = attributePath;
        this.valueFilter = valueFilter;
        this.subAttribute = subAttribute;
    }

    /**
     * Parse a PATCH path.
     *
     * @param path the path from a PATCH operation
     * @return the parsed path
     * @throws BadRequestException with scimType {@code invalidPath} if the path is malformed
     */
    public static ScimPatchPath parse(String path) throws BadRequestException {
        if (path == null || path.trim().isEmpty()) {
            throw BadRequestException.invalidPath("PATCH path cannot be empty");
        }
        String trimmed = path.trim();

        int open = trimmed.indexOf('[');
        if (open == -1) {
            if (trimmed.indexOf(']') != -1 || !isAttributePath(trimmed)) {
                throw BadRequestException.invalidPath("Invalid PATCH path: '" + path + "'");
            }
            return new ScimPatchPath(trimmed, null, null);
        }

        int close = trimmed.lastIndexOf(']');
        if (close < open) {
            throw BadRequestException.invalidPath("Unbalanced brackets in PATCH path: '" + path + "'");
        }

        String attribute = trimmed.substring(0, open).trim();
        if (!isAttributePath(attribute)) {
            throw BadRequestException.invalidPath("Invalid attribute in PATCH path: '" + path + "'");
        }

        String remainder = trimmed.substring(close + 1);
        String sub = null;
        if (!remainder.isEmpty()) {
            if (!remainder.startsWith(".") || !SUB_ATTRIBUTE.matcher(remainder.substring(1)).matches()) {
                throw BadRequestException.invalidPath("Invalid sub-attribute in PATCH path: '" + path + "'");
            }
            sub = remainder.substring(1);
        }

        FilterNode filter;
        try {
            filter = ScimFilterParser.parse(trimmed.substring(open + 1, close));
        } catch (InvalidFilterException e) {
            LOGGER.fine("Rejected PATCH path '" + path + "': " + e.getMessage());
            throw BadRequestException.invalidPath("Invalid filter in PATCH path '" + path + "': " + e.getMessage());
        }
        return new ScimPatchPath(attribute, filter, sub);
    }

    private static boolean isAttributePath(String candidate) {
        return ATTRIBUTE_PATH.matcher(candidate).matches() || AttributePathResolver.splitUrnPath(candidate) != null;
    }

    /**
     * Select the values this path targets in a resource.
     *
     * <p>For a value path, the matching object elements of the multi-valued attribute
     * (or their sub-attribute when one is given). Otherwise the attribute value itself.
     * Missing and null values are never selected.</p>
     *
     * @param resource the resource
     * @return the targeted values, possibly empty
     */
    public List<JsonNode> select(JsonNode resource) {
        JsonNode value = AttributePathResolver.resolve(resource, attributePath);
        if (!isValuePath()) {
            return isMissing(value) ? Collections.emptyList() : Collections.singletonList(value);
        }
        if (value == null || !value.isArray()) {
            return Collections.emptyList();
        }

        List<JsonNode> selected = new ArrayList<>();
        for (JsonNode element : value) {
            if (!element.isObject() || !ScimFilterEvaluator.evaluate(valueFilter, element)) {
                continue;
            }
            JsonNode target = subAttribute == null
                    ? element
                    : AttributePathResolver.getIgnoreCase(element, subAttribute);
            if (!isMissing(target)) {
                selected.add(target);
            }
        }
        return selected;
    }

    private static boolean isMissing(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    public boolean isValuePath() {
        return valueFilter != null;
    }

    public boolean isExtensionPath() {
        return AttributePathResolver.splitUrnPath(attributePath) != null;
    }

    /**
     * @return the attribute (or multi-valued attribute) the path starts from
     */
    public String getAttributePath() {
        return attributePath;
    }

    /**
     * @return the bracket filter, or {@code null} if this is not a value path
     */
    public FilterNode getValueFilter() {
        return valueFilter;
    }

    /**
     * @return the sub-attribute after the closing bracket, or {@code null}
     */
    public String getSubAttribute() {
        return subAttribute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScimPatchPath that = (ScimPatchPath) o;
        return attributePath.equals(that.attributePath)
                && Objects.equals(valueFilter, that.valueFilter)
                && Objects.equals(subAttribute, that.subAttribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributePath, valueFilter, subAttribute);
    }

    @Override
    public String toString() {
        if (!isValuePath()) {
            return attributePath;
        }
        return attributePath + "[" + valueFilter + "]" + (subAttribute != null ? "." + subAttribute : "");
    }
}
