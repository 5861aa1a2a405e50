package com.scimserver.scim.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scimserver.scim.filter.AttributePathResolver;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SCIM attribute projection (RFC 7644 Section 3.4.2.5).
 *
 * <p>Implements the {@code attributes} and {@code excludedAttributes} query
 * parameters of list, search and get operations:</p>
 * <ul>
 *   <li>{@code attributes}: only the named attributes are returned, plus the
 *       always-returned {@code schemas}, {@code id} and {@code meta}.</li>
 *   <li>{@code excludedAttributes}: the named attributes are removed from the
 *       default set; always-returned attributes cannot be removed.</li>
 *   <li>If both are present, {@code attributes} wins.</li>
 * </ul>
 *
 * <p>Both parameters are comma-separated and case-insensitive. Sub-attributes are
 * addressed as {@code name.givenName}; extension attributes as
 * {@code urn:ietf:params:scim:schemas:extension:enterprise:2.0:User:department}.
 * Output keeps the resource's key casing and order. The input is never modified.</p>
 */
public final class ScimAttributeProjector {

    /** Attributes with "returned": "always" (RFC 7643 Section 7). */
    static final Set<String> ALWAYS_RETURNED = Set.of("schemas", "id", "meta");

    private ScimAttributeProjector() {
    }

    /**
     * Apply attribute projection to a single resource.
     *
     * @param resource the full SCIM resource
     * @param attributes comma-separated attributes to include, may be null
     * @param excludedAttributes comma-separated attributes to exclude, may be null
     * @return the projected resource; the input itself when no projection applies
     */
    public static ObjectNode applyAttributeProjection(ObjectNode resource, String attributes,
                                                      String excludedAttributes) {
        Set<String> included = parseAttrList(attributes);
        if (!included.isEmpty()) {
            return includeOnly(resource, included);
        }
        Set<String> excluded = parseAttrList(excludedAttributes);
        if (!excluded.isEmpty()) {
            return exclude(resource, excluded);
        }
        return resource;
    }

    /**
     * Apply attribute projection to every resource of a list response.
     *
     * @return a new list of projected resources; the input list when no projection applies
     */
    public static List<ObjectNode> applyAttributeProjectionToList(List<ObjectNode> resources, String attributes,
                                                                  String excludedAttributes) {
        if (parseAttrList(attributes).isEmpty() && parseAttrList(excludedAttributes).isEmpty()) {
            return resources;
        }
        List<ObjectNode> projected = new ArrayList<>(resources.size());
        for (ObjectNode resource : resources) {
            projected.add(applyAttributeProjection(resource, attributes, excludedAttributes));
        }
        return projected;
    }

    /**
     * Split a parameter value into trimmed, lowercased, non-empty names.
     */
    static Set<String> parseAttrList(String raw) {
        Set<String> names = new LinkedHashSet<>();
        if (raw == null) {
            return names;
        }
        for (String part : raw.split(",")) {
            String name = part.trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static ObjectNode includeOnly(ObjectNode resource, Set<String> attrs) {
        Map<String, Set<String>> selection = groupByTopLevel(resource, attrs, false);
        ObjectNode result = resource.objectNode();

        Iterator<Map.Entry<String, JsonNode>> fields = resource.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String lower = field.getKey().toLowerCase(Locale.ROOT);

            if (ALWAYS_RETURNED.contains(lower)) {
                result.set(field.getKey(), field.getValue());
                continue;
            }
            if (!selection.containsKey(lower)) {
                continue;
            }

            Set<String> subs = selection.get(lower);
            JsonNode value = field.getValue();
            if (subs == null || !value.isObject()) {
                result.set(field.getKey(), value);
            } else {
                result.set(field.getKey(), keepSubAttributes((ObjectNode) value, subs));
            }
        }
        return result;
    }

    private static ObjectNode exclude(ObjectNode resource, Set<String> attrs) {
        Map<String, Set<String>> selection = groupByTopLevel(resource, attrs, true);
        ObjectNode result = resource.objectNode();

        Iterator<Map.Entry<String, JsonNode>> fields = resource.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String lower = field.getKey().toLowerCase(Locale.ROOT);

            if (!selection.containsKey(lower)) {
                result.set(field.getKey(), field.getValue());
                continue;
            }

            Set<String> subs = selection.get(lower);
            JsonNode value = field.getValue();
            if (subs == null) {
                continue;
            }
            if (value.isObject()) {
                result.set(field.getKey(), dropSubAttributes((ObjectNode) value, subs));
            } else {
                result.set(field.getKey(), value);
            }
        }
        return result;
    }

    /**
     * Group requested names by top-level attribute. A {@code null} sub-set means the
     * whole attribute; a bare name wins over dotted names for the same parent.
     */
    private static Map<String, Set<String>> groupByTopLevel(ObjectNode resource, Set<String> attrs,
                                                            boolean skipAlwaysReturned) {
        Map<String, Set<String>> topLevel = new LinkedHashMap<>();
        for (String attr : attrs) {
            String[] split = splitAttribute(resource, attr);
            String top = split[0];
            if (skipAlwaysReturned && ALWAYS_RETURNED.contains(top)) {
                continue;
            }
            if (split[1] == null) {
                topLevel.put(top, null);
            } else if (!topLevel.containsKey(top)) {
                Set<String> subs = new LinkedHashSet<>();
                subs.add(split[1]);
                topLevel.put(top, subs);
            } else if (topLevel.get(top) != null) {
                topLevel.get(top).add(split[1]);
            }
        }
        return topLevel;
    }

    /**
     * Split a lowercased attribute name into {@code [topLevel, subAttribute-or-null]}.
     * An extension schema URN that is itself a key of the resource is a top-level name.
     */
    private static String[] splitAttribute(ObjectNode resource, String attr) {
        if (AttributePathResolver.findKey(resource, attr) != null) {
            return new String[] {attr, null};
        }
        String[] urnSplit = AttributePathResolver.splitUrnPath(attr);
        if (urnSplit != null) {
            return urnSplit;
        }
        int dot = attr.indexOf('.');
        if (dot == -1) {
            return new String[] {attr, null};
        }
        return new String[] {attr.substring(0, dot), attr.substring(dot + 1)};
    }

    /**
     * Keep only the named sub-attributes. Names may be dotted again, as in
     * {@code manager.value} inside an extension.
     */
    private static ObjectNode keepSubAttributes(ObjectNode value, Set<String> subs) {
        Map<String, Set<String>> selection = groupByFirstSegment(subs);
        ObjectNode filtered = value.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String lower = field.getKey().toLowerCase(Locale.ROOT);
            if (!selection.containsKey(lower)) {
                continue;
            }
            Set<String> nested = selection.get(lower);
            if (nested == null || !field.getValue().isObject()) {
                filtered.set(field.getKey(), field.getValue());
            } else {
                filtered.set(field.getKey(), keepSubAttributes((ObjectNode) field.getValue(), nested));
            }
        }
        return filtered;
    }

    private static ObjectNode dropSubAttributes(ObjectNode value, Set<String> subs) {
        Map<String, Set<String>> selection = groupByFirstSegment(subs);
        ObjectNode filtered = value.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String lower = field.getKey().toLowerCase(Locale.ROOT);
            if (!selection.containsKey(lower)) {
                filtered.set(field.getKey(), field.getValue());
                continue;
            }
            Set<String> nested = selection.get(lower);
            if (nested == null) {
                continue;
            }
            if (field.getValue().isObject()) {
                filtered.set(field.getKey(), dropSubAttributes((ObjectNode) field.getValue(), nested));
            } else {
                filtered.set(field.getKey(), field.getValue());
            }
        }
        return filtered;
    }

    /**
     * Group dotted names by their first segment; a bare name wins, as for top-level names.
     */
    private static Map<String, Set<String>> groupByFirstSegment(Set<String> names) {
        Map<String, Set<String>> grouped = new LinkedHashMap<>();
        for (String name : names) {
            int dot = name.indexOf('.');
            String head = dot == -1 ? name : name.substring(0, dot);
            if (dot == -1) {
                grouped.put(head, null);
            } else if (!grouped.containsKey(head)) {
                Set<String> rest = new LinkedHashSet<>();
                rest.add(name.substring(dot + 1));
                grouped.put(head, rest);
            } else if (grouped.get(head) != null) {
                grouped.get(head).add(name.substring(dot + 1));
            }
        }
        return grouped;
    }
}
