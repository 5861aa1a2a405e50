package com.scimserver.scim.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves SCIM attribute paths against a resource represented as a JSON tree.
 *
 * <p>Supported forms:</p>
 * <ul>
 *   <li>Simple: {@code userName}</li>
 *   <li>Dotted: {@code name.givenName}</li>
 *   <li>URN-qualified: {@code urn:ietf:params:scim:schemas:extension:enterprise:2.0:User:department},
 *       looked up as the {@code urn:...:User} key followed by {@code department}</li>
 * </ul>
 *
 * <p>Attribute names are case-insensitive (RFC 7643 Section 2.1); when an object
 * holds several keys differing only by case the first one in field order wins.
 * Arrays are never traversed implicitly.</p>
 */
public final class AttributePathResolver {

    private static final Pattern URN_PATH = Pattern.compile("^(urn:[a-zA-Z0-9:._-]+):([a-zA-Z0-9_.]+)$");

    private AttributePathResolver() {
    }

    /**
     * Resolve an attribute path.
     *
     * @param resource the resource (or a complex value standing in for it)
     * @param attrPath the attribute path
     * @return the value at the path, or {@code null} when any segment is missing
     *         or a non-terminal segment is not an object. A JSON null attribute is
     *         returned as a {@code NullNode}.
     */
    public static JsonNode resolve(JsonNode resource, String attrPath) {
        if (resource == null || attrPath == null) {
            return null;
        }
        String[] urnSplit = splitUrnPath(attrPath);
        if (urnSplit != null) {
            JsonNode extension = getIgnoreCase(resource, urnSplit[0]);
            if (extension == null || !extension.isObject()) {
                return null;
            }
            return resolveDotted(extension, urnSplit[1]);
        }
        return resolveDotted(resource, attrPath);
    }

    /**
     * Split a URN-qualified path into the schema URN and the attribute path inside it.
     *
     * @param attrPath the attribute path
     * @return {@code [urn, subPath]}, or {@code null} if the path is not URN-qualified
     */
    public static String[] splitUrnPath(String attrPath) {
        Matcher matcher = URN_PATH.matcher(attrPath);
        if (!matcher.matches()) {
            return null;
        }
        return new String[] {matcher.group(1), matcher.group(2)};
    }

    /**
     * Find the actual key of an object field, ignoring case.
     *
     * @param node the object node
     * @param name the attribute name in any casing
     * @return the key as stored in the node, or {@code null}
     */
    public static String findKey(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String needle = name.toLowerCase(Locale.ROOT);
        Iterator<String> fieldNames = node.fieldNames();
        while (fieldNames.hasNext()) {
            String key = fieldNames.next();
            if (key.toLowerCase(Locale.ROOT).equals(needle)) {
                return key;
            }
        }
        return null;
    }

    /**
     * Get an object field, ignoring case.
     *
     * @return the field value, or {@code null} if absent
     */
    public static JsonNode getIgnoreCase(JsonNode node, String name) {
        String key = findKey(node, name);
        return key != null ? node.get(key) : null;
    }

    private static JsonNode resolveDotted(JsonNode root, String path) {
        JsonNode current = root;
        for (String segment : path.split("\\.", -1)) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = getIgnoreCase(current, segment);
        }
        return current;
    }
}
