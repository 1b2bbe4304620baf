package org.gridiron.tool;

import org.json.JSONObject;

/**
 * Lenient readers for tool arguments: clients send numbers as strings and booleans as "true".
 */
final class ToolArguments {

    private ToolArguments() {}

    static String requireString(JSONObject args, String key) {
        String value = optionalString(args, key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument: " + key);
        }
        return value;
    }

    static String optionalString(JSONObject args, String key) {
        if (args == null || !args.has(key) || args.isNull(key)) return null;
        String value = String.valueOf(args.get(key)).trim();
        return value.isEmpty() ? null : value;
    }

    static Integer optionalInt(JSONObject args, String key) {
        String value = optionalString(args, key);
        if (value == null || value.equalsIgnoreCase("current")) return null;
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument " + key + " must be a number, got '" + value + "'", e);
        }
    }

    static boolean optionalBoolean(JSONObject args, String key, boolean fallback) {
        String value = optionalString(args, key);
        return value == null ? fallback : Boolean.parseBoolean(value);
    }

    static JSONObject schema(String[][] properties, String... required) {
        JSONObject props = new JSONObject();
        for (String[] p : properties) {
            props.put(p[0], new JSONObject().put("type", p[1]).put("description", p[2]));
        }
        return new JSONObject()
                .put("type", "object")
                .put("properties", props)
                .put("required", required);
    }
}
