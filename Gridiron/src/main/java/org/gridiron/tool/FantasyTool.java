package org.gridiron.tool;

import org.json.JSONObject;

import java.io.IOException;

public interface FantasyTool {
    String name();
    String description();
    JSONObject inputSchema();
    JSONObject execute(JSONObject arguments, ToolContext ctx) throws IOException;
}
