package org.gridiron.tool;

import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry and dispatcher of the named tools. Dispatch never throws: every failure becomes an
 * {@code {"error": ...}} object the client can display.
 */
public class ToolManager {

    private static final Logger log = LoggerFactory.getLogger(ToolManager.class);

    private final Map<String, FantasyTool> tools = new LinkedHashMap<>();
    private final ToolContext context;

    public ToolManager(ToolContext context) {
        this.context = context;
    }

    /** The three fantasy football tools. */
    public static ToolManager withDefaultTools(ToolContext context) {
        ToolManager manager = new ToolManager(context);
        manager.addTool(new GetMatchupTool());
        manager.addTool(new CompareTeamsTool());
        manager.addTool(new BuildLineupTool());
        return manager;
    }

    public void addTool(FantasyTool tool) {
        tools.put(tool.name(), tool);
    }

    public JSONArray listTools() {
        JSONArray list = new JSONArray();
        for (FantasyTool tool : tools.values()) {
            list.put(new JSONObject()
                    .put("name", tool.name())
                    .put("description", tool.description())
                    .put("inputSchema", tool.inputSchema()));
        }
        return list;
    }

    public JSONObject dispatch(String toolName, JSONObject arguments) {
        FantasyTool tool = tools.get(toolName);
        if (tool == null) {
            return new JSONObject().put("error", "Unknown tool: " + toolName);
        }
        JSONObject args = arguments == null ? new JSONObject() : arguments;
        try {
            return tool.execute(args, context);
        } catch (IllegalArgumentException e) {
            return new JSONObject().put("error", e.getMessage());
        } catch (IOException e) {
            log.warn("Tool {} failed on a provider call: {}", toolName, e.getMessage());
            return new JSONObject()
                    .put("error", "Provider request failed: " + e.getMessage())
                    .put("suggestion", "Check your Yahoo token or try again in a moment");
        } catch (RuntimeException e) {
            log.error("Tool {} crashed", toolName, e);
            return new JSONObject()
                    .put("error", "Unexpected error in " + toolName + ": " + e.getMessage())
                    .put("suggestion", "Try again or check system logs for details");
        }
    }
}
