package io.agency.core.tool;

import java.util.Map;

/// Built-in tool reporting the host operating system, architecture and Java version.
public final class SystemInfoTool implements ToolHandler {

    public static final String NAME = "system_info";

    private static final ToolDefinition DEFINITION =
            ToolDefinition.simple(
                    NAME, "Returns the operating system, CPU architecture and Java version");

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return "os="
                + System.getProperty("os.name")
                + " "
                + System.getProperty("os.version")
                + ", arch="
                + System.getProperty("os.arch")
                + ", java="
                + System.getProperty("java.version");
    }
}
