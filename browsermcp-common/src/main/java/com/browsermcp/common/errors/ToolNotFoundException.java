package com.browsermcp.common.errors;

import java.util.List;

public class ToolNotFoundException extends BridgeException {

    public ToolNotFoundException(String toolName, List<String> availableTools) {
        super("Tool \"" + toolName + "\" not found. Available tools: "
                + String.join(", ", availableTools));
    }
}
