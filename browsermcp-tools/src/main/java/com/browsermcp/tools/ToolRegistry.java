package com.browsermcp.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name → tool table with alias resolution.
 *
 * <p>A tool named {@code browser_<verb>} is also reachable as {@code <verb>},
 * {@code browser_browser_<verb>} and {@code mcp__browsermcp__browser_<verb>}. An alias never
 * shadows an explicit registration, and the first tool to claim an alias keeps it.
 */
@Slf4j
public final class ToolRegistry {

    public static final String TOOL_PREFIX = "browser_";
    public static final String CLIENT_PREFIX = "mcp__browsermcp__";

    private final Map<String, BrowserTool> tools;
    private final Map<String, BrowserTool> aliases;

    public ToolRegistry(List<BrowserTool> toolList) {
        Map<String, BrowserTool> byName = new LinkedHashMap<>();
        for (BrowserTool tool : toolList) {
            if (byName.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + tool.getName());
            }
        }

        Map<String, BrowserTool> aliasTable = new LinkedHashMap<>();
        for (BrowserTool tool : byName.values()) {
            for (String alias : aliasesOf(tool.getName())) {
                if (byName.containsKey(alias)) {
                    log.debug("Alias {} of {} shadowed by a registered tool", alias, tool.getName());
                    continue;
                }
                aliasTable.putIfAbsent(alias, tool);
            }
        }

        this.tools = Collections.unmodifiableMap(byName);
        this.aliases = Collections.unmodifiableMap(aliasTable);
    }

    /**
     * Alternative spellings for a registered name. Empty when the name lacks the tool prefix.
     */
    public static List<String> aliasesOf(String name) {
        if (name == null || !name.startsWith(TOOL_PREFIX) || name.length() == TOOL_PREFIX.length()) {
            return List.of();
        }
        return List.of(
                name.substring(TOOL_PREFIX.length()),
                TOOL_PREFIX + name,
                CLIENT_PREFIX + name);
    }

    /**
     * Exact registration first, then aliases.
     */
    public Optional<BrowserTool> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        BrowserTool tool = tools.get(name);
        return tool != null ? Optional.of(tool) : Optional.ofNullable(aliases.get(name));
    }

    public List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> defs = new ArrayList<>();
        for (BrowserTool tool : tools.values()) {
            defs.add(tool.toDefinition());
        }
        return defs;
    }

    public int size() {
        return tools.size();
    }
}
