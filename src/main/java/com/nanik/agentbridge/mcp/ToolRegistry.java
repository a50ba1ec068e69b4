package com.nanik.agentbridge.mcp;

import com.nanik.agentbridge.tools.ToolDescriptor;

import java.util.*;

/**
 * Registry of the tools exposed by the bridge.
 *
 * Populated once at construction and never changed afterwards.
 */
public class ToolRegistry {

    private final Map<String, ToolDescriptor> tools;

    public ToolRegistry(List<ToolDescriptor> descriptors) {
        Map<String, ToolDescriptor> byName = new LinkedHashMap<>(); // Preserve declaration order
        for (ToolDescriptor descriptor : descriptors) {
            if (byName.containsKey(descriptor.getName())) {
                throw new IllegalArgumentException("Duplicate tool: " + descriptor.getName());
            }
            byName.put(descriptor.getName(), descriptor);
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    /**
     * Check if a tool exists.
     */
    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Get a tool by name, or null if unknown.
     */
    public ToolDescriptor getTool(String name) {
        return name != null ? tools.get(name) : null;
    }

    /**
     * Get all tool descriptors in registration order.
     */
    public List<ToolDescriptor> getAllDescriptors() {
        return new ArrayList<>(tools.values());
    }

    /**
     * Get all tool names.
     */
    public Set<String> getToolNames() {
        return tools.keySet();
    }

    /**
     * Get the number of registered tools.
     */
    public int size() {
        return tools.size();
    }
}
