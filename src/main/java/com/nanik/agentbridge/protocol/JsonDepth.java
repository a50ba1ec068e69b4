package com.nanik.agentbridge.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Nesting depth of a JSON tree, measured without recursion so that hostile
 * input cannot exhaust the stack.
 */
public final class JsonDepth {

    /** Deepest record the bridge accepts on its input. */
    public static final int MAX_RECORD_DEPTH = 64;

    private JsonDepth() {
    }

    /**
     * Whether {@code root} nests arrays or objects more than {@code maxDepth}
     * levels deep. A primitive has depth 0, {@code {}} and {@code []} depth 1.
     */
    public static boolean exceeds(JsonElement root, int maxDepth) {
        if (root == null) {
            return false;
        }
        Deque<JsonElement> elements = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        elements.push(root);
        depths.push(0);
        while (!elements.isEmpty()) {
            JsonElement element = elements.pop();
            int depth = depths.pop();
            if (element.isJsonArray()) {
                if (depth + 1 > maxDepth) {
                    return true;
                }
                for (JsonElement member : element.getAsJsonArray()) {
                    elements.push(member);
                    depths.push(depth + 1);
                }
            } else if (element.isJsonObject()) {
                if (depth + 1 > maxDepth) {
                    return true;
                }
                JsonObject object = element.getAsJsonObject();
                for (String key : object.keySet()) {
                    elements.push(object.get(key));
                    depths.push(depth + 1);
                }
            }
        }
        return false;
    }
}
