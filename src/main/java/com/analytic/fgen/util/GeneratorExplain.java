package com.analytic.fgen.util;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Diagnostic utility for inspecting bound expression trees.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports.
 * Do <b>not</b> use on the hot path (allocates strings, walks the whole tree).
 */
public final class GeneratorExplain {
    private GeneratorExplain() {
        // Utility class
    }

    /**
     * One line per node, indented by depth. Sub-trees reachable through more
     * than one parent are expanded the first time and marked "(shared)" after.
     */
    public static String explainTree(FieldGenerator root) {
        StringBuilder sb = new StringBuilder(256);
        appendNode(sb, root, 0, new IdentityHashMap<>(), null);
        return sb.toString();
    }

    /** As {@link #explainTree(FieldGenerator)}, with each node's value at {@code pos}. */
    public static String explainTree(FieldGenerator root, Context pos) {
        StringBuilder sb = new StringBuilder(256);
        appendNode(sb, root, 0, new IdentityHashMap<>(), pos);
        return sb.toString();
    }

    /** Number of distinct nodes in the tree. */
    public static int countNodes(FieldGenerator root) {
        Map<FieldGenerator, Boolean> seen = new IdentityHashMap<>();
        count(root, seen);
        return seen.size();
    }

    private static void count(FieldGenerator node, Map<FieldGenerator, Boolean> seen) {
        if (seen.put(node, Boolean.TRUE) != null)
            return;
        for (FieldGenerator child : node.args())
            count(child, seen);
    }

    private static void appendNode(StringBuilder sb, FieldGenerator node, int depth,
            Map<FieldGenerator, Boolean> seen, Context pos) {
        sb.append("  ".repeat(depth)).append(node.type()).append(' ').append(node.str());
        if (pos != null)
            sb.append(" = ").append(node.generate(pos));
        if (seen.put(node, Boolean.TRUE) != null) {
            sb.append(" (shared)\n");
            return;
        }
        sb.append('\n');
        for (FieldGenerator child : node.args())
            appendNode(sb, child, depth + 1, seen, pos);
    }
}
