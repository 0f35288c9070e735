package im.arun.compextract.util;

import im.arun.compextract.model.UINode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Utility methods for walking and querying node trees.
 */
public class TreeUtils {

    private TreeUtils() {}

    /**
     * Pre-order walk over a node and all of its descendants.
     */
    public static void walk(UINode node, Consumer<UINode> visitor) {
        if (node == null) {
            return;
        }
        visitor.accept(node);
        for (UINode child : node.getChildren()) {
            walk(child, visitor);
        }
    }

    /**
     * Pre-order walk over descendants only, not descending below nodes the
     * {@code stopAt} predicate accepts (those nodes are still visited).
     */
    public static void walkDescendants(UINode node, Predicate<UINode> stopAt, Consumer<UINode> visitor) {
        if (node == null) {
            return;
        }
        for (UINode child : node.getChildren()) {
            visitor.accept(child);
            if (!stopAt.test(child)) {
                walkDescendants(child, stopAt, visitor);
            }
        }
    }

    public static List<UINode> findAll(List<UINode> roots, Predicate<UINode> filter) {
        List<UINode> result = new ArrayList<>();
        if (roots == null) {
            return result;
        }
        for (UINode root : roots) {
            walk(root, node -> {
                if (filter.test(node)) {
                    result.add(node);
                }
            });
        }
        return result;
    }

    public static boolean anyDescendant(UINode node, Predicate<UINode> filter) {
        for (UINode child : node.getChildren()) {
            if (filter.test(child) || anyDescendant(child, filter)) {
                return true;
            }
        }
        return false;
    }

    public static int countNodes(List<UINode> roots) {
        int[] count = {0};
        if (roots != null) {
            for (UINode root : roots) {
                walk(root, node -> count[0]++);
            }
        }
        return count[0];
    }

    /**
     * File-safe form of a layer name: whitespace removed, path separators replaced.
     */
    public static String safeName(String name) {
        if (name == null || name.isBlank()) {
            return "Unnamed";
        }
        return name.replaceAll("\\s+", "").replaceAll("[/\\\\:*?\"<>|]", "_");
    }
}
