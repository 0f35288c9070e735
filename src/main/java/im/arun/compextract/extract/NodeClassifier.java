package im.arun.compextract.extract;

import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.UINode;
import im.arun.compextract.util.TreeUtils;

import java.util.List;

/**
 * Structural predicates over node subtrees shared by candidate collection and rendering.
 */
public class NodeClassifier {

    /**
     * True when every descendant is a graphical primitive: no text, no interactive
     * extension and no extracted sub-component below the node.
     */
    public boolean allDescendantsAreShapes(UINode node) {
        for (UINode child : node.getChildren()) {
            if (child.getType().isText() || child.getType().isExtension()) {
                return false;
            }
            // A shape is still a shape even if it was extracted
            if (child.getType().isShape()) {
                continue;
            }
            if (child.isExtracted() || child.isAsComponent()) {
                return false;
            }
            if (!allDescendantsAreShapes(child)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Containers made only of shapes are rasterized as a single image instead of extracted.
     */
    public boolean isPureShapeGroup(UINode node) {
        return node.hasChildren() && allDescendantsAreShapes(node);
    }

    /**
     * Any descendant, visible or not, flagged as a mask.
     */
    public boolean hasMaskDescendants(UINode node) {
        return TreeUtils.anyDescendant(node, child -> isTruthy(child.getCustomProps().get("isMask")));
    }

    /**
     * Text below the node, not looking inside extracted components.
     */
    public boolean hasTextDescendants(UINode node) {
        for (UINode child : node.getChildren()) {
            if (child.getType() == ObjectType.TEXT) {
                return true;
            }
            if (child.isExtracted() || child.isAsComponent()) {
                continue;
            }
            if (hasTextDescendants(child)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasAnyStyle(UINode node, List<String> keys) {
        for (String key : keys) {
            if (isPresentStyle(node.style(key))) {
                return true;
            }
        }
        return false;
    }

    static boolean isPresentStyle(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof List) {
            return !((List<?>) value).isEmpty();
        }
        String text = value.toString().trim();
        return !text.isEmpty() && !"transparent".equalsIgnoreCase(text) && !"none".equalsIgnoreCase(text);
    }

    private static boolean isTruthy(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(value.toString());
    }
}
