package im.arun.compextract.hash;

import im.arun.compextract.model.UINode;
import im.arun.compextract.util.TreeUtils;

import java.util.StringJoiner;

/**
 * Fingerprint over the color-bearing styles of a node's descendants, in pre-order.
 * Structurally identical instances with different fills or strokes produce
 * different fingerprints. The root itself is left out: instance names always differ.
 */
public class VisualFingerprinter {

    private static final String FILL_COLOR = "fillColor";
    private static final String STROKE_COLOR = "strokeColor";

    public String fingerprint(UINode node) {
        StringJoiner joiner = new StringJoiner("|");
        TreeUtils.walkDescendants(node, current -> false, current -> {
            Object fill = current.style(FILL_COLOR);
            if (isOpaqueColor(fill)) {
                joiner.add(current.getName() + ":fill:" + fill);
            }
            Object stroke = current.style(STROKE_COLOR);
            if (stroke != null && !stroke.toString().isEmpty()) {
                joiner.add(current.getName() + ":stroke:" + stroke);
            }
        });
        return joiner.toString();
    }

    private boolean isOpaqueColor(Object color) {
        if (color == null) {
            return false;
        }
        String value = color.toString().trim();
        return !value.isEmpty() && !"transparent".equalsIgnoreCase(value) && !"none".equalsIgnoreCase(value);
    }
}
