package im.arun.compextract.naming;

import im.arun.compextract.config.KeywordTable;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.UINode;

/**
 * Renames the inner layers of a component to the slot names the runtime binds
 * by convention: {@code title}, {@code icon}, and {@code bar}/{@code grip} for
 * progress bars and sliders. The component root keeps its name.
 */
public class NamingNormalizer {

    public static final String TITLE = "title";
    public static final String ICON = "icon";
    public static final String BAR = "bar";
    public static final String GRIP = "grip";

    private final KeywordTable keywords;

    public NamingNormalizer(KeywordTable keywords) {
        this.keywords = keywords;
    }

    /**
     * @return number of layers renamed
     */
    public int apply(UINode component) {
        return applyToChildren(component, component.getType());
    }

    private int applyToChildren(UINode node, ObjectType componentType) {
        int renamed = 0;
        for (UINode child : node.getChildren()) {
            // References belong to other components
            if (child.isAsComponent()) {
                continue;
            }
            if (rename(child, componentType)) {
                renamed++;
            }
            renamed += applyToChildren(child, componentType);
        }
        return renamed;
    }

    private boolean rename(UINode node, ObjectType componentType) {
        ObjectType type = node.getType();
        String name = node.getName();

        if (type.isText()) {
            if (keywords.isTitle(name) && !TITLE.equals(name)) {
                node.setName(TITLE);
                return true;
            }
            return false;
        }

        if (componentType == ObjectType.SLIDER && keywords.isGrip(name)) {
            node.setName(GRIP);
            return true;
        }
        if ((componentType == ObjectType.PROGRESS_BAR || componentType == ObjectType.SLIDER) && keywords.isBar(name)) {
            node.setName(BAR);
            return true;
        }

        boolean visual = type == ObjectType.IMAGE || type == ObjectType.GRAPH
                || type == ObjectType.COMPONENT || type == ObjectType.LOADER;
        if (visual && keywords.isIcon(name)) {
            node.setName(ICON);
            if (!node.hasChildren() || node.getSrc() != null) {
                node.setType(ObjectType.LOADER);
            }
            return true;
        }
        return false;
    }
}
