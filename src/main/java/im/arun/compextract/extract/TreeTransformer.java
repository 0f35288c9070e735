package im.arun.compextract.extract;

import im.arun.compextract.config.KeywordTable;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.Resource;
import im.arun.compextract.model.UINode;
import im.arun.compextract.render.RenderPipeline;
import im.arun.compextract.render.RenderedResource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces every extracted node below a parent with a slim reference node that links
 * to the component resource and carries the instance's content overrides.
 */
public class TreeTransformer {

    public static final String OVERRIDE_TITLE = "title";
    public static final String OVERRIDE_ICON = "icon";
    public static final String OVERRIDE_PAGE = "page";

    private final ResourceTable resourceTable;
    private final KeywordTable keywords;
    private final RenderPipeline renderPipeline;

    public TreeTransformer(ResourceTable resourceTable, KeywordTable keywords) {
        this(resourceTable, keywords, null);
    }

    /**
     * @param renderPipeline used to obtain a resource for icon layers that have none yet; may be null
     */
    public TreeTransformer(ResourceTable resourceTable, KeywordTable keywords, RenderPipeline renderPipeline) {
        this.resourceTable = resourceTable;
        this.keywords = keywords;
        this.renderPipeline = renderPipeline;
    }

    /**
     * Rewrite the children of {@code parent} in place.
     *
     * @return number of nodes replaced
     * @throws ReferenceResolutionException if an extracted node has no registered resource
     */
    public int transformChildren(UINode parent) {
        int replaced = 0;
        List<UINode> children = parent.getChildren();
        for (int i = 0; i < children.size(); i++) {
            UINode child = children.get(i);
            if (child.isExtracted()) {
                children.set(i, buildReference(child));
                replaced++;
            } else if (child.hasChildren()) {
                replaced += transformChildren(child);
            }
        }
        return replaced;
    }

    UINode buildReference(UINode instance) {
        Resource resource = resourceTable.resolve(instance);

        UINode ref = new UINode(instance.getId(), instance.getName(), instance.getType());
        ref.setSourceId(instance.getSourceId());
        ref.setX(instance.getX());
        ref.setY(instance.getY());
        ref.setWidth(instance.getWidth());
        ref.setHeight(instance.getHeight());
        ref.setRotation(instance.getRotation());
        ref.setVisible(instance.getVisible());
        ref.setStyles(new LinkedHashMap<>(instance.getStyles()));
        ref.setCustomProps(new LinkedHashMap<>(instance.getCustomProps()));
        ref.setSrc(resource.getId());
        ref.setFileName(resource.getName() + ".xml");
        ref.setAsComponent(true);
        ref.setStructuralHash(instance.getStructuralHash());
        ref.setVariantPageId(instance.getVariantPageId());
        ref.setOverrides(extractOverrides(instance));
        return ref;
    }

    Map<String, Object> extractOverrides(UINode instance) {
        Map<String, Object> overrides = new LinkedHashMap<>();
        collectContent(instance, overrides);

        ObjectType type = instance.getType();
        if (type == ObjectType.PROGRESS_BAR || type == ObjectType.SLIDER) {
            putIfSet(overrides, "value", instance.getValue());
            putIfSet(overrides, "max", instance.getMax());
            putIfSet(overrides, "min", instance.getMin());
        }

        if (instance.getVariantPageId() != 0) {
            overrides.put(OVERRIDE_PAGE, instance.getVariantPageId());
        }
        return overrides;
    }

    private void collectContent(UINode node, Map<String, Object> overrides) {
        ObjectType type = node.getType();

        if (type == ObjectType.TEXT && node.getText() != null && keywords.isTitle(node.getName())) {
            overrides.put(OVERRIDE_TITLE, node.getText());
        }

        if ((type == ObjectType.IMAGE || type == ObjectType.LOADER) && keywords.isIcon(node.getName())) {
            String src = resolveVisual(node);
            if (src != null) {
                overrides.put(OVERRIDE_ICON, src);
            }
        }

        for (UINode child : node.getChildren()) {
            // Nested components carry their own overrides
            if (!child.isExtracted() && !child.isAsComponent()) {
                collectContent(child, overrides);
            }
        }
    }

    private String resolveVisual(UINode node) {
        if (node.getSrc() != null || renderPipeline == null) {
            return node.getSrc();
        }
        RenderedResource rendered = renderPipeline.enqueue(node, "");
        node.setSrc(rendered.getResourceId());
        node.setFileName("img/" + rendered.getFileName());
        return rendered.getResourceId();
    }

    private static void putIfSet(Map<String, Object> overrides, String key, Double value) {
        if (value != null) {
            overrides.put(key, value);
        }
    }
}
