package im.arun.compextract.render;

import im.arun.compextract.extract.NodeClassifier;
import im.arun.compextract.model.GearInfo;
import im.arun.compextract.model.LookVariant;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.Resource;
import im.arun.compextract.model.UINode;
import im.arun.compextract.util.TreeUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory render queue. Assigns resource ids and sizes to visual nodes and records
 * what has to be rendered; a downloader drains {@link #getQueue()} afterwards.
 */
public class RenderQueue implements RenderPipeline {
    private static final Logger logger = LoggerFactory.getLogger(RenderQueue.class);

    private final double scale;
    private final NodeClassifier classifier;
    private final List<QueuedRender> queue = new ArrayList<>();
    private final List<Resource> resources = new ArrayList<>();

    public RenderQueue(double scale) {
        this(scale, new NodeClassifier());
    }

    public RenderQueue(double scale, NodeClassifier classifier) {
        this.scale = scale;
        this.classifier = classifier;
    }

    @Data
    @AllArgsConstructor
    public static class QueuedRender {
        private UINode node;
        private String sourceId;
        private String fileName;
        private String resourceId;
        private String suffix;
    }

    @Override
    public RenderedResource enqueue(UINode node, String variantSuffix) {
        String suffix = variantSuffix != null ? variantSuffix : "";
        String sourceId = node.getRenderId();
        String nodeIdStr = sourceId != null ? sourceId.replace(':', '_') : "anon";
        String safeName = TreeUtils.safeName(node.getName());
        String fileName = safeName + suffix + "_" + nodeIdStr + ".png";
        String resourceId = "img_" + safeName + suffix.replaceAll("[^a-zA-Z0-9]", "_") + "_" + nodeIdStr;

        queue.add(new QueuedRender(node, sourceId, fileName, resourceId, suffix));

        // Effects overflow the node bounds
        int padding = visualPadding(node);
        int width = (int) Math.round((node.getWidth() + padding * 2) * scale);
        int height = (int) Math.round((node.getHeight() + padding * 2) * scale);

        resources.add(Resource.image(resourceId, fileName, width, height));
        return new RenderedResource(resourceId, fileName, width, height);
    }

    /**
     * Scan a forest. Nodes passed in that have children are treated as component roots
     * and never rendered whole; their children are scanned instead.
     */
    @Override
    public void scan(List<UINode> nodes) {
        if (nodes == null) {
            return;
        }
        for (UINode node : nodes) {
            if (node.hasChildren()) {
                node.getChildren().forEach(this::visit);
            } else {
                visit(node);
            }
        }
    }

    private void visit(UINode node) {
        if (!node.isShown()) {
            return;
        }

        // Already resolved: only the alternate looks still need rendering
        if (node.getSrc() != null) {
            if (node.getMultiLooks() != null) {
                enqueueMultiLooks(node, node.getSrc());
            }
            return;
        }

        // Components are never rendered whole, their parts get their own images
        if (node.isAsComponent()) {
            node.getChildren().forEach(this::visit);
            return;
        }

        if (isVisualLeaf(node)) {
            RenderedResource rendered = enqueue(node, "");
            node.setSrc(rendered.getResourceId());
            node.setFileName("img/" + rendered.getFileName());

            if (node.getMultiLooks() != null) {
                enqueueMultiLooks(node, rendered.getResourceId());
            }
            return;
        }

        node.getChildren().forEach(this::visit);
    }

    /**
     * Render every alternate look and point the node's icon gear at the per-page images.
     */
    private void enqueueMultiLooks(UINode node, String baseResourceId) {
        Map<Integer, String> lookResources = new LinkedHashMap<>();
        lookResources.put(0, baseResourceId);

        for (Map.Entry<Integer, LookVariant> look : node.getMultiLooks().entrySet()) {
            LookVariant variant = look.getValue();
            if (variant == null || variant.getSourceId() == null) {
                continue;
            }
            UINode lookNode = new UINode(node.getId(), node.getName(), node.getType());
            lookNode.setSourceId(variant.getSourceId());
            lookNode.setWidth(node.getWidth());
            lookNode.setHeight(node.getHeight());
            lookNode.setStyles(node.getStyles());
            lookNode.setCustomProps(node.getCustomProps());

            RenderedResource rendered = enqueue(lookNode, "_page" + look.getKey());
            lookResources.put(look.getKey(), rendered.getResourceId());
        }

        if (node.getGears() == null) {
            return;
        }
        for (GearInfo gear : node.getGears()) {
            if (GearInfo.GEAR_ICON.equals(gear.getType())) {
                gear.setValues(iconGearValues(gear, lookResources, baseResourceId));
            }
        }
    }

    static String iconGearValues(GearInfo gear, Map<Integer, String> lookResources, String baseResourceId) {
        if ("button".equals(gear.getController())) {
            // Button pages: 0=up, 1=down, 2=over, 3=selectedOver. Any variant look is the down look.
            String variant = lookResources.entrySet().stream()
                    .filter(e -> e.getKey() != 0 && !baseResourceId.equals(e.getValue()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(baseResourceId);
            return String.join("|", baseResourceId, variant, baseResourceId, baseResourceId);
        }

        int maxPage = Math.max(Collections.max(lookResources.keySet()), 3);
        List<String> values = new ArrayList<>();
        for (int page = 0; page <= maxPage; page++) {
            values.add(lookResources.getOrDefault(page, baseResourceId));
        }
        return String.join("|", values);
    }

    /**
     * Whether a node is rendered as one image rather than scanned further.
     */
    boolean isVisualLeaf(UINode node) {
        ObjectType type = node.getType();
        if (type == ObjectType.IMAGE) {
            return true;
        }
        if (type == ObjectType.GRAPH) {
            return node.style("fillColor") != null || node.style("strokeColor") != null;
        }
        if (type != ObjectType.COMPONENT && type != ObjectType.GROUP && type != ObjectType.LOADER) {
            return false;
        }

        boolean hasVisualProps = node.style("fillColor") != null
                || node.style("strokeColor") != null
                || node.style("imageFill") != null
                || isNonEmptyList(node.style("filters"));
        boolean hasFillPaths = isNonEmptyList(node.getCustomProps().get("fillGeometry"));
        if ((hasVisualProps || hasFillPaths) && !classifier.hasTextDescendants(node)) {
            return true;
        }

        if (classifier.isPureShapeGroup(node)) {
            logger.debug("Rendering '{}' as one image: all children are shapes", node.getName());
            return true;
        }

        if (node.hasChildren() && classifier.hasMaskDescendants(node)) {
            logger.debug("Rendering '{}' as one image: contains masks", node.getName());
            return true;
        }
        return false;
    }

    /**
     * Pixels that strokes, shadows and blurs extend beyond the node bounds.
     */
    static int visualPadding(UINode node) {
        int padding = 0;
        Map<String, Object> styles = node.getStyles();

        Double strokeSize = toDouble(styles.get("strokeSize"));
        if (strokeSize != null) {
            padding = Math.max(padding, (int) Math.ceil(strokeSize / 2));
        }
        padding = Math.max(padding, filterPadding(styles.get("filters"), true));

        Object mergedPaths = node.getCustomProps().get("mergedPaths");
        if (mergedPaths instanceof List) {
            for (Object path : (List<?>) mergedPaths) {
                if (!(path instanceof Map)) {
                    continue;
                }
                Map<?, ?> pathProps = (Map<?, ?>) path;
                Double pathStroke = toDouble(pathProps.get("strokeSize"));
                if (pathStroke != null) {
                    padding = Math.max(padding, (int) Math.ceil(pathStroke / 2));
                }
                padding = Math.max(padding, filterPadding(pathProps.get("filters"), false));
            }
        }
        return padding;
    }

    private static int filterPadding(Object filters, boolean typed) {
        int padding = 0;
        if (!(filters instanceof List)) {
            return padding;
        }
        for (Object filter : (List<?>) filters) {
            if (!(filter instanceof Map)) {
                continue;
            }
            Map<?, ?> props = (Map<?, ?>) filter;
            Object type = props.get("type");
            double radius = orZero(toDouble(props.get("radius")));
            if (!typed || "DROP_SHADOW".equals(type) || "INNER_SHADOW".equals(type)) {
                double offX = 0;
                double offY = 0;
                if (props.get("offset") instanceof Map) {
                    Map<?, ?> offset = (Map<?, ?>) props.get("offset");
                    offX = Math.abs(orZero(toDouble(offset.get("x"))));
                    offY = Math.abs(orZero(toDouble(offset.get("y"))));
                }
                double spread = orZero(toDouble(props.get("spread")));
                padding = Math.max(padding, (int) Math.ceil(Math.max(offX, offY) + radius + spread));
            } else if ("LAYER_BLUR".equals(type)) {
                padding = Math.max(padding, (int) Math.ceil(radius));
            }
        }
        return padding;
    }

    private static boolean isNonEmptyList(Object value) {
        return value instanceof List && !((List<?>) value).isEmpty();
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0;
    }

    public List<QueuedRender> getQueue() {
        return Collections.unmodifiableList(queue);
    }

    @Override
    public List<Resource> producedResources() {
        return Collections.unmodifiableList(resources);
    }
}
