package im.arun.compextract.render;

import im.arun.compextract.model.Resource;
import im.arun.compextract.model.UINode;

import java.util.List;

/**
 * Contract with the image rendering pipeline. Extraction hands it visual nodes and
 * gets back opaque resource identifiers; fetching and writing images happens elsewhere.
 */
public interface RenderPipeline {

    /**
     * Queue a node for rendering.
     *
     * @param variantSuffix distinguishes look variants of the same node, empty for the default look
     */
    RenderedResource enqueue(UINode node, String variantSuffix);

    /**
     * Walk a forest and queue every visual leaf, writing the resource ids onto the nodes.
     */
    void scan(List<UINode> nodes);

    /**
     * Image resources produced so far, in queue order.
     */
    default List<Resource> producedResources() {
        return List.of();
    }
}
