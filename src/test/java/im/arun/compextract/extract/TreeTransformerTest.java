package im.arun.compextract.extract;

import im.arun.compextract.config.KeywordTable;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.Resource;
import im.arun.compextract.model.UINode;
import im.arun.compextract.render.RenderPipeline;
import im.arun.compextract.render.RenderedResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static im.arun.compextract.TestNodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class TreeTransformerTest {

    private ResourceTable table;
    private TreeTransformer transformer;

    @BeforeEach
    void setUp() {
        table = new ResourceTable();
        table.register("h-card", Resource.component("comp_0", "Card"));
        transformer = new TreeTransformer(table, new KeywordTable());
    }

    private static UINode extracted(UINode node, String hash) {
        node.setExtracted(true);
        node.setStructuralHash(hash);
        return node;
    }

    @Test
    void testExtractedChildIsReplacedByReference() {
        UINode card = extracted(card("Card", "Welcome"), "h-card");
        card.setX(10);
        card.setY(20);
        UINode root = screen(text("Heading", "x"), card);

        int replaced = transformer.transformChildren(root);

        assertEquals(1, replaced);
        UINode ref = root.getChildren().get(1);
        assertNotSame(card, ref);
        assertTrue(ref.isAsComponent());
        assertFalse(ref.isExtracted());
        assertEquals("comp_0", ref.getSrc());
        assertEquals("Card.xml", ref.getFileName());
        assertEquals(card.getId(), ref.getId());
        assertEquals(10, ref.getX());
        assertEquals(20, ref.getY());
        assertEquals(200, ref.getWidth());
        assertTrue(ref.getChildren().isEmpty());
        assertEquals("Welcome", ref.getOverrides().get("title"));
    }

    @Test
    void testNestedContainersAreWalked() {
        UINode card = extracted(card("Card", "Deep"), "h-card");
        UINode root = screen(component("Section", component("Column", card)));

        transformer.transformChildren(root);

        UINode column = root.getChildren().get(0).getChildren().get(0);
        assertEquals("comp_0", column.getChildren().get(0).getSrc());
    }

    @Test
    void testMissingResourceFailsLoudly() {
        UINode stray = extracted(card("Stray", "x"), "h-unknown");
        UINode root = screen(stray);

        ReferenceResolutionException e = assertThrows(ReferenceResolutionException.class,
                () -> transformer.transformChildren(root));
        assertEquals(stray.getId(), e.getNodeId());
        assertEquals("h-unknown", e.getStructuralHash());
        assertTrue(e.getMessage().contains("Stray"));
    }

    @Test
    void testLastTitleLayerWins() {
        UINode header = component("Header", text("Title", "first-A"), text("Sub Label", "last-A"));

        Map<String, Object> overrides = transformer.extractOverrides(header);

        assertEquals("last-A", overrides.get("title"));
    }

    @Test
    void testPageOverrideOnlyForVariants() {
        UINode base = extracted(card("Card", "a"), "h-card");
        UINode variant = extracted(card("Card", "b"), "h-card");
        variant.setVariantPageId(2);
        UINode root = screen(base, variant);

        transformer.transformChildren(root);

        assertFalse(root.getChildren().get(0).getOverrides().containsKey("page"));
        assertEquals(2, root.getChildren().get(1).getOverrides().get("page"));
    }

    @Test
    void testIconOverrideNeedsResolvedResource() {
        UINode icon = node("Icon", ObjectType.IMAGE, 16, 16);
        icon.setSrc("img_star");
        UINode unresolved = node("Image", ObjectType.LOADER, 16, 16);
        UINode withIcon = extracted(component("Tile", icon, text("Title", "Star")), "h-card");
        UINode withoutIcon = extracted(component("Tile", unresolved, text("Title", "Empty")), "h-card");
        UINode root = screen(withIcon, withoutIcon);

        transformer.transformChildren(root);

        Map<String, Object> first = root.getChildren().get(0).getOverrides();
        Map<String, Object> second = root.getChildren().get(1).getOverrides();
        assertEquals("img_star", first.get("icon"));
        assertEquals("Star", first.get("title"));
        assertFalse(second.containsKey("icon"));
    }

    @Test
    void testIconWithoutResourceIsRenderedWhenPipelineGiven() {
        List<UINode> enqueued = new ArrayList<>();
        RenderPipeline pipeline = new RenderPipeline() {
            @Override
            public RenderedResource enqueue(UINode node, String variantSuffix) {
                enqueued.add(node);
                return new RenderedResource("img_" + node.getName(), node.getName() + ".png", 32, 32);
            }

            @Override
            public void scan(List<UINode> nodes) {
            }
        };
        TreeTransformer rendering = new TreeTransformer(table, new KeywordTable(), pipeline);
        UINode icon = node("Icon", ObjectType.IMAGE, 16, 16);
        UINode root = screen(extracted(component("Tile", icon, text("Label", "x")), "h-card"));

        rendering.transformChildren(root);

        assertEquals(List.of(icon), enqueued);
        assertEquals("img_Icon", icon.getSrc());
        assertEquals("img/Icon.png", icon.getFileName());
        assertEquals("img_Icon", root.getChildren().get(0).getOverrides().get("icon"));
    }

    @Test
    void testNestedComponentContentIsNotHoisted() {
        UINode innerButton = extracted(button("Button", "#000000", "Inner"), "h-card");
        UINode outer = component("Outer", innerButton, shape("Line", null));

        Map<String, Object> overrides = transformer.extractOverrides(outer);

        assertFalse(overrides.containsKey("title"));
    }

    @Test
    void testProgressValuesBecomeOverrides() {
        UINode progress = extracted(node("Loading", ObjectType.PROGRESS_BAR, 200, 10,
                shape("Track", "#333333"), shape("Bar", "#00FF00")), "h-card");
        progress.setValue(40.0);
        progress.setMax(100.0);

        Map<String, Object> overrides = transformer.extractOverrides(progress);

        assertEquals(40.0, overrides.get("value"));
        assertEquals(100.0, overrides.get("max"));
        assertFalse(overrides.containsKey("min"));
    }
}
