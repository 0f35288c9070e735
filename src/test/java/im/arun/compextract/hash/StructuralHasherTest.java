package im.arun.compextract.hash;

import im.arun.compextract.config.ExtractorConfig;
import im.arun.compextract.model.UINode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static im.arun.compextract.TestNodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class StructuralHasherTest {

    private final StructuralHasher hasher = new StructuralHasher(new ExtractorConfig().getShapeStyleKeys());

    @Test
    void testHashIsDeterministic() {
        UINode button = button("Button", "#0000FF", "OK");
        assertEquals(hasher.hash(button), hasher.hash(button));
    }

    @Test
    void testContentAndColorAreIgnored() {
        UINode first = button("Button/Default", "#0000FF", "OK");
        UINode second = button("Button/Other", "#FF0000", "Cancel");
        second.getChildren().get(0).setSrc("img_other");

        assertEquals(hasher.hash(first), hasher.hash(second));
    }

    @Test
    void testSizeChangesHash() {
        UINode first = button("Button", "#0000FF", "OK");
        UINode second = button("Button", "#0000FF", "OK");
        second.setWidth(121);

        assertNotEquals(hasher.hash(first), hasher.hash(second));
    }

    @Test
    void testShapeStylesChangeHash() {
        UINode first = button("Button", "#0000FF", "OK");
        UINode second = button("Button", "#0000FF", "OK");
        second.getStyles().put("cornerRadius", "8");

        assertNotEquals(hasher.hash(first), hasher.hash(second));
    }

    @Test
    void testNonShapeStylesAreIgnored() {
        UINode first = button("Button", "#0000FF", "OK");
        UINode second = button("Button", "#0000FF", "OK");
        second.getStyles().put("opacity", 0.5);
        second.getStyles().put("strokeColor", "#000000");

        assertEquals(hasher.hash(first), hasher.hash(second));
    }

    @Test
    void testStructuredStyleValuesHashByContent() {
        UINode first = card("Card", "A");
        UINode second = card("Card", "B");
        first.getStyles().put("shadow", Map.of("type", "DROP_SHADOW", "radius", 4));
        second.getStyles().put("shadow", Map.of("radius", 4, "type", "DROP_SHADOW"));

        assertEquals(hasher.hash(first), hasher.hash(second));
    }

    @Test
    void testEffectColorsDoNotSplitGroups() {
        UINode first = card("Card", "A");
        UINode second = card("Card", "B");
        first.getStyles().put("filters", List.of(Map.of("type", "DROP_SHADOW", "color", "#000000")));
        second.getStyles().put("filters", List.of(Map.of("type", "DROP_SHADOW", "color", "#FF0000")));

        assertEquals(hasher.hash(first), hasher.hash(second));
    }

    @Test
    void testChildOrderMatters() {
        UINode first = component("Row", text("Label", "a"), shape("Dot", null));
        UINode second = component("Row", shape("Dot", null), text("Label", "a"));

        assertNotEquals(hasher.hash(first), hasher.hash(second));
    }
}
