package im.arun.compextract.extract;

import im.arun.compextract.config.KeywordTable;
import im.arun.compextract.hash.VisualFingerprinter;
import im.arun.compextract.model.GearInfo;
import im.arun.compextract.model.UINode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static im.arun.compextract.TestNodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class VariantAnalyzerTest {

    private final VariantAnalyzer analyzer = new VariantAnalyzer(new KeywordTable(), new VisualFingerprinter());

    @Test
    void testPressedVariantTakesDownPage() {
        UINode normal = button("Button/Default", "#0000FF", "OK");
        UINode pressed = button("Button/Pressed", "#FF0000", "OK");

        Map<Integer, List<UINode>> pages = analyzer.analyze(List.of(normal, pressed));

        assertEquals(List.of(normal), pages.get(0));
        assertEquals(List.of(pressed), pages.get(1));
        assertEquals(0, normal.getVariantPageId());
        assertEquals(1, pressed.getVariantPageId());
        assertEquals(pressed.getSourceId(), normal.getMultiLooks().get(1).getSourceId());

        List<GearInfo> iconGears = normal.getGears().stream()
                .filter(g -> GearInfo.GEAR_ICON.equals(g.getType()))
                .toList();
        assertEquals(1, iconGears.size());
        assertEquals("button", iconGears.get(0).getController());
    }

    @Test
    void testIdenticalInstancesCreateNoLooks() {
        List<UINode> cards = List.of(card("Card", "a"), card("Card", "b"), card("Card", "c"),
                card("Card", "d"), card("Card", "e"));

        Map<Integer, List<UINode>> pages = analyzer.analyze(cards);

        assertEquals(1, pages.size());
        assertEquals(5, pages.get(0).size());
        assertNull(cards.get(0).getMultiLooks());
        assertNull(cards.get(0).getGears());
        assertNull(cards.get(0).getVariantPageNames());
        cards.forEach(card -> assertEquals(0, card.getVariantPageId()));
    }

    @Test
    void testIdenticalInstancesUseNameForPage() {
        UINode normal = card("Tab", "a");
        UINode selected = card("Tab/Selected", "b");

        analyzer.analyze(List.of(normal, selected));

        assertEquals(3, selected.getVariantPageId());
        assertNull(normal.getMultiLooks());
        // A named page still needs something to switch to it
        assertEquals(1, normal.getGears().size());
        assertEquals(GearInfo.GEAR_ICON, normal.getGears().get(0).getType());
        assertEquals("state", normal.getGears().get(0).getController());
        assertEquals(Map.of(3, "Selected"), normal.getVariantPageNames());
    }

    @Test
    void testUnnamedVariantsGetSequentialPages() {
        UINode base = button("Chip", "#000000", "a");
        UINode red = button("Chip Red", "#FF0000", "b");
        UINode green = button("Chip Green", "#00FF00", "c");
        UINode redAgain = button("Chip Red 2", "#FF0000", "d");

        analyzer.analyze(List.of(base, red, green, redAgain));

        assertEquals(1, red.getVariantPageId());
        assertEquals(2, green.getVariantPageId());
        assertEquals(1, redAgain.getVariantPageId());
        assertEquals(2, base.getMultiLooks().size());
        assertEquals(Map.of(1, "Look1", 2, "Look2"), base.getVariantPageNames());
    }

    @Test
    void testTakenSemanticPageFallsBackToSequential() {
        UINode base = button("Btn", "#000000", "a");
        UINode unnamed = button("Btn Alt", "#111111", "b");
        UINode hover = button("Btn Hover", "#222222", "c");
        UINode hoverToo = button("Btn Over", "#333333", "d");

        analyzer.analyze(List.of(base, unnamed, hover, hoverToo));

        assertEquals(1, unnamed.getVariantPageId());
        assertEquals(2, hover.getVariantPageId());
        // Page 2 is taken by the first hover look
        assertEquals(3, hoverToo.getVariantPageId());
    }

    @Test
    void testNonCanonicalNeverGetsPageZero() {
        UINode base = button("Base", "#000000", "a");
        UINode normalNamed = button("Normal", "#FFFFFF", "b");

        analyzer.analyze(List.of(base, normalNamed));

        assertNotEquals(0, normalNamed.getVariantPageId());
        assertFalse(base.getMultiLooks().containsKey(0));
    }

    @Test
    void testNonButtonUsesStateController() {
        UINode base = card("Card", "a");
        UINode highlighted = card("Card", "b");
        highlighted.getChildren().get(1).getStyles().put("fillColor", "#FF0000");

        analyzer.analyze(List.of(base, highlighted));

        assertEquals(1, base.getGears().size());
        assertEquals("state", base.getGears().get(0).getController());
    }

    @Test
    void testReanalysisKeepsSingleIconGear() {
        UINode normal = button("Button", "#0000FF", "OK");
        UINode pressed = button("Button/Pressed", "#FF0000", "OK");

        analyzer.analyze(List.of(normal, pressed));
        analyzer.analyze(List.of(normal, pressed));

        assertEquals(1, normal.getGears().size());
    }

    @Test
    void testSingleInstanceStaysOnDefaultPage() {
        UINode only = button("Button/Pressed", "#FF0000", "OK");

        Map<Integer, List<UINode>> pages = analyzer.analyze(List.of(only));

        assertEquals(List.of(only), pages.get(0));
        assertEquals(0, only.getVariantPageId());
        assertNull(only.getMultiLooks());
    }
}
