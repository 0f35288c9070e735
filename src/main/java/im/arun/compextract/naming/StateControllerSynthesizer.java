package im.arun.compextract.naming;

import im.arun.compextract.config.KeywordTable;
import im.arun.compextract.model.ControllerInfo;
import im.arun.compextract.model.GearInfo;
import im.arun.compextract.model.ObjectType;
import im.arun.compextract.model.UINode;
import im.arun.compextract.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Synthesizes the interaction-state controller of a component from the names of its layers.
 *
 * <p>Buttons get the fixed four-page button controller. Other components get a
 * {@code state} controller with a {@code Normal} page plus one page per state found,
 * keyed by the state's page id, and one page per look variant without a named state.
 *
 * <p>Per-layer visibility bindings are only written when enabled: treating every
 * unnamed layer as always visible breaks designs with decorative state layers.
 */
public class StateControllerSynthesizer {
    private static final Logger logger = LoggerFactory.getLogger(StateControllerSynthesizer.class);

    public static final String BUTTON_PAGES = "0,up,1,down,2,over,3,selectedOver";
    private static final int BUTTON_PAGE_COUNT = 4;

    private final KeywordTable keywords;
    private final boolean visibilityGears;

    public StateControllerSynthesizer(KeywordTable keywords, boolean visibilityGears) {
        this.keywords = keywords;
        this.visibilityGears = visibilityGears;
    }

    /**
     * @return the controller attached to the node, or null when no state was detected
     */
    public ControllerInfo apply(UINode node) {
        Map<StateRole, List<UINode>> detected = detectStates(node);
        boolean hasLooks = (node.getMultiLooks() != null && !node.getMultiLooks().isEmpty())
                || (node.getVariantPageNames() != null && !node.getVariantPageNames().isEmpty());
        if (detected.isEmpty() && !hasLooks) {
            return null;
        }

        boolean button = node.getType() == ObjectType.BUTTON;
        ControllerInfo controller = button
                ? new ControllerInfo("button", BUTTON_PAGES)
                : new ControllerInfo("state", buildPages(detected, node));

        List<ControllerInfo> controllers = node.controllersOrCreate();
        controllers.removeIf(existing -> controller.getName().equals(existing.getName()));
        controllers.add(controller);
        logger.debug("Controller '{}' on '{}' with pages {}", controller.getName(), node.getName(), controller.getPages());

        if (visibilityGears) {
            bindVisibility(detected, controller.getName(), button);
        }
        return controller;
    }

    Map<StateRole, List<UINode>> detectStates(UINode node) {
        Map<StateRole, List<UINode>> detected = new EnumMap<>(StateRole.class);
        // References count as layers but their insides belong to their own component
        TreeUtils.walkDescendants(node, UINode::isAsComponent, layer -> {
            StateRole role = keywords.detectState(layer.getName());
            if (role != null) {
                detected.computeIfAbsent(role, r -> new ArrayList<>()).add(layer);
            }
        });
        return detected;
    }

    private String buildPages(Map<StateRole, List<UINode>> detected, UINode node) {
        Map<Integer, String> pages = new TreeMap<>();
        pages.put(StateRole.NORMAL.getPageId(), StateRole.NORMAL.getPageName());
        for (StateRole role : detected.keySet()) {
            pages.putIfAbsent(role.getPageId(), role.getPageName());
        }
        if (node.getVariantPageNames() != null) {
            node.getVariantPageNames().forEach(pages::putIfAbsent);
        }
        if (node.getMultiLooks() != null) {
            for (Integer lookPage : node.getMultiLooks().keySet()) {
                pages.putIfAbsent(lookPage, "Look" + lookPage);
            }
        }

        StringJoiner joiner = new StringJoiner(",");
        pages.forEach((id, name) -> joiner.add(id + "," + name));
        return joiner.toString();
    }

    private void bindVisibility(Map<StateRole, List<UINode>> detected, String controller, boolean button) {
        detected.forEach((role, layers) -> {
            int page = role.getPageId();
            if (button && page >= BUTTON_PAGE_COUNT) {
                return;
            }
            for (UINode layer : layers) {
                List<GearInfo> gears = layer.gearsOrCreate();
                gears.removeIf(gear -> GearInfo.GEAR_DISPLAY.equals(gear.getType()));
                GearInfo display = new GearInfo(GearInfo.GEAR_DISPLAY, controller);
                display.setPages(String.valueOf(page));
                gears.add(display);
            }
        });
    }
}
