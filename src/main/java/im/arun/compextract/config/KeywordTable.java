package im.arun.compextract.config;

import im.arun.compextract.naming.StateRole;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword to semantic-role mappings used by every name-driven heuristic.
 * Matching is a case-insensitive substring test.
 */
@Data
public class KeywordTable {
    private List<String> title = new ArrayList<>(List.of("label", "title", "文本", "标题"));
    private List<String> icon = new ArrayList<>(List.of("icon", "image", "background", "图标", "图片", "背景"));
    private List<String> bar = new ArrayList<>(List.of("bar", "fill", "progress", "进度"));
    private List<String> grip = new ArrayList<>(List.of("grip", "thumb", "handle", "滑块"));

    // Checked in this order; the first role with a matching keyword wins.
    private Map<StateRole, List<String>> states = defaultStates();

    private static Map<StateRole, List<String>> defaultStates() {
        Map<StateRole, List<String>> states = new EnumMap<>(StateRole.class);
        states.put(StateRole.DISABLED, new ArrayList<>(List.of("disabled", "disable", "禁用")));
        states.put(StateRole.SELECTED, new ArrayList<>(List.of("selected", "checked", "选中")));
        states.put(StateRole.DOWN, new ArrayList<>(List.of("pressed", "down", "按下")));
        states.put(StateRole.OVER, new ArrayList<>(List.of("hover", "over", "悬停")));
        states.put(StateRole.NORMAL, new ArrayList<>(List.of("normal", "default", "默认", "正常")));
        return states;
    }

    public boolean isTitle(String name) {
        return matches(name, title);
    }

    public boolean isIcon(String name) {
        return matches(name, icon);
    }

    public boolean isBar(String name) {
        return matches(name, bar);
    }

    public boolean isGrip(String name) {
        return matches(name, grip);
    }

    /**
     * Resolve the interaction state a layer name refers to, or null if none.
     */
    public StateRole detectState(String name) {
        for (StateRole role : new StateRole[]{
                StateRole.DISABLED, StateRole.SELECTED, StateRole.DOWN, StateRole.OVER, StateRole.NORMAL}) {
            if (matches(name, states.get(role))) {
                return role;
            }
        }
        return null;
    }

    /**
     * True when the name refers to a non-default interaction state (hover, pressed, selected, disabled).
     */
    public boolean isAlternateState(String name) {
        StateRole role = detectState(name);
        return role != null && role != StateRole.NORMAL;
    }

    public static boolean matches(String name, List<String> keywords) {
        if (name == null || name.isEmpty() || keywords == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isEmpty() && lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
