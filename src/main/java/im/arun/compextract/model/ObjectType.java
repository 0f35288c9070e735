package im.arun.compextract.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of node type tags understood by the component runtime.
 * Declaration order matches the runtime's numeric type ids.
 */
public enum ObjectType {
    IMAGE,
    MOVIE_CLIP,
    SOUND,
    GRAPH,
    LOADER,
    GROUP,
    TEXT,
    RICH_TEXT,
    INPUT_TEXT,
    COMPONENT,
    LIST,
    LABEL,
    BUTTON,
    COMBO_BOX,
    PROGRESS_BAR,
    SLIDER,
    SCROLL_BAR,
    TREE,
    LOADER_3D;

    private static final Set<ObjectType> EXTENSIONS =
            EnumSet.of(BUTTON, PROGRESS_BAR, SLIDER, COMBO_BOX, LABEL, LIST);

    private static final Set<ObjectType> TEXTS = EnumSet.of(TEXT, RICH_TEXT, INPUT_TEXT);

    /**
     * Interactive extension types keep behaviour only when they go through the component system.
     */
    public boolean isExtension() {
        return EXTENSIONS.contains(this);
    }

    public boolean isText() {
        return TEXTS.contains(this);
    }

    public boolean isShape() {
        return this == IMAGE || this == GRAPH;
    }

    /**
     * Name written as the component's extension marker, e.g. "Button" or "ProgressBar".
     */
    public String extensionName() {
        switch (this) {
            case BUTTON: return "Button";
            case PROGRESS_BAR: return "ProgressBar";
            case SLIDER: return "Slider";
            case COMBO_BOX: return "ComboBox";
            case LABEL: return "Label";
            case LIST: return "List";
            default: return null;
        }
    }
}
