package im.arun.compextract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the design tree. Children are exclusively owned by their parent;
 * there is no parent back-reference, passes walk top-down.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UINode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("sourceId")
    private String sourceId;

    @JsonProperty("name")
    private String name = "";

    @JsonProperty("type")
    private ObjectType type = ObjectType.COMPONENT;

    @JsonProperty("x")
    private double x;

    @JsonProperty("y")
    private double y;

    @JsonProperty("width")
    private double width;

    @JsonProperty("height")
    private double height;

    @JsonProperty("rotation")
    private Double rotation;

    @JsonProperty("styles")
    private Map<String, Object> styles = new LinkedHashMap<>();

    @JsonProperty("customProps")
    private Map<String, Object> customProps = new LinkedHashMap<>();

    @JsonProperty("text")
    private String text;

    @JsonProperty("src")
    private String src;

    @JsonProperty("fileName")
    private String fileName;

    @JsonProperty("children")
    private List<UINode> children = new ArrayList<>();

    @JsonProperty("visible")
    private Boolean visible;

    @JsonProperty("multiLooks")
    private Map<Integer, LookVariant> multiLooks;

    @JsonProperty("asComponent")
    private boolean asComponent;

    @JsonProperty("overrides")
    private Map<String, Object> overrides;

    @JsonProperty("extension")
    private String extension;

    @JsonProperty("value")
    private Double value;

    @JsonProperty("max")
    private Double max;

    @JsonProperty("min")
    private Double min;

    @JsonProperty("controllers")
    private List<ControllerInfo> controllers;

    @JsonProperty("gears")
    private List<GearInfo> gears;

    // Extraction bookkeeping, never part of a snapshot.

    @JsonIgnore
    private boolean extracted;

    @JsonIgnore
    private String structuralHash;

    @JsonIgnore
    private int variantPageId;

    // Canonical only: every page the group uses besides page 0, with its page name
    @JsonIgnore
    private Map<Integer, String> variantPageNames;

    public UINode(String id, String name, ObjectType type) {
        this.id = id;
        setName(name);
        setType(type);
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    public void setType(ObjectType type) {
        this.type = type != null ? type : ObjectType.COMPONENT;
    }

    public void setStyles(Map<String, Object> styles) {
        this.styles = styles != null ? styles : new LinkedHashMap<>();
    }

    public void setCustomProps(Map<String, Object> customProps) {
        this.customProps = customProps != null ? customProps : new LinkedHashMap<>();
    }

    /**
     * Null entries are dropped; a missing child is simply absent.
     */
    public void setChildren(List<UINode> children) {
        List<UINode> copy = new ArrayList<>();
        if (children != null) {
            for (UINode child : children) {
                if (child != null) {
                    copy.add(child);
                }
            }
        }
        this.children = copy;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Nodes are visible unless explicitly hidden.
     */
    @JsonIgnore
    public boolean isShown() {
        return visible == null || visible;
    }

    public Object style(String key) {
        return styles.get(key);
    }

    /**
     * Source id to use when asking the renderer for this node.
     */
    @JsonIgnore
    public String getRenderId() {
        return sourceId != null ? sourceId : id;
    }

    public UINode addChild(UINode child) {
        if (child != null) {
            children.add(child);
        }
        return this;
    }

    public List<GearInfo> gearsOrCreate() {
        if (gears == null) {
            gears = new ArrayList<>();
        }
        return gears;
    }

    public List<ControllerInfo> controllersOrCreate() {
        if (controllers == null) {
            controllers = new ArrayList<>();
        }
        return controllers;
    }

    public Map<Integer, LookVariant> multiLooksOrCreate() {
        if (multiLooks == null) {
            multiLooks = new LinkedHashMap<>();
        }
        return multiLooks;
    }

    @Override
    public String toString() {
        return "UINode{id=" + id + ", name=" + name + ", type=" + type + ", children=" + children.size() + "}";
    }
}
