package im.arun.compextract.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Binding between a node property and a controller page, e.g. "gearIcon" or "gearDisplay".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GearInfo {

    public static final String GEAR_ICON = "gearIcon";
    public static final String GEAR_DISPLAY = "gearDisplay";

    @JsonProperty("type")
    private String type;

    @JsonProperty("controller")
    private String controller;

    @JsonProperty("pages")
    private String pages;

    @JsonProperty("values")
    private String values;

    @JsonProperty("default")
    private String defaultValue;

    public GearInfo(String type, String controller) {
        this.type = type;
        this.controller = controller;
    }
}
