package im.arun.compextract.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Package resource descriptor. For components, {@code data} is a frozen JSON snapshot
 * of the canonical node subtree.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Resource {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private ResourceType type;

    @JsonProperty("data")
    private String data;

    @JsonProperty("width")
    private Integer width;

    @JsonProperty("height")
    private Integer height;

    @JsonProperty("exported")
    private Boolean exported;

    public static Resource component(String id, String name) {
        Resource resource = new Resource();
        resource.setId(id);
        resource.setName(name);
        resource.setType(ResourceType.COMPONENT);
        return resource;
    }

    public static Resource image(String id, String name, int width, int height) {
        return new Resource(id, name, ResourceType.IMAGE, null, width, height, null);
    }
}
