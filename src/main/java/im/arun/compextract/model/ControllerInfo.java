package im.arun.compextract.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State controller attached to a component. Pages are encoded as
 * "index,name" pairs, e.g. "0,up,1,down,2,over,3,selectedOver".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ControllerInfo {

    @JsonProperty("name")
    private String name;

    @JsonProperty("pages")
    private String pages;

    @JsonProperty("selected")
    private Integer selected;

    public ControllerInfo(String name, String pages) {
        this(name, pages, null);
    }
}
