package im.arun.compextract.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Alternate appearance of a component. Holds the source id of the instance that
 * renders this look so it can be rendered independently, or a style delta.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LookVariant {

    @JsonProperty("sourceId")
    private String sourceId;

    @JsonProperty("styles")
    private Map<String, Object> styles;

    public static LookVariant ofSource(String sourceId) {
        return new LookVariant(sourceId, null);
    }
}
