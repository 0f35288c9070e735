package im.arun.compextract.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output of one extraction pass: the rewritten root forest and the resource table
 * handed to the serializer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionResult {

    @JsonProperty("roots")
    private List<UINode> roots;

    @JsonProperty("resources")
    private List<Resource> resources;

    @JsonProperty("group_count")
    private int groupCount;

    @JsonProperty("dropped_resources")
    private List<String> droppedResources;
}
