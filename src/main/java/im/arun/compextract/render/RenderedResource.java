package im.arun.compextract.render;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Handle returned by the renderer for an enqueued node: resource id, output file name
 * and pixel size of the image that will be produced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RenderedResource {
    private String resourceId;
    private String fileName;
    private int width;
    private int height;
}
