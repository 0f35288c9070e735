package im.arun.compextract.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ExtractorConfig {
    private int minChildrenForSignificance = 2;
    private List<String> shapeStyleKeys = new ArrayList<>(List.of(
            "borderRadius", "cornerRadius", "border", "strokeSize", "shadow", "fillType"));
    private List<String> visualStyleKeys = new ArrayList<>(List.of(
            "background", "backgroundColor", "fillColor", "border", "outline", "strokeColor"));
    private List<String> denyNameSubstrings = new ArrayList<>(List.of("#noextract", "_labelpart"));
    private boolean synthesizeVisibilityGears = false;
    private double renderScale = 2.0;
    private String logDir;
    private KeywordTable keywords = new KeywordTable();
}
