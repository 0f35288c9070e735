package im.arun.compextract.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.compextract.config.ConfigLoader;
import im.arun.compextract.config.ExtractorConfig;
import im.arun.compextract.model.ExtractionResult;
import im.arun.compextract.model.UINode;
import im.arun.compextract.render.RenderQueue;
import im.arun.compextract.service.ComponentExtractionService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: reads a laid-out node tree as JSON, extracts components
 * and writes the rewritten tree with its resource table as JSON.
 */
@Command(
    name = "compextract",
    description = "Extract reusable components and look variants from a design node tree",
    mixinStandardHelpOptions = true,
    version = "ComponentExtractor 1.0"
)
public class ComponentExtractorCLI implements Callable<Integer> {

    @Option(names = {"--input"}, description = "Node tree JSON (a node or an array of root nodes)", required = true)
    private String inputPath;

    @Option(names = {"--output"}, description = "Output JSON file path (default: stdout)")
    private String outputPath;

    @Option(names = {"--config"}, description = "Extractor YAML configuration")
    private String configPath;

    @Option(names = {"--visibility-gears"}, description = "Bind state layers to controller pages (yes/no)", defaultValue = "no")
    private String visibilityGears;

    @Option(names = {"--render-scale"}, description = "Scale applied to rendered image sizes")
    private Double renderScale;

    @Option(names = {"--log-dir"}, description = "Directory for the JSON audit log")
    private String logDir;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            err.println("Error: input file not found: " + inputPath);
            return 1;
        }

        Map<String, Object> options = new HashMap<>();
        options.put("synthesizeVisibilityGears", visibilityGears);
        if (renderScale != null) {
            options.put("renderScale", renderScale);
        }
        if (logDir != null) {
            options.put("logDir", logDir);
        }
        ExtractorConfig config = new ConfigLoader(configPath).load(options);

        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);

        List<UINode> roots;
        try {
            roots = readRoots(mapper, input);
        } catch (IOException e) {
            err.println("Error: cannot parse node tree: " + e.getMessage());
            return 1;
        }

        RenderQueue renderQueue = new RenderQueue(config.getRenderScale());
        ComponentExtractionService service = new ComponentExtractionService(config, renderQueue);

        ExtractionResult result;
        try {
            result = service.extract(roots);
        } catch (RuntimeException e) {
            err.println("Error extracting components: " + e.getMessage());
            return 1;
        }

        String jsonOutput = mapper.writeValueAsString(result);
        PrintWriter summary;
        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), jsonOutput);
            out.println("Output written to: " + outputPath);
            summary = out;
        } else {
            out.println(jsonOutput);
            // Keep stdout pure JSON
            summary = err;
        }

        summary.printf("Components: %d, resources: %d, images queued: %d, dropped: %d%n",
                result.getGroupCount(),
                result.getResources().size(),
                renderQueue.getQueue().size(),
                result.getDroppedResources().size());
        return result.getDroppedResources().isEmpty() ? 0 : 2;
    }

    private List<UINode> readRoots(ObjectMapper mapper, Path input) throws IOException {
        JsonNode tree = mapper.readTree(input.toFile());
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return new ArrayList<>();
        }
        if (tree.isArray()) {
            return mapper.convertValue(tree, new TypeReference<List<UINode>>() {});
        }
        List<UINode> roots = new ArrayList<>();
        roots.add(mapper.treeToValue(tree, UINode.class));
        return roots;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ComponentExtractorCLI()).execute(args);
        System.exit(exitCode);
    }
}
