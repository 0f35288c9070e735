package im.arun.compextract.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.compextract.model.UINode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static im.arun.compextract.TestNodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComponentExtractorCLITest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = new CommandLine(new ComponentExtractorCLI());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    private Path writeInput(Object tree) throws Exception {
        Path input = tempDir.resolve("tree.json");
        mapper.writeValue(input.toFile(), tree);
        return input;
    }

    @Test
    void testExtractToFile() throws Exception {
        UINode screen = screen(button("Button/Default", "#0000FF", "OK"), button("Button/Pressed", "#FF0000", "OK"));
        Path input = writeInput(List.of(screen));
        Path output = tempDir.resolve("out.json");

        int exitCode = cmd.execute("--input", input.toString(), "--output", output.toString());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("Output written to:"));
        assertTrue(out.toString().contains("Components: 1"));

        JsonNode result = mapper.readTree(output.toFile());
        assertEquals(1, result.get("group_count").asInt());
        JsonNode component = result.get("resources").get(0);
        assertEquals("comp_0", component.get("id").asText());
        assertEquals("component", component.get("type").asText());

        JsonNode refs = result.get("roots").get(0).get("children");
        assertEquals(2, refs.size());
        assertTrue(refs.get(0).get("asComponent").asBoolean());
        assertEquals(1, refs.get(1).get("overrides").get("page").asInt());
        // Bookkeeping never leaks into the output
        assertNull(refs.get(0).get("extracted"));
        assertNull(refs.get(0).get("structuralHash"));
    }

    @Test
    void testSingleRootToStdout() throws Exception {
        Path input = writeInput(screen(card("Card", "A"), card("Card", "B")));

        int exitCode = cmd.execute("--input", input.toString(), "--render-scale", "1");

        assertEquals(0, exitCode);
        JsonNode result = mapper.readTree(out.toString());
        assertEquals(1, result.get("group_count").asInt());
        assertTrue(err.toString().contains("images queued: 1"));
    }

    @Test
    void testVisibilityGearsFlag() throws Exception {
        UINode selected = shape("Selected", "#0000FF");
        UINode tab = component("Tab", shape("Normal", "#FFFFFF"), selected, text("Label", "Home"));
        Path input = writeInput(screen(tab));
        Path output = tempDir.resolve("tabs.json");

        int exitCode = cmd.execute("--input", input.toString(), "--output", output.toString(),
                "--visibility-gears", "yes");

        assertEquals(0, exitCode);
        JsonNode data = mapper.readTree(mapper.readTree(output.toFile()).get("resources").get(0).get("data").asText());
        JsonNode selectedLayer = data.get("children").get(1);
        assertEquals("gearDisplay", selectedLayer.get("gears").get(0).get("type").asText());
        assertEquals("3", selectedLayer.get("gears").get(0).get("pages").asText());
    }

    @Test
    void testMissingInput() {
        int exitCode = cmd.execute("--input", tempDir.resolve("missing.json").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("input file not found"));
    }

    @Test
    void testMalformedInput() throws Exception {
        Path input = tempDir.resolve("broken.json");
        Files.writeString(input, "{ not json");

        assertEquals(1, cmd.execute("--input", input.toString()));
        assertTrue(err.toString().contains("cannot parse node tree"));
    }
}
