package im.arun.compextract.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates a structured audit trail of one extraction run.
 * Entries are written to a JSON file after every entry when a log directory is
 * configured, otherwise they are kept in memory only.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger() {
        this(null, "extraction");
    }

    public JsonLogger(String logDir, String runName) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        if (logDir == null) {
            this.logPath = null;
            return;
        }

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("%s_%s.json", TreeUtils.safeName(runName), timestamp);

        Path dir = Paths.get(logDir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", dir, e);
        }

        this.logPath = dir.resolve(logFileName);
    }

    public void info(String message) {
        info(message, Map.of());
    }

    public void info(String message, Map<String, ?> details) {
        log("INFO", message, details);
    }

    public void warn(String message, Map<String, ?> details) {
        log("WARNING", message, details);
    }

    public void error(String message, Map<String, ?> details) {
        log("ERROR", message, details);
    }

    private void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        if (details != null && !details.isEmpty()) {
            entry.putAll(details);
        }
        logData.add(entry);

        if (logPath != null) {
            writeToFile();
        }
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(logData);
    }

    public Path getLogPath() {
        return logPath;
    }
}
