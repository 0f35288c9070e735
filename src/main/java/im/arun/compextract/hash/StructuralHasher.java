package im.arun.compextract.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.compextract.model.UINode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical fingerprint of a subtree's structure: type, size, shape-defining styles
 * and the fingerprints of the children in order. Text, linked resources and colors
 * are ignored, so instances that differ only in content or skin hash identically.
 */
public class StructuralHasher {
    private static final Logger logger = LoggerFactory.getLogger(StructuralHasher.class);

    private final List<String> shapeStyleKeys;
    private final ObjectMapper objectMapper;

    public StructuralHasher(List<String> shapeStyleKeys) {
        this.shapeStyleKeys = List.copyOf(shapeStyleKeys);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String hash(UINode node) {
        List<Object> parts = new ArrayList<>();
        parts.add(node.getType().name());
        parts.add(node.getWidth());
        parts.add(node.getHeight());

        for (String key : shapeStyleKeys) {
            Object value = node.style(key);
            if (value != null) {
                parts.add(key);
                parts.add(serializeValue(value));
            }
        }

        for (UINode child : node.getChildren()) {
            parts.add(hash(child));
        }

        return serializeValue(parts);
    }

    private String serializeValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // Unserializable style values still contribute their type to the hash
            logger.debug("Falling back to class name for style value: {}", e.getMessage());
            return value.getClass().getName();
        }
    }
}
