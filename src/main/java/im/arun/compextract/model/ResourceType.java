package im.arun.compextract.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResourceType {
    IMAGE("image"),
    COMPONENT("component"),
    SOUND("sound"),
    FONT("font"),
    MOVIE_CLIP("movieclip"),
    MISC("misc");

    private final String value;

    ResourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
