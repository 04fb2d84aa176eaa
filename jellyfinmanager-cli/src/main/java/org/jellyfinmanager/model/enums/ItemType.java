package org.jellyfinmanager.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * Kind of a watched item. Serialized as the integer code used by backup files.
 */
@Getter
public enum ItemType {
    UNKNOWN(0, null),
    MOVIE(1, "Movie"),
    EPISODE(2, "Episode");

    private final int code;
    private final String jellyfinType;

    ItemType(int code, String jellyfinType) {
        this.code = code;
        this.jellyfinType = jellyfinType;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ItemType fromCode(int code) {
        return Arrays.stream(values())
                .filter(type -> type.code == code)
                .findFirst()
                .orElse(UNKNOWN);
    }

    public static ItemType fromJellyfinType(String jellyfinType) {
        return Arrays.stream(values())
                .filter(type -> type.jellyfinType != null && type.jellyfinType.equals(jellyfinType))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
