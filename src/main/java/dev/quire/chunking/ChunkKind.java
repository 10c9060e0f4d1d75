package dev.quire.chunking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of an emitted chunk: a whole top-level unit, or one piece of a unit that had to be split.
 */
public enum ChunkKind {
    PRIMARY_UNIT("primary_unit"),
    SUB_SEGMENT("sub_segment");

    private final String value;

    ChunkKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ChunkKind fromValue(String value) {
        for (ChunkKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Invalid chunk kind: " + value);
    }
}
