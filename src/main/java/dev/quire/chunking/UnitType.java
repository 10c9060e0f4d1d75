package dev.quire.chunking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a top-level unit of a stylesheet holds.
 */
public enum UnitType {
    HELPER_TEMPLATE("helper_template"),
    MAIN_TEMPLATE("main_template"),
    FUNCTION("function"),
    IMPORT_SECTION("import_section"),
    VARIABLE_SECTION("variable_section"),
    NAMESPACE_SECTION("namespace_section"),
    /** A whole document emitted as a single chunk. */
    STYLESHEET("stylesheet"),
    UNKNOWN("unknown");

    private final String value;

    UnitType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static UnitType fromValue(String value) {
        for (UnitType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid unit type: " + value);
    }
}
