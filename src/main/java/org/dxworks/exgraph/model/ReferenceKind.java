package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a cross-module reference directive.
 */
public enum ReferenceKind {
    ALIAS,
    IMPORT,
    USE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReferenceKind fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
