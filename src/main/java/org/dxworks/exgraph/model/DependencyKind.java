package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Label of a module dependency edge: a function call or one of the reference directives.
 */
public enum DependencyKind {
    CALL,
    ALIAS,
    IMPORT,
    USE;

    public static DependencyKind of(ReferenceKind kind) {
        switch (kind) {
            case ALIAS:
                return ALIAS;
            case IMPORT:
                return IMPORT;
            case USE:
                return USE;
            default:
                throw new IllegalArgumentException("Unsupported reference kind: " + kind);
        }
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DependencyKind fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
