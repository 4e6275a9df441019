package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CallKind {
    LOCAL,
    REMOTE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CallKind fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
