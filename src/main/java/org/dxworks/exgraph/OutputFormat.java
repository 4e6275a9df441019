package org.dxworks.exgraph;

import java.util.Locale;

public enum OutputFormat {
    JSON("json"),
    DOT("dot");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static OutputFormat fromOption(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "json":
                return JSON;
            case "dot":
                return DOT;
            default:
                throw new IllegalArgumentException("Unknown format: " + value);
        }
    }
}
