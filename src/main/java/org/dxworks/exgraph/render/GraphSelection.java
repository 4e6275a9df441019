package org.dxworks.exgraph.render;

import java.util.Locale;

/**
 * Which artifacts an output contains.
 */
public enum GraphSelection {
    /** Module nodes and module dependency edges. */
    MODULES("modules"),
    /** Function-level call nodes and call edges. */
    CALLS("calls"),
    /** Module nodes and aggregated module call edges. */
    MODULE_CALLS("module_calls"),
    /** Everything; written as {@code graphs.*}. */
    ALL("graphs");

    private final String fileStem;

    GraphSelection(String fileStem) {
        this.fileStem = fileStem;
    }

    public String fileName(String extension) {
        return fileStem + "." + extension;
    }

    /**
     * Parses a {@code --graph} value. {@code both} selects every artifact.
     */
    public static GraphSelection fromOption(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "modules":
                return MODULES;
            case "calls":
                return CALLS;
            case "module_calls":
                return MODULE_CALLS;
            case "both":
            case "all":
                return ALL;
            default:
                throw new IllegalArgumentException("Unknown graph type: " + value);
        }
    }
}
