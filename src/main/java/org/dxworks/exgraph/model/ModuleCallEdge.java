package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Module-to-module edge obtained by collapsing all function-level calls between two modules.
 */
public final class ModuleCallEdge {
    public final QualifiedName from;
    public final QualifiedName to;

    @JsonCreator
    public ModuleCallEdge(@JsonProperty("from") QualifiedName from,
                          @JsonProperty("to") QualifiedName to) {
        this.from = Objects.requireNonNullElse(from, QualifiedName.UNKNOWN);
        this.to = Objects.requireNonNullElse(to, QualifiedName.UNKNOWN);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleCallEdge)) return false;
        ModuleCallEdge that = (ModuleCallEdge) o;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
