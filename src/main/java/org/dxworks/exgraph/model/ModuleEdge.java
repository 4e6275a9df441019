package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class ModuleEdge {
    public final QualifiedName from;
    public final QualifiedName to;
    public final DependencyKind kind;

    @JsonCreator
    public ModuleEdge(@JsonProperty("from") QualifiedName from,
                      @JsonProperty("to") QualifiedName to,
                      @JsonProperty("kind") DependencyKind kind) {
        this.from = Objects.requireNonNullElse(from, QualifiedName.UNKNOWN);
        this.to = Objects.requireNonNullElse(to, QualifiedName.UNKNOWN);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleEdge)) return false;
        ModuleEdge that = (ModuleEdge) o;
        return from.equals(that.from) && to.equals(that.to) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, kind);
    }

    @Override
    public String toString() {
        return from + " -[" + kind.label() + "]-> " + to;
    }
}
