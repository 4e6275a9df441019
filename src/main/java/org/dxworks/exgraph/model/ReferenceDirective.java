package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class ReferenceDirective {
    public final ReferenceKind kind;
    public final QualifiedName target;

    @JsonCreator
    public ReferenceDirective(@JsonProperty("kind") ReferenceKind kind,
                              @JsonProperty("target") QualifiedName target) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = Objects.requireNonNullElse(target, QualifiedName.UNKNOWN);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceDirective)) return false;
        ReferenceDirective that = (ReferenceDirective) o;
        return kind == that.kind && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, target);
    }

    @Override
    public String toString() {
        return kind.label() + " " + target;
    }
}
