package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class CallEdge {
    public final CallKind kind;
    public final Mfa from;
    public final Mfa to;

    @JsonCreator
    public CallEdge(@JsonProperty("kind") CallKind kind,
                    @JsonProperty("from") Mfa from,
                    @JsonProperty("to") Mfa to) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public static CallEdge of(CallSite call) {
        return new CallEdge(call.kind, call.from, call.to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallEdge)) return false;
        CallEdge that = (CallEdge) o;
        return kind == that.kind && from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, from, to);
    }

    @Override
    public String toString() {
        return from + " -[" + kind.label() + "]-> " + to;
    }
}
