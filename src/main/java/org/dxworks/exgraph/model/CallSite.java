package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One recorded invocation. {@code from} is always the enclosing definition,
 * {@code to.module} may be {@link QualifiedName#UNKNOWN}.
 */
public final class CallSite {
    public final CallKind kind;
    public final Mfa from;
    public final Mfa to;

    @JsonCreator
    public CallSite(@JsonProperty("kind") CallKind kind,
                    @JsonProperty("from") Mfa from,
                    @JsonProperty("to") Mfa to) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public static CallSite local(Mfa from, Mfa to) {
        return new CallSite(CallKind.LOCAL, from, to);
    }

    public static CallSite remote(Mfa from, Mfa to) {
        return new CallSite(CallKind.REMOTE, from, to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallSite)) return false;
        CallSite that = (CallSite) o;
        return kind == that.kind && from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, from, to);
    }

    @Override
    public String toString() {
        return kind.label() + " " + from + " -> " + to;
    }
}
