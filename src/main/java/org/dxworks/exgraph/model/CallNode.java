package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class CallNode {
    public final Mfa mfa;

    @JsonCreator
    public CallNode(@JsonProperty("mfa") Mfa mfa) {
        this.mfa = Objects.requireNonNull(mfa, "mfa");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallNode)) return false;
        return mfa.equals(((CallNode) o).mfa);
    }

    @Override
    public int hashCode() {
        return mfa.hashCode();
    }

    @Override
    public String toString() {
        return mfa.toString();
    }
}
