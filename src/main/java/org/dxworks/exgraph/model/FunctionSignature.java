package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

public final class FunctionSignature implements Comparable<FunctionSignature> {

    private static final Comparator<FunctionSignature> ORDER = Comparator
            .comparing((FunctionSignature f) -> f.name)
            .thenComparingInt(f -> f.arity);

    public final String name;
    public final int arity;

    @JsonCreator
    public FunctionSignature(@JsonProperty("name") String name, @JsonProperty("arity") int arity) {
        if (arity < 0) {
            throw new IllegalArgumentException("Negative arity for " + name + ": " + arity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.arity = arity;
    }

    @Override
    public int compareTo(FunctionSignature other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionSignature)) return false;
        FunctionSignature that = (FunctionSignature) o;
        return arity == that.arity && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arity);
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
