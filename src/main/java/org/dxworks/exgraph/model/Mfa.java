package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/**
 * Module, function name and arity of one callable. Serialized as {@code [module, name, arity]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"module", "name", "arity"})
public final class Mfa implements Comparable<Mfa> {

    private static final Comparator<Mfa> ORDER = Comparator
            .comparing((Mfa m) -> m.module)
            .thenComparing(m -> m.name)
            .thenComparingInt(m -> m.arity);

    public final QualifiedName module;
    public final String name;
    public final int arity;

    @JsonCreator
    public Mfa(@JsonProperty("module") QualifiedName module,
               @JsonProperty("name") String name,
               @JsonProperty("arity") int arity) {
        this.module = Objects.requireNonNullElse(module, QualifiedName.UNKNOWN);
        this.name = Objects.requireNonNull(name, "name");
        this.arity = arity;
    }

    public static Mfa of(QualifiedName module, FunctionSignature signature) {
        return new Mfa(module, signature.name, signature.arity);
    }

    @Override
    public int compareTo(Mfa other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mfa)) return false;
        Mfa that = (Mfa) o;
        return arity == that.arity && module.equals(that.module) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, name, arity);
    }

    @Override
    public String toString() {
        return module + "." + name + "/" + arity;
    }
}
