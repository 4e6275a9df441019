package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Normalized extraction result for one {@code defmodule}.
 * <p>
 * Functions are unique and sorted by name then arity; calls and refs keep the order
 * in which they were encountered in the source.
 */
public final class ModuleRecord {
    public final QualifiedName name;
    public final String file;
    public final List<FunctionSignature> functions;
    public final List<CallSite> calls;
    public final List<ReferenceDirective> refs;

    @JsonCreator
    public ModuleRecord(@JsonProperty("name") QualifiedName name,
                        @JsonProperty("file") String file,
                        @JsonProperty("functions") List<FunctionSignature> functions,
                        @JsonProperty("calls") List<CallSite> calls,
                        @JsonProperty("refs") List<ReferenceDirective> refs) {
        this.name = Objects.requireNonNullElse(name, QualifiedName.UNKNOWN);
        this.file = file;
        this.functions = List.copyOf(new TreeSet<>(functions == null ? List.of() : functions));
        this.calls = calls == null ? List.of() : List.copyOf(calls);
        this.refs = refs == null ? List.of() : List.copyOf(refs);
    }

    /**
     * Mutable accumulator filled by a single traversal of a module body.
     */
    public static final class Builder {
        private final QualifiedName name;
        private final String file;
        private final TreeSet<FunctionSignature> functions = new TreeSet<>();
        private final List<CallSite> calls = new ArrayList<>();
        private final List<ReferenceDirective> refs = new ArrayList<>();

        public Builder(QualifiedName name, String file) {
            this.name = name;
            this.file = file;
        }

        public Builder addFunction(FunctionSignature signature) {
            functions.add(signature);
            return this;
        }

        public Builder addCall(CallSite call) {
            calls.add(call);
            return this;
        }

        public Builder addRef(ReferenceDirective ref) {
            refs.add(ref);
            return this;
        }

        public ModuleRecord build() {
            return new ModuleRecord(name, file, new ArrayList<>(functions), calls, refs);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleRecord)) return false;
        ModuleRecord that = (ModuleRecord) o;
        return name.equals(that.name) && Objects.equals(file, that.file)
                && functions.equals(that.functions) && calls.equals(that.calls) && refs.equals(that.refs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, file, functions, calls, refs);
    }

    @Override
    public String toString() {
        return "ModuleRecord{" + name + " @ " + file + ", functions=" + functions
                + ", calls=" + calls.size() + ", refs=" + refs.size() + "}";
    }
}
