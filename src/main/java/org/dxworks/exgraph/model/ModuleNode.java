package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public final class ModuleNode {
    public final QualifiedName name;
    public final String file;
    public final List<FunctionSignature> functions;

    @JsonCreator
    public ModuleNode(@JsonProperty("name") QualifiedName name,
                      @JsonProperty("file") String file,
                      @JsonProperty("functions") List<FunctionSignature> functions) {
        this.name = Objects.requireNonNullElse(name, QualifiedName.UNKNOWN);
        this.file = file;
        this.functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public static ModuleNode of(ModuleRecord record) {
        return new ModuleNode(record.name, record.file, record.functions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleNode)) return false;
        ModuleNode that = (ModuleNode) o;
        return name.equals(that.name) && Objects.equals(file, that.file) && functions.equals(that.functions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, file, functions);
    }

    @Override
    public String toString() {
        return name + " (" + file + ")";
    }
}
