package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The five graph artifacts derived from one analysis run.
 */
public final class Graphs {
    @JsonProperty("modules")
    public final List<ModuleNode> modules;
    @JsonProperty("module_edges")
    public final List<ModuleEdge> moduleEdges;
    @JsonProperty("call_nodes")
    public final List<CallNode> callNodes;
    @JsonProperty("call_edges")
    public final List<CallEdge> callEdges;
    @JsonProperty("module_call_edges")
    public final List<ModuleCallEdge> moduleCallEdges;

    @JsonCreator
    public Graphs(@JsonProperty("modules") List<ModuleNode> modules,
                  @JsonProperty("module_edges") List<ModuleEdge> moduleEdges,
                  @JsonProperty("call_nodes") List<CallNode> callNodes,
                  @JsonProperty("call_edges") List<CallEdge> callEdges,
                  @JsonProperty("module_call_edges") List<ModuleCallEdge> moduleCallEdges) {
        this.modules = copy(modules);
        this.moduleEdges = copy(moduleEdges);
        this.callNodes = copy(callNodes);
        this.callEdges = copy(callEdges);
        this.moduleCallEdges = copy(moduleCallEdges);
    }

    public static Graphs empty() {
        return new Graphs(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Graphs)) return false;
        Graphs that = (Graphs) o;
        return modules.equals(that.modules) && moduleEdges.equals(that.moduleEdges)
                && callNodes.equals(that.callNodes) && callEdges.equals(that.callEdges)
                && moduleCallEdges.equals(that.moduleCallEdges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modules, moduleEdges, callNodes, callEdges, moduleCallEdges);
    }
}
