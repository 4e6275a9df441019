package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.model.CallEdge;
import org.dxworks.exgraph.model.CallNode;
import org.dxworks.exgraph.model.Graphs;
import org.dxworks.exgraph.model.Mfa;
import org.dxworks.exgraph.model.ModuleCallEdge;
import org.dxworks.exgraph.model.ModuleEdge;
import org.dxworks.exgraph.model.ModuleNode;
import org.dxworks.exgraph.model.QualifiedName;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Restricts graphs to modules defined in the analyzed sources.
 * <p>
 * Runs exactly two passes. The first drops every edge with an endpoint outside the known
 * modules; the second drops call nodes that no surviving call edge touches. Module nodes are
 * never removed.
 */
public class InternalOnlyFilter {

    public Graphs apply(Graphs graphs) {
        Set<QualifiedName> known = knownModules(graphs.modules);

        List<ModuleEdge> moduleEdges = graphs.moduleEdges.stream()
                .filter(e -> known.contains(e.from) && known.contains(e.to))
                .collect(Collectors.toList());
        List<ModuleCallEdge> moduleCallEdges = graphs.moduleCallEdges.stream()
                .filter(e -> known.contains(e.from) && known.contains(e.to))
                .collect(Collectors.toList());
        List<CallEdge> callEdges = graphs.callEdges.stream()
                .filter(e -> known.contains(e.from.module) && known.contains(e.to.module))
                .collect(Collectors.toList());

        Set<Mfa> endpoints = new HashSet<>();
        for (CallEdge edge : callEdges) {
            endpoints.add(edge.from);
            endpoints.add(edge.to);
        }
        List<CallNode> callNodes = graphs.callNodes.stream()
                .filter(n -> endpoints.contains(n.mfa))
                .collect(Collectors.toList());

        return new Graphs(graphs.modules, moduleEdges, callNodes, callEdges, moduleCallEdges);
    }

    static Set<QualifiedName> knownModules(List<ModuleNode> modules) {
        Set<QualifiedName> known = new HashSet<>();
        for (ModuleNode module : modules) {
            if (module.name.isKnown()) known.add(module.name);
        }
        return known;
    }
}
