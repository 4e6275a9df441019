package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.model.CallEdge;
import org.dxworks.exgraph.model.CallNode;
import org.dxworks.exgraph.model.CallSite;
import org.dxworks.exgraph.model.DependencyKind;
import org.dxworks.exgraph.model.FunctionSignature;
import org.dxworks.exgraph.model.Graphs;
import org.dxworks.exgraph.model.Mfa;
import org.dxworks.exgraph.model.ModuleCallEdge;
import org.dxworks.exgraph.model.ModuleEdge;
import org.dxworks.exgraph.model.ModuleNode;
import org.dxworks.exgraph.model.ModuleRecord;
import org.dxworks.exgraph.model.QualifiedName;
import org.dxworks.exgraph.model.ReferenceDirective;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Folds module records into the module and call graphs.
 * <p>
 * Records are expected in file order, then in order within each file. Module edges and
 * module call edges are deduplicated keeping the first occurrence; call edges keep their
 * multiplicity.
 */
public class GraphBuilder {

    private final InternalOnlyFilter internalOnlyFilter;

    public GraphBuilder() {
        this(new InternalOnlyFilter());
    }

    public GraphBuilder(InternalOnlyFilter internalOnlyFilter) {
        this.internalOnlyFilter = internalOnlyFilter;
    }

    public Graphs build(List<ModuleRecord> records, boolean internalOnly) {
        Graphs graphs = build(records);
        return internalOnly ? internalOnlyFilter.apply(graphs) : graphs;
    }

    public Graphs build(List<ModuleRecord> records) {
        return new Graphs(
                moduleNodes(records),
                moduleEdges(records),
                callNodes(records),
                callEdges(records),
                moduleCallEdges(records));
    }

    List<ModuleNode> moduleNodes(List<ModuleRecord> records) {
        List<ModuleNode> nodes = new ArrayList<>(records.size());
        for (ModuleRecord record : records) {
            nodes.add(ModuleNode.of(record));
        }
        return nodes;
    }

    List<ModuleEdge> moduleEdges(List<ModuleRecord> records) {
        Set<ModuleEdge> edges = new LinkedHashSet<>();
        for (ModuleRecord record : records) {
            for (CallSite call : record.calls) {
                addModuleEdge(edges, record.name, call.to.module, DependencyKind.CALL);
            }
            for (ReferenceDirective ref : record.refs) {
                addModuleEdge(edges, record.name, ref.target, DependencyKind.of(ref.kind));
            }
        }
        return new ArrayList<>(edges);
    }

    private static void addModuleEdge(Set<ModuleEdge> edges, QualifiedName from, QualifiedName to, DependencyKind kind) {
        if (to.isUnknown() || to.equals(from)) return;
        edges.add(new ModuleEdge(from, to, kind));
    }

    List<CallNode> callNodes(List<ModuleRecord> records) {
        Set<Mfa> mfas = new TreeSet<>();
        for (ModuleRecord record : records) {
            for (FunctionSignature function : record.functions) {
                mfas.add(Mfa.of(record.name, function));
            }
        }
        List<CallNode> nodes = new ArrayList<>(mfas.size());
        for (Mfa mfa : mfas) {
            nodes.add(new CallNode(mfa));
        }
        return nodes;
    }

    List<CallEdge> callEdges(List<ModuleRecord> records) {
        List<CallEdge> edges = new ArrayList<>();
        for (ModuleRecord record : records) {
            for (CallSite call : record.calls) {
                edges.add(CallEdge.of(call));
            }
        }
        return edges;
    }

    List<ModuleCallEdge> moduleCallEdges(List<ModuleRecord> records) {
        Set<ModuleCallEdge> run = new LinkedHashSet<>();
        for (ModuleRecord record : records) {
            Set<ModuleCallEdge> perRecord = new LinkedHashSet<>();
            for (CallSite call : record.calls) {
                if (!call.to.module.equals(record.name)) {
                    perRecord.add(new ModuleCallEdge(record.name, call.to.module));
                }
            }
            run.addAll(perRecord);
        }
        return new ArrayList<>(run);
    }
}
