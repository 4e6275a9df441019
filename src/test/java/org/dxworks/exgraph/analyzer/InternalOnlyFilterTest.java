package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.model.CallEdge;
import org.dxworks.exgraph.model.CallKind;
import org.dxworks.exgraph.model.CallNode;
import org.dxworks.exgraph.model.DependencyKind;
import org.dxworks.exgraph.model.FunctionSignature;
import org.dxworks.exgraph.model.Graphs;
import org.dxworks.exgraph.model.Mfa;
import org.dxworks.exgraph.model.ModuleCallEdge;
import org.dxworks.exgraph.model.ModuleEdge;
import org.dxworks.exgraph.model.ModuleNode;
import org.dxworks.exgraph.model.ModuleRecord;
import org.dxworks.exgraph.model.QualifiedName;
import org.dxworks.exgraph.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.dxworks.exgraph.TestUtils.extract;
import static org.junit.jupiter.api.Assertions.*;

class InternalOnlyFilterTest {

    private final InternalOnlyFilter filter = new InternalOnlyFilter();

    private static QualifiedName q(String dotted) {
        return QualifiedName.parse(dotted);
    }

    private static Mfa mfa(String module, String name, int arity) {
        return new Mfa(q(module), name, arity);
    }

    private static ModuleNode module(String name, FunctionSignature... functions) {
        return new ModuleNode(q(name), name.toLowerCase() + ".ex", List.of(functions));
    }

    @Test
    void callsIntoUnscannedModulesAreDropped() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule M do\n"
                        + "  def a, do: X.g()\n"
                        + "end\n");
        Graphs unfiltered = new GraphBuilder().build(records);
        assertEquals(1, unfiltered.moduleEdges.size());
        assertEquals(1, unfiltered.callEdges.size());
        assertEquals(1, unfiltered.callNodes.size());

        Graphs graphs = filter.apply(unfiltered);

        assertEquals(1, graphs.modules.size());
        assertTrue(graphs.moduleEdges.isEmpty());
        assertTrue(graphs.moduleCallEdges.isEmpty());
        assertTrue(graphs.callEdges.isEmpty());
        assertTrue(graphs.callNodes.isEmpty());
    }

    @Test
    void unknownTargetsAreKeptUnfilteredAndDroppedFiltered() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule M do\n"
                        + "  def a(mod), do: mod.g()\n"
                        + "  def b, do: a(M)\n"
                        + "end\n");

        Graphs unfiltered = new GraphBuilder().build(records, false);
        CallEdge dynamic = new CallEdge(CallKind.REMOTE, mfa("M", "a", 1), new Mfa(QualifiedName.UNKNOWN, "g", 0));
        assertTrue(unfiltered.callEdges.contains(dynamic));
        assertTrue(unfiltered.moduleCallEdges.contains(new ModuleCallEdge(q("M"), QualifiedName.UNKNOWN)));

        Graphs filtered = new GraphBuilder().build(records, true);
        assertEquals(List.of(new CallEdge(CallKind.LOCAL, mfa("M", "b", 0), mfa("M", "a", 1))), filtered.callEdges);
        assertTrue(filtered.moduleCallEdges.isEmpty());
        assertEquals(List.of(new CallNode(mfa("M", "a", 1)), new CallNode(mfa("M", "b", 0))), filtered.callNodes);
    }

    @Test
    void unknownModuleNameIsNeverKnown() {
        Set<QualifiedName> known = InternalOnlyFilter.knownModules(List.of(
                module("A"), new ModuleNode(QualifiedName.UNKNOWN, "x.ex", List.of())));

        assertEquals(Set.of(q("A")), known);
    }

    @Test
    void edgesFromAnUnknownModuleAreDropped() {
        Mfa fromUnknown = new Mfa(QualifiedName.UNKNOWN, "f", 0);
        Graphs graphs = new Graphs(
                List.of(module("A", new FunctionSignature("g", 0)), new ModuleNode(QualifiedName.UNKNOWN, "x.ex", List.of())),
                List.of(new ModuleEdge(QualifiedName.UNKNOWN, q("A"), DependencyKind.CALL)),
                List.of(new CallNode(mfa("A", "g", 0)), new CallNode(fromUnknown)),
                List.of(new CallEdge(CallKind.REMOTE, fromUnknown, mfa("A", "g", 0))),
                List.of(new ModuleCallEdge(QualifiedName.UNKNOWN, q("A"))));

        Graphs filtered = filter.apply(graphs);

        assertTrue(filtered.moduleEdges.isEmpty());
        assertTrue(filtered.callEdges.isEmpty());
        assertTrue(filtered.moduleCallEdges.isEmpty());
        assertTrue(filtered.callNodes.isEmpty());
        assertEquals(2, filtered.modules.size());
    }

    @Test
    void callNodesReachedOnlyThroughDroppedEdgesAreRemoved() {
        Graphs graphs = new Graphs(
                List.of(module("A", new FunctionSignature("f", 0), new FunctionSignature("g", 0), new FunctionSignature("idle", 0)),
                        module("B", new FunctionSignature("h", 1))),
                List.of(new ModuleEdge(q("A"), q("B"), DependencyKind.CALL),
                        new ModuleEdge(q("A"), q("Logger"), DependencyKind.CALL)),
                List.of(new CallNode(mfa("A", "f", 0)), new CallNode(mfa("A", "g", 0)),
                        new CallNode(mfa("A", "idle", 0)), new CallNode(mfa("B", "h", 1))),
                List.of(new CallEdge(CallKind.REMOTE, mfa("A", "f", 0), mfa("B", "h", 1)),
                        new CallEdge(CallKind.REMOTE, mfa("A", "g", 0), mfa("Logger", "info", 1)),
                        new CallEdge(CallKind.REMOTE, mfa("A", "f", 0), mfa("B", "h", 1))),
                List.of(new ModuleCallEdge(q("A"), q("B")), new ModuleCallEdge(q("A"), q("Logger"))));

        Graphs filtered = filter.apply(graphs);

        assertEquals(List.of(new ModuleEdge(q("A"), q("B"), DependencyKind.CALL)), filtered.moduleEdges);
        assertEquals(List.of(new ModuleCallEdge(q("A"), q("B"))), filtered.moduleCallEdges);
        assertEquals(2, filtered.callEdges.size());
        assertEquals(List.of(new CallNode(mfa("A", "f", 0)), new CallNode(mfa("B", "h", 1))), filtered.callNodes);
    }

    @Test
    void everySurvivingEdgeEndpointIsKnown() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule A do\n"
                        + "  alias B.Helper\n"
                        + "  def run(x), do: Helper.go(x) |> Enum.count()\n"
                        + "end\n"
                        + "defmodule B.Helper do\n"
                        + "  import Kernel\n"
                        + "  def go(x), do: A.run(x)\n"
                        + "end\n");

        Graphs filtered = new GraphBuilder().build(records, true);
        Set<QualifiedName> known = InternalOnlyFilter.knownModules(filtered.modules);

        assertFalse(filtered.moduleEdges.isEmpty());
        for (ModuleEdge edge : filtered.moduleEdges) {
            assertTrue(known.contains(edge.from) && known.contains(edge.to), edge.toString());
        }
        for (ModuleCallEdge edge : filtered.moduleCallEdges) {
            assertTrue(known.contains(edge.from) && known.contains(edge.to), edge.toString());
        }
        for (CallEdge edge : filtered.callEdges) {
            assertTrue(known.contains(edge.from.module) && known.contains(edge.to.module), edge.toString());
            assertTrue(filtered.callNodes.contains(new CallNode(edge.from)));
        }
    }

    @Test
    void filteringTwiceChangesNothing() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule A do\n"
                        + "  def f, do: B.g(List.first([]))\n"
                        + "end\n"
                        + "defmodule B do\n"
                        + "  def g(x), do: x\n"
                        + "end\n");

        Graphs once = new GraphBuilder().build(records, true);

        assertEquals(once, filter.apply(once));
        assertEquals(List.of(new CallNode(mfa("A", "f", 0)), new CallNode(mfa("B", "g", 1))), once.callNodes);
    }
}
