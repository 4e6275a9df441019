package org.dxworks.exgraph.render;

import org.approvaltests.Approvals;
import org.dxworks.exgraph.AnalysisOptions;
import org.dxworks.exgraph.ProjectAnalyzer;
import org.dxworks.exgraph.TestUtils;
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
import org.dxworks.exgraph.model.QualifiedName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DotRendererTest {

    private static final QualifiedName A = QualifiedName.of("A");
    private static final QualifiedName B = QualifiedName.of("B", "Sub");

    private static Graphs sample() {
        Mfa f = new Mfa(A, "f", 0);
        Mfa g = new Mfa(B, "g?", 1);
        return new Graphs(
                List.of(new ModuleNode(A, "lib/a.ex", List.of(new FunctionSignature("f", 0))),
                        new ModuleNode(B, "lib/b/sub.ex", List.of(new FunctionSignature("g?", 1)))),
                List.of(new ModuleEdge(A, B, DependencyKind.CALL), new ModuleEdge(A, B, DependencyKind.ALIAS)),
                List.of(new CallNode(f), new CallNode(g)),
                List.of(new CallEdge(CallKind.REMOTE, f, g), new CallEdge(CallKind.LOCAL, f, new Mfa(A, "h", 0))),
                List.of(new ModuleCallEdge(A, B)));
    }

    @Test
    void moduleGraphLabelsEdgesWithTheirKind() {
        assertEquals(String.join("\n",
                "digraph modules {",
                "  rankdir=LR;",
                "  m_A [label=\"A\"];",
                "  m_B_Sub [label=\"B.Sub\"];",
                "  m_A -> m_B_Sub [label=\"call\"];",
                "  m_A -> m_B_Sub [label=\"alias\"];",
                "}"), new DotRenderer().moduleGraph(sample()));
    }

    @Test
    void callGraphStylesLocalAndRemoteCalls() {
        assertEquals(String.join("\n",
                "digraph calls {",
                "  rankdir=LR;",
                "  c_A_f_0 [label=\"A.f/0\"];",
                "  c_B_Sub_g__1 [label=\"B.Sub.g?/1\"];",
                "  c_A_f_0 -> c_B_Sub_g__1 [style=dashed];",
                "  c_A_f_0 -> c_A_h_0 [style=solid];",
                "}"), new DotRenderer().callGraph(sample()));
    }

    @Test
    void moduleCallGraphHasUnlabelledEdges() {
        assertEquals(String.join("\n",
                "digraph module_calls {",
                "  rankdir=LR;",
                "  m_A [label=\"A\"];",
                "  m_B_Sub [label=\"B.Sub\"];",
                "  m_A -> m_B_Sub;",
                "}"), new DotRenderer().render(sample(), GraphSelection.MODULE_CALLS));
    }

    @Test
    void prunedModulesDisappearWithTheirEdges() {
        DotRenderer renderer = new DotRenderer(List.of(" B.Sub ", ""));

        assertEquals(String.join("\n",
                "digraph modules {",
                "  rankdir=LR;",
                "  m_A [label=\"A\"];",
                "}"), renderer.moduleGraph(sample()));
        assertEquals(String.join("\n",
                "digraph calls {",
                "  rankdir=LR;",
                "  c_A_f_0 [label=\"A.f/0\"];",
                "  c_A_f_0 -> c_A_h_0 [style=solid];",
                "}"), renderer.callGraph(sample()));
    }

    @Test
    void pruneMatchesWholeNamesOnly() {
        String dot = new DotRenderer(List.of("B")).moduleGraph(sample());

        assertTrue(dot.contains("m_B_Sub [label=\"B.Sub\"];"));
    }

    @Test
    void identifiersAreSanitized() {
        assertEquals("m_Foo_Bar", DotRenderer.moduleId(QualifiedName.of("Foo", "Bar")));
        assertEquals("c_Foo___using___1", DotRenderer.callId(new Mfa(QualifiedName.of("Foo"), "__using__", 1)));
        assertEquals("u_apply_2", DotRenderer.callId(new Mfa(QualifiedName.UNKNOWN, "apply", 2)));
    }

    @Test
    void unresolvedModuleNeverSharesAnIdWithAModuleNamedUnknown() {
        QualifiedName erlangUnknown = QualifiedName.of("unknown");

        assertEquals("m_unknown", DotRenderer.moduleId(erlangUnknown));
        assertEquals("u_module", DotRenderer.moduleId(QualifiedName.UNKNOWN));
        assertEquals("c_unknown_apply_2", DotRenderer.callId(new Mfa(erlangUnknown, "apply", 2)));
        assertNotEquals(DotRenderer.callId(new Mfa(erlangUnknown, "apply", 2)),
                DotRenderer.callId(new Mfa(QualifiedName.UNKNOWN, "apply", 2)));
    }

    @Test
    void combinedShopGraph() {
        Graphs graphs = new ProjectAnalyzer().analyze(TestUtils.SHOP, AnalysisOptions.defaults());

        Approvals.verify(new DotRenderer().combined(graphs) + "\n");
    }
}
