package org.dxworks.exgraph.render;

import org.dxworks.exgraph.model.CallEdge;
import org.dxworks.exgraph.model.CallKind;
import org.dxworks.exgraph.model.CallNode;
import org.dxworks.exgraph.model.Graphs;
import org.dxworks.exgraph.model.Mfa;
import org.dxworks.exgraph.model.ModuleCallEdge;
import org.dxworks.exgraph.model.ModuleEdge;
import org.dxworks.exgraph.model.ModuleNode;
import org.dxworks.exgraph.model.QualifiedName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Writes graph artifacts in Graphviz DOT.
 * <p>
 * A prune list removes modules from the drawing only: a pruned module's node and every edge
 * touching it are left out. In the call graph this applies to every function of a pruned
 * module.
 */
public class DotRenderer {

    private static final Pattern NON_ID_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private final Set<String> pruned;

    public DotRenderer() {
        this(Set.of());
    }

    /**
     * @param prune qualified module names, matched exactly
     */
    public DotRenderer(Collection<String> prune) {
        this.pruned = prune.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public String moduleGraph(Graphs graphs) {
        List<String> lines = header("modules");
        for (ModuleNode module : graphs.modules) {
            if (isPruned(module.name)) continue;
            lines.add("  " + moduleId(module.name) + " [label=\"" + escape(module.name.toString()) + "\"];");
        }
        for (ModuleEdge edge : graphs.moduleEdges) {
            if (isPruned(edge.from) || isPruned(edge.to)) continue;
            lines.add("  " + moduleId(edge.from) + " -> " + moduleId(edge.to)
                    + " [label=\"" + edge.kind.label() + "\"];");
        }
        return close(lines);
    }

    public String callGraph(Graphs graphs) {
        List<String> lines = header("calls");
        for (CallNode node : graphs.callNodes) {
            if (isPruned(node.mfa.module)) continue;
            lines.add("  " + callId(node.mfa) + " [label=\"" + escape(node.mfa.toString()) + "\"];");
        }
        for (CallEdge edge : graphs.callEdges) {
            if (isPruned(edge.from.module) || isPruned(edge.to.module)) continue;
            String style = edge.kind == CallKind.LOCAL ? "solid" : "dashed";
            lines.add("  " + callId(edge.from) + " -> " + callId(edge.to) + " [style=" + style + "];");
        }
        return close(lines);
    }

    public String moduleCallGraph(Graphs graphs) {
        List<String> lines = header("module_calls");
        for (ModuleNode module : graphs.modules) {
            if (isPruned(module.name)) continue;
            lines.add("  " + moduleId(module.name) + " [label=\"" + escape(module.name.toString()) + "\"];");
        }
        for (ModuleCallEdge edge : graphs.moduleCallEdges) {
            if (isPruned(edge.from) || isPruned(edge.to)) continue;
            lines.add("  " + moduleId(edge.from) + " -> " + moduleId(edge.to) + ";");
        }
        return close(lines);
    }

    /**
     * Module call graph followed by the function-level call graph, in one file.
     */
    public String combined(Graphs graphs) {
        return moduleCallGraph(graphs) + "\n\n// Function-level call graph\n" + callGraph(graphs);
    }

    public String render(Graphs graphs, GraphSelection selection) {
        switch (selection) {
            case MODULES:
                return moduleGraph(graphs);
            case CALLS:
                return callGraph(graphs);
            case MODULE_CALLS:
                return moduleCallGraph(graphs);
            case ALL:
                return combined(graphs);
            default:
                throw new IllegalArgumentException("Unsupported selection: " + selection);
        }
    }

    private boolean isPruned(QualifiedName name) {
        return pruned.contains(name.toString());
    }

    // the unresolved module gets its own prefix so a real module named unknown cannot share its id
    static String moduleId(QualifiedName name) {
        return name.isUnknown() ? "u_module" : "m_" + sanitize(name.toString());
    }

    static String callId(Mfa mfa) {
        String function = mfa.name + "_" + mfa.arity;
        return mfa.module.isUnknown() ? "u_" + sanitize(function) : "c_" + sanitize(mfa.module + "_" + function);
    }

    private static String sanitize(String raw) {
        return NON_ID_CHARS.matcher(raw).replaceAll("_");
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static List<String> header(String name) {
        List<String> lines = new ArrayList<>();
        lines.add("digraph " + name + " {");
        lines.add("  rankdir=LR;");
        return lines;
    }

    private static String close(List<String> lines) {
        lines.add("}");
        return String.join("\n", lines);
    }
}
