package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.model.QualifiedName;
import org.dxworks.exgraph.parser.NodeKind;
import org.dxworks.exgraph.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.exgraph.analyzer.SyntaxHelper.*;

/**
 * Resolves module references against an {@link AliasTable} and applies alias directives to it.
 * <p>
 * Resolution is best effort: anything that cannot be reduced to literal segments at analysis
 * time ({@code var.Foo}, {@code Module.concat(...)}, an unbound {@code __MODULE__}) resolves to
 * {@link QualifiedName#UNKNOWN}, never to an error.
 */
public class AliasResolver {

    private static final String ELIXIR_PREFIX = "Elixir";

    /**
     * @param reference     the reference expression ({@code Foo.Bar}, {@code __MODULE__}, {@code :atom}, ...)
     * @param currentModule the module whose body is being walked, {@code null} or unknown outside any module
     * @param table         aliases in effect
     */
    public QualifiedName resolve(SyntaxNode reference, QualifiedName currentModule, AliasTable table) {
        if (reference == null) return QualifiedName.UNKNOWN;
        switch (reference.getKind()) {
            case ALIASES:
                return resolveAliases(reference, currentModule, table);
            case MODULE_SELF:
                return currentModule != null && currentModule.isKnown() ? currentModule : QualifiedName.UNKNOWN;
            case ATOM:
                return fromAtom(reference.getValue());
            case CALL:
                if (isUnquote(reference)) {
                    return resolve(reference.child(0), currentModule, table);
                }
                return QualifiedName.UNKNOWN;
            default:
                return QualifiedName.UNKNOWN;
        }
    }

    private QualifiedName resolveAliases(SyntaxNode aliases, QualifiedName currentModule, AliasTable table) {
        List<SyntaxNode> parts = aliases.getChildren();
        if (parts.isEmpty()) return QualifiedName.UNKNOWN;

        SyntaxNode head = parts.get(0);
        QualifiedName base;
        if (head.is(NodeKind.SEGMENT)) {
            if (ELIXIR_PREFIX.equals(head.getValue()) && parts.size() > 1) {
                // Elixir.Foo is already fully qualified and never alias-expanded
                base = null;
            } else {
                QualifiedName bound = table.lookup(head.getValue());
                base = bound != null ? bound : QualifiedName.of(head.getValue());
            }
        } else {
            base = resolve(head, currentModule, table);
            if (base.isUnknown()) return QualifiedName.UNKNOWN;
        }

        List<String> rest = new ArrayList<>();
        for (int i = 1; i < parts.size(); i++) {
            SyntaxNode part = parts.get(i);
            if (!part.is(NodeKind.SEGMENT)) return QualifiedName.UNKNOWN;
            rest.add(part.getValue());
        }
        if (base == null) {
            return QualifiedName.of(rest);
        }
        return base.append(rest);
    }

    /**
     * {@code :"Elixir.Foo.Bar"} names the module {@code Foo.Bar}; {@code :ets} names the
     * Erlang module {@code ets}.
     */
    static QualifiedName fromAtom(String atom) {
        if (atom == null || atom.isEmpty()) return QualifiedName.UNKNOWN;
        String name = atom.startsWith(ELIXIR_PREFIX + ".") ? atom.substring(ELIXIR_PREFIX.length() + 1) : atom;
        String[] segments = name.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) return QualifiedName.UNKNOWN;
        }
        return QualifiedName.of(segments);
    }

    /**
     * Applies an {@code alias} directive and returns the targets it references, in order.
     *
     * @param target the aliased expression; a {@link NodeKind#MULTI_ALIAS} expands to one target per child
     * @param as     value of the {@code as:} option, or {@code null}
     */
    public List<QualifiedName> applyAlias(AliasTable table, SyntaxNode target, SyntaxNode as, QualifiedName currentModule) {
        List<QualifiedName> referenced = new ArrayList<>();
        if (target != null && target.is(NodeKind.MULTI_ALIAS)) {
            QualifiedName base = resolve(target.child(0), currentModule, table);
            if (base.isUnknown()) {
                referenced.add(QualifiedName.UNKNOWN);
                return referenced;
            }
            List<SyntaxNode> branches = target.getChildren().subList(1, target.childCount());
            for (SyntaxNode branch : branches) {
                List<String> segments = literalSegments(branch);
                if (segments == null) {
                    referenced.add(QualifiedName.UNKNOWN);
                    continue;
                }
                QualifiedName expanded = base.append(segments);
                table.put(expanded.lastSegment(), expanded);
                referenced.add(expanded);
            }
            return referenced;
        }

        QualifiedName resolved = resolve(target, currentModule, table);
        referenced.add(resolved);
        if (resolved.isUnknown()) return referenced;

        List<String> rename = literalSegments(as);
        if (rename != null && rename.size() == 1) {
            table.put(rename.get(0), resolved);
        } else {
            table.put(resolved.lastSegment(), resolved);
        }
        return referenced;
    }
}
