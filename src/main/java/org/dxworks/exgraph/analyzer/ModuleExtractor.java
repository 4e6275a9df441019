package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.model.CallSite;
import org.dxworks.exgraph.model.FunctionSignature;
import org.dxworks.exgraph.model.Mfa;
import org.dxworks.exgraph.model.ModuleRecord;
import org.dxworks.exgraph.model.QualifiedName;
import org.dxworks.exgraph.model.ReferenceDirective;
import org.dxworks.exgraph.model.ReferenceKind;
import org.dxworks.exgraph.parser.NodeKind;
import org.dxworks.exgraph.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.dxworks.exgraph.analyzer.SyntaxHelper.*;

/**
 * Walks a parsed file and produces one {@link ModuleRecord} per {@code defmodule}, nested
 * ones included.
 * <p>
 * The walk is depth-first pre-order, so calls and references keep their source order. One
 * {@link AliasTable} is shared by the whole body of a module: an {@code alias} written inside
 * one function stays in effect for the functions that follow it.
 */
public class ModuleExtractor {

    private static final Set<String> FUNCTION_DEFINITIONS = Set.of("def", "defp", "defmacro", "defmacrop");
    private static final String MODULE_DEFINITION = "defmodule";
    private static final String ALIAS = "alias";
    private static final String IMPORT = "import";
    private static final String USE = "use";

    private final AliasResolver resolver;

    public ModuleExtractor() {
        this(new AliasResolver());
    }

    public ModuleExtractor(AliasResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @return records in encounter order; an enclosing module precedes the modules nested in it
     */
    public List<ModuleRecord> extract(SyntaxNode root, String file) {
        List<ModuleRecord> records = new ArrayList<>();
        new FileWalk(file, records).findModules(root, null);
        return records;
    }

    /** State of one module body being walked. */
    private static final class ModuleScope {
        final QualifiedName module;
        final AliasTable aliases = AliasTable.empty();
        final ModuleRecord.Builder record;

        ModuleScope(QualifiedName module, String file) {
            this.module = module;
            this.record = new ModuleRecord.Builder(module, file);
        }
    }

    private final class FileWalk {
        private final String file;
        private final List<ModuleRecord> records;

        FileWalk(String file, List<ModuleRecord> records) {
            this.file = file;
            this.records = records;
        }

        /** Looks for module definitions only; nothing else outside a module body is recorded. */
        void findModules(SyntaxNode node, ModuleScope enclosing) {
            if (node == null) return;
            if (isCallTo(node, MODULE_DEFINITION)) {
                extractModule(node, enclosing);
                return;
            }
            for (SyntaxNode child : node.getChildren()) {
                findModules(child, enclosing);
            }
        }

        private void extractModule(SyntaxNode definition, ModuleScope enclosing) {
            SyntaxNode nameNode = definition.child(0);
            QualifiedName enclosingName = enclosing != null ? enclosing.module : null;
            // the name is taken as written: no enclosing prefix, no aliases in effect
            QualifiedName name = resolver.resolve(nameNode, enclosingName, AliasTable.empty());

            int slot = records.size();
            records.add(null);
            ModuleScope scope = new ModuleScope(name, file);
            walkModuleBody(doBody(definition), scope);
            records.set(slot, scope.record.build());
        }

        private void walkModuleBody(SyntaxNode node, ModuleScope scope) {
            if (node == null) return;
            if (node.is(NodeKind.BLOCK)) {
                for (SyntaxNode child : node.getChildren()) {
                    walkModuleBody(child, scope);
                }
                return;
            }
            if (node.is(NodeKind.CALL)) {
                String name = node.getValue();
                if (FUNCTION_DEFINITIONS.contains(name)) {
                    defineFunction(node, scope);
                    return;
                }
                if (MODULE_DEFINITION.equals(name)) {
                    extractModule(node, scope);
                    return;
                }
                if (isDirective(name)) {
                    directive(node, scope);
                    return;
                }
            }
            findModules(node, scope);
        }

        private void defineFunction(SyntaxNode definition, ModuleScope scope) {
            SyntaxNode head = definition.child(0);
            if (head != null && head.is(NodeKind.OPERATOR, "when")) {
                head = head.child(0);
            }
            FunctionSignature signature = signatureOf(head);
            if (signature == null) return;

            scope.record.addFunction(signature);
            Mfa from = Mfa.of(scope.module, signature);
            SyntaxNode body = trailingKeywords(definition);
            if (body == null || definition.childCount() < 2) return;
            for (SyntaxNode section : body.getChildren()) {
                for (SyntaxNode child : section.getChildren()) {
                    walkFunctionBody(child, scope, from);
                }
            }
        }

        private FunctionSignature signatureOf(SyntaxNode head) {
            if (head == null) return null;
            if (head.is(NodeKind.CALL)) {
                return new FunctionSignature(head.getValue(), head.childCount());
            }
            if (head.is(NodeKind.VARIABLE)) {
                return new FunctionSignature(head.getValue(), 0);
            }
            return null;
        }

        private void walkFunctionBody(SyntaxNode node, ModuleScope scope, Mfa from) {
            switch (node.getKind()) {
                case CALL:
                    walkCall(node, scope, from);
                    return;
                case REMOTE_CALL: {
                    QualifiedName target = resolver.resolve(node.child(0), scope.module, scope.aliases);
                    scope.record.addCall(CallSite.remote(from, new Mfa(target, node.getValue(), node.childCount() - 1)));
                    descend(node, scope, from);
                    return;
                }
                case VARIABLE:
                case ATOM:
                case ALIASES:
                case SEGMENT:
                case MODULE_SELF:
                case MULTI_ALIAS:
                    return;
                default:
                    descend(node, scope, from);
            }
        }

        private void walkCall(SyntaxNode call, ModuleScope scope, Mfa from) {
            String name = call.getValue();
            if (FUNCTION_DEFINITIONS.contains(name)) {
                descend(call, scope, from);
            } else if (MODULE_DEFINITION.equals(name)) {
                extractModule(call, scope);
            } else if (isDirective(name)) {
                directive(call, scope);
            } else {
                scope.record.addCall(CallSite.local(from, new Mfa(scope.module, name, call.childCount())));
                descend(call, scope, from);
            }
        }

        private void descend(SyntaxNode node, ModuleScope scope, Mfa from) {
            for (SyntaxNode child : node.getChildren()) {
                walkFunctionBody(child, scope, from);
            }
        }

        private void directive(SyntaxNode call, ModuleScope scope) {
            SyntaxNode target = call.child(0);
            if (target == null) return;

            if (ALIAS.equals(call.getValue())) {
                SyntaxNode as = keywordValue(call.child(1), "as");
                for (QualifiedName aliased : resolver.applyAlias(scope.aliases, target, as, scope.module)) {
                    scope.record.addRef(new ReferenceDirective(ReferenceKind.ALIAS, aliased));
                }
                return;
            }
            ReferenceKind kind = IMPORT.equals(call.getValue()) ? ReferenceKind.IMPORT : ReferenceKind.USE;
            QualifiedName resolved = resolver.resolve(target, scope.module, scope.aliases);
            scope.record.addRef(new ReferenceDirective(kind, resolved));
        }
    }

    private static boolean isDirective(String name) {
        return ALIAS.equals(name) || IMPORT.equals(name) || USE.equals(name);
    }
}
