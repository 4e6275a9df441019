package org.dxworks.exgraph.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generic tagged syntax tree node: a kind, an optional textual value, source position
 * and an ordered list of children.
 */
public final class SyntaxNode {
    private final NodeKind kind;
    private final String value;
    private final int line;
    private final int column;
    private final List<SyntaxNode> children;

    public SyntaxNode(NodeKind kind, String value, int line, int column, List<SyntaxNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value;
        this.line = line;
        this.column = column;
        this.children = children == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(children));
    }

    public static SyntaxNode leaf(NodeKind kind, String value, int line, int column) {
        return new SyntaxNode(kind, value, line, column, null);
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public SyntaxNode child(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    public boolean is(NodeKind expected, String expectedValue) {
        return kind == expected && Objects.equals(value, expectedValue);
    }

    /**
     * S-expression rendering, handy in tests and debug output.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    private void render(StringBuilder sb) {
        sb.append('(').append(kind.name().toLowerCase());
        if (value != null) {
            sb.append(' ').append(value);
        }
        for (SyntaxNode child : children) {
            sb.append(' ');
            child.render(sb);
        }
        sb.append(')');
    }
}
