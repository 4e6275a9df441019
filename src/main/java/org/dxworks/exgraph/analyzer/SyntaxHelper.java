package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.parser.NodeKind;
import org.dxworks.exgraph.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

public class SyntaxHelper {

    private SyntaxHelper() {
    }

    public static boolean isCallTo(SyntaxNode node, String... names) {
        if (node == null || !node.is(NodeKind.CALL)) return false;
        for (String name : names) {
            if (name.equals(node.getValue())) return true;
        }
        return false;
    }

    public static boolean isUnquote(SyntaxNode node) {
        return isCallTo(node, "unquote") && node.childCount() == 1;
    }

    /**
     * Value of {@code key} in a keyword list ({@code as: Foo}, {@code do: ...}), or {@code null}.
     */
    public static SyntaxNode keywordValue(SyntaxNode keywords, String key) {
        if (keywords == null || !keywords.is(NodeKind.KEYWORDS)) return null;
        for (SyntaxNode pair : keywords.getChildren()) {
            if (pair.is(NodeKind.PAIR, key)) return pair.child(0);
        }
        return null;
    }

    /**
     * Trailing keyword argument of a call: the {@code do ... end} block or an inline
     * {@code , do: ...} / {@code , as: ...} list.
     */
    public static SyntaxNode trailingKeywords(SyntaxNode call) {
        if (call == null || call.childCount() == 0) return null;
        SyntaxNode last = call.child(call.childCount() - 1);
        return last.is(NodeKind.KEYWORDS) ? last : null;
    }

    public static SyntaxNode doBody(SyntaxNode call) {
        return keywordValue(trailingKeywords(call), "do");
    }

    /**
     * Segments of a literal alias such as {@code Foo.Bar}; {@code null} for anything else.
     */
    public static List<String> literalSegments(SyntaxNode node) {
        if (node == null || !node.is(NodeKind.ALIASES) || node.childCount() == 0) return null;
        List<String> segments = new ArrayList<>();
        for (SyntaxNode part : node.getChildren()) {
            if (!part.is(NodeKind.SEGMENT)) return null;
            segments.add(part.getValue());
        }
        return segments;
    }
}
