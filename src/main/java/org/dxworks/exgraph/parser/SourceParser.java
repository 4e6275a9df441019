package org.dxworks.exgraph.parser;

/**
 * Turns source text into a generic {@link SyntaxNode} tree.
 */
public interface SourceParser {

    SyntaxNode parse(String source, String file) throws ParseException;
}
