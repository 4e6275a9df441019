package org.dxworks.exgraph.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits Elixir source into tokens. Comments are dropped, newlines and {@code ;} become
 * {@link TokenType#NEWLINE} separators (collapsed), string interpolations are kept as raw
 * source fragments for the parser to read recursively.
 */
final class ElixirLexer {

    private static final String[] THREE_CHAR_OPERATORS = {
            "...", "===", "!==", "<<<", ">>>", "<<~", "~>>", "<~>", "|||", "&&&", "^^^", "~~~", "+++", "---"
    };

    private static final String[] TWO_CHAR_OPERATORS = {
            "\\\\", "<>", "++", "--", "==", "!=", "=~", "<=", ">=", "&&", "||", "|>", "=>", "::", "..",
            "<-", "<~", "~>", "**", "//"
    };

    private static final String ONE_CHAR_OPERATORS = "<>+-*/=!^&|@";

    private static final Set<String> WORD_OPERATORS = Set.of("and", "or", "not", "in", "when");
    private static final Set<String> BLOCK_KEYWORDS = Set.of("else", "rescue", "catch", "after");
    private static final Set<String> RESERVED_LITERALS = Set.of("true", "false", "nil");

    private final String src;
    private final String file;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line;
    private int col;
    private boolean sawSpace;

    ElixirLexer(String source, String file) {
        this(source, file, 1, 1);
    }

    ElixirLexer(String source, String file, int startLine, int startColumn) {
        this.src = source;
        this.file = file;
        this.line = startLine;
        this.col = startColumn;
    }

    List<Token> tokenize() throws ParseException {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                advance();
                sawSpace = true;
                continue;
            }
            if (c == '\\' && peekAt(1) == '\n') {
                // explicit line continuation
                advance();
                advance();
                sawSpace = true;
                continue;
            }
            if (c == '\n' || c == ';') {
                addSeparator();
                advance();
                continue;
            }
            if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n') advance();
                continue;
            }

            int startLine = line;
            int startCol = col;
            if (isIdentifierStart(c)) {
                lexIdentifier(startLine, startCol);
            } else if (Character.isUpperCase(c)) {
                lexAlias(startLine, startCol);
            } else if (Character.isDigit(c)) {
                lexNumber(startLine, startCol);
            } else if (c == '"' || c == '\'') {
                lexQuoted(c, startLine, startCol);
            } else if (c == ':') {
                lexColon(startLine, startCol);
            } else if (c == '?') {
                lexChar(startLine, startCol);
            } else if (c == '~' && Character.isLetter(peekAt(1))) {
                lexSigil(startLine, startCol);
            } else if (c == '%') {
                advance();
                add(TokenType.PERCENT, "%", startLine, startCol);
            } else {
                lexPunctuation(c, startLine, startCol);
            }
        }
        addSeparator();
        add(TokenType.EOF, "", line, col);
        return tokens;
    }

    private void lexIdentifier(int startLine, int startCol) {
        int start = pos;
        while (pos < src.length() && isIdentifierPart(src.charAt(pos))) advance();
        if (pos < src.length() && (src.charAt(pos) == '?' || src.charAt(pos) == '!')) advance();
        String text = src.substring(start, pos);

        if (isKeywordKeyColon()) {
            advance();
            add(TokenType.KW_KEY, text, startLine, startCol);
            return;
        }
        if (WORD_OPERATORS.contains(text)) {
            add(TokenType.OPERATOR, text, startLine, startCol);
        } else if (BLOCK_KEYWORDS.contains(text)) {
            add(TokenType.BLOCK_KEYWORD, text, startLine, startCol);
        } else if (RESERVED_LITERALS.contains(text)) {
            add(TokenType.RESERVED_LITERAL, text, startLine, startCol);
        } else if ("do".equals(text)) {
            add(TokenType.DO, text, startLine, startCol);
        } else if ("end".equals(text)) {
            add(TokenType.END, text, startLine, startCol);
        } else if ("fn".equals(text)) {
            add(TokenType.FN, text, startLine, startCol);
        } else {
            add(TokenType.IDENTIFIER, text, startLine, startCol);
        }
    }

    private void lexAlias(int startLine, int startCol) {
        int start = pos;
        while (pos < src.length() && isIdentifierPart(src.charAt(pos))) advance();
        String text = src.substring(start, pos);
        if (isKeywordKeyColon()) {
            advance();
            add(TokenType.KW_KEY, text, startLine, startCol);
            return;
        }
        add(TokenType.ALIAS, text, startLine, startCol);
    }

    private void lexNumber(int startLine, int startCol) {
        int start = pos;
        char next = peekAt(1);
        if (src.charAt(pos) == '0' && (next == 'x' || next == 'o' || next == 'b')) {
            advance();
            advance();
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) advance();
            add(TokenType.INTEGER, src.substring(start, pos), startLine, startCol);
            return;
        }
        consumeDigits();
        boolean isFloat = false;
        if (pos < src.length() && src.charAt(pos) == '.' && Character.isDigit(peekAt(1))) {
            isFloat = true;
            advance();
            consumeDigits();
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                advance();
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) advance();
                consumeDigits();
            }
        }
        add(isFloat ? TokenType.FLOAT : TokenType.INTEGER, src.substring(start, pos), startLine, startCol);
    }

    private void consumeDigits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) advance();
    }

    private void lexQuoted(char quote, int startLine, int startCol) throws ParseException {
        TokenType type = quote == '"' ? TokenType.STRING : TokenType.CHARLIST;
        List<Token.Interpolation> interpolations = new ArrayList<>();
        String text;
        if (peekAt(1) == quote && peekAt(2) == quote) {
            text = readHeredoc(quote, interpolations, true);
        } else {
            advance();
            text = readUntil(quote, interpolations, true);
        }
        if (isKeywordKeyColon()) {
            advance();
            add(TokenType.KW_KEY, text, startLine, startCol);
            return;
        }
        tokens.add(new Token(type, text, startLine, startCol, sawSpace, interpolations));
        sawSpace = false;
    }

    private void lexColon(int startLine, int startCol) throws ParseException {
        char next = peekAt(1);
        if (next == ':') {
            advance();
            advance();
            add(TokenType.OPERATOR, "::", startLine, startCol);
            return;
        }
        if (next == '"' || next == '\'') {
            advance();
            advance();
            String text = readUntil(next, new ArrayList<>(), true);
            add(TokenType.ATOM, text, startLine, startCol);
            return;
        }
        if (isIdentifierStart(next) || Character.isUpperCase(next)) {
            advance();
            int start = pos;
            while (pos < src.length() && (isIdentifierPart(src.charAt(pos)) || src.charAt(pos) == '@')) advance();
            if (pos < src.length() && (src.charAt(pos) == '?' || src.charAt(pos) == '!')) advance();
            add(TokenType.ATOM, src.substring(start, pos), startLine, startCol);
            return;
        }
        String op = matchOperatorAt(pos + 1);
        if (op == null && (src.startsWith("->", pos + 1) || src.startsWith("<<", pos + 1) || src.startsWith(">>", pos + 1))) {
            op = src.substring(pos + 1, pos + 3);
        }
        if (op == null && (src.startsWith("{}", pos + 1) || src.startsWith("[]", pos + 1) || src.startsWith("%{}", pos + 1))) {
            op = src.startsWith("%{}", pos + 1) ? "%{}" : src.substring(pos + 1, pos + 3);
        }
        if (op == null && (next == '.' || next == '%')) {
            op = String.valueOf(next);
        }
        if (op != null) {
            advance();
            for (int i = 0; i < op.length(); i++) advance();
            add(TokenType.ATOM, op, startLine, startCol);
            return;
        }
        throw new ParseException("unexpected ':'", file, startLine, startCol);
    }

    private void lexChar(int startLine, int startCol) throws ParseException {
        advance();
        if (pos >= src.length()) {
            throw new ParseException("unterminated character literal", file, startLine, startCol);
        }
        int start = pos;
        if (src.charAt(pos) == '\\') {
            advance();
        }
        if (pos < src.length()) {
            int cp = src.codePointAt(pos);
            for (int i = 0; i < Character.charCount(cp); i++) advance();
        }
        add(TokenType.CHAR, "?" + src.substring(start, pos), startLine, startCol);
    }

    private void lexSigil(int startLine, int startCol) throws ParseException {
        int start = pos;
        advance();
        if (Character.isUpperCase(src.charAt(pos))) {
            while (pos < src.length() && (Character.isUpperCase(src.charAt(pos)) || Character.isDigit(src.charAt(pos)))) advance();
        } else {
            advance();
        }
        if (pos >= src.length()) {
            throw new ParseException("unterminated sigil", file, startLine, startCol);
        }
        char open = src.charAt(pos);
        if ((open == '"' || open == '\'') && peekAt(1) == open && peekAt(2) == open) {
            readHeredoc(open, new ArrayList<>(), false);
        } else {
            char close = closingDelimiter(open);
            if (close == 0) {
                throw new ParseException("invalid sigil delimiter '" + open + "'", file, line, col);
            }
            advance();
            readUntil(close, new ArrayList<>(), false);
        }
        while (pos < src.length() && Character.isLetterOrDigit(src.charAt(pos))) advance();
        add(TokenType.SIGIL, src.substring(start, pos), startLine, startCol);
    }

    private static char closingDelimiter(char open) {
        switch (open) {
            case '(':
                return ')';
            case '[':
                return ']';
            case '{':
                return '}';
            case '<':
                return '>';
            case '/':
            case '|':
            case '"':
            case '\'':
                return open;
            default:
                return 0;
        }
    }

    private void lexPunctuation(char c, int startLine, int startCol) throws ParseException {
        switch (c) {
            case '(':
                advance();
                add(TokenType.LPAREN, "(", startLine, startCol);
                return;
            case ')':
                advance();
                add(TokenType.RPAREN, ")", startLine, startCol);
                return;
            case '[':
                advance();
                add(TokenType.LBRACKET, "[", startLine, startCol);
                return;
            case ']':
                advance();
                add(TokenType.RBRACKET, "]", startLine, startCol);
                return;
            case '{':
                advance();
                add(TokenType.LBRACE, "{", startLine, startCol);
                return;
            case '}':
                advance();
                add(TokenType.RBRACE, "}", startLine, startCol);
                return;
            case ',':
                advance();
                add(TokenType.COMMA, ",", startLine, startCol);
                return;
            default:
                break;
        }

        for (String op : THREE_CHAR_OPERATORS) {
            if (src.startsWith(op, pos)) {
                advanceBy(op.length());
                add(TokenType.OPERATOR, op, startLine, startCol);
                return;
            }
        }
        if (src.startsWith("->", pos)) {
            advanceBy(2);
            add(TokenType.ARROW, "->", startLine, startCol);
            return;
        }
        if (src.startsWith("<<", pos)) {
            advanceBy(2);
            add(TokenType.BITSTRING_OPEN, "<<", startLine, startCol);
            return;
        }
        if (src.startsWith(">>", pos)) {
            advanceBy(2);
            add(TokenType.BITSTRING_CLOSE, ">>", startLine, startCol);
            return;
        }
        for (String op : TWO_CHAR_OPERATORS) {
            if (src.startsWith(op, pos)) {
                advanceBy(op.length());
                add(TokenType.OPERATOR, op, startLine, startCol);
                return;
            }
        }
        if (c == '.') {
            advance();
            add(TokenType.DOT, ".", startLine, startCol);
            return;
        }
        if (ONE_CHAR_OPERATORS.indexOf(c) >= 0) {
            advance();
            add(TokenType.OPERATOR, String.valueOf(c), startLine, startCol);
            return;
        }
        throw new ParseException("unexpected character '" + c + "'", file, startLine, startCol);
    }

    private String matchOperatorAt(int at) {
        for (String op : THREE_CHAR_OPERATORS) {
            if (src.startsWith(op, at)) return op;
        }
        for (String op : TWO_CHAR_OPERATORS) {
            if (src.startsWith(op, at)) return op;
        }
        if (at < src.length() && ONE_CHAR_OPERATORS.indexOf(src.charAt(at)) >= 0) {
            return String.valueOf(src.charAt(at));
        }
        return null;
    }

    /**
     * Reads up to the unescaped {@code close} character (consumed). The opening delimiter
     * must already be consumed.
     */
    private String readUntil(char close, List<Token.Interpolation> interpolations, boolean interpolate)
            throws ParseException {
        int startLine = line;
        int startCol = col;
        StringBuilder text = new StringBuilder();
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\' && pos + 1 < src.length()) {
                text.append(c).append(src.charAt(pos + 1));
                advance();
                advance();
                continue;
            }
            if (c == close) {
                advance();
                return text.toString();
            }
            if (interpolate && c == '#' && peekAt(1) == '{') {
                text.append(readInterpolation(interpolations));
                continue;
            }
            text.append(c);
            advance();
        }
        throw new ParseException("unterminated literal", file, startLine, startCol);
    }

    private String readHeredoc(char quote, List<Token.Interpolation> interpolations, boolean interpolate)
            throws ParseException {
        int startLine = line;
        int startCol = col;
        advanceBy(3);
        StringBuilder text = new StringBuilder();
        boolean atLineStart = false;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (atLineStart) {
                int ahead = pos;
                while (ahead < src.length() && (src.charAt(ahead) == ' ' || src.charAt(ahead) == '\t')) ahead++;
                if (ahead + 2 < src.length() && src.charAt(ahead) == quote
                        && src.charAt(ahead + 1) == quote && src.charAt(ahead + 2) == quote) {
                    advanceBy(ahead - pos + 3);
                    return text.toString();
                }
                atLineStart = false;
            }
            if (c == '\\' && pos + 1 < src.length()) {
                text.append(c).append(src.charAt(pos + 1));
                advance();
                advance();
                continue;
            }
            if (interpolate && c == '#' && peekAt(1) == '{') {
                text.append(readInterpolation(interpolations));
                continue;
            }
            if (c == '\n') {
                atLineStart = true;
            }
            text.append(c);
            advance();
        }
        throw new ParseException("unterminated heredoc", file, startLine, startCol);
    }

    /**
     * Consumes {@code #{ ... }} and records the inner source. Braces inside nested strings
     * do not count towards nesting.
     */
    private String readInterpolation(List<Token.Interpolation> interpolations) throws ParseException {
        int startLine = line;
        int startCol = col;
        advance();
        advance();
        int innerLine = line;
        int innerCol = col;
        int start = pos;
        int depth = 1;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '"' || c == '\'') {
                advance();
                skipNestedString(c);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    String inner = src.substring(start, pos);
                    advance();
                    interpolations.add(new Token.Interpolation(inner, innerLine, innerCol));
                    return "#{" + inner + "}";
                }
            }
            advance();
        }
        throw new ParseException("unterminated interpolation", file, startLine, startCol);
    }

    private void skipNestedString(char quote) {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < src.length()) advance();
                continue;
            }
            advance();
            if (c == quote) return;
        }
    }

    private boolean isKeywordKeyColon() {
        return pos < src.length() && src.charAt(pos) == ':' && peekAt(1) != ':'
                && (pos + 1 >= src.length() || Character.isWhitespace(src.charAt(pos + 1)));
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (Character.isLetter(c) && !Character.isUpperCase(c));
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private char peekAt(int offset) {
        int at = pos + offset;
        return at < src.length() ? src.charAt(at) : 0;
    }

    private void advance() {
        if (src.charAt(pos) == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        pos++;
    }

    private void advanceBy(int count) {
        for (int i = 0; i < count && pos < src.length(); i++) advance();
    }

    private void add(TokenType type, String text, int tokenLine, int tokenCol) {
        tokens.add(new Token(type, text, tokenLine, tokenCol, sawSpace, null));
        sawSpace = false;
    }

    private void addSeparator() {
        sawSpace = false;
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).is(TokenType.NEWLINE)) {
            return;
        }
        tokens.add(new Token(TokenType.NEWLINE, "\n", line, col, false, null));
    }
}
