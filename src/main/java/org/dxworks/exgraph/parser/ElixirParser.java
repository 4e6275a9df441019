package org.dxworks.exgraph.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads Elixir source into a {@link SyntaxNode} tree.
 * <p>
 * Expressions are parsed by precedence climbing over the Elixir operator table. Calls may
 * omit parentheses; a {@code do ... end} block binds to the outermost call without
 * parentheses and is attached as a trailing {@link NodeKind#KEYWORDS} argument, the same
 * shape the Elixir compiler produces. Interpolated string fragments are parsed too and
 * become children of their {@link NodeKind#LITERAL}.
 */
public class ElixirParser implements SourceParser {

    private static final int LEFT = 0;
    private static final int RIGHT = 1;

    /** Operand precedence of prefix operators; higher than every binary operator. */
    private static final int UNARY_PRECEDENCE = 18;
    /** Operand precedence of the capture operator {@code &}. */
    private static final int CAPTURE_PRECEDENCE = 7;

    private static final Map<String, int[]> BINARY_OPERATORS = new HashMap<>();

    static {
        binary(1, LEFT, "\\\\", "<-");
        binary(2, RIGHT, "when");
        binary(3, RIGHT, "::");
        binary(4, RIGHT, "|");
        binary(5, RIGHT, "=>");
        binary(7, RIGHT, "=");
        binary(8, LEFT, "||", "|||", "or");
        binary(9, LEFT, "&&", "&&&", "and");
        binary(10, LEFT, "==", "!=", "=~", "===", "!==");
        binary(11, LEFT, "<", ">", "<=", ">=");
        binary(12, LEFT, "|>", "<<<", ">>>", "<<~", "~>>", "<~", "~>", "<~>", "^^^");
        binary(13, LEFT, "in", "not in");
        binary(14, RIGHT, "++", "--", "+++", "---", "..", "<>", "//");
        binary(15, LEFT, "+", "-");
        binary(16, LEFT, "*", "/");
        binary(17, LEFT, "**");
    }

    private static final Set<String> PREFIX_OPERATORS = Set.of("-", "+", "!", "^", "not", "~~~");

    /** Operators that may begin a continuation line of the previous expression. */
    private static final Set<String> NON_CONTINUING = Set.of("+", "-");

    private static void binary(int precedence, int associativity, String... operators) {
        for (String op : operators) {
            BINARY_OPERATORS.put(op, new int[]{precedence, associativity});
        }
    }

    @Override
    public SyntaxNode parse(String source, String file) throws ParseException {
        List<Token> tokens = new ElixirLexer(source, file).tokenize();
        return new Session(tokens, file).parseFile();
    }

    private static final class Session {
        private final List<Token> tokens;
        private final String file;
        private int index;
        private boolean allowDo = true;

        Session(List<Token> tokens, String file) {
            this.tokens = tokens;
            this.file = file;
        }

        SyntaxNode parseFile() throws ParseException {
            Token first = peek();
            List<SyntaxNode> forms = new ArrayList<>();
            while (true) {
                skipNewlines();
                if (peek().is(TokenType.EOF)) break;
                forms.add(parseExpression(0));
                Token after = peek();
                if (!after.is(TokenType.NEWLINE) && !after.is(TokenType.EOF)) {
                    throw unexpected(after);
                }
            }
            return new SyntaxNode(NodeKind.BLOCK, null, first.line, first.column, forms);
        }

        // ---- expressions ----

        private SyntaxNode parseExpression(int minPrecedence) throws ParseException {
            SyntaxNode left = parseUnary();
            while (true) {
                if (peek().is(TokenType.NEWLINE) && continuesOnNextLine()) {
                    skipNewlines();
                }
                Token opToken = peek();
                String op = binaryOperator(opToken);
                if (op == null) break;
                int[] binding = BINARY_OPERATORS.get(op);
                if (binding[0] < minPrecedence) break;

                next();
                if ("not in".equals(op)) next();
                skipNewlines();
                SyntaxNode right = parseExpression(binding[1] == LEFT ? binding[0] + 1 : binding[0]);
                left = new SyntaxNode(NodeKind.OPERATOR, op, opToken.line, opToken.column, List.of(left, right));
            }
            return left;
        }

        private String binaryOperator(Token token) {
            if (!token.is(TokenType.OPERATOR)) return null;
            if ("not".equals(token.text)) {
                return peekAt(1).isOperator("in") ? "not in" : null;
            }
            return BINARY_OPERATORS.containsKey(token.text) ? token.text : null;
        }

        private boolean continuesOnNextLine() {
            int i = index;
            while (tokens.get(i).is(TokenType.NEWLINE)) i++;
            Token candidate = tokens.get(i);
            if (!candidate.is(TokenType.OPERATOR) || NON_CONTINUING.contains(candidate.text)) {
                return false;
            }
            if ("not".equals(candidate.text)) {
                return tokens.get(i + 1).isOperator("in");
            }
            return BINARY_OPERATORS.containsKey(candidate.text);
        }

        private SyntaxNode parseUnary() throws ParseException {
            Token t = peek();
            if (t.is(TokenType.OPERATOR)) {
                if (PREFIX_OPERATORS.contains(t.text)) {
                    next();
                    SyntaxNode operand = parseExpression(UNARY_PRECEDENCE);
                    return new SyntaxNode(NodeKind.OPERATOR, t.text, t.line, t.column, List.of(operand));
                }
                if ("&".equals(t.text)) {
                    next();
                    SyntaxNode operand = parseExpression(CAPTURE_PRECEDENCE);
                    return new SyntaxNode(NodeKind.OPERATOR, "&", t.line, t.column, List.of(operand));
                }
                if ("@".equals(t.text)) {
                    next();
                    return parsePostfix(parseAttribute(t));
                }
            }
            return parsePostfix(parsePrimary());
        }

        private SyntaxNode parseAttribute(Token at) throws ParseException {
            Token name = next();
            if (!name.is(TokenType.IDENTIFIER)) {
                throw new ParseException("expected attribute name after '@'", file, name.line, name.column);
            }
            List<SyntaxNode> args;
            if (peek().is(TokenType.LPAREN) && !peek().spaceBefore) {
                next();
                args = parseSequence(TokenType.RPAREN);
            } else if (startsNoParensArgument(peek())) {
                args = parseNoParensArguments();
            } else {
                args = Collections.emptyList();
            }
            return new SyntaxNode(NodeKind.ATTRIBUTE, name.text, at.line, at.column, args);
        }

        private SyntaxNode parsePrimary() throws ParseException {
            Token t = next();
            switch (t.type) {
                case IDENTIFIER:
                    return parseIdentifier(t);
                case ALIAS:
                    return new SyntaxNode(NodeKind.ALIASES, null, t.line, t.column,
                            List.of(SyntaxNode.leaf(NodeKind.SEGMENT, t.text, t.line, t.column)));
                case ATOM:
                    return SyntaxNode.leaf(NodeKind.ATOM, t.text, t.line, t.column);
                case KW_KEY:
                    index--;
                    return parseKeywordList();
                case INTEGER:
                case FLOAT:
                case CHAR:
                case SIGIL:
                case RESERVED_LITERAL:
                    return SyntaxNode.leaf(NodeKind.LITERAL, t.text, t.line, t.column);
                case STRING:
                case CHARLIST:
                    return new SyntaxNode(NodeKind.LITERAL, t.text, t.line, t.column, parseInterpolations(t));
                case LPAREN:
                    return parseParenthesized(t);
                case LBRACKET:
                    return new SyntaxNode(NodeKind.LIST, null, t.line, t.column, parseSequence(TokenType.RBRACKET));
                case LBRACE:
                    return new SyntaxNode(NodeKind.TUPLE, null, t.line, t.column, parseSequence(TokenType.RBRACE));
                case BITSTRING_OPEN:
                    return new SyntaxNode(NodeKind.LIST, "<<>>", t.line, t.column, parseSequence(TokenType.BITSTRING_CLOSE));
                case PERCENT:
                    return parseMap(t);
                case FN:
                    return parseFn(t);
                case OPERATOR:
                    if ("...".equals(t.text) || "..".equals(t.text)) {
                        return SyntaxNode.leaf(NodeKind.VARIABLE, t.text, t.line, t.column);
                    }
                    throw unexpected(t);
                default:
                    throw unexpected(t);
            }
        }

        private SyntaxNode parseIdentifier(Token t) throws ParseException {
            if ("__MODULE__".equals(t.text)) {
                return SyntaxNode.leaf(NodeKind.MODULE_SELF, t.text, t.line, t.column);
            }
            Token after = peek();
            List<SyntaxNode> args;
            if (after.is(TokenType.LPAREN) && !after.spaceBefore) {
                next();
                args = new ArrayList<>(parseSequence(TokenType.RPAREN));
            } else if (startsNoParensArgument(after)) {
                args = new ArrayList<>(parseNoParensArguments());
            } else if (allowDo && after.is(TokenType.DO)) {
                args = new ArrayList<>();
            } else {
                return SyntaxNode.leaf(NodeKind.VARIABLE, t.text, t.line, t.column);
            }
            attachDoBlock(args);
            return new SyntaxNode(NodeKind.CALL, t.text, t.line, t.column, args);
        }

        private SyntaxNode parsePostfix(SyntaxNode node) throws ParseException {
            while (true) {
                Token t = peek();
                if (t.is(TokenType.DOT)) {
                    next();
                    node = parseAfterDot(node);
                } else if (t.is(TokenType.LBRACKET) && !t.spaceBefore) {
                    next();
                    boolean saved = allowDo;
                    allowDo = true;
                    skipNewlines();
                    SyntaxNode key = parseExpression(0);
                    skipNewlines();
                    expect(TokenType.RBRACKET);
                    allowDo = saved;
                    node = new SyntaxNode(NodeKind.ACCESS, null, t.line, t.column, List.of(node, key));
                } else if (t.is(TokenType.LPAREN) && !t.spaceBefore && isCallLike(node)) {
                    next();
                    List<SyntaxNode> children = new ArrayList<>();
                    children.add(node);
                    children.addAll(parseSequence(TokenType.RPAREN));
                    node = new SyntaxNode(NodeKind.ANON_CALL, null, t.line, t.column, children);
                } else {
                    return node;
                }
            }
        }

        private SyntaxNode parseAfterDot(SyntaxNode target) throws ParseException {
            Token member = next();
            switch (member.type) {
                case ALIAS: {
                    List<SyntaxNode> parts = new ArrayList<>();
                    if (target.is(NodeKind.ALIASES)) {
                        parts.addAll(target.getChildren());
                    } else {
                        parts.add(target);
                    }
                    parts.add(SyntaxNode.leaf(NodeKind.SEGMENT, member.text, member.line, member.column));
                    return new SyntaxNode(NodeKind.ALIASES, null, target.getLine(), target.getColumn(), parts);
                }
                case LPAREN: {
                    List<SyntaxNode> children = new ArrayList<>();
                    children.add(target);
                    children.addAll(parseSequence(TokenType.RPAREN));
                    return new SyntaxNode(NodeKind.ANON_CALL, null, member.line, member.column, children);
                }
                case LBRACE: {
                    List<SyntaxNode> children = new ArrayList<>();
                    children.add(target);
                    children.addAll(parseSequence(TokenType.RBRACE));
                    return new SyntaxNode(NodeKind.MULTI_ALIAS, null, target.getLine(), target.getColumn(), children);
                }
                case IDENTIFIER:
                case STRING:
                case DO:
                case END:
                case FN:
                case BLOCK_KEYWORD:
                case RESERVED_LITERAL:
                case OPERATOR:
                    return parseRemoteCall(target, member);
                default:
                    throw unexpected(member);
            }
        }

        private SyntaxNode parseRemoteCall(SyntaxNode target, Token member) throws ParseException {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(target);
            Token after = peek();
            if (after.is(TokenType.LPAREN) && !after.spaceBefore) {
                next();
                children.addAll(parseSequence(TokenType.RPAREN));
            } else if (startsNoParensArgument(after)) {
                children.addAll(parseNoParensArguments());
            }
            attachDoBlock(children);
            return new SyntaxNode(NodeKind.REMOTE_CALL, member.text, member.line, member.column, children);
        }

        private static boolean isCallLike(SyntaxNode node) {
            return node.is(NodeKind.CALL) || node.is(NodeKind.REMOTE_CALL) || node.is(NodeKind.ANON_CALL);
        }

        // ---- calls ----

        private boolean startsNoParensArgument(Token t) {
            if (!t.spaceBefore) return false;
            switch (t.type) {
                case IDENTIFIER:
                case ALIAS:
                case ATOM:
                case KW_KEY:
                case INTEGER:
                case FLOAT:
                case CHAR:
                case STRING:
                case CHARLIST:
                case SIGIL:
                case RESERVED_LITERAL:
                case FN:
                case PERCENT:
                case LBRACE:
                case LBRACKET:
                case LPAREN:
                case BITSTRING_OPEN:
                    return true;
                case OPERATOR:
                    if ("not".equals(t.text)) {
                        return !peekAt(1).isOperator("in");
                    }
                    return "&".equals(t.text) || "@".equals(t.text) || "!".equals(t.text)
                            || "^".equals(t.text) || "...".equals(t.text);
                default:
                    return false;
            }
        }

        private List<SyntaxNode> parseNoParensArguments() throws ParseException {
            boolean saved = allowDo;
            allowDo = false;
            List<SyntaxNode> args = new ArrayList<>();
            try {
                while (true) {
                    args.add(parseExpression(0));
                    if (!peek().is(TokenType.COMMA)) break;
                    next();
                    skipNewlines();
                }
            } finally {
                allowDo = saved;
            }
            return args;
        }

        private void attachDoBlock(List<SyntaxNode> args) throws ParseException {
            if (allowDo && peek().is(TokenType.DO)) {
                args.add(parseDoBlock());
            }
        }

        private SyntaxNode parseDoBlock() throws ParseException {
            Token doToken = expect(TokenType.DO);
            boolean saved = allowDo;
            allowDo = true;
            List<SyntaxNode> sections = new ArrayList<>();
            String key = "do";
            Token keyToken = doToken;
            while (true) {
                SyntaxNode body = parseBody(TokenType.END);
                sections.add(new SyntaxNode(NodeKind.PAIR, key, keyToken.line, keyToken.column, List.of(body)));
                if (!peek().is(TokenType.BLOCK_KEYWORD)) break;
                keyToken = next();
                key = keyToken.text;
            }
            expect(TokenType.END);
            allowDo = saved;
            return new SyntaxNode(NodeKind.KEYWORDS, null, doToken.line, doToken.column, sections);
        }

        /**
         * Body of a {@code do}/{@code else}/... section, of an {@code fn} or of a parenthesized
         * group: either plain expressions or a list of {@code head -> body} clauses. Stops before
         * {@code close}, or before a block keyword when {@code close} is {@code end}.
         */
        private SyntaxNode parseBody(TokenType close) throws ParseException {
            Token start = peek();
            List<SyntaxNode> plain = new ArrayList<>();
            List<SyntaxNode> clauses = new ArrayList<>();
            Token clauseStart = null;
            List<SyntaxNode> clauseHead = null;
            List<SyntaxNode> clauseBody = null;

            while (true) {
                skipNewlines();
                Token t = peek();
                if (closesBody(t, close) || t.is(TokenType.EOF)) break;

                List<SyntaxNode> head = new ArrayList<>();
                if (!t.is(TokenType.ARROW)) {
                    head.add(parseExpression(0));
                    while (peek().is(TokenType.COMMA)) {
                        next();
                        skipNewlines();
                        head.add(parseExpression(0));
                    }
                }
                if (peek().is(TokenType.ARROW)) {
                    next();
                    if (clauseHead != null) {
                        clauses.add(stab(clauseStart, clauseHead, clauseBody));
                    }
                    clauseStart = t;
                    clauseHead = head;
                    clauseBody = new ArrayList<>();
                    continue;
                }
                // (a, b) only appears as a parenthesized clause head
                if (head.size() != 1 && close != TokenType.RPAREN) {
                    throw unexpected(peek());
                }
                Token after = peek();
                if (!after.is(TokenType.NEWLINE) && !closesBody(after, close)) {
                    throw unexpected(after);
                }
                if (clauseBody != null) {
                    clauseBody.addAll(head);
                } else {
                    plain.addAll(head);
                }
            }

            if (clauseHead != null) {
                if (!plain.isEmpty()) {
                    throw new ParseException("expression before first clause", file, start.line, start.column);
                }
                clauses.add(stab(clauseStart, clauseHead, clauseBody));
                return new SyntaxNode(NodeKind.BLOCK, null, start.line, start.column, clauses);
            }
            if (plain.size() == 1) {
                return plain.get(0);
            }
            return new SyntaxNode(NodeKind.BLOCK, null, start.line, start.column, plain);
        }

        private boolean closesBody(Token t, TokenType close) {
            return t.is(close) || (close == TokenType.END && t.is(TokenType.BLOCK_KEYWORD));
        }

        private SyntaxNode stab(Token start, List<SyntaxNode> head, List<SyntaxNode> body) {
            SyntaxNode headNode = new SyntaxNode(NodeKind.BLOCK, null, start.line, start.column, head);
            SyntaxNode bodyNode = new SyntaxNode(NodeKind.BLOCK, null, start.line, start.column, body);
            return new SyntaxNode(NodeKind.STAB, null, start.line, start.column, List.of(headNode, bodyNode));
        }

        // ---- containers ----

        private SyntaxNode parseKeywordList() throws ParseException {
            Token first = peek();
            List<SyntaxNode> pairs = new ArrayList<>();
            while (true) {
                Token key = expect(TokenType.KW_KEY);
                skipNewlines();
                SyntaxNode value = parseExpression(0);
                pairs.add(new SyntaxNode(NodeKind.PAIR, key.text, key.line, key.column, List.of(value)));
                if (!peek().is(TokenType.COMMA) || !nextNonNewlineAfterComma().is(TokenType.KW_KEY)) break;
                next();
                skipNewlines();
            }
            return new SyntaxNode(NodeKind.KEYWORDS, null, first.line, first.column, pairs);
        }

        private Token nextNonNewlineAfterComma() {
            int i = index + 1;
            while (tokens.get(i).is(TokenType.NEWLINE)) i++;
            return tokens.get(i);
        }

        /**
         * Comma separated expressions up to {@code close} (consumed). Newlines and a trailing
         * comma are allowed.
         */
        private List<SyntaxNode> parseSequence(TokenType close) throws ParseException {
            boolean saved = allowDo;
            allowDo = true;
            List<SyntaxNode> items = new ArrayList<>();
            skipNewlines();
            while (!peek().is(close)) {
                items.add(parseExpression(0));
                skipNewlines();
                if (peek().is(TokenType.COMMA)) {
                    next();
                    skipNewlines();
                } else if (!peek().is(close)) {
                    throw unexpected(peek());
                }
            }
            next();
            allowDo = saved;
            return items;
        }

        private SyntaxNode parseParenthesized(Token open) throws ParseException {
            boolean saved = allowDo;
            allowDo = true;
            SyntaxNode body = parseBody(TokenType.RPAREN);
            expect(TokenType.RPAREN);
            allowDo = saved;
            if (body.is(NodeKind.BLOCK) && body.getChildren().isEmpty()) {
                return new SyntaxNode(NodeKind.BLOCK, null, open.line, open.column, List.of());
            }
            return body;
        }

        private SyntaxNode parseMap(Token percent) throws ParseException {
            List<SyntaxNode> children = new ArrayList<>();
            String value = null;
            if (!peek().is(TokenType.LBRACE)) {
                SyntaxNode name = parseStructName();
                children.add(name);
                value = "struct";
            }
            expect(TokenType.LBRACE);
            children.addAll(parseSequence(TokenType.RBRACE));
            return new SyntaxNode(NodeKind.MAP, value, percent.line, percent.column, children);
        }

        private SyntaxNode parseStructName() throws ParseException {
            Token t = next();
            SyntaxNode name;
            if (t.is(TokenType.ALIAS)) {
                name = new SyntaxNode(NodeKind.ALIASES, null, t.line, t.column,
                        List.of(SyntaxNode.leaf(NodeKind.SEGMENT, t.text, t.line, t.column)));
            } else if (t.is(TokenType.IDENTIFIER) && "__MODULE__".equals(t.text)) {
                name = SyntaxNode.leaf(NodeKind.MODULE_SELF, t.text, t.line, t.column);
            } else if (t.is(TokenType.IDENTIFIER)) {
                name = SyntaxNode.leaf(NodeKind.VARIABLE, t.text, t.line, t.column);
            } else if (t.isOperator("@")) {
                Token attr = expect(TokenType.IDENTIFIER);
                name = SyntaxNode.leaf(NodeKind.ATTRIBUTE, attr.text, t.line, t.column);
            } else {
                throw unexpected(t);
            }
            while (peek().is(TokenType.DOT) && peekAt(1).is(TokenType.ALIAS)) {
                next();
                Token segment = next();
                List<SyntaxNode> parts = new ArrayList<>();
                if (name.is(NodeKind.ALIASES)) {
                    parts.addAll(name.getChildren());
                } else {
                    parts.add(name);
                }
                parts.add(SyntaxNode.leaf(NodeKind.SEGMENT, segment.text, segment.line, segment.column));
                name = new SyntaxNode(NodeKind.ALIASES, null, name.getLine(), name.getColumn(), parts);
            }
            return name;
        }

        private SyntaxNode parseFn(Token fn) throws ParseException {
            boolean saved = allowDo;
            allowDo = true;
            SyntaxNode body = parseBody(TokenType.END);
            expect(TokenType.END);
            allowDo = saved;
            if (body.is(NodeKind.BLOCK) && !body.getChildren().isEmpty()
                    && body.getChildren().get(0).is(NodeKind.STAB)) {
                return new SyntaxNode(NodeKind.FN, null, fn.line, fn.column, body.getChildren());
            }
            throw new ParseException("expected '->' clauses in fn", file, fn.line, fn.column);
        }

        private List<SyntaxNode> parseInterpolations(Token literal) throws ParseException {
            if (literal.interpolations.isEmpty()) {
                return Collections.emptyList();
            }
            List<SyntaxNode> parts = new ArrayList<>();
            for (Token.Interpolation fragment : literal.interpolations) {
                List<Token> fragmentTokens = new ElixirLexer(fragment.source, file, fragment.line, fragment.column).tokenize();
                SyntaxNode parsed = new Session(fragmentTokens, file).parseFile();
                parts.addAll(parsed.getChildren());
            }
            return parts;
        }

        // ---- token plumbing ----

        private Token peek() {
            return tokens.get(index);
        }

        private Token peekAt(int offset) {
            int at = Math.min(index + offset, tokens.size() - 1);
            return tokens.get(at);
        }

        private Token next() {
            Token t = tokens.get(index);
            if (!t.is(TokenType.EOF)) index++;
            return t;
        }

        private Token expect(TokenType type) throws ParseException {
            Token t = peek();
            if (!t.is(type)) {
                throw new ParseException("expected " + type + " but found " + describe(t), file, t.line, t.column);
            }
            return next();
        }

        private void skipNewlines() {
            while (peek().is(TokenType.NEWLINE)) index++;
        }

        private ParseException unexpected(Token t) {
            return new ParseException("unexpected " + describe(t), file, t.line, t.column);
        }

        private static String describe(Token t) {
            if (t.is(TokenType.EOF)) return "end of file";
            if (t.is(TokenType.NEWLINE)) return "newline";
            return "'" + t.text + "'";
        }
    }
}
