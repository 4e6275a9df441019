package org.dxworks.exgraph.parser;

/**
 * Closed set of node tags produced by {@link ElixirParser}.
 */
public enum NodeKind {
    /** Sequence of expressions: file root, multi-expression bodies, {@code (a; b)}. */
    BLOCK,
    /** Local call {@code name(args)} or {@code name args}; value is the name. */
    CALL,
    /** {@code target.member(args)}; first child is the target, value is the member. */
    REMOTE_CALL,
    /** {@code fun.(args)}; first child is the callee. */
    ANON_CALL,
    /** Bare identifier without arguments. */
    VARIABLE,
    /** Alias path such as {@code Foo.Bar}; children are the path parts. */
    ALIASES,
    /** Literal part of an alias path. */
    SEGMENT,
    /** {@code __MODULE__}. */
    MODULE_SELF,
    /** {@code Base.{A, B}}; first child is the base, remaining children the branches. */
    MULTI_ALIAS,
    ATOM,
    /** Numbers, strings, charlists, sigils, booleans, nil. Interpolated expressions are children. */
    LITERAL,
    /** Unary or binary operator; value is the operator. */
    OPERATOR,
    /** List literal, also used for bitstrings (value {@code <<>>}). */
    LIST,
    TUPLE,
    /** Map or struct literal. For structs the first child is the struct name. */
    MAP,
    /** Keyword list; children are {@link #PAIR} nodes. */
    KEYWORDS,
    /** One {@code key: value} entry; value is the key, single child is the value. */
    PAIR,
    /** {@code fn ... end}; children are {@link #STAB} clauses. */
    FN,
    /** {@code head -> body}; children are a head BLOCK and a body BLOCK. */
    STAB,
    /** Module attribute {@code @name value}; value is the attribute name. */
    ATTRIBUTE,
    /** {@code expr[key]}. */
    ACCESS
}
