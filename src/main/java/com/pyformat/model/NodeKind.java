package com.pyformat.model;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Grammar symbols of branch nodes.
 *
 * Kinds flagged as statements are the ones that receive a blank-line decision
 * when they directly follow a class or function definition.
 */
public enum NodeKind {
    FILE_INPUT("file_input", false),
    CLASSDEF("classdef", false),
    FUNCDEF("funcdef", false),
    ASYNC_FUNCDEF("async_funcdef", false),
    DECORATED("decorated", false),
    DECORATORS("decorators", false),
    DECORATOR("decorator", false),
    SUITE("suite", false),
    PARAMETERS("parameters", false),
    TYPEDARGSLIST("typedargslist", false),
    ARGLIST("arglist", false),
    TRAILER("trailer", false),
    POWER("power", false),
    ATOM("atom", false),
    DOTTED_NAME("dotted_name", false),
    TEST("test", false),
    COMPARISON("comparison", false),
    ARITH_EXPR("arith_expr", false),
    TERM("term", false),
    EXPR("expr", false),
    TESTLIST("testlist", false),
    IMPORT_NAME("import_name", false),
    IMPORT_FROM("import_from", false),
    DOTTED_AS_NAMES("dotted_as_names", false),
    IMPORT_AS_NAMES("import_as_names", false),

    SMALL_STMT("small_stmt", true),
    EXPR_STMT("expr_stmt", true),
    PRINT_STMT("print_stmt", true),
    DEL_STMT("del_stmt", true),
    PASS_STMT("pass_stmt", true),
    BREAK_STMT("break_stmt", true),
    CONTINUE_STMT("continue_stmt", true),
    RETURN_STMT("return_stmt", true),
    RAISE_STMT("raise_stmt", true),
    YIELD_STMT("yield_stmt", true),
    IMPORT_STMT("import_stmt", true),
    GLOBAL_STMT("global_stmt", true),
    EXEC_STMT("exec_stmt", true),
    ASSERT_STMT("assert_stmt", true),
    IF_STMT("if_stmt", true),
    WHILE_STMT("while_stmt", true),
    FOR_STMT("for_stmt", true),
    TRY_STMT("try_stmt", true),
    WITH_STMT("with_stmt", true),
    NONLOCAL_STMT("nonlocal_stmt", true),
    ASYNC_STMT("async_stmt", true),
    SIMPLE_STMT("simple_stmt", true);

    private static final Map<String, NodeKind> BY_SYMBOL = Stream.of(values())
            .collect(Collectors.toMap(NodeKind::getSymbol, Function.identity()));

    private final String symbol;
    private final boolean statement;

    NodeKind(String symbol, boolean statement) {
        this.symbol = symbol;
        this.statement = statement;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isStatement() {
        return statement;
    }

    public boolean isDefinition() {
        return this == CLASSDEF || this == FUNCDEF;
    }

    /**
     * @return the kind for a grammar symbol name, or {@code null} when unknown
     */
    public static NodeKind fromSymbol(String symbol) {
        return symbol == null ? null : BY_SYMBOL.get(symbol.toLowerCase());
    }
}
