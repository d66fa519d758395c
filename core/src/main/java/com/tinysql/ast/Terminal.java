package com.tinysql.ast;

/**
 * Value held by an AST leaf: either a name or a constant.
 */
public sealed interface Terminal permits Identifier, Literal {
}
