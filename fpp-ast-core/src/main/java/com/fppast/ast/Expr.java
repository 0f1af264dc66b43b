package com.fppast.ast;

/**
 * Expression
 */
public sealed interface Expr permits
    ExprArray,
    ExprBinop,
    ExprDot,
    ExprIdent,
    ExprLiteralBool,
    ExprLiteralFloat,
    ExprLiteralInt,
    ExprLiteralString,
    ExprParen,
    ExprStruct,
    ExprUnop {
}
