package com.sankeydsl.loader.ast;

/** Surface syntax a statement was recognized in. */
public enum Notation {
    COLOR_DIRECTIVE,
    BRACKET,
    ARROW,
    DELIMITED,
    TABULAR
}
