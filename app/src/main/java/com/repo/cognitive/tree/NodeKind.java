package com.repo.cognitive.tree;

/**
 * Node kinds the engine dispatches on. Everything else is {@link #OTHER}.
 */
public enum NodeKind {
    FILE,
    FUNCTION,
    IF,
    LOOP,
    SWITCH,
    SWITCH_CASE,
    CATCH,
    LOGICAL,
    CONDITIONAL,
    JUMP,
    OTHER
}
