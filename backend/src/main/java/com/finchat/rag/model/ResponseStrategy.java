package com.finchat.rag.model;

public enum ResponseStrategy {
    /** A handler answered; generation only formats its structured result. */
    DIRECT,
    /** No handler; generation is grounded in retrieved chunks. */
    GROUNDED_GENERATION,
    /** No handler and no supporting context. */
    UNGROUNDED_GENERATION
}
