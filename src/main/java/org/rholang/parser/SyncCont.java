package org.rholang.parser;

/**
 * What follows a synchronous send: '.' (empty) or '; P'.
 */
public final class SyncCont {
    public final Proc proc; // null for '.'
    public final SourceSpan span;

    SyncCont(Proc proc, SourceSpan span) {
        this.proc = proc;
        this.span = span;
    }

    public boolean isEmpty() {
        return proc == null;
    }
}
