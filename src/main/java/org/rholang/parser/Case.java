package org.rholang.parser;

import com.google.common.base.Preconditions;

public final class Case {
    public final Proc pattern;
    public final Proc body;
    public final SourceSpan span;

    Case(Proc pattern, Proc body) {
        this.pattern = Preconditions.checkNotNull(pattern);
        this.body = Preconditions.checkNotNull(body);
        this.span = SourceSpan.between(pattern.span, body.span);
    }
}
