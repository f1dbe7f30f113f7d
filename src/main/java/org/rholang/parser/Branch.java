package org.rholang.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// one arm of a select: linear binds joined by '&', then '=>' and a body
public final class Branch {
    public final ImmutableList<Bind.Linear> patterns;
    public final Proc body;
    public final SourceSpan span;

    Branch(ImmutableList<Bind.Linear> patterns, Proc body) {
        Preconditions.checkArgument(!patterns.isEmpty(), "branch without binds");
        this.patterns = patterns;
        this.body = Preconditions.checkNotNull(body);
        this.span = SourceSpan.between(patterns.get(0).span, body.span);
    }
}
