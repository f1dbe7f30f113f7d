package org.rholang.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Binds joined by '&'; all of them must fire together.
 */
public final class Receipt {
    public final ImmutableList<Bind> binds;
    public final SourceSpan span;

    Receipt(ImmutableList<Bind> binds) {
        Preconditions.checkArgument(!binds.isEmpty(), "receipt without binds");
        this.binds = binds;
        this.span = SourceSpan.between(binds.get(0).span, binds.get(binds.size() - 1).span);
    }
}
