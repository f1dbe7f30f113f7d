package org.rholang.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A comma separated list of names, optionally ending in a remainder {@code ...@var}.
 * Only contract formals may be empty.
 */
public final class Names {
    public final ImmutableList<Name> names;
    public final Proc.ProcVar remainder; // may be null
    public final SourceSpan span;

    Names(ImmutableList<Name> names, Proc.ProcVar remainder, SourceSpan span) {
        this.names = Preconditions.checkNotNull(names);
        this.remainder = remainder;
        this.span = span;
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty() && remainder == null;
    }
}
