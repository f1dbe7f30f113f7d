package org.rholang.parser;

import com.google.common.base.Preconditions;

public final class KeyValuePair {
    public final Proc key;
    public final Proc value;
    public final SourceSpan span;

    KeyValuePair(Proc key, Proc value) {
        this.key = Preconditions.checkNotNull(key);
        this.value = Preconditions.checkNotNull(value);
        this.span = SourceSpan.between(key.span, value.span);
    }
}
