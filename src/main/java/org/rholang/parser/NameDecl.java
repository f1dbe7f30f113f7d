package org.rholang.parser;

import com.google.common.base.Preconditions;

// x or x(`rho:io:stdout`) in a new declaration
public final class NameDecl {
    public final String var;
    public final String uri; // may be null
    public final SourceSpan span;

    NameDecl(String var, String uri, SourceSpan span) {
        this.var = Preconditions.checkNotNull(var);
        this.uri = uri;
        this.span = span;
    }
}
