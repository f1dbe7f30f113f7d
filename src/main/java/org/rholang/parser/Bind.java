package org.rholang.parser;

import com.google.common.base.Preconditions;

/**
 * One binding inside a receive. The binder decides the kind:
 * {@code <-} linear, {@code <=} repeated, {@code <<-} peek.
 */
public abstract class Bind {
    public final Names names; // null when nothing is bound
    public final SourceSpan span;

    Bind(Names names, SourceSpan span) {
        this.names = names;
        this.span = Preconditions.checkNotNull(span);
    }

    public abstract String binder();

    public static final class Linear extends Bind {
        public final Source source;

        Linear(Names names, Source source, SourceSpan span) {
            super(names, span);
            this.source = Preconditions.checkNotNull(source);
        }

        public String binder() { return "<-"; }
    }

    public static final class Repeated extends Bind {
        public final Name source;

        Repeated(Names names, Name source, SourceSpan span) {
            super(names, span);
            this.source = Preconditions.checkNotNull(source);
        }

        public String binder() { return "<="; }
    }

    public static final class Peek extends Bind {
        public final Name source;

        Peek(Names names, Name source, SourceSpan span) {
            super(names, span);
            this.source = Preconditions.checkNotNull(source);
        }

        public String binder() { return "<<-"; }
    }
}
