package org.rholang.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// right hand side of a linear bind
public abstract class Source {
    public final Name name;
    public final SourceSpan span;

    Source(Name name, SourceSpan span) {
        this.name = Preconditions.checkNotNull(name);
        this.span = span;
    }

    public static final class Simple extends Source {
        Simple(Name name) {
            super(name, name.span);
        }
    }

    // name?!
    public static final class ReceiveSend extends Source {
        ReceiveSend(Name name, SourceSpan span) {
            super(name, span);
        }
    }

    // name!?(inputs)
    public static final class SendReceive extends Source {
        public final ImmutableList<Proc> inputs;

        SendReceive(Name name, ImmutableList<Proc> inputs, SourceSpan span) {
            super(name, span);
            this.inputs = inputs;
        }
    }
}
