package org.rholang.parser;

import com.google.common.base.Preconditions;

/**
 * A channel name: either a variable (or wildcard) or a quoted process.
 * {@link Proc.Eval} turns a name back into a process.
 */
public abstract class Name {
    public interface Visitor<R> {
        R visitProcVarName(ProcVar name);
        R visitQuoteName(Quote name);
    }

    public final SourceSpan span;

    Name(SourceSpan span) {
        this.span = Preconditions.checkNotNull(span);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static final class ProcVar extends Name {
        public final Proc.ProcVar var;

        ProcVar(Proc.ProcVar var) {
            super(var.span);
            this.var = var;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProcVarName(this);
        }
    }

    public static final class Quote extends Name {
        public final Proc quotable;

        Quote(Proc quotable, SourceSpan span) {
            super(span);
            this.quotable = Preconditions.checkNotNull(quotable);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuoteName(this);
        }
    }
}
