package org.rholang.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The declarations of a let. Sequential declarations are separated by ';'
 * and may use names bound by earlier ones; concurrent ones are separated by '&'.
 */
public final class LetDecls {
    public enum Mode {
        SEQUENTIAL(";"),
        CONCURRENT("&");

        public final String separator;

        Mode(String separator) {
            this.separator = separator;
        }
    }

    /**
     * names = procs; the two lists pair up positionally. Their lengths are
     * not compared here.
     */
    public static final class Decl {
        public final Names names;
        public final ImmutableList<Proc> procs;
        public final SourceSpan span;

        Decl(Names names, ImmutableList<Proc> procs, SourceSpan span) {
            Preconditions.checkArgument(!procs.isEmpty(), "let declaration without values");
            this.names = Preconditions.checkNotNull(names);
            this.procs = procs;
            this.span = span;
        }
    }

    public final Mode mode;
    public final ImmutableList<Decl> decls;

    LetDecls(Mode mode, ImmutableList<Decl> decls) {
        Preconditions.checkArgument(!decls.isEmpty(), "let without declarations");
        this.mode = Preconditions.checkNotNull(mode);
        this.decls = decls;
    }
}
