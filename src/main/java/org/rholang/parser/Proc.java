package org.rholang.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A Rholang process. Everything the parser produces is a Proc: process
 * combinators (par, send, for, ...) as well as expressions and ground terms.
 * Nodes are immutable and built through {@link AstBuilder}.
 *
 * <p>Grouping parentheses and blocks make no node of their own: {@code (P)}
 * and {@code {P}} yield P with P's span, which does not cover the
 * surrounding brackets.
 */
public abstract class Proc {
    public interface Visitor<R> {
        R visitNilProc(Nil proc);
        R visitParProc(Par proc);
        R visitSendProc(Send proc);
        R visitSendSyncProc(SendSync proc);
        R visitNewProc(New proc);
        R visitIfElseProc(IfElse proc);
        R visitLetProc(Let proc);
        R visitBundleProc(Bundle proc);
        R visitMatchProc(Match proc);
        R visitChoiceProc(Choice proc);
        R visitContractProc(Contract proc);
        R visitInputProc(Input proc);
        R visitBinaryProc(Binary proc);
        R visitUnaryProc(Unary proc);
        R visitEvalProc(Eval proc);
        R visitQuoteProc(Quote proc);
        R visitMethodProc(Method proc);
        R visitVarRefProc(VarRef proc);
        R visitBoolLitProc(BoolLit proc);
        R visitLongLitProc(LongLit proc);
        R visitStringLitProc(StringLit proc);
        R visitUriLitProc(UriLit proc);
        R visitSimpleTypeProc(SimpleType proc);
        R visitUnitProc(Unit proc);
        R visitVarProc(Var proc);
        R visitWildcardProc(Wildcard proc);
        R visitListLitProc(ListLit proc);
        R visitTupleLitProc(TupleLit proc);
        R visitSetLitProc(SetLit proc);
        R visitMapLitProc(MapLit proc);
    }

    public final SourceSpan span;

    Proc(SourceSpan span) {
        this.span = Preconditions.checkNotNull(span);
    }

    public abstract NodeKind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    public static final class Nil extends Proc {
        Nil(SourceSpan span) {
            super(span);
        }

        public NodeKind kind() { return NodeKind.NIL; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNilProc(this);
        }
    }

    public static final class Par extends Proc {
        public final Proc left;
        public final Proc right;

        Par(Proc left, Proc right, SourceSpan span) {
            super(span);
            this.left = Preconditions.checkNotNull(left);
            this.right = Preconditions.checkNotNull(right);
        }

        public NodeKind kind() { return NodeKind.PAR; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParProc(this);
        }
    }

    public static final class Send extends Proc {
        public final Name channel;
        public final SendMode mode;
        public final ImmutableList<Proc> inputs;

        Send(Name channel, SendMode mode, ImmutableList<Proc> inputs, SourceSpan span) {
            super(span);
            this.channel = Preconditions.checkNotNull(channel);
            this.mode = Preconditions.checkNotNull(mode);
            this.inputs = inputs;
        }

        public NodeKind kind() { return NodeKind.SEND; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSendProc(this);
        }
    }

    public static final class SendSync extends Proc {
        public final Name channel;
        public final ImmutableList<Proc> inputs;
        public final SyncCont cont;

        SendSync(Name channel, ImmutableList<Proc> inputs, SyncCont cont, SourceSpan span) {
            super(span);
            this.channel = Preconditions.checkNotNull(channel);
            this.inputs = inputs;
            this.cont = Preconditions.checkNotNull(cont);
        }

        public NodeKind kind() { return NodeKind.SEND_SYNC; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSendSyncProc(this);
        }
    }

    public static final class New extends Proc {
        public final ImmutableList<NameDecl> decls;
        public final Proc body;

        New(ImmutableList<NameDecl> decls, Proc body, SourceSpan span) {
            super(span);
            Preconditions.checkArgument(!decls.isEmpty(), "new without declarations");
            this.decls = decls;
            this.body = Preconditions.checkNotNull(body);
        }

        public NodeKind kind() { return NodeKind.NEW; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNewProc(this);
        }
    }

    public static final class IfElse extends Proc {
        public final Proc condition;
        public final Proc ifBranch;
        public final Proc elseBranch; // null when there is no else

        IfElse(Proc condition, Proc ifBranch, Proc elseBranch, SourceSpan span) {
            super(span);
            this.condition = Preconditions.checkNotNull(condition);
            this.ifBranch = Preconditions.checkNotNull(ifBranch);
            this.elseBranch = elseBranch;
        }

        public NodeKind kind() { return NodeKind.IF_ELSE; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfElseProc(this);
        }
    }

    public static final class Let extends Proc {
        public final LetDecls decls;
        public final Proc body;

        Let(LetDecls decls, Proc body, SourceSpan span) {
            super(span);
            this.decls = Preconditions.checkNotNull(decls);
            this.body = Preconditions.checkNotNull(body);
        }

        public NodeKind kind() { return NodeKind.LET; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLetProc(this);
        }
    }

    public static final class Bundle extends Proc {
        public final BundleKind bundleKind;
        public final Proc body;

        Bundle(BundleKind bundleKind, Proc body, SourceSpan span) {
            super(span);
            this.bundleKind = Preconditions.checkNotNull(bundleKind);
            this.body = Preconditions.checkNotNull(body);
        }

        public NodeKind kind() { return NodeKind.BUNDLE; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBundleProc(this);
        }
    }

    public static final class Match extends Proc {
        public final Proc scrutinee;
        public final ImmutableList<Case> cases;

        Match(Proc scrutinee, ImmutableList<Case> cases, SourceSpan span) {
            super(span);
            Preconditions.checkArgument(!cases.isEmpty(), "match without cases");
            this.scrutinee = Preconditions.checkNotNull(scrutinee);
            this.cases = cases;
        }

        public NodeKind kind() { return NodeKind.MATCH; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatchProc(this);
        }
    }

    public static final class Choice extends Proc {
        public final ImmutableList<Branch> branches;

        Choice(ImmutableList<Branch> branches, SourceSpan span) {
            super(span);
            Preconditions.checkArgument(!branches.isEmpty(), "select without branches");
            this.branches = branches;
        }

        public NodeKind kind() { return NodeKind.CHOICE; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChoiceProc(this);
        }
    }

    public static final class Contract extends Proc {
        public final Name name;
        public final Names formals;
        public final Proc body;

        Contract(Name name, Names formals, Proc body, SourceSpan span) {
            super(span);
            this.name = Preconditions.checkNotNull(name);
            this.formals = Preconditions.checkNotNull(formals);
            this.body = Preconditions.checkNotNull(body);
        }

        public NodeKind kind() { return NodeKind.CONTRACT; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContractProc(this);
        }
    }

    public static final class Input extends Proc {
        public final ImmutableList<Receipt> receipts;
        public final Proc body;

        Input(ImmutableList<Receipt> receipts, Proc body, SourceSpan span) {
            super(span);
            Preconditions.checkArgument(!receipts.isEmpty(), "for without receipts");
            this.receipts = receipts;
            this.body = Preconditions.checkNotNull(body);
        }

        public NodeKind kind() { return NodeKind.INPUT; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInputProc(this);
        }
    }

    public static final class Binary extends Proc {
        public final BinaryOp op;
        public final Proc left;
        public final Proc right;

        Binary(BinaryOp op, Proc left, Proc right, SourceSpan span) {
            super(span);
            this.op = Preconditions.checkNotNull(op);
            this.left = Preconditions.checkNotNull(left);
            this.right = Preconditions.checkNotNull(right);
        }

        public NodeKind kind() { return op.kind; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryProc(this);
        }
    }

    public static final class Unary extends Proc {
        public final UnaryOp op;
        public final Proc operand;

        Unary(UnaryOp op, Proc operand, SourceSpan span) {
            super(span);
            this.op = Preconditions.checkNotNull(op);
            this.operand = Preconditions.checkNotNull(operand);
        }

        public NodeKind kind() { return op.kind; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryProc(this);
        }
    }

    public static final class Eval extends Proc {
        public final Name name;

        Eval(Name name, SourceSpan span) {
            super(span);
            this.name = Preconditions.checkNotNull(name);
        }

        public NodeKind kind() { return NodeKind.EVAL; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEvalProc(this);
        }
    }

    public static final class Quote extends Proc {
        public final Proc quotable;

        Quote(Proc quotable, SourceSpan span) {
            super(span);
            this.quotable = Preconditions.checkNotNull(quotable);
        }

        public NodeKind kind() { return NodeKind.QUOTE; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuoteProc(this);
        }
    }

    public static final class Method extends Proc {
        public final Proc receiver;
        public final String name;
        public final ImmutableList<Proc> args;

        Method(Proc receiver, String name, ImmutableList<Proc> args, SourceSpan span) {
            super(span);
            this.receiver = Preconditions.checkNotNull(receiver);
            this.name = Preconditions.checkNotNull(name);
            this.args = args;
        }

        public NodeKind kind() { return NodeKind.METHOD; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMethodProc(this);
        }
    }

    public static final class VarRef extends Proc {
        public final VarRefKind refKind;
        public final String var;

        VarRef(VarRefKind refKind, String var, SourceSpan span) {
            super(span);
            this.refKind = Preconditions.checkNotNull(refKind);
            this.var = Preconditions.checkNotNull(var);
        }

        public NodeKind kind() { return NodeKind.VAR_REF; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarRefProc(this);
        }
    }

    public static final class BoolLit extends Proc {
        public final boolean value;

        BoolLit(boolean value, SourceSpan span) {
            super(span);
            this.value = value;
        }

        public NodeKind kind() { return NodeKind.BOOL_LITERAL; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolLitProc(this);
        }
    }

    public static final class LongLit extends Proc {
        public final long value;

        LongLit(long value, SourceSpan span) {
            super(span);
            this.value = value;
        }

        public NodeKind kind() { return NodeKind.LONG_LITERAL; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLongLitProc(this);
        }
    }

    public static final class StringLit extends Proc {
        public final String value; // escapes kept as written

        StringLit(String value, SourceSpan span) {
            super(span);
            this.value = Preconditions.checkNotNull(value);
        }

        public NodeKind kind() { return NodeKind.STRING_LITERAL; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLitProc(this);
        }
    }

    public static final class UriLit extends Proc {
        public final String value;

        UriLit(String value, SourceSpan span) {
            super(span);
            Preconditions.checkArgument(!value.isEmpty() && value.indexOf('`') < 0, "bad uri: %s", value);
            this.value = value;
        }

        public NodeKind kind() { return NodeKind.URI_LITERAL; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUriLitProc(this);
        }
    }

    public static final class SimpleType extends Proc {
        public final GroundType type;

        SimpleType(GroundType type, SourceSpan span) {
            super(span);
            this.type = Preconditions.checkNotNull(type);
        }

        public NodeKind kind() { return NodeKind.SIMPLE_TYPE; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSimpleTypeProc(this);
        }
    }

    public static final class Unit extends Proc {
        Unit(SourceSpan span) {
            super(span);
        }

        public NodeKind kind() { return NodeKind.UNIT; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnitProc(this);
        }
    }

    /**
     * A variable or the wildcard; the only things a remainder can bind.
     */
    public abstract static class ProcVar extends Proc {
        ProcVar(SourceSpan span) {
            super(span);
        }
    }

    public static final class Var extends ProcVar {
        public final String name;

        Var(String name, SourceSpan span) {
            super(span);
            this.name = Preconditions.checkNotNull(name);
        }

        public NodeKind kind() { return NodeKind.VAR; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarProc(this);
        }
    }

    public static final class Wildcard extends ProcVar {
        Wildcard(SourceSpan span) {
            super(span);
        }

        public NodeKind kind() { return NodeKind.WILDCARD; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWildcardProc(this);
        }
    }

    public static final class ListLit extends Proc {
        public final ImmutableList<Proc> elements;
        public final ProcVar remainder; // may be null

        ListLit(ImmutableList<Proc> elements, ProcVar remainder, SourceSpan span) {
            super(span);
            this.elements = elements;
            this.remainder = remainder;
        }

        public NodeKind kind() { return NodeKind.LIST; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListLitProc(this);
        }
    }

    public static final class TupleLit extends Proc {
        public final ImmutableList<Proc> elements;

        TupleLit(ImmutableList<Proc> elements, SourceSpan span) {
            super(span);
            Preconditions.checkArgument(!elements.isEmpty(), "empty tuple");
            this.elements = elements;
        }

        public NodeKind kind() { return NodeKind.TUPLE; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTupleLitProc(this);
        }
    }

    public static final class SetLit extends Proc {
        public final ImmutableList<Proc> elements;
        public final ProcVar remainder; // may be null

        SetLit(ImmutableList<Proc> elements, ProcVar remainder, SourceSpan span) {
            super(span);
            this.elements = elements;
            this.remainder = remainder;
        }

        public NodeKind kind() { return NodeKind.SET; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetLitProc(this);
        }
    }

    public static final class MapLit extends Proc {
        public final ImmutableList<KeyValuePair> pairs;
        public final ProcVar remainder; // may be null

        MapLit(ImmutableList<KeyValuePair> pairs, ProcVar remainder, SourceSpan span) {
            super(span);
            this.pairs = pairs;
            this.remainder = remainder;
        }

        public NodeKind kind() { return NodeKind.MAP; }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMapLitProc(this);
        }
    }
}
