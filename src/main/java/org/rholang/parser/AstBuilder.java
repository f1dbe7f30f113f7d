package org.rholang.parser;

import com.google.common.collect.ImmutableList;

/**
 * Node factories used by the parser, one per grammar production. Each
 * factory only combines nodes that are already built and computes the span
 * of the result.
 */
final class AstBuilder {
    private AstBuilder() {}

    static SourceSpan span(Token first, Token last) {
        return new SourceSpan(first.start, last.end);
    }

    static SourceSpan span(Token first, Proc last) {
        return new SourceSpan(first.start, last.span.end);
    }

    // ground terms

    static Proc ground(Token tok) {
        SourceSpan span = tok.span();
        switch (tok.type) {
            case NIL: return new Proc.Nil(span);
            case TRUE: return new Proc.BoolLit(true, span);
            case FALSE: return new Proc.BoolLit(false, span);
            case LONG: return new Proc.LongLit((Long)tok.literal, span);
            case STRING: return new Proc.StringLit((String)tok.literal, span);
            case URI: return new Proc.UriLit((String)tok.literal, span);
            case BOOL_TYPE: return new Proc.SimpleType(GroundType.BOOL, span);
            case INT_TYPE: return new Proc.SimpleType(GroundType.INT, span);
            case STRING_TYPE: return new Proc.SimpleType(GroundType.STRING, span);
            case URI_TYPE: return new Proc.SimpleType(GroundType.URI, span);
            case BYTE_ARRAY_TYPE: return new Proc.SimpleType(GroundType.BYTE_ARRAY, span);
            case IDENTIFIER: return new Proc.Var(tok.lexeme, span);
            case WILDCARD: return new Proc.Wildcard(span);
            default:
                throw new IllegalArgumentException("not a ground term: " + tok);
        }
    }

    static Proc nil(SourceSpan span) {
        return new Proc.Nil(span);
    }

    static Proc unit(Token lparen, Token rparen) {
        return new Proc.Unit(span(lparen, rparen));
    }

    // collections

    static Proc list(Token open, ImmutableList<Proc> elements, Proc.ProcVar remainder, Token close) {
        return new Proc.ListLit(elements, remainder, span(open, close));
    }

    static Proc tuple(Token open, ImmutableList<Proc> elements, Token close) {
        return new Proc.TupleLit(elements, span(open, close));
    }

    static Proc set(Token setTok, ImmutableList<Proc> elements, Proc.ProcVar remainder, Token close) {
        return new Proc.SetLit(elements, remainder, span(setTok, close));
    }

    static Proc map(Token open, ImmutableList<KeyValuePair> pairs, Proc.ProcVar remainder, Token close) {
        return new Proc.MapLit(pairs, remainder, span(open, close));
    }

    static KeyValuePair keyValue(Proc key, Proc value) {
        return new KeyValuePair(key, value);
    }

    // expressions

    static Proc par(Proc left, Proc right) {
        return new Proc.Par(left, right, SourceSpan.between(left.span, right.span));
    }

    static Proc binary(Token operator, Proc left, Proc right) {
        BinaryOp op = BinaryOp.fromToken(operator.type);
        return new Proc.Binary(op, left, right, SourceSpan.between(left.span, right.span));
    }

    static Proc unary(Token operator, Proc operand) {
        UnaryOp op;
        switch (operator.type) {
            case NOT: op = UnaryOp.NOT; break;
            case MINUS: op = UnaryOp.NEG; break;
            case TILDE: op = UnaryOp.NEGATION; break;
            default:
                throw new IllegalArgumentException("not a unary operator: " + operator);
        }
        return new Proc.Unary(op, operand, span(operator, operand));
    }

    static Proc eval(Token star, Name name) {
        return new Proc.Eval(name, new SourceSpan(star.start, name.span.end));
    }

    static Proc quote(Token at, Proc quotable) {
        return new Proc.Quote(quotable, span(at, quotable));
    }

    static Proc method(Proc receiver, Token name, ImmutableList<Proc> args, Token rparen) {
        return new Proc.Method(receiver, name.lexeme, args, new SourceSpan(receiver.span.start, rparen.end));
    }

    static Proc varRef(Token eq, VarRefKind kind, Token var) {
        return new Proc.VarRef(kind, var.lexeme, span(eq, var));
    }

    // processes

    static Proc send(Name channel, Token operator, ImmutableList<Proc> inputs, Token rparen) {
        SendMode mode = operator.type == TokenType.BANG_BANG ? SendMode.MULTIPLE : SendMode.SINGLE;
        return new Proc.Send(channel, mode, inputs, new SourceSpan(channel.span.start, rparen.end));
    }

    static Proc sendSync(Name channel, ImmutableList<Proc> inputs, SyncCont cont) {
        return new Proc.SendSync(channel, inputs, cont, new SourceSpan(channel.span.start, cont.span.end));
    }

    static SyncCont emptyCont(Token dot) {
        return new SyncCont(null, dot.span());
    }

    static SyncCont cont(Token semicolon, Proc proc) {
        return new SyncCont(proc, span(semicolon, proc));
    }

    static Proc newProc(Token kw, ImmutableList<NameDecl> decls, Proc body) {
        return new Proc.New(decls, body, span(kw, body));
    }

    static NameDecl nameDecl(Token var, Token uri, Token last) {
        return new NameDecl(var.lexeme, uri == null ? null : (String)uri.literal, span(var, last));
    }

    static Proc ifElse(Token kw, Proc condition, Proc ifBranch, Proc elseBranch) {
        Proc last = elseBranch == null ? ifBranch : elseBranch;
        return new Proc.IfElse(condition, ifBranch, elseBranch, span(kw, last));
    }

    static Proc let(Token kw, LetDecls decls, Proc body) {
        return new Proc.Let(decls, body, span(kw, body));
    }

    static LetDecls.Decl letDecl(Names names, ImmutableList<Proc> procs) {
        Proc last = procs.get(procs.size() - 1);
        return new LetDecls.Decl(names, procs, SourceSpan.between(names.span, last.span));
    }

    static Proc bundle(Token kw, Proc body, Token rbrace) {
        BundleKind kind;
        switch (kw.type) {
            case BUNDLE_READ: kind = BundleKind.READ_ONLY; break;
            case BUNDLE_WRITE: kind = BundleKind.WRITE_ONLY; break;
            case BUNDLE_EQUIV: kind = BundleKind.EQUIVALENT; break;
            case BUNDLE: kind = BundleKind.READ_WRITE; break;
            default:
                throw new IllegalArgumentException("not a bundle keyword: " + kw);
        }
        return new Proc.Bundle(kind, body, span(kw, rbrace));
    }

    static Proc match(Token kw, Proc scrutinee, ImmutableList<Case> cases, Token rbrace) {
        return new Proc.Match(scrutinee, cases, span(kw, rbrace));
    }

    static Proc choice(Token kw, ImmutableList<Branch> branches, Token rbrace) {
        return new Proc.Choice(branches, span(kw, rbrace));
    }

    static Proc contract(Token kw, Name name, Names formals, Proc body, Token rbrace) {
        return new Proc.Contract(name, formals, body, span(kw, rbrace));
    }

    static Proc input(Token kw, ImmutableList<Receipt> receipts, Proc body, Token rbrace) {
        return new Proc.Input(receipts, body, span(kw, rbrace));
    }

    // binds

    static Bind.Linear linearBind(Names names, Source source, Token first) {
        return new Bind.Linear(names, source, new SourceSpan(first.start, source.span.end));
    }

    static Bind repeatedBind(Names names, Name source, Token first) {
        return new Bind.Repeated(names, source, new SourceSpan(first.start, source.span.end));
    }

    static Bind peekBind(Names names, Name source, Token first) {
        return new Bind.Peek(names, source, new SourceSpan(first.start, source.span.end));
    }

    static Source simpleSource(Name name) {
        return new Source.Simple(name);
    }

    static Source receiveSend(Name name, Token suffix) {
        return new Source.ReceiveSend(name, new SourceSpan(name.span.start, suffix.end));
    }

    static Source sendReceive(Name name, ImmutableList<Proc> inputs, Token rparen) {
        return new Source.SendReceive(name, inputs, new SourceSpan(name.span.start, rparen.end));
    }

    // names

    static Names names(ImmutableList<Name> names, Proc.ProcVar remainder, SourceSpan span) {
        return new Names(names, remainder, span);
    }

    static Name quoteName(Token at, Proc quotable) {
        return new Name.Quote(quotable, span(at, quotable));
    }

    /**
     * The name a process denotes when used as a channel, or null if it
     * denotes none: only variables, the wildcard and quotes do.
     */
    static Name toName(Proc proc) {
        if (proc instanceof Proc.ProcVar) {
            return new Name.ProcVar((Proc.ProcVar)proc);
        }
        if (proc instanceof Proc.Quote) {
            return new Name.Quote(((Proc.Quote)proc).quotable, proc.span);
        }
        return null;
    }
}
