package org.rholang.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import static org.rholang.parser.TokenType.*;

/*
 * Grammar:
 * low prec
 * to
 * high prec
 *
 * program        : proc* EOF ;
 * proc (0)       : binding ( "|" binding )* ;
 * binding (1)    : "new" nameDecl ( "," nameDecl )* ","? "in" binding
 *                | "if" "(" proc ")" binding ( "else" binding )?
 *                | compound ;
 * nameDecl       : IDENTIFIER ( "(" URI ")" )? ;
 * compound (2)   : "let" letDecl ( ( ";" | "&" ) letDecl )* "in" binding
 *                | ( "bundle" | "bundle+" | "bundle-" | "bundle0" ) block
 *                | "match" logicOr "{" ( proc "=>" proc )+ "}"
 *                | "select" "{" ( linearBind ( "&" linearBind )* "=>" send )+ "}"
 *                | "contract" name "(" names? ")" "=" block
 *                | "for" "(" receipt ( ";" receipt )* ")" block
 *                | send ;
 * letDecl        : names "=" proc ( "," proc )* ;
 * receipt        : bind ( "&" bind )* ;
 * bind           : names? "<-" source | names? "<=" name | names? "<<-" name ;
 * source         : name ( "?!" | "!?" "(" procs ")" )? ;
 * send (3)       : logicOr ( ( "!" | "!!" ) "(" procs ")"
 *                          | "!?" "(" procs ")" ( "." | ";" binding ) )? ;
 * logic_or (4)   : logicAnd ( "or" logicAnd )* ;
 * logic_and (5)  : equality ( "and" equality )* ;
 * equality (6)   : comparison ( ( "==" | "!=" ) comparison )* ( "matches" equality )? ;
 * comparison (7) : addition ( ( "<" | "<=" | ">" | ">=" ) addition )* ;
 * addition (8)   : multiplication ( ( "++" | "--" | "+" | "-" ) multiplication )* ;
 * mult (9)       : unary ( ( "%%" | "*" | "/" | "%" ) unary )* ;
 * unary (10)     : ( "not" | "-" ) unary | call ;
 * call (11)      : quoteEval ( "." IDENTIFIER "(" procs ")" )* ;
 * quoteEval (12) : "*" name | "@" quoteEval | disjunction ;
 * disjunction(13): conjunction ( "\/" conjunction )* ;
 * conjunction(14): negation ( "/\" negation )* ;
 * negation (15)  : "~" negation | primary ;
 * primary (16)   : NIL | BOOL | LONG | STRING | URI | IDENTIFIER | "_" | simpleType
 *                | ( "=" | "=" "*" ) IDENTIFIER
 *                | "(" ")" | "(" proc ")" | "(" proc "," procs ")"
 *                | "[" elements "]" | "Set" "(" elements ")"
 *                | "{" proc "}" | "{" ( proc ":" proc ( "," proc ":" proc )* )? remainder? "}" ;
 * name           : IDENTIFIER | "_" | "@" quoteEval ;
 * names          : name ( "," name )* ","? ( "..." "@" procVar )? | "..." "@" procVar ;
 * remainder      : "..." "@"? procVar ;
 *
 * Nesting through parentheses, blocks, collections and prefix operators is
 * limited to MAX_DEPTH levels.
 */

public class Parser {
    static final int MAX_DEPTH = 128;

    private final Lexer lexer;
    private final List<Token> tokens = new ArrayList<>();
    private int current = 0;
    private int depth = 0;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    public static Parser newFromSource(String source) {
        return new Parser(new Lexer(source));
    }

    /**
     * Parses the whole input into one process. An empty program is Nil and
     * several top-level processes are composed in parallel, left to right.
     */
    public Proc parse() {
        ImmutableList<Proc> procs = parseAll();
        if (procs.isEmpty()) {
            return AstBuilder.nil(peekTok().span());
        }
        Proc proc = procs.get(0);
        for (int i = 1; i < procs.size(); i++) {
            proc = AstBuilder.par(proc, procs.get(i));
        }
        return proc;
    }

    public ImmutableList<Proc> parseAll() {
        ImmutableList.Builder<Proc> procs = ImmutableList.builder();
        while (!isAtEnd()) {
            procs.add(par());
        }
        return procs.build();
    }

    private Proc par() {
        enter();
        Proc proc = binding();
        while (matchAny(PIPE)) {
            Proc right = binding();
            proc = AstBuilder.par(proc, right);
        }
        leave();
        return proc;
    }

    private Proc binding() {
        if (matchAny(NEW)) return newProc(prevTok());
        if (matchAny(IF)) return ifElse(prevTok());
        return compound();
    }

    private Proc newProc(Token kw) {
        ImmutableList.Builder<NameDecl> decls = ImmutableList.builder();
        Set<String> seen = new HashSet<>();
        do {
            Token var = consumeTok(IDENTIFIER, "variable name");
            if (!seen.add(var.lexeme)) {
                throw error(var, "distinct name in new declaration");
            }
            Token uri = null;
            if (matchAny(LEFT_PAREN)) {
                uri = consumeTok(URI, "URI literal");
                consumeTok(RIGHT_PAREN, "')'");
            }
            decls.add(AstBuilder.nameDecl(var, uri, prevTok()));
        } while (matchAny(COMMA) && !checkTok(IN)); // a trailing comma is allowed
        consumeTok(IN, "'in'");
        enter();
        Proc body = binding();
        leave();
        return AstBuilder.newProc(kw, decls.build(), body);
    }

    private Proc ifElse(Token kw) {
        consumeTok(LEFT_PAREN, "'(' after 'if'");
        Proc condition = par();
        consumeTok(RIGHT_PAREN, "')'");
        enter();
        Proc ifBranch = binding();
        Proc elseBranch = null;
        if (matchAny(ELSE)) {
            elseBranch = binding();
        }
        leave();
        return AstBuilder.ifElse(kw, condition, ifBranch, elseBranch);
    }

    private Proc compound() {
        if (matchAny(LET)) return let(prevTok());
        if (matchAny(BUNDLE, BUNDLE_READ, BUNDLE_WRITE, BUNDLE_EQUIV)) {
            Token kw = prevTok();
            Proc body = block();
            return AstBuilder.bundle(kw, body, prevTok());
        }
        if (matchAny(MATCH)) return match(prevTok());
        if (matchAny(SELECT)) return select(prevTok());
        if (matchAny(CONTRACT)) return contract(prevTok());
        if (matchAny(FOR)) return input(prevTok());
        return send();
    }

    private Proc let(Token kw) {
        ImmutableList.Builder<LetDecls.Decl> decls = ImmutableList.builder();
        LetDecls.Mode mode = null;
        decls.add(letDecl());
        while (checkTok(SEMICOLON) || checkTok(AMPERSAND)) {
            Token separator = advance();
            LetDecls.Mode separatorMode =
                separator.type == SEMICOLON ? LetDecls.Mode.SEQUENTIAL : LetDecls.Mode.CONCURRENT;
            if (mode == null) {
                mode = separatorMode;
            } else if (mode != separatorMode) {
                throw error(separator, "'" + mode.separator + "' between let declarations");
            }
            decls.add(letDecl());
        }
        if (mode == null) mode = LetDecls.Mode.SEQUENTIAL;
        consumeTok(IN, "'in'");
        enter();
        Proc body = binding();
        leave();
        return AstBuilder.let(kw, new LetDecls(mode, decls.build()), body);
    }

    private LetDecls.Decl letDecl() {
        Names names = names();
        consumeTok(EQUAL, "'='");
        ImmutableList.Builder<Proc> procs = ImmutableList.builder();
        do {
            procs.add(par());
        } while (matchAny(COMMA));
        return AstBuilder.letDecl(names, procs.build());
    }

    private Proc match(Token kw) {
        Proc scrutinee = logicOr();
        consumeTok(LEFT_BRACE, "'{' after match expression");
        ImmutableList.Builder<Case> cases = ImmutableList.builder();
        do {
            Proc pattern = par();
            consumeTok(ARROW, "'=>'");
            Proc body = par();
            cases.add(new Case(pattern, body));
        } while (!checkTok(RIGHT_BRACE));
        Token rbrace = consumeTok(RIGHT_BRACE, "'}'");
        return AstBuilder.match(kw, scrutinee, cases.build(), rbrace);
    }

    private Proc select(Token kw) {
        consumeTok(LEFT_BRACE, "'{' after 'select'");
        ImmutableList.Builder<Branch> branches = ImmutableList.builder();
        do {
            ImmutableList.Builder<Bind.Linear> binds = ImmutableList.builder();
            do {
                binds.add(linearBind());
            } while (matchAny(AMPERSAND));
            consumeTok(ARROW, "'=>'");
            Proc body = send();
            branches.add(new Branch(binds.build(), body));
        } while (!checkTok(RIGHT_BRACE));
        Token rbrace = consumeTok(RIGHT_BRACE, "'}'");
        return AstBuilder.choice(kw, branches.build(), rbrace);
    }

    private Proc contract(Token kw) {
        Name name = name();
        Token lparen = consumeTok(LEFT_PAREN, "'(' after contract name");
        Names formals;
        if (checkTok(RIGHT_PAREN)) {
            formals = AstBuilder.names(ImmutableList.<Name>of(), null, new SourceSpan(lparen.end, lparen.end));
        } else {
            formals = names();
        }
        consumeTok(RIGHT_PAREN, "')'");
        consumeTok(EQUAL, "'='");
        Proc body = block();
        return AstBuilder.contract(kw, name, formals, body, prevTok());
    }

    private Proc input(Token kw) {
        consumeTok(LEFT_PAREN, "'(' after 'for'");
        ImmutableList.Builder<Receipt> receipts = ImmutableList.builder();
        do {
            ImmutableList.Builder<Bind> binds = ImmutableList.builder();
            do {
                binds.add(bind());
            } while (matchAny(AMPERSAND));
            receipts.add(new Receipt(binds.build()));
        } while (matchAny(SEMICOLON));
        consumeTok(RIGHT_PAREN, "')'");
        Proc body = block();
        return AstBuilder.input(kw, receipts.build(), body, prevTok());
    }

    private Bind bind() {
        Token first = peekTok();
        Names names = null;
        if (!checkTok(LEFT_ARROW) && !checkTok(LESS_EQUAL) && !checkTok(LEFT_LEFT_ARROW)) {
            names = names();
        }
        if (matchAny(LEFT_ARROW)) {
            return AstBuilder.linearBind(names, source(), first);
        }
        if (matchAny(LESS_EQUAL)) {
            return AstBuilder.repeatedBind(names, name(), first);
        }
        if (matchAny(LEFT_LEFT_ARROW)) {
            return AstBuilder.peekBind(names, name(), first);
        }
        throw error(peekTok(), "'<-', '<=' or '<<-'");
    }

    private Bind.Linear linearBind() {
        Token first = peekTok();
        Names names = null;
        if (!checkTok(LEFT_ARROW)) {
            names = names();
        }
        consumeTok(LEFT_ARROW, "'<-'");
        return AstBuilder.linearBind(names, source(), first);
    }

    private Source source() {
        Name name = name();
        if (matchAny(QUESTION_BANG)) {
            return AstBuilder.receiveSend(name, prevTok());
        }
        if (matchAny(BANG_QUESTION)) {
            consumeTok(LEFT_PAREN, "'(' after '!?'");
            ImmutableList<Proc> inputs = procs(RIGHT_PAREN, "')'");
            return AstBuilder.sendReceive(name, inputs, prevTok());
        }
        return AstBuilder.simpleSource(name);
    }

    private Proc send() {
        Token first = peekTok();
        Proc proc = logicOr();
        if (matchAny(BANG, BANG_BANG)) {
            Token operator = prevTok();
            Name channel = channel(proc, first);
            consumeTok(LEFT_PAREN, "'(' after '" + operator.lexeme + "'");
            ImmutableList<Proc> inputs = procs(RIGHT_PAREN, "')'");
            return AstBuilder.send(channel, operator, inputs, prevTok());
        }
        if (matchAny(BANG_QUESTION)) {
            Name channel = channel(proc, first);
            consumeTok(LEFT_PAREN, "'(' after '!?'");
            ImmutableList<Proc> inputs = procs(RIGHT_PAREN, "')'");
            SyncCont cont;
            if (matchAny(DOT)) {
                cont = AstBuilder.emptyCont(prevTok());
            } else if (matchAny(SEMICOLON)) {
                Token semicolon = prevTok();
                enter();
                cont = AstBuilder.cont(semicolon, binding());
                leave();
            } else {
                throw error(peekTok(), "'.' or ';' after synchronous send");
            }
            return AstBuilder.sendSync(channel, inputs, cont);
        }
        return proc;
    }

    private Name channel(Proc proc, Token first) {
        Name name = AstBuilder.toName(proc);
        if (name == null) {
            throw new SyntaxError(proc.span, "channel name", proc.kind().grammarName(), first.line, first.column);
        }
        return name;
    }

    private Proc logicOr() {
        Proc proc = logicAnd();
        while (matchAny(OR)) {
            Token operator = prevTok();
            Proc right = logicAnd();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc logicAnd() {
        Proc proc = equality();
        while (matchAny(AND)) {
            Token operator = prevTok();
            Proc right = equality();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc equality() {
        Proc proc = comparison();

        while (matchAny(BANG_EQUAL, EQUAL_EQUAL)) {
            Token operator = prevTok();
            Proc right = comparison();
            proc = AstBuilder.binary(operator, proc, right);
        }
        // matches is right associative
        if (matchAny(MATCHES)) {
            Token operator = prevTok();
            enter();
            Proc right = equality();
            leave();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc comparison() {
        Proc proc = addition();

        while (matchAny(GREATER, GREATER_EQUAL,
                    LESS, LESS_EQUAL)) {
            Token operator = prevTok();
            Proc right = addition();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc addition() {
        Proc proc = multiplication();

        while (matchAny(PLUS_PLUS, MINUS_MINUS, PLUS, MINUS)) {
            Token operator = prevTok();
            Proc right = multiplication();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc multiplication() {
        Proc proc = unary();

        while (matchAny(PERCENT_PERCENT, STAR, SLASH, PERCENT)) {
            Token operator = prevTok();
            Proc right = unary();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc unary() {
        if (matchAny(NOT, MINUS)) {
            Token operator = prevTok();
            enter();
            Proc right = unary();
            leave();
            return AstBuilder.unary(operator, right);
        }

        return call();
    }

    private Proc call() {
        Proc proc = quoteEval();
        while (matchAny(DOT)) {
            Token name = consumeTok(IDENTIFIER, "method name after '.'");
            consumeTok(LEFT_PAREN, "'(' after method name");
            ImmutableList<Proc> args = procs(RIGHT_PAREN, "')'");
            proc = AstBuilder.method(proc, name, args, prevTok());
        }
        return proc;
    }

    private Proc quoteEval() {
        if (matchAny(STAR)) {
            Token star = prevTok();
            enter();
            Name name = name();
            leave();
            return AstBuilder.eval(star, name);
        }
        if (matchAny(AT)) {
            Token at = prevTok();
            enter();
            Proc quotable = quoteEval();
            leave();
            return AstBuilder.quote(at, quotable);
        }
        return disjunction();
    }

    private Proc disjunction() {
        Proc proc = conjunction();
        while (matchAny(DISJUNCTION)) {
            Token operator = prevTok();
            Proc right = conjunction();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc conjunction() {
        Proc proc = negation();
        while (matchAny(CONJUNCTION)) {
            Token operator = prevTok();
            Proc right = negation();
            proc = AstBuilder.binary(operator, proc, right);
        }
        return proc;
    }

    private Proc negation() {
        if (matchAny(TILDE)) {
            Token operator = prevTok();
            enter();
            Proc operand = negation();
            leave();
            return AstBuilder.unary(operator, operand);
        }
        return primary();
    }

    private Proc primary() {
        if (matchAny(NIL, TRUE, FALSE, LONG, STRING, URI, WILDCARD,
                    BOOL_TYPE, INT_TYPE, STRING_TYPE, URI_TYPE, BYTE_ARRAY_TYPE)) {
            return AstBuilder.ground(prevTok());
        }

        if (matchAny(IDENTIFIER)) {
            Token ident = prevTok();
            if (ident.lexeme.equals("Set") && matchAny(LEFT_PAREN)) {
                ImmutableList.Builder<Proc> elements = ImmutableList.builder();
                Proc.ProcVar remainder = elements(elements, RIGHT_PAREN);
                Token rparen = consumeTok(RIGHT_PAREN, "')'");
                return AstBuilder.set(ident, elements.build(), remainder, rparen);
            }
            return AstBuilder.ground(ident);
        }

        // a var ref only takes an identifier, so it binds like an atom
        if (matchAny(EQUAL)) {
            Token eq = prevTok();
            VarRefKind kind = matchAny(STAR) ? VarRefKind.NAME : VarRefKind.PROC;
            Token var = consumeTok(IDENTIFIER, "variable after '" + kind.symbol + "'");
            return AstBuilder.varRef(eq, kind, var);
        }

        if (matchAny(LEFT_BRACKET)) {
            Token lbracket = prevTok();
            ImmutableList.Builder<Proc> elements = ImmutableList.builder();
            Proc.ProcVar remainder = elements(elements, RIGHT_BRACKET);
            Token rbracket = consumeTok(RIGHT_BRACKET, "']'");
            return AstBuilder.list(lbracket, elements.build(), remainder, rbracket);
        }

        if (matchAny(LEFT_PAREN)) {
            return parenthesized(prevTok());
        }

        if (matchAny(LEFT_BRACE)) {
            return blockOrMap(prevTok());
        }

        throw error(peekTok(), "process");
    }

    // unit, grouping or tuple
    private Proc parenthesized(Token lparen) {
        if (matchAny(RIGHT_PAREN)) {
            return AstBuilder.unit(lparen, prevTok());
        }
        Proc first = par();
        if (matchAny(RIGHT_PAREN)) {
            return first;
        }
        consumeTok(COMMA, "',' or ')'");
        ImmutableList.Builder<Proc> elements = ImmutableList.builder();
        elements.add(first);
        while (!checkTok(RIGHT_PAREN)) {
            elements.add(par());
            if (!matchAny(COMMA)) break;
        }
        Token rparen = consumeTok(RIGHT_PAREN, "')'");
        return AstBuilder.tuple(lparen, elements.build(), rparen);
    }

    // A block yields the process inside it; no node is made for the braces.
    private Proc blockOrMap(Token lbrace) {
        if (checkTok(RIGHT_BRACE) || checkTok(ELLIPSIS)) {
            return map(lbrace, null);
        }
        Proc first = par();
        if (matchAny(COLON)) {
            return map(lbrace, first);
        }
        consumeTok(RIGHT_BRACE, "'}'");
        return first;
    }

    private Proc map(Token lbrace, Proc firstKey) {
        ImmutableList.Builder<KeyValuePair> pairs = ImmutableList.builder();
        Proc.ProcVar remainder = null;
        boolean more = true;
        if (firstKey != null) {
            pairs.add(AstBuilder.keyValue(firstKey, par()));
            more = matchAny(COMMA) || checkTok(ELLIPSIS);
        }
        while (more && !checkTok(RIGHT_BRACE)) {
            if (matchAny(ELLIPSIS)) {
                remainder = remainder();
                break;
            }
            Proc key = par();
            consumeTok(COLON, "':'");
            pairs.add(AstBuilder.keyValue(key, par()));
            more = matchAny(COMMA) || checkTok(ELLIPSIS);
        }
        Token rbrace = consumeTok(RIGHT_BRACE, "'}'");
        return AstBuilder.map(lbrace, pairs.build(), remainder, rbrace);
    }

    private Proc block() {
        consumeTok(LEFT_BRACE, "'{'");
        Proc proc = par();
        consumeTok(RIGHT_BRACE, "'}'");
        return proc;
    }

    // Comma separated processes up to and including the closing token.
    private ImmutableList<Proc> procs(TokenType closing, String closingText) {
        ImmutableList.Builder<Proc> procs = ImmutableList.builder();
        while (!checkTok(closing)) {
            procs.add(par());
            if (!matchAny(COMMA)) break;
        }
        consumeTok(closing, closingText);
        return procs.build();
    }

    // Collection elements, leaving the closing token. Returns the remainder, if any.
    private Proc.ProcVar elements(ImmutableList.Builder<Proc> elements, TokenType closing) {
        while (!checkTok(closing)) {
            if (matchAny(ELLIPSIS)) {
                return remainder();
            }
            elements.add(par());
            if (!matchAny(COMMA) && !checkTok(ELLIPSIS)) break;
        }
        return null;
    }

    private Proc.ProcVar remainder() {
        matchAny(AT);
        return procVar();
    }

    private Names names() {
        Token first = peekTok();
        ImmutableList.Builder<Name> names = ImmutableList.builder();
        Proc.ProcVar remainder = null;
        if (!checkTok(ELLIPSIS)) {
            names.add(name());
            while (matchAny(COMMA)) {
                if (!startsName()) break;
                names.add(name());
            }
        }
        if (matchAny(ELLIPSIS)) {
            consumeTok(AT, "'@' after '...'");
            remainder = procVar();
        }
        return AstBuilder.names(names.build(), remainder, AstBuilder.span(first, prevTok()));
    }

    private Name name() {
        if (matchAny(AT)) {
            Token at = prevTok();
            return AstBuilder.quoteName(at, quoteEval());
        }
        if (checkTok(IDENTIFIER) || checkTok(WILDCARD)) {
            return AstBuilder.toName(procVar());
        }
        throw error(peekTok(), "name");
    }

    private boolean startsName() {
        return checkTok(IDENTIFIER) || checkTok(WILDCARD) || checkTok(AT);
    }

    private Proc.ProcVar procVar() {
        if (matchAny(IDENTIFIER, WILDCARD)) {
            return (Proc.ProcVar)AstBuilder.ground(prevTok());
        }
        throw error(peekTok(), "variable");
    }

    // Any error ends the parse, so leave() only runs on the way back out of a successful descent.
    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error(peekTok(), "at most " + MAX_DEPTH + " levels of nesting");
        }
    }

    private void leave() {
        depth--;
    }

    private boolean matchAny(TokenType... ttypes) {
        for (TokenType ttype : ttypes) {
            if (checkTok(ttype)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private Token consumeTok(TokenType ttype, String expected) {
        if (checkTok(ttype)) {
            advance();
            return prevTok();
        } else {
            throw error(peekTok(), expected);
        }
    }

    private boolean checkTok(TokenType ttype) {
        if (isAtEnd()) return false;
        return peekTok().type == ttype;
    }

    private Token peekTok() {
        return peekTokN(0);
    }

    // Pulls tokens from the lexer only as far as the parser looks ahead.
    private Token peekTokN(int n) {
        while (tokens.size() <= current + n) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type == EOF) {
                return tokens.get(tokens.size() - 1);
            }
            tokens.add(lexer.nextToken());
        }
        return tokens.get(current + n);
    }

    private Token prevTok() {
        if (current == 0) return peekTok();
        return tokens.get(current - 1);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return prevTok();
    }

    private boolean isAtEnd() {
        return peekTok().type == EOF;
    }

    private SyntaxError error(Token token, String expected) {
        String found = token.type == EOF ? "end of input" : "'" + token.lexeme + "'";
        return new SyntaxError(token.span(), expected, found, token.line, token.column);
    }
}
