package org.rholang.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;
import org.rholang.parser.AstPrinter;
import org.rholang.parser.BundleKind;
import org.rholang.parser.NodeKind;
import org.rholang.parser.Parser;
import org.rholang.parser.Proc;
import org.rholang.parser.SendMode;
import org.rholang.parser.SourceSpan;
import org.rholang.parser.SyntaxError;

public class ParserTest {
    private static SyntaxError syntaxError(String src) {
        try {
            Parser.newFromSource(src).parse();
        } catch (SyntaxError e) {
            return e;
        }
        fail("expected a syntax error for " + src);
        return null;
    }

    @Test
    public void testPrecedence() {
        assertEquals("(+ 1 (* 2 3))", AstPrinter.print("1 + 2 * 3"));
        assertEquals("(+ (* 1 2) 3)", AstPrinter.print("1 * 2 + 3"));
        assertEquals("(* (+ 1 2) 3)", AstPrinter.print("(1 + 2) * 3"));
        assertEquals("(- (- 1 2) 3)", AstPrinter.print("1 - 2 - 3"));
        assertEquals("(or (var a) (and (var b) (var c)))", AstPrinter.print("a or b and c"));
        assertEquals("(== (not (var a)) (var b))", AstPrinter.print("not a == b"));
        assertEquals("(* (- (var x)) (var y))", AstPrinter.print("-x * y"));
        assertEquals("(!= (== (var a) (var b)) (var c))", AstPrinter.print("a == b != c"));
        assertEquals("(<= (< (var a) (var b)) (var c))", AstPrinter.print("a < b <= c"));
        assertEquals("(-- (++ \"a\" \"b\") (var c))", AstPrinter.print("\"a\" ++ \"b\" -- c"));
        assertEquals("(% (%% (var x) (var y)) (var z))", AstPrinter.print("x %% y % z"));
    }

    @Test
    public void testMatchesIsRightAssociative() {
        assertEquals("(matches (var a) (matches (var b) (var c)))", AstPrinter.print("a matches b matches c"));
        assertEquals("(matches (== (var a) (var b)) (var c))", AstPrinter.print("a == b matches c"));
    }

    @Test
    public void testPatternOperators() {
        assertEquals("(\\/ (var a) (/\\ (var b) (var c)))", AstPrinter.print("a \\/ b /\\ c"));
        assertEquals("(/\\ (~ (var a)) (var b))", AstPrinter.print("~a /\\ b"));
        assertEquals("(\\/ (= x) (=* y))", AstPrinter.print("=x \\/ =*y"));
    }

    @Test
    public void testVarRefIsAnOperand() {
        assertEquals("(/\\ (= x) (var y))", AstPrinter.print("=x /\\ y"));
        assertEquals("(/\\ 1 (= x))", AstPrinter.print("1 /\\ =x"));
        assertEquals("(~ (= x))", AstPrinter.print("~=x"));
        assertEquals("(~ (=* x))", AstPrinter.print("~=*x"));
        assertEquals("(match (var z) (case (/\\ (= x) Int) Nil))",
                AstPrinter.print("match z { =x /\\ Int => Nil }"));
    }

    @Test
    public void testParIsLeftAssociative() {
        assertEquals("(par (par (var a) (var b)) (var c))", AstPrinter.print("a | b | c"));
        assertEquals("(par (var a) (par (var b) (var c)))", AstPrinter.print("a | (b | c)"));
    }

    @Test
    public void testQuoteAndEval() {
        assertEquals("(quote 1)", AstPrinter.print("@(1)"));
        assertEquals("(eval (var x))", AstPrinter.print("*x"));
        assertEquals("(eval (quote (var x)))", AstPrinter.print("*@x"));
        assertEquals("(quote (quote Nil))", AstPrinter.print("@@Nil"));
    }

    @Test
    public void testMethodCalls() {
        assertEquals("(method bar (method foo (var x) 1 2))", AstPrinter.print("x.foo(1, 2).bar()"));
        assertEquals("(method foo (eval (var x)))", AstPrinter.print("*x.foo()"));
        assertEquals("(method length \"abc\")", AstPrinter.print("\"abc\".length()"));
    }

    @Test
    public void testSends() {
        assertEquals("(send! (var x) 1 2)", AstPrinter.print("x!(1, 2)"));
        assertEquals("(send!! (var x))", AstPrinter.print("x!!()"));
        assertEquals("(send! (quote \"stdout\") \"hi\")", AstPrinter.print("@\"stdout\"!(\"hi\")"));
        assertEquals("(send! _ 1)", AstPrinter.print("_!(1)"));

        Proc.Send send = (Proc.Send)Parser.newFromSource("x!!(1)").parse();
        assertEquals(SendMode.MULTIPLE, send.mode);
        assertEquals(1, send.inputs.size());
    }

    @Test
    public void testSynchronousSend() {
        assertEquals("(send!? (var x) 1)", AstPrinter.print("x!?(1)."));
        assertEquals("(send!? (var x) 1 (cont (send! (var y) 2)))", AstPrinter.print("x!?(1); y!(2)"));
        assertEquals("(par (send!? (var x) 1 (cont (send! (var y) 2))) (var z))",
                AstPrinter.print("x!?(1); y!(2) | z"));

        Proc.SendSync sync = (Proc.SendSync)Parser.newFromSource("x!?(1).").parse();
        assertTrue(sync.cont.isEmpty());
        assertNull(sync.cont.proc);
    }

    @Test
    public void testNew() {
        assertEquals("(new [x y(`rho:io:stdout`)] (send! (var x) 1))",
                AstPrinter.print("new x, y(`rho:io:stdout`) in { x!(1) }"));
        assertEquals("(par (new [x] (send! (var x) 1)) (send! (var y) 2))",
                AstPrinter.print("new x in x!(1) | y!(2)"));
        assertEquals("(new [x] Nil)", AstPrinter.print("new x, in Nil"));
    }

    @Test
    public void testIfElse() {
        assertEquals("(if true 1 2)", AstPrinter.print("if (true) 1 else 2"));
        assertEquals("(if (var a) (if (var b) 1 2))", AstPrinter.print("if (a) if (b) 1 else 2"));
        assertEquals("(if (var a) (send! (var x) 1))", AstPrinter.print("if (a) { x!(1) }"));
    }

    @Test
    public void testLet() {
        assertEquals("(let (= [(var x)] 1) (= [(var y)] 2) (+ (var x) (var y)))",
                AstPrinter.print("let x = 1; y = 2 in x + y"));
        assertEquals("(let& (= [(var x)] 1) (= [(var y)] 2) Nil)",
                AstPrinter.print("let x = 1 & y = 2 in Nil"));
        assertEquals("(let (= [(var x) (var y)] 1 2) Nil)",
                AstPrinter.print("let x, y = 1, 2 in Nil"));
    }

    @Test
    public void testLetBodyIsAnyProcess() {
        assertEquals("(let (= [(var x)] 1) (new [y] Nil))", AstPrinter.print("let x = 1 in new y in Nil"));
        assertEquals("(let (= [(var x)] 1) (if (var x) Nil))", AstPrinter.print("let x = 1 in if (x) Nil"));
        assertEquals("(let (= [(var x)] 1) (send!? (var y) (var x)))", AstPrinter.print("let x = 1 in y!?(x)."));
        assertEquals("(par (let (= [(var x)] 1) (var a)) (var b))", AstPrinter.print("let x = 1 in a | b"));
    }

    @Test
    public void testBundles() {
        assertEquals("(bundle+ (var x))", AstPrinter.print("bundle+ { x }"));
        assertEquals("(bundle- (var x))", AstPrinter.print("bundle- {x}"));
        assertEquals("(bundle0 (var x))", AstPrinter.print("bundle0 {x}"));
        assertEquals("(bundle (var x))", AstPrinter.print("bundle {x}"));

        Proc.Bundle bundle = (Proc.Bundle)Parser.newFromSource("bundle+ { x }").parse();
        assertEquals(BundleKind.WRITE_ONLY, bundle.bundleKind);
    }

    @Test
    public void testMatch() {
        assertEquals("(match (var x) (case 1 (var a)) (case _ (var b)))",
                AstPrinter.print("match x { 1 => a  _ => b }"));
        assertEquals("(match (list 1 2) (case (list (var h) ...(var t)) (var h)))",
                AstPrinter.print("match [1, 2] { [h ...t] => h }"));
    }

    @Test
    public void testSelect() {
        assertEquals("(select (branch (<- [(var x)] (var a)) (<- [(var y)] (var b)) (var P)) " +
                    "(branch (<- [(var z)] (var c)) (var Q)))",
                AstPrinter.print("select { x <- a & y <- b => P  z <- c => Q }"));
    }

    @Test
    public void testContract() {
        assertEquals("(contract (quote \"add\") [(var a) (var b) (var ret)] (send! (var ret) (+ (var a) (var b))))",
                AstPrinter.print("contract @\"add\"(a, b, ret) = { ret!(a + b) }"));
        assertEquals("(contract (var foo) [] Nil)", AstPrinter.print("contract foo() = { Nil }"));
        assertEquals("(contract (var foo) [(var x) ...(var rest)] Nil)",
                AstPrinter.print("contract foo(x, ...@rest) = { Nil }"));
    }

    @Test
    public void testBindKinds() {
        assertEquals("(for (receipt (<- [(var x)] (var c))) Nil)", AstPrinter.print("for (x <- c) { Nil }"));
        assertEquals("(for (receipt (<= [(var x)] (var c))) Nil)", AstPrinter.print("for (x <= c) { Nil }"));
        assertEquals("(for (receipt (<<- [(var x)] (var c))) Nil)", AstPrinter.print("for (x <<- c) { Nil }"));
        assertEquals("(for (receipt (<- [] (var c))) Nil)", AstPrinter.print("for (<- c) { Nil }"));
    }

    @Test
    public void testReceiptsAndSources() {
        assertEquals("(for (receipt (<- [(var x)] (?! (var c)))) Nil)",
                AstPrinter.print("for (x <- c?!) { Nil }"));
        assertEquals("(for (receipt (<- [(var x)] (!? (var c) 1 2))) Nil)",
                AstPrinter.print("for (x <- c!?(1, 2)) { Nil }"));
        assertEquals("(for (receipt (<- [(var x)] (var a)) (<- [(var y)] (var b))) " +
                    "(receipt (<- [(var z)] (var c))) Nil)",
                AstPrinter.print("for (x <- a & y <- b; z <- c) { Nil }"));
        assertEquals("(for (receipt (<- [(quote (var x)) ...(var rest)] (var c))) Nil)",
                AstPrinter.print("for (@x, ...@rest <- c) { Nil }"));
    }

    @Test
    public void testCollections() {
        assertEquals("(list 1 2 ...(var rest))", AstPrinter.print("[1, 2, ...@rest]"));
        assertEquals("(list 1 2 ...(var rest))", AstPrinter.print("[1, 2 ...rest]"));
        assertEquals("(list)", AstPrinter.print("[]"));
        assertEquals("()", AstPrinter.print("()"));
        assertEquals("1", AstPrinter.print("(1)"));
        assertEquals("(tuple 1)", AstPrinter.print("(1,)"));
        assertEquals("(tuple 1 2)", AstPrinter.print("(1, 2)"));
        assertEquals("(set 1 2)", AstPrinter.print("Set(1, 2)"));
        assertEquals("(set)", AstPrinter.print("Set()"));
        assertEquals("(var Set)", AstPrinter.print("Set"));
        assertEquals("(map)", AstPrinter.print("{}"));
        assertEquals("(map (: \"a\" 1) (: \"b\" 2))", AstPrinter.print("{\"a\": 1, \"b\": 2}"));
        assertEquals("(map (: \"a\" 1) ...(var rest))", AstPrinter.print("{\"a\": 1 ...rest}"));
        assertEquals("(var x)", AstPrinter.print("{ x }"));

        Proc.ListLit list = (Proc.ListLit)Parser.newFromSource("[1, 2, ...@rest]").parse();
        assertEquals(2, list.elements.size());
        assertEquals("rest", ((Proc.Var)list.remainder).name);
    }

    @Test
    public void testGroundTerms() {
        assertEquals("Nil", AstPrinter.print("Nil"));
        assertEquals("true", AstPrinter.print("true"));
        assertEquals("Int", AstPrinter.print("Int"));
        assertEquals("ByteArray", AstPrinter.print("ByteArray"));
        assertEquals("`rho:x`", AstPrinter.print("`rho:x`"));
        assertEquals("-5", AstPrinter.print("-5"));
        assertEquals("(- 5)", AstPrinter.print("-(5)"));
        assertEquals("\"hi\"", AstPrinter.print("\"hi\""));
        assertEquals("_", AstPrinter.print("_"));
    }

    @Test
    public void testProgram() {
        assertEquals("Nil", AstPrinter.print(""));
        assertEquals("Nil", AstPrinter.print("// only a comment"));
        assertEquals("(par (var a) (var b))", AstPrinter.print("a b"));

        List<Proc> procs = Parser.newFromSource("a!(1) b!(2)").parseAll();
        assertEquals(2, procs.size());
        assertEquals(NodeKind.SEND, procs.get(1).kind());
    }

    @Test
    public void testSpans() {
        assertEquals(new SourceSpan(0, 0), Parser.newFromSource("").parse().span);
        assertEquals(new SourceSpan(0, 5), Parser.newFromSource("x!(1)").parse().span);
        assertEquals(new SourceSpan(0, 12), Parser.newFromSource("new x in Nil").parse().span);
        assertEquals(new SourceSpan(0, 20), Parser.newFromSource("for (x <- c) { Nil }").parse().span);
        String src = "a|1 + 2";
        Proc right = ((Proc.Par)Parser.newFromSource(src).parse()).right;
        assertEquals(new SourceSpan(2, 7), right.span);
        assertEquals("1 + 2", right.span.textOf(src));
    }

    @Test
    public void testBlockIsTransparent() {
        Proc proc = Parser.newFromSource("{ x }").parse();
        assertEquals(NodeKind.VAR, proc.kind());
        assertEquals(new SourceSpan(2, 3), proc.span);
        assertEquals("x", proc.span.textOf("{ x }"));
        assertEquals("a + b", Parser.newFromSource("(a + b)").parse().span.textOf("(a + b)"));
    }

    @Test
    public void testSyntaxErrorPosition() {
        SyntaxError error = syntaxError("for (msg <- channel {");
        assertEquals("')'", error.getExpected());
        assertEquals("'{'", error.getFound());
        assertEquals(1, error.getLine());
        assertEquals(21, error.getColumn());
        assertEquals(new SourceSpan(20, 21), error.getSpan());

        error = syntaxError("x |\n  )");
        assertEquals("process", error.getExpected());
        assertEquals(2, error.getLine());
        assertEquals(3, error.getColumn());
    }

    @Test
    public void testUnexpectedEnd() {
        assertEquals("end of input", syntaxError("new channel in { @\"stdout\"!(\"hi\")").getFound());
        assertEquals("process", syntaxError("x | ").getExpected());
        assertEquals("')'", syntaxError("(1, 2").getExpected());
        assertEquals("'.' or ';' after synchronous send", syntaxError("x!?(1)").getExpected());
    }

    @Test
    public void testErrorMessages() {
        SyntaxError error = syntaxError("[1 2]");
        assertEquals("expected ']' but found '2'", error.getMessage());

        error = syntaxError("=5");
        assertEquals("'5'", error.getFound());
    }

    @Test
    public void testChannelMustBeAName() {
        SyntaxError error = syntaxError("1!(2)");
        assertEquals("channel name", error.getExpected());
        assertEquals("long_literal", error.getFound());

        assertEquals("add", syntaxError("(a + b)!(2)").getFound());
    }

    @Test
    public void testNewNamesAreDistinct() {
        SyntaxError error = syntaxError("new x, y, x in Nil");
        assertEquals("distinct name in new declaration", error.getExpected());
        assertEquals("'x'", error.getFound());
    }

    @Test
    public void testLetSeparatorsCannotMix() {
        SyntaxError error = syntaxError("let x = 1; y = 2 & z = 3 in Nil");
        assertEquals("';' between let declarations", error.getExpected());
        assertEquals("'&'", error.getFound());
    }
}
