package org.rholang.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;
import org.rholang.parser.LexError;
import org.rholang.parser.NodeKind;
import org.rholang.parser.ParserError;
import org.rholang.parser.RholangParser;
import org.rholang.parser.SyntaxError;

import com.google.common.base.Strings;

public class RholangParserTest {
    @Test
    public void testValidPrograms() {
        assertTrue(RholangParser.isValid("new channel in { @\"stdout\"!(\"Hello, world!\") }"));
        assertTrue(RholangParser.isValid("for (msg <- channel) { @\"stdout\"!(msg) }"));
        assertTrue(RholangParser.isValid("1 + 2 * 3"));
        assertTrue(RholangParser.isValid("contract @\"add\"(a, b, return) = { return!(a + b) }"));
        assertTrue(RholangParser.isValid(""));
        assertTrue(RholangParser.isValid("// just a comment"));
        assertTrue(RholangParser.isValid("\"\""));
        assertTrue(RholangParser.isValid("\"\\\"\""));
    }

    @Test
    public void testInvalidPrograms() {
        assertFalse(RholangParser.isValid("new channel in { @\"stdout\"!(\"Hello, world!\") "));
        assertFalse(RholangParser.isValid("for (msg <- channel {"));
        assertFalse(RholangParser.isValid("\"unterminated"));
        assertFalse(RholangParser.isValid("1!(2)"));
    }

    @Test
    public void testTreeString() {
        assertEquals("(+ 1 (* 2 3))", RholangParser.toTreeString("1 + 2 * 3"));
        assertEquals("(par (par (var a) (var b)) (var c))", RholangParser.toTreeString("a | b | c"));
    }

    @Test
    public void testPrettyTree() {
        assertEquals("(bundle0\n  (send! (var x) 1)\n)", RholangParser.toPrettyTree("bundle0 { x!(1) }"));
        assertEquals(RholangParser.toPrettyTree("x | y"),
                RholangParser.toPrettyString(RholangParser.parse("x | y")));
    }

    @Test(expected = SyntaxError.class)
    public void testTreeStringOfInvalidSource() {
        RholangParser.toTreeString("for (msg <- channel {");
    }

    @Test
    public void testLexErrorSurfaces() {
        try {
            RholangParser.parse("x!(\"oops)");
        } catch (LexError e) {
            assertEquals(3, e.getOffset());
            assertEquals("Parsing error: unterminated string literal at line 1, column 4", e.display());
            return;
        }
        throw new AssertionError("expected a lex error");
    }

    @Test
    public void testNodeKinds() {
        assertEquals(NodeKind.INPUT, RholangParser.parse("for (x <- c) { Nil }").kind());
        assertEquals(NodeKind.CHOICE, RholangParser.parse("select { x <- c => Nil }").kind());
        assertEquals(NodeKind.IF_ELSE, RholangParser.parse("if (true) Nil").kind());
        for (NodeKind kind : NodeKind.values()) {
            assertEquals(kind, NodeKind.resolve(kind.grammarName()));
            assertEquals(kind, NodeKind.fromId(kind.id()));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeKind() {
        NodeKind.resolve("source_file");
    }

    @Test
    public void testValidityAgreesWithParse() throws IOException {
        for (String name : SourcePrinterTest.CORPUS) {
            for (String src : mutations(SourcePrinterTest.corpus(name))) {
                boolean parsed;
                try {
                    RholangParser.parse(src);
                    parsed = true;
                } catch (ParserError e) {
                    parsed = false;
                }
                assertEquals(src, parsed, RholangParser.isValid(src));
            }
        }
    }

    @Test
    public void testDeepNestingIsInvalid() {
        assertFalse(RholangParser.isValid(Strings.repeat("(", 20000) + "1" + Strings.repeat(")", 20000)));
        assertFalse(RholangParser.isValid(Strings.repeat("[", 20000)));
        assertFalse(RholangParser.isValid(Strings.repeat("{", 20000) + "x"));
        assertFalse(RholangParser.isValid(Strings.repeat("@", 20000) + "x"));
        assertFalse(RholangParser.isValid(Strings.repeat("*@", 20000) + "x"));
        assertFalse(RholangParser.isValid(Strings.repeat("~", 20000) + "x"));
        assertFalse(RholangParser.isValid(Strings.repeat("not ", 20000) + "x"));
        assertFalse(RholangParser.isValid(Strings.repeat("x matches ", 20000) + "x"));
        assertFalse(RholangParser.isValid(Strings.repeat("new x in ", 20000) + "Nil"));
        assertFalse(RholangParser.isValid(Strings.repeat("let x = 1 in ", 20000) + "Nil"));
    }

    @Test
    public void testNestingLimit() {
        String ok = Strings.repeat("(", 127) + "1" + Strings.repeat(")", 127);
        assertEquals("1", RholangParser.toTreeString(ok));

        try {
            RholangParser.parse(Strings.repeat("(", 128) + "1" + Strings.repeat(")", 128));
        } catch (SyntaxError e) {
            assertEquals("at most 128 levels of nesting", e.getExpected());
            assertEquals("'1'", e.getFound());
            return;
        }
        throw new AssertionError("expected a syntax error");
    }

    @Test
    public void testConcurrentParses() throws Exception {
        final String[] programs = {
            "1 + 2 * 3",
            "new x in { x!(1) | for (y <- x) { Nil } }",
            "match [1, 2] { [h ...t] => h }",
            "contract foo(a) = { a!(a) }",
        };
        List<String> expected = new ArrayList<>();
        for (String src : programs) {
            expected.add(RholangParser.toTreeString(src));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                final String src = programs[i % programs.length];
                results.add(pool.submit(new Callable<String>() {
                    @Override
                    public String call() {
                        return RholangParser.toTreeString(src);
                    }
                }));
            }
            for (int i = 0; i < results.size(); i++) {
                assertEquals(expected.get(i % programs.length), results.get(i).get());
            }
        } finally {
            pool.shutdown();
        }
    }

    // Broken variants of a program: each bracket dropped in turn, then truncations.
    private static List<String> mutations(String src) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < src.length(); i++) {
            if ("(){}[]\"`".indexOf(src.charAt(i)) >= 0) {
                result.add(src.substring(0, i) + src.substring(i + 1));
            }
        }
        for (int end = 0; end < src.length(); end += 7) {
            result.add(src.substring(0, end));
        }
        return result;
    }
}
