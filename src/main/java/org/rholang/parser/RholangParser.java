package org.rholang.parser;

/**
 * Entry points for tools that only need to check, parse or print Rholang
 * source. Every call works on its own lexer and tree, so calls may run
 * concurrently.
 */
public final class RholangParser {
    private RholangParser() {}

    /**
     * True iff the source lexes and parses. Never throws.
     */
    public static boolean isValid(String source) {
        try {
            parse(source);
            return true;
        } catch (ParserError e) {
            return false;
        }
    }

    public static Proc parse(String source) {
        return Parser.newFromSource(source).parse();
    }

    public static String toTreeString(String source) {
        return new AstPrinter(false).procToString(parse(source));
    }

    public static String toPrettyTree(String source) {
        return toPrettyString(parse(source));
    }

    /**
     * Source text that parses back to a tree of the same shape.
     */
    public static String toCanonicalString(Proc proc) {
        return SourcePrinter.print(proc);
    }

    public static String toPrettyString(Proc proc) {
        return new AstPrinter(true).procToString(proc);
    }
}
