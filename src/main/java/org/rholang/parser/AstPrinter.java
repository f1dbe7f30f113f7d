package org.rholang.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints a tree as an s-expression, e.g. {@code (+ 1 (* 2 3))} for
 * {@code 1 + 2 * 3}. In pretty mode a node whose children are not all flat
 * puts each child on its own line, indented two spaces per level.
 */
public class AstPrinter implements Proc.Visitor<String>, Name.Visitor<String> {
    private final boolean pretty;
    private int indent = 0;

    public static final String PARSE_ERROR = "!error!";

    public AstPrinter(boolean pretty) {
        this.pretty = pretty;
    }

    public static String print(String src) {
        return print(src, false);
    }

    public static String print(String src, boolean pretty) {
        Proc proc;
        try {
            proc = Parser.newFromSource(src).parse();
        } catch (ParserError e) {
            return PARSE_ERROR;
        }
        return new AstPrinter(pretty).procToString(proc);
    }

    public String procToString(Proc proc) {
        return proc.accept(this);
    }

    @Override
    public String visitNilProc(Proc.Nil proc) {
        return "Nil";
    }

    @Override
    public String visitParProc(Proc.Par proc) {
        return parenthesize("par", parts(sub(proc.left), sub(proc.right)));
    }

    @Override
    public String visitSendProc(Proc.Send proc) {
        List<String> parts = parts(sub(proc.channel));
        for (Proc input : proc.inputs) {
            parts.add(sub(input));
        }
        return parenthesize("send" + proc.mode.symbol, parts);
    }

    @Override
    public String visitSendSyncProc(Proc.SendSync proc) {
        List<String> parts = parts(sub(proc.channel));
        for (Proc input : proc.inputs) {
            parts.add(sub(input));
        }
        if (!proc.cont.isEmpty()) {
            indent++;
            parts.add(parenthesize("cont", parts(sub(proc.cont.proc))));
            indent--;
        }
        return parenthesize("send!?", parts);
    }

    @Override
    public String visitNewProc(Proc.New proc) {
        StringBuilder decls = new StringBuilder("[");
        for (NameDecl decl : proc.decls) {
            if (decls.length() > 1) decls.append(" ");
            decls.append(decl.var);
            if (decl.uri != null) {
                decls.append("(`").append(decl.uri).append("`)");
            }
        }
        decls.append("]");
        return parenthesize("new", parts(decls.toString(), sub(proc.body)));
    }

    @Override
    public String visitIfElseProc(Proc.IfElse proc) {
        List<String> parts = parts(sub(proc.condition), sub(proc.ifBranch));
        if (proc.elseBranch != null) {
            parts.add(sub(proc.elseBranch));
        }
        return parenthesize("if", parts);
    }

    @Override
    public String visitLetProc(Proc.Let proc) {
        List<String> parts = new ArrayList<>();
        indent++;
        for (LetDecls.Decl decl : proc.decls.decls) {
            List<String> declParts = parts(names(decl.names));
            for (Proc value : decl.procs) {
                declParts.add(sub(value));
            }
            parts.add(parenthesize("=", declParts));
        }
        indent--;
        parts.add(sub(proc.body));
        String name = proc.decls.mode == LetDecls.Mode.CONCURRENT ? "let&" : "let";
        return parenthesize(name, parts);
    }

    @Override
    public String visitBundleProc(Proc.Bundle proc) {
        return parenthesize(proc.bundleKind.keyword, parts(sub(proc.body)));
    }

    @Override
    public String visitMatchProc(Proc.Match proc) {
        List<String> parts = parts(sub(proc.scrutinee));
        indent++;
        for (Case c : proc.cases) {
            parts.add(parenthesize("case", parts(sub(c.pattern), sub(c.body))));
        }
        indent--;
        return parenthesize("match", parts);
    }

    @Override
    public String visitChoiceProc(Proc.Choice proc) {
        List<String> parts = new ArrayList<>();
        indent++;
        for (Branch branch : proc.branches) {
            List<String> branchParts = new ArrayList<>();
            for (Bind.Linear bind : branch.patterns) {
                branchParts.add(bind(bind));
            }
            branchParts.add(sub(branch.body));
            parts.add(parenthesize("branch", branchParts));
        }
        indent--;
        return parenthesize("select", parts);
    }

    @Override
    public String visitContractProc(Proc.Contract proc) {
        return parenthesize("contract", parts(sub(proc.name), names(proc.formals), sub(proc.body)));
    }

    @Override
    public String visitInputProc(Proc.Input proc) {
        List<String> parts = new ArrayList<>();
        indent++;
        for (Receipt receipt : proc.receipts) {
            List<String> binds = new ArrayList<>();
            for (Bind bind : receipt.binds) {
                binds.add(bind(bind));
            }
            parts.add(parenthesize("receipt", binds));
        }
        indent--;
        parts.add(sub(proc.body));
        return parenthesize("for", parts);
    }

    @Override
    public String visitBinaryProc(Proc.Binary proc) {
        return parenthesize(proc.op.symbol, parts(sub(proc.left), sub(proc.right)));
    }

    @Override
    public String visitUnaryProc(Proc.Unary proc) {
        return parenthesize(proc.op.symbol, parts(sub(proc.operand)));
    }

    @Override
    public String visitEvalProc(Proc.Eval proc) {
        return parenthesize("eval", parts(sub(proc.name)));
    }

    @Override
    public String visitQuoteProc(Proc.Quote proc) {
        return parenthesize("quote", parts(sub(proc.quotable)));
    }

    @Override
    public String visitMethodProc(Proc.Method proc) {
        List<String> parts = parts(proc.name, sub(proc.receiver));
        for (Proc arg : proc.args) {
            parts.add(sub(arg));
        }
        return parenthesize("method", parts);
    }

    @Override
    public String visitVarRefProc(Proc.VarRef proc) {
        return "(" + proc.refKind.symbol + " " + proc.var + ")";
    }

    @Override
    public String visitBoolLitProc(Proc.BoolLit proc) {
        return String.valueOf(proc.value);
    }

    @Override
    public String visitLongLitProc(Proc.LongLit proc) {
        return String.valueOf(proc.value);
    }

    @Override
    public String visitStringLitProc(Proc.StringLit proc) {
        return "\"" + proc.value + "\"";
    }

    @Override
    public String visitUriLitProc(Proc.UriLit proc) {
        return "`" + proc.value + "`";
    }

    @Override
    public String visitSimpleTypeProc(Proc.SimpleType proc) {
        return proc.type.keyword;
    }

    @Override
    public String visitUnitProc(Proc.Unit proc) {
        return "()";
    }

    @Override
    public String visitVarProc(Proc.Var proc) {
        return "(var " + proc.name + ")";
    }

    @Override
    public String visitWildcardProc(Proc.Wildcard proc) {
        return "_";
    }

    @Override
    public String visitListLitProc(Proc.ListLit proc) {
        return parenthesize("list", elements(proc.elements, proc.remainder));
    }

    @Override
    public String visitTupleLitProc(Proc.TupleLit proc) {
        return parenthesize("tuple", elements(proc.elements, null));
    }

    @Override
    public String visitSetLitProc(Proc.SetLit proc) {
        return parenthesize("set", elements(proc.elements, proc.remainder));
    }

    @Override
    public String visitMapLitProc(Proc.MapLit proc) {
        List<String> parts = new ArrayList<>();
        indent++;
        for (KeyValuePair pair : proc.pairs) {
            parts.add(parenthesize(":", parts(sub(pair.key), sub(pair.value))));
        }
        indent--;
        if (proc.remainder != null) {
            parts.add("..." + sub(proc.remainder));
        }
        return parenthesize("map", parts);
    }

    @Override
    public String visitProcVarName(Name.ProcVar name) {
        return name.var.accept(this);
    }

    @Override
    public String visitQuoteName(Name.Quote name) {
        return parenthesize("quote", parts(sub(name.quotable)));
    }

    // Renders a bind one level below the current node.
    private String bind(Bind bind) {
        indent++;
        List<String> parts = parts(bind.names == null ? "[]" : names(bind.names));
        if (bind instanceof Bind.Linear) {
            parts.add(source(((Bind.Linear)bind).source));
        } else if (bind instanceof Bind.Repeated) {
            parts.add(sub(((Bind.Repeated)bind).source));
        } else {
            parts.add(sub(((Bind.Peek)bind).source));
        }
        String result = parenthesize(bind.binder(), parts);
        indent--;
        return result;
    }

    private String source(Source source) {
        if (source instanceof Source.ReceiveSend) {
            indent++;
            String result = parenthesize("?!", parts(sub(source.name)));
            indent--;
            return result;
        }
        if (source instanceof Source.SendReceive) {
            indent++;
            List<String> parts = parts(sub(source.name));
            for (Proc input : ((Source.SendReceive)source).inputs) {
                parts.add(sub(input));
            }
            String result = parenthesize("!?", parts);
            indent--;
            return result;
        }
        return sub(source.name);
    }

    private String names(Names names) {
        StringBuilder builder = new StringBuilder("[");
        for (Name name : names.names) {
            if (builder.length() > 1) builder.append(" ");
            builder.append(name.accept(this));
        }
        if (names.remainder != null) {
            if (builder.length() > 1) builder.append(" ");
            builder.append("...").append(names.remainder.accept(this));
        }
        builder.append("]");
        return builder.toString();
    }

    private List<String> elements(List<Proc> elements, Proc.ProcVar remainder) {
        List<String> parts = new ArrayList<>();
        for (Proc element : elements) {
            parts.add(sub(element));
        }
        if (remainder != null) {
            parts.add("..." + sub(remainder));
        }
        return parts;
    }

    private String sub(Proc proc) {
        indent++;
        String result = proc.accept(this);
        indent--;
        return result;
    }

    private String sub(Name name) {
        indent++;
        String result = name.accept(this);
        indent--;
        return result;
    }

    private static List<String> parts(String... parts) {
        List<String> list = new ArrayList<>();
        for (String part : parts) {
            list.add(part);
        }
        return list;
    }

    private String parenthesize(String name, List<String> parts) {
        boolean multiline = pretty && !allFlat(parts);
        StringBuilder builder = new StringBuilder();
        builder.append("(").append(name);
        for (String part : parts) {
            if (multiline) {
                builder.append("\n").append(indent(indent + 1));
            } else {
                builder.append(" ");
            }
            builder.append(part);
        }
        if (multiline) {
            builder.append("\n").append(indent(indent));
        }
        builder.append(")");
        return builder.toString();
    }

    // flat: one line and at most one level of parentheses
    private static boolean allFlat(List<String> parts) {
        for (String part : parts) {
            if (part.indexOf('\n') >= 0) return false;
            if (part.indexOf('(') != part.lastIndexOf('(')) return false;
        }
        return true;
    }

    private static String indent(int level) {
        StringBuilder builder = new StringBuilder();
        int i = level;
        while (i > 0) {
            builder.append("  ");
            i--;
        }
        return builder.toString();
    }
}
