package org.rholang.parser;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Prints a tree back as Rholang source. The output parses to a tree with the
 * same shape: every nested process that is not a ground term or collection is
 * wrapped in braces, so precedence never has to be reconstructed.
 */
public class SourcePrinter implements Proc.Visitor<String>, Name.Visitor<String> {
    private static final Joiner COMMA = Joiner.on(", ");

    public static String print(Proc proc) {
        return proc.accept(new SourcePrinter());
    }

    @Override
    public String visitNilProc(Proc.Nil proc) {
        return "Nil";
    }

    @Override
    public String visitParProc(Proc.Par proc) {
        // left nesting is kept by leaving a left-hand par bare
        String left = proc.left instanceof Proc.Par ? proc.left.accept(this) : wrap(proc.left);
        return left + " | " + wrap(proc.right);
    }

    @Override
    public String visitSendProc(Proc.Send proc) {
        return proc.channel.accept(this) + proc.mode.symbol + "(" + procs(proc.inputs) + ")";
    }

    @Override
    public String visitSendSyncProc(Proc.SendSync proc) {
        String send = proc.channel.accept(this) + "!?(" + procs(proc.inputs) + ")";
        if (proc.cont.isEmpty()) {
            return send + ".";
        }
        return send + "; " + wrap(proc.cont.proc);
    }

    @Override
    public String visitNewProc(Proc.New proc) {
        List<String> decls = new ArrayList<>();
        for (NameDecl decl : proc.decls) {
            decls.add(decl.uri == null ? decl.var : decl.var + "(`" + decl.uri + "`)");
        }
        return "new " + COMMA.join(decls) + " in " + wrap(proc.body);
    }

    @Override
    public String visitIfElseProc(Proc.IfElse proc) {
        // a bare branch after ')' would read "-5" as a subtraction
        String result = "if (" + proc.condition.accept(this) + ") " + block(proc.ifBranch);
        if (proc.elseBranch != null) {
            result += " else " + block(proc.elseBranch);
        }
        return result;
    }

    @Override
    public String visitLetProc(Proc.Let proc) {
        List<String> decls = new ArrayList<>();
        for (LetDecls.Decl decl : proc.decls.decls) {
            decls.add(names(decl.names) + " = " + procs(decl.procs));
        }
        String separator = " " + proc.decls.mode.separator + " ";
        return "let " + Joiner.on(separator).join(decls) + " in " + wrap(proc.body);
    }

    @Override
    public String visitBundleProc(Proc.Bundle proc) {
        return proc.bundleKind.keyword + " " + block(proc.body);
    }

    @Override
    public String visitMatchProc(Proc.Match proc) {
        StringBuilder builder = new StringBuilder();
        builder.append("match ").append(wrap(proc.scrutinee)).append(" {");
        for (Case c : proc.cases) {
            builder.append(" ").append(block(c.pattern)).append(" => ").append(block(c.body));
        }
        builder.append(" }");
        return builder.toString();
    }

    @Override
    public String visitChoiceProc(Proc.Choice proc) {
        StringBuilder builder = new StringBuilder("select {");
        for (Branch branch : proc.branches) {
            List<String> binds = new ArrayList<>();
            for (Bind.Linear bind : branch.patterns) {
                binds.add(bind(bind));
            }
            builder.append(" ").append(Joiner.on(" & ").join(binds));
            builder.append(" => ").append(wrap(branch.body));
        }
        builder.append(" }");
        return builder.toString();
    }

    @Override
    public String visitContractProc(Proc.Contract proc) {
        String formals = proc.formals.isEmpty() ? "" : names(proc.formals);
        return "contract " + proc.name.accept(this) + "(" + formals + ") = " + block(proc.body);
    }

    @Override
    public String visitInputProc(Proc.Input proc) {
        List<String> receipts = new ArrayList<>();
        for (Receipt receipt : proc.receipts) {
            List<String> binds = new ArrayList<>();
            for (Bind bind : receipt.binds) {
                binds.add(bind(bind));
            }
            receipts.add(Joiner.on(" & ").join(binds));
        }
        return "for (" + Joiner.on("; ").join(receipts) + ") " + block(proc.body);
    }

    @Override
    public String visitBinaryProc(Proc.Binary proc) {
        return wrap(proc.left) + " " + proc.op.symbol + " " + wrap(proc.right);
    }

    @Override
    public String visitUnaryProc(Proc.Unary proc) {
        switch (proc.op) {
            case NOT:
                return "not " + wrap(proc.operand);
            case NEG:
                // braces keep "-5" from being read back as a literal
                return "-" + block(proc.operand);
            default:
                return "~" + wrap(proc.operand);
        }
    }

    @Override
    public String visitEvalProc(Proc.Eval proc) {
        return "*" + proc.name.accept(this);
    }

    @Override
    public String visitQuoteProc(Proc.Quote proc) {
        return "@" + wrap(proc.quotable);
    }

    @Override
    public String visitMethodProc(Proc.Method proc) {
        return wrap(proc.receiver) + "." + proc.name + "(" + procs(proc.args) + ")";
    }

    @Override
    public String visitVarRefProc(Proc.VarRef proc) {
        return proc.refKind.symbol + proc.var;
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
        return proc.name;
    }

    @Override
    public String visitWildcardProc(Proc.Wildcard proc) {
        return "_";
    }

    @Override
    public String visitListLitProc(Proc.ListLit proc) {
        return "[" + elements(proc.elements, proc.remainder) + "]";
    }

    @Override
    public String visitTupleLitProc(Proc.TupleLit proc) {
        String elements = procs(proc.elements);
        return "(" + elements + (proc.elements.size() == 1 ? ",)" : ")");
    }

    @Override
    public String visitSetLitProc(Proc.SetLit proc) {
        return "Set(" + elements(proc.elements, proc.remainder) + ")";
    }

    @Override
    public String visitMapLitProc(Proc.MapLit proc) {
        List<String> parts = new ArrayList<>();
        for (KeyValuePair pair : proc.pairs) {
            parts.add(wrap(pair.key) + ": " + wrap(pair.value));
        }
        if (proc.remainder != null) {
            parts.add("..." + proc.remainder.accept(this));
        }
        return "{" + COMMA.join(parts) + "}";
    }

    @Override
    public String visitProcVarName(Name.ProcVar name) {
        return name.var.accept(this);
    }

    @Override
    public String visitQuoteName(Name.Quote name) {
        return "@" + wrap(name.quotable);
    }

    private String bind(Bind bind) {
        String names = bind.names == null ? "" : names(bind.names) + " ";
        String source;
        if (bind instanceof Bind.Linear) {
            source = source(((Bind.Linear)bind).source);
        } else if (bind instanceof Bind.Repeated) {
            source = ((Bind.Repeated)bind).source.accept(this);
        } else {
            source = ((Bind.Peek)bind).source.accept(this);
        }
        return names + bind.binder() + " " + source;
    }

    private String source(Source source) {
        String name = source.name.accept(this);
        if (source instanceof Source.ReceiveSend) {
            return name + "?!";
        }
        if (source instanceof Source.SendReceive) {
            return name + "!?(" + procs(((Source.SendReceive)source).inputs) + ")";
        }
        return name;
    }

    private String names(Names names) {
        List<String> parts = new ArrayList<>();
        for (Name name : names.names) {
            parts.add(name.accept(this));
        }
        if (names.remainder != null) {
            parts.add("...@" + names.remainder.accept(this));
        }
        return COMMA.join(parts);
    }

    private String elements(List<Proc> elements, Proc.ProcVar remainder) {
        List<String> parts = new ArrayList<>();
        for (Proc element : elements) {
            parts.add(wrap(element));
        }
        if (remainder != null) {
            parts.add("..." + remainder.accept(this));
        }
        return COMMA.join(parts);
    }

    private String procs(List<Proc> procs) {
        List<String> parts = new ArrayList<>();
        for (Proc proc : procs) {
            parts.add(wrap(proc));
        }
        return COMMA.join(parts);
    }

    private String wrap(Proc proc) {
        String text = proc.accept(this);
        return proc.kind().isAtomic() ? text : "{" + text + "}";
    }

    private String block(Proc proc) {
        return "{ " + proc.accept(this) + " }";
    }
}
