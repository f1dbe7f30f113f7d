package org.rholang.parser;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The JSON document written by the command line tool.
 */
@JsonPropertyOrder({"valid", "tree", "error"})
public class ParseReport {
    private final boolean valid;
    private final String tree;
    private final String error;

    ParseReport(boolean valid, String tree, String error) {
        this.valid = valid;
        this.tree = tree;
        this.error = error;
    }

    static ParseReport success(String tree) {
        return new ParseReport(true, tree, null);
    }

    static ParseReport failure(ParserError error) {
        return new ParseReport(false, null, error.display());
    }

    public boolean isValid() {
        return valid;
    }

    public String getTree() {
        return tree;
    }

    public String getError() {
        return error;
    }
}
