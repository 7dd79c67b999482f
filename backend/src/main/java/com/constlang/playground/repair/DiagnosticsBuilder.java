package com.constlang.playground.repair;

import com.constlang.playground.lexer.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Describes repair edits to the user, one diagnostic per edit, in the order they were applied.
 */
public class DiagnosticsBuilder {

    public List<Diagnostic> build(List<EditOp> edits) {
        List<Diagnostic> diagnostics = new ArrayList<>(edits.size());
        for (EditOp edit : edits) {
            diagnostics.add(describe(edit));
        }
        return diagnostics;
    }

    Diagnostic describe(EditOp edit) {
        if (edit instanceof EditOp.Delete delete) {
            return Diagnostic.repair(delete.token(),
                    "removed unexpected token '" + delete.token().text() + "'");
        }
        if (edit instanceof EditOp.Replace replace) {
            return Diagnostic.repair(replace.oldToken(),
                    "replaced '" + replace.oldToken().text() + "' with '" + replace.newToken().text() + "'");
        }
        if (edit instanceof EditOp.Insert insert) {
            return Diagnostic.repair(insert.token(),
                    "inserted missing token '" + insert.token().text() + "'");
        }
        throw new IllegalStateException("Unknown edit type: " + edit.getClass().getName());
    }
}
