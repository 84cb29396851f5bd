package com.progrep.forms.declarator;

/**
 * Visitor over the proclamator forms.
 */
public interface ProclamatorVisitor {
    void visit(InitializedProclamator initialized);
    void visit(ConstrainedProclamator constrained);
}
