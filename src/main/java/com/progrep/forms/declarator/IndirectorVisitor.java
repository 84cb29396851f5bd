package com.progrep.forms.declarator;

/**
 * Visitor over the indirector forms.
 */
public interface IndirectorVisitor {
    void visit(SimpleIndirector simple);
    void visit(MemberIndirector member);
}
