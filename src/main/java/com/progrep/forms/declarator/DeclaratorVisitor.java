package com.progrep.forms.declarator;

/**
 * Visitor over the declarator forms.
 */
public interface DeclaratorVisitor {
    void visit(TermDeclarator term);
    void visit(TargetedDeclarator targeted);
}
