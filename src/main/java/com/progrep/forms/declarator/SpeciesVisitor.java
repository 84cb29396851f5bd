package com.progrep.forms.declarator;

/**
 * Visitor over the species declarator forms.
 */
public interface SpeciesVisitor {
    void visit(IdSpecies id);
    void visit(CallableSpecies callable);
    void visit(ArraySpecies array);
    void visit(ParenthesizedSpecies parenthesized);
}
