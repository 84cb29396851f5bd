package com.progrep.forms.attribute;

/**
 * Visitor over the attribute forms, one overload per form.
 */
public interface AttributeVisitor {
    void visit(BasicAttribute basic);
    void visit(ScopedAttribute scoped);
    void visit(LabeledAttribute labeled);
    void visit(CalledAttribute called);
    void visit(ExpandedAttribute expanded);
    void visit(FactoredAttribute factored);
    void visit(ElaboratedAttribute elaborated);
}
