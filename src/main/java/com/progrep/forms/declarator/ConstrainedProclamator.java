package com.progrep.forms.declarator;

import com.progrep.forms.semantic.Decl;
import com.progrep.forms.semantic.Expr;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A proclamator with a trailing requires-clause: {@code f(T) requires C<T>}.
 */
@Getter
@ToString(callSuper = true)
public final class ConstrainedProclamator extends Proclamator {
    private final Expr constraint;

    public ConstrainedProclamator(@NonNull Declarator declarator, @NonNull Decl result,
                                  @NonNull Expr constraint) {
        super(declarator, result);
        this.constraint = constraint;
    }

    @Override
    public void accept(ProclamatorVisitor visitor) {
        visitor.visit(this);
    }
}
