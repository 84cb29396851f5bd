package com.progrep.forms.declarator;

import com.progrep.forms.ref.OptionalRef;
import com.progrep.forms.semantic.Decl;
import com.progrep.forms.semantic.Expr;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A proclamator with an optional initializer: {@code x = 42}, or just {@code x}.
 */
@Getter
@ToString(callSuper = true)
public final class InitializedProclamator extends Proclamator {
    private final OptionalRef<Expr> initializer;

    public InitializedProclamator(@NonNull Declarator declarator, @NonNull Decl result,
                                  @NonNull OptionalRef<Expr> initializer) {
        super(declarator, result);
        this.initializer = initializer;
    }

    @Override
    public void accept(ProclamatorVisitor visitor) {
        visitor.visit(this);
    }
}
