package com.progrep.forms.declarator;

import com.progrep.forms.semantic.Decl;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A declarator together with the declaration it introduces.
 */
@Getter
@ToString
public abstract sealed class Proclamator permits InitializedProclamator, ConstrainedProclamator {
    private final Declarator declarator;
    private final Decl result;

    protected Proclamator(@NonNull Declarator declarator, @NonNull Decl result) {
        this.declarator = declarator;
        this.result = result;
    }

    public abstract void accept(ProclamatorVisitor visitor);
}
