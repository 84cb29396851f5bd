package com.progrep.forms.declarator;

import com.progrep.forms.flags.BindingMode;
import com.progrep.forms.flags.TypeQualifiers;
import com.progrep.forms.ref.OptionalRef;
import com.progrep.forms.semantic.Expr;
import com.progrep.forms.semantic.ParameterList;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A function declarator suffix:
 * {@code prefix ( parameters ) qualifiers binding-mode throws-expression}.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class CallableSpecies extends SpeciesDeclarator {
    @NonNull
    private final IndexedView<SpeciesDeclarator> prefix;
    @NonNull
    private final ParameterList parameters;
    @NonNull
    private final TypeQualifiers qualifiers;
    @NonNull
    private final BindingMode bindingMode;
    /**
     * The {@code noexcept} or dynamic exception specification, when written.
     */
    @NonNull
    private final OptionalRef<Expr> throwsExpression;

    @Override
    public void accept(SpeciesVisitor visitor) {
        visitor.visit(this);
    }
}
