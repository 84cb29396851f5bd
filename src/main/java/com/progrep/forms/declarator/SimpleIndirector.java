package com.progrep.forms.declarator;

import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.flags.TypeQualifiers;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A pointer or reference ptr-operator: {@code *}, {@code &} or {@code &&},
 * optionally followed by cv-qualifiers ({@code * const}).
 */
@Getter
@ToString(callSuper = true)
public final class SimpleIndirector extends Indirector {
    private final Mode mode;
    private final TypeQualifiers qualifiers;

    public SimpleIndirector(@NonNull IndexedView<Attribute> attributes, @NonNull Mode mode,
                            @NonNull TypeQualifiers qualifiers) {
        super(attributes);
        this.mode = mode;
        this.qualifiers = qualifiers;
    }

    @Override
    public void accept(IndirectorVisitor visitor) {
        visitor.visit(this);
    }

    public enum Mode {
        /**
         * Pointer, {@code *}.
         */
        DEREF("*"),

        /**
         * Lvalue reference, {@code &}.
         */
        BIND("&"),

        /**
         * Rvalue reference, {@code &&}.
         */
        MOVE("&&");

        private final String spelling;

        Mode(String spelling) {
            this.spelling = spelling;
        }

        public String getSpelling() {
            return spelling;
        }
    }
}
