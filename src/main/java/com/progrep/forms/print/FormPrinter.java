package com.progrep.forms.print;

import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.attribute.AttributeVisitor;
import com.progrep.forms.attribute.BasicAttribute;
import com.progrep.forms.attribute.CalledAttribute;
import com.progrep.forms.attribute.ElaboratedAttribute;
import com.progrep.forms.attribute.ExpandedAttribute;
import com.progrep.forms.attribute.FactoredAttribute;
import com.progrep.forms.attribute.LabeledAttribute;
import com.progrep.forms.attribute.ScopedAttribute;
import com.progrep.forms.declarator.ArraySpecies;
import com.progrep.forms.declarator.CallableSpecies;
import com.progrep.forms.declarator.ConstrainedProclamator;
import com.progrep.forms.declarator.Declarator;
import com.progrep.forms.declarator.DeclaratorVisitor;
import com.progrep.forms.declarator.IdSpecies;
import com.progrep.forms.declarator.Indirector;
import com.progrep.forms.declarator.IndirectorVisitor;
import com.progrep.forms.declarator.InitializedProclamator;
import com.progrep.forms.declarator.MemberIndirector;
import com.progrep.forms.declarator.ParenthesizedSpecies;
import com.progrep.forms.declarator.Proclamator;
import com.progrep.forms.declarator.ProclamatorVisitor;
import com.progrep.forms.declarator.SimpleIndirector;
import com.progrep.forms.declarator.SpeciesDeclarator;
import com.progrep.forms.declarator.SpeciesVisitor;
import com.progrep.forms.declarator.TargetedDeclarator;
import com.progrep.forms.declarator.TermDeclarator;
import com.progrep.forms.flags.BindingMode;
import com.progrep.forms.flags.TypeQualifiers;
import com.progrep.forms.semantic.Decl;
import com.progrep.forms.view.IndexedView;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns attribute and declarator forms back into C++ source text.
 *
 * Every form is reached through its visitor; the printer never inspects the
 * runtime class of a node. Semantic entities (names, types, expressions) are
 * spelled by the {@link SemanticRenderer} given at construction.
 */
public class FormPrinter {
    private static final Logger log = LoggerFactory.getLogger(FormPrinter.class);

    private final SemanticRenderer renderer;
    private final PrinterConfig config;

    public FormPrinter(@NonNull SemanticRenderer renderer) {
        this(renderer, PrinterConfig.defaults());
    }

    public FormPrinter(@NonNull SemanticRenderer renderer, @NonNull PrinterConfig config) {
        this.renderer = renderer;
        this.config = config;
    }

    public String print(Attribute attribute) {
        Writer writer = new Writer();
        attribute.accept(writer);
        return finish("attribute", writer);
    }

    /**
     * An attribute specifier for the whole sequence, e.g. {@code [[a, b]]}, or
     * the bare list when {@link PrinterConfig#isBracketAttributes()} is off.
     * Empty for an empty sequence.
     */
    public String printAttributes(IndexedView<Attribute> attributes) {
        Writer writer = new Writer();
        writer.attributes(attributes, config.isBracketAttributes());
        return finish("attribute sequence", writer);
    }

    public String print(Indirector indirector) {
        Writer writer = new Writer();
        indirector.accept(writer);
        return finish("indirector", writer);
    }

    public String print(SpeciesDeclarator species) {
        Writer writer = new Writer();
        species.accept(writer);
        return finish("species", writer);
    }

    /**
     * Indirectors are printed before the species exactly as held, so a term
     * reads the way C++ parses it: {@code *(int)} is a function returning a
     * pointer. A pointer to function is held with a parenthesized species in
     * the callable's prefix and prints as {@code (*fp)(int)}.
     */
    public String print(Declarator declarator) {
        Writer writer = new Writer();
        declarator.accept(writer);
        return finish("declarator", writer);
    }

    public String print(Proclamator proclamator) {
        Writer writer = new Writer();
        proclamator.accept(writer);
        return finish("proclamator", writer);
    }

    private String finish(String kind, Writer writer) {
        String text = writer.result();
        log.trace("Printed {}: {}", kind, text);
        return text;
    }

    /**
     * One rendering pass. Not shared between calls.
     */
    private final class Writer implements AttributeVisitor, IndirectorVisitor, SpeciesVisitor,
            DeclaratorVisitor, ProclamatorVisitor {

        private final StringBuilder out = new StringBuilder();

        String result() {
            return out.toString();
        }

        void attributes(IndexedView<Attribute> attributes, boolean bracketed) {
            if (attributes.isEmpty()) {
                return;
            }
            if (bracketed) {
                out.append("[[");
            }
            attributeList(attributes);
            if (bracketed) {
                out.append("]]");
            }
        }

        private void attributeList(IndexedView<Attribute> attributes) {
            boolean first = true;
            for (Attribute attribute : attributes) {
                if (!first) {
                    out.append(config.getListSeparator());
                }
                attribute.accept(this);
                first = false;
            }
        }

        // Attributes

        @Override
        public void visit(BasicAttribute basic) {
            out.append(basic.getToken().getSpelling());
        }

        @Override
        public void visit(ScopedAttribute scoped) {
            out.append(scoped.getScope().getSpelling())
               .append("::")
               .append(scoped.getMember().getSpelling());
        }

        @Override
        public void visit(LabeledAttribute labeled) {
            out.append(labeled.getLabel().getSpelling()).append(": ");
            labeled.getAttribute().accept(this);
        }

        @Override
        public void visit(CalledAttribute called) {
            called.getFunction().accept(this);
            out.append('(');
            attributeList(called.getArguments());
            out.append(')');
        }

        @Override
        public void visit(ExpandedAttribute expanded) {
            expanded.getOperand().accept(this);
            out.append(expanded.getExpander().getSpelling());
        }

        @Override
        public void visit(FactoredAttribute factored) {
            out.append("using ").append(factored.getFactor().getSpelling()).append(": ");
            attributeList(factored.getTerms());
        }

        @Override
        public void visit(ElaboratedAttribute elaborated) {
            out.append(renderer.render(elaborated.getExpression()));
        }

        // Indirectors

        @Override
        public void visit(SimpleIndirector simple) {
            out.append(simple.getMode().getSpelling());
            indirectorTail(simple.getAttributes(), simple.getQualifiers());
        }

        @Override
        public void visit(MemberIndirector member) {
            out.append(renderer.render(member.getScope())).append("::*");
            indirectorTail(member.getAttributes(), member.getQualifiers());
        }

        // ptr-operator attribute-specifier-seq cv-qualifier-seq, then a space before what follows
        private void indirectorTail(IndexedView<Attribute> attributes, TypeQualifiers qualifiers) {
            if (attributes.isEmpty() && qualifiers.isEmpty()) {
                return;
            }
            if (!attributes.isEmpty()) {
                out.append(' ');
                attributes(attributes, true);
            }
            if (!qualifiers.isEmpty()) {
                out.append(' ').append(qualifiers.spelling());
            }
            out.append(' ');
        }

        // Species

        @Override
        public void visit(IdSpecies id) {
            out.append(renderer.render(id.getName()));
        }

        @Override
        public void visit(CallableSpecies callable) {
            species(callable.getPrefix());
            out.append('(');
            boolean first = true;
            for (Decl parameter : callable.getParameters().getElements()) {
                if (!first) {
                    out.append(config.getListSeparator());
                }
                out.append(renderer.render(parameter));
                first = false;
            }
            out.append(')');
            if (!callable.getQualifiers().isEmpty()) {
                out.append(' ').append(callable.getQualifiers().spelling());
            }
            if (callable.getBindingMode() != BindingMode.COPY) {
                out.append(' ').append(callable.getBindingMode().getSpelling());
            }
            callable.getThrowsExpression().ifValid(eh -> out.append(' ').append(renderer.render(eh)));
        }

        @Override
        public void visit(ArraySpecies array) {
            species(array.getPrefix());
            out.append('[');
            array.getBound().ifValid(bound -> out.append(renderer.render(bound)));
            out.append(']');
        }

        @Override
        public void visit(ParenthesizedSpecies parenthesized) {
            out.append('(');
            parenthesized.getTerm().accept(this);
            out.append(')');
        }

        private void species(IndexedView<SpeciesDeclarator> prefix) {
            for (SpeciesDeclarator species : prefix) {
                species.accept(this);
            }
        }

        // Declarators

        @Override
        public void visit(TermDeclarator term) {
            for (Indirector indirector : term.getIndirectors()) {
                indirector.accept(this);
            }
            term.getSpecies().accept(this);
            trailingAttributes(term.getAttributes());
        }

        @Override
        public void visit(TargetedDeclarator targeted) {
            targeted.getSpecies().accept(this);
            trailingAttributes(targeted.getAttributes());
            out.append(config.getReturnArrow()).append(renderer.render(targeted.getTarget()));
        }

        private void trailingAttributes(IndexedView<Attribute> attributes) {
            if (!attributes.isEmpty()) {
                out.append(' ');
                attributes(attributes, true);
            }
        }

        // Proclamators

        @Override
        public void visit(InitializedProclamator initialized) {
            initialized.getDeclarator().accept(this);
            initialized.getInitializer().ifValid(init -> out.append(" = ").append(renderer.render(init)));
        }

        @Override
        public void visit(ConstrainedProclamator constrained) {
            constrained.getDeclarator().accept(this);
            out.append(" requires ").append(renderer.render(constrained.getConstraint()));
        }
    }
}
