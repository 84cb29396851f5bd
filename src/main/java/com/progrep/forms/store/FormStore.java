package com.progrep.forms.store;

import com.progrep.forms.attribute.Attribute;
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
import com.progrep.forms.declarator.IdSpecies;
import com.progrep.forms.declarator.Indirector;
import com.progrep.forms.declarator.InitializedProclamator;
import com.progrep.forms.declarator.MemberIndirector;
import com.progrep.forms.declarator.ParenthesizedSpecies;
import com.progrep.forms.declarator.SimpleIndirector;
import com.progrep.forms.declarator.SpeciesDeclarator;
import com.progrep.forms.declarator.TargetedDeclarator;
import com.progrep.forms.declarator.TermDeclarator;
import com.progrep.forms.flags.BindingMode;
import com.progrep.forms.flags.TypeQualifiers;
import com.progrep.forms.lexical.Token;
import com.progrep.forms.ref.OptionalRef;
import com.progrep.forms.semantic.Decl;
import com.progrep.forms.semantic.Expr;
import com.progrep.forms.semantic.ParameterList;
import com.progrep.forms.semantic.ScopeRef;
import com.progrep.forms.semantic.Type;
import com.progrep.forms.view.EmptyView;
import com.progrep.forms.view.IndexedView;
import com.progrep.forms.view.ListView;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Allocates attribute and declarator forms together with the sequences they
 * refer to.
 *
 * Sequences handed to the store are copied into unmodifiable lists, so the
 * views built on them stay valid and in source order for as long as the store
 * is reachable. The store owns that storage; forms only read it.
 */
public class FormStore {
    private static final Logger log = LoggerFactory.getLogger(FormStore.class);

    @Getter
    private final String name;
    private final AtomicInteger nodeCount = new AtomicInteger();

    public FormStore(@NonNull String name) {
        this.name = name;
        log.debug("Created form store '{}'", name);
    }

    /**
     * Number of form nodes allocated by this store so far.
     */
    public int getNodeCount() {
        return nodeCount.get();
    }

    // Sequences

    public <T> IndexedView<T> sequence(@NonNull List<? extends T> elements) {
        if (elements.isEmpty()) {
            return EmptyView.instance();
        }
        List<T> copy = List.copyOf(elements);
        return new ListView<>(copy);
    }

    @SafeVarargs
    public final <T> IndexedView<T> sequenceOf(T... elements) {
        return sequence(Arrays.asList(elements));
    }

    public ParameterList parameters(@NonNull List<? extends Decl> parameters) {
        IndexedView<Decl> elements = sequence(parameters);
        return () -> elements;
    }

    // Attributes

    public BasicAttribute basicAttribute(Token token) {
        return track(new BasicAttribute(token));
    }

    public ScopedAttribute scopedAttribute(Token scope, Token member) {
        return track(new ScopedAttribute(scope, member));
    }

    public LabeledAttribute labeledAttribute(Token label, Attribute attribute) {
        return track(new LabeledAttribute(label, attribute));
    }

    public CalledAttribute calledAttribute(Attribute function, List<? extends Attribute> arguments) {
        return track(new CalledAttribute(function, sequence(arguments)));
    }

    public ExpandedAttribute expandedAttribute(Token expander, Attribute operand) {
        return track(new ExpandedAttribute(expander, operand));
    }

    public FactoredAttribute factoredAttribute(Token factor, List<? extends Attribute> terms) {
        return track(new FactoredAttribute(factor, sequence(terms)));
    }

    public ElaboratedAttribute elaboratedAttribute(Expr expression) {
        return track(new ElaboratedAttribute(expression));
    }

    // Indirectors

    public SimpleIndirector simpleIndirector(SimpleIndirector.Mode mode) {
        return simpleIndirector(mode, TypeQualifiers.NONE, List.of());
    }

    public SimpleIndirector simpleIndirector(SimpleIndirector.Mode mode, TypeQualifiers qualifiers,
                                             List<? extends Attribute> attributes) {
        return track(new SimpleIndirector(sequence(attributes), mode, qualifiers));
    }

    public MemberIndirector memberIndirector(ScopeRef scope, TypeQualifiers qualifiers) {
        return memberIndirector(scope, qualifiers, List.of());
    }

    public MemberIndirector memberIndirector(ScopeRef scope, TypeQualifiers qualifiers,
                                             List<? extends Attribute> attributes) {
        return track(new MemberIndirector(sequence(attributes), scope, qualifiers));
    }

    // Species

    public IdSpecies idSpecies(Expr name) {
        return track(new IdSpecies(name));
    }

    public CallableSpecies callableSpecies(List<? extends SpeciesDeclarator> prefix, ParameterList parameters) {
        return callableSpecies(prefix, parameters, TypeQualifiers.NONE, BindingMode.COPY, OptionalRef.absent());
    }

    public CallableSpecies callableSpecies(List<? extends SpeciesDeclarator> prefix, ParameterList parameters,
                                           TypeQualifiers qualifiers, BindingMode bindingMode,
                                           OptionalRef<Expr> throwsExpression) {
        return track(new CallableSpecies(sequence(prefix), parameters, qualifiers, bindingMode, throwsExpression));
    }

    public ArraySpecies arraySpecies(List<? extends SpeciesDeclarator> prefix, OptionalRef<Expr> bound) {
        return track(new ArraySpecies(sequence(prefix), bound));
    }

    public ParenthesizedSpecies parenthesizedSpecies(TermDeclarator term) {
        return track(new ParenthesizedSpecies(term));
    }

    // Declarators

    public TermDeclarator termDeclarator(List<? extends Indirector> indirectors, SpeciesDeclarator species) {
        return termDeclarator(indirectors, species, List.of());
    }

    public TermDeclarator termDeclarator(List<? extends Indirector> indirectors, SpeciesDeclarator species,
                                         List<? extends Attribute> attributes) {
        return track(new TermDeclarator(sequence(attributes), sequence(indirectors), species));
    }

    public TargetedDeclarator targetedDeclarator(CallableSpecies species, Type target) {
        return targetedDeclarator(species, target, List.of());
    }

    public TargetedDeclarator targetedDeclarator(CallableSpecies species, Type target,
                                                 List<? extends Attribute> attributes) {
        return track(new TargetedDeclarator(sequence(attributes), species, target));
    }

    // Proclamators

    public InitializedProclamator initializedProclamator(Declarator declarator, Decl result,
                                                         OptionalRef<Expr> initializer) {
        return track(new InitializedProclamator(declarator, result, initializer));
    }

    public ConstrainedProclamator constrainedProclamator(Declarator declarator, Decl result, Expr constraint) {
        return track(new ConstrainedProclamator(declarator, result, constraint));
    }

    private <N> N track(N node) {
        int count = nodeCount.incrementAndGet();
        if (log.isTraceEnabled()) {
            log.trace("[{}] allocated {} (#{})", name, node.getClass().getSimpleName(), count);
        }
        return node;
    }
}
