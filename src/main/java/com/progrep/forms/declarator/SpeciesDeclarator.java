package com.progrep.forms.declarator;

/**
 * The shape in which a declared name is used: a plain name, a call, a
 * subscript, or a parenthesized grouping.
 *
 * Callable and array species are composed through their prefix sequence, the
 * species written to their left, so {@code (*f())[3]} nests an array species
 * around a parenthesized term whose species is callable. Declaration mimics
 * use; no full parse tree is kept.
 */
public abstract sealed class SpeciesDeclarator
        permits IdSpecies, CallableSpecies, ArraySpecies, ParenthesizedSpecies {

    public abstract void accept(SpeciesVisitor visitor);
}
