package com.progrep.forms.attribute;

/**
 * Base class for the syntactic forms an attribute can take inside
 * {@code [[ ]]}.
 *
 * The set of forms is closed. Client code learns which form it holds by
 * calling {@link #accept(AttributeVisitor)}; there is no down-cast API.
 */
public abstract sealed class Attribute
        permits BasicAttribute, ScopedAttribute, LabeledAttribute, CalledAttribute,
                ExpandedAttribute, FactoredAttribute, ElaboratedAttribute {

    public abstract void accept(AttributeVisitor visitor);
}
