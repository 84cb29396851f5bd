package com.progrep.forms.semantic;

import com.progrep.forms.view.IndexedView;

/**
 * Parameters of a callable, in declaration order.
 */
public interface ParameterList {

    IndexedView<Decl> getElements();
}
