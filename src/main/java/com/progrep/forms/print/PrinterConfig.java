package com.progrep.forms.print;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Options for {@link FormPrinter}.
 */
@Value
@Builder(toBuilder = true)
public class PrinterConfig {

    /**
     * Wrap attribute sequences in {@code [[ ]]}. Off, the bare attribute list is
     * printed, as inside an already open attribute specifier.
     */
    @Builder.Default
    boolean bracketAttributes = true;

    /**
     * Text between the elements of parameter, argument and term lists.
     */
    @NonNull
    @Builder.Default
    String listSeparator = ", ";

    /**
     * Text between a callable species and its trailing return type.
     */
    @NonNull
    @Builder.Default
    String returnArrow = " -> ";

    public static PrinterConfig defaults() {
        return PrinterConfig.builder().build();
    }
}
