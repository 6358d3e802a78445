package io.github.cyfko.texml.core.ast;

import java.util.Locale;

/**
 * MathML operator form.
 */
public enum OperatorForm {
    INFIX,
    PREFIX,
    POSTFIX;

    /**
     * @return the MathML {@code form} attribute value
     */
    public String attribute() {
        return name().toLowerCase(Locale.ROOT);
    }
}
