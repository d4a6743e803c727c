package org.logica.propositions;

import java.util.Objects;

/**
 * Atomo che racchiude un valore immutabile arbitrario; due costanti sono uguali se
 * lo sono i loro valori. Stampato come {@code $(valore)}.
 */
public final class Constant extends Atom {

    private final Object value;

    private Constant(Object value) {
        this.value = value;
    }

    public static Constant of(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Il valore di una costante non può essere null");
        }
        return new Constant(value);
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.CONSTANT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant)) return false;
        return value.equals(((Constant) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Kind.CONSTANT, value);
    }

    @Override
    public String toString() {
        return value instanceof String ? "$(\"" + value + "\")" : "$(" + value + ")";
    }
}
