package org.logica.propositions;

import java.util.regex.Pattern;

/**
 * Atomo identificato da un nome simbolico; due variabili sono uguali se hanno lo stesso nome.
 *
 * Il prefisso {@value #RESERVED_PREFIX} è riservato alle variabili ausiliarie della
 * trasformazione di Tseytin e viene rifiutato per le variabili dell'utente.
 * I nomi {@code $1, $2, ...} identificano i segnaposto delle regole di riscrittura.
 */
public final class Variable extends Atom {

    public static final String RESERVED_PREFIX = "##";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$[1-9][0-9]*");

    private final String name;

    private Variable(String name) {
        this.name = name;
    }

    /**
     * @throws IllegalArgumentException se il nome è null, vuoto o usa il prefisso riservato
     */
    public static Variable of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Il nome di una variabile non può essere null o vuoto");
        }
        if (name.startsWith(RESERVED_PREFIX)) {
            throw new IllegalArgumentException("Il prefisso '" + RESERVED_PREFIX + "' è riservato: " + name);
        }
        return new Variable(name);
    }

    /** Variabile ausiliaria {@code ##index} introdotta dalla trasformazione di Tseytin. */
    public static Variable auxiliary(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Indice ausiliario non valido: " + index);
        }
        return new Variable(RESERVED_PREFIX + index);
    }

    /** Segnaposto {@code $index} per le regole di riscrittura. */
    public static Variable placeholder(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Indice del segnaposto non valido: " + index);
        }
        return new Variable("$" + index);
    }

    public String getName() {
        return name;
    }

    public boolean isAuxiliary() {
        return name.startsWith(RESERVED_PREFIX);
    }

    public boolean isPlaceholder() {
        return PLACEHOLDER.matcher(name).matches();
    }

    /**
     * @throws IllegalStateException se la variabile non è un segnaposto
     */
    public int placeholderIndex() {
        if (!isPlaceholder()) {
            throw new IllegalStateException("La variabile '" + name + "' non è un segnaposto");
        }
        return Integer.parseInt(name.substring(1));
    }

    @Override
    public Kind getKind() {
        return Kind.VARIABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
