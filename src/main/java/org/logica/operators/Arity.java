package org.logica.operators;

/**
 * Arità di un operatore: un intero non negativo oppure illimitata (operatori n-ari).
 *
 * @param value numero di argomenti, {@code -1} per l'arità illimitata
 */
public record Arity(int value) {

    public static final Arity NULLARY = new Arity(0);
    public static final Arity UNARY = new Arity(1);
    public static final Arity BINARY = new Arity(2);
    public static final Arity UNBOUNDED = new Arity(-1);

    public Arity {
        if (value < -1) {
            throw new IllegalArgumentException("Arità non valida: " + value);
        }
    }

    public static Arity of(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Arità negativa non ammessa: " + value);
        }
        return switch (value) {
            case 0 -> NULLARY;
            case 1 -> UNARY;
            case 2 -> BINARY;
            default -> new Arity(value);
        };
    }

    public boolean isUnbounded() {
        return value < 0;
    }

    /**
     * Verifica se un'applicazione con {@code count} argomenti rispetta l'arità.
     */
    public boolean accepts(int count) {
        return isUnbounded() || count == value;
    }

    @Override
    public String toString() {
        return isUnbounded() ? "∞" : Integer.toString(value);
    }
}
