package org.logica.solver;

/**
 * Assegnamento sulla traccia del solutore, come letterale DIMACS reso vero.
 *
 * @param literal letterale vero sotto l'assegnamento
 * @param reason indice della clausola che ha implicato il letterale, {@value #DECISION} per le decisioni
 */
record AssignedLiteral(int literal, int reason) {

    static final int DECISION = -1;

    AssignedLiteral {
        if (literal == 0) {
            throw new IllegalArgumentException("Il letterale 0 non identifica alcuna variabile");
        }
        if (reason < DECISION) {
            throw new IllegalArgumentException("Indice di clausola non valido: " + reason);
        }
    }

    static AssignedLiteral decision(int variable, boolean value) {
        return new AssignedLiteral(value ? variable : -variable, DECISION);
    }

    static AssignedLiteral implied(int variable, boolean value, int reason) {
        if (reason == DECISION) {
            throw new IllegalArgumentException("Un'implicazione richiede la clausola che la giustifica");
        }
        return new AssignedLiteral(value ? variable : -variable, reason);
    }

    int getVariable() {
        return Math.abs(literal);
    }

    boolean isDecision() {
        return reason == DECISION;
    }

    int toDimacsLiteral() {
        return literal;
    }

    @Override
    public String toString() {
        return isDecision() ? "d" + literal : literal + "←c" + reason;
    }
}
