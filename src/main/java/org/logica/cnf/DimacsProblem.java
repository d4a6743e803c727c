package org.logica.cnf;

import java.util.ArrayList;
import java.util.List;

/**
 * Problema letto da un file DIMACS CNF.
 *
 * @param variableCount numero di variabili dichiarato nell'intestazione
 * @param clauses clausole senza lo zero terminale
 */
public record DimacsProblem(int variableCount, List<List<Integer>> clauses) {

    public DimacsProblem {
        if (variableCount < 0) {
            throw new IllegalArgumentException("Numero di variabili negativo: " + variableCount);
        }
        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            copy.add(List.copyOf(clause));
        }
        clauses = List.copyOf(copy);
    }
}
