package org.logica.solver;

import java.util.List;

/**
 * Contratto del motore SAT: date clausole CNF su letterali interi (DIMACS, senza lo zero
 * finale), produce l'iteratore delle assegnazioni che le soddisfano.
 */
public interface SatEngine {

    /**
     * @param clauses clausole con letterali in [-variableCount, variableCount] \ {0}
     * @param variableCount numero di variabili del problema
     * @return soluzioni da chiudere dopo l'uso; vuote se il problema è insoddisfacibile
     */
    Solutions solve(List<List<Integer>> clauses, int variableCount);
}
