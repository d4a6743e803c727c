package org.logica.solver;

import org.logica.support.LogicException;

/**
 * Lanciata quando si usa un iteratore di soluzioni la cui risorsa è già stata rilasciata.
 */
public class SolverResourceException extends LogicException {

    public SolverResourceException(String message) {
        super(message);
    }
}
