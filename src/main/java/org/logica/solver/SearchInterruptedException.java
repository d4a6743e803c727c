package org.logica.solver;

import org.logica.support.LogicException;

/**
 * Lanciata quando il thread che esegue la ricerca viene interrotto, per esempio allo
 * scadere di un timeout. L'iteratore di soluzioni coinvolto viene rilasciato.
 */
public class SearchInterruptedException extends LogicException {

    public SearchInterruptedException(String message) {
        super(message);
    }
}
