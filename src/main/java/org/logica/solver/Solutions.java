package org.logica.solver;

import java.util.Iterator;

/**
 * Iteratore delle soluzioni di un problema SAT. L'elemento i-esimo dell'array
 * è il valore della variabile i+1.
 *
 * Possiede in esclusiva la risorsa del solutore: la rilascia quando le soluzioni
 * sono esaurite o alla chiusura. Dopo {@link #close()} ogni altro uso lancia
 * {@link SolverResourceException}.
 */
public interface Solutions extends Iterator<boolean[]>, AutoCloseable {

    @Override
    void close();

    boolean isReleased();
}
