package org.logica.solver;

import java.util.NoSuchElementException;
import java.util.logging.Logger;

/**
 * Enumerazione delle soluzioni tramite clausole bloccanti: ogni modello restituito
 * viene subito escluso dalla ricerca. La ricerca viene rilasciata all'esaurimento,
 * alla chiusura esplicita o quando viene interrotta.
 */
final class CdclSolutions implements Solutions {

    private static final Logger LOGGER = Logger.getLogger(CdclSolutions.class.getName());

    private final SearchStatistics statistics;
    private CdclSearch search;
    private boolean[] pending;
    private boolean closed;

    CdclSolutions(CdclSearch search, SearchStatistics statistics) {
        this.search = search;
        this.statistics = statistics;
    }

    @Override
    public boolean hasNext() {
        ensureOpen();
        if (pending != null) {
            return true;
        }
        if (search == null) {
            return false;
        }
        boolean found;
        try {
            found = search.solve();
        } catch (SearchInterruptedException e) {
            release();
            throw e;
        }
        if (found) {
            pending = search.model();
            search.block(pending);
            statistics.incrementSolutions();
        } else {
            release();
        }
        return pending != null;
    }

    @Override
    public boolean[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Nessun'altra soluzione");
        }
        boolean[] result = pending;
        pending = null;
        return result;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            pending = null;
            release();
        }
    }

    @Override
    public boolean isReleased() {
        return search == null;
    }

    private void ensureOpen() {
        if (closed) {
            throw new SolverResourceException("Iteratore di soluzioni già chiuso");
        }
    }

    private void release() {
        if (search != null) {
            search = null;
            statistics.stopTimer();
            LOGGER.fine(() -> "Risorsa del solutore rilasciata: " + statistics);
        }
    }
}
