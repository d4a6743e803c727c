package org.logica.solver;

import java.util.List;
import java.util.logging.Logger;

/**
 * Motore SAT basato su Conflict-Driven Clause Learning.
 *
 * Con un intervallo di restart positivo la ricerca riparte dal livello 0 dopo quel
 * numero di conflitti, con intervallo che cresce di un fattore 1.5 a ogni restart.
 */
public class CdclEngine implements SatEngine {

    private static final Logger LOGGER = Logger.getLogger(CdclEngine.class.getName());

    /** Intervallo iniziale usato quando i restart sono abilitati senza valore esplicito. */
    public static final int DEFAULT_RESTART_INTERVAL = 100;

    private final int restartInterval;

    public CdclEngine() {
        this(0);
    }

    /**
     * @param restartInterval conflitti prima del primo restart, 0 per disabilitare
     */
    public CdclEngine(int restartInterval) {
        if (restartInterval < 0) {
            throw new IllegalArgumentException("Intervallo di restart negativo: " + restartInterval);
        }
        this.restartInterval = restartInterval;
    }

    public static CdclEngine withRestarts() {
        return new CdclEngine(DEFAULT_RESTART_INTERVAL);
    }

    public boolean isRestartEnabled() {
        return restartInterval > 0;
    }

    @Override
    public Solutions solve(List<List<Integer>> clauses, int variableCount) {
        if (clauses == null) {
            throw new IllegalArgumentException("Le clausole non possono essere null");
        }
        LOGGER.fine(() -> "Avvio CDCL su " + clauses.size() + " clausole e " + variableCount + " variabili"
                + (isRestartEnabled() ? " con restart" : ""));
        SearchStatistics statistics = new SearchStatistics();
        return new CdclSolutions(new CdclSearch(clauses, variableCount, restartInterval, statistics), statistics);
    }
}
