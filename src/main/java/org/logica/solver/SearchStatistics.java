package org.logica.solver;

import java.time.Duration;

/**
 * Contatori della ricerca CDCL, accumulati su tutte le soluzioni enumerate
 * dallo stesso iteratore. Il tempo si ferma al rilascio della ricerca.
 */
public class SearchStatistics {

    private int decisions;
    private int propagations;
    private int conflicts;
    private int learnedClauses;
    private int backjumps;
    private int restarts;
    private int solutions;

    private final long startNanos = System.nanoTime();
    private long stopNanos = -1;

    //region AGGIORNAMENTO (solo dal pacchetto del solutore)

    void incrementDecisions() {
        decisions++;
    }

    void incrementPropagations() {
        propagations++;
    }

    void incrementConflicts() {
        conflicts++;
    }

    void incrementLearnedClauses() {
        learnedClauses++;
    }

    void incrementBackjumps() {
        backjumps++;
    }

    void incrementRestarts() {
        restarts++;
    }

    void incrementSolutions() {
        solutions++;
    }

    void stopTimer() {
        if (stopNanos < 0) {
            stopNanos = System.nanoTime();
        }
    }

    //endregion

    //region LETTURA

    public Duration getElapsed() {
        return Duration.ofNanos((stopNanos < 0 ? System.nanoTime() : stopNanos) - startNanos);
    }

    public boolean isStopped() {
        return stopNanos >= 0;
    }

    public int getDecisions() {
        return decisions;
    }

    public int getPropagations() {
        return propagations;
    }

    public int getConflicts() {
        return conflicts;
    }

    public int getLearnedClauses() {
        return learnedClauses;
    }

    public int getBackjumps() {
        return backjumps;
    }

    public int getRestarts() {
        return restarts;
    }

    public int getSolutions() {
        return solutions;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("decisioni %d, propagazioni %d, conflitti %d, clausole apprese %d, "
                        + "backjump %d, restart %d, soluzioni %d in %d ms",
                decisions, propagations, conflicts, learnedClauses, backjumps, restarts, solutions,
                getElapsed().toMillis());
    }
}
