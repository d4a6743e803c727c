package org.logica.solver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RICERCA CDCL - Stato incrementale del solutore per un singolo problema
 *
 * ALGORITMO:
 * • propagazione unitaria fino al punto fisso
 * • analisi del conflitto al primo Unique Implication Point con clausola appresa
 * • backjump non cronologico al secondo livello più alto della clausola appresa
 * • euristica di decisione a contatori per letterale in stile VSIDS
 * • restart opzionale con intervallo crescente
 *
 * La ricerca è incrementale: dopo ogni modello si può aggiungere una clausola
 * bloccante e riprendere dal livello 0 mantenendo le clausole apprese.
 *
 * L'interruzione del thread chiamante viene controllata a ogni passo della ricerca e
 * a ogni passata di propagazione, e termina la ricerca con {@link SearchInterruptedException}.
 */
final class CdclSearch {

    private static final Logger LOGGER = Logger.getLogger(CdclSearch.class.getName());

    /** Ogni quanti conflitti i contatori VSIDS vengono dimezzati. */
    private static final int DECAY_INTERVAL = 64;

    /** Fattore di crescita dell'intervallo fra due restart. */
    private static final double RESTART_GROWTH = 1.5;

    //region STATO

    private final int variableCount;
    private final List<int[]> clauses = new ArrayList<>();

    /** Valore per variabile: 1 vero, -1 falso, 0 non assegnata. */
    private final int[] values;
    private final int[] levels;

    /** Indice della clausola che ha implicato la variabile, -1 per decisioni. */
    private final int[] reasons;

    /** Contatori VSIDS per letterale: indice 2v per v, 2v+1 per ¬v. */
    private final int[] activity;

    private final DecisionStack trail = new DecisionStack();
    private final SearchStatistics statistics;

    private boolean unsatisfiable;
    private double restartLimit;
    private int conflictsSinceRestart;

    //endregion

    CdclSearch(List<List<Integer>> input, int variableCount, int restartInterval, SearchStatistics statistics) {
        if (variableCount < 0) {
            throw new IllegalArgumentException("Numero di variabili negativo: " + variableCount);
        }
        this.variableCount = variableCount;
        this.values = new int[variableCount + 1];
        this.levels = new int[variableCount + 1];
        this.reasons = new int[variableCount + 1];
        this.activity = new int[2 * (variableCount + 1)];
        this.statistics = statistics;
        this.restartLimit = restartInterval;
        for (List<Integer> clause : input) {
            addClause(clause);
        }
        LOGGER.fine(() -> String.format("Ricerca CDCL inizializzata: %d variabili, %d clausole",
                variableCount, clauses.size()));
    }

    //region CLAUSOLE

    /**
     * Aggiunge una clausola al livello 0, eliminando duplicati e tautologie.
     * La clausola vuota rende il problema insoddisfacibile.
     */
    void addClause(List<Integer> clause) {
        Set<Integer> literals = new LinkedHashSet<>();
        for (Integer literal : clause) {
            if (literal == null || literal == 0 || Math.abs(literal) > variableCount) {
                throw new IllegalArgumentException("Letterale non valido " + literal + " per "
                        + variableCount + " variabili");
            }
            if (literals.contains(-literal)) {
                return;
            }
            literals.add(literal);
        }
        if (literals.isEmpty()) {
            unsatisfiable = true;
            LOGGER.fine("Clausola vuota: problema insoddisfacibile");
            return;
        }
        int[] stored = new int[literals.size()];
        int i = 0;
        for (int literal : literals) {
            stored[i++] = literal;
            activity[activityIndex(literal)]++;
        }
        if (trail.getLevel() > 0) {
            backtrack(0);
        }
        clauses.add(stored);
    }

    /** Clausola che esclude esattamente l'assegnamento dato. */
    void block(boolean[] model) {
        List<Integer> blocking = new ArrayList<>(model.length);
        for (int v = 1; v <= model.length; v++) {
            blocking.add(model[v - 1] ? -v : v);
        }
        addClause(blocking);
    }

    //endregion

    //region RICERCA

    /**
     * Cerca un modello delle clausole correnti.
     *
     * @return true se trovato (leggibile con {@link #model()}), false se insoddisfacibile
     * @throws SearchInterruptedException se il thread viene interrotto durante la ricerca
     */
    boolean solve() {
        if (unsatisfiable) {
            return false;
        }
        backtrack(0);
        conflictsSinceRestart = 0;
        while (true) {
            checkForInterruption();
            int conflict = propagate();
            if (conflict >= 0) {
                statistics.incrementConflicts();
                if (trail.getLevel() == 0) {
                    unsatisfiable = true;
                    LOGGER.fine("Conflitto al livello 0: nessun altro modello");
                    return false;
                }
                learn(conflict);
                restartIfDue();
            } else {
                int literal = pickBranchLiteral();
                if (literal == 0) {
                    return true;
                }
                statistics.incrementDecisions();
                trail.addDecision(Math.abs(literal), literal > 0);
                assign(literal, -1);
            }
        }
    }

    boolean[] model() {
        boolean[] model = new boolean[variableCount];
        for (int v = 1; v <= variableCount; v++) {
            model[v - 1] = values[v] > 0;
        }
        return model;
    }

    /**
     * Propagazione unitaria fino al punto fisso.
     *
     * @return indice di una clausola falsificata, -1 se nessun conflitto
     */
    private int propagate() {
        boolean changed = true;
        while (changed) {
            checkForInterruption();
            changed = false;
            for (int c = 0; c < clauses.size(); c++) {
                int[] clause = clauses.get(c);
                int unassigned = 0;
                int candidate = 0;
                boolean satisfied = false;
                for (int literal : clause) {
                    int value = valueOf(literal);
                    if (value > 0) {
                        satisfied = true;
                        break;
                    }
                    if (value == 0) {
                        unassigned++;
                        candidate = literal;
                    }
                }
                if (satisfied) {
                    continue;
                }
                if (unassigned == 0) {
                    return c;
                }
                if (unassigned == 1) {
                    statistics.incrementPropagations();
                    trail.addImpliedLiteral(Math.abs(candidate), candidate > 0, c);
                    assign(candidate, c);
                    changed = true;
                }
            }
        }
        return -1;
    }

    /**
     * Analisi al primo UIP: risolve la clausola di conflitto con le ragioni degli
     * assegnamenti del livello corrente, dal più recente, finché ne resta uno solo.
     */
    private void learn(int conflictIndex) {
        int currentLevel = trail.getLevel();
        List<AssignedLiteral> levelTrail = trail.getAssignmentsAtLevel(currentLevel);
        Set<Integer> seen = new HashSet<>();
        List<Integer> learned = new ArrayList<>();
        learned.add(0);

        int[] clause = clauses.get(conflictIndex);
        int pending = 0;
        int pivot = 0;
        int position = levelTrail.size() - 1;
        int asserting;
        while (true) {
            for (int literal : clause) {
                int variable = Math.abs(literal);
                if (variable == pivot || levels[variable] == 0 || !seen.add(variable)) {
                    continue;
                }
                if (levels[variable] == currentLevel) {
                    pending++;
                } else {
                    learned.add(literal);
                }
            }
            while (!seen.contains(levelTrail.get(position).getVariable())) {
                position--;
            }
            AssignedLiteral next = levelTrail.get(position--);
            pivot = next.getVariable();
            pending--;
            if (pending <= 0) {
                asserting = -next.toDimacsLiteral();
                break;
            }
            clause = clauses.get(reasons[pivot]);
        }
        learned.set(0, asserting);

        int backjumpLevel = 0;
        for (int i = 1; i < learned.size(); i++) {
            backjumpLevel = Math.max(backjumpLevel, levels[Math.abs(learned.get(i))]);
        }
        for (int literal : learned) {
            activity[activityIndex(literal)] += 2;
        }
        if (statistics.getConflicts() % DECAY_INTERVAL == 0) {
            for (int i = 0; i < activity.length; i++) {
                activity[i] /= 2;
            }
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Clausola appresa " + learned + " dopo la decisione " + trail.getDecision(currentLevel)
                    + ", backjump " + currentLevel + " → " + backjumpLevel);
        }
        backtrack(backjumpLevel);
        statistics.incrementBackjumps();
        statistics.incrementLearnedClauses();

        int[] stored = new int[learned.size()];
        for (int i = 0; i < stored.length; i++) {
            stored[i] = learned.get(i);
        }
        clauses.add(stored);
        trail.addImpliedLiteral(Math.abs(asserting), asserting > 0, clauses.size() - 1);
        assign(asserting, clauses.size() - 1);
    }

    private void checkForInterruption() {
        if (Thread.currentThread().isInterrupted()) {
            LOGGER.fine(() -> "Ricerca interrotta dopo " + statistics.getConflicts() + " conflitti");
            throw new SearchInterruptedException("Ricerca CDCL interrotta");
        }
    }

    private void restartIfDue() {
        if (restartLimit <= 0) {
            return;
        }
        conflictsSinceRestart++;
        if (conflictsSinceRestart >= restartLimit) {
            backtrack(0);
            statistics.incrementRestarts();
            conflictsSinceRestart = 0;
            restartLimit *= RESTART_GROWTH;
            LOGGER.finest(() -> "Restart, prossimo dopo " + (int) restartLimit + " conflitti");
        }
    }

    /** Letterale non assegnato con contatore massimo; 0 se tutte le variabili sono assegnate. */
    private int pickBranchLiteral() {
        int best = 0;
        int bestActivity = -1;
        for (int v = 1; v <= variableCount; v++) {
            if (values[v] != 0) {
                continue;
            }
            if (activity[activityIndex(v)] > bestActivity) {
                best = v;
                bestActivity = activity[activityIndex(v)];
            }
            if (activity[activityIndex(-v)] > bestActivity) {
                best = -v;
                bestActivity = activity[activityIndex(-v)];
            }
        }
        return best;
    }

    //endregion

    //region ASSEGNAMENTI

    private void assign(int literal, int reason) {
        int variable = Math.abs(literal);
        values[variable] = literal > 0 ? 1 : -1;
        levels[variable] = trail.getLevel();
        reasons[variable] = reason;
    }

    private void backtrack(int level) {
        for (AssignedLiteral removed : trail.backtrackToLevel(level)) {
            int variable = removed.getVariable();
            values[variable] = 0;
            levels[variable] = 0;
            reasons[variable] = -1;
        }
    }

    private int valueOf(int literal) {
        int value = values[Math.abs(literal)];
        return literal > 0 ? value : -value;
    }

    private static int activityIndex(int literal) {
        return literal > 0 ? 2 * literal : 2 * -literal + 1;
    }

    //endregion
}
