package org.logica.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Traccia degli assegnamenti organizzata per livelli di decisione.
 *
 * Il livello 0 contiene le implicazioni indipendenti da ogni decisione ed è sempre
 * presente; ogni decisione apre un nuovo livello, le implicazioni si accodano al
 * livello corrente. Il backjump rimuove interi livelli.
 */
final class DecisionStack {

    private static final Logger LOGGER = Logger.getLogger(DecisionStack.class.getName());

    private final Stack<ArrayList<AssignedLiteral>> levelStack;

    DecisionStack() {
        this.levelStack = new Stack<>();
        this.levelStack.push(new ArrayList<>());
    }

    void addDecision(int variable, boolean value) {
        ArrayList<AssignedLiteral> level = new ArrayList<>();
        level.add(AssignedLiteral.decision(variable, value));
        levelStack.push(level);
        LOGGER.finest(() -> String.format("Decisione: var=%d, val=%s, livello=%d", variable, value, getLevel()));
    }

    /** @param reason indice della clausola che implica l'assegnamento */
    void addImpliedLiteral(int variable, boolean value, int reason) {
        levelStack.peek().add(AssignedLiteral.implied(variable, value, reason));
        LOGGER.finest(() -> String.format("Implicazione: var=%d, val=%s, livello=%d, clausola=%d",
                variable, value, getLevel(), reason));
    }

    /**
     * Rimuove tutti i livelli sopra {@code targetLevel}.
     *
     * @return assegnamenti rimossi
     * @throws IllegalArgumentException se il livello è negativo o superiore a quello corrente
     */
    List<AssignedLiteral> backtrackToLevel(int targetLevel) {
        int currentLevel = getLevel();
        if (targetLevel < 0 || targetLevel > currentLevel) {
            throw new IllegalArgumentException(
                    String.format("Livello di backtrack %d non valido (corrente %d)", targetLevel, currentLevel));
        }
        List<AssignedLiteral> removed = new ArrayList<>();
        while (getLevel() > targetLevel) {
            removed.addAll(levelStack.pop());
        }
        if (LOGGER.isLoggable(Level.FINEST) && currentLevel != targetLevel) {
            LOGGER.finest(String.format("Backjump %d → %d, %d assegnamenti rimossi",
                    currentLevel, targetLevel, removed.size()));
        }
        return removed;
    }

    int getLevel() {
        return levelStack.size() - 1;
    }

    List<AssignedLiteral> getAssignmentsAtLevel(int level) {
        if (level < 0 || level > getLevel()) {
            throw new IllegalArgumentException("Livello inesistente: " + level);
        }
        return levelStack.get(level);
    }

    /** Decisione che ha aperto il livello indicato, maggiore di 0. */
    AssignedLiteral getDecision(int level) {
        if (level <= 0) {
            throw new IllegalArgumentException("Il livello 0 non ha decisioni");
        }
        return getAssignmentsAtLevel(level).get(0);
    }
}
