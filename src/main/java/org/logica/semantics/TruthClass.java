package org.logica.semantics;

/**
 * Classe di verità di una proposizione, nell'ordine contraddizione < contingenza < tautologia.
 */
public enum TruthClass {
    CONTRADICTION,
    CONTINGENCY,
    TAUTOLOGY
}
