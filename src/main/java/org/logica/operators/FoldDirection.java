package org.logica.operators;

/**
 * Direzione di piegatura usata per costruire catene n-arie di un operatore binario.
 * LEFT produce ((a op b) op c), RIGHT produce a op (b op c).
 */
public enum FoldDirection {
    LEFT,
    RIGHT
}
