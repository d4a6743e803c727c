package org.logica.operators;

import org.logica.support.LogicException;

/**
 * Lanciata quando si richiede una proprietà che il catalogo non ha potuto scoprire
 * (duale o converso assente) oppure una piegatura vuota di un operatore senza elemento neutro.
 */
public class UndefinedOperatorBehaviorException extends LogicException {

    public UndefinedOperatorBehaviorException(String message) {
        super(message);
    }
}
