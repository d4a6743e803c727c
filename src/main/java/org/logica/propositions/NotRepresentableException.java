package org.logica.propositions;

import org.logica.support.LogicException;

/**
 * Lanciata da una conversione parziale quando la proposizione non ha forma equivalente
 * nella rappresentazione richiesta (es. un albero con operatore binario verso un letterale).
 */
public class NotRepresentableException extends LogicException {

    public NotRepresentableException(Proposition source, String target) {
        super("Impossibile rappresentare '" + source + "' come " + target);
    }
}
