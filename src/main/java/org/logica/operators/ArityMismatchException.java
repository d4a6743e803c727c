package org.logica.operators;

import org.logica.support.LogicException;

/**
 * Lanciata quando un operatore viene applicato a un numero di argomenti diverso dalla sua arità.
 */
public class ArityMismatchException extends LogicException {

    private final transient LogicalOperator operator;
    private final int actual;

    public ArityMismatchException(LogicalOperator operator, int actual) {
        super("L'operatore '" + operator.getName() + "' richiede " + operator.getArity()
                + " argomenti, ricevuti " + actual);
        this.operator = operator;
        this.actual = actual;
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public int getActual() {
        return actual;
    }
}
