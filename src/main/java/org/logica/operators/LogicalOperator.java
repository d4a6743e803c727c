package org.logica.operators;

/**
 * Connettivo logico identificato da un nome simbolico.
 *
 * Implementato dall'enumerazione chiusa {@link Operator} per i connettivi predefiniti
 * e da {@link CustomOperator} per quelli registrati in un {@link OperatorCatalog}.
 * Le proprietà algebriche (duale, converso, elementi neutri, ...) non appartengono
 * all'operatore ma al catalogo che lo ha registrato.
 */
public interface LogicalOperator {

    /** Nome simbolico univoco nel catalogo (es. "and", "imply"). */
    String getName();

    /** Simbolo canonico usato nella rappresentazione testuale (es. "∧"). */
    String getSymbol();

    /** Numero di argomenti accettati. */
    Arity getArity();
}
