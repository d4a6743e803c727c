package org.logica.operators;

/**
 * Operatore definito dall'utente e registrato in un {@link OperatorCatalog}.
 *
 * L'uguaglianza è l'identità dell'istanza creata dalla registrazione: due registrazioni
 * con lo stesso nome in cataloghi diversi producono operatori distinti, anche con
 * regole diverse, e nessuno dei due cataloghi accetta gli alberi dell'altro.
 */
public final class CustomOperator implements LogicalOperator {

    private final String name;
    private final String symbol;
    private final Arity arity;

    CustomOperator(String name, String symbol, Arity arity) {
        this.name = name;
        this.symbol = symbol;
        this.arity = arity;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public Arity getArity() {
        return arity;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
