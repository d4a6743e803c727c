package org.logica.propositions;

import org.logica.operators.LogicalOperator;
import org.logica.operators.Operator;

import java.util.List;
import java.util.function.Function;

/**
 * Proposizione atomica: {@link Constant} o {@link Variable}.
 */
public abstract class Atom extends Proposition {

    Atom() {
    }

    @Override
    public LogicalOperator getOperator() {
        return Operator.IDENTITY;
    }

    @Override
    public List<Proposition> children() {
        return List.of();
    }

    @Override
    public boolean isAtom() {
        return true;
    }

    @Override
    public Proposition map(Function<? super Atom, ? extends Proposition> f) {
        Proposition mapped = f.apply(this);
        if (mapped == null) {
            throw new IllegalArgumentException("La funzione di mappatura ha restituito null per " + this);
        }
        return mapped;
    }

    @Override
    public Literal toLiteral() {
        return Literal.of(Operator.IDENTITY, this);
    }

    @Override
    public Tree toTree() {
        return Tree.of(Operator.IDENTITY, this);
    }

    @Override
    public Clause toClause(Operator operator) {
        requireAndOr(operator);
        return Clause.of(operator, toLiteral());
    }
}
