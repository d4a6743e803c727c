package org.logica.propositions;

import org.logica.operators.Operator;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Letterale: un atomo in forma positiva ({@link Operator#IDENTITY}) o negata
 * ({@link Operator#NOT}). Non si annida mai: la negazione di un letterale negato
 * è il letterale positivo.
 */
public final class Literal extends Proposition {

    private final Operator operator;
    private final Atom atom;

    private Literal(Operator operator, Atom atom) {
        this.operator = operator;
        this.atom = atom;
    }

    /**
     * @throws IllegalArgumentException se l'operatore non è identità o negazione, o l'atomo è null
     */
    public static Literal of(Operator operator, Atom atom) {
        if (operator != Operator.IDENTITY && operator != Operator.NOT) {
            throw new IllegalArgumentException("Un letterale richiede identità o negazione, trovato: " + operator);
        }
        if (atom == null) {
            throw new IllegalArgumentException("L'atomo di un letterale non può essere null");
        }
        return new Literal(operator, atom);
    }

    public static Literal positive(Atom atom) {
        return of(Operator.IDENTITY, atom);
    }

    public static Literal negative(Atom atom) {
        return of(Operator.NOT, atom);
    }

    public Atom getAtom() {
        return atom;
    }

    public boolean isPositive() {
        return operator == Operator.IDENTITY;
    }

    public Literal negate() {
        return new Literal(isPositive() ? Operator.NOT : Operator.IDENTITY, atom);
    }

    @Override
    public Kind getKind() {
        return Kind.LITERAL;
    }

    @Override
    public Operator getOperator() {
        return operator;
    }

    @Override
    public List<Proposition> children() {
        return List.of(atom);
    }

    @Override
    public Proposition map(Function<? super Atom, ? extends Proposition> f) {
        Proposition mapped = atom.map(f);
        if (isPositive()) {
            return mapped.isAtom() ? Literal.of(Operator.IDENTITY, (Atom) mapped) : mapped;
        }
        if (mapped.isAtom()) {
            return Literal.of(Operator.NOT, (Atom) mapped);
        }
        if (mapped instanceof Literal) {
            return ((Literal) mapped).negate();
        }
        return Tree.of(Operator.NOT, mapped);
    }

    @Override
    public Literal toLiteral() {
        return this;
    }

    @Override
    public Tree toTree() {
        return Tree.of(operator, atom);
    }

    @Override
    public Clause toClause(Operator target) {
        requireAndOr(target);
        return Clause.of(target, this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal other = (Literal) o;
        return operator == other.operator && atom.equals(other.atom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, atom);
    }

    @Override
    public String toString() {
        return isPositive() ? atom.toString() : operator.getSymbol() + atom;
    }
}
