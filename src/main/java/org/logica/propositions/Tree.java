package org.logica.propositions;

import org.logica.operators.ArityMismatchException;
import org.logica.operators.LogicalOperator;
import org.logica.operators.Operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Albero sintattico: un operatore applicato a un numero di figli pari alla sua arità.
 * Le costanti di verità ⊤ e ⊥ sono alberi nullari ({@link #TRUE}, {@link #FALSE}).
 *
 * La costruzione diretta non semplifica nulla; per la costruzione con semplificazione
 * si usa {@link org.logica.evaluation.Evaluator#apply}.
 */
public final class Tree extends Proposition {

    public static final Tree TRUE = new Tree(Operator.TAUTOLOGY, List.of());
    public static final Tree FALSE = new Tree(Operator.CONTRADICTION, List.of());

    private final LogicalOperator operator;
    private final List<Proposition> children;

    private Tree(LogicalOperator operator, List<Proposition> children) {
        this.operator = operator;
        this.children = children;
    }

    public static Tree of(LogicalOperator operator, Proposition... children) {
        return of(operator, Arrays.asList(children));
    }

    /**
     * @throws ArityMismatchException se il numero di figli non rispetta l'arità
     * @throws IllegalArgumentException se l'operatore o un figlio è null
     */
    public static Tree of(LogicalOperator operator, List<? extends Proposition> children) {
        if (operator == null) {
            throw new IllegalArgumentException("L'operatore di un albero non può essere null");
        }
        if (children == null || children.contains(null)) {
            throw new IllegalArgumentException("I figli di un albero non possono essere null");
        }
        if (!operator.getArity().accepts(children.size())) {
            throw new ArityMismatchException(operator, children.size());
        }
        if (operator == Operator.TAUTOLOGY) {
            return TRUE;
        }
        if (operator == Operator.CONTRADICTION) {
            return FALSE;
        }
        return new Tree(operator, List.copyOf(children));
    }

    /** Costante di verità corrispondente al valore booleano. */
    public static Tree constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Kind getKind() {
        return Kind.TREE;
    }

    @Override
    public LogicalOperator getOperator() {
        return operator;
    }

    @Override
    public List<Proposition> children() {
        return children;
    }

    @Override
    public Optional<Boolean> truthValue() {
        if (operator == Operator.TAUTOLOGY) {
            return Optional.of(true);
        }
        if (operator == Operator.CONTRADICTION) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    @Override
    public Proposition map(Function<? super Atom, ? extends Proposition> f) {
        if (children.isEmpty()) {
            return this;
        }
        List<Proposition> mapped = new ArrayList<>(children.size());
        for (Proposition child : children) {
            mapped.add(child.map(f));
        }
        return Tree.of(operator, mapped);
    }

    @Override
    public Literal toLiteral() {
        if (operator == Operator.IDENTITY) {
            return children.get(0).toLiteral();
        }
        if (operator == Operator.NOT) {
            return children.get(0).toLiteral().negate();
        }
        throw new NotRepresentableException(this, "letterale");
    }

    @Override
    public Tree toTree() {
        return this;
    }

    @Override
    public Clause toClause(Operator target) {
        requireAndOr(target);
        Optional<Boolean> value = truthValue();
        if (value.isPresent()) {
            // ⊤ è la clausola ∧ vuota, ⊥ la clausola ∨ vuota
            if (value.get() == (target == Operator.AND)) {
                return Clause.empty(target);
            }
            throw new NotRepresentableException(this, "clausola " + target.getSymbol());
        }
        if (operator == target || operator == fold(target)) {
            Clause result = Clause.empty(target);
            for (Proposition child : children) {
                result = result.union(child.toClause(target));
            }
            return result;
        }
        if (operator == Operator.IDENTITY || operator == Operator.NOT) {
            return Clause.of(target, toLiteral());
        }
        throw new NotRepresentableException(this, "clausola " + target.getSymbol());
    }

    private static Operator fold(Operator target) {
        return target == Operator.AND ? Operator.CONJUNCTION : Operator.DISJUNCTION;
    }

    @Override
    boolean needsParentheses() {
        return children.size() > 1 || operator.getArity().isUnbounded();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tree)) return false;
        Tree other = (Tree) o;
        return operator.equals(other.operator) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, children);
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return operator.getArity().isUnbounded() ? operator.getSymbol() + "()" : operator.getSymbol();
        }
        if (children.size() == 1 && !operator.getArity().isUnbounded()) {
            return operator.getSymbol() + operand(children.get(0));
        }
        return children.stream()
                .map(Proposition::operand)
                .collect(Collectors.joining(" " + operator.getSymbol() + " "));
    }
}
