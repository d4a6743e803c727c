package org.logica.propositions;

import org.logica.operators.Operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Forma normale: clausole distinte dell'operatore duale unite da ∧ (CNF) o ∨ (DNF).
 *
 * Come per {@link Clause}, l'ordine di inserimento vale per iterazione e stampa
 * mentre l'uguaglianza è insiemistica. La forma vuota vale l'elemento neutro.
 */
public final class Normal extends Proposition {

    private final Operator operator;
    private final List<Clause> clauses;

    private Normal(Operator operator, List<Clause> clauses) {
        this.operator = operator;
        this.clauses = clauses;
    }

    public static Normal of(Operator operator, Clause... clauses) {
        return of(operator, Arrays.asList(clauses));
    }

    /**
     * @throws IllegalArgumentException se l'operatore non è ∧/∨ o una clausola non usa il duale
     */
    public static Normal of(Operator operator, List<Clause> clauses) {
        requireAndOr(operator);
        if (clauses == null || clauses.contains(null)) {
            throw new IllegalArgumentException("Le clausole di una forma normale non possono essere null");
        }
        Operator inner = operator.andOrDual();
        for (Clause clause : clauses) {
            if (clause.getOperator() != inner) {
                throw new IllegalArgumentException("Una forma normale " + operator.getSymbol()
                        + " richiede clausole " + inner.getSymbol() + ", trovata: " + clause);
            }
        }
        return new Normal(operator, List.copyOf(new LinkedHashSet<>(clauses)));
    }

    public static Normal empty(Operator operator) {
        return of(operator, List.of());
    }

    public List<Clause> getClauses() {
        return clauses;
    }

    public boolean isCnf() {
        return operator == Operator.AND;
    }

    /** Negazione secondo De Morgan: CNF diventa DNF con ogni clausola negata, e viceversa. */
    public Normal negate() {
        List<Clause> negated = clauses.stream().map(Clause::negate).collect(Collectors.toList());
        return of(operator.andOrDual(), negated);
    }

    @Override
    public Kind getKind() {
        return Kind.NORMAL;
    }

    @Override
    public Operator getOperator() {
        return operator;
    }

    @Override
    public List<Proposition> children() {
        return List.copyOf(clauses);
    }

    @Override
    public Optional<Boolean> truthValue() {
        boolean neutral = operator == Operator.AND;
        if (clauses.isEmpty()) {
            return Optional.of(neutral);
        }
        // una clausola vuota vale l'elemento assorbente dell'operatore esterno
        for (Clause clause : clauses) {
            if (clause.isEmpty()) {
                return Optional.of(!neutral);
            }
        }
        return Optional.empty();
    }

    @Override
    public Proposition map(Function<? super Atom, ? extends Proposition> f) {
        Operator inner = operator.andOrDual();
        List<Proposition> mapped = new ArrayList<>(clauses.size());
        boolean allClauses = true;
        for (Clause clause : clauses) {
            Proposition result = clause.map(f);
            allClauses &= result instanceof Clause && ((Clause) result).getOperator() == inner;
            mapped.add(result);
        }
        if (allClauses) {
            List<Clause> mappedClauses = new ArrayList<>(mapped.size());
            for (Proposition result : mapped) {
                mappedClauses.add((Clause) result);
            }
            return of(operator, mappedClauses);
        }
        return foldTree(operator, mapped);
    }

    @Override
    public Literal toLiteral() {
        if (clauses.size() == 1) {
            return clauses.get(0).toLiteral();
        }
        throw new NotRepresentableException(this, "letterale");
    }

    @Override
    public Tree toTree() {
        List<Tree> parts = new ArrayList<>(clauses.size());
        for (Clause clause : clauses) {
            parts.add(clause.toTree());
        }
        return foldTree(operator, parts);
    }

    @Override
    public Clause toClause(Operator target) {
        requireAndOr(target);
        if (clauses.size() == 1) {
            return clauses.get(0).toClause(target);
        }
        if (target == operator) {
            // ogni clausola deve ridursi a un solo letterale
            List<Literal> literals = new ArrayList<>();
            for (Clause clause : clauses) {
                if (clause.getLiterals().size() != 1) {
                    throw new NotRepresentableException(this, "clausola " + target.getSymbol());
                }
                literals.add(clause.getLiterals().get(0));
            }
            return Clause.of(target, literals);
        }
        throw new NotRepresentableException(this, "clausola " + target.getSymbol());
    }

    @Override
    public Normal toNormal(Operator target) {
        requireAndOr(target);
        if (target == operator) {
            return this;
        }
        return super.toNormal(target);
    }

    @Override
    boolean needsParentheses() {
        return clauses.size() > 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Normal)) return false;
        Normal other = (Normal) o;
        return operator == other.operator && new HashSet<>(clauses).equals(new HashSet<>(other.clauses));
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, new HashSet<>(clauses));
    }

    @Override
    public String toString() {
        if (clauses.isEmpty()) {
            return operator == Operator.AND ? Operator.TAUTOLOGY.getSymbol() : Operator.CONTRADICTION.getSymbol();
        }
        if (clauses.size() == 1) {
            return clauses.get(0).toString();
        }
        return clauses.stream()
                .map(Proposition::operand)
                .collect(Collectors.joining(" " + operator.getSymbol() + " "));
    }
}
