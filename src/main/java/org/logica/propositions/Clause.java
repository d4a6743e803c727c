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
 * Clausola: letterali distinti uniti da ∧ o ∨.
 *
 * L'ordine di inserimento viene conservato per iterazione e stampa, mentre
 * uguaglianza e hash trattano i letterali come insieme. La clausola vuota vale
 * l'elemento neutro dell'operatore (⊤ per ∧, ⊥ per ∨).
 */
public final class Clause extends Proposition {

    private final Operator operator;
    private final List<Literal> literals;

    private Clause(Operator operator, List<Literal> literals) {
        this.operator = operator;
        this.literals = literals;
    }

    public static Clause of(Operator operator, Literal... literals) {
        return of(operator, Arrays.asList(literals));
    }

    /**
     * @throws IllegalArgumentException se l'operatore non è ∧/∨ o un letterale è null
     */
    public static Clause of(Operator operator, List<Literal> literals) {
        requireAndOr(operator);
        if (literals == null || literals.contains(null)) {
            throw new IllegalArgumentException("I letterali di una clausola non possono essere null");
        }
        return new Clause(operator, List.copyOf(new LinkedHashSet<>(literals)));
    }

    public static Clause empty(Operator operator) {
        return of(operator, List.of());
    }

    /** Operatore duale di quello della clausola (∧ per ∨ e viceversa). */
    static Operator dualOf(Operator operator) {
        return operator.andOrDual();
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    /** Clausola con i letterali di entrambe, senza duplicati e nell'ordine di inserimento. */
    public Clause union(Clause other) {
        if (other.operator != operator) {
            throw new IllegalArgumentException("Unione di clausole con operatori diversi: "
                    + operator + " e " + other.operator);
        }
        List<Literal> merged = new ArrayList<>(literals);
        merged.addAll(other.literals);
        return of(operator, merged);
    }

    /** Negazione secondo De Morgan: operatore duale e letterali negati. */
    public Clause negate() {
        List<Literal> negated = literals.stream().map(Literal::negate).collect(Collectors.toList());
        return of(dualOf(operator), negated);
    }

    @Override
    public Kind getKind() {
        return Kind.CLAUSE;
    }

    @Override
    public Operator getOperator() {
        return operator;
    }

    @Override
    public List<Proposition> children() {
        return List.copyOf(literals);
    }

    @Override
    public Optional<Boolean> truthValue() {
        return literals.isEmpty() ? Optional.of(operator == Operator.AND) : Optional.empty();
    }

    @Override
    public Proposition map(Function<? super Atom, ? extends Proposition> f) {
        List<Proposition> mapped = new ArrayList<>(literals.size());
        boolean allLiterals = true;
        for (Literal literal : literals) {
            Proposition result = literal.map(f);
            allLiterals &= result instanceof Literal;
            mapped.add(result);
        }
        if (allLiterals) {
            List<Literal> mappedLiterals = new ArrayList<>(mapped.size());
            for (Proposition result : mapped) {
                mappedLiterals.add((Literal) result);
            }
            return of(operator, mappedLiterals);
        }
        return foldTree(operator, mapped);
    }

    @Override
    public Literal toLiteral() {
        if (literals.size() == 1) {
            return literals.get(0);
        }
        throw new NotRepresentableException(this, "letterale");
    }

    @Override
    public Tree toTree() {
        return foldTree(operator, literals);
    }

    @Override
    public Clause toClause(Operator target) {
        requireAndOr(target);
        if (target == operator) {
            return this;
        }
        // un solo letterale ha lo stesso significato con entrambi gli operatori
        if (literals.size() == 1) {
            return of(target, literals);
        }
        throw new NotRepresentableException(this, "clausola " + target.getSymbol());
    }

    @Override
    boolean needsParentheses() {
        return literals.size() > 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        Clause other = (Clause) o;
        return operator == other.operator && new HashSet<>(literals).equals(new HashSet<>(other.literals));
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, new HashSet<>(literals));
    }

    @Override
    public String toString() {
        if (literals.isEmpty()) {
            return operator == Operator.AND ? Operator.TAUTOLOGY.getSymbol() : Operator.CONTRADICTION.getSymbol();
        }
        return literals.stream()
                .map(Literal::toString)
                .collect(Collectors.joining(" " + operator.getSymbol() + " "));
    }
}
