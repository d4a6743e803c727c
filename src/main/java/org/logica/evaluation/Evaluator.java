package org.logica.evaluation;

import org.logica.operators.ArityMismatchException;
import org.logica.operators.FoldDirection;
import org.logica.operators.LogicalOperator;
import org.logica.operators.Operator;
import org.logica.operators.OperatorCatalog;
import org.logica.operators.UndefinedOperatorBehaviorException;
import org.logica.propositions.Atom;
import org.logica.propositions.Clause;
import org.logica.propositions.Literal;
import org.logica.propositions.Normal;
import org.logica.propositions.Proposition;
import org.logica.propositions.Tree;
import org.logica.propositions.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * VALUTATORE E RISCRITTORE - Costruzione semplificante e passi di riscrittura
 *
 * Tutte le proposizioni composte vengono costruite tramite {@link #apply}, che:
 * • verifica l'arità a ogni applicazione
 * • valuta subito nullari, identità, operatori n-ari e argomenti tutti costanti
 * • applica le leggi di identità e dominazione con operandi costanti
 * • spinge la negazione su costanti, letterali e forme canoniche
 * • in tutti gli altri casi restituisce un albero pigro senza visitare i figli
 *
 * {@link #evaluate} esegue un solo passo di riscrittura (negazione spinta di un
 * livello tramite il duale, espansione della regola per gli operatori non primitivi).
 */
public class Evaluator {

    private static final Logger LOGGER = Logger.getLogger(Evaluator.class.getName());

    private final OperatorCatalog catalog;

    public Evaluator(OperatorCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Il catalogo degli operatori non può essere null");
        }
        this.catalog = catalog;
    }

    private static final class StandardHolder {
        static final Evaluator STANDARD = new Evaluator(OperatorCatalog.standard());
    }

    /** Valutatore condiviso sul catalogo predefinito. */
    public static Evaluator standard() {
        return StandardHolder.STANDARD;
    }

    public OperatorCatalog getCatalog() {
        return catalog;
    }

    //region COSTRUZIONE SEMPLIFICANTE

    public Proposition apply(LogicalOperator operator, Proposition... args) {
        if (args == null) {
            throw new IllegalArgumentException("Gli argomenti non possono essere null");
        }
        return apply(operator, Arrays.asList(args));
    }

    /**
     * Applica l'operatore con semantica ansiosa o pigra.
     *
     * @throws ArityMismatchException se il numero di argomenti non rispetta l'arità
     * @throws IllegalArgumentException se l'operatore non è registrato o un argomento è null
     */
    public Proposition apply(LogicalOperator operator, List<? extends Proposition> args) {
        if (args == null || args.contains(null)) {
            throw new IllegalArgumentException("Gli argomenti non possono essere null");
        }
        catalog.properties(operator);
        if (!operator.getArity().accepts(args.size())) {
            throw new ArityMismatchException(operator, args.size());
        }

        if (operator instanceof Operator) {
            switch ((Operator) operator) {
                case TAUTOLOGY:
                    return Tree.TRUE;
                case CONTRADICTION:
                    return Tree.FALSE;
                case IDENTITY:
                    return args.get(0);
                case NOT:
                    return negate(args.get(0));
                case CONJUNCTION:
                    return fold(Operator.AND, args);
                case DISJUNCTION:
                    return fold(Operator.OR, args);
                default:
                    break;
            }
        }

        boolean[] values = new boolean[args.size()];
        boolean allConstant = true;
        for (int i = 0; i < values.length && allConstant; i++) {
            Optional<Boolean> value = args.get(i).truthValue();
            allConstant = value.isPresent();
            values[i] = value.orElse(false);
        }
        if (allConstant) {
            return Tree.constant(catalog.evaluate(operator, values));
        }

        if (args.size() == 2) {
            Proposition simplified = identityLaws(operator, args.get(0), args.get(1));
            if (simplified != null) {
                return simplified;
            }
        }
        return Tree.of(operator, args);
    }

    /** Valutazione booleana immediata. */
    public boolean apply(LogicalOperator operator, boolean... args) {
        return catalog.evaluate(operator, args);
    }

    /**
     * Leggi di identità (x op e = x) e di dominazione per ∧/∨ con un operando costante.
     *
     * @return proposizione semplificata, o null se nessuna legge si applica
     */
    private Proposition identityLaws(LogicalOperator operator, Proposition left, Proposition right) {
        Optional<Boolean> leftValue = left.truthValue();
        Optional<Boolean> rightValue = right.truthValue();

        if (operator == Operator.AND || operator == Operator.OR) {
            boolean absorbing = operator == Operator.OR;
            if (leftValue.isPresent() && leftValue.get() == absorbing
                    || rightValue.isPresent() && rightValue.get() == absorbing) {
                return Tree.constant(absorbing);
            }
        }

        Optional<Operator> leftIdentity = catalog.leftIdentity(operator);
        if (leftValue.isPresent() && leftIdentity.isPresent()
                && leftValue.get() == (leftIdentity.get() == Operator.TAUTOLOGY)) {
            return right;
        }
        Optional<Operator> rightIdentity = catalog.rightIdentity(operator);
        if (rightValue.isPresent() && rightIdentity.isPresent()
                && rightValue.get() == (rightIdentity.get() == Operator.TAUTOLOGY)) {
            return left;
        }
        return null;
    }

    /**
     * Negazione immediata: costanti invertite, letterali formati o invertiti,
     * doppia negazione eliminata, forme canoniche dualizzate; altrimenti albero pigro.
     */
    public Proposition negate(Proposition p) {
        if (p == null) {
            throw new IllegalArgumentException("La proposizione da negare non può essere null");
        }
        switch (p.getKind()) {
            case CONSTANT:
            case VARIABLE:
                return Literal.of(Operator.NOT, (Atom) p);
            case LITERAL: {
                Literal literal = (Literal) p;
                return literal.isPositive() ? literal.negate() : literal.getAtom();
            }
            case CLAUSE:
                return ((Clause) p).negate();
            case NORMAL:
                return ((Normal) p).negate();
            default:
                break;
        }
        Optional<Boolean> value = p.truthValue();
        if (value.isPresent()) {
            return Tree.constant(!value.get());
        }
        if (p.getOperator() == Operator.NOT) {
            return p.children().get(0);
        }
        return Tree.of(Operator.NOT, p);
    }

    //endregion

    //region RISCRITTURA

    public Proposition evaluate(LogicalOperator operator, Proposition... args) {
        return evaluate(operator, Arrays.asList(args));
    }

    /**
     * Un passo di riscrittura.
     * • ¬op(p, q) diventa dual(op)(¬p, ¬q), oppure la negazione della regola se il duale manca
     * • un operatore non primitivo viene sostituito dalla sua regola istanziata
     * • un operatore primitivo viene semplicemente applicato
     */
    public Proposition evaluate(LogicalOperator operator, List<? extends Proposition> args) {
        catalog.properties(operator);
        if (!operator.getArity().accepts(args.size())) {
            throw new ArityMismatchException(operator, args.size());
        }
        if (operator == Operator.NOT) {
            return pushNegation(args.get(0));
        }
        if (isPrimitive(operator)) {
            return apply(operator, args);
        }
        Optional<Proposition> rule = catalog.rule(operator);
        if (rule.isEmpty()) {
            throw new UndefinedOperatorBehaviorException("Nessuna regola di riscrittura per '" + operator.getName() + "'");
        }
        Proposition result = instantiate(rule.get(), args);
        LOGGER.finest(() -> "Riscrittura " + operator.getName() + args + " -> " + result);
        return result;
    }

    private Proposition pushNegation(Proposition inner) {
        if (inner.getKind() != Proposition.Kind.TREE || inner.getOperator() == Operator.NOT) {
            return negate(inner);
        }
        if (inner.children().isEmpty()) {
            return negate(apply(inner.getOperator(), inner.children()));
        }
        LogicalOperator innerOperator = inner.getOperator();
        Optional<LogicalOperator> dual = catalog.findDual(innerOperator);
        if (dual.isPresent()) {
            List<Proposition> negated = new ArrayList<>(inner.children().size());
            for (Proposition child : inner.children()) {
                negated.add(negate(child));
            }
            return apply(dual.get(), negated);
        }
        Optional<Proposition> rule = catalog.rule(innerOperator);
        if (rule.isPresent()) {
            return negate(instantiate(rule.get(), inner.children()));
        }
        return negate(inner);
    }

    private static boolean isPrimitive(LogicalOperator operator) {
        return operator instanceof Operator && (((Operator) operator).isPrimitive()
                || operator == Operator.CONJUNCTION || operator == Operator.DISJUNCTION);
    }

    /** Sostituisce $i con args[i-1] ricostruendo la regola tramite {@link #apply}. */
    private Proposition instantiate(Proposition rule, List<? extends Proposition> args) {
        switch (rule.getKind()) {
            case VARIABLE: {
                Variable variable = (Variable) rule;
                return variable.isPlaceholder() ? args.get(variable.placeholderIndex() - 1) : variable;
            }
            case CONSTANT:
                return rule;
            case LITERAL: {
                Literal literal = (Literal) rule;
                Proposition atom = instantiate(literal.getAtom(), args);
                return literal.isPositive() ? atom : negate(atom);
            }
            case CLAUSE:
            case NORMAL:
            case TREE: {
                List<Proposition> parts = new ArrayList<>(rule.children().size());
                for (Proposition child : rule.children()) {
                    parts.add(instantiate(child, args));
                }
                if (rule.getKind() == Proposition.Kind.TREE) {
                    return apply(rule.getOperator(), parts);
                }
                return fold(rule.getOperator(), parts);
            }
            default:
                throw new IllegalStateException("Tipo di proposizione non gestito: " + rule.getKind());
        }
    }

    /**
     * Ricostruzione dal basso verso l'alto tramite {@link #apply}. Gli alberi senza figli
     * (⋀(), ⋁(), operatori nullari registrati) diventano la costante che rappresentano.
     */
    public Proposition simplify(Proposition p) {
        if (isAtomicForm(p)) {
            return p;
        }
        List<Proposition> children = new ArrayList<>(p.children().size());
        for (Proposition child : p.children()) {
            children.add(simplify(child));
        }
        return apply(p.getOperator(), children);
    }

    /**
     * Forma normale negativa: solo atomi, letterali, ∧ e ∨. Gli operatori non primitivi
     * vengono espansi tramite la loro regola.
     */
    public Proposition negationNormalForm(Proposition p) {
        if (isAtomicForm(p)) {
            return p;
        }
        LogicalOperator operator = p.getOperator();
        List<Proposition> children = p.children();
        if (operator == Operator.NOT) {
            return negatedNormalForm(children.get(0));
        }
        if (operator == Operator.IDENTITY) {
            return negationNormalForm(children.get(0));
        }
        if (isPrimitive(operator)) {
            return apply(operator, mapAll(children, false));
        }
        return negationNormalForm(evaluate(operator, children));
    }

    private Proposition negatedNormalForm(Proposition p) {
        if (isAtomicForm(p)) {
            return negate(p);
        }
        LogicalOperator operator = p.getOperator();
        List<Proposition> children = p.children();
        if (operator == Operator.NOT) {
            return negationNormalForm(children.get(0));
        }
        if (operator == Operator.IDENTITY) {
            return negatedNormalForm(children.get(0));
        }
        if (operator == Operator.AND || operator == Operator.CONJUNCTION) {
            return fold(Operator.OR, mapAll(children, true));
        }
        if (operator == Operator.OR || operator == Operator.DISJUNCTION) {
            return fold(Operator.AND, mapAll(children, true));
        }
        return negatedNormalForm(evaluate(operator, children));
    }

    /** Atomi, letterali, forme canoniche e costanti ⊤/⊥: nulla da riscrivere. */
    private static boolean isAtomicForm(Proposition p) {
        return p.getKind() != Proposition.Kind.TREE || p.truthValue().isPresent();
    }

    private List<Proposition> mapAll(List<Proposition> children, boolean negated) {
        List<Proposition> result = new ArrayList<>(children.size());
        for (Proposition child : children) {
            result.add(negated ? negatedNormalForm(child) : negationNormalForm(child));
        }
        return result;
    }

    //endregion

    //region PIEGATURE N-ARIE

    /**
     * Piega una sequenza con un operatore binario secondo la sua direzione.
     *
     * @throws UndefinedOperatorBehaviorException se la sequenza è vuota e l'operatore non ha elemento neutro
     */
    public Proposition fold(LogicalOperator operator, List<? extends Proposition> parts) {
        if (operator == Operator.CONJUNCTION) {
            return fold(Operator.AND, parts);
        }
        if (operator == Operator.DISJUNCTION) {
            return fold(Operator.OR, parts);
        }
        if (operator.getArity().value() != 2) {
            throw new IllegalArgumentException("La piegatura richiede un operatore binario: " + operator.getName());
        }
        if (parts.isEmpty()) {
            Optional<Operator> identity = catalog.leftIdentity(operator).or(() -> catalog.rightIdentity(operator));
            return identity.map(e -> (Proposition) Tree.constant(e == Operator.TAUTOLOGY))
                    .orElseThrow(() -> new UndefinedOperatorBehaviorException(
                            "Piegatura vuota di '" + operator.getName() + "' senza elemento neutro"));
        }
        if (catalog.foldDirection(operator) == FoldDirection.RIGHT) {
            Proposition acc = parts.get(parts.size() - 1);
            for (int i = parts.size() - 2; i >= 0; i--) {
                acc = apply(operator, parts.get(i), acc);
            }
            return acc;
        }
        Proposition acc = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            acc = apply(operator, acc, parts.get(i));
        }
        return acc;
    }

    public Proposition conjunction(List<? extends Proposition> parts) {
        return fold(Operator.AND, parts);
    }

    public Proposition disjunction(List<? extends Proposition> parts) {
        return fold(Operator.OR, parts);
    }

    //endregion
}
