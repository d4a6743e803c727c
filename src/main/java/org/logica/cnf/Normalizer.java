package org.logica.cnf;

import org.logica.evaluation.Evaluator;
import org.logica.operators.Operator;
import org.logica.propositions.Clause;
import org.logica.propositions.Literal;
import org.logica.propositions.Normal;
import org.logica.propositions.Proposition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * NORMALIZZATORE - Conversione in Forma Normale Congiuntiva o Disgiuntiva
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Forma normale negativa (regole espanse, negazioni sugli atomi)
 * 2. Ricorsione strutturale: nodi dell'operatore esterno concatenano le clausole,
 *    nodi del duale distribuiscono (prodotto cartesiano con unione dei letterali)
 * 3. Eliminazione duplicati in ordine di prima inserzione e collasso sulla clausola vuota
 *
 * Una forma normale già nel formato richiesto viene restituita invariata.
 */
public class Normalizer {

    private static final Logger LOGGER = Logger.getLogger(Normalizer.class.getName());

    private final Evaluator evaluator;

    public Normalizer(Evaluator evaluator) {
        if (evaluator == null) {
            throw new IllegalArgumentException("Il valutatore non può essere null");
        }
        this.evaluator = evaluator;
    }

    private static final class StandardHolder {
        static final Normalizer STANDARD = new Normalizer(Evaluator.standard());
    }

    public static Normalizer standard() {
        return StandardHolder.STANDARD;
    }

    /**
     * METODO PRINCIPALE - Forma normale equivalente alla proposizione
     *
     * @param target {@link Operator#AND} per la CNF, {@link Operator#OR} per la DNF
     * @param p proposizione da normalizzare
     * @return forma normale logicamente equivalente
     * @throws IllegalArgumentException se target non è ∧/∨ o p è null
     */
    public Normal normalize(Operator target, Proposition p) {
        if (target == null || !target.isAndOr()) {
            throw new IllegalArgumentException("La forma normale richiede AND o OR, trovato: " + target);
        }
        if (p == null) {
            throw new IllegalArgumentException("La proposizione da normalizzare non può essere null");
        }
        if (p instanceof Normal && ((Normal) p).getOperator() == target) {
            return (Normal) p;
        }

        LOGGER.fine(() -> "Inizio conversione " + (target == Operator.AND ? "CNF" : "DNF") + " per: " + p);
        Proposition nnf = evaluator.negationNormalForm(p);
        LOGGER.finest(() -> "Dopo forma normale negativa: " + nnf);

        List<Clause> clauses = clausesOf(target, nnf);
        Normal result = collapse(target, Normal.of(target, clauses));
        LOGGER.fine(() -> "Conversione completata: " + result.getClauses().size() + " clausole");
        return result;
    }

    /**
     * Clausole dell'operatore interno la cui combinazione con target equivale a q.
     * Una lista vuota è l'elemento neutro di target.
     */
    private List<Clause> clausesOf(Operator target, Proposition q) {
        Operator inner = target.andOrDual();
        switch (q.getKind()) {
            case CONSTANT, VARIABLE, LITERAL -> {
                return List.of(Clause.of(inner, q.toLiteral()));
            }
            case CLAUSE -> {
                Clause clause = (Clause) q;
                if (clause.getOperator() == inner) {
                    return List.of(clause);
                }
                return singletons(inner, clause.getLiterals());
            }
            case NORMAL -> {
                Normal normal = (Normal) q;
                if (normal.getOperator() == target) {
                    return normal.getClauses();
                }
                List<List<Clause>> factors = new ArrayList<>();
                for (Clause clause : normal.getClauses()) {
                    factors.add(singletons(inner, clause.getLiterals()));
                }
                return distribute(inner, factors);
            }
            default -> {
                return treeClauses(target, q);
            }
        }
    }

    private List<Clause> treeClauses(Operator target, Proposition tree) {
        Operator inner = target.andOrDual();
        Optional<Boolean> value = tree.truthValue();
        if (value.isPresent()) {
            boolean neutral = target == Operator.AND;
            return value.get() == neutral ? List.of() : List.of(Clause.empty(inner));
        }
        if (tree.getOperator() == target) {
            List<Clause> result = new ArrayList<>();
            for (Proposition child : tree.children()) {
                result.addAll(clausesOf(target, child));
            }
            return result;
        }
        if (tree.getOperator() == inner) {
            List<List<Clause>> factors = new ArrayList<>();
            for (Proposition child : tree.children()) {
                factors.add(clausesOf(target, child));
            }
            return distribute(inner, factors);
        }
        throw new IllegalStateException("Nodo inatteso dopo la forma normale negativa: " + tree);
    }

    /** Prodotto cartesiano dei fattori, unendo i letterali delle clausole scelte. */
    private static List<Clause> distribute(Operator inner, List<List<Clause>> factors) {
        List<Clause> product = List.of(Clause.empty(inner));
        for (List<Clause> factor : factors) {
            List<Clause> next = new ArrayList<>(product.size() * factor.size());
            for (Clause partial : product) {
                for (Clause clause : factor) {
                    next.add(partial.union(clause));
                }
            }
            product = next;
        }
        return product;
    }

    private static List<Clause> singletons(Operator inner, List<Literal> literals) {
        List<Clause> result = new ArrayList<>(literals.size());
        for (Literal literal : literals) {
            result.add(Clause.of(inner, literal));
        }
        return result;
    }

    /** Una clausola vuota assorbe tutte le altre. */
    private static Normal collapse(Operator target, Normal normal) {
        for (Clause clause : normal.getClauses()) {
            if (clause.isEmpty()) {
                return Normal.of(target, clause);
            }
        }
        return normal;
    }
}
