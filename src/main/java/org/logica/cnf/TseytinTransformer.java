package org.logica.cnf;

import org.logica.evaluation.Evaluator;
import org.logica.operators.Operator;
import org.logica.propositions.Atom;
import org.logica.propositions.Clause;
import org.logica.propositions.Literal;
import org.logica.propositions.Normal;
import org.logica.propositions.Proposition;
import org.logica.propositions.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * TRASFORMAZIONE DI TSEYTIN - Clausole equisoddisfacibili in dimensione lineare
 *
 * Visita la proposizione in post-ordine introducendo una variabile ausiliaria
 * ({@code ##1, ##2, ...}) per ogni sotto-espressione composta e le clausole che
 * ne fissano l'equivalenza:
 * • x ↔ (a1 ∧ ... ∧ an): (¬x ∨ ai) per ogni i, (x ∨ ¬a1 ∨ ... ∨ ¬an)
 * • x ↔ (a1 ∨ ... ∨ an): (x ∨ ¬ai) per ogni i, (¬x ∨ a1 ∨ ... ∨ an)
 * • x ↔ ¬a: (¬x ∨ ¬a), (x ∨ a)
 * • x ↔ ⊤ / ⊥: clausola unitaria
 *
 * Sotto-espressioni strutturalmente uguali condividono la stessa ausiliaria.
 * Gli altri operatori vengono prima riscritti con la loro regola. Una clausola
 * unitaria finale afferma la radice.
 */
public class TseytinTransformer {

    private static final Logger LOGGER = Logger.getLogger(TseytinTransformer.class.getName());

    private final Evaluator evaluator;

    public TseytinTransformer(Evaluator evaluator) {
        if (evaluator == null) {
            throw new IllegalArgumentException("Il valutatore non può essere null");
        }
        this.evaluator = evaluator;
    }

    public static TseytinTransformer standard() {
        return new TseytinTransformer(Evaluator.standard());
    }

    /**
     * @param p proposizione da codificare
     * @return codifica equisoddisfacibile; le soluzioni ristrette agli atomi dell'utente
     *         sono esattamente i modelli di p
     */
    public TseytinEncoding transform(Proposition p) {
        if (p == null) {
            throw new IllegalArgumentException("La proposizione da trasformare non può essere null");
        }
        Encoding state = new Encoding();
        for (Atom atom : p.atoms()) {
            state.index(atom);
        }
        int root = state.encode(p);
        state.clauses.add(List.of(root));

        TseytinEncoding result = new TseytinEncoding(state.clauses, new ArrayList<>(state.indices.keySet()));
        LOGGER.fine(() -> "Tseytin completata: " + result);
        return result;
    }

    /** Stato di una singola trasformazione. */
    private final class Encoding {

        private final Map<Atom, Integer> indices = new LinkedHashMap<>();
        private final Map<Proposition, Integer> shared = new HashMap<>();
        private final List<List<Integer>> clauses = new ArrayList<>();
        private int auxiliaryCount;

        int index(Atom atom) {
            Integer index = indices.get(atom);
            if (index == null) {
                index = indices.size() + 1;
                indices.put(atom, index);
            }
            return index;
        }

        int encode(Proposition q) {
            switch (q.getKind()) {
                case CONSTANT:
                case VARIABLE:
                    return index((Atom) q);
                case LITERAL: {
                    Literal literal = (Literal) q;
                    int atom = index(literal.getAtom());
                    return literal.isPositive() ? atom : -atom;
                }
                default:
                    break;
            }
            Integer known = shared.get(q);
            if (known != null) {
                return known;
            }
            int result = encodeCompound(q);
            shared.put(q, result);
            return result;
        }

        private int encodeCompound(Proposition q) {
            Optional<Boolean> value = q.truthValue();
            if (value.isPresent() && q.children().isEmpty()) {
                int x = fresh();
                clauses.add(List.of(value.get() ? x : -x));
                return x;
            }
            if (q instanceof Clause) {
                Clause clause = (Clause) q;
                List<Integer> parts = new ArrayList<>();
                for (Literal literal : clause.getLiterals()) {
                    parts.add(encode(literal));
                }
                return gate(clause.getOperator() == Operator.AND, parts);
            }
            if (q instanceof Normal) {
                Normal normal = (Normal) q;
                List<Integer> parts = new ArrayList<>();
                for (Clause clause : normal.getClauses()) {
                    parts.add(encode(clause));
                }
                return gate(normal.getOperator() == Operator.AND, parts);
            }

            if (q.getOperator() == Operator.IDENTITY) {
                return encode(q.children().get(0));
            }
            if (q.getOperator() == Operator.NOT) {
                int a = encode(q.children().get(0));
                int x = fresh();
                clauses.add(List.of(-x, -a));
                clauses.add(List.of(x, a));
                return x;
            }
            if (q.getOperator() == Operator.AND || q.getOperator() == Operator.CONJUNCTION
                    || q.getOperator() == Operator.OR || q.getOperator() == Operator.DISJUNCTION) {
                List<Integer> parts = new ArrayList<>();
                for (Proposition child : q.children()) {
                    parts.add(encode(child));
                }
                boolean conjunction = q.getOperator() == Operator.AND || q.getOperator() == Operator.CONJUNCTION;
                return gate(conjunction, parts);
            }
            return encode(evaluator.evaluate(q.getOperator(), q.children()));
        }

        private int gate(boolean conjunction, List<Integer> parts) {
            int x = fresh();
            int sign = conjunction ? 1 : -1;
            List<Integer> closing = new ArrayList<>(parts.size() + 1);
            closing.add(sign * x);
            for (int a : parts) {
                clauses.add(List.of(-sign * x, sign * a));
                closing.add(-sign * a);
            }
            clauses.add(closing);
            return x;
        }

        private int fresh() {
            auxiliaryCount++;
            return index(Variable.auxiliary(auxiliaryCount));
        }
    }
}
