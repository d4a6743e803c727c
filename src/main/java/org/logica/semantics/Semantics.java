package org.logica.semantics;

import org.logica.cnf.TseytinEncoding;
import org.logica.cnf.TseytinTransformer;
import org.logica.evaluation.Evaluator;
import org.logica.operators.Operator;
import org.logica.propositions.Atom;
import org.logica.propositions.Proposition;
import org.logica.propositions.Tree;
import org.logica.solver.CdclEngine;
import org.logica.solver.SatEngine;
import org.logica.solver.Solutions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * PREDICATI SEMANTICI - Soddisfacibilità, equivalenza e ordinamento tramite motore SAT
 *
 * Ogni predicato si riduce a una domanda di soddisfacibilità sulla codifica di Tseytin:
 * • contraddizione: nessun modello
 * • tautologia: la negazione è una contraddizione
 * • equivalenza: p ↮ q è una contraddizione (per due atomi basta l'uguaglianza)
 * • ordinamento: contraddizione < contingenza < tautologia
 *
 * Le costanti di verità sono risolte senza interpellare il motore.
 */
public class Semantics {

    private static final Logger LOGGER = Logger.getLogger(Semantics.class.getName());

    private final Evaluator evaluator;
    private final TseytinTransformer transformer;
    private final SatEngine engine;

    public Semantics(Evaluator evaluator, SatEngine engine) {
        if (evaluator == null || engine == null) {
            throw new IllegalArgumentException("Valutatore e motore SAT sono obbligatori");
        }
        this.evaluator = evaluator;
        this.transformer = new TseytinTransformer(evaluator);
        this.engine = engine;
    }

    /** Semantica sul catalogo predefinito con il motore CDCL senza restart. */
    public static Semantics standard() {
        return new Semantics(Evaluator.standard(), new CdclEngine());
    }

    public Evaluator getEvaluator() {
        return evaluator;
    }

    //region MODELLI

    /**
     * Modelli di p ristretti ai suoi atomi, uno per ogni assegnamento che rende p vera.
     * L'iteratore possiede una risorsa del motore e va chiuso.
     */
    public Models solutions(Proposition p) {
        TseytinEncoding encoding = transformer.transform(p);
        Solutions raw = engine.solve(encoding.clauses(), encoding.getVariableCount());
        return new Models(raw, encoding.userAtoms());
    }

    //endregion

    //region PREDICATI

    public boolean isContradiction(Proposition p) {
        Optional<Boolean> value = p.truthValue();
        if (value.isPresent()) {
            return !value.get();
        }
        try (Models models = solutions(p)) {
            boolean contradiction = !models.hasNext();
            LOGGER.fine(() -> "Contraddizione " + p + ": " + contradiction);
            return contradiction;
        }
    }

    public boolean isTautology(Proposition p) {
        return isContradiction(evaluator.apply(Operator.NOT, p));
    }

    /** Vero se p è una tautologia o una contraddizione. */
    public boolean isTruth(Proposition p) {
        return p.truthValue().isPresent() || isTautology(p) || isContradiction(p);
    }

    public boolean isContingency(Proposition p) {
        return !isTruth(p);
    }

    public boolean isSatisfiable(Proposition p) {
        return !isContradiction(p);
    }

    public boolean isFalsifiable(Proposition p) {
        return !isTautology(p);
    }

    public boolean isEquisatisfiable(Proposition p, Proposition q) {
        return isSatisfiable(p) == isSatisfiable(q);
    }

    /**
     * Equivalenza logica. Due atomi sono equivalenti solo se uguali; in tutti gli altri
     * casi si verifica che p ↮ q sia una contraddizione.
     */
    public boolean areEquivalent(Proposition p, Proposition q) {
        if (p.isAtom() && q.isAtom()) {
            return p.equals(q);
        }
        return isContradiction(evaluator.apply(Operator.XOR, p, q));
    }

    /** p < q nell'ordine contraddizione < contingenza < tautologia. */
    public boolean isLessThan(Proposition p, Proposition q) {
        return isContradiction(p) ? isSatisfiable(q) : isFalsifiable(p) && isTautology(q);
    }

    public TruthClass classify(Proposition p) {
        if (isContradiction(p)) {
            return TruthClass.CONTRADICTION;
        }
        return isTautology(p) ? TruthClass.TAUTOLOGY : TruthClass.CONTINGENCY;
    }

    /** Ordinamento per classe di verità; proposizioni della stessa classe risultano pari. */
    public Comparator<Proposition> comparator() {
        return Comparator.comparing(this::classify);
    }

    //endregion

    //region INTERPRETAZIONE

    /**
     * Sostituisce gli atomi presenti nella valutazione con ⊤/⊥ e semplifica.
     * Gli atomi non valutati restano invariati.
     */
    public Proposition interpret(Valuation valuation, Proposition p) {
        Map<Atom, Boolean> values = valuation.values();
        Proposition substituted = p.map(atom -> {
            Boolean value = values.get(atom);
            return value == null ? atom : Tree.constant(value);
        });
        return evaluator.simplify(substituted);
    }

    /**
     * Valore di verità di p sotto una valutazione completa.
     *
     * @throws IllegalArgumentException se la valutazione non copre tutti gli atomi di p
     */
    public boolean evaluate(Valuation valuation, Proposition p) {
        Proposition result = interpret(valuation, p);
        return result.truthValue().orElseThrow(() -> new IllegalArgumentException(
                "Valutazione incompleta per " + p + ": " + valuation));
    }

    /** Valori di verità di p per ogni valutazione dei suoi atomi, nell'ordine di {@link Valuations}. */
    public List<Boolean> interpretations(Proposition p) {
        List<Boolean> result = new ArrayList<>();
        for (Valuation valuation : Valuations.of(p)) {
            result.add(evaluate(valuation, p));
        }
        return result;
    }

    //endregion
}
