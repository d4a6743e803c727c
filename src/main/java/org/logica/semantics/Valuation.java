package org.logica.semantics;

import org.logica.operators.Operator;
import org.logica.propositions.Atom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assegnamento di valori di verità ad atomi, nell'ordine in cui gli atomi sono stati forniti.
 *
 * @param values mappa ordinata e non modificabile atomo → valore
 */
public record Valuation(Map<Atom, Boolean> values) {

    public Valuation {
        if (values == null || values.containsKey(null) || values.containsValue(null)) {
            throw new IllegalArgumentException("Una valutazione non può contenere atomi o valori null");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Valuation of(Map<Atom, Boolean> values) {
        return new Valuation(values);
    }

    public Optional<Boolean> get(Atom atom) {
        return Optional.ofNullable(values.get(atom));
    }

    public boolean contains(Atom atom) {
        return values.containsKey(atom);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + (e.getValue() ? Operator.TAUTOLOGY : Operator.CONTRADICTION).getSymbol())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
