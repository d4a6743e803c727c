package org.logica.semantics;

import org.logica.propositions.Atom;
import org.logica.propositions.Proposition;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Tutte le 2^n valutazioni di n atomi distinti.
 *
 * ORDINE: il primo atomo varia più velocemente e ogni atomo assume prima vero poi falso,
 * quindi la prima valutazione è tutta vera e l'ultima tutta falsa.
 */
public final class Valuations {

    /** Oltre questo numero di atomi il contatore a 64 bit non basta. */
    public static final int MAX_ATOMS = 62;

    private Valuations() {
    }

    public static Iterable<Valuation> of(Proposition p) {
        return of(p.atomList());
    }

    /**
     * @throws IllegalArgumentException se gli atomi distinti sono più di {@value #MAX_ATOMS}
     */
    public static Iterable<Valuation> of(List<? extends Atom> atoms) {
        List<Atom> unique = new ArrayList<>(new LinkedHashSet<>(atoms));
        if (unique.size() > MAX_ATOMS) {
            throw new IllegalArgumentException("Troppi atomi per enumerare le valutazioni: " + unique.size());
        }
        return () -> new ValuationIterator(unique);
    }

    /** Numero di valutazioni di n atomi. */
    public static long count(int atoms) {
        return 1L << atoms;
    }

    private static final class ValuationIterator implements Iterator<Valuation> {

        private final List<Atom> atoms;
        private final long total;
        private long row;

        ValuationIterator(List<Atom> atoms) {
            this.atoms = atoms;
            this.total = count(atoms.size());
        }

        @Override
        public boolean hasNext() {
            return row < total;
        }

        @Override
        public Valuation next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Valutazioni esaurite");
            }
            Map<Atom, Boolean> values = new LinkedHashMap<>();
            for (int i = 0; i < atoms.size(); i++) {
                values.put(atoms.get(i), ((row >> i) & 1L) == 0L);
            }
            row++;
            return new Valuation(values);
        }
    }
}
