package org.logica.semantics;

import org.logica.propositions.Atom;
import org.logica.solver.Solutions;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Modelli di una proposizione ristretti ai suoi atomi, letti da un iteratore di soluzioni
 * della codifica di Tseytin. Va chiuso dopo l'uso, preferibilmente con try-with-resources.
 */
public final class Models implements Iterator<Valuation>, AutoCloseable {

    private final Solutions solutions;
    private final List<Atom> atoms;

    Models(Solutions solutions, List<Atom> atoms) {
        this.solutions = solutions;
        this.atoms = List.copyOf(atoms);
    }

    /** Atomi dell'utente, indicizzati da 1 nella codifica. */
    public List<Atom> getAtoms() {
        return atoms;
    }

    @Override
    public boolean hasNext() {
        return solutions.hasNext();
    }

    @Override
    public Valuation next() {
        boolean[] model = solutions.next();
        Map<Atom, Boolean> values = new LinkedHashMap<>();
        for (int i = 0; i < atoms.size(); i++) {
            values.put(atoms.get(i), model[i]);
        }
        return new Valuation(values);
    }

    public boolean isReleased() {
        return solutions.isReleased();
    }

    @Override
    public void close() {
        solutions.close();
    }
}
