package org.logica.cnf;

import org.logica.propositions.Atom;
import org.logica.propositions.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Risultato della trasformazione di Tseytin: clausole su letterali interi e tabella degli atomi.
 *
 * Il letterale {@code k > 0} indica l'atomo {@code atoms.get(k - 1)}, {@code -k} la sua negazione.
 * Gli atomi dell'utente precedono sempre le variabili ausiliarie.
 *
 * @param clauses clausole in forma DIMACS (senza lo zero finale)
 * @param atoms atomi indicizzati da 1
 */
public record TseytinEncoding(List<List<Integer>> clauses, List<Atom> atoms) {

    public TseytinEncoding {
        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            copy.add(List.copyOf(clause));
        }
        clauses = List.copyOf(copy);
        atoms = List.copyOf(atoms);
    }

    public static boolean isAuxiliary(Atom atom) {
        return atom instanceof Variable && ((Variable) atom).isAuxiliary();
    }

    /** Atomi della formula originale, nell'ordine di prima occorrenza. */
    public List<Atom> userAtoms() {
        List<Atom> result = new ArrayList<>();
        for (Atom atom : atoms) {
            if (!isAuxiliary(atom)) {
                result.add(atom);
            }
        }
        return result;
    }

    public int getVariableCount() {
        return atoms.size();
    }

    public int getClauseCount() {
        return clauses.size();
    }

    /** Indice DIMACS dell'atomo, 0 se assente. */
    public int indexOf(Atom atom) {
        return atoms.indexOf(atom) + 1;
    }

    public String toDimacs() {
        return Dimacs.write(this);
    }

    @Override
    public String toString() {
        return String.format("TseytinEncoding{clausole=%d, variabili=%d, ausiliarie=%d}",
                clauses.size(), atoms.size(), atoms.size() - userAtoms().size());
    }
}
