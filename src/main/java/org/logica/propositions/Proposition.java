package org.logica.propositions;

import org.logica.cnf.Normalizer;
import org.logica.operators.LogicalOperator;
import org.logica.operators.Operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * PROPOSIZIONE - Radice del modello dati immutabile delle formule logiche
 *
 * Varianti (vedi {@link Kind}):
 * • {@link Constant} e {@link Variable}: atomi
 * • {@link Literal}: identità o negazione di un atomo, mai annidato
 * • {@link Tree}: operatore applicato a sotto-proposizioni (⊤ e ⊥ sono alberi nullari)
 * • {@link Clause}: letterali senza duplicati uniti da ∧ o ∨
 * • {@link Normal}: clausole del duale unite da ∧ (CNF) o ∨ (DNF)
 *
 * Uguaglianza e hash sono strutturali. Le conversioni restituiscono sempre nuovi oggetti;
 * quelle parziali lanciano {@link NotRepresentableException}.
 */
public abstract class Proposition {

    /** Discriminante delle varianti concrete. */
    public enum Kind {
        CONSTANT,
        VARIABLE,
        LITERAL,
        TREE,
        CLAUSE,
        NORMAL
    }

    Proposition() {
    }

    //region STRUTTURA

    public abstract Kind getKind();

    /**
     * Operatore principale: {@link Operator#IDENTITY} per gli atomi,
     * identità o negazione per i letterali, ∧/∨ per clausole e forme normali.
     */
    public abstract LogicalOperator getOperator();

    /** Figli diretti nell'ordine di stampa: atomo del letterale, letterali, clausole, argomenti. */
    public abstract List<Proposition> children();

    public boolean isAtom() {
        return false;
    }

    /**
     * Valore di verità costante, se la proposizione è ⊤, ⊥ o una forma canonica
     * ridotta al proprio elemento neutro o assorbente.
     */
    public Optional<Boolean> truthValue() {
        return Optional.empty();
    }

    /** Profondità dell'albero sintattico: 0 per le foglie. */
    public int depth() {
        int max = -1;
        for (Proposition child : children()) {
            max = Math.max(max, child.depth());
        }
        return max + 1;
    }

    /** Numero di nodi dell'albero sintattico. */
    public int size() {
        int size = 1;
        for (Proposition child : children()) {
            size += child.size();
        }
        return size;
    }

    //endregion

    //region ATOMI E OPERATORI

    /**
     * Atomi distinti in ordine di prima occorrenza (visita in pre-ordine).
     * L'iterabile è pigro e può essere percorso più volte.
     */
    public Iterable<Atom> atoms() {
        return () -> new AtomIterator(this);
    }

    /** Atomi distinti raccolti in una lista. */
    public List<Atom> atomList() {
        List<Atom> result = new ArrayList<>();
        for (Atom atom : atoms()) {
            result.add(atom);
        }
        return result;
    }

    /** Operatori distinti in pre-ordine; gli atomi non contribuiscono. */
    public List<LogicalOperator> operators() {
        Set<LogicalOperator> found = new LinkedHashSet<>();
        collectOperators(this, found);
        return new ArrayList<>(found);
    }

    private static void collectOperators(Proposition p, Set<LogicalOperator> found) {
        if (p.isAtom()) {
            return;
        }
        found.add(p.getOperator());
        for (Proposition child : p.children()) {
            collectOperators(child, found);
        }
    }

    /**
     * Iteratore in pre-ordine con pila esplicita; gli atomi già restituiti vengono saltati.
     */
    private static final class AtomIterator implements Iterator<Atom> {

        private final Deque<Proposition> stack = new ArrayDeque<>();
        private final Set<Atom> seen = new HashSet<>();
        private Atom next;

        AtomIterator(Proposition root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            while (next == null && !stack.isEmpty()) {
                Proposition current = stack.pop();
                if (current.isAtom()) {
                    Atom atom = (Atom) current;
                    if (seen.add(atom)) {
                        next = atom;
                    }
                } else {
                    List<Proposition> children = current.children();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        stack.push(children.get(i));
                    }
                }
            }
            return next != null;
        }

        @Override
        public Atom next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Nessun altro atomo");
            }
            Atom result = next;
            next = null;
            return result;
        }
    }

    //endregion

    //region TRASFORMAZIONI

    /**
     * Applica {@code f} a ogni atomo e ricostruisce la stessa forma.
     * Quando i risultati non sono più letterali, clausole e forme normali
     * vengono ricostruite come alberi.
     */
    public abstract Proposition map(Function<? super Atom, ? extends Proposition> f);

    /** @throws NotRepresentableException se la proposizione non equivale a un singolo letterale */
    public abstract Literal toLiteral();

    /** Forma ad albero equivalente; sempre definita. */
    public abstract Tree toTree();

    /**
     * Clausola equivalente con l'operatore dato.
     *
     * @param operator {@link Operator#AND} o {@link Operator#OR}
     * @throws NotRepresentableException se la forma non è rappresentabile senza normalizzare
     */
    public abstract Clause toClause(Operator operator);

    /**
     * Forma normale equivalente: CNF con {@link Operator#AND}, DNF con {@link Operator#OR}.
     * Sempre definita, delega al {@link Normalizer} del catalogo predefinito.
     */
    public Normal toNormal(Operator operator) {
        return Normalizer.standard().normalize(operator, this);
    }

    static void requireAndOr(Operator operator) {
        if (operator == null || !operator.isAndOr()) {
            throw new IllegalArgumentException("Operatore atteso AND o OR, trovato: " + operator);
        }
    }

    /** Piega una lista di proposizioni in una catena sinistra di alberi, senza semplificare. */
    static Tree foldTree(Operator operator, List<? extends Proposition> parts) {
        if (parts.isEmpty()) {
            return operator == Operator.AND ? Tree.TRUE : Tree.FALSE;
        }
        if (parts.size() == 1) {
            return parts.get(0).toTree();
        }
        Proposition acc = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            acc = Tree.of(operator, acc, parts.get(i));
        }
        return (Tree) acc;
    }

    //endregion

    //region STAMPA

    /** Vero se, come operando di un operatore binario, la proposizione va racchiusa tra parentesi. */
    boolean needsParentheses() {
        return false;
    }

    static String operand(Proposition p) {
        return p.needsParentheses() ? "(" + p + ")" : p.toString();
    }

    //endregion
}
