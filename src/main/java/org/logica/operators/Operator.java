package org.logica.operators;

import java.util.Arrays;
import java.util.Optional;

/**
 * CONNETTIVI PREDEFINITI - Enumerazione chiusa degli operatori logici di base
 *
 * Ogni costante porta solo nome, simbolo e arità. Le proprietà algebriche
 * (duale, converso, elementi neutri, regola di riscrittura) sono registrate in
 * {@link OperatorCatalog#standard()}.
 *
 * Operatori primitivi (valutati direttamente): ⊤, ⊥, 𝒾, ¬, ∧, ∨.
 * Tutti gli altri si riducono ai primitivi tramite la propria regola.
 */
public enum Operator implements LogicalOperator {

    //region NULLARI
    TAUTOLOGY("tautology", "⊤", Arity.NULLARY),
    CONTRADICTION("contradiction", "⊥", Arity.NULLARY),
    //endregion

    //region UNARI
    IDENTITY("identity", "𝒾", Arity.UNARY),
    NOT("not", "¬", Arity.UNARY),
    //endregion

    //region BINARI
    AND("and", "∧", Arity.BINARY),
    NAND("nand", "⊼", Arity.BINARY),
    NOR("nor", "⊽", Arity.BINARY),
    OR("or", "∨", Arity.BINARY),
    XOR("xor", "↮", Arity.BINARY),
    XNOR("xnor", "↔", Arity.BINARY),
    IMPLY("imply", "→", Arity.BINARY),
    NOT_IMPLY("not_imply", "↛", Arity.BINARY),
    CONVERSE_IMPLY("converse_imply", "←", Arity.BINARY),
    NOT_CONVERSE_IMPLY("not_converse_imply", "↚", Arity.BINARY),
    //endregion

    //region N-ARI
    CONJUNCTION("conjunction", "⋀", Arity.UNBOUNDED),
    DISJUNCTION("disjunction", "⋁", Arity.UNBOUNDED);
    //endregion

    private final String name;
    private final String symbol;
    private final Arity arity;

    Operator(String name, String symbol, Arity arity) {
        this.name = name;
        this.symbol = symbol;
        this.arity = arity;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public Arity getArity() {
        return arity;
    }

    /** Vero per i due operatori su cui si basano clausole e forme normali. */
    public boolean isAndOr() {
        return this == AND || this == OR;
    }

    /** Vero per ⊤ e ⊥. */
    public boolean isTruthConstant() {
        return this == TAUTOLOGY || this == CONTRADICTION;
    }

    /**
     * Operatori la cui semantica è calcolata direttamente, senza regola di riscrittura.
     */
    public boolean isPrimitive() {
        return switch (this) {
            case TAUTOLOGY, CONTRADICTION, IDENTITY, NOT, AND, OR -> true;
            default -> false;
        };
    }

    /**
     * Operatore duale di AND/OR, usato da clausole e forme normali.
     *
     * @throws IllegalArgumentException se l'operatore non è AND né OR
     */
    public Operator andOrDual() {
        return switch (this) {
            case AND -> OR;
            case OR -> AND;
            default -> throw new IllegalArgumentException("Operatore atteso AND o OR, trovato: " + name);
        };
    }

    public static Optional<Operator> fromName(String name) {
        return Arrays.stream(values()).filter(op -> op.name.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
