package org.logica.operators;

import org.logica.propositions.Proposition;

/**
 * Metadati algebrici di un operatore registrato nel catalogo.
 *
 * I campi opzionali (elementi neutri, duale, converso, regola) valgono {@code null}
 * quando la proprietà non esiste o non è stata scoperta; il catalogo li espone
 * come {@link java.util.Optional} o lancia {@link UndefinedOperatorBehaviorException}.
 *
 * @param operator operatore descritto
 * @param commutative esito della verifica di commutatività
 * @param associative esito della verifica di associatività
 * @param leftIdentity costante di verità e tale che e op x = x, oppure null
 * @param rightIdentity costante di verità e tale che x op e = x, oppure null
 * @param dual operatore duale, oppure null se non scoperto
 * @param converse operatore converso, oppure null se non scoperto
 * @param foldDirection direzione usata per le catene n-arie
 * @param rule regola di riscrittura sui segnaposto $1..$n, null per i primitivi
 */
public record OperatorProperties(
        LogicalOperator operator,
        PropertyStatus commutative,
        PropertyStatus associative,
        Operator leftIdentity,
        Operator rightIdentity,
        LogicalOperator dual,
        LogicalOperator converse,
        FoldDirection foldDirection,
        Proposition rule) {

    public OperatorProperties {
        if (operator == null || commutative == null || associative == null || foldDirection == null) {
            throw new IllegalArgumentException("Operatore, stato delle proprietà e direzione sono obbligatori");
        }
        if (leftIdentity != null && !leftIdentity.isTruthConstant()) {
            throw new IllegalArgumentException("L'elemento neutro sinistro deve essere ⊤ o ⊥");
        }
        if (rightIdentity != null && !rightIdentity.isTruthConstant()) {
            throw new IllegalArgumentException("L'elemento neutro destro deve essere ⊤ o ⊥");
        }
    }

    OperatorProperties withDual(LogicalOperator newDual) {
        return new OperatorProperties(operator, commutative, associative, leftIdentity, rightIdentity,
                newDual, converse, foldDirection, rule);
    }

    OperatorProperties withConverse(LogicalOperator newConverse) {
        return new OperatorProperties(operator, commutative, associative, leftIdentity, rightIdentity,
                dual, newConverse, foldDirection, rule);
    }
}
