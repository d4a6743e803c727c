package org.logica.semantics;

import org.logica.operators.Operator;
import org.logica.propositions.Literal;
import org.logica.propositions.Proposition;
import org.logica.propositions.Tree;
import org.logica.propositions.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;

/** Raggruppamento delle colonne e stampa della tabella di verità. */
public class TruthTableTest {

    private final Semantics semantics = Semantics.standard();

    private final Variable p = Variable.of("p");
    private final Variable q = Variable.of("q");

    @Test void testColumnsAreGroupedByInterpretation() {
        Proposition excludedMiddle = Tree.of(Operator.OR, p, Literal.negative(p));
        Proposition conjunction = Tree.of(Operator.AND, p, q);
        Proposition idempotent = Tree.of(Operator.AND, p, p);

        TruthTable table = TruthTable.of(semantics, excludedMiddle, conjunction, idempotent);

        assertThat(table.getHeader(), is(List.of(
                List.of(excludedMiddle),
                List.of(p, idempotent),
                List.<Proposition>of(q),
                List.of(conjunction))));
        assertThat(table.getRowCount(), is(4));
        assertThat(table.getColumnCount(), is(4));
        assertThat(table.getValuations().get(1).get(p).get(), is(false));
    }

    @Test void testCells() {
        TruthTable table = TruthTable.of(semantics, Tree.of(Operator.AND, p, q));
        // colonne: p, q, p ∧ q
        assertThat(table.get(0, 2), is(true));
        assertThat(table.get(1, 0), is(false));
        assertThat(table.get(1, 1), is(true));
        assertThat(table.get(1, 2), is(false));
        assertThat(table.get(3, 2), is(false));
    }

    @Test void testRender() {
        TruthTable table = TruthTable.of(semantics, Tree.of(Operator.AND, p, q));
        String[] lines = table.render().split("\n");
        assertThat(lines.length, is(6));
        assertThat(lines[0], is("p | q | p ∧ q"));
        assertThat(lines[1], is("-------------"));
        assertThat(lines[2], startsWith("⊤ | ⊤ | ⊤"));
        assertThat(table.toString(), is(table.render()));
    }

    @Test void testConstantOnlyTable() {
        TruthTable table = TruthTable.of(semantics, Tree.TRUE);
        assertThat(table.getRowCount(), is(1));
        assertThat(table.getHeader(), is(List.of(List.<Proposition>of(Tree.TRUE))));
        assertThat(table.get(0, 0), is(true));
    }
}
