package org.logica.cnf;

import org.logica.evaluation.Evaluator;
import org.logica.operators.CustomOperator;
import org.logica.operators.Operator;
import org.logica.operators.OperatorCatalog;
import org.logica.propositions.Clause;
import org.logica.propositions.Literal;
import org.logica.propositions.Normal;
import org.logica.propositions.Tree;
import org.logica.propositions.Variable;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Conversione in forma normale congiuntiva e disgiuntiva. */
public class NormalizerTest {

    private final Normalizer normalizer = Normalizer.standard();

    private final Variable p = Variable.of("p");
    private final Variable q = Variable.of("q");
    private final Variable r = Variable.of("r");

    @Test void testDistributionIntoCnf() {
        Normal cnf = normalizer.normalize(Operator.AND, Tree.of(Operator.OR, p, Tree.of(Operator.AND, q, r)));

        assertThat(cnf, is(Normal.of(Operator.AND,
                Clause.of(Operator.OR, Literal.positive(p), Literal.positive(q)),
                Clause.of(Operator.OR, Literal.positive(p), Literal.positive(r)))));
        assertThat(cnf.getClauses(), hasSize(2));
        assertThat(cnf, hasToString("(p ∨ q) ∧ (p ∨ r)"));
    }

    @Test void testDistributionIntoDnf() {
        Normal dnf = normalizer.normalize(Operator.OR, Tree.of(Operator.AND, p, Tree.of(Operator.OR, q, r)));

        assertThat(dnf, is(Normal.of(Operator.OR,
                Clause.of(Operator.AND, Literal.positive(p), Literal.positive(q)),
                Clause.of(Operator.AND, Literal.positive(p), Literal.positive(r)))));
    }

    @Test void testNormalizationIsIdempotent() {
        Normal cnf = normalizer.normalize(Operator.AND, Tree.of(Operator.XOR, p, q));
        assertThat(normalizer.normalize(Operator.AND, cnf), sameInstance(cnf));
        assertThat(cnf, is(Normal.of(Operator.AND,
                Clause.of(Operator.OR, Literal.positive(p), Literal.positive(q)),
                Clause.of(Operator.OR, Literal.negative(p), Literal.negative(q)))));
    }

    @Test void testRulesAreExpandedBeforeDistribution() {
        assertThat(Tree.of(Operator.IMPLY, p, q).toNormal(Operator.AND),
                is(Normal.of(Operator.AND, Clause.of(Operator.OR, Literal.negative(p), Literal.positive(q)))));

        Normal negated = normalizer.normalize(Operator.AND, Tree.of(Operator.NAND, p, q));
        assertThat(negated, is(Normal.of(Operator.AND,
                Clause.of(Operator.OR, Literal.negative(p), Literal.negative(q)))));
    }

    @Test void testConstants() {
        assertThat(normalizer.normalize(Operator.AND, Tree.TRUE).truthValue(), is(Optional.of(true)));
        assertThat(normalizer.normalize(Operator.AND, Tree.FALSE).truthValue(), is(Optional.of(false)));
        assertThat(normalizer.normalize(Operator.OR, Tree.FALSE).getClauses(), hasSize(0));
        // una clausola vuota assorbe le altre
        Normal absorbed = normalizer.normalize(Operator.AND,
                Tree.of(Operator.AND, p, Tree.of(Operator.AND, q, Tree.FALSE)));
        assertThat(absorbed.truthValue(), is(Optional.of(false)));
        assertThat(absorbed.getClauses(), hasSize(1));
    }

    @Test void testChildlessTrees() {
        assertThat(normalizer.normalize(Operator.AND, Tree.of(Operator.CONJUNCTION)).truthValue(),
                is(Optional.of(true)));
        assertThat(normalizer.normalize(Operator.OR, Tree.of(Operator.DISJUNCTION)).truthValue(),
                is(Optional.of(false)));
        assertThat(normalizer.normalize(Operator.AND,
                Tree.of(Operator.AND, p, Tree.of(Operator.DISJUNCTION))).truthValue(), is(Optional.of(false)));
        assertThat(normalizer.normalize(Operator.AND,
                Tree.of(Operator.OR, p, Tree.of(Operator.NOT, Tree.of(Operator.CONJUNCTION)))),
                is(Normal.of(Operator.AND, Clause.of(Operator.OR, Literal.positive(p)))));

        OperatorCatalog.Builder builder = OperatorCatalog.builder();
        CustomOperator top = builder.register("top2", "⊤₂", Tree.of(Operator.NOT, Tree.FALSE)).operator();
        Normalizer extended = new Normalizer(new Evaluator(builder.build()));
        assertThat(extended.normalize(Operator.AND, Tree.of(top)).truthValue(), is(Optional.of(true)));
        assertThat(extended.normalize(Operator.AND, Tree.of(Operator.AND, q, Tree.of(top))),
                is(Normal.of(Operator.AND, Clause.of(Operator.OR, Literal.positive(q)))));
    }

    @Test void testCanonicalFormsSwitchOperator() {
        Normal cnf = Normal.of(Operator.AND,
                Clause.of(Operator.OR, Literal.positive(p), Literal.positive(q)),
                Clause.of(Operator.OR, Literal.positive(r)));
        Normal dnf = normalizer.normalize(Operator.OR, cnf);

        assertThat(dnf, is(Normal.of(Operator.OR,
                Clause.of(Operator.AND, Literal.positive(p), Literal.positive(r)),
                Clause.of(Operator.AND, Literal.positive(q), Literal.positive(r)))));
        assertThat(normalizer.normalize(Operator.AND, Literal.negative(p)),
                is(Normal.of(Operator.AND, Clause.of(Operator.OR, Literal.negative(p)))));
    }

    @Test void testRejectsInvalidTarget() {
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(Operator.XOR, p));
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(Operator.AND, null));
    }
}
