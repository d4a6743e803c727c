package org.logica.evaluation;

import org.logica.operators.ArityMismatchException;
import org.logica.operators.CustomOperator;
import org.logica.operators.Operator;
import org.logica.operators.OperatorCatalog;
import org.logica.operators.UndefinedOperatorBehaviorException;
import org.logica.propositions.Clause;
import org.logica.propositions.Literal;
import org.logica.propositions.Normal;
import org.logica.propositions.Proposition;
import org.logica.propositions.Tree;
import org.logica.propositions.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Costruzione semplificante, negazione e passi di riscrittura. */
public class EvaluatorTest {

    private final Evaluator evaluator = Evaluator.standard();

    private final Variable p = Variable.of("p");
    private final Variable q = Variable.of("q");
    private final Variable r = Variable.of("r");

    //region LEGGI DI IDENTITÀ

    @Test void testIdentityLaws() {
        assertThat(evaluator.apply(Operator.AND, p, Tree.TRUE), is(p));
        assertThat(evaluator.apply(Operator.AND, Tree.TRUE, p), is(p));
        assertThat(evaluator.apply(Operator.OR, p, Tree.FALSE), is(p));
        assertThat(evaluator.apply(Operator.XOR, Tree.FALSE, p), is(p));
        assertThat(evaluator.apply(Operator.XNOR, p, Tree.TRUE), is(p));
        assertThat(evaluator.apply(Operator.IMPLY, Tree.TRUE, p), is(p));
        assertThat(evaluator.apply(Operator.NOT_IMPLY, p, Tree.FALSE), is(p));
    }

    @Test void testDominationLaws() {
        assertThat(evaluator.apply(Operator.AND, p, Tree.FALSE), sameInstance(Tree.FALSE));
        assertThat(evaluator.apply(Operator.OR, Tree.TRUE, p), sameInstance(Tree.TRUE));
    }

    @Test void testNoIdentityOnTheWrongSide() {
        assertThat(evaluator.apply(Operator.IMPLY, p, Tree.FALSE), is(Tree.of(Operator.IMPLY, p, Tree.FALSE)));
    }

    @Test void testConstantArgumentsAreEvaluated() {
        assertThat(evaluator.apply(Operator.XOR, Tree.TRUE, Tree.TRUE), sameInstance(Tree.FALSE));
        assertThat(evaluator.apply(Operator.NAND, Tree.TRUE, Tree.FALSE), sameInstance(Tree.TRUE));
        assertThat(evaluator.apply(Operator.IMPLY, true, false), is(false));
        assertThat(evaluator.apply(Operator.TAUTOLOGY, List.of()), sameInstance(Tree.TRUE));
    }

    @Test void testOtherApplicationsStayLazy() {
        assertThat(evaluator.apply(Operator.AND, p, q), is(Tree.of(Operator.AND, p, q)));
        assertThat(evaluator.apply(Operator.XOR, p, p), is(Tree.of(Operator.XOR, p, p)));
        assertThat(evaluator.apply(Operator.IDENTITY, p), is(p));
    }

    @Test void testArityIsChecked() {
        assertThrows(ArityMismatchException.class, () -> evaluator.apply(Operator.AND, p));
        assertThrows(ArityMismatchException.class, () -> evaluator.apply(Operator.NOT, p, q));
        assertThrows(IllegalArgumentException.class, () -> evaluator.apply(Operator.AND, p, null));
    }

    //endregion

    //region NEGAZIONE

    @Test void testDoubleNegation() {
        assertThat(evaluator.apply(Operator.NOT, p), is(Literal.negative(p)));
        assertThat(evaluator.apply(Operator.NOT, evaluator.apply(Operator.NOT, p)), is(p));

        Proposition conjunction = evaluator.apply(Operator.AND, p, q);
        Proposition negated = evaluator.apply(Operator.NOT, conjunction);
        assertThat(negated, is(Tree.of(Operator.NOT, conjunction)));
        assertThat(evaluator.apply(Operator.NOT, negated), is(conjunction));
        assertThat(evaluator.negate(Tree.FALSE), sameInstance(Tree.TRUE));
    }

    @Test void testDeMorganOnCanonicalForms() {
        Clause clause = Clause.of(Operator.AND, Literal.positive(p), Literal.negative(q));
        assertThat(evaluator.negate(clause), is(Clause.of(Operator.OR, Literal.negative(p), Literal.positive(q))));

        Normal dnf = Normal.of(Operator.OR, clause, Clause.of(Operator.AND, Literal.positive(r)));
        assertThat(evaluator.negate(dnf), is(Normal.of(Operator.AND,
                Clause.of(Operator.OR, Literal.negative(p), Literal.positive(q)),
                Clause.of(Operator.OR, Literal.negative(r)))));
    }

    //endregion

    //region RISCRITTURA

    @Test void testEvaluatePushesNegationThroughDual() {
        Proposition result = evaluator.evaluate(Operator.NOT, Tree.of(Operator.AND, p, q));
        assertThat(result, is(Tree.of(Operator.OR, Literal.negative(p), Literal.negative(q))));

        Proposition implication = evaluator.evaluate(Operator.NOT, Tree.of(Operator.IMPLY, p, q));
        assertThat(implication, is(Tree.of(Operator.NOT_CONVERSE_IMPLY, Literal.negative(p), Literal.negative(q))));
    }

    @Test void testEvaluateExpandsRules() {
        assertThat(evaluator.evaluate(Operator.IMPLY, p, q), is(Tree.of(Operator.OR, Literal.negative(p), q)));
        assertThat(evaluator.evaluate(Operator.NAND, p, q), is(Tree.of(Operator.NOT, Tree.of(Operator.AND, p, q))));
        assertThat(evaluator.evaluate(Operator.NOT_IMPLY, p, q), is(Tree.of(Operator.AND, p, Literal.negative(q))));
        // gli operatori primitivi vengono solo applicati
        assertThat(evaluator.evaluate(Operator.AND, p, Tree.TRUE), is(p));
    }

    @Test void testSimplify() {
        Tree tree = Tree.of(Operator.AND, Tree.of(Operator.OR, p, Tree.TRUE), q);
        assertThat(evaluator.simplify(tree), is(q));
        Tree nested = Tree.of(Operator.XOR, Tree.of(Operator.AND, Tree.FALSE, p), r);
        assertThat(evaluator.simplify(nested), is(r));
    }

    @Test void testNegationNormalForm() {
        Proposition nnf = evaluator.negationNormalForm(Tree.of(Operator.NOT, Tree.of(Operator.IMPLY, p, q)));
        assertThat(nnf, is(Tree.of(Operator.AND, p, Literal.negative(q))));

        Proposition nested = evaluator.negationNormalForm(
                Tree.of(Operator.NOT, Tree.of(Operator.OR, p, Tree.of(Operator.NOT, Tree.of(Operator.AND, q, r)))));
        assertThat(nested, is(Tree.of(Operator.AND, Literal.negative(p), Tree.of(Operator.AND, q, r))));
    }

    //endregion

    //region PIEGATURE

    @Test void testFoldDirections() {
        assertThat(evaluator.fold(Operator.AND, List.of(p, q, r)),
                is(Tree.of(Operator.AND, Tree.of(Operator.AND, p, q), r)));
        assertThat(evaluator.fold(Operator.NOT_IMPLY, List.of(p, q, r)),
                is(Tree.of(Operator.NOT_IMPLY, p, Tree.of(Operator.NOT_IMPLY, q, r))));
        assertThat(evaluator.apply(Operator.DISJUNCTION, p, q, r),
                is(Tree.of(Operator.OR, Tree.of(Operator.OR, p, q), r)));
        assertThat(evaluator.conjunction(List.of(p)), is(p));
    }

    @Test void testEmptyFolds() {
        assertThat(evaluator.fold(Operator.AND, List.of()), sameInstance(Tree.TRUE));
        assertThat(evaluator.disjunction(List.of()), sameInstance(Tree.FALSE));
        assertThat(evaluator.fold(Operator.IMPLY, List.of()), sameInstance(Tree.TRUE));
        assertThat(evaluator.apply(Operator.CONJUNCTION, List.of()), sameInstance(Tree.TRUE));
        assertThrows(UndefinedOperatorBehaviorException.class, () -> evaluator.fold(Operator.NAND, List.of()));
        assertThrows(IllegalArgumentException.class, () -> evaluator.fold(Operator.NOT, List.of(p)));
    }

    //endregion

    //region OPERATORI PERSONALIZZATI

    @Test void testCustomOperator() {
        OperatorCatalog.Builder builder = OperatorCatalog.builder();
        CustomOperator nor = builder.register("nor2", "⊽₂", Tree.of(Operator.NOT,
                Tree.of(Operator.OR, Variable.placeholder(1), Variable.placeholder(2)))).operator();
        Evaluator extended = new Evaluator(builder.build());

        assertThat(extended.apply(nor, Tree.TRUE, Tree.FALSE), sameInstance(Tree.FALSE));
        assertThat(extended.apply(nor, p, q), is(Tree.of(nor, p, q)));
        assertThat(extended.evaluate(nor, p, q), is(Tree.of(Operator.NOT, Tree.of(Operator.OR, p, q))));
        // il duale scoperto (⊼) guida la negazione spinta
        assertThat(extended.evaluate(Operator.NOT, Tree.of(nor, p, q)),
                is(Tree.of(Operator.NAND, Literal.negative(p), Literal.negative(q))));
        assertThrows(IllegalArgumentException.class, () -> evaluator.apply(nor, p, q));
    }

    //endregion

    //region ALBERI SENZA FIGLI

    @Test void testChildlessTreesSimplifyToTheirConstant() {
        assertThat(evaluator.simplify(Tree.of(Operator.CONJUNCTION)), sameInstance(Tree.TRUE));
        assertThat(evaluator.simplify(Tree.of(Operator.DISJUNCTION)), sameInstance(Tree.FALSE));
        assertThat(evaluator.simplify(Tree.of(Operator.AND, p, Tree.of(Operator.DISJUNCTION))),
                sameInstance(Tree.FALSE));
    }

    @Test void testChildlessTreesUnderNegation() {
        assertThat(evaluator.negationNormalForm(Tree.of(Operator.NOT, Tree.of(Operator.CONJUNCTION))),
                sameInstance(Tree.FALSE));
        assertThat(evaluator.negationNormalForm(Tree.of(Operator.NOT, Tree.of(Operator.DISJUNCTION))),
                sameInstance(Tree.TRUE));
        assertThat(evaluator.negationNormalForm(Tree.of(Operator.OR, p, Tree.of(Operator.CONJUNCTION))),
                sameInstance(Tree.TRUE));
    }

    @Test void testNullaryCustomOperator() {
        OperatorCatalog.Builder builder = OperatorCatalog.builder();
        CustomOperator top = builder.register("top2", "⊤₂", Tree.of(Operator.NOT, Tree.FALSE)).operator();
        Evaluator extended = new Evaluator(builder.build());

        assertThat(extended.simplify(Tree.of(top)), sameInstance(Tree.TRUE));
        assertThat(extended.negationNormalForm(Tree.of(Operator.NOT, Tree.of(top))), sameInstance(Tree.FALSE));
        assertThat(extended.negationNormalForm(Tree.of(Operator.AND, p, Tree.of(top))), is(p));
    }

    //endregion
}
