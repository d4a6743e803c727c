package org.logica.operators;

import org.logica.propositions.Literal;
import org.logica.propositions.Proposition;
import org.logica.propositions.Tree;
import org.logica.propositions.Variable;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Catalogo predefinito e registrazione di operatori personalizzati. */
public class OperatorCatalogTest {

    private static final Variable A = Variable.placeholder(1);
    private static final Variable B = Variable.placeholder(2);
    private static final Variable C = Variable.placeholder(3);

    private final OperatorCatalog catalog = OperatorCatalog.standard();

    @Test void testStandardLookup() {
        assertThat(catalog.lookup("and").get(), is(Operator.AND));
        assertThat(catalog.lookup("not_converse_imply").get(), is(Operator.NOT_CONVERSE_IMPLY));
        assertThat(catalog.lookup("nand2").isPresent(), is(false));
        assertThat(catalog.operators(), hasSize(Operator.values().length));
        assertThat(catalog.arity(Operator.CONJUNCTION).isUnbounded(), is(true));
    }

    @Test void testStandardDualsAndConverses() {
        assertThat(catalog.dual(Operator.AND), is(Operator.OR));
        assertThat(catalog.dual(Operator.NAND), is(Operator.NOR));
        assertThat(catalog.dual(Operator.XOR), is(Operator.XNOR));
        assertThat(catalog.dual(Operator.IMPLY), is(Operator.NOT_CONVERSE_IMPLY));
        assertThat(catalog.dual(Operator.TAUTOLOGY), is(Operator.CONTRADICTION));
        assertThat(catalog.converse(Operator.IMPLY), is(Operator.CONVERSE_IMPLY));
        assertThat(catalog.converse(Operator.NOT_IMPLY), is(Operator.NOT_CONVERSE_IMPLY));
        assertThat(catalog.converse(Operator.AND), is(Operator.AND));
    }

    @Test void testStandardAlgebraicProperties() {
        assertThat(catalog.isCommutative(Operator.NAND), is(true));
        assertThat(catalog.associativity(Operator.NAND), is(PropertyStatus.FAILS));
        assertThat(catalog.isAssociative(Operator.XOR), is(true));
        assertThat(catalog.commutativity(Operator.IMPLY), is(PropertyStatus.FAILS));
        assertThat(catalog.commutativity(Operator.NOT), is(PropertyStatus.UNDETERMINED));

        assertThat(catalog.leftIdentity(Operator.IMPLY), is(Optional.of(Operator.TAUTOLOGY)));
        assertThat(catalog.rightIdentity(Operator.IMPLY).isPresent(), is(false));
        assertThat(catalog.rightIdentity(Operator.NOT_IMPLY), is(Optional.of(Operator.CONTRADICTION)));
        assertThat(catalog.foldDirection(Operator.NOT_IMPLY), is(FoldDirection.RIGHT));
        assertThat(catalog.foldDirection(Operator.AND), is(FoldDirection.LEFT));
    }

    @Test void testEvaluateBuiltIns() {
        assertThat(catalog.evaluate(Operator.XOR, true, false), is(true));
        assertThat(catalog.evaluate(Operator.XNOR, true, false), is(false));
        assertThat(catalog.evaluate(Operator.IMPLY, true, false), is(false));
        assertThat(catalog.evaluate(Operator.CONVERSE_IMPLY, false, true), is(false));
        assertThat(catalog.evaluate(Operator.NOT_CONVERSE_IMPLY, false, true), is(true));
        assertThat(catalog.evaluate(Operator.CONJUNCTION), is(true));
        assertThat(catalog.evaluate(Operator.DISJUNCTION), is(false));
        assertThat(catalog.evaluate(Operator.DISJUNCTION, false, false, true), is(true));
        assertThat(catalog.evaluate(Operator.TAUTOLOGY), is(true));
    }

    @Test void testEvaluateRejectsWrongArity() {
        ArityMismatchException e = assertThrows(ArityMismatchException.class,
                () -> catalog.evaluate(Operator.AND, true));
        assertThat(e.getActual(), is(1));
        assertThrows(ArityMismatchException.class, () -> catalog.evaluate(Operator.NOT, true, false));
    }

    @Test void testUnregisteredOperator() {
        OperatorCatalog.Builder builder = OperatorCatalog.builder();
        CustomOperator custom = builder.register("nor2", "⊽₂",
                Tree.of(Operator.NOT, Tree.of(Operator.OR, A, B))).operator();

        assertThrows(IllegalArgumentException.class, () -> catalog.properties(custom));
        assertThat(catalog.isRegistered(custom), is(false));
        assertThat(builder.build().isRegistered(custom), is(true));
    }

    //region REGISTRAZIONE

    @Test void testRegisterDiscoversProperties() {
        Registration registration = OperatorCatalog.builder().register("nor2", "⊽₂",
                Tree.of(Operator.NOT, Tree.of(Operator.OR, A, B)));
        OperatorProperties props = registration.properties();

        assertThat(registration.isComplete(), is(true));
        assertThat(registration.operator().getArity(), is(Arity.BINARY));
        assertThat(props.commutative(), is(PropertyStatus.HOLDS));
        assertThat(props.associative(), is(PropertyStatus.FAILS));
        assertThat(props.leftIdentity() == null, is(true));
        assertThat(props.dual(), is(Operator.NAND));
        assertThat(props.converse(), is(registration.operator()));
    }

    @Test void testRegisterFindsIdentitiesAndConverse() {
        Proposition rule = Tree.of(Operator.OR, Literal.negative(A), B);
        OperatorCatalog.Builder builder = OperatorCatalog.builder();
        CustomOperator imp = builder.register("imp2", "⇒", rule).operator();
        OperatorCatalog extended = builder.build();

        assertThat(extended.leftIdentity(imp), is(Optional.of(Operator.TAUTOLOGY)));
        assertThat(extended.rightIdentity(imp).isPresent(), is(false));
        assertThat(extended.dual(imp), is(Operator.NOT_CONVERSE_IMPLY));
        assertThat(extended.converse(imp), is(Operator.CONVERSE_IMPLY));
        assertThat(extended.commutativity(imp), is(PropertyStatus.FAILS));
        assertThat(extended.rule(imp), is(Optional.of(rule)));
        assertThat(extended.evaluate(imp, true, false), is(false));
        assertThat(extended.evaluate(imp, false, false), is(true));
    }

    @Test void testDualBackfilledByLaterRegistration() {
        OperatorCatalog.Builder builder = OperatorCatalog.builder();
        Registration first = builder.register("and_or", "⊕",
                Tree.of(Operator.OR, Tree.of(Operator.AND, A, B), C));
        assertThat(first.isComplete(), is(false));
        assertThat(first.properties().dual() == null, is(true));

        OperatorCatalog partial = builder.build();
        assertThrows(UndefinedOperatorBehaviorException.class, () -> partial.dual(first.operator()));
        assertThat(partial.findDual(first.operator()).isPresent(), is(false));

        Registration second = builder.register("or_and", "⊗",
                Tree.of(Operator.AND, Tree.of(Operator.OR, A, B), C));
        OperatorCatalog complete = builder.build();

        assertThat(second.properties().dual(), is(first.operator()));
        assertThat(complete.dual(first.operator()), is(second.operator()));
        assertThat(complete.arity(second.operator()), is(Arity.of(3)));
        // i cataloghi già costruiti non cambiano
        assertThat(partial.findDual(first.operator()).isPresent(), is(false));
    }

    @Test void testRegisterRejectsInvalidRules() {
        OperatorCatalog.Builder builder = OperatorCatalog.builder();
        assertThrows(IllegalArgumentException.class,
                () -> builder.register("bad", "b", Tree.of(Operator.AND, A, Variable.of("x"))));
        assertThrows(IllegalArgumentException.class,
                () -> builder.register("gap", "g", Tree.of(Operator.AND, A, C)));
        assertThrows(IllegalArgumentException.class,
                () -> builder.register("and", "&", Tree.of(Operator.AND, A, B)));
        assertThrows(IllegalArgumentException.class,
                () -> builder.register(" ", "&", Tree.of(Operator.AND, A, B)));
        assertThrows(IllegalArgumentException.class, () -> builder.register("nothing", "n", null));
    }

    @Test void testStandardCatalogIsNotExtended() {
        OperatorCatalog.builder().register("nor2", "⊽₂", Tree.of(Operator.NOT, Tree.of(Operator.OR, A, B)));
        assertThat(OperatorCatalog.standard().lookup("nor2").isPresent(), is(false));
        assertThat(OperatorCatalog.standard(), sameInstance(catalog));
    }

    @Test void testSameNameInDifferentCatalogsAreDistinct() {
        OperatorCatalog.Builder first = OperatorCatalog.builder();
        CustomOperator both = first.register("op", "∘", Tree.of(Operator.AND, A, B)).operator();
        OperatorCatalog.Builder second = OperatorCatalog.builder();
        CustomOperator either = second.register("op", "∘", Tree.of(Operator.OR, A, B)).operator();
        OperatorCatalog withBoth = first.build();
        OperatorCatalog withEither = second.build();

        assertThat(both.equals(either), is(false));
        assertThat(both.equals(both), is(true));
        assertThat(withBoth.isRegistered(either), is(false));
        assertThrows(IllegalArgumentException.class, () -> withBoth.properties(either));
        assertThat(withBoth.evaluate(both, true, false), is(false));
        assertThat(withEither.evaluate(either, true, false), is(true));
        assertThat(withBoth.toBuilder().build().isRegistered(both), is(true));
    }

    @Test void testUnaryRegistrationWarnsAboutBinaryProperties() {
        Registration registration = OperatorCatalog.builder().register("same", "≡", Tree.of(Operator.NOT,
                Tree.of(Operator.NOT, A)));
        assertThat(registration.isComplete(), is(false));
        // l'identità è autoduale: il confronto parte dall'operatore stesso
        assertThat(registration.properties().dual(), is(registration.operator()));
        assertThat(registration.properties().commutative(), is(PropertyStatus.UNDETERMINED));
        assertThat(registration.properties().converse(), is(registration.operator()));
        assertThat(registration.warnings(), hasSize(1));
        assertThat(OperatorCatalog.builder().build().operators(), is(catalog.operators()));
    }

    //endregion
}
