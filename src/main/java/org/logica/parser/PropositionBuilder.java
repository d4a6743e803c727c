package org.logica.parser;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.logica.evaluation.Evaluator;
import org.logica.operators.Operator;
import org.logica.propositions.Constant;
import org.logica.propositions.Proposition;
import org.logica.propositions.Tree;
import org.logica.propositions.Variable;

import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DI PROPOSIZIONI - Visitor dall'albero sintattico ANTLR al modello
 *
 * Ogni nodo viene costruito tramite {@link Evaluator#apply}, quindi le semplificazioni
 * immediate (costanti, doppia negazione, leggi di identità) avvengono già durante l'analisi.
 *
 * ASSOCIATIVITÀ:
 * • ↔ ↮ ∨ ⊽ ∧ ⊼: a sinistra, a op b op c = (a op b) op c
 * • → ← ↛ ↚: a destra, a → b → c = a → (b → c)
 */
class PropositionBuilder extends FormulaBaseVisitor<Proposition> {

    private static final Logger LOGGER = Logger.getLogger(PropositionBuilder.class.getName());

    private final Evaluator evaluator;

    PropositionBuilder(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Proposition visitFormula(FormulaParser.FormulaContext ctx) {
        return visit(ctx.equivalence());
    }

    //region OPERATORI BINARI

    @Override
    public Proposition visitIff(FormulaParser.IffContext ctx) {
        return leftChain(ctx.ops, ctx.implication());
    }

    @Override
    public Proposition visitImplies(FormulaParser.ImpliesContext ctx) {
        Proposition antecedent = visit(ctx.disjunction());
        if (ctx.op == null) {
            return antecedent;
        }
        Proposition consequent = visit(ctx.implication());
        return evaluator.apply(operatorOf(ctx.op), antecedent, consequent);
    }

    @Override
    public Proposition visitOr(FormulaParser.OrContext ctx) {
        return leftChain(ctx.ops, ctx.conjunction());
    }

    @Override
    public Proposition visitAnd(FormulaParser.AndContext ctx) {
        return leftChain(ctx.ops, ctx.negation());
    }

    private Proposition leftChain(List<Token> ops, List<? extends ParseTree> operands) {
        Proposition result = visit(operands.get(0));
        for (int i = 0; i < ops.size(); i++) {
            result = evaluator.apply(operatorOf(ops.get(i)), result, visit(operands.get(i + 1)));
        }
        return result;
    }

    private static Operator operatorOf(Token token) {
        return switch (token.getType()) {
            case FormulaParser.IFF -> Operator.XNOR;
            case FormulaParser.XOR -> Operator.XOR;
            case FormulaParser.IMPLIES -> Operator.IMPLY;
            case FormulaParser.CONVERSE -> Operator.CONVERSE_IMPLY;
            case FormulaParser.NOT_IMPLIES -> Operator.NOT_IMPLY;
            case FormulaParser.NOT_CONVERSE -> Operator.NOT_CONVERSE_IMPLY;
            case FormulaParser.OR -> Operator.OR;
            case FormulaParser.NOR -> Operator.NOR;
            case FormulaParser.AND -> Operator.AND;
            case FormulaParser.NAND -> Operator.NAND;
            default -> throw new IllegalStateException("Token operatore inatteso: " + token.getText());
        };
    }

    //endregion

    //region NEGAZIONE E ATOMI

    @Override
    public Proposition visitNot(FormulaParser.NotContext ctx) {
        return evaluator.apply(Operator.NOT, visit(ctx.negation()));
    }

    @Override
    public Proposition visitBase(FormulaParser.BaseContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Proposition visitPar(FormulaParser.ParContext ctx) {
        return visit(ctx.equivalence());
    }

    @Override
    public Proposition visitTop(FormulaParser.TopContext ctx) {
        return Tree.TRUE;
    }

    @Override
    public Proposition visitBottom(FormulaParser.BottomContext ctx) {
        return Tree.FALSE;
    }

    @Override
    public Proposition visitConstant(FormulaParser.ConstantContext ctx) {
        return ctx.value.getType() == FormulaParser.STRING ? text(ctx.value) : number(ctx.value);
    }

    @Override
    public Proposition visitText(FormulaParser.TextContext ctx) {
        return text(ctx.STRING().getSymbol());
    }

    @Override
    public Proposition visitNumber(FormulaParser.NumberContext ctx) {
        return number(ctx.NUMBER().getSymbol());
    }

    @Override
    public Proposition visitId(FormulaParser.IdContext ctx) {
        return Variable.of(ctx.IDENTIFIER().getText());
    }

    private static Constant text(Token token) {
        String raw = token.getText();
        String body = raw.substring(1, raw.length() - 1);
        StringBuilder value = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                c = body.charAt(++i);
            }
            value.append(c);
        }
        return Constant.of(value.toString());
    }

    private static Constant number(Token token) {
        try {
            return Constant.of(Integer.parseInt(token.getText()));
        } catch (NumberFormatException e) {
            LOGGER.warning("Costante numerica fuori intervallo: " + token.getText());
            throw new FormulaSyntaxException("costante numerica fuori intervallo '" + token.getText() + "'",
                    token.getLine(), token.getCharPositionInLine(), e);
        }
    }

    //endregion
}
