package org.logica.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.logica.evaluation.Evaluator;
import org.logica.propositions.Proposition;

import java.util.logging.Logger;

/**
 * Facciata della pipeline ANTLR: lexing, parsing e costruzione della proposizione.
 * Il primo errore sintattico interrompe l'analisi con {@link FormulaSyntaxException}.
 */
public class PropositionParser {

    private static final Logger LOGGER = Logger.getLogger(PropositionParser.class.getName());

    private final Evaluator evaluator;

    public PropositionParser(Evaluator evaluator) {
        if (evaluator == null) {
            throw new IllegalArgumentException("Il valutatore non può essere null");
        }
        this.evaluator = evaluator;
    }

    public static PropositionParser standard() {
        return new PropositionParser(Evaluator.standard());
    }

    /**
     * @param text formula in notazione infissa
     * @return proposizione costruita tramite il valutatore
     * @throws FormulaSyntaxException se il testo non rispetta la grammatica
     */
    public Proposition parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Il testo della formula non può essere null");
        }
        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        FormulaParser parser = new FormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Proposition result = new PropositionBuilder(evaluator).visit(tree);
        LOGGER.fine(() -> "Formula analizzata: " + result);
        return result;
    }

    /** Converte il primo errore di lexer o parser in eccezione. */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new FormulaSyntaxException(msg, line, charPositionInLine, e);
        }
    }
}
