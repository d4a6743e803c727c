package org.logica.cnf;

import org.logica.operators.Operator;
import org.logica.propositions.Atom;
import org.logica.propositions.Clause;
import org.logica.propositions.Literal;
import org.logica.propositions.Normal;
import org.logica.propositions.Variable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lettura e scrittura del formato DIMACS CNF.
 *
 * FORMATO:
 * • righe di commento che iniziano con 'c'
 * • intestazione {@code p cnf <variabili> <clausole>}
 * • una clausola per riga, letterali interi terminati da 0
 * • una riga che inizia con '%' chiude il file (convenzione dei benchmark SATLIB)
 */
public final class Dimacs {

    private static final Logger LOGGER = Logger.getLogger(Dimacs.class.getName());

    /** Prefisso dei nomi delle variabili create dalla lettura di un file DIMACS. */
    public static final String VARIABLE_PREFIX = "p";

    private Dimacs() {
    }

    //region SCRITTURA

    public static String write(List<List<Integer>> clauses, int variableCount) {
        StringBuilder out = new StringBuilder();
        out.append("p cnf ").append(variableCount).append(' ').append(clauses.size()).append('\n');
        appendClauses(out, clauses);
        return out.toString();
    }

    /** Scrive la codifica con un commento per ogni atomo dell'utente. */
    public static String write(TseytinEncoding encoding) {
        StringBuilder out = new StringBuilder();
        List<Atom> atoms = encoding.atoms();
        for (int i = 0; i < atoms.size(); i++) {
            if (!TseytinEncoding.isAuxiliary(atoms.get(i))) {
                out.append("c ").append(i + 1).append(' ').append(atoms.get(i)).append('\n');
            }
        }
        out.append("p cnf ").append(encoding.getVariableCount()).append(' ')
                .append(encoding.getClauseCount()).append('\n');
        appendClauses(out, encoding.clauses());
        return out.toString();
    }

    private static void appendClauses(StringBuilder out, List<List<Integer>> clauses) {
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                out.append(literal).append(' ');
            }
            out.append("0\n");
        }
    }

    //endregion

    //region LETTURA

    public static DimacsProblem read(Path path) throws IOException {
        LOGGER.fine("Lettura file DIMACS: " + path);
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException se l'intestazione manca o è malformata,
     *         un letterale supera il numero di variabili, o l'ultima clausola non è chiusa
     */
    public static DimacsProblem parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Il testo DIMACS non può essere null");
        }
        int variableCount = -1;
        int declaredClauses = -1;
        List<List<Integer>> clauses = new ArrayList<>();
        List<Integer> current = new ArrayList<>();

        String[] lines = text.split("\\R");
        for (int lineNumber = 0; lineNumber < lines.length; lineNumber++) {
            String line = lines[lineNumber].trim();
            if (line.isEmpty() || line.startsWith("c")) {
                continue;
            }
            if (line.startsWith("%")) {
                break;
            }
            if (line.startsWith("p")) {
                String[] header = line.split("\\s+");
                if (variableCount >= 0 || header.length != 4 || !header[1].equals("cnf")) {
                    throw new IllegalArgumentException("Intestazione DIMACS non valida alla riga "
                            + (lineNumber + 1) + ": " + line);
                }
                variableCount = parseNumber(header[2], lineNumber);
                declaredClauses = parseNumber(header[3], lineNumber);
                continue;
            }
            if (variableCount < 0) {
                throw new IllegalArgumentException("Clausola prima dell'intestazione alla riga " + (lineNumber + 1));
            }
            for (String token : line.split("\\s+")) {
                int literal = parseNumber(token, lineNumber);
                if (literal == 0) {
                    clauses.add(current);
                    current = new ArrayList<>();
                } else if (Math.abs(literal) > variableCount) {
                    throw new IllegalArgumentException("Letterale " + literal + " oltre il numero di variabili "
                            + variableCount + " alla riga " + (lineNumber + 1));
                } else {
                    current.add(literal);
                }
            }
        }

        if (variableCount < 0) {
            throw new IllegalArgumentException("Intestazione DIMACS 'p cnf' assente");
        }
        if (!current.isEmpty()) {
            throw new IllegalArgumentException("Ultima clausola non terminata da 0");
        }
        if (clauses.size() != declaredClauses) {
            LOGGER.warning(String.format("Clausole dichiarate %d, lette %d", declaredClauses, clauses.size()));
        }
        return new DimacsProblem(variableCount, clauses);
    }

    private static int parseNumber(String token, int lineNumber) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Numero non valido '" + token + "' alla riga " + (lineNumber + 1), e);
        }
    }

    /** CNF sulle variabili {@code p1..pn}. */
    public static Normal toNormal(DimacsProblem problem) {
        List<Variable> variables = new ArrayList<>(problem.variableCount());
        for (int i = 1; i <= problem.variableCount(); i++) {
            variables.add(Variable.of(VARIABLE_PREFIX + i));
        }
        List<Clause> clauses = new ArrayList<>(problem.clauses().size());
        for (List<Integer> clause : problem.clauses()) {
            List<Literal> literals = new ArrayList<>(clause.size());
            for (int literal : clause) {
                Variable variable = variables.get(Math.abs(literal) - 1);
                literals.add(literal > 0 ? Literal.positive(variable) : Literal.negative(variable));
            }
            clauses.add(Clause.of(Operator.OR, literals));
        }
        return Normal.of(Operator.AND, clauses);
    }

    //endregion
}
