package org.logica.semantics;

import org.logica.operators.Operator;
import org.logica.propositions.Atom;
import org.logica.propositions.Proposition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tabella di verità di un insieme di proposizioni e dei loro atomi.
 *
 * Le colonne con la stessa interpretazione sono raggruppate in un'unica intestazione.
 * Ordine dei gruppi: prima quelli equivalenti a ⊤ o ⊥, poi quelli equivalenti a un
 * atomo, infine i composti; a parità, ordine di prima comparsa. Le righe seguono
 * l'ordine di {@link Valuations}.
 */
public final class TruthTable {

    private final List<List<Proposition>> header;
    private final List<Valuation> valuations;
    private final boolean[][] body;

    private TruthTable(List<List<Proposition>> header, List<Valuation> valuations, boolean[][] body) {
        this.header = header;
        this.valuations = valuations;
        this.body = body;
    }

    public static TruthTable of(Semantics semantics, Proposition... propositions) {
        return of(semantics, Arrays.asList(propositions));
    }

    public static TruthTable of(Semantics semantics, List<? extends Proposition> propositions) {
        Set<Atom> atoms = new LinkedHashSet<>();
        for (Proposition p : propositions) {
            for (Atom atom : p.atoms()) {
                atoms.add(atom);
            }
        }
        Set<Proposition> columns = new LinkedHashSet<>(atoms);
        columns.addAll(propositions);

        List<Valuation> rows = new ArrayList<>();
        for (Valuation valuation : Valuations.of(new ArrayList<>(atoms))) {
            rows.add(valuation);
        }

        Map<List<Boolean>, List<Proposition>> truths = new LinkedHashMap<>();
        Map<List<Boolean>, List<Proposition>> atomGroups = new LinkedHashMap<>();
        Map<List<Boolean>, List<Proposition>> compounds = new LinkedHashMap<>();
        List<Boolean> allTrue = Collections.nCopies(rows.size(), true);
        List<Boolean> allFalse = Collections.nCopies(rows.size(), false);
        Set<List<Boolean>> atomInterpretations = new LinkedHashSet<>();
        for (Atom atom : atoms) {
            atomInterpretations.add(interpretations(semantics, rows, atom));
        }

        for (Proposition column : columns) {
            List<Boolean> interpretation = interpretations(semantics, rows, column);
            Map<List<Boolean>, List<Proposition>> group;
            if (interpretation.equals(allTrue) || interpretation.equals(allFalse)) {
                group = truths;
            } else if (atomInterpretations.contains(interpretation)) {
                group = atomGroups;
            } else {
                group = compounds;
            }
            group.computeIfAbsent(interpretation, k -> new ArrayList<>()).add(column);
        }

        List<List<Proposition>> header = new ArrayList<>();
        List<List<Boolean>> bodyColumns = new ArrayList<>();
        for (Map<List<Boolean>, List<Proposition>> group : List.of(truths, atomGroups, compounds)) {
            for (Map.Entry<List<Boolean>, List<Proposition>> entry : group.entrySet()) {
                header.add(List.copyOf(entry.getValue()));
                bodyColumns.add(entry.getKey());
            }
        }

        boolean[][] body = new boolean[rows.size()][bodyColumns.size()];
        for (int row = 0; row < rows.size(); row++) {
            for (int col = 0; col < bodyColumns.size(); col++) {
                body[row][col] = bodyColumns.get(col).get(row);
            }
        }
        return new TruthTable(List.copyOf(header), List.copyOf(rows), body);
    }

    private static List<Boolean> interpretations(Semantics semantics, List<Valuation> rows, Proposition p) {
        List<Boolean> result = new ArrayList<>(rows.size());
        for (Valuation valuation : rows) {
            result.add(semantics.evaluate(valuation, p));
        }
        return result;
    }

    /** Gruppi di proposizioni equivalenti, uno per colonna. */
    public List<List<Proposition>> getHeader() {
        return header;
    }

    public List<Valuation> getValuations() {
        return valuations;
    }

    public int getRowCount() {
        return body.length;
    }

    public int getColumnCount() {
        return header.size();
    }

    public boolean get(int row, int column) {
        return body[row][column];
    }

    /** Rappresentazione testuale con ⊤/⊥ nelle celle. */
    public String render() {
        List<String> titles = header.stream()
                .map(group -> group.stream().map(Proposition::toString).collect(Collectors.joining(", ")))
                .collect(Collectors.toList());
        int[] widths = new int[titles.size()];
        for (int col = 0; col < widths.length; col++) {
            widths[col] = Math.max(1, titles.get(col).codePointCount(0, titles.get(col).length()));
        }

        StringBuilder out = new StringBuilder();
        appendRow(out, titles, widths);
        out.append(widths.length == 0 ? "" : "-".repeat(Arrays.stream(widths).sum() + 3 * (widths.length - 1)))
                .append('\n');
        for (boolean[] row : body) {
            List<String> cells = new ArrayList<>(row.length);
            for (boolean value : row) {
                cells.add(symbol(value));
            }
            appendRow(out, cells, widths);
        }
        return out.toString();
    }

    private static void appendRow(StringBuilder out, List<String> cells, int[] widths) {
        for (int col = 0; col < cells.size(); col++) {
            String cell = cells.get(col);
            out.append(cell).append(" ".repeat(widths[col] - cell.codePointCount(0, cell.length())));
            if (col < cells.size() - 1) {
                out.append(" | ");
            }
        }
        out.append('\n');
    }

    @Override
    public String toString() {
        return render();
    }

    private static String symbol(boolean value) {
        return (value ? Operator.TAUTOLOGY : Operator.CONTRADICTION).getSymbol();
    }
}
