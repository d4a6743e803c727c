package org.logica.cnf;

import org.logica.operators.Operator;
import org.logica.propositions.Clause;
import org.logica.propositions.Literal;
import org.logica.propositions.Normal;
import org.logica.propositions.Variable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Lettura e scrittura del formato DIMACS CNF. */
public class DimacsTest {

    @Test void testParse() {
        DimacsProblem problem = Dimacs.parse("c esempio\np cnf 3 2\n1 -2 0\n2 3 0\n");
        assertThat(problem.variableCount(), is(3));
        assertThat(problem.clauses(), is(List.of(List.of(1, -2), List.of(2, 3))));
    }

    @Test void testClauseSpanningLines() {
        DimacsProblem problem = Dimacs.parse("p cnf 2 2\n1\n  -2 0 2\n0\n");
        assertThat(problem.clauses(), is(List.of(List.of(1, -2), List.of(2))));
    }

    @Test void testPercentTerminatesInput() {
        DimacsProblem problem = Dimacs.parse("p cnf 1 1\n1 0\n%\n0\n");
        assertThat(problem.clauses(), is(List.of(List.of(1))));
    }

    @Test void testMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Dimacs.parse("1 2 0\n"));
        assertThrows(IllegalArgumentException.class, () -> Dimacs.parse("p dnf 2 1\n1 0\n"));
        assertThrows(IllegalArgumentException.class, () -> Dimacs.parse("p cnf 2 1\n1 3 0\n"));
        assertThrows(IllegalArgumentException.class, () -> Dimacs.parse("p cnf 2 1\n1 2\n"));
        assertThrows(IllegalArgumentException.class, () -> Dimacs.parse("p cnf 2 1\n1 x 0\n"));
        assertThrows(IllegalArgumentException.class, () -> Dimacs.parse("p cnf 2 1\np cnf 2 1\n"));
    }

    @Test void testWrite() {
        String text = Dimacs.write(List.of(List.of(1, -2), List.of(2)), 2);
        assertThat(text, is("p cnf 2 2\n1 -2 0\n2 0\n"));
        assertThat(Dimacs.parse(text).clauses(), is(List.of(List.of(1, -2), List.of(2))));
    }

    @Test void testToNormal() {
        Normal cnf = Dimacs.toNormal(Dimacs.parse("p cnf 2 2\n1 -2 0\n2 0\n"));
        Variable p1 = Variable.of("p1");
        Variable p2 = Variable.of("p2");
        assertThat(cnf, is(Normal.of(Operator.AND,
                Clause.of(Operator.OR, Literal.positive(p1), Literal.negative(p2)),
                Clause.of(Operator.OR, Literal.positive(p2)))));
    }

    @Test void testRead(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("problema.cnf");
        Files.writeString(file, "c file\np cnf 2 1\n-1 2 0\n", StandardCharsets.UTF_8);
        assertThat(Dimacs.read(file).clauses(), is(List.of(List.of(-1, 2))));
        assertThrows(IOException.class, () -> Dimacs.read(directory.resolve("assente.cnf")));
    }
}
