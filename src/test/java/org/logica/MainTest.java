package org.logica;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;

/** Pipeline a riga di comando: parametri, analisi, codici di uscita e file di output. */
public class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    //region PARAMETRI

    @Test void testNoArguments() {
        assertThat(Main.run(new String[0], out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E]"));
    }

    @Test void testHelp() {
        assertThat(Main.run(new String[]{"-h"}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("UTILIZZO"));
    }

    @Test void testInvalidArguments() {
        assertThat(Main.run(new String[]{"-x"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[]{"-e", "p", "-t", "0"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[]{"-e", "p", "-n", "due"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[]{"-e", "p", "-opt=z"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[]{"-f", "inesistente.txt"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[]{"-o", "risultati"}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("Parametro sconosciuto: -x"));
    }

    @Test void testSyntaxError() {
        assertThat(Main.run(new String[]{"-e", "p &"}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] Errore di sintassi alla riga 1"));
    }

    //endregion

    //region ANALISI

    @Test void testTautology() {
        assertThat(Main.run(new String[]{"-e", "p | !p", "-opt=c"}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("[I] Formula: p ∨ ¬p"));
        assertThat(output(), containsString("Classificazione: tautologia"));
        assertThat(output(), containsString("Modello 2"));
    }

    @Test void testContradiction() {
        assertThat(Main.run(new String[]{"-e", "p & !p"}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("Classificazione: contraddizione"));
        assertThat(output(), containsString("UNSAT"));
        assertThat(output(), not(containsString("Modello 1")));
    }

    @Test void testModelLimit() {
        assertThat(Main.run(new String[]{"-e", "p | q", "-n", "1", "-opt=r"}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("con restart"));
        assertThat(output(), containsString("Modello 1"));
        assertThat(output(), not(containsString("Modello 2")));
        assertThat(output(), containsString("altri modelli oltre il limite di 1"));
    }

    /** Principio dei cassetti con n+1 piccioni e n buchi, insoddisfacibile e costoso per CDCL. */
    private static String pigeonhole(int holes) {
        List<String> clauses = new ArrayList<>();
        for (int pigeon = 0; pigeon <= holes; pigeon++) {
            List<String> somewhere = new ArrayList<>();
            for (int hole = 0; hole < holes; hole++) {
                somewhere.add("x_" + pigeon + "_" + hole);
            }
            clauses.add("(" + String.join(" | ", somewhere) + ")");
        }
        for (int hole = 0; hole < holes; hole++) {
            for (int i = 0; i <= holes; i++) {
                for (int k = i + 1; k <= holes; k++) {
                    clauses.add("(!x_" + i + "_" + hole + " | !x_" + k + "_" + hole + ")");
                }
            }
        }
        return String.join(" & ", clauses);
    }

    private static boolean solverThreadAlive() {
        for (StackTraceElement[] stack : Thread.getAllStackTraces().values()) {
            for (StackTraceElement frame : stack) {
                if (frame.getClassName().endsWith(".CdclSearch")) {
                    return true;
                }
            }
        }
        return false;
    }

    @Test void testTimeoutStopsTheSolver() throws InterruptedException {
        assertThat(Main.run(new String[]{"-e", pigeonhole(10), "-t", "1"}, out), is(Main.EXIT_TIMEOUT));
        assertThat(output(), containsString("[W] Timeout raggiunto dopo 1 secondi"));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (solverThreadAlive() && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertThat(solverThreadAlive(), is(false));
    }

    @Test void testTseytinOption() {
        assertThat(Main.run(new String[]{"-e", "p & q", "-opt=t"}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("p cnf 3 4"));
        assertThat(output(), containsString("Modello 1: [p=⊤, q=⊤]"));
    }

    //endregion

    //region FILE

    @Test void testOutputDirectory(@TempDir Path directory) throws IOException {
        int exitCode = Main.run(new String[]{"-e", "p -> q", "-opt=all", "-o", directory.toString()}, out);
        assertThat(exitCode, is(Main.EXIT_OK));

        String result = Files.readString(directory.resolve("RESULT").resolve("formula.res"), StandardCharsets.UTF_8);
        assertThat(result, containsString("Classificazione: contingenza"));
        assertThat(Files.exists(directory.resolve("CNF").resolve("formula.txt")), is(true));
        assertThat(Files.exists(directory.resolve("DNF").resolve("formula.txt")), is(true));
        assertThat(Files.readString(directory.resolve("DIMACS").resolve("formula.cnf"), StandardCharsets.UTF_8),
                containsString("c 1 p"));
    }

    @Test void testFormulaFile(@TempDir Path directory) throws IOException {
        Path input = directory.resolve("esercizio.txt");
        Files.writeString(input, "(p -> q) & p & !q\n", StandardCharsets.UTF_8);
        Path results = directory.resolve("out");

        assertThat(Main.run(new String[]{"-f", input.toString(), "-o", results.toString()}, out), is(Main.EXIT_OK));
        assertThat(Files.readString(results.resolve("RESULT").resolve("esercizio.res"), StandardCharsets.UTF_8),
                containsString("UNSAT"));
    }

    @Test void testDimacsFile(@TempDir Path directory) throws IOException {
        Path input = directory.resolve("problema.cnf");
        Files.writeString(input, "c esempio\np cnf 2 2\n1 0\n-1 2 0\n", StandardCharsets.UTF_8);

        assertThat(Main.run(new String[]{"-f", input.toString()}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("SAT"));
        assertThat(output(), containsString("Modello 1: [p1=⊤, p2=⊤]"));
        assertThat(output(), not(containsString("Modello 2")));
    }

    @Test void testMalformedDimacsFile(@TempDir Path directory) throws IOException {
        Path input = directory.resolve("rotto.cnf");
        Files.writeString(input, "1 2 0\n", StandardCharsets.UTF_8);

        assertThat(Main.run(new String[]{"-f", input.toString()}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] Errore durante l'elaborazione"));
    }

    //endregion
}
