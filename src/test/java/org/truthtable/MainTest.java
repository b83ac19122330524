package org.truthtable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {

    @TempDir
    Path tempDir;

    //region FORMULA INLINE

    @Test
    void shouldWriteAllOutputsForInlineFormula() throws IOException {
        Path output = tempDir.resolve("out");

        int exitCode = Main.run(new String[]{"-e", "A AND B", "-opt=all", "-o", output.toString()});

        assertEquals(Main.EXIT_SUCCESS, exitCode);
        assertEquals("A,B,Result\n0,0,0\n0,1,0\n1,0,0\n1,1,1\n",
                Files.readString(output.resolve("TABLE").resolve("formula.csv")));
        assertEquals("(A and B)\n", Files.readString(output.resolve("DNF").resolve("formula.dnf")));
        assertEquals("(A or B) and (A or not B) and (not A or B)\n",
                Files.readString(output.resolve("CNF").resolve("formula.cnf")));
        assertEquals("A\\B  0  1\n0    0  0\n1    0  1\n",
                Files.readString(output.resolve("KMAP").resolve("formula.kmap")));
    }

    @Test
    void shouldWriteOnlyRequestedOptions() {
        Path output = tempDir.resolve("out");

        assertEquals(Main.EXIT_SUCCESS, Main.run(new String[]{"-e", "A -> B", "-opt=c", "-o", output.toString()}));

        assertTrue(Files.exists(output.resolve("TABLE").resolve("formula.csv")));
        assertTrue(Files.exists(output.resolve("CNF").resolve("formula.cnf")));
        assertFalse(Files.exists(output.resolve("DNF")));
        assertFalse(Files.exists(output.resolve("KMAP")));
    }

    @Test
    void shouldSkipKarnaughFileWhenUnsupported() {
        Path output = tempDir.resolve("out");

        assertEquals(Main.EXIT_SUCCESS, Main.run(new String[]{"-e", "NOT A", "-opt=k", "-o", output.toString()}));

        assertTrue(Files.exists(output.resolve("TABLE").resolve("formula.csv")));
        assertFalse(Files.exists(output.resolve("KMAP")));
    }

    @Test
    void shouldFailOnInvalidFormula() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-e", "A AND (B"}));
    }

    //endregion

    //region FILE E DIRECTORY

    @Test
    void shouldWriteNextToInputFileByDefault() throws IOException {
        Path file = Files.writeString(tempDir.resolve("implicazione.txt"), "A -> B\n");

        assertEquals(Main.EXIT_SUCCESS, Main.run(new String[]{"-f", file.toString(), "-opt=d"}));

        assertEquals("A,B,Result\n0,0,1\n0,1,1\n1,0,0\n1,1,1\n",
                Files.readString(tempDir.resolve("TABLE").resolve("implicazione.csv")));
        assertEquals("(not A and not B) or (not A and B) or (A and B)\n",
                Files.readString(tempDir.resolve("DNF").resolve("implicazione.dnf")));
    }

    @Test
    void shouldProcessEveryTxtFileAndReportFailures() throws IOException {
        Path input = Files.createDirectory(tempDir.resolve("formule"));
        Path output = tempDir.resolve("out");
        Files.writeString(input.resolve("a_valida.txt"), "NAND(A, B)");
        Files.writeString(input.resolve("b_errata.txt"), "A $ B");
        Files.writeString(input.resolve("ignorato.csv"), "A");

        int exitCode = Main.run(new String[]{"-d", input.toString(), "-o", output.toString()});

        assertEquals(Main.EXIT_FAILURE, exitCode);
        assertTrue(Files.exists(output.resolve("TABLE").resolve("a_valida.csv")));
        assertFalse(Files.exists(output.resolve("TABLE").resolve("b_errata.csv")));
        assertFalse(Files.exists(output.resolve("TABLE").resolve("ignorato.csv")));
    }

    @Test
    void shouldSucceedOnDirectoryWithValidFormulas() throws IOException {
        Path input = Files.createDirectory(tempDir.resolve("formule"));
        Files.writeString(input.resolve("tautologia.txt"), "A OR NOT A");
        Files.writeString(input.resolve("costante.txt"), "TRUE");

        assertEquals(Main.EXIT_SUCCESS, Main.run(new String[]{"-d", input.toString()}));

        assertEquals("Result\n1\n", Files.readString(input.resolve("TABLE").resolve("costante.csv")));
        assertThat(input.resolve("TABLE").resolve("tautologia.csv")).exists();
    }

    //endregion

    //region PARAMETRI

    @Test
    void shouldShowHelp() {
        assertEquals(Main.EXIT_SUCCESS, Main.run(new String[]{"-h"}));
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{}));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-x"}));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-opt=d"}));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-e", "A", "-opt=z"}));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-e"}));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-f", tempDir.resolve("manca.txt").toString()}));
    }

    @Test
    void shouldRejectCombinedModes() throws IOException {
        Path file = Files.writeString(tempDir.resolve("f.txt"), "A");

        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-e", "A", "-f", file.toString()}));
    }

    @Test
    void shouldParseOptionFlags() {
        Main.Configuration config = new Main.ArgumentParser().parse(new String[]{"-opt=dk", "-e", "A"});

        assertEquals(Main.InputMode.EXPRESSION, config.mode);
        assertEquals("A", config.expression);
        assertTrue(config.showDnf);
        assertFalse(config.showCnf);
        assertTrue(config.showKarnaughMap);
    }

    //endregion
}
