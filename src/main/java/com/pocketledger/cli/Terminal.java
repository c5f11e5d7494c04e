package com.pocketledger.cli;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented stdin/stdout pair. Secrets go through {@link Console} when one is attached.
 */
public class Terminal {
    private final BufferedReader in;
    private final PrintStream out;
    private final Console console;

    public Terminal(BufferedReader in, PrintStream out, Console console) {
        this.in = in;
        this.out = out;
        this.console = console;
    }

    public static Terminal system() {
        return new Terminal(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out,
                System.console());
    }

    /**
     * Prints the label and reads one trimmed line.
     *
     * @throws EndOfInput when stdin is exhausted
     */
    public String prompt(String label) {
        out.print(label);
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) throw new EndOfInput();
            return line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String secret(String label) {
        if (console == null) return prompt(label);
        char[] pw = console.readPassword("%s", label);
        if (pw == null) throw new EndOfInput();
        return new String(pw);
    }

    public void println(String line) {
        out.println(line);
    }

    public void println() {
        out.println();
    }

    public static final class EndOfInput extends RuntimeException {
        EndOfInput() {
            super("end of input", null, false, false);
        }
    }
}
