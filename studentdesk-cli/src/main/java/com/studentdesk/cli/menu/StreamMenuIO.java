package com.studentdesk.cli.menu;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Plain stream I/O. Used when no interactive terminal is attached (pipes, tests).
 */
public final class StreamMenuIO implements MenuIO {

    private final BufferedReader in;
    private final PrintStream out;

    public StreamMenuIO(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public String readLine(String label) {
        out.print(label + ": ");
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        }
    }

    @Override
    public void println(String text) {
        out.println(text);
    }

    @Override
    public void close() {
        out.flush();
    }
}
