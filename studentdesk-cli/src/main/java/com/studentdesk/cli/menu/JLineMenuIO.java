package com.studentdesk.cli.menu;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Interactive terminal with line editing and history.
 */
public final class JLineMenuIO implements MenuIO {

    private static final Logger log = LoggerFactory.getLogger(JLineMenuIO.class);

    private final Terminal terminal;
    private final LineReader reader;

    private JLineMenuIO(Terminal terminal) {
        this.terminal = terminal;
        this.reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("studentdesk")
                .build();
    }

    public static JLineMenuIO open() throws IOException {
        return new JLineMenuIO(buildTerminal());
    }

    /**
     * Some hosts cannot load the native terminal providers; fall back to a dumb terminal instead of failing.
     */
    private static Terminal buildTerminal() throws IOException {
        try {
            return TerminalBuilder.builder()
                    .system(true)
                    .build();
        } catch (IOException | RuntimeException e) {
            log.debug("System terminal unavailable, using dumb terminal", e);
        }

        return TerminalBuilder.builder()
                .system(true)
                .dumb(true)
                .build();
    }

    @Override
    public String readLine(String label) {
        try {
            return reader.readLine(label + ": ");
        } catch (EndOfFileException | UserInterruptException e) {
            return null;
        }
    }

    @Override
    public void println(String text) {
        terminal.writer().println(text);
        terminal.writer().flush();
    }

    @Override
    public void close() throws IOException {
        terminal.close();
    }
}
