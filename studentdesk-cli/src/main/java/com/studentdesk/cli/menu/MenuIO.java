package com.studentdesk.cli.menu;

import java.io.Closeable;

/**
 * Line-oriented terminal used by the menu.
 */
public interface MenuIO extends Closeable {

    /**
     * Prints {@code label + ": "} and reads one line.
     *
     * @return the line as typed, or null when input has ended (EOF, Ctrl-D, Ctrl-C)
     */
    String readLine(String label);

    void println(String text);
}
