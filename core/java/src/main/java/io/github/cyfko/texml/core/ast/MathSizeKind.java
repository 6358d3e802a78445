package io.github.cyfko.texml.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * LaTeX size switches and their relative MathML {@code mathsize}.
 */
public enum MathSizeKind {
    TINY("tiny", "0.5em"),
    SCRIPTSIZE("scriptsize", "0.7em"),
    FOOTNOTESIZE("footnotesize", "0.8em"),
    SMALL("small", "0.9em"),
    NORMALSIZE("normalsize", "1em"),
    LARGE("large", "1.2em"),
    LARGER("Large", "1.44em"),
    LARGEST("LARGE", "1.728em"),
    HUGE("huge", "2.074em"),
    HUGER("Huge", "2.488em");

    private final String command;
    private final String size;

    MathSizeKind(String command, String size) {
        this.command = command;
        this.size = size;
    }

    public String command() {
        return command;
    }

    public String size() {
        return size;
    }

    public static Optional<MathSizeKind> fromCommand(String command) {
        return Arrays.stream(values()).filter(kind -> kind.command.equals(command)).findFirst();
    }
}
