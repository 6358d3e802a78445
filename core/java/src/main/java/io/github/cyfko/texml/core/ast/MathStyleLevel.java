package io.github.cyfko.texml.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * TeX math styles and the MathML attributes that reproduce them.
 */
public enum MathStyleLevel {
    DISPLAY("displaystyle", true, 0),
    TEXT("textstyle", false, 0),
    SCRIPT("scriptstyle", false, 1),
    SCRIPT_SCRIPT("scriptscriptstyle", false, 2);

    private final String command;
    private final boolean displaystyle;
    private final int scriptLevel;

    MathStyleLevel(String command, boolean displaystyle, int scriptLevel) {
        this.command = command;
        this.displaystyle = displaystyle;
        this.scriptLevel = scriptLevel;
    }

    public String command() {
        return command;
    }

    public boolean displaystyle() {
        return displaystyle;
    }

    public int scriptLevel() {
        return scriptLevel;
    }

    public static Optional<MathStyleLevel> fromCommand(String command) {
        return Arrays.stream(values()).filter(level -> level.command.equals(command)).findFirst();
    }
}
