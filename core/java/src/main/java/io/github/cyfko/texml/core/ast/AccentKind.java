package io.github.cyfko.texml.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Accents and over/under decorations.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum AccentKind {
    HAT("hat", "^", false, false),
    BAR("bar", "¯", false, false),
    TILDE("tilde", "~", false, false),
    DOT("dot", "˙", false, false),
    DDOT("ddot", "¨", false, false),
    VEC("vec", "→", false, false),
    CHECK("check", "ˇ", false, false),
    BREVE("breve", "˘", false, false),
    ACUTE("acute", "´", false, false),
    GRAVE("grave", "`", false, false),
    WIDEHAT("widehat", "^", false, true),
    WIDETILDE("widetilde", "~", false, true),
    OVERLINE("overline", "‾", false, true),
    UNDERLINE("underline", "_", true, true),
    OVERBRACE("overbrace", "⏞", false, true),
    UNDERBRACE("underbrace", "⏟", true, true),
    OVERRIGHTARROW("overrightarrow", "→", false, true),
    OVERLEFTARROW("overleftarrow", "←", false, true);

    private final String command;
    private final String mark;
    private final boolean under;
    private final boolean stretchy;

    AccentKind(String command, String mark, boolean under, boolean stretchy) {
        this.command = command;
        this.mark = mark;
        this.under = under;
        this.stretchy = stretchy;
    }

    public String command() {
        return command;
    }

    public String mark() {
        return mark;
    }

    /**
     * @return true when the mark goes below the base
     */
    public boolean isUnder() {
        return under;
    }

    public boolean isStretchy() {
        return stretchy;
    }

    /**
     * @return true for the braces, which take their scripts below or above rather than aside
     */
    public boolean isBrace() {
        return this == OVERBRACE || this == UNDERBRACE;
    }

    public static Optional<AccentKind> fromCommand(String command) {
        return Arrays.stream(values()).filter(kind -> kind.command.equals(command)).findFirst();
    }
}
