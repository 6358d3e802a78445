package io.github.cyfko.texml.core.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Font variants selectable with {@code \mathbb} and friends, with their MathML
 * {@code mathvariant} value.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum StyleKind {
    BOLD("bold", "mathbf", "textbf"),
    ITALIC("italic", "mathit", "textit"),
    BOLD_ITALIC("bold-italic", "boldsymbol", "bm"),
    NORMAL("normal", "mathrm", "mathup"),
    DOUBLE_STRUCK("double-struck", "mathbb"),
    SCRIPT("script", "mathcal", "mathscr"),
    FRAKTUR("fraktur", "mathfrak"),
    SANS_SERIF("sans-serif", "mathsf", "textsf"),
    MONOSPACE("monospace", "mathtt", "texttt");

    private final String mathvariant;
    private final List<String> commands;

    StyleKind(String mathvariant, String... commands) {
        this.mathvariant = mathvariant;
        this.commands = List.of(commands);
    }

    public String mathvariant() {
        return mathvariant;
    }

    public List<String> commands() {
        return commands;
    }

    public static Optional<StyleKind> fromCommand(String command) {
        return Arrays.stream(values()).filter(kind -> kind.commands.contains(command)).findFirst();
    }
}
