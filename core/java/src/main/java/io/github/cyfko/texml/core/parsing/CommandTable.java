package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.AccentKind;
import io.github.cyfko.texml.core.ast.MathSizeKind;
import io.github.cyfko.texml.core.ast.MathStyleLevel;
import io.github.cyfko.texml.core.ast.StyleKind;
import io.github.cyfko.texml.core.model.SIPrefixKind;
import io.github.cyfko.texml.core.model.SIUnitKind;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only mapping from built-in command name to {@link CommandInfo}.
 * <p>
 * Built once and shared by every parser in the process. Names are case-sensitive and are
 * stored without the leading backslash. When a name could belong to two categories, the
 * category registered first wins (text styles such as {@code \textbf} are TEXT, not STYLE).
 * </p>
 *
 * <pre>{@code
 * CommandTable.standard().lookup("frac");   // Optional[CommandInfo[FRACTION, 2]]
 * CommandTable.standard().lookup("foo");    // Optional.empty
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CommandTable {

    private static final CommandTable STANDARD = new CommandTable(buildStandardEntries());

    private final Map<String, CommandInfo> entries;

    private CommandTable(Map<String, CommandInfo> entries) {
        this.entries = Map.copyOf(entries);
    }

    /**
     * @return the shared table of built-in commands
     */
    public static CommandTable standard() {
        return STANDARD;
    }

    public Optional<CommandInfo> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return every command name registered under the given category
     */
    public Set<String> names(CommandCategory category) {
        return entries.entrySet().stream()
                .filter(entry -> entry.getValue().category() == category)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static Map<String, CommandInfo> buildStandardEntries() {
        Map<String, CommandInfo> map = new HashMap<>();

        register(map, CommandCategory.FRACTION, 2, "frac", "cfrac", "dfrac", "tfrac");
        register(map, CommandCategory.BINOMIAL, 2, "binom", "dbinom", "tbinom");
        register(map, CommandCategory.GENERALIZED_FRACTION, 6, "genfrac");
        register(map, CommandCategory.INFIX_FRACTION, 0, "over", "choose", "atop");
        register(map, CommandCategory.SQRT, 1, "sqrt");

        register(map, CommandCategory.DELIMITER, 1, "left", "right", "middle");
        register(map, CommandCategory.SIZED_DELIMITER, 1,
                "big", "Big", "bigg", "Bigg", "bigl", "Bigl", "biggl", "Biggl",
                "bigr", "Bigr", "biggr", "Biggr", "bigm", "Bigm", "biggm", "Biggm");
        register(map, CommandCategory.ENVIRONMENT, 1, "begin", "end");

        register(map, CommandCategory.TEXT, 1,
                "text", "textrm", "textnormal", "textup", "mbox", "hbox",
                "textbf", "textit", "textsf", "texttt");
        register(map, CommandCategory.SPACE, 0,
                ",", ":", ">", ";", "!", " ", "quad", "qquad", "enspace", "thinspace", "medspace",
                "thickspace", "negthinspace", "negmedspace", "negthickspace");
        register(map, CommandCategory.SPACE, 1, "hspace");
        register(map, CommandCategory.COLOR, 1, "color");
        register(map, CommandCategory.COLOR, 2, "textcolor");
        register(map, CommandCategory.MATH_STYLE, 0,
                Arrays.stream(MathStyleLevel.values()).map(MathStyleLevel::command).toList());
        register(map, CommandCategory.MATH_SIZE, 0,
                Arrays.stream(MathSizeKind.values()).map(MathSizeKind::command).toList());
        register(map, CommandCategory.PHANTOM, 1, "phantom", "hphantom", "vphantom");
        register(map, CommandCategory.PHANTOM, 0, "mathstrut");
        register(map, CommandCategory.UNDER_OVER, 2, "underset", "overset", "stackrel");

        register(map, CommandCategory.STYLE, 1,
                Arrays.stream(StyleKind.values()).flatMap(kind -> kind.commands().stream()).toList());
        register(map, CommandCategory.ACCENT, 1,
                Arrays.stream(AccentKind.values()).map(AccentKind::command).toList());
        register(map, CommandCategory.NEGATION, 1, "not");

        register(map, CommandCategory.SIUNITX, 1, "num", "si", "unit");
        register(map, CommandCategory.SIUNITX, 2, "SI", "qty");
        register(map, CommandCategory.SI_UNIT, 0,
                Arrays.stream(SIUnitKind.values()).flatMap(kind -> kind.commands().stream()).toList());
        register(map, CommandCategory.SI_PREFIX, 0,
                Arrays.stream(SIPrefixKind.values())
                        .filter(kind -> kind != SIPrefixKind.NONE)
                        .map(SIPrefixKind::command)
                        .toList());
        register(map, CommandCategory.SI_PREFIX, 0, "deka");
        register(map, CommandCategory.SI_OPERATOR, 0, "per", "squared", "cubed", "square", "cubic");
        register(map, CommandCategory.SI_OPERATOR, 1, "tothe", "raiseto");

        register(map, CommandCategory.MACRO_DEFINITION, 0, "def", "newcommand", "renewcommand", "providecommand");
        register(map, CommandCategory.IGNORED, 0, "limits", "nolimits", "displaylimits", "nonumber", "notag", "relax");

        register(map, CommandCategory.BIG_OPERATOR, 0, SymbolTable.bigOperators().keySet());
        register(map, CommandCategory.FUNCTION, 0, SymbolTable.functions());
        register(map, CommandCategory.FUNCTION, 1, "operatorname");
        register(map, CommandCategory.GREEK, 0, SymbolTable.greek().keySet());
        register(map, CommandCategory.FENCE, 0, SymbolTable.fences().keySet());
        register(map, CommandCategory.OPERATOR, 0, SymbolTable.operators().keySet());
        register(map, CommandCategory.SYMBOL, 0, SymbolTable.symbols().keySet());

        return map;
    }

    private static void register(Map<String, CommandInfo> map, CommandCategory category, int arity, String... names) {
        register(map, category, arity, Arrays.asList(names));
    }

    private static void register(Map<String, CommandInfo> map, CommandCategory category, int arity,
                                 Collection<String> names) {
        CommandInfo info = new CommandInfo(category, arity);
        for (String name : names) {
            map.putIfAbsent(name, info);
        }
    }
}
