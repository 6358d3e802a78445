package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.BigOperatorClass;
import io.github.cyfko.texml.core.ast.OperatorForm;
import io.github.cyfko.texml.core.model.Token;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Name to Unicode tables for the zero-argument commands.
 * <p>
 * The tables are closed: a name missing from them renders as {@link #PLACEHOLDER}. They are
 * immutable and shared by all parsers.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SymbolTable {

    /** Glyph rendered for a Greek/operator/symbol name without a mapping. */
    public static final String PLACEHOLDER = "?";

    /**
     * A large operator and the family deciding where its limits go.
     */
    public record BigOperatorSpec(String symbol, BigOperatorClass operatorClass) {}

    /**
     * A fence command and its role.
     */
    public record FenceSpec(String symbol, OperatorForm form) {}

    private static final Map<String, String> GREEK = Map.ofEntries(
            entry("alpha", "α"), entry("beta", "β"), entry("gamma", "γ"), entry("delta", "δ"),
            entry("epsilon", "ε"), entry("zeta", "ζ"), entry("eta", "η"), entry("theta", "θ"),
            entry("iota", "ι"), entry("kappa", "κ"), entry("lambda", "λ"), entry("mu", "μ"),
            entry("nu", "ν"), entry("xi", "ξ"), entry("omicron", "ο"), entry("pi", "π"),
            entry("rho", "ρ"), entry("sigma", "σ"), entry("tau", "τ"), entry("upsilon", "υ"),
            entry("phi", "φ"), entry("chi", "χ"), entry("psi", "ψ"), entry("omega", "ω"),
            entry("Gamma", "Γ"), entry("Delta", "Δ"), entry("Theta", "Θ"), entry("Lambda", "Λ"),
            entry("Xi", "Ξ"), entry("Pi", "Π"), entry("Sigma", "Σ"), entry("Upsilon", "Υ"),
            entry("Phi", "Φ"), entry("Psi", "Ψ"), entry("Omega", "Ω"),
            entry("varepsilon", "ϵ"), entry("vartheta", "ϑ"), entry("varpi", "ϖ"),
            entry("varrho", "ϱ"), entry("varsigma", "ς"), entry("varphi", "ϕ"),
            entry("varkappa", "ϰ"), entry("digamma", "ϝ")
    );

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            // binary operators
            entry("times", "×"), entry("div", "÷"), entry("pm", "±"), entry("mp", "∓"),
            entry("cdot", "⋅"), entry("ast", "∗"), entry("star", "⋆"), entry("circ", "∘"),
            entry("bullet", "•"), entry("oplus", "⊕"), entry("otimes", "⊗"), entry("ominus", "⊖"),
            entry("odot", "⊙"), entry("oslash", "⊘"), entry("cup", "∪"), entry("cap", "∩"),
            entry("sqcup", "⊔"), entry("sqcap", "⊓"), entry("uplus", "⊎"), entry("wedge", "∧"),
            entry("land", "∧"), entry("vee", "∨"), entry("lor", "∨"), entry("setminus", "∖"),
            entry("wr", "≀"), entry("amalg", "⨿"), entry("dagger", "†"), entry("ddagger", "‡"),
            // relations
            entry("ne", "≠"), entry("neq", "≠"), entry("le", "≤"), entry("leq", "≤"),
            entry("ge", "≥"), entry("geq", "≥"), entry("leqslant", "⩽"), entry("geqslant", "⩾"),
            entry("ll", "≪"), entry("gg", "≫"), entry("equiv", "≡"), entry("sim", "∼"),
            entry("simeq", "≃"), entry("approx", "≈"), entry("cong", "≅"), entry("propto", "∝"),
            entry("perp", "⊥"), entry("parallel", "∥"), entry("mid", "∣"), entry("in", "∈"),
            entry("notin", "∉"), entry("ni", "∋"), entry("subset", "⊂"), entry("supset", "⊃"),
            entry("subseteq", "⊆"), entry("supseteq", "⊇"), entry("prec", "≺"), entry("succ", "≻"),
            entry("preceq", "⪯"), entry("succeq", "⪰"), entry("doteq", "≐"), entry("models", "⊨"),
            entry("vdash", "⊢"), entry("dashv", "⊣"), entry("asymp", "≍"),
            // arrows
            entry("to", "→"), entry("rightarrow", "→"), entry("leftarrow", "←"), entry("gets", "←"),
            entry("leftrightarrow", "↔"), entry("Rightarrow", "⇒"), entry("Leftarrow", "⇐"),
            entry("Leftrightarrow", "⇔"), entry("implies", "⟹"), entry("impliedby", "⟸"),
            entry("iff", "⟺"), entry("mapsto", "↦"), entry("longrightarrow", "⟶"),
            entry("longleftarrow", "⟵"), entry("longleftrightarrow", "⟷"), entry("Longrightarrow", "⟹"),
            entry("Longleftarrow", "⟸"), entry("longmapsto", "⟼"), entry("uparrow", "↑"),
            entry("downarrow", "↓"), entry("updownarrow", "↕"), entry("Uparrow", "⇑"),
            entry("Downarrow", "⇓"), entry("nearrow", "↗"), entry("searrow", "↘"),
            entry("swarrow", "↙"), entry("nwarrow", "↖"), entry("hookrightarrow", "↪"),
            entry("hookleftarrow", "↩"), entry("rightleftharpoons", "⇌"),
            // dots
            entry("ldots", "…"), entry("dots", "…"), entry("cdots", "⋯"), entry("vdots", "⋮"),
            entry("ddots", "⋱"),
            // logic and punctuation
            entry("neg", "¬"), entry("lnot", "¬"), entry("colon", ":"),
            entry("lq", "‘"), entry("rq", "’"),
            // escaped characters
            entry("%", "%"), entry("&", "&"), entry("#", "#"), entry("$", "$"), entry("_", "_")
    );

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
            entry("infty", "∞"), entry("partial", "∂"), entry("nabla", "∇"), entry("emptyset", "∅"),
            entry("varnothing", "∅"), entry("forall", "∀"), entry("exists", "∃"), entry("nexists", "∄"),
            entry("hbar", "ℏ"), entry("hslash", "ℏ"), entry("ell", "ℓ"), entry("wp", "℘"),
            entry("Re", "ℜ"), entry("Im", "ℑ"), entry("aleph", "ℵ"), entry("beth", "ℶ"),
            entry("angle", "∠"), entry("prime", "′"), entry("top", "⊤"), entry("bot", "⊥"),
            entry("triangle", "△"), entry("Box", "□"), entry("Diamond", "◇"),
            entry("clubsuit", "♣"), entry("diamondsuit", "♢"), entry("heartsuit", "♡"),
            entry("spadesuit", "♠"), entry("flat", "♭"), entry("natural", "♮"), entry("sharp", "♯"),
            entry("imath", "ı"), entry("jmath", "ȷ"), entry("degree", "°"), entry("complement", "∁"),
            entry("therefore", "∴"), entry("because", "∵"), entry("checkmark", "✓")
    );

    private static final Map<String, FenceSpec> FENCES = Map.ofEntries(
            entry("langle", new FenceSpec("⟨", OperatorForm.PREFIX)),
            entry("rangle", new FenceSpec("⟩", OperatorForm.POSTFIX)),
            entry("lvert", new FenceSpec("|", OperatorForm.PREFIX)),
            entry("rvert", new FenceSpec("|", OperatorForm.POSTFIX)),
            entry("lVert", new FenceSpec("‖", OperatorForm.PREFIX)),
            entry("rVert", new FenceSpec("‖", OperatorForm.POSTFIX)),
            entry("lfloor", new FenceSpec("⌊", OperatorForm.PREFIX)),
            entry("rfloor", new FenceSpec("⌋", OperatorForm.POSTFIX)),
            entry("lceil", new FenceSpec("⌈", OperatorForm.PREFIX)),
            entry("rceil", new FenceSpec("⌉", OperatorForm.POSTFIX)),
            entry("{", new FenceSpec("{", OperatorForm.PREFIX)),
            entry("}", new FenceSpec("}", OperatorForm.POSTFIX)),
            entry("|", new FenceSpec("‖", OperatorForm.INFIX)),
            entry("vert", new FenceSpec("|", OperatorForm.INFIX)),
            entry("Vert", new FenceSpec("‖", OperatorForm.INFIX))
    );

    private static final Map<String, BigOperatorSpec> BIG_OPERATORS = Map.ofEntries(
            entry("sum", new BigOperatorSpec("∑", BigOperatorClass.SUMMATION)),
            entry("prod", new BigOperatorSpec("∏", BigOperatorClass.SUMMATION)),
            entry("coprod", new BigOperatorSpec("∐", BigOperatorClass.SUMMATION)),
            entry("bigcup", new BigOperatorSpec("⋃", BigOperatorClass.SUMMATION)),
            entry("bigcap", new BigOperatorSpec("⋂", BigOperatorClass.SUMMATION)),
            entry("bigoplus", new BigOperatorSpec("⨁", BigOperatorClass.SUMMATION)),
            entry("bigotimes", new BigOperatorSpec("⨂", BigOperatorClass.SUMMATION)),
            entry("bigodot", new BigOperatorSpec("⨀", BigOperatorClass.SUMMATION)),
            entry("bigvee", new BigOperatorSpec("⋁", BigOperatorClass.SUMMATION)),
            entry("bigwedge", new BigOperatorSpec("⋀", BigOperatorClass.SUMMATION)),
            entry("bigsqcup", new BigOperatorSpec("⨆", BigOperatorClass.SUMMATION)),
            entry("int", new BigOperatorSpec("∫", BigOperatorClass.INTEGRAL)),
            entry("iint", new BigOperatorSpec("∬", BigOperatorClass.INTEGRAL)),
            entry("iiint", new BigOperatorSpec("∭", BigOperatorClass.INTEGRAL)),
            entry("oint", new BigOperatorSpec("∮", BigOperatorClass.INTEGRAL)),
            entry("oiint", new BigOperatorSpec("∯", BigOperatorClass.INTEGRAL)),
            entry("lim", new BigOperatorSpec("lim", BigOperatorClass.LIMIT)),
            entry("limsup", new BigOperatorSpec("lim sup", BigOperatorClass.LIMIT)),
            entry("liminf", new BigOperatorSpec("lim inf", BigOperatorClass.LIMIT)),
            entry("max", new BigOperatorSpec("max", BigOperatorClass.LIMIT)),
            entry("min", new BigOperatorSpec("min", BigOperatorClass.LIMIT)),
            entry("sup", new BigOperatorSpec("sup", BigOperatorClass.LIMIT)),
            entry("inf", new BigOperatorSpec("inf", BigOperatorClass.LIMIT)),
            entry("det", new BigOperatorSpec("det", BigOperatorClass.LIMIT)),
            entry("gcd", new BigOperatorSpec("gcd", BigOperatorClass.LIMIT)),
            entry("Pr", new BigOperatorSpec("Pr", BigOperatorClass.LIMIT)),
            entry("argmax", new BigOperatorSpec("arg max", BigOperatorClass.LIMIT)),
            entry("argmin", new BigOperatorSpec("arg min", BigOperatorClass.LIMIT))
    );

    private static final Set<String> FUNCTIONS = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "coth", "log", "ln", "lg", "exp", "arg", "ker", "dim", "hom", "deg"
    );

    /** Command-spelled delimiters accepted after {@code \left}, {@code \right} and {@code \big}. */
    private static final Map<String, String> COMMAND_DELIMITERS = Map.ofEntries(
            entry("{", "{"), entry("}", "}"), entry("|", "‖"),
            entry("langle", "⟨"), entry("rangle", "⟩"), entry("lvert", "|"), entry("rvert", "|"),
            entry("lVert", "‖"), entry("rVert", "‖"), entry("vert", "|"), entry("Vert", "‖"),
            entry("lfloor", "⌊"), entry("rfloor", "⌋"), entry("lceil", "⌈"), entry("rceil", "⌉"),
            entry("backslash", "∖"), entry("uparrow", "↑"), entry("downarrow", "↓"),
            entry("updownarrow", "↕"), entry("Uparrow", "⇑"), entry("Downarrow", "⇓")
    );

    private static final Map<String, String> SPACE_WIDTHS = Map.ofEntries(
            entry(",", "0.1667em"), entry("thinspace", "0.1667em"),
            entry(":", "0.2222em"), entry(">", "0.2222em"), entry("medspace", "0.2222em"),
            entry(";", "0.2778em"), entry("thickspace", "0.2778em"),
            entry("!", "-0.1667em"), entry("negthinspace", "-0.1667em"),
            entry("negmedspace", "-0.2222em"), entry("negthickspace", "-0.2778em"),
            entry(" ", "0.3333em"), entry("enspace", "0.5em"), entry("quad", "1em"), entry("qquad", "2em")
    );

    /** Precomposed negations; any other character gets U+0338 appended. */
    private static final Map<String, String> NEGATIONS = Map.ofEntries(
            entry("=", "≠"), entry("<", "≮"), entry(">", "≯"), entry("≤", "≰"), entry("≥", "≱"),
            entry("≡", "≢"), entry("∼", "≁"), entry("≃", "≄"), entry("≈", "≉"), entry("≅", "≇"),
            entry("∈", "∉"), entry("∋", "∌"), entry("⊂", "⊄"), entry("⊃", "⊅"), entry("⊆", "⊈"),
            entry("⊇", "⊉"), entry("∃", "∄"), entry("∣", "∤"), entry("∥", "∦"), entry("→", "↛"),
            entry("←", "↚"), entry("↔", "↮"), entry("⇒", "⇏"), entry("⇐", "⇍"), entry("⇔", "⇎")
    );

    /** Width of the non-breaking space {@code ~} and of {@code \ }. */
    public static final String INTERWORD_SPACE = "0.3333em";

    private SymbolTable() {
        // static tables only
    }

    public static Map<String, String> greek() {
        return GREEK;
    }

    public static Map<String, String> operators() {
        return OPERATORS;
    }

    public static Map<String, String> symbols() {
        return SYMBOLS;
    }

    public static Map<String, FenceSpec> fences() {
        return FENCES;
    }

    public static Map<String, BigOperatorSpec> bigOperators() {
        return BIG_OPERATORS;
    }

    public static Set<String> functions() {
        return FUNCTIONS;
    }

    public static String greekLetter(String name) {
        return GREEK.getOrDefault(name, PLACEHOLDER);
    }

    public static String operator(String name) {
        return OPERATORS.getOrDefault(name, PLACEHOLDER);
    }

    public static String symbol(String name) {
        return SYMBOLS.getOrDefault(name, PLACEHOLDER);
    }

    /**
     * @param name spacing command name, e.g. {@code ,} or {@code quad}
     * @return the MathML width, empty for names that are not fixed spaces
     */
    public static Optional<String> spaceWidth(String name) {
        return Optional.ofNullable(SPACE_WIDTHS.get(name));
    }

    /**
     * Negates a relation or symbol for {@code \not}.
     *
     * @param value the rendered character
     * @return the precomposed negated character, or the value followed by a combining long solidus
     */
    public static String negate(String value) {
        return NEGATIONS.getOrDefault(value, value + "\u0338");
    }

    /**
     * Renders an operator character typed directly in the source. The hyphen becomes a
     * minus sign and the asterisk an asterisk operator; other characters render as typed.
     *
     * @param character the source character
     * @return the text to render
     */
    public static String literalOperator(String character) {
        return switch (character) {
            case "-" -> "−";
            case "*" -> "∗";
            default -> character;
        };
    }

    /**
     * Resolves the delimiter following {@code \left}, {@code \right}, {@code \middle} or a
     * {@code \big} command. The empty string stands for the invisible delimiter {@code .}.
     *
     * @param token the token after the command
     * @return the delimiter text, empty if the token is not a delimiter
     */
    public static Optional<String> delimiter(Token token) {
        return switch (token.kind()) {
            case LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, VERT -> Optional.of(token.value());
            case OPERATOR -> switch (token.value()) {
                case "." -> Optional.of("");
                case "/" -> Optional.of("/");
                case "<" -> Optional.of("⟨");
                case ">" -> Optional.of("⟩");
                default -> Optional.empty();
            };
            case COMMAND -> Optional.ofNullable(COMMAND_DELIMITERS.get(token.value()));
            default -> Optional.empty();
        };
    }
}
