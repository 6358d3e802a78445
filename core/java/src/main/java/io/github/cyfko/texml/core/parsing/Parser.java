package io.github.cyfko.texml.core.parsing;

import io.github.cyfko.texml.core.ast.AccentKind;
import io.github.cyfko.texml.core.ast.AccentNode;
import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.ast.AtopNode;
import io.github.cyfko.texml.core.ast.BigOperatorClass;
import io.github.cyfko.texml.core.ast.BigOperatorNode;
import io.github.cyfko.texml.core.ast.BinomialNode;
import io.github.cyfko.texml.core.ast.ColorNode;
import io.github.cyfko.texml.core.ast.DelimitedNode;
import io.github.cyfko.texml.core.ast.FenceStyle;
import io.github.cyfko.texml.core.ast.FractionNode;
import io.github.cyfko.texml.core.ast.FractionStyle;
import io.github.cyfko.texml.core.ast.FunctionNode;
import io.github.cyfko.texml.core.ast.IdentifierNode;
import io.github.cyfko.texml.core.ast.LimitsMode;
import io.github.cyfko.texml.core.ast.MathSizeKind;
import io.github.cyfko.texml.core.ast.MathSizeNode;
import io.github.cyfko.texml.core.ast.MathStyleLevel;
import io.github.cyfko.texml.core.ast.MathStyleNode;
import io.github.cyfko.texml.core.ast.NumberNode;
import io.github.cyfko.texml.core.ast.OperatorForm;
import io.github.cyfko.texml.core.ast.OperatorNode;
import io.github.cyfko.texml.core.ast.PhantomKind;
import io.github.cyfko.texml.core.ast.PhantomNode;
import io.github.cyfko.texml.core.ast.RootNode;
import io.github.cyfko.texml.core.ast.RowNode;
import io.github.cyfko.texml.core.ast.SIUnitNode;
import io.github.cyfko.texml.core.ast.SizedDelimiterNode;
import io.github.cyfko.texml.core.ast.SpaceNode;
import io.github.cyfko.texml.core.ast.SqrtNode;
import io.github.cyfko.texml.core.ast.StyleKind;
import io.github.cyfko.texml.core.ast.StyleNode;
import io.github.cyfko.texml.core.ast.SubSupNode;
import io.github.cyfko.texml.core.ast.SubscriptNode;
import io.github.cyfko.texml.core.ast.SuperscriptNode;
import io.github.cyfko.texml.core.ast.SymbolNode;
import io.github.cyfko.texml.core.ast.TextNode;
import io.github.cyfko.texml.core.ast.UnderOverNode;
import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.core.exception.CompileException;
import io.github.cyfko.texml.core.exception.ErrorKind;
import io.github.cyfko.texml.core.model.MacroDefinition;
import io.github.cyfko.texml.core.model.SIUnitComponent;
import io.github.cyfko.texml.core.model.SIUnitKind;
import io.github.cyfko.texml.core.model.Token;
import io.github.cyfko.texml.core.model.TokenKind;
import io.github.cyfko.texml.core.spi.MacroRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Recursive descent parser turning a token list into an {@link AstNode} tree.
 * <p>
 * Command dispatch is table driven: the {@link CommandTable} gives the {@link CommandCategory}
 * of a name and one {@link CommandHandler} per category builds the node. Commands the table
 * does not know are looked up in the caller's {@link MacroRegistry}, then degrade to an
 * identifier.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = Lexer.standard().lex("x_i^2");
 * AstNode ast = new Parser(tokens, new MacroRegistry(), CompilerPolicy.defaults()).parse();
 * // SubSupNode[base=IdentifierNode[x], subscript=IdentifierNode[i], superscript=NumberNode[2]]
 * }</pre>
 *
 * <p>A parser is single use and not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Parser {
    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

    private final TokenStream tokens;
    private final MacroRegistry registry;
    private final CompilerPolicy policy;
    private final CommandTable commands = CommandTable.standard();
    private final int expansionDepth;
    private final Map<CommandCategory, CommandHandler> handlers = new EnumMap<>(CommandCategory.class);
    private final EnvironmentParser environments;
    private final MacroExpander macros;
    private final SiunitxParser siunitx;

    private int nestingDepth;
    private int leftRightDepth;
    /** Open bare parentheses/brackets in the current scope; a closer only ends a sequence when positive. */
    private int bareDepth;

    /**
     * @param tokens   tokens from the {@link Lexer}
     * @param registry macros visible to this parse; definitions found in the source are added to it
     * @param policy   resource limits
     */
    public Parser(List<Token> tokens, MacroRegistry registry, CompilerPolicy policy) {
        this(tokens, registry, policy, 0, 0);
    }

    private Parser(List<Token> tokens, MacroRegistry registry, CompilerPolicy policy,
                   int expansionDepth, int nestingDepth) {
        this.tokens = new TokenStream(tokens);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.expansionDepth = expansionDepth;
        this.nestingDepth = nestingDepth;
        this.environments = new EnvironmentParser(this);
        this.macros = new MacroExpander(this);
        this.siunitx = new SiunitxParser(this);
        registerHandlers();
    }

    /**
     * Parses the whole token list as one expression.
     *
     * @return the root node; an empty row if the source only defines macros
     * @throws CompileException on malformed input
     */
    public AstNode parse() {
        if (tokens.isAtEnd()) {
            throw new CompileException(ErrorKind.UNEXPECTED_EOF, "Empty expression", tokens.position());
        }
        List<AstNode> nodes = parseSequence(true);
        expectEndOfInput();
        return RowNode.wrap(nodes);
    }

    private void registerHandlers() {
        handlers.put(CommandCategory.FRACTION, this::parseFraction);
        handlers.put(CommandCategory.BINOMIAL, this::parseBinomial);
        handlers.put(CommandCategory.GENERALIZED_FRACTION, this::parseGeneralizedFraction);
        handlers.put(CommandCategory.INFIX_FRACTION, (command, info) -> {
            throw CompileException.unexpectedToken(command.toSource(), command.position());
        });
        handlers.put(CommandCategory.SQRT, this::parseSqrt);
        handlers.put(CommandCategory.GREEK, (command, info) ->
                Optional.of(new SymbolNode(command.value(), degraded(command, SymbolTable.greekLetter(command.value())))));
        handlers.put(CommandCategory.OPERATOR, (command, info) ->
                Optional.of(OperatorNode.of(command.value(), degraded(command, SymbolTable.operator(command.value())))));
        handlers.put(CommandCategory.SYMBOL, (command, info) ->
                Optional.of(new SymbolNode(command.value(), degraded(command, SymbolTable.symbol(command.value())))));
        handlers.put(CommandCategory.FENCE, this::parseFence);
        handlers.put(CommandCategory.NEGATION, this::parseNegation);
        handlers.put(CommandCategory.STYLE, this::parseStyle);
        handlers.put(CommandCategory.ACCENT, this::parseAccent);
        handlers.put(CommandCategory.BIG_OPERATOR, this::parseBigOperator);
        handlers.put(CommandCategory.FUNCTION, this::parseFunction);
        handlers.put(CommandCategory.DELIMITER, this::parseDelimiter);
        handlers.put(CommandCategory.SIZED_DELIMITER, this::parseSizedDelimiter);
        handlers.put(CommandCategory.ENVIRONMENT, this::parseEnvironment);
        handlers.put(CommandCategory.TEXT, this::parseText);
        handlers.put(CommandCategory.SPACE, this::parseSpace);
        handlers.put(CommandCategory.COLOR, this::parseColor);
        handlers.put(CommandCategory.MATH_STYLE, (command, info) -> Optional.of(new MathStyleNode(
                MathStyleLevel.fromCommand(command.value()).orElseThrow(), parseRestOfGroup())));
        handlers.put(CommandCategory.MATH_SIZE, (command, info) -> Optional.of(new MathSizeNode(
                MathSizeKind.fromCommand(command.value()).orElseThrow(), parseRestOfGroup())));
        handlers.put(CommandCategory.PHANTOM, this::parsePhantom);
        handlers.put(CommandCategory.UNDER_OVER, this::parseUnderOver);
        handlers.put(CommandCategory.SIUNITX, siunitx::parse);
        handlers.put(CommandCategory.SI_UNIT, (command, info) -> Optional.of(new SIUnitNode(
                List.of(SIUnitComponent.of(SIUnitKind.fromCommand(command.value()).orElseThrow())), List.of())));
        handlers.put(CommandCategory.SI_PREFIX, (command, info) -> {
            throw CompileException.invalidCommand(command.toSource(), command.position());
        });
        handlers.put(CommandCategory.SI_OPERATOR, (command, info) -> {
            throw CompileException.invalidCommand(command.toSource(), command.position());
        });
        handlers.put(CommandCategory.MACRO_DEFINITION, (command, info) -> {
            macros.define(command);
            return Optional.empty();
        });
        handlers.put(CommandCategory.IGNORED, (command, info) -> Optional.empty());
    }

    // ==================== Expression grammar ====================

    /**
     * Parses terms until a token that ends a sequence.
     *
     * @param allowInfix whether {@code \over}, {@code \choose} and {@code \atop} may split the sequence
     * @return the parsed terms, possibly none
     */
    List<AstNode> parseSequence(boolean allowInfix) {
        List<AstNode> nodes = new ArrayList<>();
        while (!atSequenceEnd()) {
            Token token = tokens.peek();
            if (allowInfix && token.is(TokenKind.COMMAND) && isInfixFraction(token.value())) {
                tokens.advance();
                AstNode left = RowNode.wrap(nodes);
                AstNode right = RowNode.wrap(parseSequence(true));
                AstNode fraction = switch (token.value()) {
                    case "choose" -> new BinomialNode(left, right, FractionStyle.NORMAL);
                    case "atop" -> new AtopNode(left, right);
                    default -> new FractionNode(left, right, FractionStyle.NORMAL);
                };
                return new ArrayList<>(List.of(fraction));
            }
            parseTerm().ifPresent(nodes::add);
        }
        return nodes;
    }

    private boolean atSequenceEnd() {
        Token token = tokens.peek();
        return switch (token.kind()) {
            case EOF, RIGHT_BRACE, AMPERSAND, LINE_BREAK -> true;
            case RIGHT_PAREN, RIGHT_BRACKET -> bareDepth > 0;
            case COMMAND -> token.isCommand("right") || token.isCommand("end");
            default -> false;
        };
    }

    private boolean isInfixFraction(String name) {
        return commands.lookup(name)
                .map(info -> info.category() == CommandCategory.INFIX_FRACTION)
                .orElse(false);
    }

    /**
     * A primary with its scripts and postfix factorials. Leading scripts attach to an empty row.
     */
    private Optional<AstNode> parseTerm() {
        Token token = tokens.peek();
        AstNode base;
        if (token.is(TokenKind.SUBSCRIPT) || token.is(TokenKind.SUPERSCRIPT) || token.isOperator("'")) {
            base = RowNode.empty();
        } else {
            Optional<AstNode> primary = parsePrimary();
            if (primary.isEmpty()) {
                return Optional.empty();
            }
            base = primary.get();
        }

        AstNode node = parseScripts(base);
        if (tokens.peek().isOperator("!")) {
            List<AstNode> parts = new ArrayList<>();
            parts.add(node);
            while (tokens.peek().isOperator("!")) {
                tokens.advance();
                parts.add(OperatorNode.postfix("!", "!"));
            }
            node = new RowNode(parts);
        }
        return Optional.of(node);
    }

    /**
     * Collects {@code _}, {@code ^} and primes following a base, in any order.
     */
    AstNode parseScripts(AstNode base) {
        AstNode subscript = null;
        AstNode superscript = null;
        boolean explicitSuperscript = false;

        while (true) {
            Token token = tokens.peek();
            if (token.isOperator("'")) {
                int count = 0;
                while (tokens.peek().isOperator("'")) {
                    tokens.advance();
                    count++;
                }
                superscript = append(superscript, primes(count));
            } else if (token.is(TokenKind.SUPERSCRIPT)) {
                if (explicitSuperscript) {
                    // double superscript: the first pair becomes the base of the next
                    base = attachScripts(base, subscript, superscript);
                    subscript = null;
                    superscript = null;
                }
                tokens.advance();
                superscript = append(superscript, parseScriptArgument(token));
                explicitSuperscript = true;
            } else if (token.is(TokenKind.SUBSCRIPT)) {
                if (subscript != null) {
                    base = attachScripts(base, subscript, superscript);
                    superscript = null;
                    explicitSuperscript = false;
                }
                tokens.advance();
                subscript = parseScriptArgument(token);
            } else {
                return attachScripts(base, subscript, superscript);
            }
        }
    }

    private static AstNode attachScripts(AstNode base, AstNode subscript, AstNode superscript) {
        if (subscript != null && superscript != null) {
            return new SubSupNode(base, subscript, superscript);
        }
        if (subscript != null) {
            return new SubscriptNode(base, subscript);
        }
        if (superscript != null) {
            return new SuperscriptNode(base, superscript);
        }
        return base;
    }

    private static AstNode append(AstNode existing, AstNode next) {
        if (existing == null) {
            return next;
        }
        List<AstNode> children = new ArrayList<>();
        if (existing instanceof RowNode row) {
            children.addAll(row.children());
        } else {
            children.add(existing);
        }
        children.add(next);
        return new RowNode(children);
    }

    private static AstNode primes(int count) {
        return switch (count) {
            case 1 -> OperatorNode.of("'", "′");
            case 2 -> OperatorNode.of("''", "″");
            case 3 -> OperatorNode.of("'''", "‴");
            default -> OperatorNode.of("'".repeat(count), "′".repeat(count));
        };
    }

    /**
     * The operand of {@code _} or {@code ^}: a group, one digit of a number, or one primary.
     */
    AstNode parseScriptArgument(Token script) {
        Token next = tokens.peek();
        if (next.is(TokenKind.LEFT_BRACE)) {
            return parseGroup();
        }
        if (next.is(TokenKind.NUMBER)) {
            return new NumberNode(tokens.advanceLeadingDigit().value());
        }
        if (cannotStartArgument(next)) {
            throw CompileException.missingArgument(script.value(), script.position());
        }
        return parseArgumentPrimary(script);
    }

    private Optional<AstNode> parsePrimary() {
        Token token = tokens.peek();
        return switch (token.kind()) {
            case NUMBER -> {
                tokens.advance();
                yield Optional.of(new NumberNode(token.value()));
            }
            case IDENTIFIER -> {
                tokens.advance();
                yield Optional.of(new IdentifierNode(token.value()));
            }
            case OPERATOR -> {
                tokens.advance();
                yield Optional.of(literalOperator(token));
            }
            case LEFT_BRACE -> Optional.of(parseGroup());
            case LEFT_PAREN, LEFT_BRACKET -> Optional.of(parseBareDelimited());
            case RIGHT_PAREN, RIGHT_BRACKET -> {
                tokens.advance();
                yield Optional.of(OperatorNode.fence(token.value(), token.value(), OperatorForm.POSTFIX, FenceStyle.FIXED));
            }
            case VERT -> {
                tokens.advance();
                yield Optional.of(OperatorNode.fence("|", "|", OperatorForm.INFIX, FenceStyle.FIXED));
            }
            case COMMAND -> parseCommand();
            case RIGHT_BRACE -> throw CompileException.mismatchedBraces(token.position());
            case EOF -> throw CompileException.unexpectedEof(token.position());
            case SUBSCRIPT, SUPERSCRIPT, AMPERSAND, LINE_BREAK ->
                    throw CompileException.unexpectedToken(token.toSource(), token.position());
        };
    }

    private static AstNode literalOperator(Token token) {
        return switch (token.value()) {
            case "~" -> new SpaceNode(SymbolTable.INTERWORD_SPACE);
            case "'" -> OperatorNode.of("'", "′");
            default -> OperatorNode.of(token.value(), SymbolTable.literalOperator(token.value()));
        };
    }

    private Optional<AstNode> parseCommand() {
        Token command = tokens.advance();
        String name = command.value();

        Optional<CommandInfo> info = commands.lookup(name);
        if (info.isPresent()) {
            return handlers.get(info.get().category()).handle(command, info.get());
        }
        Optional<MacroDefinition> macro = registry.lookup(name);
        if (macro.isPresent()) {
            return macros.expand(command, macro.get());
        }
        LOGGER.finer(() -> "Unknown command \\" + name + " at position " + command.position()
                + " rendered as an identifier");
        return Optional.of(new IdentifierNode(name));
    }

    private String degraded(Token command, String value) {
        if (SymbolTable.PLACEHOLDER.equals(value)) {
            LOGGER.finer(() -> "No glyph for \\" + command.value() + ", rendering placeholder");
        }
        return value;
    }

    // ==================== Groups and delimiters ====================

    /**
     * Parses {@code { ... }}. Closing tokens of other constructs found before the brace are
     * reported, never skipped.
     */
    AstNode parseGroup() {
        Token open = tokens.expect(TokenKind.LEFT_BRACE);
        int savedBareDepth = bareDepth;
        try {
            enterNesting(open);
            bareDepth = 0;
            List<AstNode> nodes = parseSequence(true);
            Token close = tokens.peek();
            if (!close.is(TokenKind.RIGHT_BRACE)) {
                throw unexpectedTerminator(close);
            }
            tokens.advance();
            return RowNode.wrap(nodes);
        } finally {
            bareDepth = savedBareDepth;
            nestingDepth--;
        }
    }

    /**
     * Rest of the enclosing group, for the declarations {@code \color}, {@code \displaystyle}, ...
     */
    private AstNode parseRestOfGroup() {
        return RowNode.wrap(parseSequence(true));
    }

    private AstNode parseBareDelimited() {
        Token open = tokens.advance();
        List<AstNode> content;
        try {
            enterNesting(open);
            bareDepth++;
            content = parseSequence(true);
        } finally {
            bareDepth--;
            nestingDepth--;
        }
        Token close = tokens.peek();
        if (close.is(TokenKind.RIGHT_PAREN) || close.is(TokenKind.RIGHT_BRACKET)) {
            tokens.advance();
            return new DelimitedNode(open.value(), close.value(), RowNode.wrap(content), false);
        }
        // an unmatched opener is an ordinary fence character
        List<AstNode> parts = new ArrayList<>();
        parts.add(OperatorNode.fence(open.value(), open.value(), OperatorForm.PREFIX, FenceStyle.FIXED));
        parts.addAll(content);
        return RowNode.wrap(parts);
    }

    private Optional<AstNode> parseDelimiter(Token command, CommandInfo info) {
        return switch (command.value()) {
            case "left" -> Optional.of(parseLeftRight(command));
            case "middle" -> {
                if (leftRightDepth == 0) {
                    throw CompileException.unexpectedToken(command.toSource(), command.position());
                }
                String delimiter = readDelimiter(command);
                yield Optional.of(OperatorNode.fence("middle", delimiter, OperatorForm.INFIX, FenceStyle.STRETCHY));
            }
            default -> throw CompileException.mismatchedBraces(command.position());
        };
    }

    private AstNode parseLeftRight(Token left) {
        String open = readDelimiter(left);
        int savedBareDepth = bareDepth;
        List<AstNode> content;
        try {
            enterNesting(left);
            leftRightDepth++;
            bareDepth = 0;
            content = parseSequence(true);
        } finally {
            leftRightDepth--;
            bareDepth = savedBareDepth;
            nestingDepth--;
        }
        Token right = tokens.peek();
        if (!right.isCommand("right")) {
            throw unexpectedTerminator(right);
        }
        tokens.advance();
        String close = readDelimiter(right);
        return new DelimitedNode(open, close, RowNode.wrap(content), true);
    }

    private String readDelimiter(Token command) {
        Token next = tokens.peek();
        if (next.is(TokenKind.EOF)) {
            throw CompileException.missingArgument(command.value(), command.position());
        }
        String delimiter = SymbolTable.delimiter(next).orElseThrow(() -> CompileException.invalidArgument(
                "Invalid delimiter after " + command.toSource() + ": " + next.toSource(), next.position()));
        tokens.advance();
        return delimiter;
    }

    private Optional<AstNode> parseSizedDelimiter(Token command, CommandInfo info) {
        String name = command.value();
        char suffix = name.charAt(name.length() - 1);
        boolean hasSuffix = suffix == 'l' || suffix == 'r' || suffix == 'm';
        String stem = hasSuffix ? name.substring(0, name.length() - 1) : name;
        int size = switch (stem) {
            case "big" -> 1;
            case "Big" -> 2;
            case "bigg" -> 3;
            default -> 4;
        };
        String delimiter = readDelimiter(command);
        OperatorForm form;
        if (!hasSuffix) {
            form = impliedForm(delimiter);
        } else if (suffix == 'l') {
            form = OperatorForm.PREFIX;
        } else if (suffix == 'r') {
            form = OperatorForm.POSTFIX;
        } else {
            form = OperatorForm.INFIX;
        }
        return Optional.of(new SizedDelimiterNode(delimiter, size, form));
    }

    private static OperatorForm impliedForm(String delimiter) {
        if ("([{⟨⌊⌈".contains(delimiter) && !delimiter.isEmpty()) {
            return OperatorForm.PREFIX;
        }
        if (")]}⟩⌋⌉".contains(delimiter) && !delimiter.isEmpty()) {
            return OperatorForm.POSTFIX;
        }
        return OperatorForm.INFIX;
    }

    /**
     * Error for a token that ends a sequence where it is not allowed.
     */
    CompileException unexpectedTerminator(Token token) {
        if (token.is(TokenKind.EOF)) {
            return CompileException.unexpectedEof(token.position());
        }
        if (token.is(TokenKind.RIGHT_BRACE) || token.kind().isCloser() || token.isCommand("right")) {
            return CompileException.mismatchedBraces(token.position());
        }
        return CompileException.unexpectedToken(token.toSource(), token.position());
    }

    private void expectEndOfInput() {
        Token token = tokens.peek();
        if (!token.is(TokenKind.EOF)) {
            throw unexpectedTerminator(token);
        }
    }

    // ==================== Arguments ====================

    /**
     * Reads a required argument: a braced group, or a single token following the TeX rule
     * ({@code \frac12} reads {@code 1} then {@code 2}).
     *
     * @param command the command owning the argument, for error messages
     * @return the argument node
     */
    AstNode parseArgument(Token command) {
        Token next = tokens.peek();
        if (next.is(TokenKind.LEFT_BRACE)) {
            return parseGroup();
        }
        if (cannotStartArgument(next)) {
            throw CompileException.missingArgument(command.value(), command.position());
        }
        if (next.is(TokenKind.NUMBER)) {
            return new NumberNode(tokens.advanceLeadingDigit().value());
        }
        return parseArgumentPrimary(command);
    }

    private AstNode parseArgumentPrimary(Token command) {
        try {
            enterNesting(command);
            return parsePrimary().orElseThrow(
                    () -> CompileException.missingArgument(command.value(), command.position()));
        } finally {
            nestingDepth--;
        }
    }

    private boolean cannotStartArgument(Token token) {
        return switch (token.kind()) {
            case EOF, RIGHT_BRACE, RIGHT_PAREN, RIGHT_BRACKET, AMPERSAND, LINE_BREAK, SUBSCRIPT, SUPERSCRIPT -> true;
            case COMMAND -> token.isCommand("right") || token.isCommand("end");
            default -> false;
        };
    }

    /**
     * Reads a braced argument as raw tokens, without parsing it. Nested braces are kept in
     * the content. A non-brace token is taken alone.
     *
     * @param command the command owning the argument, for error messages
     * @return the tokens and the source span they came from
     */
    RawArgument readRawArgument(Token command) {
        Token open = tokens.peek();
        if (!open.is(TokenKind.LEFT_BRACE)) {
            if (cannotStartArgument(open)) {
                throw CompileException.missingArgument(command.value(), command.position());
            }
            Token single = tokens.advance();
            return new RawArgument(List.of(single), single.position(), single.end());
        }
        tokens.advance();
        List<Token> content = new ArrayList<>();
        int depth = 1;
        while (true) {
            Token token = tokens.advance();
            if (token.is(TokenKind.EOF)) {
                throw CompileException.unexpectedEof(token.position());
            }
            if (token.is(TokenKind.LEFT_BRACE)) {
                depth++;
            } else if (token.is(TokenKind.RIGHT_BRACE) && --depth == 0) {
                return new RawArgument(content, open.end(), token.position());
            }
            content.add(token);
        }
    }

    /**
     * Raw tokens of an argument. {@code start} and {@code end} delimit the source text between
     * the braces and are used to restore the spacing of text arguments.
     */
    record RawArgument(List<Token> tokens, int start, int end) {

        /**
         * Rebuilds the argument as text: one space wherever the source had whitespace,
         * escaped characters unescaped, Greek letters spelled as letters and other commands
         * kept as typed.
         */
        String text() {
            StringBuilder text = new StringBuilder();
            int previousEnd = start;
            for (Token token : tokens) {
                if (token.position() > previousEnd) {
                    text.append(' ');
                }
                text.append(textOf(token));
                previousEnd = Math.max(previousEnd, token.end());
            }
            if (end > previousEnd) {
                text.append(' ');
            }
            return text.toString();
        }

        /**
         * @return the token values joined without any spacing
         */
        String compact() {
            StringBuilder text = new StringBuilder();
            for (Token token : tokens) {
                if (token.is(TokenKind.COMMAND)) {
                    text.append(SymbolTable.operators().getOrDefault(token.value(), token.toSource()));
                } else if (!token.is(TokenKind.LEFT_BRACE) && !token.is(TokenKind.RIGHT_BRACE)) {
                    text.append(token.value());
                }
            }
            return text.toString();
        }

        private static String textOf(Token token) {
            return switch (token.kind()) {
                case LEFT_BRACE, RIGHT_BRACE -> "";
                case OPERATOR -> token.value().equals("~") ? " " : token.value();
                case COMMAND -> switch (token.value()) {
                    case "%", "&", "$", "#", "_", "{", "}" -> token.value();
                    case " " -> " ";
                    default -> SymbolTable.greek().containsKey(token.value())
                            ? SymbolTable.greekLetter(token.value())
                            : token.toSource();
                };
                default -> token.value();
            };
        }
    }

    // ==================== Command handlers ====================

    private Optional<AstNode> parseFraction(Token command, CommandInfo info) {
        AstNode numerator = parseArgument(command);
        AstNode denominator = parseArgument(command);
        FractionStyle style = switch (command.value()) {
            case "dfrac", "cfrac" -> FractionStyle.DISPLAY;
            case "tfrac" -> FractionStyle.TEXT;
            default -> FractionStyle.NORMAL;
        };
        return Optional.of(new FractionNode(numerator, denominator, style));
    }

    private Optional<AstNode> parseBinomial(Token command, CommandInfo info) {
        AstNode top = parseArgument(command);
        AstNode bottom = parseArgument(command);
        FractionStyle style = switch (command.value()) {
            case "dbinom" -> FractionStyle.DISPLAY;
            case "tbinom" -> FractionStyle.TEXT;
            default -> FractionStyle.NORMAL;
        };
        return Optional.of(new BinomialNode(top, bottom, style));
    }

    /**
     * {@code \genfrac{left}{right}{thickness}{style}{numerator}{denominator}}.
     */
    private Optional<AstNode> parseGeneralizedFraction(Token command, CommandInfo info) {
        String open = readDelimiterArgument(command);
        String close = readDelimiterArgument(command);
        RawArgument thicknessArgument = readRawArgument(command);
        boolean noRule = isZeroThickness(thicknessArgument);
        String styleText = readRawArgument(command).compact();
        FractionStyle style = switch (styleText) {
            case "0" -> FractionStyle.DISPLAY;
            case "1" -> FractionStyle.TEXT;
            default -> FractionStyle.NORMAL;
        };
        AstNode numerator = parseArgument(command);
        AstNode denominator = parseArgument(command);

        if (noRule && open.equals("(") && close.equals(")")) {
            return Optional.of(new BinomialNode(numerator, denominator, style));
        }
        AstNode fraction = noRule
                ? new AtopNode(numerator, denominator)
                : new FractionNode(numerator, denominator, style);
        if (open.isEmpty() && close.isEmpty()) {
            return Optional.of(fraction);
        }
        return Optional.of(new DelimitedNode(open, close, fraction, true));
    }

    private String readDelimiterArgument(Token command) {
        RawArgument argument = readRawArgument(command);
        if (argument.tokens().isEmpty()) {
            return "";
        }
        Token first = argument.tokens().get(0);
        return SymbolTable.delimiter(first).orElseThrow(() -> CompileException.invalidArgument(
                "Invalid delimiter after " + command.toSource() + ": " + first.toSource(), first.position()));
    }

    private static boolean isZeroThickness(RawArgument argument) {
        String digits = argument.compact().replaceAll("[a-zA-Z]", "");
        if (digits.isEmpty()) {
            return false;
        }
        try {
            return Double.parseDouble(digits) == 0.0;
        } catch (NumberFormatException e) {
            throw CompileException.invalidNumber("Invalid fraction thickness: " + argument.compact(), argument.start());
        }
    }

    private Optional<AstNode> parseSqrt(Token command, CommandInfo info) {
        AstNode index = null;
        if (tokens.check(TokenKind.LEFT_BRACKET)) {
            Token open = tokens.advance();
            List<AstNode> indexNodes;
            int savedBareDepth = bareDepth;
            try {
                enterNesting(open);
                bareDepth = 1;
                indexNodes = parseSequence(true);
            } finally {
                bareDepth = savedBareDepth;
                nestingDepth--;
            }
            Token close = tokens.peek();
            if (!close.is(TokenKind.RIGHT_BRACKET)) {
                throw unexpectedTerminator(close);
            }
            tokens.advance();
            if (!indexNodes.isEmpty()) {
                index = RowNode.wrap(indexNodes);
            }
        }
        AstNode radicand = parseArgument(command);
        return Optional.of(index == null ? new SqrtNode(radicand) : new RootNode(radicand, index));
    }

    private Optional<AstNode> parseFence(Token command, CommandInfo info) {
        SymbolTable.FenceSpec fence = SymbolTable.fences().get(command.value());
        return Optional.of(OperatorNode.fence(command.value(), fence.symbol(), fence.form(), FenceStyle.FIXED));
    }

    private Optional<AstNode> parseNegation(Token command, CommandInfo info) {
        Token next = tokens.peek();
        if (cannotStartArgument(next) || next.is(TokenKind.LEFT_BRACE)) {
            throw CompileException.missingArgument(command.value(), command.position());
        }
        AstNode negated = parsePrimary().orElseThrow(
                () -> CompileException.missingArgument(command.value(), command.position()));
        if (negated instanceof OperatorNode operator) {
            return Optional.of(new OperatorNode(operator.name(), SymbolTable.negate(operator.value()),
                    operator.form(), operator.fence()));
        }
        if (negated instanceof SymbolNode symbol) {
            return Optional.of(new SymbolNode(symbol.name(), SymbolTable.negate(symbol.value())));
        }
        if (negated instanceof IdentifierNode identifier) {
            return Optional.of(new IdentifierNode(SymbolTable.negate(identifier.name())));
        }
        throw CompileException.invalidArgument("Cannot negate " + next.toSource(), next.position());
    }

    private Optional<AstNode> parseStyle(Token command, CommandInfo info) {
        StyleKind style = StyleKind.fromCommand(command.value()).orElseThrow();
        return Optional.of(new StyleNode(style, parseArgument(command)));
    }

    private Optional<AstNode> parseAccent(Token command, CommandInfo info) {
        AccentKind accent = AccentKind.fromCommand(command.value()).orElseThrow();
        return Optional.of(new AccentNode(accent, parseArgument(command)));
    }

    private Optional<AstNode> parseBigOperator(Token command, CommandInfo info) {
        SymbolTable.BigOperatorSpec spec = SymbolTable.bigOperators().get(command.value());
        return Optional.of(parseLimits(command.value(), spec.symbol(), spec.operatorClass()));
    }

    /**
     * Reads {@code \limits}/{@code \nolimits} and at most one lower and one upper limit,
     * in any order.
     */
    private BigOperatorNode parseLimits(String name, String symbol, BigOperatorClass operatorClass) {
        LimitsMode mode = LimitsMode.AUTO;
        while (true) {
            Token token = tokens.peek();
            if (token.isCommand("limits")) {
                mode = LimitsMode.LIMITS;
            } else if (token.isCommand("nolimits")) {
                mode = LimitsMode.NO_LIMITS;
            } else if (token.isCommand("displaylimits")) {
                mode = LimitsMode.AUTO;
            } else {
                break;
            }
            tokens.advance();
        }
        AstNode lower = null;
        AstNode upper = null;
        while (true) {
            Token token = tokens.peek();
            if (token.is(TokenKind.SUBSCRIPT) && lower == null) {
                tokens.advance();
                lower = parseScriptArgument(token);
            } else if (token.is(TokenKind.SUPERSCRIPT) && upper == null) {
                tokens.advance();
                upper = parseScriptArgument(token);
            } else {
                break;
            }
        }
        return new BigOperatorNode(name, symbol, operatorClass, mode, lower, upper);
    }

    private Optional<AstNode> parseFunction(Token command, CommandInfo info) {
        if (!command.isCommand("operatorname")) {
            return Optional.of(new FunctionNode(command.value()));
        }
        boolean limitsBelow = false;
        if (tokens.peek().isOperator("*")) {
            tokens.advance();
            limitsBelow = true;
        }
        String name = readRawArgument(command).text().trim();
        if (name.isEmpty()) {
            throw CompileException.invalidArgument("Empty operator name", command.position());
        }
        if (limitsBelow) {
            return Optional.of(parseLimits("operatorname*", name, BigOperatorClass.LIMIT));
        }
        return Optional.of(new FunctionNode(name));
    }

    private Optional<AstNode> parseEnvironment(Token command, CommandInfo info) {
        if (command.isCommand("end")) {
            throw CompileException.unexpectedToken(command.toSource(), command.position());
        }
        return Optional.of(environments.parse(command));
    }

    private Optional<AstNode> parseText(Token command, CommandInfo info) {
        TextNode text = new TextNode(readRawArgument(command).text());
        // \textbf and friends
        return Optional.of(StyleKind.fromCommand(command.value())
                .<AstNode>map(style -> new StyleNode(style, text))
                .orElse(text));
    }

    private Optional<AstNode> parseSpace(Token command, CommandInfo info) {
        if (command.isCommand("hspace")) {
            if (tokens.peek().isOperator("*")) {
                tokens.advance();
            }
            String width = readRawArgument(command).compact();
            if (width.isEmpty()) {
                throw CompileException.invalidArgument("Empty space width", command.position());
            }
            return Optional.of(new SpaceNode(width));
        }
        return Optional.of(new SpaceNode(SymbolTable.spaceWidth(command.value()).orElseThrow()));
    }

    private Optional<AstNode> parseColor(Token command, CommandInfo info) {
        String color = readRawArgument(command).compact();
        if (color.isEmpty()) {
            throw CompileException.invalidArgument("Empty color", command.position());
        }
        if (command.isCommand("textcolor")) {
            return Optional.of(new ColorNode(color, parseArgument(command)));
        }
        return Optional.of(new ColorNode(color, parseRestOfGroup()));
    }

    private Optional<AstNode> parsePhantom(Token command, CommandInfo info) {
        if (command.isCommand("mathstrut")) {
            return Optional.of(new PhantomNode(PhantomKind.VERTICAL, OperatorNode.of("(", "(")));
        }
        PhantomKind kind = switch (command.value()) {
            case "hphantom" -> PhantomKind.HORIZONTAL;
            case "vphantom" -> PhantomKind.VERTICAL;
            default -> PhantomKind.FULL;
        };
        return Optional.of(new PhantomNode(kind, parseArgument(command)));
    }

    private Optional<AstNode> parseUnderOver(Token command, CommandInfo info) {
        AstNode script = parseArgument(command);
        AstNode base = parseArgument(command);
        if (command.isCommand("underset")) {
            return Optional.of(new UnderOverNode(base, script, null));
        }
        return Optional.of(new UnderOverNode(base, null, script));
    }

    // ==================== Shared state for the helpers ====================

    TokenStream tokens() {
        return tokens;
    }

    MacroRegistry registry() {
        return registry;
    }

    CompilerPolicy policy() {
        return policy;
    }

    int expansionDepth() {
        return expansionDepth;
    }

    /**
     * Builds the parser that re-parses a macro expansion: same registry and policy, one
     * expansion level deeper, current nesting carried over.
     */
    Parser expansionParser(List<Token> expansion) {
        return new Parser(expansion, registry, policy, expansionDepth + 1, nestingDepth);
    }

    /**
     * Parses a macro expansion. Unlike {@link #parse()}, an empty result is allowed.
     */
    Optional<AstNode> parseExpansion() {
        List<AstNode> nodes = parseSequence(true);
        expectEndOfInput();
        return nodes.isEmpty() ? Optional.empty() : Optional.of(RowNode.wrap(nodes));
    }

    /**
     * Parses one environment cell in a fresh delimiter scope.
     */
    List<AstNode> parseCell(boolean allowInfix) {
        int savedBareDepth = bareDepth;
        try {
            bareDepth = 0;
            return parseSequence(allowInfix);
        } finally {
            bareDepth = savedBareDepth;
        }
    }

    void enterEnvironment(Token begin) {
        enterNesting(begin);
    }

    void exitEnvironment() {
        nestingDepth--;
    }

    private void enterNesting(Token at) {
        nestingDepth++;
        if (nestingDepth > policy.maxNestingDepth()) {
            throw CompileException.invalidArgument(
                    "Nesting deeper than " + policy.maxNestingDepth() + " levels", at.position());
        }
    }
}
