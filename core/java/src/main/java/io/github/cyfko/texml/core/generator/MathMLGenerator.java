package io.github.cyfko.texml.core.generator;

import io.github.cyfko.texml.core.ast.AccentKind;
import io.github.cyfko.texml.core.ast.AccentNode;
import io.github.cyfko.texml.core.ast.AstNode;
import io.github.cyfko.texml.core.ast.AstVisitor;
import io.github.cyfko.texml.core.ast.AtopNode;
import io.github.cyfko.texml.core.ast.BigOperatorClass;
import io.github.cyfko.texml.core.ast.BigOperatorNode;
import io.github.cyfko.texml.core.ast.BinomialNode;
import io.github.cyfko.texml.core.ast.ColorNode;
import io.github.cyfko.texml.core.ast.DelimitedNode;
import io.github.cyfko.texml.core.ast.EnvironmentKind;
import io.github.cyfko.texml.core.ast.PhantomKind;
import io.github.cyfko.texml.core.ast.FractionNode;
import io.github.cyfko.texml.core.ast.FractionStyle;
import io.github.cyfko.texml.core.ast.FunctionNode;
import io.github.cyfko.texml.core.ast.IdentifierNode;
import io.github.cyfko.texml.core.ast.LimitsMode;
import io.github.cyfko.texml.core.ast.MathSizeNode;
import io.github.cyfko.texml.core.ast.MathStyleNode;
import io.github.cyfko.texml.core.ast.MatrixNode;
import io.github.cyfko.texml.core.ast.NumberNode;
import io.github.cyfko.texml.core.ast.OperatorForm;
import io.github.cyfko.texml.core.ast.OperatorNode;
import io.github.cyfko.texml.core.ast.PhantomNode;
import io.github.cyfko.texml.core.ast.RootNode;
import io.github.cyfko.texml.core.ast.RowNode;
import io.github.cyfko.texml.core.ast.SINumberNode;
import io.github.cyfko.texml.core.ast.SIUnitNode;
import io.github.cyfko.texml.core.ast.SIValueNode;
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
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.model.SIUnitComponent;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serializes an {@link AstNode} tree to Presentation MathML.
 * <p>
 * The generator is stateless and thread-safe. It never fails on a tree built by the parser;
 * all validation happens before.
 * </p>
 *
 * <pre>{@code
 * String xml = new MathMLGenerator().generate(ast, MathMLOptions.block());
 * // <math xmlns="http://www.w3.org/1998/Math/MathML" display="block">...</math>
 * }</pre>
 *
 * <p>{@link MathMLOptions#prettyPrint()} and {@link MathMLOptions#indentSize()} are accepted
 * but output is always compact.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MathMLGenerator {

    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";

    static final String APPLY_FUNCTION = "⁡";
    static final String THIN_SPACE = "0.1667em";

    private static final String[] SIZED_DELIMITER_SIZES = {"1.2em", "1.623em", "2.047em", "2.470em"};
    private static final Pattern SCIENTIFIC = Pattern.compile("([+-]?)([^eE]*)[eE]([+-]?)(\\d+)");

    /**
     * @param ast     the tree to serialize
     * @param options display mode
     * @return a complete {@code <math>} element
     */
    public String generate(AstNode ast, MathMLOptions options) {
        Objects.requireNonNull(ast, "ast");
        Objects.requireNonNull(options, "options");
        MarkupWriter writer = new MarkupWriter();
        writer.open("math", "xmlns", MATHML_NAMESPACE, "display", options.displayStyle() ? "block" : "inline");
        ast.accept(new Emitter(writer));
        writer.close("math");
        return writer.toString();
    }

    /**
     * Writes one node per visit. Returns {@code null}: output goes to the writer.
     */
    private static final class Emitter implements AstVisitor<Void> {

        private final MarkupWriter out;

        Emitter(MarkupWriter out) {
            this.out = out;
        }

        private void emit(AstNode node) {
            node.accept(this);
        }

        /**
         * Children of a row written without their {@code <mrow>}, for containers that already
         * group their content.
         */
        private void emitContent(AstNode node) {
            if (node instanceof RowNode row) {
                emitChildren(row.children());
            } else {
                emit(node);
            }
        }

        private void emitChildren(List<AstNode> children) {
            for (int i = 0; i < children.size(); i++) {
                AstNode child = children.get(i);
                emit(child);
                if (i + 1 < children.size() && appliesFunction(child)) {
                    out.leaf("mo", APPLY_FUNCTION);
                    if (!(children.get(i + 1) instanceof DelimitedNode)) {
                        out.empty("mspace", "width", THIN_SPACE);
                    }
                }
            }
        }

        private static boolean appliesFunction(AstNode node) {
            if (node instanceof FunctionNode) {
                return true;
            }
            if (node instanceof SubscriptNode script) {
                return script.base() instanceof FunctionNode;
            }
            if (node instanceof SuperscriptNode script) {
                return script.base() instanceof FunctionNode;
            }
            if (node instanceof SubSupNode script) {
                return script.base() instanceof FunctionNode;
            }
            return node instanceof BigOperatorNode operator
                    && operator.operatorClass() == BigOperatorClass.LIMIT
                    && !operator.hasLimits();
        }

        // ---------- leaves ----------

        @Override
        public Void visitNumber(NumberNode node) {
            out.leaf("mn", node.value());
            return null;
        }

        @Override
        public Void visitIdentifier(IdentifierNode node) {
            out.leaf("mi", node.name());
            return null;
        }

        @Override
        public Void visitSymbol(SymbolNode node) {
            out.leaf("mi", node.value(), "mathvariant", isUpperGreek(node.value()) ? "normal" : null);
            return null;
        }

        private static boolean isUpperGreek(String value) {
            if (value.codePointCount(0, value.length()) != 1) {
                return false;
            }
            int codePoint = value.codePointAt(0);
            return codePoint >= 0x0391 && codePoint <= 0x03A9;
        }

        @Override
        public Void visitOperator(OperatorNode node) {
            String form = node.form() == OperatorForm.INFIX ? null : node.form().attribute();
            switch (node.fence()) {
                case FIXED -> out.leaf("mo", node.value(), "form", form, "stretchy", "false");
                case STRETCHY -> out.leaf("mo", node.value(), "fence", "true", "form", form, "stretchy", "true");
                default -> out.leaf("mo", node.value(), "form", form);
            }
            return null;
        }

        @Override
        public Void visitText(TextNode node) {
            out.leaf("mtext", protectOuterSpaces(node.text()));
            return null;
        }

        private static String protectOuterSpaces(String text) {
            int start = 0;
            while (start < text.length() && text.charAt(start) == ' ') {
                start++;
            }
            int end = text.length();
            while (end > start && text.charAt(end - 1) == ' ') {
                end--;
            }
            return " ".repeat(start) + text.substring(start, end) + " ".repeat(text.length() - end);
        }

        @Override
        public Void visitSpace(SpaceNode node) {
            out.empty("mspace", "width", node.width());
            return null;
        }

        @Override
        public Void visitFunction(FunctionNode node) {
            out.leaf("mi", node.name());
            return null;
        }

        // ---------- layout ----------

        @Override
        public Void visitRow(RowNode node) {
            out.open("mrow");
            emitChildren(node.children());
            out.close("mrow");
            return null;
        }

        @Override
        public Void visitSqrt(SqrtNode node) {
            out.open("msqrt");
            emitContent(node.radicand());
            out.close("msqrt");
            return null;
        }

        @Override
        public Void visitRoot(RootNode node) {
            out.open("mroot");
            emit(node.radicand());
            emit(node.index());
            out.close("mroot");
            return null;
        }

        @Override
        public Void visitFraction(FractionNode node) {
            openFractionStyle(node.style());
            out.open("mfrac");
            emit(node.numerator());
            emit(node.denominator());
            out.close("mfrac");
            closeFractionStyle(node.style());
            return null;
        }

        @Override
        public Void visitBinomial(BinomialNode node) {
            openFractionStyle(node.style());
            out.open("mrow");
            stretchyFence("(", OperatorForm.PREFIX);
            out.open("mfrac", "linethickness", "0");
            emit(node.top());
            emit(node.bottom());
            out.close("mfrac");
            stretchyFence(")", OperatorForm.POSTFIX);
            out.close("mrow");
            closeFractionStyle(node.style());
            return null;
        }

        private void openFractionStyle(FractionStyle style) {
            switch (style) {
                case DISPLAY -> out.open("mstyle", "displaystyle", "true", "scriptlevel", "0");
                case TEXT -> out.open("mstyle", "displaystyle", "false", "scriptlevel", "0");
                default -> {
                    // inherits the surrounding style
                }
            }
        }

        private void closeFractionStyle(FractionStyle style) {
            if (style != FractionStyle.NORMAL) {
                out.close("mstyle");
            }
        }

        @Override
        public Void visitAtop(AtopNode node) {
            out.open("mfrac", "linethickness", "0");
            emit(node.top());
            emit(node.bottom());
            out.close("mfrac");
            return null;
        }

        @Override
        public Void visitSubscript(SubscriptNode node) {
            String element = isBrace(node.base()) ? "munder" : "msub";
            out.open(element);
            emit(node.base());
            emit(node.subscript());
            out.close(element);
            return null;
        }

        @Override
        public Void visitSuperscript(SuperscriptNode node) {
            String element = isBrace(node.base()) ? "mover" : "msup";
            out.open(element);
            emit(node.base());
            emit(node.superscript());
            out.close(element);
            return null;
        }

        @Override
        public Void visitSubSup(SubSupNode node) {
            String element = isBrace(node.base()) ? "munderover" : "msubsup";
            out.open(element);
            emit(node.base());
            emit(node.subscript());
            emit(node.superscript());
            out.close(element);
            return null;
        }

        private static boolean isBrace(AstNode base) {
            return base instanceof AccentNode accent && accent.accent().isBrace();
        }

        @Override
        public Void visitAccent(AccentNode node) {
            AccentKind accent = node.accent();
            String stretchy = accent.isStretchy() ? "true" : "false";
            if (accent.isUnder()) {
                out.open("munder", "accentunder", "true");
                emit(node.base());
                out.leaf("mo", accent.mark(), "stretchy", stretchy);
                out.close("munder");
            } else {
                out.open("mover", "accent", "true");
                emit(node.base());
                out.leaf("mo", accent.mark(), "stretchy", stretchy);
                out.close("mover");
            }
            return null;
        }

        @Override
        public Void visitUnderOver(UnderOverNode node) {
            if (node.under() != null && node.over() != null) {
                out.open("munderover");
                emit(node.base());
                emit(node.under());
                emit(node.over());
                out.close("munderover");
            } else if (node.under() != null) {
                out.open("munder");
                emit(node.base());
                emit(node.under());
                out.close("munder");
            } else {
                out.open("mover");
                emit(node.base());
                emit(node.over());
                out.close("mover");
            }
            return null;
        }

        // ---------- styling ----------

        @Override
        public Void visitStyle(StyleNode node) {
            if (emitStyledLeaf(node.style(), node.content())) {
                return null;
            }
            out.open("mstyle", "mathvariant", node.style().mathvariant());
            emitContent(node.content());
            out.close("mstyle");
            return null;
        }

        /**
         * Single identifiers, numbers and symbols are written with styled code points rather
         * than a {@code mathvariant}, which renderers support unevenly.
         */
        private boolean emitStyledLeaf(StyleKind style, AstNode content) {
            if (style == StyleKind.NORMAL) {
                if (content instanceof IdentifierNode identifier) {
                    out.leaf("mi", identifier.name(), "mathvariant", "normal");
                    return true;
                }
                if (content instanceof SymbolNode symbol) {
                    out.leaf("mi", symbol.value(), "mathvariant", "normal");
                    return true;
                }
                if (content instanceof NumberNode number) {
                    out.leaf("mn", number.value());
                    return true;
                }
                return false;
            }
            if (content instanceof IdentifierNode identifier) {
                Optional<String> styled = StyledCharacters.apply(style, identifier.name());
                styled.ifPresent(text -> out.leaf("mi", text));
                return styled.isPresent();
            }
            if (content instanceof SymbolNode symbol) {
                Optional<String> styled = StyledCharacters.apply(style, symbol.value());
                styled.ifPresent(text -> out.leaf("mi", text));
                return styled.isPresent();
            }
            if (content instanceof NumberNode number) {
                Optional<String> styled = StyledCharacters.apply(style, number.value());
                styled.ifPresent(text -> out.leaf("mn", text));
                return styled.isPresent();
            }
            return false;
        }

        @Override
        public Void visitMathStyle(MathStyleNode node) {
            out.open("mstyle", "displaystyle", String.valueOf(node.level().displaystyle()),
                    "scriptlevel", String.valueOf(node.level().scriptLevel()));
            emitContent(node.content());
            out.close("mstyle");
            return null;
        }

        @Override
        public Void visitMathSize(MathSizeNode node) {
            out.open("mstyle", "mathsize", node.size().size());
            emitContent(node.content());
            out.close("mstyle");
            return null;
        }

        @Override
        public Void visitColor(ColorNode node) {
            out.open("mstyle", "mathcolor", node.color());
            emitContent(node.content());
            out.close("mstyle");
            return null;
        }

        @Override
        public Void visitPhantom(PhantomNode node) {
            switch (node.kind()) {
                case HORIZONTAL -> out.open("mpadded", "height", "0", "depth", "0");
                case VERTICAL -> out.open("mpadded", "width", "0");
                default -> {
                    // plain phantom
                }
            }
            out.open("mphantom");
            emitContent(node.content());
            out.close("mphantom");
            if (node.kind() != PhantomKind.FULL) {
                out.close("mpadded");
            }
            return null;
        }

        // ---------- delimiters ----------

        @Override
        public Void visitDelimited(DelimitedNode node) {
            out.open("mrow");
            if (node.stretchy()) {
                if (!node.open().isEmpty()) {
                    stretchyFence(node.open(), OperatorForm.PREFIX);
                }
                emitContent(node.content());
                if (!node.close().isEmpty()) {
                    stretchyFence(node.close(), OperatorForm.POSTFIX);
                }
            } else {
                out.leaf("mo", node.open(), "form", "prefix", "stretchy", "false");
                emitContent(node.content());
                out.leaf("mo", node.close(), "form", "postfix", "stretchy", "false");
            }
            out.close("mrow");
            return null;
        }

        private void stretchyFence(String delimiter, OperatorForm form) {
            out.leaf("mo", delimiter, "fence", "true", "form", form.attribute(), "stretchy", "true");
        }

        @Override
        public Void visitSizedDelimiter(SizedDelimiterNode node) {
            if (node.delimiter().isEmpty()) {
                return null;
            }
            String size = SIZED_DELIMITER_SIZES[node.size() - 1];
            String form = node.form() == OperatorForm.INFIX ? null : node.form().attribute();
            out.leaf("mo", node.delimiter(), "fence", "true", "form", form, "stretchy", "true",
                    "symmetric", "true", "minsize", size, "maxsize", size);
            return null;
        }

        // ---------- tables ----------

        @Override
        public Void visitMatrix(MatrixNode node) {
            EnvironmentKind kind = node.environment();
            boolean fenced = !kind.open().isEmpty() || !kind.close().isEmpty();
            if (fenced) {
                out.open("mrow");
                if (!kind.open().isEmpty()) {
                    stretchyFence(kind.open(), OperatorForm.PREFIX);
                }
            }
            switch (kind.family()) {
                case ALIGNMENT -> alignmentTable(node);
                case GATHER -> gatherTable(node);
                case CASES -> plainTable(node, "left left");
                default -> plainTable(node, null);
            }
            if (fenced) {
                if (!kind.close().isEmpty()) {
                    stretchyFence(kind.close(), OperatorForm.POSTFIX);
                }
                out.close("mrow");
            }
            return null;
        }

        private void plainTable(MatrixNode node, String columnAlign) {
            out.open("mtable", "columnalign", columnAlign);
            for (List<AstNode> row : node.rows()) {
                out.open("mtr");
                for (AstNode cell : row) {
                    out.open("mtd");
                    emitContent(cell);
                    out.close("mtd");
                }
                out.close("mtr");
            }
            out.close("mtable");
        }

        private void alignmentTable(MatrixNode node) {
            StringBuilder columnAlign = new StringBuilder("right");
            for (int column = 0; column < node.columnCount(); column++) {
                columnAlign.append(column % 2 == 0 ? " right" : " left");
            }
            columnAlign.append(" left");

            out.open("mtable", "columnalign", columnAlign.toString(), "displaystyle", "true", "style", "width:100%");
            for (List<AstNode> row : node.rows()) {
                out.open("mtr");
                out.open("mtd", "style", "padding:0;width:50%").close("mtd");
                for (int column = 0; column < row.size(); column++) {
                    out.open("mtd", "class", column % 2 == 0 ? "tml-right" : "tml-left");
                    emitContent(row.get(column));
                    out.close("mtd");
                }
                out.open("mtd", "style", "padding:0;width:50%").close("mtd");
                out.close("mtr");
            }
            out.close("mtable");
        }

        private void gatherTable(MatrixNode node) {
            out.open("mtable", "columnalign", "center", "displaystyle", "true", "style", "width:100%");
            for (List<AstNode> row : node.rows()) {
                out.open("mtr");
                for (AstNode cell : row) {
                    out.open("mtd", "class", "tml-center");
                    emitContent(cell);
                    out.close("mtd");
                }
                out.close("mtr");
            }
            out.close("mtable");
        }

        // ---------- large operators ----------

        @Override
        public Void visitBigOperator(BigOperatorNode node) {
            boolean underOver = node.limitsUnderOver();
            String element;
            if (node.lower() != null && node.upper() != null) {
                element = underOver ? "munderover" : "msubsup";
            } else if (node.lower() != null) {
                element = underOver ? "munder" : "msub";
            } else if (node.upper() != null) {
                element = underOver ? "mover" : "msup";
            } else {
                element = null;
            }

            if (element != null) {
                out.open(element);
            }
            if (node.operatorClass() == BigOperatorClass.LIMIT) {
                out.leaf("mo", node.symbol(), "movablelimits", "true", "form", "prefix");
            } else {
                boolean movable = node.limits() == LimitsMode.AUTO && underOver;
                out.leaf("mo", node.symbol(), "largeop", "true", "movablelimits", String.valueOf(movable));
            }
            if (element != null) {
                if (node.lower() != null) {
                    emit(node.lower());
                }
                if (node.upper() != null) {
                    emit(node.upper());
                }
                out.close(element);
            }
            return null;
        }

        // ---------- siunitx ----------

        @Override
        public Void visitSINumber(SINumberNode node) {
            writeNumber(node.value());
            return null;
        }

        private void writeNumber(String value) {
            Matcher scientific = SCIENTIFIC.matcher(value);
            if (scientific.matches()) {
                String sign = scientific.group(1);
                String mantissa = scientific.group(2);
                boolean negativeExponent = scientific.group(3).equals("-");
                String exponent = scientific.group(4);

                out.open("mrow");
                if (sign.equals("-")) {
                    out.leaf("mo", "−");
                }
                if (!mantissa.isEmpty()) {
                    out.leaf("mn", mantissa);
                    out.leaf("mo", "×");
                }
                out.open("msup");
                out.leaf("mn", "10");
                if (negativeExponent) {
                    out.open("mrow").leaf("mo", "−").leaf("mn", exponent).close("mrow");
                } else {
                    out.leaf("mn", exponent);
                }
                out.close("msup");
                out.close("mrow");
            } else if (value.startsWith("-") && value.length() > 1) {
                out.open("mrow").leaf("mo", "−").leaf("mn", value.substring(1)).close("mrow");
            } else {
                out.leaf("mn", value);
            }
        }

        @Override
        public Void visitSIUnit(SIUnitNode node) {
            out.open("mrow");
            writeComponents(node.numerator());
            if (!node.denominator().isEmpty()) {
                if (node.numerator().isEmpty()) {
                    out.leaf("mn", "1");
                }
                out.leaf("mo", "/");
                writeComponents(node.denominator());
            }
            out.close("mrow");
            return null;
        }

        private void writeComponents(List<SIUnitComponent> components) {
            for (int i = 0; i < components.size(); i++) {
                if (i > 0) {
                    out.empty("mspace", "width", THIN_SPACE);
                }
                SIUnitComponent component = components.get(i);
                String symbol = component.symbol();
                String variant = symbol.codePointCount(0, symbol.length()) == 1 ? "normal" : null;
                if (component.power() == 1) {
                    out.leaf("mi", symbol, "mathvariant", variant);
                } else {
                    out.open("msup");
                    out.leaf("mi", symbol, "mathvariant", variant);
                    out.leaf("mn", String.valueOf(component.power()));
                    out.close("msup");
                }
            }
        }

        @Override
        public Void visitSIValue(SIValueNode node) {
            out.open("mrow");
            writeNumber(node.value());
            if (!node.unit().isEmpty()) {
                out.empty("mspace", "width", THIN_SPACE);
                visitSIUnit(node.unit());
            }
            out.close("mrow");
            return null;
        }
    }
}
