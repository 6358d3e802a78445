package io.github.cyfko.texml.core.spi;

import java.util.Optional;

/**
 * Lookup service resolving non-ASCII input characters for the lexer.
 * <p>
 * Implementations must be pure and thread-safe: the same code point always resolves to the
 * same mapping. {@link DefaultUnicodeSymbolTable} covers Greek letters, common operators,
 * relations, arrows, large operators and super/subscript digits.
 * </p>
 *
 * <pre>{@code
 * UnicodeSymbolTable table = DefaultUnicodeSymbolTable.getInstance();
 * table.lookup('α');   // Optional[UnicodeMapping[latex=alpha, category=GREEK_LETTER]]
 * table.lookup('²');   // Optional[UnicodeMapping[latex=2, category=SUPERSCRIPT]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface UnicodeSymbolTable {

    /**
     * @param codePoint a non-ASCII Unicode scalar value
     * @return its mapping, or empty when the character is unknown
     */
    Optional<UnicodeMapping> lookup(int codePoint);
}
