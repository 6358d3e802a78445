package io.github.cyfko.texml.core.spi;

import io.github.cyfko.texml.core.model.MacroDefinition;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Table of user-defined macros, filled by {@code \def} and {@code \newcommand} while parsing
 * and consulted for commands the built-in table does not know.
 * <p>
 * A registry is an ordinary object owned by whoever compiles: definitions made while
 * compiling one fragment stay visible to the following fragments compiled with the same
 * registry, which is how a document preamble works. Unrelated documents, and in particular
 * documents compiled concurrently, must each use their own registry (see {@link #copy()}).
 * </p>
 *
 * <p><strong>Concurrency:</strong> storage is a {@link ConcurrentHashMap}, so a registry can
 * be read while another thread defines macros, but the result of compiling against a
 * registry that changes mid-compilation is unspecified.</p>
 *
 * <p><strong>Versioning:</strong> {@link #version()} increases each time the content
 * changes. Caches use it to tell whether output computed earlier is still valid.</p>
 *
 * <pre>{@code
 * MacroRegistry preamble = new MacroRegistry();
 * preamble.define(new MacroDefinition("R", 0, Lexer.standard().lex("\\mathbb{R}")));
 *
 * LatexCompiler perRequest = new BasicLatexCompiler(preamble.copy());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MacroRegistry {
    private static final Logger LOGGER = Logger.getLogger(MacroRegistry.class.getName());

    private final Map<String, MacroDefinition> macros = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();

    public MacroRegistry() {
    }

    private MacroRegistry(Map<String, MacroDefinition> initial) {
        macros.putAll(initial);
    }

    /**
     * Registers a macro, silently replacing any previous definition with the same name.
     *
     * @param definition the macro
     */
    public void define(MacroDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        MacroDefinition previous = macros.put(definition.name(), definition);
        if (!definition.equals(previous)) {
            version.incrementAndGet();
        }
        LOGGER.fine(() -> (previous == null ? "Defined" : "Redefined") + " macro \\" + definition.name()
                + " with " + definition.arity() + " argument(s)");
    }

    /**
     * Registers a macro only if no macro with that name exists yet.
     *
     * @param definition the macro
     * @return true if the definition was added
     */
    public boolean defineIfAbsent(MacroDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        boolean added = macros.putIfAbsent(definition.name(), definition) == null;
        if (added) {
            version.incrementAndGet();
        }
        return added;
    }

    /**
     * @param name command name without backslash
     * @return the definition, or empty if none
     */
    public Optional<MacroDefinition> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(macros.get(name));
    }

    public boolean contains(String name) {
        return name != null && macros.containsKey(name);
    }

    /**
     * @param name command name without backslash
     * @return true if a definition was removed
     */
    public boolean remove(String name) {
        boolean removed = name != null && macros.remove(name) != null;
        if (removed) {
            version.incrementAndGet();
        }
        return removed;
    }

    /**
     * @return a snapshot of the defined names
     */
    public Set<String> names() {
        return Set.copyOf(macros.keySet());
    }

    public int size() {
        return macros.size();
    }

    public boolean isEmpty() {
        return macros.isEmpty();
    }

    /**
     * Removes every definition. Call between unrelated documents sharing a registry.
     */
    public void clear() {
        macros.clear();
        version.incrementAndGet();
    }

    /**
     * @return a counter that changes whenever the content of the registry changes
     */
    public long version() {
        return version.get();
    }

    /**
     * @return an independent registry holding the same definitions
     */
    public MacroRegistry copy() {
        return new MacroRegistry(macros);
    }
}
