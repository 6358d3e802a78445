package io.github.cyfko.texml.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Guards the sources against LaTeX commands such as {@code \\unit} written with a single
 * backslash in comments: javac reads them as malformed unicode escapes.
 */
@DisplayName("Source escape Tests")
class SourceEscapesTest {

    /** A backslash preceded by an even number of backslashes, then {@code u} without four hex digits. */
    private static final Pattern ILLEGAL_ESCAPE = Pattern.compile("(?<!\\\\)(?:\\\\\\\\)*\\\\u+(?![0-9a-fA-F]{4})");

    @Test
    @DisplayName("Should contain no malformed unicode escape")
    void testNoIllegalUnicodeEscape() throws IOException {
        // Given
        List<String> offenders = new ArrayList<>();

        // When
        for (Path root : List.of(Path.of("src/main/java"), Path.of("src/test/java"))) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (Stream<Path> files = Files.walk(root)) {
                for (Path file : files.filter(f -> f.toString().endsWith(".java")).toList()) {
                    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                    for (int i = 0; i < lines.size(); i++) {
                        Matcher matcher = ILLEGAL_ESCAPE.matcher(lines.get(i));
                        if (matcher.find()) {
                            offenders.add(file + ":" + (i + 1));
                        }
                    }
                }
            }
        }

        // Then
        assertTrue(offenders.isEmpty(), () -> "Malformed unicode escapes: " + offenders);
    }

    @Test
    @DisplayName("Should recognise malformed escapes only")
    void testPattern() {
        assertTrue(ILLEGAL_ESCAPE.matcher("{@code \\unit}").find());
        assertTrue(ILLEGAL_ESCAPE.matcher("x \\\\\\underset").find());
        assertFalse(ILLEGAL_ESCAPE.matcher("\"\\u00A0\"").find());
        assertFalse(ILLEGAL_ESCAPE.matcher("\"\\\\unit\"").find());
    }
}
