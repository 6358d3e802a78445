package io.github.cyfko.texml.spring.controller;

import io.github.cyfko.texml.core.exception.CompileException;

/**
 * Body of an HTTP 400 answer.
 *
 * @param kind      error label, e.g. {@code UnexpectedEof}
 * @param message   short description
 * @param position  char offset in the source, -1 if unknown
 * @param formatted caret rendering against the source
 */
public record CompileErrorResponse(String kind, String message, int position, String formatted) {

    public static CompileErrorResponse of(CompileException error, String source) {
        return new CompileErrorResponse(error.getKind().label(), error.getMessage(), error.getPosition(),
                error.formatError(source));
    }
}
