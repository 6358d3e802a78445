package io.github.cyfko.texml.spring.controller;

/**
 * Body of {@code POST {path}/compile}.
 *
 * @param latex   LaTeX math source
 * @param display block math if true, inline if false, configured default if absent
 */
public record CompileRequest(String latex, Boolean display) {
}
