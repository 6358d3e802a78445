package io.github.cyfko.texml.spring.controller;

public record CompileResponse(String mathml) {
}
