module io.github.cyfko.texml.core {
    requires java.logging;

    exports io.github.cyfko.texml.core;
    exports io.github.cyfko.texml.core.api;
    exports io.github.cyfko.texml.core.ast;
    exports io.github.cyfko.texml.core.cache;
    exports io.github.cyfko.texml.core.config;
    exports io.github.cyfko.texml.core.exception;
    exports io.github.cyfko.texml.core.generator;
    exports io.github.cyfko.texml.core.impl;
    exports io.github.cyfko.texml.core.model;
    exports io.github.cyfko.texml.core.parsing;
    exports io.github.cyfko.texml.core.spi;
}
