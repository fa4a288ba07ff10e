module io.github.cyfko.celldl.core {
    requires java.logging;

    exports io.github.cyfko.celldl.core;
    exports io.github.cyfko.celldl.core.api;
    exports io.github.cyfko.celldl.core.ast;
    exports io.github.cyfko.celldl.core.config;
    exports io.github.cyfko.celldl.core.diagnostics;
    exports io.github.cyfko.celldl.core.exception;
    exports io.github.cyfko.celldl.core.impl;
    exports io.github.cyfko.celldl.core.lexer;
    exports io.github.cyfko.celldl.core.model;
    exports io.github.cyfko.celldl.core.parsing;
    exports io.github.cyfko.celldl.core.printer;
    exports io.github.cyfko.celldl.core.recovery;
    exports io.github.cyfko.celldl.core.utils;
    exports io.github.cyfko.celldl.core.visitor;
}
