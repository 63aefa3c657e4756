module io.github.cyfko.mathql.core {
    requires java.logging;

    exports io.github.cyfko.mathql.core;
    exports io.github.cyfko.mathql.core.api;
    exports io.github.cyfko.mathql.core.ast;
    exports io.github.cyfko.mathql.core.channel;
    exports io.github.cyfko.mathql.core.config;
    exports io.github.cyfko.mathql.core.eval;
    exports io.github.cyfko.mathql.core.exception;
    exports io.github.cyfko.mathql.core.impl;
    exports io.github.cyfko.mathql.core.parsing;
    exports io.github.cyfko.mathql.core.render;
    exports io.github.cyfko.mathql.core.utils;
}
