module io.github.cyfko.curatorkit.core {
    requires com.fasterxml.jackson.databind;
    requires java.logging;

    exports io.github.cyfko.curatorkit.core.api;
    exports io.github.cyfko.curatorkit.core.batch;
    exports io.github.cyfko.curatorkit.core.config;
    exports io.github.cyfko.curatorkit.core.exception;
    exports io.github.cyfko.curatorkit.core.format;
    exports io.github.cyfko.curatorkit.core.impl;
    exports io.github.cyfko.curatorkit.core.json;
    exports io.github.cyfko.curatorkit.core.lookup;
    exports io.github.cyfko.curatorkit.core.model;
    exports io.github.cyfko.curatorkit.core.ontology;
    exports io.github.cyfko.curatorkit.core.parsing;
    exports io.github.cyfko.curatorkit.core.rewrite;
    exports io.github.cyfko.curatorkit.core.tree;
}
