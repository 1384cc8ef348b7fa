module com.cycletrade.engine {
    // Exports
    exports com.cycletrade.engine;
    exports com.cycletrade.engine.order;
    exports com.cycletrade.engine.risk;
    exports com.cycletrade.engine.strategy;
    exports com.cycletrade.engine.config;
    exports com.cycletrade.engine.result;

    // Dependencies
    requires transitive com.cycletrade.core;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.dataformat.yaml;
    requires org.slf4j;

    // Jackson needs reflection access
    opens com.cycletrade.engine.config to com.fasterxml.jackson.databind;
    opens com.cycletrade.engine.result to com.fasterxml.jackson.databind;
    opens com.cycletrade.engine.order to com.fasterxml.jackson.databind;
    opens com.cycletrade.engine.risk to com.fasterxml.jackson.databind;
}
