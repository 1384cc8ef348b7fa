module com.cycletrade.core {
    // Exports - all public packages
    exports com.cycletrade.core.model;
    exports com.cycletrade.core.indicators;
    exports com.cycletrade.core.cycle;

    // Jackson (for model serialization)
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;

    // Logging
    requires org.slf4j;

    // Jackson needs reflection access to models
    opens com.cycletrade.core.model to com.fasterxml.jackson.databind;
    opens com.cycletrade.core.indicators to com.fasterxml.jackson.databind;
    opens com.cycletrade.core.cycle to com.fasterxml.jackson.databind;
}
