package com.williamcallahan.mdcanvas.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies startup validation of parse, render and cache settings.
 */
class AppPropertiesValidationTest {

    @Test
    void defaults_areValid() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveMaxSpans() {
        AppProperties appProperties = new AppProperties();
        appProperties.getParse().setMaxSpansPerTable(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsIdenticalRegionDelimiters() {
        AppProperties appProperties = new AppProperties();
        appProperties.getParse().setRegionClose("<md>");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsDefaultWidthAboveMaximum() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRender().setDefaultWidth(5000);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsMalformedColor() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRender().setLinkColor("blue-ish");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroCacheTtl() {
        AppProperties appProperties = new AppProperties();
        appProperties.getCache().setExpireAfterWrite(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
