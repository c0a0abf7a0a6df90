package com.williamcallahan.mdcanvas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entry point for the markup canvas service.
 *
 * <p>Runs headless unless started with {@code -Djava.awt.headless=false}, which a desktop host needs
 * for click requests that open links.</p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MdCanvasApplication {

    static final String HEADLESS_PROPERTY = "java.awt.headless";

    public static void main(String[] args) {
        defaultToHeadless();
        SpringApplication.run(MdCanvasApplication.class, args);
    }

    static void defaultToHeadless() {
        if (System.getProperty(HEADLESS_PROPERTY) == null) {
            System.setProperty(HEADLESS_PROPERTY, "true");
        }
    }
}
