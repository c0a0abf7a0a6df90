package com.williamcallahan.mdcanvas;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MdCanvasApplicationHeadlessTest {

    private String savedHeadless;

    @BeforeEach
    void saveHeadless() {
        savedHeadless = System.getProperty(MdCanvasApplication.HEADLESS_PROPERTY);
    }

    @AfterEach
    void restoreHeadless() {
        if (savedHeadless == null) {
            System.clearProperty(MdCanvasApplication.HEADLESS_PROPERTY);
        } else {
            System.setProperty(MdCanvasApplication.HEADLESS_PROPERTY, savedHeadless);
        }
    }

    @Test
    void defaultToHeadless_unset_enablesHeadless() {
        System.clearProperty(MdCanvasApplication.HEADLESS_PROPERTY);

        MdCanvasApplication.defaultToHeadless();

        assertEquals("true", System.getProperty(MdCanvasApplication.HEADLESS_PROPERTY));
    }

    @Test
    void defaultToHeadless_explicitDesktopMode_isKept() {
        System.setProperty(MdCanvasApplication.HEADLESS_PROPERTY, "false");

        MdCanvasApplication.defaultToHeadless();

        assertEquals("false", System.getProperty(MdCanvasApplication.HEADLESS_PROPERTY));
    }
}
