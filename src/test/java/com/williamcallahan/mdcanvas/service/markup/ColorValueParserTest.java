package com.williamcallahan.mdcanvas.service.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColorValueParserTest {

    @Test
    void parse_hexForms_expandShortDigits() {
        assertEquals(List.of(new Color(255, 0, 0)), ColorValueParser.parse("#f00").orElseThrow());
        assertEquals(List.of(new Color(0x12, 0x34, 0x56)), ColorValueParser.parse("#123456").orElseThrow());
    }

    @Test
    void parse_rgbFunctionAndName_areCaseInsensitive() {
        assertEquals(List.of(new Color(1, 2, 3)), ColorValueParser.parse("RGB(1, 2, 3)").orElseThrow());
        assertEquals(List.of(new Color(0, 0, 128)), ColorValueParser.parse("Navy").orElseThrow());
    }

    @Test
    void parse_underscoreSeparatedStops_formGradient() {
        List<Color> stops = ColorValueParser.parse("red_#00f_white").orElseThrow();

        assertEquals(List.of(new Color(255, 0, 0), new Color(0, 0, 255), new Color(255, 255, 255)), stops);
    }

    @Test
    void parse_invalidValues_areRejected() {
        assertTrue(ColorValueParser.parse("").isEmpty());
        assertTrue(ColorValueParser.parse("#12").isEmpty());
        assertTrue(ColorValueParser.parse("#ggg").isEmpty());
        assertTrue(ColorValueParser.parse("rgb(256,0,0)").isEmpty());
        assertTrue(ColorValueParser.parse("rgb(1,2)").isEmpty());
        assertTrue(ColorValueParser.parse("red_notacolor").isEmpty());
        assertTrue(ColorValueParser.parse("red_").isEmpty());
    }

    @Test
    void parse_moreThanEightStops_isRejected() {
        assertTrue(ColorValueParser.parse("red_red_red_red_red_red_red_red").isPresent());
        assertTrue(ColorValueParser.parse("red_red_red_red_red_red_red_red_red").isEmpty());
    }
}
