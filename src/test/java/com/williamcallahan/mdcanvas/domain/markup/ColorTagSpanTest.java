package com.williamcallahan.mdcanvas.domain.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColorTagSpanTest {

    @Test
    void solidColor_isSameAtEveryPosition() {
        ColorTagSpan span = new ColorTagSpan(2, 6, "red", List.of(Color.RED));

        assertFalse(span.isGradient());
        assertEquals(Color.RED, span.colorAt(2));
        assertEquals(Color.RED, span.colorAt(5));
    }

    @Test
    void gradient_interpolatesFromFirstToLastStop() {
        ColorTagSpan span = new ColorTagSpan(0, 3, "#000_#fff", List.of(Color.BLACK, Color.WHITE));

        assertTrue(span.isGradient());
        assertEquals(Color.BLACK, span.colorAt(0));
        assertEquals(new Color(128, 128, 128), span.colorAt(1));
        assertEquals(Color.WHITE, span.colorAt(2));
    }

    @Test
    void gradient_clampsPositionsOutsideSpan() {
        ColorTagSpan span = new ColorTagSpan(10, 12, "red_blue", List.of(Color.RED, Color.BLUE));

        assertEquals(Color.RED, span.colorAt(0));
        assertEquals(Color.BLUE, span.colorAt(50));
    }

    @Test
    void constructor_rejectsTooManyStops() {
        List<Color> stops = Collections.nCopies(ColorTagSpan.MAX_COLOR_STOPS + 1, Color.RED);

        assertThrows(IllegalArgumentException.class, () -> new ColorTagSpan(0, 1, "red", stops));
        assertThrows(IllegalArgumentException.class, () -> new ColorTagSpan(0, 1, "red", List.of()));
    }
}
