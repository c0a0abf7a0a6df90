package com.williamcallahan.mdcanvas.service.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.font.TextAttribute;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class Graphics2DSurfaceTest {

    private BufferedImage image;
    private Graphics2D graphics;
    private Graphics2DSurface surface;

    @BeforeEach
    void createSurface() {
        image = new BufferedImage(200, 60, BufferedImage.TYPE_INT_ARGB);
        graphics = image.createGraphics();
        surface = new Graphics2DSurface(graphics, Font.SANS_SERIF, 14f);
    }

    @AfterEach
    void disposeGraphics() {
        graphics.dispose();
    }

    @Test
    void fontFor_styleFlags_selectFamilyWeightAndSize() {
        TextRunStyle code = new TextRunStyle(null, 1.0f, true, false, true, false, Color.BLACK);
        TextRunStyle heading = new TextRunStyle("Serif", 2.0f, false, true, false, false, Color.BLACK);

        Font codeFont = surface.fontFor(code);
        Font headingFont = surface.fontFor(heading);

        assertEquals(Font.MONOSPACED, codeFont.getName());
        assertTrue(codeFont.isBold());
        assertEquals("Serif", headingFont.getName());
        assertTrue(headingFont.isItalic());
        assertEquals(28f, headingFont.getSize2D());
    }

    @Test
    void fontFor_strikethrough_setsTextAttribute() {
        TextRunStyle struck = new TextRunStyle(null, 1.0f, false, false, false, true, Color.BLACK);

        Font font = surface.fontFor(struck);

        assertEquals(TextAttribute.STRIKETHROUGH_ON, font.getAttributes().get(TextAttribute.STRIKETHROUGH));
    }

    @Test
    void fontFor_sameStyle_reusesCachedFont() {
        TextRunStyle plain = TextRunStyle.plain(Color.BLACK);

        assertSame(surface.fontFor(plain), surface.fontFor(TextRunStyle.plain(Color.RED)));
    }

    @Test
    void measure_widerTextIsWider() {
        TextRunStyle plain = TextRunStyle.plain(Color.BLACK);

        RunMetrics one = surface.measure("m", plain);
        RunMetrics many = surface.measure("mmmm", plain);

        assertTrue(many.width() > one.width());
        assertTrue(one.height() > 0);
        assertTrue(one.ascent() > 0);
    }

    @Test
    void drawRun_paintsPixelsInRunColor() {
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, 200, 60);

        surface.drawRun("MMMM", 4, 4, new TextRunStyle(null, 2.0f, true, false, false, false, Color.BLACK));

        boolean painted = false;
        for (int x = 0; x < 200 && !painted; x++) {
            for (int y = 0; y < 60 && !painted; y++) {
                painted = image.getRGB(x, y) != Color.WHITE.getRGB();
            }
        }
        assertTrue(painted);
    }

    @Test
    void clipBounds_reflectsGraphicsClip() {
        graphics.setClip(1, 2, 30, 40);

        assertEquals(new Rectangle(1, 2, 30, 40), surface.clipBounds());
    }

    @Test
    void constructor_rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new Graphics2DSurface(graphics, Font.SANS_SERIF, 0f));
    }
}
