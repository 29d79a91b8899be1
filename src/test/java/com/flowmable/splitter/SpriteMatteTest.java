package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class SpriteMatteTest {

    @Test
    void cutOut_backgroundTransparentForegroundOpaque() {
        BufferedImage sheet = SyntheticSheets.twoSprites();
        BufferedImage sprite = SpriteMatte.cutOut(sheet, new Box(0, 8, 82, 92), SyntheticSheets.whiteBackground());

        assertEquals(82, sprite.getWidth());
        assertEquals(84, sprite.getHeight());
        assertEquals(0, sprite.getRGB(0, 0) >>> 24, "Padding row is background");
        assertEquals(0, sprite.getRGB(81, 40) >>> 24, "Padding column is background");
        assertEquals(SyntheticSheets.RED, sprite.getRGB(10, 10));
    }

    @Test
    void cutOut_mattesOnCropNotOnSheetMask() {
        // Opaque pixel in the padding area belongs to a neighbour but is still foreground by color
        BufferedImage sheet = SyntheticSheets.uniform(50, 50, SyntheticSheets.WHITE);
        SyntheticSheets.fill(sheet, 10, 10, 20, 20, SyntheticSheets.RED);
        sheet.setRGB(31, 20, SyntheticSheets.BLUE);

        BufferedImage sprite = SpriteMatte.cutOut(sheet, new Box(8, 8, 32, 32), SyntheticSheets.whiteBackground());
        assertEquals(0xFF, sprite.getRGB(23, 12) >>> 24);
        assertEquals(0, sprite.getRGB(22, 12) >>> 24);
    }

    @Test
    void cutOut_secondBackgroundColorAlsoTransparent() {
        BufferedImage sheet = SyntheticSheets.checkerboard(32, 32, 0xFFC8C8C8, 0xFF969696);
        SyntheticSheets.fill(sheet, 12, 12, 8, 8, SyntheticSheets.RED);
        BackgroundModel model = new BackgroundModel(new Rgb(200, 200, 200), new Rgb(150, 150, 150), 10);

        BufferedImage sprite = SpriteMatte.cutOut(sheet, new Box(8, 8, 24, 24), model);
        int opaque = 0;
        for (int y = 0; y < 16; y++)
            for (int x = 0; x < 16; x++)
                if ((sprite.getRGB(x, y) >>> 24) == 0xFF) opaque++;
        assertEquals(64, opaque);
    }
}
