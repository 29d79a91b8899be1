package com.flowmable.splitter;

import java.awt.image.BufferedImage;

/**
 * Crops a sprite and mattes its background to transparency.
 * <p>
 * The matte is recomputed on the crop itself rather than taken from the sheet's
 * mask, so padding pixels that touch neighbouring content are classified on
 * their own color.
 */
public final class SpriteMatte {

    private static final int OPAQUE = 0xFF000000;

    private SpriteMatte() {}

    public static BufferedImage cutOut(BufferedImage sheet, Box box, BackgroundModel background) {
        int w = box.width();
        int h = box.height();
        int[] pixels = sheet.getRGB(box.x1(), box.y1(), w, h, null, 0, w);
        for (int i = 0; i < pixels.length; i++) {
            int rgb = pixels[i] & 0x00FFFFFF;
            pixels[i] = background.isBackground(pixels[i]) ? rgb : OPAQUE | rgb;
        }
        BufferedImage sprite = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        sprite.setRGB(0, 0, w, h, pixels, 0, w);
        return sprite;
    }
}
