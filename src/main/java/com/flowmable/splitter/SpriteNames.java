package com.flowmable.splitter;

import java.nio.file.Path;

/**
 * Output naming for sprites cut from a sheet.
 */
public final class SpriteNames {

    /** File name prefix added by the image generator the sheets usually come from. */
    public static final String GENERATOR_PREFIX = "Gemini_Generated_Image_";

    private SpriteNames() {}

    /**
     * Sheet file name without extension or generator prefix,
     * e.g. {@code Gemini_Generated_Image_abc123.png} becomes {@code abc123}.
     */
    public static String baseName(Path sheet) {
        String name = sheet.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        if (name.startsWith(GENERATOR_PREFIX) && name.length() > GENERATOR_PREFIX.length()) {
            name = name.substring(GENERATOR_PREFIX.length());
        }
        return name;
    }
}
