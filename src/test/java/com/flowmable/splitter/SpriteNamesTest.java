package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SpriteNamesTest {

    @Test
    void baseName_stripsExtension() {
        assertEquals("sheet", SpriteNames.baseName(Path.of("dir", "sheet.png")));
        assertEquals("a.b", SpriteNames.baseName(Path.of("a.b.jpg")));
    }

    @Test
    void baseName_stripsGeneratorPrefix() {
        assertEquals("k3x9", SpriteNames.baseName(Path.of("Gemini_Generated_Image_k3x9.png")));
    }

    @Test
    void baseName_keepsBarePrefixAndDotFiles() {
        assertEquals("Gemini_Generated_Image_", SpriteNames.baseName(Path.of("Gemini_Generated_Image_.png")));
        assertEquals(".hidden", SpriteNames.baseName(Path.of(".hidden")));
    }

    @Test
    void spriteFileName_zeroPadded() {
        assertEquals("k3x9_004.png", SpriteRecord.fileName("k3x9", 4));
        assertEquals("k3x9_1234.png", SpriteRecord.fileName("k3x9", 1234));
    }
}
