package com.flowmable.splitter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SpriteWriterTest {

    @TempDir
    Path outputDir;

    private final BufferedImage sheet = SyntheticSheets.twoSprites();
    private final List<SpriteRecord> sprites = List.of(
            SpriteRecord.of(0, "pair", new Box(0, 8, 82, 92), new GridPosition(0, 0)),
            SpriteRecord.of(1, "pair", new Box(118, 8, 200, 92), new GridPosition(0, 1)));

    @Test
    void write_finalNamesOnly() throws IOException {
        List<Path> written = new SpriteWriter().write(sheet, SyntheticSheets.whiteBackground(), sprites, outputDir);

        assertEquals(List.of(outputDir.resolve("pair_000.png"), outputDir.resolve("pair_001.png")), written);
        try (Stream<Path> files = Files.list(outputDir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
            assertEquals(List.of("pair_000.png", "pair_001.png"), names);
        }
    }

    @Test
    void write_pngKeepsAlphaMatte() throws IOException {
        new SpriteWriter().write(sheet, SyntheticSheets.whiteBackground(), sprites, outputDir);

        BufferedImage first = ImageIO.read(outputDir.resolve("pair_000.png").toFile());
        assertEquals(82, first.getWidth());
        assertEquals(84, first.getHeight());
        assertEquals(0, first.getRGB(0, 0) >>> 24);
        assertEquals(SyntheticSheets.RED, first.getRGB(40, 40));
    }

    @Test
    void write_replacesStaleOutput() throws IOException {
        Path stale = outputDir.resolve("pair_001.png");
        Files.writeString(stale, "not a png");

        new SpriteWriter().write(sheet, SyntheticSheets.whiteBackground(), sprites, outputDir);

        assertNotNull(ImageIO.read(stale.toFile()));
    }

    @Test
    void write_createsMissingDirectory() throws IOException {
        Path nested = outputDir.resolve("a").resolve("b");
        new SpriteWriter().write(sheet, SyntheticSheets.whiteBackground(), List.of(), nested);
        assertTrue(Files.isDirectory(nested));
    }

    @Test
    void temporaryName_format() {
        assertEquals("_tmp_007.png", SpriteWriter.temporaryName(7));
    }
}
