package com.flowmable.splitter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestWriterTest {

    @TempDir
    Path outputDir;

    @Test
    void line_gridSprite() {
        SpriteRecord sprite = SpriteRecord.of(3, "sheet", new Box(118, 8, 200, 92), new GridPosition(0, 1));
        assertEquals("sheet_003.png" + " ".repeat(17) + "    82x84    grid=( 0, 1)  from (118, 8) to (200, 92)",
                ManifestWriter.line(sprite));
    }

    @Test
    void line_detectedSprite() {
        SpriteRecord sprite = SpriteRecord.of(0, "blobs", new Box(18, 38, 52, 72), null);
        assertEquals("blobs_000.png" + " ".repeat(17) + "    34x34    from (18, 38) to (52, 72)",
                ManifestWriter.line(sprite));
    }

    @Test
    void render_headerAndEntries() {
        List<SpriteRecord> sprites = List.of(
                SpriteRecord.of(0, "s", new Box(0, 0, 30, 30), new GridPosition(0, 0)),
                SpriteRecord.of(1, "s", new Box(30, 0, 60, 30), new GridPosition(0, 1)));
        String text = ManifestWriter.render("s.png", "Grid: 2x1, period: 30x30", sprites);

        String[] lines = text.split("\n", -1);
        assertEquals("Source: s.png", lines[0]);
        assertEquals("Grid: 2x1, period: 30x30", lines[1]);
        assertEquals("Sprites extracted: 2", lines[2]);
        assertEquals("", lines[3]);
        assertTrue(lines[4].startsWith("s_000.png"));
        assertTrue(lines[5].contains("grid=( 0, 1)"));
    }

    @Test
    void render_withoutAnnotation() {
        assertEquals("Source: x.png\nSprites extracted: 0\n\n", ManifestWriter.render("x.png", "", List.of()));
    }

    @Test
    void write_emptyManifest() throws IOException {
        Path manifest = new ManifestWriter().write(outputDir.resolve("nested"), "blank.png", "Mode: detect", List.of());

        assertEquals(ManifestWriter.FILE_NAME, manifest.getFileName().toString());
        assertEquals("Source: blank.png\nMode: detect\nSprites extracted: 0\n\n", Files.readString(manifest));
    }
}
