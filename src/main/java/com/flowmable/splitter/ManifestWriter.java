package com.flowmable.splitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable listing of the extracted sprites, written as {@code manifest.txt}.
 */
public class ManifestWriter {

    public static final String FILE_NAME = "manifest.txt";

    public Path write(Path outputDir, String sourceName, String annotation,
                      List<SpriteRecord> sprites) throws IOException {
        Files.createDirectories(outputDir);
        Path manifest = outputDir.resolve(FILE_NAME);
        Files.writeString(manifest, render(sourceName, annotation, sprites), StandardCharsets.UTF_8);
        return manifest;
    }

    public static String render(String sourceName, String annotation, List<SpriteRecord> sprites) {
        StringBuilder sb = new StringBuilder();
        sb.append("Source: ").append(sourceName).append('\n');
        if (annotation != null && !annotation.isEmpty()) {
            sb.append(annotation).append('\n');
        }
        sb.append("Sprites extracted: ").append(sprites.size()).append("\n\n");
        for (SpriteRecord sprite : sprites) {
            sb.append(line(sprite)).append('\n');
        }
        return sb.toString();
    }

    static String line(SpriteRecord sprite) {
        String position = sprite.hasGridPosition()
                ? String.format(Locale.ROOT, "grid=(%2d,%2d)  ",
                        sprite.gridPosition().row(), sprite.gridPosition().col())
                : "";
        Box box = sprite.sourceBox();
        return String.format(Locale.ROOT, "%-30s  %4dx%-4d  %sfrom (%d, %d) to (%d, %d)",
                sprite.fileName(), sprite.width(), sprite.height(), position,
                box.x1(), box.y1(), box.x2(), box.y2());
    }
}
