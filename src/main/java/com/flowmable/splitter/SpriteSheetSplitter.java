package com.flowmable.splitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Top-level entry point for splitting one sprite sheet.
 * <p>
 * Decode → background model → mode (AUTO resolved once by {@link ModeSelector})
 * → grid or region extraction → matted PNG crops → manifest.
 * Single-threaded; nothing is shared between runs.
 */
public class SpriteSheetSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(SpriteSheetSplitter.class);

    private final ExtractionOptions options;
    private final SpriteWriter spriteWriter;
    private final ManifestWriter manifestWriter;

    public SpriteSheetSplitter() {
        this(ExtractionOptions.DEFAULT);
    }

    public SpriteSheetSplitter(ExtractionOptions options) {
        this.options = options;
        this.spriteWriter = new SpriteWriter();
        this.manifestWriter = new ManifestWriter();
    }

    /**
     * Split {@code sheet} into {@code outputDir}, writing one PNG per sprite and a manifest.
     *
     * @throws IOException when the sheet cannot be read or the output cannot be written
     */
    public ExtractionResult split(Path sheet, Path outputDir) throws IOException {
        BufferedImage image = read(sheet);
        LOG.info("Image: {} ({}x{})", sheet.getFileName(), image.getWidth(), image.getHeight());

        BackgroundModel background = BackgroundModel.resolve(image, options);
        LOG.info("Background color: {}", background.primary().describe());
        if (background.secondary() != null) {
            LOG.info("Background color 2: {}", background.secondary().describe());
        }

        ExtractionResult result = extract(image, background, SpriteNames.baseName(sheet));

        spriteWriter.write(image, background, result.sprites(), outputDir);
        Path manifest = manifestWriter.write(outputDir, sheet.getFileName().toString(),
                result.annotation(), result.sprites());
        LOG.info("Manifest: {}", manifest);
        return result;
    }

    /**
     * Run detection only; no files are written.
     */
    public ExtractionResult extract(BufferedImage image, BackgroundModel background, String baseName) {
        ExtractionMode mode = options.mode();
        if (mode == ExtractionMode.AUTO) {
            mode = new ModeSelector(options).chooseMode(image, background);
            LOG.info("Auto-detected mode: {}", mode.label());
        }
        return switch (mode) {
            case GRID -> new GridExtractor(options).extract(image, background, baseName);
            case DETECT, AUTO -> new RegionExtractor(options).extract(image, background, baseName);
        };
    }

    /**
     * Decode an image as TYPE_INT_ARGB; sources without alpha come out opaque.
     */
    static BufferedImage read(Path file) throws IOException {
        BufferedImage decoded = ImageIO.read(file.toFile());
        if (decoded == null) {
            throw new IOException("Failed to decode image: " + file);
        }
        return toArgb(decoded);
    }

    /**
     * Pixel-for-pixel copy into TYPE_INT_ARGB. No compositing, so fully
     * transparent pixels keep their RGB for background classification.
     */
    static BufferedImage toArgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_ARGB) return src;
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage converted = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        converted.setRGB(0, 0, w, h, src.getRGB(0, 0, w, h, null, 0, w), 0, w);
        return converted;
    }
}
