package com.flowmable.splitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes matted sprite crops as PNG files.
 * <p>
 * Output is staged: every crop is first encoded under a temporary name, then
 * all temporaries are moved to their final {@code {basename}_{index:03d}.png}
 * names. Final names are only committed once every index is known, so a
 * re-sorted index order never collides with a name still in use.
 */
public class SpriteWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SpriteWriter.class);

    static final String FORMAT = "png";

    /**
     * @return paths of the written files, in index order
     * @throws IOException when the directory or a file cannot be written
     */
    public List<Path> write(BufferedImage sheet, BackgroundModel background,
                            List<SpriteRecord> sprites, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        // Phase 1: stage
        List<Path> staged = new ArrayList<>(sprites.size());
        for (int i = 0; i < sprites.size(); i++) {
            SpriteRecord sprite = sprites.get(i);
            BufferedImage cutOut = SpriteMatte.cutOut(sheet, sprite.sourceBox(), background);
            Path tmp = outputDir.resolve(temporaryName(i));
            if (!ImageIO.write(cutOut, FORMAT, tmp.toFile())) {
                throw new IOException("No " + FORMAT + " encoder available for " + tmp);
            }
            staged.add(tmp);
        }

        // Phase 2: commit
        List<Path> written = new ArrayList<>(sprites.size());
        for (int i = 0; i < sprites.size(); i++) {
            Path target = outputDir.resolve(sprites.get(i).fileName());
            Files.move(staged.get(i), target, StandardCopyOption.REPLACE_EXISTING);
            written.add(target);
        }
        LOG.info("Saved {} sprites to {}", written.size(), outputDir);
        return written;
    }

    static String temporaryName(int index) {
        return String.format(Locale.ROOT, "_tmp_%03d.%s", index, FORMAT);
    }
}
