package com.flowmable.splitter;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.validators.PositiveInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI driver: {@code sprite-splitter <input image> <output dir> [options]}.
 * <p>
 * Exit status 0 on success (also when no sprites were found), 1 on I/O
 * failure, 2 on invalid arguments.
 */
public class SplitterDriver {

    private static final Logger LOG = LoggerFactory.getLogger(SplitterDriver.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static class CommandLineParameters {

        @Parameter(description = "<input image> <output dir>")
        private List<String> paths = new ArrayList<>();

        @Parameter(names = "--mode", description = "Split mode: grid, detect or auto",
                converter = ModeConverter.class)
        private ExtractionMode mode = ExtractionOptions.DEFAULT.mode();

        @Parameter(names = "--min-size", description = "Minimum sprite dimension",
                validateWith = PositiveInteger.class)
        private int minSize = ExtractionOptions.DEFAULT.minSize();

        @Parameter(names = "--padding", description = "Padding around each crop",
                validateWith = PositiveInteger.class)
        private int padding = ExtractionOptions.DEFAULT.padding();

        @Parameter(names = "--bg-color", description = "Background color as R,G,B (default: from corners)",
                converter = RgbConverter.class)
        private Rgb background;

        @Parameter(names = "--bg-color2", description = "Second background color as R,G,B (checkerboards)",
                converter = RgbConverter.class)
        private Rgb background2;

        @Parameter(names = "--bg-tolerance", description = "Color distance tolerance for background",
                validateWith = PositiveInteger.class)
        private int tolerance = (int) ExtractionOptions.DEFAULT.tolerance();

        @Parameter(names = "--erosion", description = "Erode mask N iterations before labeling",
                validateWith = PositiveInteger.class)
        private int erosion = ExtractionOptions.DEFAULT.erosion();

        @Parameter(names = "--cols", description = "Force number of columns")
        private Integer columns;

        @Parameter(names = "--rows", description = "Force number of rows")
        private Integer rows;

        @Parameter(names = "--min-period", description = "Shortest grid period considered by detection",
                validateWith = PositiveInteger.class)
        private int minPeriod = ExtractionOptions.DEFAULT.minPeriod();

        @Parameter(names = {"--help", "-h"}, help = true, description = "Show usage")
        private boolean help;

        ExtractionOptions toOptions() {
            return ExtractionOptions.DEFAULT
                    .withMode(mode)
                    .withMinSize(minSize)
                    .withPadding(padding)
                    .withBackground(background, background2)
                    .withTolerance(tolerance)
                    .withErosion(erosion)
                    .withGrid(columns, rows)
                    .withMinPeriod(minPeriod);
        }
    }

    public static class ModeConverter implements IStringConverter<ExtractionMode> {
        @Override
        public ExtractionMode convert(String value) {
            try {
                return ExtractionMode.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }

    public static class RgbConverter implements IStringConverter<Rgb> {
        @Override
        public Rgb convert(String value) {
            try {
                return Rgb.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String... args) {
        CommandLineParameters parameters = new CommandLineParameters();
        JCommander commander = JCommander.newBuilder()
                .programName("sprite-splitter")
                .addObject(parameters)
                .build();

        ExtractionOptions options;
        try {
            commander.parse(args);
            if (parameters.help) {
                commander.usage();
                return EXIT_OK;
            }
            if (parameters.paths.size() != 2) {
                throw new ParameterException("Expected <input image> <output dir>, got " + parameters.paths.size() + " path(s)");
            }
            options = parameters.toOptions();
        } catch (ParameterException | IllegalArgumentException e) {
            System.err.println(e.getMessage());
            commander.usage();
            return EXIT_USAGE;
        }

        Path input = Path.of(parameters.paths.get(0));
        Path outputDir = Path.of(parameters.paths.get(1));
        try {
            ExtractionResult result = new SpriteSheetSplitter(options).split(input, outputDir);
            if (result.sprites().isEmpty()) {
                LOG.warn("No sprites extracted from {}", input.getFileName());
            }
            return EXIT_OK;
        } catch (IOException e) {
            LOG.error("Failed to split {}: {}", input, e.getMessage(), e);
            return EXIT_IO_ERROR;
        }
    }
}
