/*
 * PDF-Auto-Tag - In-place PDF Accessibility Tagging
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autotag.ui.cli;

import ch.qos.logback.classic.LoggerContext;
import com.itextpdf.kernel.pdf.PdfDocument;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.pdf.autotag.core.PdfWriteRequest;
import net.boyechko.pdf.autotag.core.PdfWriteResult;
import net.boyechko.pdf.autotag.core.PdfWriteSession;
import net.boyechko.pdf.autotag.core.ProcessingListener;
import net.boyechko.pdf.autotag.core.RemediationSettings;
import net.boyechko.pdf.autotag.core.VerbosityLevel;
import net.boyechko.pdf.autotag.document.ImageInfo;
import net.boyechko.pdf.autotag.document.ImageInventory;
import net.boyechko.pdf.autotag.document.PdfCustodian;
import net.boyechko.pdf.autotag.fixes.StructTreeStripper;
import net.boyechko.pdf.autotag.plan.ColorFix;
import net.boyechko.pdf.autotag.plan.HeadingAction;
import net.boyechko.pdf.autotag.plan.TaggingPlan;
import net.boyechko.pdf.autotag.plan.TaggingPlanReader;
import net.boyechko.pdf.autotag.ui.LoggingListener;
import net.boyechko.pdf.autotag.ui.ResultReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfAutoTagCLI {
    private static final String STRIPPED_OUTPUT_SUFFIX = "_untagged.pdf";

    private static Logger logger;

    /** A heading given on the command line as {@code LEVEL:PAGE:TEXT}, page 1-based. */
    public record HeadingArg(int level, int page, String text) {}

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            String password,
            Path planPath,
            String title,
            String language,
            List<HeadingArg> headings,
            Map<String, String> altTexts,
            List<String> decorativeIds,
            List<ColorFix> colorFixes,
            boolean noVerify,
            boolean deferTier2,
            boolean refreshFigures,
            boolean stripTags,
            boolean json,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null && planPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            headings = List.copyOf(headings);
            altTexts = Map.copyOf(altTexts);
            decorativeIds = List.copyOf(decorativeIds);
            colorFixes = List.copyOf(colorFixes);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }

        public CLIException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        String password;
        Path planPath;
        String title;
        String language;
        final List<HeadingArg> headings = new ArrayList<>();
        final Map<String, String> altTexts = new LinkedHashMap<>();
        final List<String> decorativeIds = new ArrayList<>();
        final List<ColorFix> colorFixes = new ArrayList<>();
        boolean noVerify;
        boolean deferTier2;
        boolean refreshFigures;
        boolean stripTags;
        boolean json;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null && planPath == null) {
                throw new CLIException("No input file specified");
            }
            if (inputPath != null && !Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (planPath != null && !Files.exists(planPath)) {
                throw new CLIException("Plan not found: " + planPath);
            }
            if (stripTags && inputPath == null) {
                throw new CLIException("--strip-tags needs an input file");
            }
            return new CLIConfig(
                    inputPath,
                    outputPath,
                    password,
                    planPath,
                    title,
                    language,
                    headings,
                    altTexts,
                    decorativeIds,
                    colorFixes,
                    noVerify,
                    deferTier2,
                    refreshFigures,
                    stripTags,
                    json,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        int status;
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            status = run(config, System.out);
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs one invocation and returns the process exit status. */
    static int run(CLIConfig config, PrintStream out) throws CLIException {
        if (config.stripTags()) {
            return stripTags(config, out);
        }

        PdfWriteRequest request = buildRequest(config);
        RemediationSettings settings = RemediationSettings.load();
        if (config.noVerify()) {
            settings = settings.withVerifyVisually(false);
        }
        if (config.deferTier2()) {
            settings = settings.withDeferTier2(true);
        }
        if (config.refreshFigures()) {
            settings = settings.withRefreshExistingFigures(true);
        }

        logger().info("Tagging {} into {}", request.source(), request.output());
        PdfWriteSession session =
                PdfWriteSession.builder()
                        .withSettings(settings)
                        .withListener(listenerFor(config, out))
                        .build();
        PdfWriteResult result = session.run(request);
        return result.success() ? 0 : 1;
    }

    /** At debug verbosity, session events go to the log alongside library debug output. */
    static ProcessingListener listenerFor(CLIConfig config, PrintStream out) {
        if (config.verbosity() == VerbosityLevel.DEBUG && !config.json()) {
            return LoggingListener.withConsoleOutput();
        }
        return new ResultReporter(out, config.verbosity(), config.json());
    }

    static PdfWriteRequest buildRequest(CLIConfig config) throws CLIException {
        TaggingPlan plan = null;
        if (config.planPath() != null) {
            try {
                plan = new TaggingPlanReader().read(config.planPath());
            } catch (IOException e) {
                throw new CLIException(e.getMessage(), e);
            }
        }

        Path input = config.inputPath();
        if (input == null) {
            input =
                    planPath(plan.inputPath())
                            .orElseThrow(() -> new CLIException("Plan names no input_path"));
        }
        Path output = config.outputPath();
        if (output == null && plan != null) {
            output = planPath(plan.outputPath()).orElse(null);
        }

        PdfWriteRequest.Builder builder =
                PdfWriteRequest.builder(input).output(output).password(config.password());
        if (config.title() != null || config.language() != null) {
            builder.metadata(config.title(), config.language());
        }
        for (HeadingArg heading : config.headings()) {
            builder.heading(
                    new HeadingAction(
                            null, heading.level(), heading.text(), heading.page() - 1, null));
        }
        config.colorFixes().forEach(builder::colorFix);

        if (!config.altTexts().isEmpty() || !config.decorativeIds().isEmpty()) {
            Map<String, ImageInfo> inventory = scanImages(input, config.password());
            for (Map.Entry<String, String> alt : config.altTexts().entrySet()) {
                builder.image(lookupImage(inventory, alt.getKey()));
                builder.altText(alt.getKey(), alt.getValue());
            }
            for (String id : config.decorativeIds()) {
                builder.image(lookupImage(inventory, id));
                builder.decorative(id);
            }
        }

        if (plan != null) {
            builder.plan(plan);
        }
        return builder.build();
    }

    private static Optional<Path> planPath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value));
    }

    private static Map<String, ImageInfo> scanImages(Path input, String password)
            throws CLIException {
        Map<String, ImageInfo> byId = new LinkedHashMap<>();
        try (PdfDocument doc = new PdfCustodian(input, password).openForReading()) {
            for (ImageInfo image : ImageInventory.scan(doc)) {
                byId.put(image.id(), image);
            }
        } catch (IOException | RuntimeException e) {
            throw new CLIException("Failed to scan images in " + input + ": " + e.getMessage(), e);
        }
        return byId;
    }

    private static ImageInfo lookupImage(Map<String, ImageInfo> inventory, String id)
            throws CLIException {
        ImageInfo image = inventory.get(id);
        if (image == null) {
            throw new CLIException(
                    "Unknown image id " + id + " (document has " + inventory.size() + " images)");
        }
        return image;
    }

    private static int stripTags(CLIConfig config, PrintStream out) {
        Path input = config.inputPath();
        Path output = config.outputPath();
        String fileName = input.getFileName().toString();
        String stem = fileName.replaceFirst("[.][^.]+$", "");
        if (output == null) {
            output = input.toAbsolutePath().resolveSibling(stem + STRIPPED_OUTPUT_SUFFIX);
        } else if (Files.isDirectory(output)) {
            output = output.resolve(stem + STRIPPED_OUTPUT_SUFFIX);
        }
        if (StructTreeStripper.strip(input, output, config.password())) {
            out.println("✓ Structure tree removed: " + output);
            return 0;
        }
        System.err.println("✗ Could not strip structure tree from " + input);
        return 1;
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-p", "--password" -> b.password = requireValue(args, ++i, "-p");
                case "--plan" -> b.planPath = Paths.get(requireValue(args, ++i, "--plan"));
                case "--title" -> b.title = requireValue(args, ++i, "--title");
                case "--lang" -> b.language = requireValue(args, ++i, "--lang");
                case "--heading" ->
                        b.headings.add(parseHeading(requireValue(args, ++i, "--heading")));
                case "--alt" -> {
                    String[] pair = splitPair(requireValue(args, ++i, "--alt"), "--alt");
                    b.altTexts.put(pair[0], pair[1]);
                }
                case "--decorative" -> b.decorativeIds.add(requireValue(args, ++i, "--decorative"));
                case "--contrast" -> {
                    String[] pair = splitPair(requireValue(args, ++i, "--contrast"), "--contrast");
                    b.colorFixes.add(new ColorFix(pair[0], pair[1]));
                }
                case "--no-verify" -> b.noVerify = true;
                case "--defer-tier2" -> b.deferTier2 = true;
                case "--refresh-figures" -> b.refreshFigures = true;
                case "--strip-tags" -> b.stripTags = true;
                case "--json" -> b.json = true;
                case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new CLIException("Unknown option: " + args[i]);
                    } else if (b.inputPath == null) {
                        b.inputPath = Paths.get(args[i]);
                    } else if (b.outputPath == null) {
                        b.outputPath = Paths.get(args[i]);
                    } else {
                        throw new CLIException("Too many file arguments: " + args[i]);
                    }
                }
            }
        }

        return b.build();
    }

    private static String requireValue(String[] args, int i, String option)
            throws CLIException {
        if (i >= args.length) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[i];
    }

    private static String[] splitPair(String value, String option) throws CLIException {
        int eq = value.indexOf('=');
        if (eq <= 0) {
            throw new CLIException("Expected KEY=VALUE after " + option + ": " + value);
        }
        return new String[] {value.substring(0, eq), value.substring(eq + 1)};
    }

    static HeadingArg parseHeading(String value) throws CLIException {
        String[] parts = value.split(":", 3);
        if (parts.length != 3 || parts[2].isBlank()) {
            throw new CLIException("Expected LEVEL:PAGE:TEXT after --heading: " + value);
        }
        try {
            int level = Integer.parseInt(parts[0].trim());
            int page = Integer.parseInt(parts[1].trim());
            if (level < 1 || level > 6 || page < 1) {
                throw new CLIException("Heading level must be 1-6 and page at least 1: " + value);
            }
            return new HeadingArg(level, page, parts[2]);
        } catch (NumberFormatException e) {
            throw new CLIException("Expected LEVEL:PAGE:TEXT after --heading: " + value);
        }
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(verbosity.logLevel());
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfAutoTagCLI.class);
        }
        return logger;
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return """
                Usage: pdf-autotag [options] <input.pdf> [<output.pdf>]

                Tags headings, images, tables and links in a copy of a PDF and fixes
                low-contrast text colors, checking each content edit against a rendering
                of the page. The input file is never modified.

                Options:
                  -h, --help                 Show this help message
                  -q, --quiet                Only show errors and final status
                  -v, --verbose              Show each change and warning as it happens
                  -vv, --debug               Show debug output
                  -p, --password <pass>      Password for encrypted PDFs
                  --plan <plan.json>         Read actions from a tagging plan
                  --title <title>            Set the document title
                  --lang <code>              Set the document language, e.g. en-US
                  --heading LEVEL:PAGE:TEXT  Tag TEXT on PAGE (1-based) as a heading
                  --alt IMAGE_ID=TEXT        Set alt text on an image (ids: img_0, img_1, ...)
                  --decorative IMAGE_ID      Mark an image as decorative
                  --contrast #RRGGBB=#RRGGBB Replace a text color
                  --no-verify                Skip rendering checks on content edits
                  --defer-tier2              Skip heading and contrast edits
                  --refresh-figures          Replace weak alt text on existing figures
                  --strip-tags               Write a copy without the structure tree
                  --json                     Print the result as JSON

                Without an output path, the result is written to <input>_remediated.pdf.
                """;
    }
}
