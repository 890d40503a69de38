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
package net.boyechko.pdf.autotag.core;

import com.itextpdf.kernel.pdf.PdfDocument;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.boyechko.pdf.autotag.document.PdfCustodian;
import net.boyechko.pdf.autotag.fixes.AltTextFixer;
import net.boyechko.pdf.autotag.fixes.ContrastFixer;
import net.boyechko.pdf.autotag.fixes.FigureAltRefresher;
import net.boyechko.pdf.autotag.fixes.HeadingTagger;
import net.boyechko.pdf.autotag.fixes.LinkTagger;
import net.boyechko.pdf.autotag.fixes.MetadataFixer;
import net.boyechko.pdf.autotag.fixes.PdfFix;
import net.boyechko.pdf.autotag.fixes.TableTagger;
import net.boyechko.pdf.autotag.plan.ColorFix;
import net.boyechko.pdf.autotag.render.BaseDocument;
import net.boyechko.pdf.autotag.render.PageRenderer;
import net.boyechko.pdf.autotag.render.PdfBoxPageRenderer;
import net.boyechko.pdf.autotag.render.VisualVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link PdfWriteRequest} to a copy of its source PDF.
 *
 * <p>The source is copied to the output path first and never opened for writing. Fixes that only
 * touch metadata and the structure tree always run; fixes that edit content streams run through
 * visual verification, or are reported as skipped when {@code deferTier2} is set. All edits land
 * in one incremental update: the document is closed exactly once, and the new revision is
 * written over the copy only if no fatal error occurred.
 */
public class PdfWriteSession {
    private static final Logger logger = LoggerFactory.getLogger(PdfWriteSession.class);

    public static final String DEFAULT_OUTPUT_SUFFIX = "_remediated.pdf";

    private final RemediationSettings settings;
    private final PageRenderer renderer;
    private final ProcessingListener listener;

    public static class PdfWriteSessionBuilder {
        private RemediationSettings settings;
        private PageRenderer renderer;
        private ProcessingListener listener;

        public PdfWriteSessionBuilder withSettings(RemediationSettings settings) {
            this.settings = settings;
            return this;
        }

        public PdfWriteSessionBuilder withRenderer(PageRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public PdfWriteSessionBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public PdfWriteSession build() {
            return new PdfWriteSession(this);
        }
    }

    public static PdfWriteSessionBuilder builder() {
        return new PdfWriteSessionBuilder();
    }

    private PdfWriteSession(PdfWriteSessionBuilder builder) {
        this.settings = builder.settings != null ? builder.settings : RemediationSettings.load();
        this.renderer = builder.renderer != null ? builder.renderer : new PdfBoxPageRenderer();
        this.listener = builder.listener != null ? builder.listener : ProcessingListener.NONE;
    }

    public RemediationSettings settings() {
        return settings;
    }

    public PdfWriteResult run(PdfWriteRequest request) {
        Path source = request.source();
        if (!Files.isRegularFile(source)) {
            return fail("Source file not found: " + source);
        }

        Path output = resolveOutputPath(source, request.output());
        try {
            if (Files.exists(output) && Files.isSameFile(source, output)) {
                return fail("Output path must differ from the source: " + output);
            }
        } catch (IOException e) {
            return fail("Cannot compare output path with source: " + e.getMessage());
        }

        PdfWriteResult.Builder result = new PdfWriteResult.Builder().outputPath(output.toString());
        request.notes().forEach(note -> {
            result.addWarning(note);
            listener.onWarning(note);
        });

        listener.onPhaseStart("Preparing working copy");
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.copy(source, output, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            return fail("Failed to copy source to " + output + ": " + e.getMessage());
        }

        PdfCustodian custodian = new PdfCustodian(output, request.password());
        ByteArrayOutputStream revision = new ByteArrayOutputStream();
        BaseDocument base;
        PdfDocument doc;
        try {
            base = BaseDocument.read(output, request.password());
            doc = custodian.openForIncrementalUpdate(revision);
        } catch (IOException | RuntimeException e) {
            deleteWorkingCopy(output);
            return fail("Failed to open PDF: " + e.getMessage());
        }

        Exception fatal = null;
        try {
            WriteContext ctx =
                    new WriteContext(doc, settings, buildVerifier(base), result, listener);
            applyFixes(ctx, request);
        } catch (Exception e) {
            logger.error("Failed to apply PDF fixes", e);
            fatal = e;
        } finally {
            try {
                doc.close();
            } catch (RuntimeException e) {
                logger.error("Failed to close PDF", e);
                if (fatal == null) {
                    fatal = e;
                }
            }
        }

        if (fatal == null) {
            try {
                Files.write(output, revision.toByteArray());
            } catch (IOException e) {
                fatal = e;
            }
        }

        if (fatal != null) {
            String message = "Fatal error: " + fatal.getMessage();
            result.addFatalError(message);
            listener.onError(message);
            PdfWriteResult failed = result.build(false);
            listener.onSummary(failed);
            return failed;
        }

        PdfWriteResult done = result.build(true);
        logger.info(
                "PDF fixes applied: {} ({} changes, {} warnings, {} errors)",
                output,
                done.changes().size(),
                done.warnings().size(),
                done.errors().size());
        listener.onSummary(done);
        return done;
    }

    private void applyFixes(WriteContext ctx, PdfWriteRequest request) {
        List<PdfFix> fixes = fixesFor(request);
        boolean deferContentEdits = settings.deferTier2();

        for (PdfFix fix : fixes) {
            if (fix.editsContent() && deferContentEdits) {
                continue;
            }
            listener.onPhaseStart(fix.describe());
            try {
                fix.apply(ctx);
            } catch (RevertFailedException e) {
                throw e;
            } catch (Exception e) {
                logger.debug("Fix {} failed", fix.describe(), e);
                ctx.warn(fix.describe() + " failed: " + e.getMessage());
            }
        }

        if (deferContentEdits) {
            if (!request.headings().isEmpty()) {
                ctx.warn(
                        "Tier 2 heading tags ("
                                + request.headings().size()
                                + " actions) skipped; use external tagger");
            }
            long colorFixes = request.colorFixes().stream().filter(f -> !f.isNoOp()).count();
            if (colorFixes > 0) {
                ctx.warn(
                        "Tier 2 contrast fixes ("
                                + colorFixes
                                + " actions) skipped; use external tagger");
            }
        }
    }

    private List<PdfFix> fixesFor(PdfWriteRequest request) {
        List<PdfFix> fixes = new ArrayList<>();
        if (request.metadata() != null
                && (request.metadata().hasTitle() || request.metadata().hasLanguage())) {
            fixes.add(new MetadataFixer(request.metadata()));
        }
        if (!request.altTexts().isEmpty() || !request.decorativeIds().isEmpty()) {
            fixes.add(
                    new AltTextFixer(
                            request.images(), request.altTexts(), request.decorativeIds()));
        }
        if (settings.refreshExistingFigures() && !request.altTexts().isEmpty()) {
            fixes.add(new FigureAltRefresher(request.images(), request.altTexts()));
        }
        if (!request.tables().isEmpty()) {
            fixes.add(new TableTagger(request.tables()));
        }
        if (!request.links().isEmpty()) {
            fixes.add(new LinkTagger(request.links()));
        }
        if (!request.headings().isEmpty()) {
            fixes.add(new HeadingTagger(request.headings()));
        }
        List<ColorFix> colorFixes =
                request.colorFixes().stream().filter(f -> !f.isNoOp()).toList();
        if (!colorFixes.isEmpty()) {
            fixes.add(new ContrastFixer(colorFixes));
        }
        fixes.sort(Comparator.comparingInt(PdfFix::priority));
        return fixes;
    }

    private VisualVerifier buildVerifier(BaseDocument base) {
        if (!settings.verifyVisually()) {
            return null;
        }
        return new VisualVerifier(
                renderer, base, settings.renderDpi(), settings.channelThreshold());
    }

    private PdfWriteResult fail(String error) {
        logger.error(error);
        listener.onError(error);
        PdfWriteResult failed = PdfWriteResult.failure(error);
        listener.onSummary(failed);
        return failed;
    }

    private static void deleteWorkingCopy(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            logger.warn("Could not delete working copy {}: {}", output, e.getMessage());
        }
    }

    /**
     * Returns {@code requested} if it names a file, {@code <stem>_remediated.pdf} inside it if it
     * is a directory, or next to the source if it is null.
     */
    public static Path resolveOutputPath(Path source, Path requested) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String defaultName = stem + DEFAULT_OUTPUT_SUFFIX;

        if (requested == null) {
            Path parent = source.toAbsolutePath().getParent();
            return parent.resolve(defaultName);
        }
        if (Files.isDirectory(requested)) {
            return requested.resolve(defaultName);
        }
        return requested;
    }
}
