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
package net.boyechko.pdf.autotag;

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import com.itextpdf.kernel.pdf.xobject.PdfImageXObject;
import com.itextpdf.layout.Document;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import net.boyechko.pdf.autotag.core.PdfWriteResult;
import net.boyechko.pdf.autotag.core.RemediationSettings;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.render.BaseDocument;
import net.boyechko.pdf.autotag.render.PageRenderer;
import net.boyechko.pdf.autotag.render.VisualVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that optionally persist PDFs via -Dpdf.autotag.testOutputDir. */
public abstract class PdfTestBase {
    private static final String OUTPUT_DIR_PROPERTY = "pdf.autotag.testOutputDir";

    @TempDir protected Path tempDir;
    private Path outputDir;
    private String testClassName;
    private String testMethodName;

    // ── Test lifecycle ──────────────────────────────────────────────

    @BeforeEach
    void captureTestName(TestInfo testInfo) {
        testClassName =
                testInfo.getTestClass()
                        .map(Class::getSimpleName)
                        .orElse(getClass().getSimpleName());
        testMethodName = testInfo.getTestMethod().map(method -> method.getName()).orElse("test");
    }

    // ── Output path helpers ─────────────────────────────────────────

    protected final OutputStream testOutputStream() {
        Path outputPath = testOutputPath();
        try {
            return Files.newOutputStream(outputPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create test output file: " + outputPath, e);
        }
    }

    protected final Path testOutputPath() {
        String methodName = testMethodName != null ? testMethodName : "test";
        return testOutputDir().resolve(methodName + ".pdf");
    }

    protected final Path testOutputPath(String filename) {
        return testOutputDir().resolve(filename);
    }

    /** Returns {baseDir}/{testClassName}/, creating it if needed. */
    protected final Path testOutputDir() {
        if (outputDir != null) {
            return outputDir;
        }

        String configured = System.getProperty(OUTPUT_DIR_PROPERTY);
        Path baseDir = configured != null && !configured.isBlank() ? Path.of(configured) : tempDir;
        String className = testClassName != null ? testClassName : getClass().getSimpleName();
        Path dir = baseDir.resolve(className);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create test output dir: " + dir, e);
        }
        outputDir = dir;
        return outputDir;
    }

    // ── PDF creation ────────────────────────────────────────────────

    /** Draws one page of an untagged test PDF with the iText kernel canvas API. */
    @FunctionalInterface
    protected interface PageContent {
        void draw(PdfDocument pdfDoc, PdfCanvas canvas, PdfFont font) throws Exception;
    }

    /** Callback for adding content to a tagged test PDF via the iText layout API. */
    @FunctionalInterface
    protected interface TestPdfContent {
        void addTo(PdfDocument pdfDoc, Document document) throws Exception;
    }

    /** Creates an untagged letter-size PDF with one page per {@code pages} entry. */
    protected final Path createUntaggedPdf(Path outputPath, PageContent... pages)
            throws Exception {
        try (PdfDocument pdfDoc = new PdfDocument(new PdfWriter(outputPath.toString()))) {
            PdfFont font = PdfFontFactory.createFont(StandardFonts.HELVETICA);
            for (PageContent content : pages) {
                PdfPage page = pdfDoc.addNewPage(PageSize.LETTER);
                PdfCanvas canvas = new PdfCanvas(page);
                content.draw(pdfDoc, canvas, font);
                canvas.release();
            }
        }
        return outputPath;
    }

    /** Creates a tagged PDF at the specified path with the given content. */
    protected final Path createTaggedPdf(Path outputPath, TestPdfContent content)
            throws Exception {
        try (PdfWriter writer = new PdfWriter(outputPath.toString());
                PdfDocument pdfDoc = new PdfDocument(writer)) {
            pdfDoc.setTagged();
            Document document = new Document(pdfDoc);
            content.addTo(pdfDoc, document);
            document.close();
        }
        return outputPath;
    }

    /** Page content showing {@code text} at (x, y) in 18pt Helvetica. */
    protected static PageContent textAt(String text, float x, float y) {
        return (pdfDoc, canvas, font) -> showText(canvas, font, text, x, y);
    }

    protected static void showText(PdfCanvas canvas, PdfFont font, String text, float x, float y) {
        canvas.beginText().setFontAndSize(font, 18).moveText(x, y).showText(text).endText();
    }

    /** Draws a filled image of the given color into {@code box}. */
    protected static PdfImageXObject drawImage(
            PdfDocument pdfDoc, PdfCanvas canvas, Color color, Rectangle box) {
        PdfImageXObject image = new PdfImageXObject(ImageDataFactory.create(pngBytes(color)));
        image.makeIndirect(pdfDoc);
        canvas.addXObjectFittedIntoRectangle(image, box);
        return image;
    }

    protected static byte[] pngBytes(Color color) {
        BufferedImage image = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, 8, 8);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    // ── Document handles ────────────────────────────────────────────

    protected static PdfDocument openForReading(Path path) throws IOException {
        return new PdfDocument(new PdfReader(path.toString()));
    }

    /** Opens {@code source} for editing, writing the result to {@code target} on close. */
    protected static PdfDocument openForEditing(Path source, Path target) throws IOException {
        return new PdfDocument(new PdfReader(source.toString()), new PdfWriter(target.toString()));
    }

    // ── Write contexts ──────────────────────────────────────────────

    protected static WriteContext contextFor(PdfDocument pdfDoc) {
        return contextFor(pdfDoc, RemediationSettings.defaults(), null);
    }

    protected static WriteContext contextFor(
            PdfDocument pdfDoc, RemediationSettings settings, VisualVerifier verifier) {
        return new WriteContext(
                pdfDoc, settings, verifier, new PdfWriteResult.Builder(), null);
    }

    /** A 72 DPI verifier that draws in-memory page edits over the bytes saved at {@code saved}. */
    protected static VisualVerifier verifierFor(PageRenderer renderer, Path saved)
            throws IOException {
        return new VisualVerifier(renderer, BaseDocument.read(saved, null), 72, 5);
    }
}
