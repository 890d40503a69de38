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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import net.boyechko.pdf.autotag.PdfTestBase;
import net.boyechko.pdf.autotag.document.StructureTree;
import net.boyechko.pdf.autotag.plan.ColorFix;
import net.boyechko.pdf.autotag.plan.HeadingAction;
import net.boyechko.pdf.autotag.render.StubPageRenderer;
import org.junit.jupiter.api.Test;

/** Test suite for PdfWriteSession. */
public class PdfWriteSessionTest extends PdfTestBase {
    private static final HeadingAction COURSE_DESCRIPTION =
            new HeadingAction("h_1", 1, "Course Description", 0, null);

    private Path syllabusPdf() throws Exception {
        return createUntaggedPdf(
                testOutputPath("syllabus.pdf"),
                (pdfDoc, canvas, font) -> {
                    showText(canvas, font, "Syllabus", 72, 700);
                    canvas.setFillColorRgb(0.6f, 0.6f, 0.6f);
                    showText(canvas, font, "Course Description", 72, 650);
                },
                textAt("Week 1: Introduction", 72, 700));
    }

    private static PdfWriteSession session(RemediationSettings settings) {
        return PdfWriteSession.builder()
                .withSettings(settings)
                .withRenderer(StubPageRenderer.unchanged())
                .build();
    }

    @Test
    void appliesMetadataAndHeadingAsIncrementalUpdate() throws Exception {
        Path source = syllabusPdf();
        byte[] original = Files.readAllBytes(source);
        Path output = testOutputPath("out/syllabus_tagged.pdf");
        RecordingProcessingListener listener = new RecordingProcessingListener();

        PdfWriteSession session =
                PdfWriteSession.builder()
                        .withSettings(RemediationSettings.defaults())
                        .withListener(listener)
                        .build();
        PdfWriteResult result =
                session.run(
                        PdfWriteRequest.builder(source)
                                .output(output)
                                .metadata("Syllabus", "en")
                                .heading(COURSE_DESCRIPTION)
                                .build());

        assertTrue(result.success(), result.errors().toString());
        assertEquals(output.toString(), result.outputPath());
        assertEquals(
                List.of(
                        "Set PDF title: Syllabus",
                        "Set PDF language: en",
                        "Tagged 'Course Description' as H1 on page 1"),
                result.changes());
        assertEquals(1, result.headingTagsApplied());
        assertTrue(result.warnings().isEmpty(), result.warnings().toString());

        assertArrayEquals(original, Files.readAllBytes(source), "Source must not change");
        byte[] written = Files.readAllBytes(output);
        assertTrue(written.length > original.length);
        assertArrayEquals(
                original,
                Arrays.copyOf(written, original.length),
                "Output should be the source plus one appended revision");
        int appended = written.length - original.length;
        String tail =
                new String(written, original.length, appended, StandardCharsets.ISO_8859_1);
        assertEquals(1, tail.split("%%EOF", -1).length - 1, "Exactly one revision appended");

        try (PdfDocument doc = openForReading(output)) {
            assertEquals(2, doc.getNumberOfPages());
            assertEquals("Syllabus", doc.getDocumentInfo().getTitle());
            PdfDictionary root =
                    doc.getCatalog().getPdfObject().getAsDictionary(PdfName.StructTreeRoot);
            assertEquals(1, StructureTree.findElementsByType(root, PdfName.H1, 8).size());
        }

        assertEquals(
                List.of("Preparing working copy", "Metadata", "Heading tags"), listener.phases());
        assertEquals(1, listener.summaries.size());
        assertTrue(listener.summaries.get(0).success());
    }

    @Test
    void defaultRendererVerifiesHeadingAndContrastEdits() throws Exception {
        Path source = syllabusPdf();
        Path output = testOutputPath("verified.pdf");

        PdfWriteResult result =
                PdfWriteSession.builder()
                        .build()
                        .run(
                                PdfWriteRequest.builder(source)
                                        .output(output)
                                        .heading(COURSE_DESCRIPTION)
                                        .colorFix(new ColorFix("#999999", "#595959"))
                                        .build());

        assertTrue(result.success(), result.errors().toString());
        assertTrue(result.warnings().isEmpty(), result.warnings().toString());
        assertEquals(1, result.headingTagsApplied());
        assertEquals(1, result.contrastFixesApplied());

        try (PdfDocument doc = openForReading(output)) {
            String content =
                    new String(doc.getPage(1).getContentBytes(), StandardCharsets.ISO_8859_1);
            assertTrue(content.contains("/H1 <</MCID 0>> BDC"), content);
            assertTrue(content.contains("0.3490 0.3490 0.3490 rg"), content);
        }
    }

    @Test
    void defaultOutputGoesNextToSource() throws Exception {
        Path source = syllabusPdf();

        PdfWriteResult result =
                session(RemediationSettings.defaults())
                        .run(PdfWriteRequest.builder(source).metadata("Syllabus", null).build());

        Path expected = source.toAbsolutePath().getParent().resolve("syllabus_remediated.pdf");
        assertTrue(result.success());
        assertEquals(expected.toString(), result.outputPath());
        assertTrue(Files.exists(expected));
    }

    @Test
    void outputPathResolution() throws Exception {
        Path source = tempDir.resolve("notes.v2.pdf");

        assertEquals(
                tempDir.resolve("notes.v2_remediated.pdf"),
                PdfWriteSession.resolveOutputPath(source, null));
        assertEquals(
                tempDir.resolve("notes.v2_remediated.pdf"),
                PdfWriteSession.resolveOutputPath(source, tempDir));
        Path explicit = tempDir.resolve("elsewhere.pdf");
        assertEquals(explicit, PdfWriteSession.resolveOutputPath(source, explicit));
    }

    @Test
    void rerunOnOutputChangesNothing() throws Exception {
        PdfWriteSession session = session(RemediationSettings.defaults());
        Path first = testOutputPath("first.pdf");
        session.run(
                PdfWriteRequest.builder(syllabusPdf())
                        .output(first)
                        .metadata("Syllabus", "en")
                        .build());

        PdfWriteResult second =
                session.run(
                        PdfWriteRequest.builder(first)
                                .output(testOutputPath("second.pdf"))
                                .metadata("Syllabus", "en")
                                .build());

        assertTrue(second.success());
        assertTrue(second.changes().isEmpty(), second.changes().toString());
    }

    @Test
    void missingSourceFails() {
        RecordingProcessingListener listener = new RecordingProcessingListener();
        Path missing = tempDir.resolve("missing.pdf");

        PdfWriteResult result =
                PdfWriteSession.builder()
                        .withSettings(RemediationSettings.defaults())
                        .withListener(listener)
                        .build()
                        .run(PdfWriteRequest.builder(missing).build());

        assertFalse(result.success());
        assertEquals(List.of("Source file not found: " + missing), result.errors());
        assertEquals(List.of("error: Source file not found: " + missing), listener.events);
        assertEquals(1, listener.summaries.size());
    }

    @Test
    void outputMayNotOverwriteSource() throws Exception {
        Path source = syllabusPdf();
        byte[] original = Files.readAllBytes(source);

        PdfWriteResult result =
                session(RemediationSettings.defaults())
                        .run(
                                PdfWriteRequest.builder(source)
                                        .output(source)
                                        .metadata("Syllabus", "en")
                                        .build());

        assertFalse(result.success());
        assertTrue(result.errors().get(0).startsWith("Output path must differ from the source"));
        assertArrayEquals(original, Files.readAllBytes(source));
    }

    @Test
    void unreadablePdfFailsWithoutLeavingOutput() throws Exception {
        Path source = testOutputPath("broken.pdf");
        Files.writeString(source, "%PDF-1.7\nthis is not really a PDF\n");
        Path output = testOutputPath("broken_out.pdf");

        PdfWriteResult result =
                session(RemediationSettings.defaults())
                        .run(PdfWriteRequest.builder(source).output(output).build());

        assertFalse(result.success());
        assertTrue(result.errors().get(0).startsWith("Failed to open PDF: "));
        assertFalse(Files.exists(output));
    }

    @Test
    void deferredContentEditsAreReportedNotApplied() throws Exception {
        Path output = testOutputPath();

        PdfWriteResult result =
                session(RemediationSettings.defaults().withDeferTier2(true))
                        .run(
                                PdfWriteRequest.builder(syllabusPdf())
                                        .output(output)
                                        .metadata("Syllabus", "en")
                                        .heading(COURSE_DESCRIPTION)
                                        .colorFix(new ColorFix("#999999", "#000000"))
                                        .colorFix(new ColorFix("#ffffff", "#FFFFFF"))
                                        .build());

        assertTrue(result.success());
        assertEquals(
                List.of("Set PDF title: Syllabus", "Set PDF language: en"), result.changes());
        assertEquals(
                List.of(
                        "Tier 2 heading tags (1 actions) skipped; use external tagger",
                        "Tier 2 contrast fixes (1 actions) skipped; use external tagger"),
                result.warnings());
        try (PdfDocument doc = openForReading(output)) {
            String content =
                    new String(doc.getPage(1).getContentBytes(), StandardCharsets.ISO_8859_1);
            assertFalse(content.contains("BDC"));
            assertTrue(content.contains("0.6 0.6 0.6 rg"));
        }
    }

    @Test
    void rejectedEditsLeaveSessionSuccessful() throws Exception {
        PdfWriteSession session =
                PdfWriteSession.builder()
                        .withSettings(RemediationSettings.defaults())
                        .withRenderer(StubPageRenderer.changedAfterFirstRender())
                        .build();

        PdfWriteResult result =
                session.run(
                        PdfWriteRequest.builder(syllabusPdf())
                                .output(testOutputPath())
                                .heading(COURSE_DESCRIPTION)
                                .build());

        assertTrue(result.success());
        assertEquals(0, result.headingTagsApplied());
        assertEquals(
                List.of("Could not tag heading 'Course Description' on page 1 after 1 attempt(s)"),
                result.warnings());
    }

    @Test
    void contrastFixesAreCountedPerPage() throws Exception {
        PdfWriteResult result =
                session(RemediationSettings.defaults())
                        .run(
                                PdfWriteRequest.builder(syllabusPdf())
                                        .output(testOutputPath())
                                        .colorFix(new ColorFix("#999999", "#000000"))
                                        .build());

        assertTrue(result.success());
        assertEquals(1, result.contrastFixesApplied());
        assertEquals(List.of("Changed color #999999 → #000000 on page 1"), result.changes());
    }

    @Test
    void planNotesBecomeWarnings() throws Exception {
        RecordingProcessingListener listener = new RecordingProcessingListener();

        PdfWriteResult result =
                PdfWriteSession.builder()
                        .withSettings(RemediationSettings.defaults())
                        .withRenderer(StubPageRenderer.unchanged())
                        .withListener(listener)
                        .build()
                        .run(
                                PdfWriteRequest.builder(syllabusPdf())
                                        .output(testOutputPath())
                                        .note("Element 4: unknown type 'chart'")
                                        .build());

        assertTrue(result.success());
        assertEquals(List.of("Element 4: unknown type 'chart'"), result.warnings());
        assertTrue(listener.events.contains("warning: Element 4: unknown type 'chart'"));
        assertEquals(List.of("Preparing working copy"), listener.phases());
    }
}
