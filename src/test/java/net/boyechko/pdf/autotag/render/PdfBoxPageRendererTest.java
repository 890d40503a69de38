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
package net.boyechko.pdf.autotag.render;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import net.boyechko.pdf.autotag.PdfTestBase;
import net.boyechko.pdf.autotag.document.PdfCustodian;
import org.junit.jupiter.api.Test;

class PdfBoxPageRendererTest extends PdfTestBase {

    private static void blackOut(PdfPage page) {
        PdfStream stream = page.getContentStream(0);
        String content = new String(stream.getBytes(), StandardCharsets.ISO_8859_1);
        String blackedOut = "0 0 0 rg 0 0 612 792 re f\n" + content;
        stream.setData(blackedOut.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void rendersLetterPageAtRequestedDpi() throws Exception {
        Path pdf = createUntaggedPdf(testOutputPath(), textAt("Syllabus", 72, 700));

        try (PdfDocument doc = openForReading(pdf)) {
            BufferedImage image =
                    new PdfBoxPageRenderer()
                            .render(BaseDocument.read(pdf, null), doc.getPage(1), 72);

            assertEquals(612, image.getWidth());
            assertEquals(792, image.getHeight());
        }
    }

    @Test
    void rendersInMemoryEdits() throws Exception {
        Path pdf = createUntaggedPdf(testOutputPath(), textAt("Syllabus", 72, 700));
        BaseDocument base = BaseDocument.read(pdf, null);
        PdfBoxPageRenderer renderer = new PdfBoxPageRenderer();

        try (PdfDocument doc = openForEditing(pdf, testOutputPath("edited.pdf"))) {
            PdfPage page = doc.getPage(1);
            BufferedImage before = renderer.render(base, page, 72);

            blackOut(page);
            BufferedImage after = renderer.render(base, page, 72);

            assertTrue(PixelDiff.percentDifferent(before, after, 5) > 90.0);
        }
    }

    @Test
    void rendersPagesOfDocumentOpenForIncrementalUpdate() throws Exception {
        Path pdf =
                createUntaggedPdf(
                        testOutputPath(),
                        textAt("Syllabus", 72, 700),
                        textAt("Week 1", 72, 700));
        BaseDocument base = BaseDocument.read(pdf, null);
        PdfBoxPageRenderer renderer = new PdfBoxPageRenderer();

        ByteArrayOutputStream revision = new ByteArrayOutputStream();
        try (PdfDocument doc = new PdfCustodian(pdf).openForIncrementalUpdate(revision)) {
            PdfPage second = doc.getPage(2);
            BufferedImage before = renderer.render(base, second, 72);

            blackOut(second);
            BufferedImage after = renderer.render(base, second, 72);
            BufferedImage first = renderer.render(base, doc.getPage(1), 72);

            assertEquals(612, before.getWidth());
            assertTrue(PixelDiff.percentDifferent(before, after, 5) > 90.0);
            assertTrue(PixelDiff.percentDifferent(before, first, 5) < 5.0);
        }
    }

    @Test
    void renderingLeavesPageUntouched() throws Exception {
        Path pdf = createUntaggedPdf(testOutputPath(), textAt("Syllabus", 72, 700));
        BaseDocument base = BaseDocument.read(pdf, null);
        PdfBoxPageRenderer renderer = new PdfBoxPageRenderer();

        try (PdfDocument doc = openForEditing(pdf, testOutputPath("rendered.pdf"))) {
            PdfPage page = doc.getPage(1);
            byte[] before = page.getContentBytes();

            BufferedImage first = renderer.render(base, page, 72);
            BufferedImage second = renderer.render(base, page, 72);

            assertArrayEquals(before, page.getContentBytes());
            assertEquals(0.0, PixelDiff.percentDifferent(first, second, 5));
        }
    }
}
