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
package net.boyechko.pdf.autotag.fixes;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.layout.element.Paragraph;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.autotag.PdfTestBase;
import org.junit.jupiter.api.Test;

class StructTreeStripperTest extends PdfTestBase {

    @Test
    void removesStructureTreeAndMarkInfo() throws Exception {
        Path tagged =
                createTaggedPdf(
                        testOutputPath("tagged.pdf"),
                        (pdfDoc, document) -> {
                            document.add(new Paragraph("Syllabus"));
                            document.add(new Paragraph("Course Description"));
                        });
        Path out = testOutputPath();

        assertTrue(StructTreeStripper.strip(tagged, out));

        try (PdfDocument doc = openForReading(out)) {
            PdfDictionary catalog = doc.getCatalog().getPdfObject();
            assertNull(catalog.get(PdfName.StructTreeRoot));
            assertNull(catalog.get(PdfName.MarkInfo));
            assertEquals(1, doc.getNumberOfPages());
        }
        try (PdfDocument doc = openForReading(tagged)) {
            assertNotNull(doc.getCatalog().getPdfObject().get(PdfName.StructTreeRoot));
        }
    }

    @Test
    void untaggedInputIsCopied() throws Exception {
        Path plain = createUntaggedPdf(testOutputPath("plain.pdf"), textAt("Hello", 72, 700));
        Path out = testOutputPath();

        assertTrue(StructTreeStripper.strip(plain, out));
        assertTrue(Files.size(out) > 0);
    }

    @Test
    void unreadableInputReportsFailure() throws Exception {
        Path bogus = testOutputPath("bogus.pdf");
        Files.writeString(bogus, "not a pdf");

        assertFalse(StructTreeStripper.strip(bogus, testOutputPath()));
        assertFalse(StructTreeStripper.strip(testOutputPath("missing.pdf"), testOutputPath()));
    }
}
