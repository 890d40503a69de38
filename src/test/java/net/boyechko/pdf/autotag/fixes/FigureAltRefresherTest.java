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

import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import java.awt.Color;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autotag.PdfTestBase;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.document.ImageInfo;
import net.boyechko.pdf.autotag.document.ImageInventory;
import net.boyechko.pdf.autotag.document.StructureTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class FigureAltRefresherTest extends PdfTestBase {
    private static final String GOOD_ALT = "Bar chart of enrollment by semester";

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(
            strings = {
                "Logo",
                "photo.jpg",
                "Screen Shot 2024-01-05 at 10.15.32 AM",
                "image_from_course_site_001",
                "diagram_of_the_lecture_hall.PNG"
            })
    void weakAltNeedsRefresh(String alt) {
        assertTrue(FigureAltRefresher.needsRefresh(alt));
    }

    @ParameterizedTest
    @ValueSource(strings = {GOOD_ALT, "Portrait of the course instructor outdoors"})
    void descriptiveAltIsKept(String alt) {
        assertFalse(FigureAltRefresher.needsRefresh(alt));
    }

    @Test
    void recognizesFilenameLikeAlt() {
        assertTrue(FigureAltRefresher.isFilenameAlt(" scan.TIFF "));
        assertTrue(FigureAltRefresher.isFilenameAlt("fig.3"));
        assertFalse(FigureAltRefresher.isFilenameAlt("Fig. 3 shows the campus map in detail"));
    }

    private Path imagePdf() throws Exception {
        return createUntaggedPdf(
                testOutputPath("image.pdf"),
                (pdfDoc, canvas, font) ->
                        drawImage(pdfDoc, canvas, Color.RED, new Rectangle(72, 600, 50, 50)));
    }

    @Test
    void replacesAltFoundByXrefBreadcrumb() throws Exception {
        try (PdfDocument doc = openForEditing(imagePdf(), testOutputPath())) {
            List<ImageInfo> images = ImageInventory.scan(doc);
            ImageInfo image = images.get(0);
            PdfDictionary root = StructureTree.ensureStructTree(doc);
            PdfDictionary figure = AltTextFixer.addFigure(doc, root, image, "");
            WriteContext ctx = contextFor(doc);

            new FigureAltRefresher(images, Map.of("img_0", GOOD_ALT)).apply(ctx);

            assertEquals(
                    List.of("Updated alt on img_0 (A11yXref " + image.xref() + ")"),
                    ctx.result().build(true).changes());
            assertEquals(GOOD_ALT, figure.getAsString(PdfName.Alt).toUnicodeString());
        }
    }

    @Test
    void replacesAltFoundByPage() throws Exception {
        try (PdfDocument doc = openForEditing(imagePdf(), testOutputPath())) {
            PdfDictionary root = StructureTree.ensureStructTree(doc);
            PdfDictionary figure =
                    AltTextFixer.addFigure(doc, root, new ImageInfo("x", null, 0), "IMG_2041.jpg");
            WriteContext ctx = contextFor(doc);

            new FigureAltRefresher(ImageInventory.scan(doc), Map.of("img_0", GOOD_ALT))
                    .apply(ctx);

            assertEquals(
                    List.of("Updated alt on img_0 (page 0)"), ctx.result().build(true).changes());
            assertEquals(GOOD_ALT, figure.getAsString(PdfName.Alt).toUnicodeString());
        }
    }

    @Test
    void leavesDescriptiveAltAlone() throws Exception {
        try (PdfDocument doc = openForEditing(imagePdf(), testOutputPath())) {
            PdfDictionary root = StructureTree.ensureStructTree(doc);
            String existing = "Photograph of students in the chemistry lab";
            PdfDictionary figure =
                    AltTextFixer.addFigure(doc, root, new ImageInfo("x", null, 0), existing);
            WriteContext ctx = contextFor(doc);

            new FigureAltRefresher(ImageInventory.scan(doc), Map.of("img_0", GOOD_ALT))
                    .apply(ctx);

            assertTrue(ctx.result().build(true).changes().isEmpty());
            assertEquals(existing, figure.getAsString(PdfName.Alt).toUnicodeString());
        }
    }

    @Test
    void untaggedDocumentIsSkipped() throws Exception {
        try (PdfDocument doc = openForEditing(imagePdf(), testOutputPath())) {
            WriteContext ctx = contextFor(doc);

            new FigureAltRefresher(ImageInventory.scan(doc), Map.of("img_0", GOOD_ALT))
                    .apply(ctx);

            assertTrue(ctx.result().build(true).changes().isEmpty());
            assertFalse(StructureTree.isTagged(doc));
        }
    }
}
