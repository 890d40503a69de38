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
package net.boyechko.pdf.autotag.document;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfWriter;
import java.io.ByteArrayOutputStream;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FigureMatcherTest {
    private PdfDocument doc;
    private PdfDictionary imageA;
    private PdfDictionary imageB;

    @BeforeEach
    void openScratchDocument() {
        doc = new PdfDocument(new PdfWriter(new ByteArrayOutputStream()));
        doc.addNewPage();
        doc.addNewPage();
        imageA = (PdfDictionary) new PdfDictionary().makeIndirect(doc);
        imageB = (PdfDictionary) new PdfDictionary().makeIndirect(doc);
    }

    @AfterEach
    void closeScratchDocument() {
        doc.close();
    }

    private ImageInfo image(String id, PdfDictionary standIn, int page) {
        return new ImageInfo(id, StructureTree.objNumber(standIn), page);
    }

    private FigureMatcher matcherFor(ImageInfo... images) {
        return new FigureMatcher(doc, List.of(images));
    }

    private PdfDictionary figureOnPage(int pageIndex) {
        PdfDictionary figure = new PdfDictionary();
        figure.put(PdfName.S, PdfName.Figure);
        figure.put(PdfName.Pg, doc.getPage(pageIndex + 1).getPdfObject());
        return figure;
    }

    private static PdfDictionary withObjectReference(PdfDictionary figure, PdfDictionary target) {
        PdfDictionary objr = new PdfDictionary();
        objr.put(PdfName.Type, PdfName.OBJR);
        objr.put(PdfName.Obj, target);
        PdfArray k = new PdfArray();
        k.add(objr);
        figure.put(PdfName.K, k);
        return figure;
    }

    @Test
    void objectReferenceWinsOverPageOrder() {
        FigureMatcher matcher = matcherFor(image("img_0", imageA, 0), image("img_1", imageB, 0));

        PdfDictionary figure = withObjectReference(figureOnPage(0), imageB);

        assertEquals("img_1", matcher.match(figure).orElseThrow().id());
        assertTrue(matcher.isConsumed("img_1"));
        assertFalse(matcher.isConsumed("img_0"));
    }

    @Test
    void figuresOnPageTakeImagesInOrder() {
        FigureMatcher matcher = matcherFor(image("img_0", imageA, 1), image("img_1", imageB, 1));

        assertEquals("img_0", matcher.match(figureOnPage(1)).orElseThrow().id());
        assertEquals("img_1", matcher.match(figureOnPage(1)).orElseThrow().id());
        assertTrue(matcher.match(figureOnPage(1)).isEmpty());
    }

    @Test
    void consumedImageIsNotGivenTwice() {
        FigureMatcher matcher = matcherFor(image("img_0", imageA, 0), image("img_1", imageB, 0));

        assertEquals(
                "img_1",
                matcher.match(withObjectReference(figureOnPage(0), imageB)).orElseThrow().id());
        assertEquals("img_0", matcher.match(figureOnPage(0)).orElseThrow().id());
        assertTrue(matcher.match(figureOnPage(0)).isEmpty());
        assertTrue(
                matcher.match(withObjectReference(figureOnPage(0), imageB)).isEmpty(),
                "OBJR to a consumed image falls through to an empty page pool");
    }

    @Test
    void figureOnOtherPageDoesNotMatch() {
        FigureMatcher matcher = matcherFor(image("img_0", imageA, 0));

        assertTrue(matcher.match(figureOnPage(1)).isEmpty());
        assertFalse(matcher.isConsumed("img_0"));
    }

    @Test
    void figureWithoutPageOrReferenceDoesNotMatch() {
        FigureMatcher matcher = matcherFor(image("img_0", imageA, 0));
        PdfDictionary figure = new PdfDictionary();
        figure.put(PdfName.S, PdfName.Figure);

        assertTrue(matcher.match(figure).isEmpty());
    }
}
