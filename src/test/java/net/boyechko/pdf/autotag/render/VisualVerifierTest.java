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
import com.itextpdf.kernel.pdf.PdfWriter;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

class VisualVerifierTest {

    /** Returns queued images in order and records the DPI of every call. */
    private static final class QueuedRenderer implements PageRenderer {
        private final Deque<Object> queue = new ArrayDeque<>();
        private final List<Integer> dpis = new ArrayList<>();
        private final List<BaseDocument> bases = new ArrayList<>();

        QueuedRenderer then(Object imageOrException) {
            queue.add(imageOrException);
            return this;
        }

        @Override
        public BufferedImage render(BaseDocument base, PdfPage page, int dpi)
                throws IOException {
            dpis.add(dpi);
            bases.add(base);
            Object next = queue.removeFirst();
            if (next instanceof IOException e) {
                throw e;
            }
            if (next instanceof RuntimeException e) {
                throw e;
            }
            return (BufferedImage) next;
        }
    }

    private static final BaseDocument SAVED = new BaseDocument(new byte[] {'%'}, null);

    private static BufferedImage blank(int rgb) {
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    private static PdfPage anyPage(PdfDocument doc) {
        return doc.addNewPage();
    }

    @Test
    void comparesCurrentRenderWithBaseline() throws Exception {
        QueuedRenderer renderer = new QueuedRenderer().then(blank(0xFFFFFF)).then(blank(0x000000));
        VisualVerifier verifier = new VisualVerifier(renderer, SAVED, 72, 5);

        try (PdfDocument doc = new PdfDocument(new PdfWriter(new ByteArrayOutputStream()))) {
            PdfPage page = anyPage(doc);
            BufferedImage baseline = verifier.snapshot(page);

            assertEquals(100.0, verifier.diffAgainst(baseline, page));
        }
        assertEquals(List.of(72, 72), renderer.dpis);
        assertEquals(List.of(SAVED, SAVED), renderer.bases);
    }

    @Test
    void failedRenderCountsAsFullyChanged() throws Exception {
        QueuedRenderer renderer =
                new QueuedRenderer()
                        .then(blank(0xFFFFFF))
                        .then(new IOException("broken font"))
                        .then(blank(0xFFFFFF))
                        .then(new IllegalStateException("bad operator"));
        VisualVerifier verifier = new VisualVerifier(renderer, SAVED, 72, 5);

        try (PdfDocument doc = new PdfDocument(new PdfWriter(new ByteArrayOutputStream()))) {
            PdfPage page = anyPage(doc);

            assertEquals(100.0, verifier.diffAgainst(verifier.snapshot(page), page));
            assertEquals(100.0, verifier.diffAgainst(verifier.snapshot(page), page));
        }
    }

    @Test
    void snapshotFailurePropagates() throws Exception {
        QueuedRenderer renderer = new QueuedRenderer().then(new IOException("unreadable"));
        VisualVerifier verifier = new VisualVerifier(renderer, SAVED, 150, 5);

        try (PdfDocument doc = new PdfDocument(new PdfWriter(new ByteArrayOutputStream()))) {
            PdfPage page = anyPage(doc);
            assertThrows(IOException.class, () -> verifier.snapshot(page));
        }
        assertEquals(List.of(150), renderer.dpis);
    }
}
