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

import com.itextpdf.kernel.pdf.PdfPage;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders with PDFBox. The saved document is loaded fresh for every render and the page's content
 * streams are replaced with the decoded bytes iText currently holds for them. Nothing is copied
 * out of the iText document, which may be open for writing.
 */
public class PdfBoxPageRenderer implements PageRenderer {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxPageRenderer.class);

    @Override
    public BufferedImage render(BaseDocument base, PdfPage page, int dpi) throws IOException {
        int pageIndex = page.getDocument().getPageNumber(page) - 1;
        if (pageIndex < 0) {
            throw new IOException("Page is not part of its document");
        }

        try (PDDocument document = load(base)) {
            if (pageIndex >= document.getNumberOfPages()) {
                throw new IOException(
                        "Page " + (pageIndex + 1) + " is missing from the saved document");
            }
            PDPage target = document.getPage(pageIndex);
            target.setContents(currentContents(document, page));

            PDFRenderer renderer = new PDFRenderer(document);
            BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
            logger.debug(
                    "Rendered page {} at {} DPI: {}x{}",
                    pageIndex + 1,
                    dpi,
                    image.getWidth(),
                    image.getHeight());
            return image;
        }
    }

    private static PDDocument load(BaseDocument base) throws IOException {
        if (base.password() == null) {
            return Loader.loadPDF(base.bytes());
        }
        return Loader.loadPDF(base.bytes(), base.password());
    }

    private static List<PDStream> currentContents(PDDocument document, PdfPage page)
            throws IOException {
        List<PDStream> streams = new ArrayList<>();
        for (int i = 0; i < page.getContentStreamCount(); i++) {
            byte[] data = page.getContentStream(i).getBytes();
            streams.add(new PDStream(document, new ByteArrayInputStream(data)));
        }
        return streams;
    }
}
