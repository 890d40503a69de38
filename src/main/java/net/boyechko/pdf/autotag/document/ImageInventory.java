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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the image XObjects of a document in page order, giving them the ids {@code img_0}, {@code
 * img_1}, ... Images inside form XObjects are included. An image drawn on several pages is listed
 * once, on the first page that uses it.
 */
public final class ImageInventory {
    private static final Logger logger = LoggerFactory.getLogger(ImageInventory.class);

    private static final int MAX_FORM_DEPTH = 8;
    private static final int MAX_PAGE_TREE_DEPTH = 32;

    private ImageInventory() {}

    public static List<ImageInfo> scan(PdfDocument doc) {
        List<ImageInfo> images = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int pageNum = 1; pageNum <= doc.getNumberOfPages(); pageNum++) {
            PdfDictionary resources = resourcesOf(doc.getPage(pageNum).getPdfObject());
            collect(resources, pageNum - 1, images, seen, new HashSet<>(), 0);
        }
        logger.debug("Found {} image(s)", images.size());
        return images;
    }

    /** Page resources, inherited from the page tree when the page has none of its own. */
    private static PdfDictionary resourcesOf(PdfDictionary pageDict) {
        PdfDictionary node = pageDict;
        for (int i = 0; node != null && i < MAX_PAGE_TREE_DEPTH; i++) {
            PdfDictionary resources = node.getAsDictionary(PdfName.Resources);
            if (resources != null) {
                return resources;
            }
            node = node.getAsDictionary(PdfName.Parent);
        }
        return null;
    }

    private static void collect(
            PdfDictionary resources,
            int pageIndex,
            List<ImageInfo> images,
            Set<Integer> seen,
            Set<Integer> visitedForms,
            int depth) {
        if (resources == null || depth > MAX_FORM_DEPTH) {
            return;
        }
        PdfDictionary xobjects = resources.getAsDictionary(PdfName.XObject);
        if (xobjects == null) {
            return;
        }
        for (PdfName name : xobjects.keySet()) {
            if (!(xobjects.get(name) instanceof PdfStream stream)) {
                continue;
            }
            PdfIndirectReference ref = stream.getIndirectReference();
            if (ref == null) {
                continue;
            }
            PdfName subtype = stream.getAsName(PdfName.Subtype);
            if (PdfName.Image.equals(subtype)) {
                if (seen.add(ref.getObjNumber())) {
                    String id = "img_" + images.size();
                    images.add(new ImageInfo(id, ref.getObjNumber(), pageIndex));
                }
            } else if (PdfName.Form.equals(subtype) && visitedForms.add(ref.getObjNumber())) {
                collect(
                        stream.getAsDictionary(PdfName.Resources),
                        pageIndex,
                        images,
                        seen,
                        visitedForms,
                        depth + 1);
            }
        }
    }
}
