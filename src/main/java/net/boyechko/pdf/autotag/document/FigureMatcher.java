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
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs existing Figure elements with known images. An object reference from the figure to the
 * image XObject wins; otherwise the figure takes the next unused image drawn on its page. Each
 * image is handed out at most once per matcher.
 */
public final class FigureMatcher {
    private static final Logger logger = LoggerFactory.getLogger(FigureMatcher.class);

    private final PdfDocument doc;
    private final Map<Integer, ImageInfo> byXref = new HashMap<>();
    private final Map<Integer, Deque<ImageInfo>> byPage = new HashMap<>();
    private final Set<String> consumed = new HashSet<>();

    public FigureMatcher(PdfDocument doc, Collection<ImageInfo> images) {
        this.doc = doc;
        for (ImageInfo image : images) {
            if (image.hasXref()) {
                byXref.putIfAbsent(image.xref(), image);
            }
            if (image.pageIndex() != null) {
                byPage.computeIfAbsent(image.pageIndex(), p -> new ArrayDeque<>()).add(image);
            }
        }
    }

    public Optional<ImageInfo> match(PdfDictionary figure) {
        ImageInfo viaObjRef = matchByObjectReference(figure);
        if (viaObjRef != null) {
            consumed.add(viaObjRef.id());
            logger.debug(
                    "Figure obj #{} matched {} by OBJR",
                    StructureTree.objNumber(figure),
                    viaObjRef.id());
            return Optional.of(viaObjRef);
        }

        ImageInfo viaPage = matchByPage(figure);
        if (viaPage != null) {
            consumed.add(viaPage.id());
            logger.debug(
                    "Figure obj #{} matched {} by page",
                    StructureTree.objNumber(figure),
                    viaPage.id());
            return Optional.of(viaPage);
        }
        return Optional.empty();
    }

    /** Returns whether {@code imageId} has already been given to a figure. */
    boolean isConsumed(String imageId) {
        return consumed.contains(imageId);
    }

    private ImageInfo matchByObjectReference(PdfDictionary figure) {
        for (PdfDictionary kid : StructureTree.kidDictionaries(figure)) {
            if (!PdfName.OBJR.equals(kid.getAsName(PdfName.Type))) {
                continue;
            }
            PdfObject target = kid.get(PdfName.Obj, false);
            if (target == null) {
                continue;
            }
            int targetNum =
                    target.isIndirectReference()
                            ? ((PdfIndirectReference) target).getObjNumber()
                            : StructureTree.objNumber(target);
            ImageInfo image = byXref.get(targetNum);
            if (image != null && !consumed.contains(image.id())) {
                return image;
            }
        }
        return null;
    }

    private ImageInfo matchByPage(PdfDictionary figure) {
        int pageIndex = StructureTree.pageIndexOf(doc, figure);
        if (pageIndex < 0) {
            return null;
        }
        Deque<ImageInfo> pool = byPage.get(pageIndex);
        while (pool != null && !pool.isEmpty()) {
            ImageInfo candidate = pool.pollFirst();
            if (!consumed.contains(candidate.id())) {
                return candidate;
            }
        }
        return null;
    }
}
