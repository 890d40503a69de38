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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.pdf.autotag.content.PdfStrings;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.document.FigureMatcher;
import net.boyechko.pdf.autotag.document.ImageInfo;
import net.boyechko.pdf.autotag.document.StructureTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes alternate descriptions for images. In a tagged document, existing Figure elements are
 * matched to images and updated in place; images left without a figure get a new Figure element
 * appended to the structure root, which is also what happens for every image in an untagged
 * document. A decorative image gets an empty description.
 */
public class AltTextFixer implements PdfFix {
    private static final Logger logger = LoggerFactory.getLogger(AltTextFixer.class);
    private static final int P_ALT_TEXT = 20;
    private static final int MESSAGE_TEXT_LENGTH = 60;

    private final Map<String, ImageInfo> images = new LinkedHashMap<>();
    private final Map<String, String> altTexts;
    private final Set<String> decorativeIds;

    public AltTextFixer(
            List<ImageInfo> images, Map<String, String> altTexts, Set<String> decorativeIds) {
        for (ImageInfo image : images) {
            this.images.putIfAbsent(image.id(), image);
        }
        this.altTexts = altTexts;
        this.decorativeIds = decorativeIds;
    }

    @Override
    public int priority() {
        return P_ALT_TEXT;
    }

    @Override
    public void apply(WriteContext ctx) {
        Set<String> wanted = new LinkedHashSet<>(altTexts.keySet());
        wanted.addAll(decorativeIds);
        if (wanted.isEmpty()) {
            return;
        }

        PdfDocument doc = ctx.doc();
        if (!StructureTree.isTagged(doc)) {
            createFigures(ctx, wanted);
            return;
        }

        Set<String> handled = updateExistingFigures(ctx, wanted);
        Set<String> unhandled = new TreeSet<>(wanted);
        unhandled.removeAll(handled);
        if (!unhandled.isEmpty()) {
            ctx.warn(
                    "Could not find struct elements for images: "
                            + String.join(", ", unhandled));
            Set<String> fallback = new LinkedHashSet<>(wanted);
            fallback.retainAll(unhandled);
            createFigures(ctx, fallback);
        }
    }

    private Set<String> updateExistingFigures(WriteContext ctx, Set<String> wanted) {
        PdfDocument doc = ctx.doc();
        PdfDictionary root = StructureTree.catalogRoot(doc);
        List<PdfDictionary> figures =
                StructureTree.findElementsByType(
                        root, PdfName.Figure, ctx.settings().structSearchDepth());
        logger.debug("Found {} existing Figure element(s)", figures.size());

        List<ImageInfo> candidates = new ArrayList<>();
        for (String id : wanted) {
            ImageInfo image = images.get(id);
            if (image != null) {
                candidates.add(image);
            }
        }
        FigureMatcher matcher = new FigureMatcher(doc, candidates);

        Set<String> handled = new LinkedHashSet<>();
        for (PdfDictionary figure : figures) {
            Optional<ImageInfo> match = matcher.match(figure);
            if (match.isEmpty()) {
                continue;
            }
            String id = match.get().id();
            int figureNum = StructureTree.objNumber(figure);
            if (decorativeIds.contains(id)) {
                setAlt(figure, "");
                ctx.change("Marked " + id + " as decorative (xref " + figureNum + ")");
            } else {
                String alt = altTexts.get(id);
                setAlt(figure, alt);
                ctx.change(
                        "Set alt text on "
                                + id
                                + " (xref "
                                + figureNum
                                + "): "
                                + FixMessages.head(alt, MESSAGE_TEXT_LENGTH));
            }
            handled.add(id);
        }
        return handled;
    }

    private void createFigures(WriteContext ctx, Set<String> ids) {
        PdfDocument doc = ctx.doc();
        PdfDictionary root = StructureTree.ensureStructTree(doc);

        for (String id : ids) {
            ImageInfo image = images.get(id);
            if (image == null) {
                ctx.warn("Failed to create /Figure for " + id + ": unknown image");
                continue;
            }
            boolean decorative = decorativeIds.contains(id);
            String alt = decorative ? "" : altTexts.getOrDefault(id, "");
            try {
                addFigure(doc, root, image, alt);
            } catch (RuntimeException e) {
                logger.debug("Figure creation for {} failed", id, e);
                ctx.warn("Failed to create /Figure for " + id + ": " + e.getMessage());
                continue;
            }
            if (decorative) {
                ctx.change("Created /Figure for " + id + " (decorative)");
            } else {
                ctx.change(
                        "Created /Figure for "
                                + id
                                + " with alt: "
                                + FixMessages.head(alt, MESSAGE_TEXT_LENGTH));
            }
        }
    }

    /** Appends {@code <</Type/StructElem /S/Figure /P root /Alt ... /A11yXref n /Pg page>>}. */
    static PdfDictionary addFigure(
            PdfDocument doc, PdfDictionary root, ImageInfo image, String alt) {
        PdfStructElem figure = new PdfStructElem(doc, PdfName.Figure);
        PdfDictionary dict = figure.getPdfObject();
        dict.put(PdfName.P, root);
        dict.put(PdfName.Alt, PdfStrings.encode(alt));
        if (image.hasXref()) {
            dict.put(StructureTree.A11Y_XREF, new PdfNumber(image.xref()));
        }
        Integer pageIndex = image.pageIndex();
        if (pageIndex != null && pageIndex >= 0 && pageIndex < doc.getNumberOfPages()) {
            dict.put(PdfName.Pg, doc.getPage(pageIndex + 1).getPdfObject());
        }
        dict.setModified();
        StructureTree.appendKid(root, dict);
        return dict;
    }

    private static void setAlt(PdfDictionary figure, String alt) {
        figure.put(PdfName.Alt, PdfStrings.encode(alt == null ? "" : alt));
        figure.setModified();
    }

    @Override
    public String describe() {
        return "Alt text";
    }
}
