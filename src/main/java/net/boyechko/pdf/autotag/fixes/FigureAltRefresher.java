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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.boyechko.pdf.autotag.content.PdfStrings;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.document.ImageInfo;
import net.boyechko.pdf.autotag.document.StructureTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Revisits every Figure already in the structure tree and replaces alt text that is missing or
 * looks machine-generated. Figures are matched by their {@code A11yXref} entry, then by page.
 */
public class FigureAltRefresher implements PdfFix {
    private static final Logger logger = LoggerFactory.getLogger(FigureAltRefresher.class);
    private static final int P_REFRESH = 25;
    private static final int GOOD_ALT_MIN_LENGTH = 21;
    private static final List<String> IMAGE_EXTENSIONS =
            List.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".tiff", ".svg");

    private final List<ImageInfo> images;
    private final Map<String, String> altTexts;

    public FigureAltRefresher(List<ImageInfo> images, Map<String, String> altTexts) {
        this.images = images;
        this.altTexts = altTexts;
    }

    @Override
    public int priority() {
        return P_REFRESH;
    }

    @Override
    public void apply(WriteContext ctx) {
        PdfDocument doc = ctx.doc();
        PdfDictionary root = StructureTree.catalogRoot(doc);
        if (altTexts.isEmpty() || root == null) {
            return;
        }

        Map<Integer, ImageInfo> byXref = new HashMap<>();
        Map<Integer, Deque<ImageInfo>> byPage = new HashMap<>();
        for (ImageInfo image : images) {
            if (!altTexts.containsKey(image.id())) {
                continue;
            }
            if (image.hasXref()) {
                byXref.put(image.xref(), image);
            }
            if (image.pageIndex() != null) {
                byPage.computeIfAbsent(image.pageIndex(), p -> new ArrayDeque<>()).add(image);
            }
        }

        List<PdfDictionary> figures =
                StructureTree.findElementsByType(
                        root,
                        PdfName.Figure,
                        ctx.settings().structSearchDepth());

        int updated = 0;
        for (PdfDictionary figure : figures) {
            String current = PdfStrings.text(figure.getAsString(PdfName.Alt));
            if (!needsRefresh(current)) {
                continue;
            }

            PdfNumber breadcrumb = figure.getAsNumber(StructureTree.A11Y_XREF);
            if (breadcrumb != null && byXref.containsKey(breadcrumb.intValue())) {
                ImageInfo image = byXref.get(breadcrumb.intValue());
                setAlt(figure, altTexts.get(image.id()));
                ctx.change(
                        "Updated alt on "
                                + image.id()
                                + " (A11yXref "
                                + breadcrumb.intValue()
                                + ")");
                updated++;
                continue;
            }

            int pageIndex = StructureTree.pageIndexOf(doc, figure);
            Deque<ImageInfo> pool = byPage.get(pageIndex);
            if (pool != null && !pool.isEmpty()) {
                ImageInfo image = pool.pollFirst();
                setAlt(figure, altTexts.get(image.id()));
                ctx.change("Updated alt on " + image.id() + " (page " + pageIndex + ")");
                updated++;
            }
        }
        if (updated > 0) {
            logger.info("Updated alt text on {} existing /Figure element(s)", updated);
        }
    }

    /** True for missing or short alt text, or text that looks like an image filename. */
    static boolean needsRefresh(String alt) {
        if (alt == null || alt.isEmpty()) {
            return true;
        }
        return alt.length() < GOOD_ALT_MIN_LENGTH || isFilenameAlt(alt);
    }

    static boolean isFilenameAlt(String alt) {
        String text = alt.strip();
        String lower = text.toLowerCase(Locale.ROOT);
        for (String extension : IMAGE_EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        if (text.startsWith("Screen Shot ") || text.startsWith("image")) {
            return true;
        }
        return text.length() < 10 && text.contains(".");
    }

    private static void setAlt(PdfDictionary figure, String alt) {
        figure.put(PdfName.Alt, PdfStrings.encode(alt));
        figure.setModified();
    }

    @Override
    public String describe() {
        return "Figure alt refresh";
    }
}
