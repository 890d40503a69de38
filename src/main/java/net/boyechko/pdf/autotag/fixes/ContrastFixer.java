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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import net.boyechko.pdf.autotag.content.ContentTokenizer;
import net.boyechko.pdf.autotag.content.RgbColor;
import net.boyechko.pdf.autotag.content.Token;
import net.boyechko.pdf.autotag.content.TokenStreamEditor;
import net.boyechko.pdf.autotag.core.RevertFailedException;
import net.boyechko.pdf.autotag.core.WriteContext;
import net.boyechko.pdf.autotag.plan.ColorFix;
import net.boyechko.pdf.autotag.render.VisualVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces low-contrast text colors with their corrected values by rewriting the operands of
 * rg/RG/scn/SCN operations. All substitutions on a page are verified together: when the page
 * changes by more than {@code contrastDiffTolerance}, every edit on that page is undone.
 */
public class ContrastFixer implements PdfFix {
    private static final Logger logger = LoggerFactory.getLogger(ContrastFixer.class);
    private static final int P_CONTRAST = 60;

    private final List<ColorFix> fixes;

    public ContrastFixer(List<ColorFix> fixes) {
        this.fixes = fixes;
    }

    @Override
    public int priority() {
        return P_CONTRAST;
    }

    @Override
    public boolean editsContent() {
        return true;
    }

    private record Substitution(ColorFix fix, RgbColor original, RgbColor replacement) {}

    @Override
    public void apply(WriteContext ctx) {
        List<Substitution> substitutions = new ArrayList<>();
        for (ColorFix fix : fixes) {
            if (fix.isNoOp()) {
                logger.debug("Dropping no-op color fix {}", fix.originalHex());
                continue;
            }
            try {
                substitutions.add(
                        new Substitution(
                                fix,
                                RgbColor.fromHex(fix.originalHex()),
                                RgbColor.fromHex(fix.fixedHex())));
            } catch (IllegalArgumentException e) {
                ctx.warn("Skipped color fix: " + e.getMessage());
            }
        }
        if (substitutions.isEmpty()) {
            return;
        }

        PdfDocument doc = ctx.doc();
        for (int pageNum = 1; pageNum <= doc.getNumberOfPages(); pageNum++) {
            applyToPage(ctx, doc.getPage(pageNum), pageNum, substitutions);
        }
    }

    private void applyToPage(
            WriteContext ctx, PdfPage page, int pageNum, List<Substitution> substitutions) {
        List<List<Token>> streams = new ArrayList<>();
        for (int i = 0; i < page.getContentStreamCount(); i++) {
            streams.add(ContentTokenizer.tokenize(page.getContentStream(i).getBytes()));
        }

        List<String> pageChanges = new ArrayList<>();
        TreeSet<Integer> edited = new TreeSet<>();
        double tolerance = ctx.settings().colorTolerance();
        for (Substitution s : substitutions) {
            int replaced = 0;
            for (int i = 0; i < streams.size(); i++) {
                int count =
                        TokenStreamEditor.replaceColor(
                                streams.get(i), s.original(), s.replacement(), tolerance);
                if (count > 0) {
                    edited.add(i);
                    replaced += count;
                }
            }
            if (replaced > 0) {
                pageChanges.add(
                        "Changed color "
                                + s.fix().originalHex()
                                + " → "
                                + s.fix().fixedHex()
                                + " on page "
                                + pageNum);
            }
        }
        if (pageChanges.isEmpty()) {
            return;
        }

        Optional<VisualVerifier> verifier = ctx.verifier();
        BufferedImage baseline = null;
        if (verifier.isPresent()) {
            try {
                baseline = verifier.get().snapshot(page);
            } catch (IOException | RuntimeException e) {
                ctx.warn(
                        "Contrast fixes on page "
                                + pageNum
                                + " skipped: could not render page ("
                                + e.getMessage()
                                + ")");
                return;
            }
        }

        Map<Integer, byte[]> originals = new LinkedHashMap<>();
        for (int i : edited) {
            PdfStream stream = page.getContentStream(i);
            originals.put(i, stream.getBytes());
            stream.setData(ContentTokenizer.join(streams.get(i)));
        }

        double diff = verifier.isPresent() ? verifier.get().diffAgainst(baseline, page) : 0.0;
        if (diff > ctx.settings().contrastDiffTolerance()) {
            restore(page, originals, pageNum);
            logger.warn(
                    "Contrast fix reverted ({}% diff) on page {}",
                    String.format("%.1f", diff),
                    pageNum);
            ctx.warn(
                    "Contrast fixes on page "
                            + pageNum
                            + " reverted: "
                            + String.format("%.1f", diff)
                            + "% of pixels changed");
            return;
        }

        for (int i : edited) {
            page.getContentStream(i).setModified();
        }
        page.getPdfObject().setModified();
        pageChanges.forEach(ctx::change);
        ctx.result().contrastFixesApplied(pageChanges.size());
    }

    private static void restore(PdfPage page, Map<Integer, byte[]> originals, int pageNum) {
        try {
            originals.forEach((i, bytes) -> page.getContentStream(i).setData(bytes));
        } catch (RuntimeException e) {
            throw new RevertFailedException(
                    "Could not restore content streams of page " + pageNum, e);
        }
    }

    @Override
    public String describe() {
        return "Contrast fixes";
    }
}
