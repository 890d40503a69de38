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
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an edit to a page is visually acceptable by comparing renders taken before and
 * after it. Read-only with respect to the document.
 */
public class VisualVerifier {
    private static final Logger logger = LoggerFactory.getLogger(VisualVerifier.class);

    private final PageRenderer renderer;
    private final BaseDocument base;
    private final int dpi;
    private final int channelThreshold;

    public VisualVerifier(
            PageRenderer renderer, BaseDocument base, int dpi, int channelThreshold) {
        this.renderer = renderer;
        this.base = base;
        this.dpi = dpi;
        this.channelThreshold = channelThreshold;
    }

    /** Renders the baseline that later attempts are compared against. */
    public BufferedImage snapshot(PdfPage page) throws IOException {
        return renderer.render(base, page, dpi);
    }

    /**
     * Renders the page in its current state and returns its percentage difference from {@code
     * baseline}. A render failure counts as 100% different.
     */
    public double diffAgainst(BufferedImage baseline, PdfPage page) {
        BufferedImage current;
        try {
            current = renderer.render(base, page, dpi);
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not render edited page, treating as changed: {}", e.getMessage());
            return 100.0;
        }
        double diff = PixelDiff.percentDifferent(baseline, current, channelThreshold);
        logger.debug("Pixel diff against baseline: {}%", String.format("%.3f", diff));
        return diff;
    }
}
