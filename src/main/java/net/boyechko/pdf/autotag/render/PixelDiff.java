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

import java.awt.image.BufferedImage;

/** Pixel-level comparison of two renders. */
public final class PixelDiff {
    private PixelDiff() {}

    /**
     * Returns the percentage of pixels where any of the R, G or B channels differs by more than
     * {@code threshold} (0..255). Images of different size count as 100% different.
     */
    public static double percentDifferent(BufferedImage a, BufferedImage b, int threshold) {
        if (a.getWidth() != b.getWidth() || a.getHeight() != b.getHeight()) {
            return 100.0;
        }
        long total = (long) a.getWidth() * a.getHeight();
        if (total == 0) {
            return 0.0;
        }

        long differing = 0;
        for (int y = 0; y < a.getHeight(); y++) {
            for (int x = 0; x < a.getWidth(); x++) {
                if (pixelDiffers(a.getRGB(x, y), b.getRGB(x, y), threshold)) {
                    differing++;
                }
            }
        }
        return differing * 100.0 / total;
    }

    private static boolean pixelDiffers(int p, int q, int threshold) {
        for (int shift = 16; shift >= 0; shift -= 8) {
            int c1 = (p >> shift) & 0xFF;
            int c2 = (q >> shift) & 0xFF;
            if (Math.abs(c1 - c2) > threshold) {
                return true;
            }
        }
        return false;
    }
}
