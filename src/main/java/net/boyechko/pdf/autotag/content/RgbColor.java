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
package net.boyechko.pdf.autotag.content;

import java.util.Locale;

/** An RGB color with channels in the 0..1 range used by content-stream color operators. */
public record RgbColor(double r, double g, double b) {

    /**
     * Parses {@code #RRGGBB}, dividing each channel by 255.
     *
     * @throws IllegalArgumentException if the value is not a '#' followed by six hex digits
     */
    public static RgbColor fromHex(String hex) {
        if (hex == null || !hex.startsWith("#") || hex.length() != 7) {
            throw new IllegalArgumentException("Not a #RRGGBB color: " + hex);
        }
        try {
            int r = Integer.parseInt(hex.substring(1, 3), 16);
            int g = Integer.parseInt(hex.substring(3, 5), 16);
            int b = Integer.parseInt(hex.substring(5, 7), 16);
            return new RgbColor(r / 255.0, g / 255.0, b / 255.0);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a #RRGGBB color: " + hex, e);
        }
    }

    /** True when each channel differs from the given channel value by less than the tolerance. */
    public boolean matches(double r, double g, double b, double tolerance) {
        return Math.abs(this.r - r) < tolerance
                && Math.abs(this.g - g) < tolerance
                && Math.abs(this.b - b) < tolerance;
    }

    /** Formats a channel the way color operands are written back: four decimal places. */
    public static String formatChannel(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
