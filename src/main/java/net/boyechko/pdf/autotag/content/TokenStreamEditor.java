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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Locates, wraps and rewrites operations within a tokenized content stream. */
public final class TokenStreamEditor {
    private static final Logger logger = LoggerFactory.getLogger(TokenStreamEditor.class);

    private static final Set<String> COLOR_OPERATORS = Set.of("rg", "RG", "scn", "SCN");
    private static final Pattern MCID_ENTRY = Pattern.compile("/MCID\\s+(\\d+)");

    private TokenStreamEditor() {}

    // ── Text location ───────────────────────────────────────────────

    /**
     * Finds every Tj or TJ operation whose string operand contains {@code target}, ignoring case.
     * The operand must be the nearest non-whitespace token before the operator. Each span runs
     * from the operand to the operator.
     */
    public static List<TextSpan> locateText(List<Token> tokens, String target) {
        String needle = target.toLowerCase(Locale.ROOT);
        List<TextSpan> matches = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            boolean showText = token.isOperator("Tj");
            boolean showArray = token.isOperator("TJ");
            if (!showText && !showArray) {
                continue;
            }

            int operand = previousNonWhitespace(tokens, i);
            if (operand < 0) {
                continue;
            }
            Token operandToken = tokens.get(operand);
            String text;
            if (showText && operandToken.kind().isString()) {
                text = PdfStrings.decode(operandToken.value());
            } else if (showArray && operandToken.kind() == TokenKind.ARRAY) {
                text = PdfStrings.decodeArray(operandToken.value());
            } else {
                continue;
            }

            if (text.toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(new TextSpan(operand, i));
            }
        }
        return matches;
    }

    /**
     * Finds the run of consecutive {@code BT ... ET} blocks positioned inside a box given in PDF
     * user space as {x0, y0, x1, y1}. A block's position comes from its Tm translations, or when
     * it has no Tm, from the sum of its Td/TD offsets. Returns the span from the first matching
     * BT to the last matching ET, or null if no block matches.
     */
    public static TextSpan locateTextBlocks(List<Token> tokens, double[] box, double tolerance) {
        int firstStart = -1;
        int lastEnd = -1;

        int blockStart = -1;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOperator("BT")) {
                blockStart = i;
            } else if (token.isOperator("ET") && blockStart >= 0) {
                boolean inside = blockInsideBox(tokens, blockStart, i, box, tolerance);
                if (inside) {
                    if (firstStart < 0) {
                        firstStart = blockStart;
                    }
                    lastEnd = i;
                } else if (firstStart >= 0) {
                    break;
                }
                blockStart = -1;
            }
        }
        return firstStart >= 0 ? new TextSpan(firstStart, lastEnd) : null;
    }

    private static boolean blockInsideBox(
            List<Token> tokens, int start, int end, double[] box, double tolerance) {
        boolean sawTm = false;
        double x = 0;
        double y = 0;
        boolean sawTd = false;

        for (int i = start + 1; i < end; i++) {
            Token token = tokens.get(i);
            if (token.isOperator("Tm")) {
                double[] m = numericOperands(tokens, i, 6);
                if (m == null) {
                    continue;
                }
                sawTm = true;
                if (insideBox(m[4], m[5], box, tolerance)) {
                    return true;
                }
            } else if (token.isOperator("Td") || token.isOperator("TD")) {
                double[] offset = numericOperands(tokens, i, 2);
                if (offset != null) {
                    x += offset[0];
                    y += offset[1];
                    sawTd = true;
                }
            }
        }
        return !sawTm && sawTd && insideBox(x, y, box, tolerance);
    }

    private static boolean insideBox(double x, double y, double[] box, double tolerance) {
        return x >= box[0] - tolerance
                && x <= box[2] + tolerance
                && y >= box[1] - tolerance
                && y <= box[3] + tolerance;
    }

    // ── Marked content ──────────────────────────────────────────────

    /**
     * Returns a new token list with {@code /Tag <</MCID n>> BDC} before the span and {@code EMC}
     * after it. The input list is not modified.
     */
    public static List<Token> injectMarkedContent(
            List<Token> tokens, TextSpan span, String tag, int mcid) {
        if (span.end() >= tokens.size()) {
            throw new IllegalArgumentException(
                    "Span " + span + " outside token list of size " + tokens.size());
        }
        List<Token> result = new ArrayList<>(tokens.size() + 9);
        result.addAll(tokens.subList(0, span.start()));
        result.add(Token.name("/" + tag));
        result.add(Token.whitespace(" "));
        result.add(Token.dict("<</MCID " + mcid + ">>"));
        result.add(Token.whitespace(" "));
        result.add(Token.operator("BDC"));
        result.add(Token.whitespace("\n"));
        result.addAll(tokens.subList(span.start(), span.end() + 1));
        result.add(Token.whitespace("\n"));
        result.add(Token.operator("EMC"));
        result.add(Token.whitespace("\n"));
        result.addAll(tokens.subList(span.end() + 1, tokens.size()));
        return result;
    }

    /**
     * Returns the largest MCID given in an inline property list of a BDC operation, or -1 if the
     * stream has none. Property lists named through the page resources are not followed.
     */
    public static int highestMcid(List<Token> tokens) {
        int highest = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).isOperator("BDC")) {
                continue;
            }
            int operand = previousNonWhitespace(tokens, i);
            if (operand < 0 || tokens.get(operand).kind() != TokenKind.DICT) {
                continue;
            }
            Matcher m = MCID_ENTRY.matcher(tokens.get(operand).value());
            if (m.find()) {
                try {
                    highest = Math.max(highest, Integer.parseInt(m.group(1)));
                } catch (NumberFormatException e) {
                    logger.debug("Ignoring out-of-range MCID {}", m.group(1));
                }
            }
        }
        return highest;
    }

    // ── Color substitution ──────────────────────────────────────────

    /**
     * Rewrites, in place, the three numeric operands of every rg/RG/scn/SCN operation whose color
     * matches {@code original} within {@code tolerance}. Operations with fewer than three numeric
     * operands are left alone.
     *
     * @return the number of operations rewritten
     */
    public static int replaceColor(
            List<Token> tokens, RgbColor original, RgbColor replacement, double tolerance) {
        int replaced = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.kind() != TokenKind.OPERATOR || !COLOR_OPERATORS.contains(token.value())) {
                continue;
            }

            int[] operands = numericOperandIndices(tokens, i, 3);
            if (operands == null) {
                continue;
            }
            double[] rgb = parseAll(tokens, operands);
            if (rgb == null || !original.matches(rgb[0], rgb[1], rgb[2], tolerance)) {
                continue;
            }

            tokens.set(operands[0], Token.number(RgbColor.formatChannel(replacement.r())));
            tokens.set(operands[1], Token.number(RgbColor.formatChannel(replacement.g())));
            tokens.set(operands[2], Token.number(RgbColor.formatChannel(replacement.b())));
            replaced++;
        }
        if (replaced > 0) {
            logger.debug("Rewrote {} color operation(s) matching {}", replaced, original);
        }
        return replaced;
    }

    // ── Operand helpers ─────────────────────────────────────────────

    private static int previousNonWhitespace(List<Token> tokens, int index) {
        for (int j = index - 1; j >= 0; j--) {
            if (!tokens.get(j).isWhitespace()) {
                return j;
            }
        }
        return -1;
    }

    /**
     * Returns the indices, in stream order, of exactly {@code count} numbers preceding the
     * operator at {@code opIndex}, skipping whitespace. Returns null when a non-number comes
     * first.
     */
    static int[] numericOperandIndices(List<Token> tokens, int opIndex, int count) {
        int[] indices = new int[count];
        int found = 0;
        int j = opIndex - 1;
        while (j >= 0 && found < count) {
            Token token = tokens.get(j);
            if (token.isWhitespace()) {
                j--;
                continue;
            }
            if (token.kind() != TokenKind.NUMBER) {
                break;
            }
            indices[count - 1 - found] = j;
            found++;
            j--;
        }
        return found == count ? indices : null;
    }

    private static double[] numericOperands(List<Token> tokens, int opIndex, int count) {
        int[] indices = numericOperandIndices(tokens, opIndex, count);
        return indices == null ? null : parseAll(tokens, indices);
    }

    private static double[] parseAll(List<Token> tokens, int[] indices) {
        double[] values = new double[indices.length];
        try {
            for (int k = 0; k < indices.length; k++) {
                values[k] = Double.parseDouble(tokens.get(indices[k]).value());
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return values;
    }
}
