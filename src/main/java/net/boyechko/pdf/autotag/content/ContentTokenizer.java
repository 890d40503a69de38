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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Lossless tokenizer for page content streams.
 *
 * <p>Unlike iText's {@code PdfTokenizer}, which drops whitespace and comments, this keeps every
 * byte in some token so that {@link #join(List)} of an unmodified token list returns the input
 * unchanged. Malformed input never fails: anything unrecognized becomes a one-character {@link
 * TokenKind#OTHER} token.
 */
public final class ContentTokenizer {
    private static final String WHITESPACE = " \t\r\n";
    private static final String DELIMITERS = " \t\r\n/<>[]()%{}";
    private static final String NUMBER_START = "0123456789+-.";

    private final String text;
    private final int n;
    private int pos;

    private ContentTokenizer(byte[] bytes) {
        this.text = new String(bytes, StandardCharsets.ISO_8859_1);
        this.n = text.length();
    }

    /** Splits content-stream bytes into tokens. */
    public static List<Token> tokenize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new ArrayList<>();
        }
        return new ContentTokenizer(bytes).readAll();
    }

    /** Concatenates token values back into content-stream bytes. */
    public static byte[] join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.value());
        }
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    private List<Token> readAll() {
        List<Token> tokens = new ArrayList<>();
        while (pos < n) {
            tokens.add(next());
        }
        return tokens;
    }

    private Token next() {
        char c = text.charAt(pos);

        if (WHITESPACE.indexOf(c) >= 0) {
            return take(pos + 1, TokenKind.WHITESPACE);
        }
        if (c == '%') {
            return take(skipComment(pos), TokenKind.COMMENT);
        }
        if (c == '(') {
            return take(skipLiteralString(pos), TokenKind.LITERAL_STRING);
        }
        if (c == '<') {
            if (pos + 1 < n && text.charAt(pos + 1) == '<') {
                return take(skipDictionary(pos), TokenKind.DICT);
            }
            return take(skipHexString(pos), TokenKind.HEX_STRING);
        }
        if (c == '[') {
            return take(skipArray(pos), TokenKind.ARRAY);
        }
        if (c == '/') {
            return take(skipRegular(pos + 1), TokenKind.NAME);
        }
        if (NUMBER_START.indexOf(c) >= 0) {
            int end = scanNumber(pos);
            if (end > 0) {
                return take(end, TokenKind.NUMBER);
            }
        }

        int end = skipRegular(pos);
        if (end > pos) {
            return take(end, TokenKind.OPERATOR);
        }
        return take(pos + 1, TokenKind.OTHER);
    }

    private Token take(int end, TokenKind kind) {
        Token token = new Token(text.substring(pos, end), kind);
        pos = end;
        return token;
    }

    /** Returns the end of a run of non-delimiter characters starting at {@code from}. */
    private int skipRegular(int from) {
        int j = from;
        while (j < n && DELIMITERS.indexOf(text.charAt(j)) < 0) {
            j++;
        }
        return j;
    }

    /**
     * Returns the end of a number starting at {@code from}, or -1 if the run is not a number. A
     * second decimal point or any non-digit makes the whole run an operator.
     */
    private int scanNumber(int from) {
        boolean hasDot = text.charAt(from) == '.';
        int j = from + 1;
        while (j < n && DELIMITERS.indexOf(text.charAt(j)) < 0) {
            char d = text.charAt(j);
            if (d == '.') {
                if (hasDot) {
                    return -1;
                }
                hasDot = true;
            } else if (d < '0' || d > '9') {
                return -1;
            }
            j++;
        }
        return j;
    }

    /** Returns the index just past the ')' balancing the '(' at {@code from}. */
    /** A comment runs to the end of the line, which may be marked by CR as well as LF. */
    private int skipComment(int start) {
        int i = start;
        while (i < n && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    private int skipLiteralString(int from) {
        int depth = 1;
        int j = from + 1;
        while (j < n && depth > 0) {
            char d = text.charAt(j);
            if (d == '\\' && j + 1 < n) {
                j += 2;
                continue;
            }
            if (d == '(') {
                depth++;
            } else if (d == ')') {
                depth--;
            }
            j++;
        }
        return j;
    }

    private int skipHexString(int from) {
        int close = text.indexOf('>', from);
        return close == -1 ? n : close + 1;
    }

    /** Returns the index just past the '>>' balancing the '<<' at {@code from}. */
    private int skipDictionary(int from) {
        int depth = 1;
        int j = from + 2;
        while (j < n - 1 && depth > 0) {
            char d = text.charAt(j);
            if (d == '<' && text.charAt(j + 1) == '<') {
                depth++;
                j += 2;
            } else if (d == '>' && text.charAt(j + 1) == '>') {
                depth--;
                j += 2;
            } else if (d == '<') {
                j = skipHexString(j);
            } else if (d == '(') {
                j = skipLiteralString(j);
            } else {
                j++;
            }
        }
        return depth > 0 ? n : j;
    }

    /** Returns the index just past the ']' balancing the '[' at {@code from}. */
    private int skipArray(int from) {
        int depth = 1;
        int j = from + 1;
        while (j < n && depth > 0) {
            char d = text.charAt(j);
            if (d == '[') {
                depth++;
                j++;
            } else if (d == ']') {
                depth--;
                j++;
            } else if (d == '(') {
                j = skipLiteralString(j);
            } else if (d == '<' && (j + 1 >= n || text.charAt(j + 1) != '<')) {
                j = skipHexString(j);
            } else {
                j++;
            }
        }
        return j;
    }
}
