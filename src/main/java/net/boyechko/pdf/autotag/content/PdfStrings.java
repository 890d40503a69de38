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

import com.itextpdf.kernel.pdf.PdfString;
import java.io.ByteArrayOutputStream;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;

/** Decoding of string operands and encoding of text into PDF string objects. */
public final class PdfStrings {
    private static final byte[] UTF16_BOM = {(byte) 0xFE, (byte) 0xFF};

    private PdfStrings() {}

    /**
     * Decodes a literal {@code (...)} or hex {@code <...>} string token to text. Bytes starting
     * with the UTF-16BE byte order mark are decoded as UTF-16BE, anything else as ISO-8859-1.
     * Returns an empty string for tokens that are neither.
     */
    public static String decode(String token) {
        if (token.length() >= 2 && token.startsWith("(") && token.endsWith(")")) {
            return toText(unescapeLiteral(token.substring(1, token.length() - 1)));
        }
        if (token.length() >= 2 && token.startsWith("<") && token.endsWith(">")) {
            return toText(parseHex(token.substring(1, token.length() - 1)));
        }
        return "";
    }

    /** Concatenates the decoded text of every string inside a TJ array token. */
    public static String decodeArray(String arrayToken) {
        StringBuilder text = new StringBuilder();
        for (Token token : ContentTokenizer.tokenize(arrayInterior(arrayToken))) {
            if (token.kind().isString()) {
                text.append(decode(token.value()));
            }
        }
        return text.toString();
    }

    /**
     * Encodes text as a PDF string object: ISO-8859-1 bytes when every character fits, otherwise
     * UTF-16BE with a leading FEFF mark, written in hex form.
     */
    public static PdfString encode(String text) {
        CharsetEncoder latin1 = StandardCharsets.ISO_8859_1.newEncoder();
        if (latin1.canEncode(text)) {
            return new PdfString(text.getBytes(StandardCharsets.ISO_8859_1));
        }
        byte[] utf16 = text.getBytes(StandardCharsets.UTF_16BE);
        byte[] content = new byte[UTF16_BOM.length + utf16.length];
        System.arraycopy(UTF16_BOM, 0, content, 0, UTF16_BOM.length);
        System.arraycopy(utf16, 0, content, UTF16_BOM.length, utf16.length);
        PdfString encoded = new PdfString(content);
        encoded.setHexWriting(true);
        return encoded;
    }

    /** Decodes the text of a PDF string object written by this class or by any other producer. */
    public static String text(PdfString value) {
        return value == null ? "" : value.toUnicodeString();
    }

    private static byte[] arrayInterior(String arrayToken) {
        String inner = arrayToken;
        if (inner.startsWith("[")) {
            inner = inner.substring(1);
        }
        if (inner.endsWith("]")) {
            inner = inner.substring(0, inner.length() - 1);
        }
        return inner.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static String toText(byte[] bytes) {
        if (bytes.length >= 2 && bytes[0] == UTF16_BOM[0] && bytes[1] == UTF16_BOM[1]) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    /** Resolves backslash escapes of a literal string body to raw bytes. */
    static byte[] unescapeLiteral(String body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.write(c);
                i++;
                continue;
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'n' -> out.write('\n');
                case 'r' -> out.write('\r');
                case 't' -> out.write('\t');
                case 'b' -> out.write('\b');
                case 'f' -> out.write('\f');
                case '\r' -> {
                    // line continuation
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\n' -> {}
                default -> {
                    if (e >= '0' && e <= '7') {
                        int value = e - '0';
                        int digits = 1;
                        while (digits < 3
                                && i < body.length()
                                && body.charAt(i) >= '0'
                                && body.charAt(i) <= '7') {
                            value = value * 8 + (body.charAt(i) - '0');
                            i++;
                            digits++;
                        }
                        out.write(value & 0xFF);
                    } else {
                        out.write(e);
                    }
                }
            }
        }
        return out.toByteArray();
    }

    /** Parses hex digits, ignoring whitespace and padding an odd final digit with zero. */
    static byte[] parseHex(String hex) {
        StringBuilder digits = new StringBuilder(hex.length());
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (Character.digit(c, 16) >= 0) {
                digits.append(c);
            }
        }
        if (digits.length() % 2 == 1) {
            digits.append('0');
        }
        byte[] bytes = new byte[digits.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int hi = Character.digit(digits.charAt(2 * i), 16);
            int lo = Character.digit(digits.charAt(2 * i + 1), 16);
            bytes[i] = (byte) ((hi << 4) | lo);
        }
        return bytes;
    }
}
