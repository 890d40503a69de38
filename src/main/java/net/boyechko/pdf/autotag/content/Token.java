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

/**
 * One token of a page content stream. The value holds the raw bytes as ISO-8859-1 characters, so
 * one char always stands for one byte and concatenating the values of an untouched token list
 * reproduces the stream exactly.
 */
public record Token(String value, TokenKind kind) {

    public Token {
        if (value == null || kind == null) {
            throw new IllegalArgumentException("Token value and kind are required");
        }
    }

    public static Token whitespace(String value) {
        return new Token(value, TokenKind.WHITESPACE);
    }

    public static Token name(String value) {
        return new Token(value, TokenKind.NAME);
    }

    public static Token dict(String value) {
        return new Token(value, TokenKind.DICT);
    }

    public static Token number(String value) {
        return new Token(value, TokenKind.NUMBER);
    }

    public static Token operator(String value) {
        return new Token(value, TokenKind.OPERATOR);
    }

    public boolean isWhitespace() {
        return kind == TokenKind.WHITESPACE;
    }

    /** Returns true if this token is the operator with the given name. */
    public boolean isOperator(String op) {
        return kind == TokenKind.OPERATOR && value.equals(op);
    }

    @Override
    public String toString() {
        return kind + "[" + value + "]";
    }
}
