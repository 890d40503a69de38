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

/** Lexical category of a content-stream token. */
public enum TokenKind {
    WHITESPACE,
    COMMENT,
    LITERAL_STRING,
    HEX_STRING,
    DICT,
    ARRAY,
    NAME,
    NUMBER,
    OPERATOR,
    OTHER;

    /** Returns true for the two string kinds that can be the operand of Tj. */
    public boolean isString() {
        return this == LITERAL_STRING || this == HEX_STRING;
    }
}
