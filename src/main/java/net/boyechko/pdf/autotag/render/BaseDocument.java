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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The saved bytes of the document being edited, and the password that opens them. In-memory page
 * edits are laid over these bytes when a page is rendered.
 *
 * @param bytes the complete file as last saved
 * @param password user or owner password, or {@code null} for unencrypted files
 */
public record BaseDocument(byte[] bytes, String password) {

    public static BaseDocument read(Path pdf, String password) throws IOException {
        return new BaseDocument(Files.readAllBytes(pdf), password);
    }
}
