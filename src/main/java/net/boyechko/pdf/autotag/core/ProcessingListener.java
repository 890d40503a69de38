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
package net.boyechko.pdf.autotag.core;

/** Interface for reporting progress and results of a write session. */
public interface ProcessingListener {
    ProcessingListener NONE = new ProcessingListener() {};

    default void onPhaseStart(String phaseName) {}

    default void onChange(String message) {}

    default void onWarning(String message) {}

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onSummary(PdfWriteResult result) {}
}
