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

import java.util.Locale;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Tunable constants for a write session.
 *
 * <p>Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE}. Each value may be
 * overridden by a system property {@code autotag.<name>} (e.g. {@code
 * -Dautotag.renderDpi=96}), then by an environment variable {@code AUTOTAG_<NAME>} (e.g. {@code
 * AUTOTAG_RENDER_DPI=96}).
 *
 * @param headingDiffTolerance largest pixel difference, in percent, accepted for a heading tag
 * @param contrastDiffTolerance largest pixel difference, in percent, accepted for a page of color
 *     substitutions
 * @param maxHeadingAttempts attempts per heading before giving up
 * @param colorTolerance per-channel tolerance when matching an operand color
 * @param renderDpi rendering resolution for verification
 * @param channelThreshold 8-bit intensity difference above which a channel counts as changed
 * @param structSearchDepth depth limit for structure tree searches
 * @param bboxTolerance slack in points when matching text positions to a bounding box
 * @param verifyVisually whether content-stream edits are rendered and compared
 * @param deferTier2 whether content-stream edits are left to an external tagger
 * @param refreshExistingFigures whether alt text on pre-existing figures is refreshed
 */
public record RemediationSettings(
        double headingDiffTolerance,
        double contrastDiffTolerance,
        int maxHeadingAttempts,
        double colorTolerance,
        int renderDpi,
        int channelThreshold,
        int structSearchDepth,
        double bboxTolerance,
        boolean verifyVisually,
        boolean deferTier2,
        boolean refreshExistingFigures) {

    public static final String DEFAULTS_RESOURCE = "/autotag-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(RemediationSettings.class);

    public RemediationSettings {
        if (maxHeadingAttempts < 1) {
            throw new IllegalArgumentException("maxHeadingAttempts must be at least 1");
        }
        if (renderDpi < 1) {
            throw new IllegalArgumentException("renderDpi must be positive");
        }
        if (structSearchDepth < 1) {
            throw new IllegalArgumentException("structSearchDepth must be at least 1");
        }
    }

    /** Bean shape of the defaults resource. */
    public static final class Values {
        public double headingDiffTolerance = 0.5;
        public double contrastDiffTolerance = 15.0;
        public int maxHeadingAttempts = 5;
        public double colorTolerance = 0.02;
        public int renderDpi = 72;
        public int channelThreshold = 5;
        public int structSearchDepth = 8;
        public double bboxTolerance = 5.0;
        public boolean verifyVisually = true;
        public boolean deferTier2 = false;
        public boolean refreshExistingFigures = false;
    }

    /** Loads the defaults resource and applies system property and environment overrides. */
    public static RemediationSettings load() {
        return load(System::getProperty, System::getenv);
    }

    static RemediationSettings load(
            UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
        Values v = readDefaults();
        Overrides o = new Overrides(systemProperties, environment);
        return new RemediationSettings(
                o.get("headingDiffTolerance", v.headingDiffTolerance),
                o.get("contrastDiffTolerance", v.contrastDiffTolerance),
                o.get("maxHeadingAttempts", v.maxHeadingAttempts),
                o.get("colorTolerance", v.colorTolerance),
                o.get("renderDpi", v.renderDpi),
                o.get("channelThreshold", v.channelThreshold),
                o.get("structSearchDepth", v.structSearchDepth),
                o.get("bboxTolerance", v.bboxTolerance),
                o.get("verifyVisually", v.verifyVisually),
                o.get("deferTier2", v.deferTier2),
                o.get("refreshExistingFigures", v.refreshExistingFigures));
    }

    /** Built-in defaults, ignoring the resource and any overrides. */
    public static RemediationSettings defaults() {
        return fromValues(new Values());
    }

    private static RemediationSettings fromValues(Values v) {
        return new RemediationSettings(
                v.headingDiffTolerance,
                v.contrastDiffTolerance,
                v.maxHeadingAttempts,
                v.colorTolerance,
                v.renderDpi,
                v.channelThreshold,
                v.structSearchDepth,
                v.bboxTolerance,
                v.verifyVisually,
                v.deferTier2,
                v.refreshExistingFigures);
    }

    private static Values readDefaults() {
        try (var inputStream = RemediationSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (inputStream == null) {
                logger.debug("No {} on classpath; using built-in defaults", DEFAULTS_RESOURCE);
                return new Values();
            }
            var yaml = new Yaml(new Constructor(Values.class, new LoaderOptions()));
            Values values = yaml.load(inputStream);
            return values != null ? values : new Values();
        } catch (Exception e) {
            throw new IllegalStateException(
                    "Failed to load settings from resource "
                            + DEFAULTS_RESOURCE
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    public RemediationSettings withVerifyVisually(boolean value) {
        return new RemediationSettings(
                headingDiffTolerance,
                contrastDiffTolerance,
                maxHeadingAttempts,
                colorTolerance,
                renderDpi,
                channelThreshold,
                structSearchDepth,
                bboxTolerance,
                value,
                deferTier2,
                refreshExistingFigures);
    }

    public RemediationSettings withDeferTier2(boolean value) {
        return new RemediationSettings(
                headingDiffTolerance,
                contrastDiffTolerance,
                maxHeadingAttempts,
                colorTolerance,
                renderDpi,
                channelThreshold,
                structSearchDepth,
                bboxTolerance,
                verifyVisually,
                value,
                refreshExistingFigures);
    }

    public RemediationSettings withRefreshExistingFigures(boolean value) {
        return new RemediationSettings(
                headingDiffTolerance,
                contrastDiffTolerance,
                maxHeadingAttempts,
                colorTolerance,
                renderDpi,
                channelThreshold,
                structSearchDepth,
                bboxTolerance,
                verifyVisually,
                deferTier2,
                value);
    }

    /** Looks up {@code autotag.<name>}, then {@code AUTOTAG_<NAME>}. */
    private record Overrides(UnaryOperator<String> systemProperties, UnaryOperator<String> env) {

        String raw(String name) {
            String value = systemProperties.apply("autotag." + name);
            if (value == null || value.isBlank()) {
                value = env.apply("AUTOTAG_" + upperSnake(name));
            }
            return value == null || value.isBlank() ? null : value.trim();
        }

        double get(String name, double fallback) {
            String value = raw(name);
            if (value == null) {
                return fallback;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid number for " + name + ": " + value, e);
            }
        }

        int get(String name, int fallback) {
            String value = raw(name);
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid integer for " + name + ": " + value, e);
            }
        }

        boolean get(String name, boolean fallback) {
            String value = raw(name);
            return value == null ? fallback : Boolean.parseBoolean(value);
        }
    }

    static String upperSnake(String camel) {
        return camel.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }
}
