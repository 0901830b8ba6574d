package com.rift.render;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Renderer stage configuration.
 *
 * @param primaryFormat   Format of the main rendered text
 * @param secondaryFormat Optional extra format (null if none)
 * @param debugFormat     Optional debug format (null if none)
 * @param jsonExport      Whether a JSON export is produced as well
 */
public record OutputSettings(
        OutputFormat primaryFormat,
        OutputFormat secondaryFormat,
        OutputFormat debugFormat,
        boolean jsonExport
) {
    public OutputSettings {
        if (primaryFormat == null) {
            primaryFormat = OutputFormat.LISP_STYLE_AST;
        }
    }

    /**
     * Canonical rendering only.
     */
    public static OutputSettings canonical() {
        return new OutputSettings(OutputFormat.LISP_STYLE_AST, null, null, false);
    }

    /**
     * Formats produced in addition to the primary one, without duplicates, in
     * secondary, debug, JSON order.
     */
    public Set<OutputFormat> additionalFormats() {
        Set<OutputFormat> formats = new LinkedHashSet<>();
        if (secondaryFormat != null) {
            formats.add(secondaryFormat);
        }
        if (debugFormat != null) {
            formats.add(debugFormat);
        }
        if (jsonExport) {
            formats.add(OutputFormat.JSON);
        }
        formats.remove(primaryFormat);
        return formats;
    }
}
