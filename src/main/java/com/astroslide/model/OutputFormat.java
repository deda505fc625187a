package com.astroslide.model;

import java.util.Locale;

public enum OutputFormat {
    JPEG("jpeg", "jpg", "image/jpeg"),
    PNG("png", "png", "image/png"),
    TIFF("tiff", "tif", "image/tiff");

    public final String formatName;
    public final String extension;
    public final String mimeType;

    OutputFormat(String formatName, String extension, String mimeType) {
        this.formatName = formatName;
        this.extension = extension;
        this.mimeType = mimeType;
    }

    /** Accepts the format name or its file extension, case-insensitively. */
    public static OutputFormat parse(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat f : values()) {
            if (f.formatName.equals(v) || f.extension.equals(v)) return f;
        }
        throw new IllegalArgumentException("Unknown output format '" + value + "' (jpeg, png, tiff)");
    }
}
