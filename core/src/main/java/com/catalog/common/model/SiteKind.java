package com.catalog.common.model;

/**
 * Discriminator for site entries. Config feeds carry a numeric {@code type};
 * codes without a dedicated constant map to {@link #OTHER} and keep their raw value
 * on the {@link SiteEntry}.
 */
public enum SiteKind {
    VIDEO(0, "video", "Video Sites"),
    VIDEO_API(1, "video_api", "API Video Sources"),
    VIDEO_SCRIPT(3, "video_script", "Script Video Sources"),
    OTHER(-1, "other", "Other");

    private final int code;
    private final String format;
    private final String displayName;

    SiteKind(int code, String format, String displayName) {
        this.code = code;
        this.format = format;
        this.displayName = displayName;
    }

    public int getCode() { return code; }

    /** Format name used for category ids and plugin format matching. */
    public String getFormat() { return format; }

    public String getDisplayName() { return displayName; }

    public static SiteKind fromCode(int code) {
        for (SiteKind kind : values()) {
            if (kind != OTHER && kind.code == code) return kind;
        }
        return OTHER;
    }
}
