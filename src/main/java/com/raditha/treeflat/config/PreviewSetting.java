package com.raditha.treeflat.config;

import java.util.List;
import java.util.Locale;

/**
 * Preview axis: none, smart, full or an exact character cap.
 *
 * @param mode  preview mode
 * @param limit character cap, only meaningful for {@link Mode#LIMIT}
 */
public record PreviewSetting(Mode mode, int limit) {

    public enum Mode {
        NONE,
        /** Shortened according to the node's preview strategy */
        SMART,
        /** Untruncated text */
        FULL,
        /** First {@code limit} characters */
        LIMIT
    }

    private static final List<String> VALID = List.of("none", "smart", "full", "or a non-negative integer");

    public PreviewSetting {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (limit < 0) {
            throw new InvalidParameterException(Parameters.PREVIEW, String.valueOf(limit), VALID);
        }
    }

    public static PreviewSetting none() {
        return new PreviewSetting(Mode.NONE, 0);
    }

    public static PreviewSetting smart() {
        return new PreviewSetting(Mode.SMART, 0);
    }

    public static PreviewSetting full() {
        return new PreviewSetting(Mode.FULL, 0);
    }

    public static PreviewSetting limit(int characters) {
        return new PreviewSetting(Mode.LIMIT, characters);
    }

    public static PreviewSetting parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "none":
                return none();
            case "smart":
                return smart();
            case "full":
                return full();
            default:
                break;
        }
        if (normalized.matches("\\d+")) {
            return limit(clamp(normalized));
        }
        throw new InvalidParameterException(Parameters.PREVIEW, String.valueOf(value), VALID);
    }

    /** Digits beyond {@code Integer.MAX_VALUE} mean "no practical cap". */
    private static int clamp(String digits) {
        String significant = digits.replaceFirst("^0+(?=\\d)", "");
        if (significant.length() > 10) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(Long.parseLong(significant), Integer.MAX_VALUE);
    }

    public boolean enabled() {
        return mode != Mode.NONE;
    }

    public String parameterValue() {
        return mode == Mode.LIMIT ? Integer.toString(limit) : mode.name().toLowerCase(Locale.ROOT);
    }
}
