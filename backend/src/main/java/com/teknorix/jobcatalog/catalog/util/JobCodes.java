package com.teknorix.jobcatalog.catalog.util;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

public final class JobCodes {
    public static final Pattern CODE_PATTERN = Pattern.compile("^JOB-[0-9A-F]{8}$");
    private static final String PREFIX = "JOB-";

    private JobCodes() {
    }

    public static String newCode() {
        return fromUuid(UUID.randomUUID());
    }

    /**
     * First 8 hex digits of the UUID, upper-cased.
     */
    public static String fromUuid(UUID uuid) {
        return PREFIX + uuid.toString().substring(0, 8).toUpperCase(Locale.ROOT);
    }

    public static boolean isValid(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }
}
