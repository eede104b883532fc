package com.quartermaster.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalises backlog ids: {@code t1}, {@code T01} and {@code T0001} all become {@code T001};
 * {@code prd1} becomes {@code PRD-001}. Ids that match no known shape are returned trimmed.
 */
public final class IdNormalizer {

    private static final int DIGITS = 3;

    private static final Pattern PRD_ID = Pattern.compile("^PRD-?(\\d+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern EPIC_ID = Pattern.compile("^E(\\d+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TASK_ID = Pattern.compile("^T(\\d+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern STORY_ID = Pattern.compile("^S(\\d+)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PRD_IN_TEXT = Pattern.compile("PRD-?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EPIC_IN_TEXT = Pattern.compile("(?<![A-Za-z])E(\\d+)", Pattern.CASE_INSENSITIVE);

    private IdNormalizer() {}

    public static String normalize(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        Matcher m;
        if ((m = PRD_ID.matcher(trimmed)).matches()) return format("PRD-", m.group(1));
        if ((m = EPIC_ID.matcher(trimmed)).matches()) return format("E", m.group(1));
        if ((m = TASK_ID.matcher(trimmed)).matches()) return format("T", m.group(1));
        if ((m = STORY_ID.matcher(trimmed)).matches()) return format("S", m.group(1));
        return trimmed;
    }

    /**
     * Extracts the PRD id from a parent reference such as {@code "PRD-001 / E002"}.
     *
     * @return the normalised PRD id, or null when the text holds none
     */
    public static String extractPrdId(String parent) {
        if (parent == null) return null;
        Matcher m = PRD_IN_TEXT.matcher(parent);
        return m.find() ? format("PRD-", m.group(1)) : null;
    }

    /**
     * Extracts the epic id from a parent reference such as {@code "PRD-001 / E002"}.
     *
     * @return the normalised epic id, or null when the text holds none
     */
    public static String extractEpicId(String parent) {
        if (parent == null) return null;
        Matcher m = EPIC_IN_TEXT.matcher(parent);
        return m.find() ? format("E", m.group(1)) : null;
    }

    private static String format(String prefix, String digits) {
        String significant = digits.replaceFirst("^0+", "");
        if (significant.isEmpty()) {
            significant = "0";
        }
        return prefix + "0".repeat(Math.max(0, DIGITS - significant.length())) + significant;
    }
}
