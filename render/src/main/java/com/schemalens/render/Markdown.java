package com.schemalens.render;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text escaping for the Markdown constructs the documents use.
 */
public final class Markdown {
    private static final Pattern BACKTICK_RUN = Pattern.compile("`+");
    private static final Pattern UNSAFE_PATH = Pattern.compile("[\\\\/:*?\"<>|\\s]+");

    private Markdown() {}

    /** Makes text safe inside a table cell: pipes escaped, line breaks turned into {@code <br>}. */
    public static String cell(String text) {
        if (text == null) {
            return "";
        }
        return text.strip()
                .replace("|", "\\|")
                .replace("\r\n", "\n")
                .replace("\r", "\n")
                .replace("\n", "<br>");
    }

    /** Inline code span, with a fence longer than any backtick run inside. */
    public static String code(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String ticks = "`".repeat(longestRun(text) + 1);
        String pad = text.startsWith("`") || text.endsWith("`") ? " " : "";
        return ticks + pad + text + pad + ticks;
    }

    /** Opening and closing fence for a code block holding {@code text}. */
    public static String fence(String text) {
        return "`".repeat(Math.max(3, longestRun(text == null ? "" : text) + 1));
    }

    /** Prefixes every line with {@code > }. */
    public static String quote(String text) {
        if (text == null) {
            return "";
        }
        return "> " + text.strip().replace("\r\n", "\n").replace("\n", "\n> ");
    }

    public static String link(String label, String target) {
        return "[" + label.replace("[", "\\[").replace("]", "\\]") + "](" + target + ")";
    }

    /** Replaces characters that are not safe in a file name. */
    public static String fileName(String part) {
        return UNSAFE_PATH.matcher(part).replaceAll("_");
    }

    /**
     * Link from the document at {@code from} to the one at {@code to}. Documents sit either at
     * the root or one directory below it.
     */
    public static String relative(String from, String to) {
        String prefix = from.indexOf('/') >= 0 ? "../" : "";
        StringBuilder sb = new StringBuilder(prefix);
        String[] segments = to.split("/");
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8)
                    .replace("+", "%20")
                    .replace("(", "%28")
                    .replace(")", "%29"));
        }
        return sb.toString();
    }

    private static int longestRun(String text) {
        int longest = 0;
        Matcher m = BACKTICK_RUN.matcher(text);
        while (m.find()) {
            longest = Math.max(longest, m.group().length());
        }
        return longest;
    }
}
