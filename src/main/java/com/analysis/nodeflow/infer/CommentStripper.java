package com.analysis.nodeflow.infer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented cleanup used when the structured scan fails.
 *
 * <p>
 * Drops triple-quoted blocks and trailing {@code #} comments, then collects
 * every identifier-shaped token that is left. This can report names that are
 * only assigned, or that sit inside single-line strings; callers accept that
 * imprecision in exchange for a result on code that does not tokenize.
 */
public final class CommentStripper {
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private CommentStripper() {
        // Utility class
    }

    public static String strip(String code) {
        List<String> kept = new ArrayList<>();
        String marker = null;
        for (String line : code.split("\n", -1)) {
            StringBuilder outside = new StringBuilder();
            int pos = 0;
            while (pos <= line.length()) {
                if (marker != null) {
                    int close = line.indexOf(marker, pos);
                    if (close < 0)
                        break;
                    pos = close + 3;
                    marker = null;
                } else {
                    int dq = line.indexOf("\"\"\"", pos);
                    int sq = line.indexOf("'''", pos);
                    int open = dq < 0 ? sq : sq < 0 ? dq : Math.min(dq, sq);
                    if (open < 0) {
                        outside.append(line, pos, line.length());
                        break;
                    }
                    outside.append(line, pos, open);
                    marker = open == dq ? "\"\"\"" : "'''";
                    pos = open + 3;
                }
            }
            String text = stripComment(outside.toString());
            if (!text.isBlank())
                kept.add(text);
        }
        return String.join("\n", kept);
    }

    /** Every identifier token in the stripped code, in order of first appearance. */
    public static List<String> identifiers(String code) {
        List<String> names = new ArrayList<>();
        Matcher m = IDENTIFIER.matcher(strip(code));
        while (m.find())
            if (!names.contains(m.group()))
                names.add(m.group());
        return names;
    }

    /** Cuts at the first {@code #} that is preceded by an even number of each quote character. */
    static String stripComment(String line) {
        int hash = line.indexOf('#');
        while (hash >= 0) {
            String before = line.substring(0, hash);
            if (count(before, '\'') % 2 == 0 && count(before, '"') % 2 == 0)
                return before;
            hash = line.indexOf('#', hash + 1);
        }
        return line;
    }

    private static int count(String s, char quote) {
        int n = 0;
        for (int i = 0; i < s.length(); i++)
            if (s.charAt(i) == quote && (i == 0 || s.charAt(i - 1) != '\\'))
                n++;
        return n;
    }
}
