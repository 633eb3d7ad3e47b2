package work.ecology.kernel.sandbox;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Positional-argument bounds of the {@code run} entry point.
 *
 * <p>{@code Function.length} stops counting at the first defaulted or rest parameter, so it is
 * only the lower bound. The upper bound comes from the declared parameter list; a rest parameter,
 * or a non-arrow body reading {@code arguments}, removes it.
 */
record RunSignature(int minimum, int maximum) {
    static final int UNBOUNDED = -1;

    private static final Pattern ARGUMENTS_OBJECT = Pattern.compile("(?<![\\w$.])arguments(?![\\w$])");
    private static final Pattern LEADING_ASYNC = Pattern.compile("^async(?=\\s|\\()\\s*");

    static RunSignature of(String source, int length) {
        String text = source == null ? "" : source.strip();
        if (text.isEmpty() || text.contains("[native code]")) {
            return new RunSignature(length, UNBOUNDED);
        }
        text = LEADING_ASYNC.matcher(text).replaceFirst("");

        boolean arrow;
        int open;
        if (text.startsWith("function")) {
            arrow = false;
            open = text.indexOf('(');
        } else if (text.startsWith("(")) {
            arrow = true;
            open = 0;
        } else {
            int arrowAt = text.indexOf("=>");
            int paren = text.indexOf('(');
            if (arrowAt >= 0 && (paren < 0 || arrowAt < paren)) {
                // single bare parameter: x => ...
                return new RunSignature(length, Math.max(length, 1));
            }
            arrow = false;
            open = paren;
        }
        if (open < 0) {
            return new RunSignature(length, UNBOUNDED);
        }

        List<String> params = new ArrayList<>();
        int close = splitParameters(text, open, params);
        if (close < 0) {
            return new RunSignature(length, UNBOUNDED);
        }
        boolean rest = params.stream().anyMatch(p -> p.startsWith("..."));
        boolean readsArguments = !arrow && ARGUMENTS_OBJECT.matcher(text.substring(close + 1)).find();
        if (rest || readsArguments) {
            return new RunSignature(length, UNBOUNDED);
        }
        return new RunSignature(length, Math.max(length, params.size()));
    }

    boolean accepts(int given) {
        return given >= minimum && (maximum == UNBOUNDED || given <= maximum);
    }

    String mismatch(int given) {
        String takes;
        if (maximum == UNBOUNDED) {
            takes = "at least " + count(minimum);
        } else if (maximum == minimum) {
            takes = count(minimum);
        } else {
            takes = "from " + minimum + " to " + maximum + " positional arguments";
        }
        return "Argument error: run() takes " + takes + " but " + given + (given == 1 ? " was" : " were") + " given";
    }

    private static String count(int n) {
        return n + " positional argument" + (n == 1 ? "" : "s");
    }

    /**
     * Collects the top-level, non-empty parameters between {@code text[open]} and its matching
     * parenthesis. Returns the index of that parenthesis, or -1 when it is never closed.
     */
    private static int splitParameters(String text, int open, List<String> out) {
        int depth = 0;
        int start = open + 1;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipQuoted(text, i, c);
                continue;
            }
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                int eol = text.indexOf('\n', i);
                i = eol < 0 ? text.length() : eol;
                continue;
            }
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                i = end < 0 ? text.length() : end + 2;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    addParameter(text.substring(start, i), out);
                    return i;
                }
            } else if (c == ',' && depth == 1) {
                addParameter(text.substring(start, i), out);
                start = i + 1;
            }
            i++;
        }
        return -1;
    }

    private static int skipQuoted(String text, int from, char quote) {
        int i = from + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return text.length();
    }

    private static void addParameter(String raw, List<String> out) {
        String param = raw.replaceAll("(?s)/\\*.*?\\*/", "").replaceAll("//[^\\n]*", "").strip();
        if (!param.isEmpty()) {
            out.add(param);
        }
    }
}
