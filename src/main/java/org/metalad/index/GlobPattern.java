package org.metalad.index;

import java.util.regex.Pattern;

/**
 * Shell style path pattern. `*` matches any run of characters including '/' and the empty
 * string, `?` matches one character, `[...]` matches a character class (`[!...]` negates).
 * Everything else matches literally.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;
    private final boolean literal;

    private GlobPattern(String glob) {
        this.glob = glob;
        this.literal = !(glob.contains("*") || glob.contains("?") || glob.contains("["));
        this.regex = Pattern.compile(translate(glob), Pattern.DOTALL);
    }

    /**
     * @param glob Pattern, null is treated as "*"
     */
    public static GlobPattern compile(String glob) {
        return new GlobPattern(glob == null ? "*" : glob);
    }

    public boolean matches(String candidate) {
        return regex.matcher(candidate).matches();
    }

    /**
     * @return True if the pattern has no wildcards, it then matches exactly one string
     */
    public boolean isLiteral() {
        return literal;
    }

    public String getGlob() {
        return glob;
    }

    private static String translate(String glob) {
        StringBuilder builder = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char ch = glob.charAt(i++);
            if (ch == '*') {
                builder.append(".*");
            } else if (ch == '?') {
                builder.append('.');
            } else if (ch == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    // no closing bracket, literal '['
                    builder.append("\\[");
                } else {
                    String content = glob.substring(i, j);
                    i = j + 1;
                    builder.append('[');
                    if (content.startsWith("!")) {
                        builder.append('^');
                        content = content.substring(1);
                    }
                    for (char member : content.toCharArray()) {
                        if ("[]&^\\".indexOf(member) >= 0) {
                            builder.append('\\');
                        }
                        builder.append(member);
                    }
                    builder.append(']');
                }
            } else {
                builder.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
