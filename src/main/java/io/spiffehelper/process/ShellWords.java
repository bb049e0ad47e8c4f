package io.spiffehelper.process;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an argument string into words using POSIX shell quoting rules. No
 * expansion of any kind is performed; the result is handed to the process
 * builder as an argv list.
 */
public final class ShellWords {
    private ShellWords() {
    }

    public static List<String> split(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isEmpty()) {
            return out;
        }
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        char quote = 0;
        int length = raw.length();
        for (int i = 0; i < length; i++) {
            char ch = raw.charAt(i);
            if (quote == '\'') {
                if (ch == '\'') {
                    quote = 0;
                } else {
                    word.append(ch);
                }
                continue;
            }
            if (quote == '"') {
                if (ch == '"') {
                    quote = 0;
                } else if (ch == '\\') {
                    if (i + 1 >= length) {
                        throw new IllegalArgumentException("Failed to parse cmd_args: unterminated double quote");
                    }
                    char next = raw.charAt(i + 1);
                    if (next == '\n') {
                        i++;
                    } else if (next == '$' || next == '`' || next == '"' || next == '\\') {
                        word.append(next);
                        i++;
                    } else {
                        word.append(ch);
                    }
                } else {
                    word.append(ch);
                }
                continue;
            }
            if (ch == ' ' || ch == '\t' || ch == '\n') {
                if (inWord) {
                    out.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
            } else if (ch == '\\') {
                if (i + 1 >= length) {
                    throw new IllegalArgumentException("Failed to parse cmd_args: trailing backslash");
                }
                char next = raw.charAt(++i);
                if (next != '\n') {
                    word.append(next);
                    inWord = true;
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
                inWord = true;
            } else if (ch == '#' && !inWord) {
                while (i + 1 < length && raw.charAt(i + 1) != '\n') {
                    i++;
                }
            } else {
                word.append(ch);
                inWord = true;
            }
        }
        if (quote != 0) {
            String kind = quote == '\'' ? "single" : "double";
            throw new IllegalArgumentException("Failed to parse cmd_args: unterminated " + kind + " quote");
        }
        if (inWord) {
            out.add(word.toString());
        }
        return out;
    }

    /**
     * Renders words back into a string a POSIX shell would split into the same list.
     */
    public static String join(List<String> words) {
        if (words == null || words.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(quote(words.get(i)));
        }
        return sb.toString();
    }

    private static String quote(String word) {
        if (word.isEmpty()) {
            return "''";
        }
        boolean plain = true;
        for (int i = 0; i < word.length() && plain; i++) {
            char ch = word.charAt(i);
            plain = Character.isLetterOrDigit(ch) || "-_./=:,@%+".indexOf(ch) >= 0;
        }
        if (plain) {
            return word;
        }
        return "'" + word.replace("'", "'\\''") + "'";
    }
}
