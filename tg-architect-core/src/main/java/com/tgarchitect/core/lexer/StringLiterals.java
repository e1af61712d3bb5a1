package com.tgarchitect.core.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between raw string/heredoc token text and their content.
 *
 * <p>Recognized escapes are {@code \\}, {@code \n}, {@code \r}, {@code \t} and {@code \"}.
 * Any other backslash sequence is kept verbatim. {@link #escape(String)} is the exact
 * inverse of the unescaping step, so extracting, re-escaping and extracting again
 * always yields the same content.
 */
public final class StringLiterals {

    private static final Pattern HEREDOC_HEADER = Pattern.compile("^<<(-?)([A-Za-z0-9_]+)[ \\t]*\\r?$");

    private StringLiterals() {
        // Utility class
    }

    /**
     * Extracts the content of a string token.
     *
     * @param token STRING token
     * @return unescaped content without the surrounding quotes
     */
    public static String extractStringContent(Token token) {
        return extractStringContent(token.value());
    }

    /**
     * Extracts the content of a raw quoted string.
     *
     * <p>A missing closing quote (unterminated literal) is tolerated.
     *
     * @param raw raw text including quotes
     * @return unescaped content
     */
    public static String extractStringContent(String raw) {
        String body = raw;
        if (body.startsWith("\"")) {
            body = body.substring(1);
            if (body.endsWith("\"") && !endsWithEscapedQuote(body)) {
                body = body.substring(0, body.length() - 1);
            }
        }
        return unescape(body);
    }

    /**
     * Replaces the recognized escape sequences with the characters they denote.
     *
     * @param text escaped text
     * @return unescaped text
     */
    public static String unescape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    default -> sb.append(c).append(next);
                }
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes content so it can be placed between double quotes.
     *
     * @param content raw content
     * @return escaped text, without surrounding quotes
     */
    public static String escape(String content) {
        StringBuilder sb = new StringBuilder(content.length() + 8);
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes content and wraps it in double quotes.
     *
     * @param content raw content
     * @return quoted literal
     */
    public static String quote(String content) {
        return "\"" + escape(content) + "\"";
    }

    /**
     * Extracts the body of a heredoc token.
     *
     * <p>For the indented form ({@code <<-EOT}) the common leading whitespace of all
     * non-blank lines is removed. An unterminated heredoc yields everything after the header.
     *
     * @param raw raw heredoc text
     * @return heredoc body, lines joined with {@code \n}
     */
    public static String extractHeredocContent(String raw) {
        String[] lines = raw.split("\n", -1);
        Matcher header = HEREDOC_HEADER.matcher(lines[0]);
        if (!header.matches()) {
            return raw;
        }
        boolean indented = !header.group(1).isEmpty();
        String delimiter = header.group(2);

        int end = lines.length;
        for (int i = lines.length - 1; i >= 1; i--) {
            if (lines[i].strip().equals(delimiter)) {
                end = i;
                break;
            }
        }

        List<String> body = new ArrayList<>();
        for (int i = 1; i < end; i++) {
            body.add(stripCarriageReturn(lines[i]));
        }
        if (indented) {
            body = removeCommonIndent(body);
        }
        return String.join("\n", body);
    }

    private static List<String> removeCommonIndent(List<String> lines) {
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int leading = 0;
            while (leading < line.length() && (line.charAt(leading) == ' ' || line.charAt(leading) == '\t')) {
                leading++;
            }
            indent = Math.min(indent, leading);
        }
        if (indent == Integer.MAX_VALUE || indent == 0) {
            return lines;
        }
        final int strip = indent;
        return lines.stream()
            .map(line -> line.length() >= strip ? line.substring(strip) : line.strip())
            .toList();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static boolean endsWithEscapedQuote(String body) {
        int backslashes = 0;
        for (int i = body.length() - 2; i >= 0 && body.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
