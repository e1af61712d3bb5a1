package com.tgarchitect.core.expression;

import com.tgarchitect.core.lexer.TerragruntLexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Bracket and string aware scanning over expression text.
 *
 * <p>"Top level" means outside any {@code ()}, {@code []}, {@code {}} pair and outside
 * quoted strings, including strings nested inside interpolations.
 */
final class TopLevelScanner {

    private TopLevelScanner() {
        // Utility class
    }

    /**
     * Finds the closing quote of the string starting at {@code start}.
     *
     * @param s text
     * @param start index of the opening quote
     * @return index of the closing quote, or -1 if the string is unterminated
     */
    static int closingQuote(String s, int start) {
        Deque<int[]> modes = new ArrayDeque<>();
        modes.push(new int[] {-1});

        for (int i = start + 1; i < s.length(); i++) {
            char c = s.charAt(i);
            int[] mode = modes.peek();

            if (mode[0] < 0) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    modes.pop();
                    if (modes.isEmpty()) {
                        return i;
                    }
                } else if (isTemplateStart(s, i) && modes.size() < TerragruntLexer.MAX_INTERPOLATION_DEPTH * 2) {
                    modes.push(new int[] {0});
                    i++;
                }
                continue;
            }

            if (c == '"') {
                modes.push(new int[] {-1});
            } else if (c == '{') {
                mode[0]++;
            } else if (c == '}') {
                if (mode[0] == 0) {
                    modes.pop();
                } else {
                    mode[0]--;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the bracket closing the one at {@code open}.
     *
     * @param s text
     * @param open index of an opening bracket
     * @return index of the matching closing bracket, or -1
     */
    static int findClosing(String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                int end = closingQuote(s, i);
                if (end < 0) {
                    return -1;
                }
                i = end;
            } else if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Returns the first top-level index at or after {@code from} accepted by {@code match}.
     *
     * <p>The predicate is tested before bracket handling, so it may match bracket characters.
     *
     * @param s text
     * @param from start index
     * @param match position predicate
     * @return matching index, or -1
     */
    static int scanTopLevel(String s, int from, IntPredicate match) {
        int depth = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (depth == 0 && c != '"' && match.test(i)) {
                return i;
            }
            if (c == '"') {
                int end = closingQuote(s, i);
                if (end < 0) {
                    return -1;
                }
                i = end;
            } else if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
            }
        }
        return -1;
    }

    static int indexOfTopLevel(String s, String token, int from) {
        return scanTopLevel(s, from, i -> s.startsWith(token, i));
    }

    /**
     * Finds a whitespace delimited keyword such as {@code if} at the top level.
     */
    static int indexOfTopLevelKeyword(String s, String keyword) {
        return scanTopLevel(s, 0, i -> s.startsWith(keyword, i)
            && i > 0 && Character.isWhitespace(s.charAt(i - 1))
            && i + keyword.length() < s.length() && Character.isWhitespace(s.charAt(i + keyword.length())));
    }

    /**
     * Splits at top-level occurrences of any of the given separator characters.
     * Blank pieces are dropped and the remaining pieces are stripped.
     */
    static List<String> splitTopLevel(String s, String separators) {
        List<String> pieces = new ArrayList<>();
        int start = 0;
        while (start <= s.length()) {
            int sep = scanTopLevel(s, start, i -> separators.indexOf(s.charAt(i)) >= 0);
            String piece = sep < 0 ? s.substring(start) : s.substring(start, sep);
            if (!piece.isBlank()) {
                pieces.add(piece.strip());
            }
            if (sep < 0) {
                break;
            }
            start = sep + 1;
        }
        return pieces;
    }

    /**
     * Finds the {@code =} of an object attribute, skipping comparison operators and {@code =>},
     * and falls back to a top-level {@code :}.
     */
    static int findAssignment(String pair) {
        int eq = scanTopLevel(pair, 0, i -> {
            if (pair.charAt(i) != '=') {
                return false;
            }
            char next = i + 1 < pair.length() ? pair.charAt(i + 1) : '\0';
            char prev = i > 0 ? pair.charAt(i - 1) : '\0';
            return next != '=' && next != '>' && "=!<>".indexOf(prev) < 0;
        });
        if (eq >= 0) {
            return eq;
        }
        return scanTopLevel(pair, 0, i -> pair.charAt(i) == ':');
    }

    /**
     * Finds the {@code :} belonging to the conditional whose {@code ?} sits at {@code question}.
     */
    static int findConditionalColon(String s, int question) {
        int[] pending = {0};
        return scanTopLevel(s, question + 1, i -> {
            char c = s.charAt(i);
            if (c == '?') {
                pending[0]++;
            } else if (c == ':') {
                if (pending[0] == 0) {
                    return true;
                }
                pending[0]--;
            }
            return false;
        });
    }

    /**
     * True if an unescaped {@code ${} or {@code %{} starts at {@code i}.
     */
    static boolean isTemplateStart(String s, int i) {
        char c = s.charAt(i);
        if ((c != '$' && c != '%') || i + 1 >= s.length() || s.charAt(i + 1) != '{') {
            return false;
        }
        return i == 0 || s.charAt(i - 1) != c;
    }

    static boolean containsTemplate(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (isTemplateStart(s, i)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isOpen(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    private static boolean isClose(char c) {
        return c == ')' || c == ']' || c == '}';
    }
}
