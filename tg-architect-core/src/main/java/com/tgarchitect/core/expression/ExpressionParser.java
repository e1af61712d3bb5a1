package com.tgarchitect.core.expression;

import com.tgarchitect.core.expression.HclExpression.ArrayExpr;
import com.tgarchitect.core.expression.HclExpression.Conditional;
import com.tgarchitect.core.expression.HclExpression.ForExpr;
import com.tgarchitect.core.expression.HclExpression.FunctionCall;
import com.tgarchitect.core.expression.HclExpression.Index;
import com.tgarchitect.core.expression.HclExpression.Literal;
import com.tgarchitect.core.expression.HclExpression.ObjectExpr;
import com.tgarchitect.core.expression.HclExpression.Reference;
import com.tgarchitect.core.expression.HclExpression.Splat;
import com.tgarchitect.core.expression.HclExpression.Template;
import com.tgarchitect.core.lexer.StringLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for the HCL expression grammar used by Terragrunt files.
 *
 * <p>Works on expression text (the right-hand side of an attribute) and tries the
 * constructs in a fixed order: literals, strings and heredocs, collections and
 * for-expressions, parenthesized expressions, conditionals, splats, index access,
 * function calls, templates and references. Text that matches none of them (for example
 * arithmetic or comparison operators) becomes an opaque {@link Literal} holding the raw text.
 * Function calls and references inside opaque text are not part of the tree, so
 * {@link FunctionCallValidator} and {@link ReferenceExtractor} do not see them. In
 * {@code length(local.subnets) > 2 ? "a" : "b"} only the branches are parsed.
 *
 * <p>Recursion is bounded by {@code maxDepth}; deeper sub-expressions are kept as opaque
 * literals so adversarial input cannot exhaust the stack.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ExpressionParser parser = new ExpressionParser();
 * HclExpression expr = parser.parse("find_in_parent_folders(\"root.hcl\")");
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.
 *
 * @since 1.0.0
 */
public class ExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    /**
     * Default bound on expression nesting.
     */
    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final Pattern REFERENCE = Pattern.compile(
        "[a-zA-Z_][a-zA-Z0-9_-]*(\\.[a-zA-Z0-9_][a-zA-Z0-9_-]*)*");
    private static final Pattern FUNCTION_HEAD = Pattern.compile(
        "([a-zA-Z_][a-zA-Z0-9_]*(?:::[a-zA-Z_][a-zA-Z0-9_]*)*)\\s*\\(");
    private static final Pattern FOR_HEAD = Pattern.compile(
        "for\\s+(?:([a-zA-Z_][a-zA-Z0-9_]*)\\s*,\\s*)?([a-zA-Z_][a-zA-Z0-9_]*)\\s+in\\s+", Pattern.DOTALL);

    private final boolean includeRaw;
    private final int maxDepth;

    public ExpressionParser() {
        this(true, DEFAULT_MAX_DEPTH);
    }

    /**
     * Creates a parser.
     *
     * @param includeRaw whether expressions keep their source text in {@code raw()}
     * @param maxDepth maximum nesting depth, at least 1
     */
    public ExpressionParser(boolean includeRaw, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.includeRaw = includeRaw;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses expression text.
     *
     * @param input expression text, may be null or blank (yields a null literal)
     * @return parsed expression, never null
     */
    public HclExpression parse(String input) {
        return parse(input == null ? "" : input, 0);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private HclExpression parse(String input, int depth) {
        String text = input.strip();
        if (text.isEmpty()) {
            return new Literal(null, raw(input));
        }
        if (depth > maxDepth) {
            log.debug("Expression nesting exceeds {} levels, keeping raw text", maxDepth);
            return new Literal(text, raw(text), true);
        }
        int next = depth + 1;

        switch (text) {
            case "null":
                return new Literal(null, raw(text));
            case "true":
                return new Literal(Boolean.TRUE, raw(text));
            case "false":
                return new Literal(Boolean.FALSE, raw(text));
            default:
                break;
        }

        if (NUMBER.matcher(text).matches()) {
            return new Literal(parseNumber(text), raw(text));
        }

        char first = text.charAt(0);
        int lastIndex = text.length() - 1;

        if (first == '"' && TopLevelScanner.closingQuote(text, 0) == lastIndex) {
            return parseQuoted(text, next);
        }
        if (text.startsWith("<<")) {
            return parseHeredoc(text, next);
        }
        if ((first == '[' || first == '{' || first == '(') && TopLevelScanner.findClosing(text, 0) == lastIndex) {
            HclExpression bracketed = parseBracketed(text, next);
            if (bracketed != null) {
                return bracketed;
            }
        }

        HclExpression result = tryConditional(text, next);
        if (result == null) {
            result = trySplat(text, next);
        }
        if (result == null) {
            result = tryIndex(text, next);
        }
        if (result == null) {
            result = tryFunction(text, next);
        }
        if (result == null && TopLevelScanner.containsTemplate(text)) {
            result = parseTemplate(text, text, next, false);
        }
        if (result == null && REFERENCE.matcher(text).matches()) {
            result = new Reference(Arrays.asList(text.split("\\.")), raw(text));
        }
        return result != null ? result : new Literal(text, raw(text), true);
    }

    // ==================== Strings ====================

    private HclExpression parseQuoted(String text, int depth) {
        String content = text.substring(1, text.length() - 1);
        if (TopLevelScanner.containsTemplate(content)) {
            return parseTemplate(content, text, depth, true);
        }
        return new Literal(StringLiterals.unescape(content), raw(text));
    }

    private HclExpression parseHeredoc(String text, int depth) {
        String body = StringLiterals.extractHeredocContent(text);
        if (TopLevelScanner.containsTemplate(body)) {
            return parseTemplate(body, text, depth, false);
        }
        return new Literal(body, raw(text));
    }

    /**
     * Splits template content into literal chunks and interpolated expressions.
     * Directives ({@code %{ if }} and friends) are kept as opaque literal parts.
     */
    private Template parseTemplate(String content, String rawText, int depth, boolean unescapeChunks) {
        List<HclExpression> parts = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        int i = 0;
        int n = content.length();

        while (i < n) {
            char c = content.charAt(i);

            if ((c == '$' || c == '%') && i + 2 < n && content.charAt(i + 1) == c && content.charAt(i + 2) == '{') {
                chunk.append(c).append('{');
                i += 3;
                continue;
            }

            if (TopLevelScanner.isTemplateStart(content, i)) {
                int close = TopLevelScanner.findClosing(content, i + 1);
                if (close < 0) {
                    chunk.append(content, i, n);
                    break;
                }
                flushChunk(parts, chunk, unescapeChunks);
                if (c == '$') {
                    parts.add(parse(stripStripMarkers(content.substring(i + 2, close)), depth));
                } else {
                    String directive = content.substring(i, close + 1);
                    parts.add(new Literal(directive, raw(directive), true));
                }
                i = close + 1;
                continue;
            }

            if (unescapeChunks && c == '\\' && i + 1 < n) {
                chunk.append(c).append(content.charAt(i + 1));
                i += 2;
                continue;
            }

            chunk.append(c);
            i++;
        }
        flushChunk(parts, chunk, unescapeChunks);
        return new Template(parts, raw(rawText));
    }

    private void flushChunk(List<HclExpression> parts, StringBuilder chunk, boolean unescape) {
        if (chunk.isEmpty()) {
            return;
        }
        String text = chunk.toString();
        parts.add(new Literal(unescape ? StringLiterals.unescape(text) : text, raw(text)));
        chunk.setLength(0);
    }

    private static String stripStripMarkers(String inner) {
        String s = inner.strip();
        if (s.startsWith("~")) {
            s = s.substring(1);
        }
        if (s.endsWith("~")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    // ==================== Collections ====================

    private HclExpression parseBracketed(String text, int depth) {
        char first = text.charAt(0);
        String inner = text.substring(1, text.length() - 1).strip();

        if (first == '(') {
            return parse(inner, depth);
        }

        if (FOR_HEAD.matcher(inner).lookingAt()) {
            return parseFor(inner, text, first == '{', depth);
        }

        if (first == '[') {
            List<HclExpression> elements = new ArrayList<>();
            for (String element : TopLevelScanner.splitTopLevel(inner, ",")) {
                elements.add(parse(element, depth));
            }
            return new ArrayExpr(elements, raw(text));
        }

        Map<String, HclExpression> attributes = new LinkedHashMap<>();
        for (String pair : TopLevelScanner.splitTopLevel(inner, ",\n")) {
            int assign = TopLevelScanner.findAssignment(pair);
            if (assign <= 0) {
                log.debug("Skipping object element without key: {}", pair);
                continue;
            }
            String key = normalizeKey(pair.substring(0, assign));
            attributes.put(key, parse(pair.substring(assign + 1), depth));
        }
        return new ObjectExpr(attributes, raw(text));
    }

    private HclExpression parseFor(String inner, String text, boolean objectResult, int depth) {
        Matcher head = FOR_HEAD.matcher(inner);
        if (!head.lookingAt()) {
            return null;
        }
        String keyVar = head.group(1);
        String valueVar = head.group(2);
        String rest = inner.substring(head.end());

        int colon = TopLevelScanner.indexOfTopLevel(rest, ":", 0);
        if (colon < 0) {
            return null;
        }
        String collection = rest.substring(0, colon);
        String body = rest.substring(colon + 1);

        HclExpression condition = null;
        int ifIndex = TopLevelScanner.indexOfTopLevelKeyword(body, "if");
        if (ifIndex >= 0) {
            condition = parse(body.substring(ifIndex + 2), depth);
            body = body.substring(0, ifIndex);
        }

        HclExpression keyExpr = null;
        String valueText = body;
        if (objectResult) {
            int arrow = TopLevelScanner.indexOfTopLevel(body, "=>", 0);
            if (arrow < 0) {
                return null;
            }
            keyExpr = parse(body.substring(0, arrow), depth);
            valueText = body.substring(arrow + 2);
        }
        valueText = valueText.strip();
        if (valueText.endsWith("...")) {
            valueText = valueText.substring(0, valueText.length() - 3);
        }

        return new ForExpr(
            keyVar,
            valueVar,
            parse(collection, depth),
            keyExpr,
            parse(valueText, depth),
            condition,
            objectResult,
            raw(text)
        );
    }

    private static String normalizeKey(String key) {
        String k = key.strip();
        if (k.startsWith("(") && k.endsWith(")")) {
            k = k.substring(1, k.length() - 1).strip();
        }
        if (k.length() >= 2 && k.startsWith("\"") && k.endsWith("\"")) {
            return StringLiterals.extractStringContent(k);
        }
        return k;
    }

    // ==================== Operators and Access ====================

    private HclExpression tryConditional(String text, int depth) {
        int question = TopLevelScanner.indexOfTopLevel(text, "?", 0);
        if (question <= 0) {
            return null;
        }
        int colon = TopLevelScanner.findConditionalColon(text, question);
        if (colon < 0) {
            return null;
        }
        return new Conditional(
            parse(text.substring(0, question), depth),
            parse(text.substring(question + 1, colon), depth),
            parse(text.substring(colon + 1), depth),
            raw(text)
        );
    }

    private HclExpression trySplat(String text, int depth) {
        int full = TopLevelScanner.indexOfTopLevel(text, "[*]", 0);
        int attr = TopLevelScanner.scanTopLevel(text, 0, i -> text.startsWith(".*", i)
            && (i + 2 == text.length() || text.charAt(i + 2) == '.' || text.charAt(i + 2) == '['));

        int at;
        int width;
        if (full > 0 && (attr < 0 || full < attr)) {
            at = full;
            width = 3;
        } else if (attr > 0) {
            at = attr;
            width = 2;
        } else {
            return null;
        }

        String source = text.substring(0, at);
        String each = text.substring(at + width);
        if (each.startsWith(".")) {
            each = each.substring(1);
        }
        return new Splat(parse(source, depth), each.isBlank() ? null : parse(each, depth), raw(text));
    }

    private HclExpression tryIndex(String text, int depth) {
        if (!text.endsWith("]")) {
            return null;
        }
        int open = TopLevelScanner.scanTopLevel(text, 1, i -> text.charAt(i) == '['
            && TopLevelScanner.findClosing(text, i) == text.length() - 1);
        if (open <= 0) {
            return null;
        }
        return new Index(
            parse(text.substring(0, open), depth),
            parse(text.substring(open + 1, text.length() - 1), depth),
            raw(text)
        );
    }

    private HclExpression tryFunction(String text, int depth) {
        Matcher head = FUNCTION_HEAD.matcher(text);
        if (!head.lookingAt()) {
            return null;
        }
        int open = head.end() - 1;
        if (TopLevelScanner.findClosing(text, open) != text.length() - 1) {
            return null;
        }
        List<HclExpression> args = new ArrayList<>();
        for (String arg : TopLevelScanner.splitTopLevel(text.substring(open + 1, text.length() - 1), ",")) {
            String argText = arg.endsWith("...") ? arg.substring(0, arg.length() - 3) : arg;
            args.add(parse(argText, depth));
        }
        return new FunctionCall(head.group(1), args, raw(text));
    }

    // ==================== Helpers ====================

    private static Object parseNumber(String text) {
        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            return Double.valueOf(text);
        }
        try {
            return Long.valueOf(text);
        } catch (NumberFormatException e) {
            return Double.valueOf(text);
        }
    }

    private String raw(String text) {
        return includeRaw ? text : "";
    }
}
