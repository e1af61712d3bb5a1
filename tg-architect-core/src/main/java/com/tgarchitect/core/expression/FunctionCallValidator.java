package com.tgarchitect.core.expression;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.expression.HclExpression.FunctionCall;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Terragrunt layer over {@link ExpressionParser}: checks builtin arity, flags unknown
 * Terragrunt-style names in strict mode and collects nested calls.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FunctionCallValidator validator = new FunctionCallValidator(new ExpressionParser(), false);
 * FunctionCallResult result = validator.parseFunctionCall("find_in_parent_folders(\"root.hcl\")");
 * if (!result.isValid()) {
 *     result.errors().forEach(e -> log.warn("{}", e));
 * }
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.
 *
 * @since 1.0.0
 */
public class FunctionCallValidator {

    private static final Logger log = LoggerFactory.getLogger(FunctionCallValidator.class);

    private static final List<String> TERRAGRUNT_PREFIXES = List.of(
        "get_", "find_", "path_", "read_", "sops_", "run_", "parse_", "render_", "mark_");
    private static final int MAX_SUGGESTIONS = 3;
    private static final int MAX_SUGGESTION_DISTANCE = 3;
    private static final int PREFIX_LENGTH = 4;

    private final ExpressionParser parser;
    private final boolean strictMode;

    public FunctionCallValidator() {
        this(new ExpressionParser(), false);
    }

    /**
     * Creates a validator.
     *
     * @param parser expression parser
     * @param strictMode whether unknown Terragrunt-style function names produce warnings
     */
    public FunctionCallValidator(ExpressionParser parser, boolean strictMode) {
        this.parser = parser;
        this.strictMode = strictMode;
    }

    // ==================== Single call ====================

    /**
     * Parses text that is expected to be a single function call and validates it.
     *
     * @param text expression text
     * @return parse result; a non-call expression yields a SYNTAX_ERROR finding
     */
    public FunctionCallResult parseFunctionCall(String text) {
        HclExpression expr = parser.parse(text);
        if (!(expr instanceof FunctionCall call)) {
            ParseError error = ParseError.error(ErrorCode.SYNTAX_ERROR,
                "Expected function call, got " + expr.kind().wireName(), null);
            return new FunctionCallResult(expr, false, null, List.of(error));
        }
        TerragruntFunction definition = TerragruntFunctions.find(call.name()).orElse(null);
        return new FunctionCallResult(call, definition != null, definition,
            validateFunction(call.name(), call.args().size()));
    }

    /**
     * Validates a call by name and argument count.
     *
     * @param name function name
     * @param argCount number of arguments
     * @return findings, empty when the call is acceptable
     */
    public List<ParseError> validateFunction(String name, int argCount) {
        Optional<TerragruntFunction> definition = TerragruntFunctions.find(name);
        if (definition.isEmpty()) {
            return unknownFunction(name);
        }

        TerragruntFunction function = definition.get();
        if (argCount < function.minArgs()) {
            return List.of(ParseError.error(ErrorCode.INVALID_FUNCTION_ARGS,
                "Function '" + name + "' requires at least " + function.minArgs()
                    + " argument(s), got " + argCount, null));
        }
        if (!function.isVariadic() && argCount > function.maxArgs()) {
            return List.of(ParseError.error(ErrorCode.INVALID_FUNCTION_ARGS,
                "Function '" + name + "' accepts at most " + function.maxArgs()
                    + " argument(s), got " + argCount, null));
        }
        return List.of();
    }

    private List<ParseError> unknownFunction(String name) {
        if (!strictMode || !hasTerragruntPrefix(name)) {
            return List.of();
        }
        List<String> suggestions = suggestions(name);
        String message = "Unknown function '" + name + "'";
        if (!suggestions.isEmpty()) {
            message += ", did you mean: " + String.join(", ", suggestions) + "?";
        }
        log.debug("Strict mode: {}", message);
        return List.of(ParseError.warning(ErrorCode.UNKNOWN_FUNCTION, message, null));
    }

    // ==================== Nested calls ====================

    /**
     * Parses expression text and returns every function call in it.
     *
     * @param text expression text
     * @return calls in pre-order
     */
    public List<ExtractedFunctionCall> extractFunctionCalls(String text) {
        return extractFunctionCalls(parser.parse(text));
    }

    /**
     * Returns every function call in an expression tree, each validated on its own.
     *
     * @param expr expression, may be null
     * @return calls in pre-order
     */
    public List<ExtractedFunctionCall> extractFunctionCalls(HclExpression expr) {
        List<ExtractedFunctionCall> calls = new ArrayList<>();
        if (expr != null) {
            collect(expr, calls);
        }
        return calls;
    }

    private void collect(HclExpression expr, List<ExtractedFunctionCall> calls) {
        if (expr instanceof FunctionCall call) {
            List<ExtractedReference> argRefs = new ArrayList<>();
            for (HclExpression arg : call.args()) {
                argRefs.addAll(ReferenceExtractor.extractReferences(arg));
            }
            calls.add(new ExtractedFunctionCall(
                call,
                TerragruntFunctions.find(call.name()).orElse(null),
                validateFunction(call.name(), call.args().size()),
                argRefs));
        }
        for (HclExpression child : expr.children()) {
            collect(child, calls);
        }
    }

    /**
     * Validates every nested call and attributes the findings to a location.
     *
     * @param expr expression
     * @param location location of the enclosing attribute, may be null
     * @return all findings
     */
    public List<ParseError> validateAll(HclExpression expr, SourceLocation location) {
        List<ParseError> errors = new ArrayList<>();
        for (ExtractedFunctionCall call : extractFunctionCalls(expr)) {
            for (ParseError error : call.errors()) {
                errors.add(new ParseError(error.message(), location, error.severity(), error.code()));
            }
        }
        return errors;
    }

    public boolean containsTerragruntFunctions(HclExpression expr) {
        return extractFunctionCalls(expr).stream().anyMatch(ExtractedFunctionCall::isTerragruntFunction);
    }

    // ==================== Catalog ====================

    public boolean isTerragruntFunction(String name) {
        return TerragruntFunctions.isTerragruntFunction(name);
    }

    public Optional<TerragruntFunction> definition(String name) {
        return TerragruntFunctions.find(name);
    }

    public List<String> functionNames() {
        return TerragruntFunctions.names();
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    /**
     * Suggests catalog names close to an unknown name.
     *
     * <p>A candidate qualifies when it shares the first four characters or lies within
     * edit distance 3. Results are ordered by distance, at most three.
     *
     * @param name unknown name
     * @return suggestions
     */
    public List<String> suggestions(String name) {
        String prefix = name.length() >= PREFIX_LENGTH ? name.substring(0, PREFIX_LENGTH) : name;
        return TerragruntFunctions.names().stream()
            .filter(candidate -> candidate.startsWith(prefix)
                || levenshtein(name, candidate) <= MAX_SUGGESTION_DISTANCE)
            .sorted(Comparator.comparingInt((String candidate) -> levenshtein(name, candidate))
                .thenComparing(Comparator.naturalOrder()))
            .limit(MAX_SUGGESTIONS)
            .toList();
    }

    private static boolean hasTerragruntPrefix(String name) {
        return TERRAGRUNT_PREFIXES.stream().anyMatch(name::startsWith);
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
