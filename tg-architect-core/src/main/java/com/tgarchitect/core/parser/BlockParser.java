package com.tgarchitect.core.parser;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.error.TerragruntSyntaxException;
import com.tgarchitect.core.expression.ExpressionParser;
import com.tgarchitect.core.expression.FunctionCallValidator;
import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclExpression.ObjectExpr;
import com.tgarchitect.core.expression.HclValues;
import com.tgarchitect.core.lexer.StringLiterals;
import com.tgarchitect.core.lexer.Token;
import com.tgarchitect.core.lexer.TokenType;
import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.block.BlockKind;
import com.tgarchitect.core.model.block.DependenciesBlock;
import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.ExtraArguments;
import com.tgarchitect.core.model.block.GenerateBlock;
import com.tgarchitect.core.model.block.GenericBlock;
import com.tgarchitect.core.model.block.HookType;
import com.tgarchitect.core.model.block.IamRoleBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.model.block.InputsBlock;
import com.tgarchitect.core.model.block.LocalsBlock;
import com.tgarchitect.core.model.block.RemoteStateBlock;
import com.tgarchitect.core.model.block.RemoteStateGenerate;
import com.tgarchitect.core.model.block.RetryConfigBlock;
import com.tgarchitect.core.model.block.TerraformBlock;
import com.tgarchitect.core.model.block.TerraformHook;
import com.tgarchitect.core.model.block.TerragruntBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a filtered token stream into typed Terragrunt blocks.
 *
 * <p>Top-level statements are dispatched by keyword. Typed keywords ({@code terraform},
 * {@code include}, {@code dependency} and the rest of {@link BlockKind}) produce their record;
 * anything else becomes a {@link GenericBlock}. Attribute expressions are handed to
 * {@link ExpressionParser} as text and every function call inside them is checked by
 * {@link FunctionCallValidator}.
 *
 * <p>A malformed statement raises an internal syntax error which is recorded and passed to
 * the {@link ErrorRecoveryStrategy}. Instances are immutable; each {@link #parse} call works
 * on its own state.
 *
 * @since 1.0.0
 */
public class BlockParser {

    private static final Logger log = LoggerFactory.getLogger(BlockParser.class);

    /**
     * Top-level keywords written as {@code keyword = expression}.
     */
    static final Set<String> ATTRIBUTE_KEYWORDS = Set.of(
        "inputs", "download_dir", "prevent_destroy", "skip", "iam_role",
        "iam_assume_role_duration", "iam_assume_role_session_name", "iam_web_identity_token",
        "terraform_binary", "terraform_version_constraint", "terragrunt_version_constraint");

    /**
     * Block keywords Terragrunt knows but that have no typed record.
     */
    static final Set<String> GENERIC_BLOCK_KEYWORDS = Set.of("feature", "exclude", "errors", "engine", "catalog");

    private final ExpressionParser expressionParser;
    private final FunctionCallValidator functionValidator;
    private final ErrorRecoveryStrategy recovery;
    private final boolean includeRaw;
    private final boolean parseGenerateBlocks;

    public BlockParser(
            ExpressionParser expressionParser,
            FunctionCallValidator functionValidator,
            ErrorRecoveryStrategy recovery,
            boolean includeRaw,
            boolean parseGenerateBlocks) {
        this.expressionParser = expressionParser;
        this.functionValidator = functionValidator;
        this.recovery = recovery;
        this.includeRaw = includeRaw;
        this.parseGenerateBlocks = parseGenerateBlocks;
    }

    /**
     * Parses the blocks of one file.
     *
     * @param tokens tokens without comments, terminated by EOF
     * @param source the text the tokens were produced from
     * @param file file path used in locations, may be null
     * @return blocks and findings
     */
    public BlockParseResult parse(List<Token> tokens, String source, String file) {
        return new Session(tokens, source, file).run();
    }

    /**
     * Attributes and nested blocks of a block body.
     */
    private record Body(Map<String, HclExpression> attributes, List<NestedBlock> nested) {
        Body() {
            this(new LinkedHashMap<>(), new ArrayList<>());
        }

        List<NestedBlock> nestedOfType(String type) {
            return nested.stream().filter(n -> n.type().equals(type)).toList();
        }
    }

    private record NestedBlock(String type, List<String> labels, Body body, SourceLocation location) {
        String firstLabel() {
            return labels.isEmpty() ? "" : labels.get(0);
        }
    }

    private final class Session {
        private final TokenCursor cursor;
        private final String source;
        private final String file;
        private final List<TerragruntBlock> blocks = new ArrayList<>();
        private final List<ParseError> errors = new ArrayList<>();

        Session(List<Token> tokens, String source, String file) {
            this.cursor = new TokenCursor(tokens);
            this.source = source;
            this.file = file;
        }

        BlockParseResult run() {
            boolean aborted = false;
            while (true) {
                cursor.skipNewlines();
                if (cursor.isAtEnd()) {
                    break;
                }
                int before = cursor.position();
                try {
                    TerragruntBlock block = parseTopLevel();
                    if (block != null) {
                        blocks.add(block);
                    }
                } catch (TerragruntSyntaxException e) {
                    ParseError error = e.toParseError();
                    errors.add(error);
                    log.debug("Block error in {}: {}", file, error);
                    if (!recovery.recover(cursor, error)) {
                        aborted = true;
                        break;
                    }
                    if (cursor.position() == before) {
                        cursor.advance();
                    }
                }
            }
            return new BlockParseResult(blocks, errors, aborted);
        }

        // ==================== Statements ====================

        private TerragruntBlock parseTopLevel() {
            Token start = cursor.current();
            if (!start.is(TokenType.IDENTIFIER)) {
                throw syntax("Unexpected " + describe(start) + " at top level", start);
            }
            String keyword = start.value();
            cursor.advance();

            if (cursor.check(TokenType.EQUALS)) {
                cursor.advance();
                HclExpression value = readAttributeExpression(keyword, start);
                return createAttributeBlock(keyword, value, start, cursor.previous());
            }

            List<String> labels = readLabels();
            if (!cursor.check(TokenType.LBRACE)) {
                throw syntax("Expected '=' or '{' after " + keyword + (labels.isEmpty() ? "" : " labels"),
                    cursor.current());
            }
            cursor.advance();
            Body body = parseBody();
            Token end = expect(TokenType.RBRACE, "Expected '}' to close " + keyword + " block");
            return createBlock(keyword, labels, body, start, end);
        }

        private Body parseBody() {
            Body body = new Body();
            while (true) {
                cursor.skipNewlines();
                while (cursor.check(TokenType.COMMA)) {
                    cursor.advance();
                    cursor.skipNewlines();
                }
                if (cursor.check(TokenType.RBRACE) || cursor.isAtEnd()) {
                    return body;
                }

                Token nameToken = cursor.current();
                String name;
                if (nameToken.is(TokenType.IDENTIFIER)) {
                    name = nameToken.value();
                } else if (nameToken.is(TokenType.STRING)) {
                    name = StringLiterals.extractStringContent(nameToken);
                } else {
                    throw syntax("Expected attribute or block name, got " + describe(nameToken), nameToken);
                }
                cursor.advance();

                if (cursor.check(TokenType.EQUALS) || cursor.check(TokenType.COLON)) {
                    cursor.advance();
                    body.attributes().put(name, readAttributeExpression(name, nameToken));
                    continue;
                }

                List<String> labels = readLabels();
                if (!cursor.check(TokenType.LBRACE)) {
                    throw syntax("Expected '=' or '{' after " + name, cursor.current());
                }
                cursor.advance();
                Body nested = parseBody();
                Token end = expect(TokenType.RBRACE, "Expected '}' to close " + name + " block");
                body.nested().add(new NestedBlock(name, labels, nested, location(nameToken, end)));
            }
        }

        private List<String> readLabels() {
            List<String> labels = new ArrayList<>();
            while (cursor.check(TokenType.STRING) || cursor.check(TokenType.IDENTIFIER)) {
                Token label = cursor.advance();
                labels.add(label.is(TokenType.STRING) ? StringLiterals.extractStringContent(label) : label.value());
            }
            return labels;
        }

        private Token expect(TokenType type, String message) {
            if (!cursor.check(type)) {
                throw syntax(message + ", got " + describe(cursor.current()), cursor.current());
            }
            return cursor.advance();
        }

        // ==================== Expressions ====================

        private HclExpression readAttributeExpression(String name, Token nameToken) {
            List<Token> parts = readExpressionTokens();
            if (parts.isEmpty()) {
                throw syntax("Expected expression after '" + name + " ='", cursor.current());
            }
            HclExpression expr = expressionParser.parse(joinTokens(parts));
            errors.addAll(functionValidator.validateAll(expr, location(nameToken, parts.get(parts.size() - 1))));
            return expr;
        }

        /**
         * Reads tokens up to a newline, comma or closing bracket at bracket depth 0.
         */
        private List<Token> readExpressionTokens() {
            List<Token> parts = new ArrayList<>();
            int depth = 0;
            while (!cursor.isAtEnd()) {
                Token token = cursor.current();
                if (depth == 0 && (token.is(TokenType.NEWLINE) || token.is(TokenType.COMMA) || isClosing(token))) {
                    break;
                }
                if (isOpening(token)) {
                    depth++;
                } else if (isClosing(token)) {
                    depth--;
                }
                parts.add(cursor.advance());
            }
            return parts;
        }

        /**
         * Rebuilds expression text from tokens; whitespace between tokens is kept and
         * gaps that held a comment become a single space.
         */
        private String joinTokens(List<Token> parts) {
            StringBuilder sb = new StringBuilder();
            Token previous = null;
            for (Token token : parts) {
                if (previous != null && token.startOffset() > previous.endOffset()) {
                    String gap = source.substring(previous.endOffset(), token.startOffset());
                    sb.append(gap.isBlank() ? gap : " ");
                }
                sb.append(token.value());
                previous = token;
            }
            return sb.toString();
        }

        // ==================== Block construction ====================

        private TerragruntBlock createAttributeBlock(String keyword, HclExpression value, Token start, Token end) {
            SourceLocation location = location(start, end);
            String raw = raw(start, end);
            switch (keyword) {
                case "inputs":
                    if (!(value instanceof ObjectExpr)) {
                        errors.add(ParseError.warning(ErrorCode.INVALID_ATTRIBUTE_VALUE,
                            "inputs should be an object", location));
                    }
                    return new InputsBlock(HclValues.attributes(value), location, raw);
                case "iam_role":
                    return new IamRoleBlock(value, null, null, location, raw);
                default:
                    if (!ATTRIBUTE_KEYWORDS.contains(keyword)) {
                        errors.add(ParseError.warning(ErrorCode.INVALID_BLOCK_TYPE,
                            "Unknown attribute: " + keyword, location));
                    }
                    return new GenericBlock(keyword, List.of(), Map.of(keyword, value), true, location, raw);
            }
        }

        private TerragruntBlock createBlock(String keyword, List<String> labels, Body body, Token start, Token end) {
            SourceLocation location = location(start, end);
            String raw = raw(start, end);
            Optional<BlockKind> kind = BlockKind.fromKeyword(keyword);
            if (kind.isEmpty()) {
                if (!GENERIC_BLOCK_KEYWORDS.contains(keyword)) {
                    errors.add(ParseError.warning(ErrorCode.INVALID_BLOCK_TYPE,
                        "Unknown block type: " + keyword, location));
                }
                return new GenericBlock(keyword, labels, flatten(body), false, location, raw);
            }

            Map<String, HclExpression> attrs = body.attributes();
            String label = labels.isEmpty() ? "" : labels.get(0);
            return switch (kind.get()) {
                case TERRAFORM -> createTerraform(body, location, raw);
                case REMOTE_STATE -> createRemoteState(body, location, raw);
                case INCLUDE -> new IncludeBlock(
                    label,
                    attrs.get("path"),
                    HclValues.bool(attrs.get("expose")).orElse(false),
                    mergeStrategy(attrs.get("merge_strategy"), location),
                    location,
                    raw);
                case LOCALS -> new LocalsBlock(attrs, location, raw);
                case DEPENDENCY -> createDependency(labels, attrs, location, raw);
                case DEPENDENCIES -> new DependenciesBlock(attrs.get("paths"), location, raw);
                case GENERATE -> parseGenerateBlocks ? createGenerate(label, attrs, location, raw) : null;
                case INPUTS -> new InputsBlock(attrs, location, raw);
                case IAM_ROLE -> new IamRoleBlock(
                    attrs.get("role_arn"),
                    HclValues.number(attrs.get("session_duration")).orElse(null),
                    attrs.get("web_identity_token"),
                    location,
                    raw);
                case RETRY_CONFIG -> new RetryConfigBlock(
                    HclValues.stringList(attrs.get("retryable_errors")),
                    HclValues.number(attrs.get("max_retry_attempts"))
                        .orElse(RetryConfigBlock.DEFAULT_MAX_RETRY_ATTEMPTS),
                    HclValues.number(attrs.get("sleep_between_retries"))
                        .orElse(RetryConfigBlock.DEFAULT_SLEEP_BETWEEN_RETRIES),
                    location,
                    raw);
                case GENERIC -> new GenericBlock(keyword, labels, flatten(body), false, location, raw);
            };
        }

        private TerraformBlock createTerraform(Body body, SourceLocation location, String raw) {
            List<ExtraArguments> extraArguments = new ArrayList<>();
            for (NestedBlock nested : body.nestedOfType("extra_arguments")) {
                Map<String, HclExpression> attrs = nested.body().attributes();
                extraArguments.add(new ExtraArguments(
                    nested.firstLabel(),
                    HclValues.stringList(attrs.get("commands")),
                    HclValues.stringList(attrs.get("arguments")),
                    HclValues.attributes(attrs.get("env_vars")),
                    HclValues.stringList(attrs.get("required_var_files")),
                    HclValues.stringList(attrs.get("optional_var_files"))));
            }
            return new TerraformBlock(
                body.attributes().get("source"),
                extraArguments,
                hooks(body, "before_hook", HookType.BEFORE),
                hooks(body, "after_hook", HookType.AFTER),
                hooks(body, "error_hook", HookType.ERROR),
                HclValues.stringList(body.attributes().get("include_in_copy")),
                location,
                raw);
        }

        private List<TerraformHook> hooks(Body body, String type, HookType hookType) {
            List<TerraformHook> hooks = new ArrayList<>();
            for (NestedBlock nested : body.nestedOfType(type)) {
                Map<String, HclExpression> attrs = nested.body().attributes();
                hooks.add(new TerraformHook(
                    hookType,
                    nested.firstLabel(),
                    HclValues.stringList(attrs.get("commands")),
                    HclValues.stringList(attrs.get("execute")),
                    HclValues.bool(attrs.get("run_on_error")).orElse(false),
                    HclValues.string(attrs.get("working_dir")).orElse(null)));
            }
            return hooks;
        }

        private RemoteStateBlock createRemoteState(Body body, SourceLocation location, String raw) {
            Map<String, HclExpression> attrs = body.attributes();

            Map<String, HclExpression> generateAttrs = attrs.containsKey("generate")
                ? HclValues.attributes(attrs.get("generate"))
                : body.nestedOfType("generate").stream().findFirst()
                    .map(n -> n.body().attributes())
                    .orElse(null);
            RemoteStateGenerate generate = generateAttrs == null ? null : new RemoteStateGenerate(
                HclValues.string(generateAttrs.get("path")).orElse(null),
                HclValues.string(generateAttrs.get("if_exists")).orElse(null));

            Map<String, HclExpression> config = new LinkedHashMap<>();
            if (attrs.containsKey("config")) {
                config.putAll(HclValues.attributes(attrs.get("config")));
            }
            body.nestedOfType("config").forEach(n -> config.putAll(flatten(n.body())));

            return new RemoteStateBlock(
                HclValues.string(attrs.get("backend")).orElse(null),
                generate,
                config,
                HclValues.bool(attrs.get("disable_init")).orElse(false),
                HclValues.bool(attrs.get("disable_dependency_optimization")).orElse(false),
                location,
                raw);
        }

        private DependencyBlock createDependency(
                List<String> labels, Map<String, HclExpression> attrs, SourceLocation location, String raw) {
            if (labels.isEmpty()) {
                errors.add(ParseError.error(ErrorCode.MISSING_REQUIRED_ATTRIBUTE,
                    "dependency block requires a name label", location));
            }
            MergeStrategy mockStrategy = mergeStrategy(attrs.get("mock_outputs_merge_strategy_with_state"), location);
            return new DependencyBlock(
                labels.isEmpty() ? "" : labels.get(0),
                attrs.get("config_path"),
                HclValues.bool(attrs.get("skip_outputs")).orElse(false),
                HclValues.attributes(attrs.get("mock_outputs")),
                mockStrategy,
                HclValues.stringList(attrs.get("mock_outputs_allowed_terraform_commands")),
                location,
                raw);
        }

        private GenerateBlock createGenerate(
                String label, Map<String, HclExpression> attrs, SourceLocation location, String raw) {
            return new GenerateBlock(
                label,
                attrs.get("path"),
                attrs.get("contents"),
                HclValues.string(attrs.get("if_exists")).orElse(null),
                HclValues.string(attrs.get("comment_prefix")).orElse(null),
                HclValues.bool(attrs.get("disable_signature")).orElse(false),
                location,
                raw);
        }

        private MergeStrategy mergeStrategy(HclExpression expr, SourceLocation location) {
            Optional<String> value = HclValues.string(expr);
            if (value.isEmpty()) {
                return MergeStrategy.NO_MERGE;
            }
            return MergeStrategy.fromWireName(value.get()).orElseGet(() -> {
                errors.add(ParseError.warning(ErrorCode.INVALID_ATTRIBUTE_VALUE,
                    "Unknown merge strategy '" + value.get() + "', using no_merge", location));
                return MergeStrategy.NO_MERGE;
            });
        }

        /**
         * Attributes of a body with nested blocks folded in as object values.
         */
        private Map<String, HclExpression> flatten(Body body) {
            Map<String, HclExpression> result = new LinkedHashMap<>(body.attributes());
            for (NestedBlock nested : body.nested()) {
                result.put(nested.type(), new ObjectExpr(flatten(nested.body()), ""));
            }
            return result;
        }

        // ==================== Helpers ====================

        private SourceLocation location(Token start, Token end) {
            return new SourceLocation(file, start.line(), start.column(), end.endLine(), end.endColumn());
        }

        private String raw(Token start, Token end) {
            if (!includeRaw || end.endOffset() < start.startOffset()) {
                return "";
            }
            return source.substring(start.startOffset(), end.endOffset());
        }

        private TerragruntSyntaxException syntax(String message, Token at) {
            return new TerragruntSyntaxException(ErrorCode.SYNTAX_ERROR, message,
                SourceLocation.at(file, at.line(), at.column()));
        }
    }

    private static boolean isOpening(Token token) {
        return token.is(TokenType.LBRACE) || token.is(TokenType.LBRACKET) || token.is(TokenType.LPAREN)
            || token.is(TokenType.INTERPOLATION) || token.is(TokenType.DIRECTIVE);
    }

    private static boolean isClosing(Token token) {
        return token.is(TokenType.RBRACE) || token.is(TokenType.RBRACKET) || token.is(TokenType.RPAREN);
    }

    private static String describe(Token token) {
        if (token.is(TokenType.EOF)) {
            return "end of file";
        }
        if (token.is(TokenType.NEWLINE)) {
            return "newline";
        }
        return "'" + token.value() + "'";
    }
}
