package com.tgarchitect.core.parser;

import com.tgarchitect.core.config.ParserConfig;
import com.tgarchitect.core.config.TerragruntConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.expression.ExpressionParser;
import com.tgarchitect.core.expression.FunctionCallValidator;
import com.tgarchitect.core.lexer.LexResult;
import com.tgarchitect.core.lexer.TerragruntLexer;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.TerragruntFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for parsing Terragrunt files.
 *
 * <p>Runs the lexer and the block parser and packs the result into an immutable
 * {@link TerragruntFile}. Include and dependency paths are left unresolved; see
 * {@link com.tgarchitect.core.resolver.IncludeResolver}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TerragruntParser parser = TerragruntParser.create(ParserConfig.defaults());
 * TerragruntFile file = parser.parseFile(Path.of("live/prod/vpc/terragrunt.hcl"));
 * file.terraformBlock().flatMap(TerraformBlock::sourceString).ifPresent(System.out::println);
 * }</pre>
 *
 * <p>Instances are thread-safe: every call lexes with a fresh {@link TerragruntLexer}.
 *
 * @since 1.0.0
 */
public class TerragruntParser {

    private static final Logger log = LoggerFactory.getLogger(TerragruntParser.class);

    private final ParserConfig config;
    private final BlockParser blockParser;
    private final Charset charset;
    private final ParseCache cache;

    private TerragruntParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        ExpressionParser expressionParser = new ExpressionParser(config.includeRaw(), ExpressionParser.DEFAULT_MAX_DEPTH);
        this.blockParser = new BlockParser(
            expressionParser,
            new FunctionCallValidator(expressionParser, config.strictFunctions()),
            config.errorRecovery() ? ErrorRecoveryStrategy.skipToBlockBoundary() : ErrorRecoveryStrategy.failFast(),
            config.includeRaw(),
            config.parseGenerateBlocks());
        this.charset = Charset.forName(config.encoding());
        this.cache = config.enableCache() ? new ParseCache(config.maxCacheSize(), config.cacheTtlMs()) : null;
    }

    public static TerragruntParser create(ParserConfig config) {
        return new TerragruntParser(config);
    }

    public static TerragruntParser create(TerragruntConfig config) {
        return new TerragruntParser(config.parser());
    }

    public static TerragruntParser create() {
        return new TerragruntParser(ParserConfig.defaults());
    }

    /**
     * Parses file content.
     *
     * @param content file content
     * @param path path recorded in the result and in error locations
     * @return parsed file, never null
     */
    public TerragruntFile parse(String content, String path) {
        LexResult lexed = new TerragruntLexer().tokenize(content, path);
        BlockParseResult parsed = blockParser.parse(lexed.filterForParsing(), content, path);

        List<ParseError> errors = new ArrayList<>(lexed.errors());
        errors.addAll(parsed.errors());
        if (parsed.aborted()) {
            log.debug("Parsing of {} stopped at the first error", path);
        }
        log.debug("Parsed {}: {} blocks, {} findings", path, parsed.blocks().size(), errors.size());
        return new TerragruntFile(path, parsed.blocks(), List.of(), List.of(), errors, config.encoding(), content.length());
    }

    /**
     * Reads and parses a file.
     *
     * <p>Files larger than {@code maxFileSize} and unreadable files produce a result with
     * no blocks and a single error.
     *
     * @param path file to read
     * @return parsed file, never null
     */
    public TerragruntFile parseFile(Path path) {
        String pathString = path.toString();
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", path, e.getMessage());
            return failed(pathString, ErrorCode.FILE_READ_ERROR, "Cannot read file: " + e.getMessage(), 0);
        }

        long size = attributes.size();
        if (size > config.maxFileSize()) {
            return failed(pathString, ErrorCode.FILE_TOO_LARGE,
                "File size " + size + " exceeds limit of " + config.maxFileSize() + " bytes", size);
        }

        long modified = attributes.lastModifiedTime().toMillis();
        if (cache != null) {
            Optional<TerragruntFile> cached = cache.get(pathString, size, modified);
            if (cached.isPresent()) {
                log.debug("Cache hit for {}", path);
                return cached.get();
            }
        }

        String content;
        try {
            content = Files.readString(path, charset);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", path, e.getMessage());
            return failed(pathString, ErrorCode.FILE_READ_ERROR, "Cannot read file: " + e.getMessage(), size);
        }

        TerragruntFile file = parse(content, pathString);
        if (cache != null) {
            cache.put(pathString, size, modified, file);
        }
        return file;
    }

    /**
     * Checks whether a file looks like a Terragrunt configuration.
     *
     * @param path file path
     * @param content file content, may be null
     * @return true if the file should be parsed
     */
    public boolean canParse(Path path, String content) {
        return TerragruntFileDetector.canParse(path, content);
    }

    public ParserConfig getConfig() {
        return config;
    }

    /**
     * Drops cached parse results.
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    int cachedFileCount() {
        return cache == null ? 0 : cache.size();
    }

    private TerragruntFile failed(String path, ErrorCode code, String message, long size) {
        ParseError error = ParseError.error(code, message, SourceLocation.at(path, 1, 1));
        return new TerragruntFile(path, List.of(), List.of(), List.of(), List.of(error), config.encoding(), size);
    }
}
