package me.christianrobert.pyunparse.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.pyunparse.config.service.ConfigService;
import me.christianrobert.pyunparse.context.GenerationResult;
import me.christianrobert.pyunparse.context.SourceGenerationException;
import me.christianrobert.pyunparse.generator.SourceGenerator;
import me.christianrobert.pyunparse.ingest.AstJsonReader;
import me.christianrobert.pyunparse.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level service turning a JSON syntax tree into Python source.
 * This is the entry point used by the REST endpoint.
 *
 * <p>Architecture:
 * <pre>
 * JSON tree → AstJsonReader → SyntaxNode tree → SourceGenerator → Python source
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * GenerationResult result = service.generate(jsonTree);
 * if (result.isSuccess()) {
 *     String source = result.getSource();
 * } else {
 *     // result.getErrorMessage(), result.getKind()
 * }
 * </pre>
 *
 * <p>Failures never leak partial source: the result carries either the complete text or the
 * error message and the kind of the offending node.</p>
 */
@ApplicationScoped
public class SourceGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SourceGenerationService.class);

    @Inject
    ConfigService configService;

    @Inject
    AstJsonReader reader;

    private final SourceGenerator generator = new SourceGenerator();

    /**
     * Generates source using the configured indentation unit and line annotation setting.
     *
     * @param jsonTree Tree in JSON form
     * @return GenerationResult containing either the source or error details
     */
    public GenerationResult generate(String jsonTree) {
        return generate(jsonTree, configService.getIndentWith(), configService.isAddLineInformation());
    }

    /**
     * Generates source with explicit options.
     *
     * @param jsonTree Tree in JSON form
     * @param indentWith Indentation unit; null falls back to the configured one
     * @param addLineInformation Whether statements get {@code # line: n} annotations
     * @return GenerationResult containing either the source or error details
     */
    public GenerationResult generate(String jsonTree, String indentWith, boolean addLineInformation) {
        if (jsonTree == null || jsonTree.trim().isEmpty()) {
            return GenerationResult.failure("Tree JSON cannot be null or empty");
        }
        String indent = indentWith != null ? indentWith : configService.getIndentWith();

        try {
            log.debug("Step 1: Reading syntax tree");
            SyntaxNode tree = reader.read(jsonTree);

            log.debug("Step 2: Generating source (lineInfo={})", addLineInformation);
            String source = generator.generate(tree, indent, addLineInformation);

            log.info("Source generation succeeded ({} characters)", source.length());
            log.trace("Generated source:\n{}", source);
            return GenerationResult.success(source);

        } catch (SourceGenerationException e) {
            log.warn("Source generation failed: {}", e.getDetailedMessage());
            return GenerationResult.failure(e);

        } catch (Exception e) {
            log.error("Unexpected error during source generation", e);
            return GenerationResult.failure("Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Generates source for a tree that is already built.
     */
    public GenerationResult generate(SyntaxNode tree) {
        if (tree == null) {
            return GenerationResult.failure("Tree cannot be null");
        }
        try {
            return GenerationResult.success(generator.generate(tree, configService.getIndentWith(),
                    configService.isAddLineInformation()));
        } catch (SourceGenerationException e) {
            log.warn("Source generation failed: {}", e.getDetailedMessage());
            return GenerationResult.failure(e);
        } catch (Exception e) {
            log.error("Unexpected error during source generation", e);
            return GenerationResult.failure("Unexpected error: " + e.getMessage());
        }
    }
}
