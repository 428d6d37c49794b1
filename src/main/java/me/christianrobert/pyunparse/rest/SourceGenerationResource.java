package me.christianrobert.pyunparse.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.pyunparse.config.service.ConfigService;
import me.christianrobert.pyunparse.context.GenerationResult;
import me.christianrobert.pyunparse.service.SourceGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint turning a JSON syntax tree into Python source.
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/source/generate?indent=2&amp;lineInfo=true" \
 *   -H "Content-Type: application/json" --data @tree.json
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "source": "...",
 *   "errorMessage": null,
 *   "kind": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * An unsupported or malformed tree is a valid business outcome, not an HTTP error.
 */
@Path("/api/source")
@Produces(MediaType.APPLICATION_JSON)
public class SourceGenerationResource {

    private static final Logger log = LoggerFactory.getLogger(SourceGenerationResource.class);

    static final int MAX_INDENT = 16;

    @Inject
    SourceGenerationService generationService;

    @Inject
    ConfigService configService;

    /**
     * Generates Python source from a JSON tree.
     *
     * @param indent Optional indentation width in spaces (defaults to the configured unit)
     * @param lineInfo Optional line annotation toggle (defaults to the configured setting)
     * @param jsonTree Tree in JSON form
     * @return GenerationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Path("/generate")
    @Consumes(MediaType.APPLICATION_JSON)
    public GenerationResult generate(
            @QueryParam("indent") Integer indent,
            @QueryParam("lineInfo") Boolean lineInfo,
            String jsonTree
    ) {
        log.info("Source generation request received via REST API (indent={}, lineInfo={})", indent, lineInfo);
        log.trace("Tree JSON: {}", jsonTree);

        if (jsonTree == null || jsonTree.trim().isEmpty()) {
            log.warn("Empty tree received");
            return GenerationResult.failure("Tree JSON cannot be empty");
        }

        if (indent != null && (indent < 1 || indent > MAX_INDENT)) {
            log.warn("Invalid indent width: {}", indent);
            return GenerationResult.failure("Invalid indent: " + indent + ". Must be between 1 and " + MAX_INDENT);
        }

        String indentWith = indent != null ? " ".repeat(indent) : configService.getIndentWith();
        boolean addLineInformation = lineInfo != null ? lineInfo : configService.isAddLineInformation();

        GenerationResult result = generationService.generate(jsonTree, indentWith, addLineInformation);

        if (result.isSuccess()) {
            log.info("Source generation succeeded");
        } else {
            log.warn("Source generation failed: {}", result.getErrorMessage());
        }
        return result;
    }
}
