package me.christianrobert.substation.dsl.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.substation.dsl.context.CompilationResult;
import me.christianrobert.substation.dsl.service.SubstationDslService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for compiling substation DSL scripts into IR.
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/substation/compile" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary @substation.dsl
 *
 * # include the syntax tree
 * curl -X POST "http://localhost:8080/api/substation/compile?showAst=true" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary $'ADD_BUS id=b1, kv=138\nVALIDATE'
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": false,
 *   "errorCode": "E.PROT.BRK_UNUSED",
 *   "errorMessage": "E.PROT.BRK_UNUSED: Breaker brk1 is not connected.",
 *   "line": 2,
 *   "column": 1,
 *   ...
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A script with errors is a valid business outcome, not an HTTP error.
 */
@Path("/api/substation")
@Produces(MediaType.APPLICATION_JSON)
public class SubstationDslResource {

    private static final Logger log = LoggerFactory.getLogger(SubstationDslResource.class);

    @Inject
    SubstationDslService substationDslService;

    /**
     * Compiles a DSL script.
     *
     * @param showAst Optional flag to include the syntax tree in the response
     * @param script DSL text (text/plain body)
     * @return CompilationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Path("/compile")
    @Consumes(MediaType.TEXT_PLAIN)
    public CompilationResult compile(
            @QueryParam("showAst") @DefaultValue("false") boolean showAst,
            String script
    ) {
        log.info("DSL compile request received via REST API");

        if (script == null || script.trim().isEmpty()) {
            log.warn("Empty DSL script received");
            return CompilationResult.failure("DSL script cannot be empty");
        }

        CompilationResult result = substationDslService.compile(script, showAst);

        if (result.isSuccess()) {
            log.info("DSL compilation succeeded: {} objects, {} chains",
                    result.getObjectCount(), result.getChainCount());
            if (result.hasAstTree()) {
                log.debug("AST tree included in response");
            }
        } else {
            log.warn("DSL compilation failed: {}", result.getErrorCode());
        }

        return result;
    }
}
