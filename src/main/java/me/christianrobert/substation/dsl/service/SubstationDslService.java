package me.christianrobert.substation.dsl.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.substation.config.service.ConfigService;
import me.christianrobert.substation.dsl.builder.SubstationIrBuilder;
import me.christianrobert.substation.dsl.context.CompilationResult;
import me.christianrobert.substation.dsl.context.SemanticException;
import me.christianrobert.substation.dsl.context.ValidationException;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.parser.AntlrParser;
import me.christianrobert.substation.dsl.parser.ParseException;
import me.christianrobert.substation.dsl.parser.ParseResult;
import me.christianrobert.substation.dsl.util.AstTreeFormatter;
import me.christianrobert.substation.dsl.util.IrJsonWriter;
import me.christianrobert.substation.dsl.validation.SubstationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front end for substation DSL scripts.
 *
 * <p>Architecture:
 * <pre>
 * DSL text → ANTLR Parse (script) → SubstationIrBuilder → SubstationIr → SubstationValidator
 *                 ↓                         ↓                                    ↓
 *         SubstationDslParser        Static Visit* helpers            first E.* violation
 * </pre>
 *
 * <p>{@link #parse} and {@link #validate} throw on the first error. {@link #compile} runs the
 * whole pipeline and reports the outcome as a {@link CompilationResult} instead.</p>
 *
 * <p>Stateless apart from configuration; every call uses its own parser and builder.</p>
 */
@ApplicationScoped
public class SubstationDslService {

    private static final Logger log = LoggerFactory.getLogger(SubstationDslService.class);

    @Inject
    AntlrParser parser;

    @Inject
    SubstationValidator validator;

    @Inject
    ConfigService configService;

    private final IrJsonWriter irJsonWriter = new IrJsonWriter();

    /**
     * Parses DSL text and builds the IR. Does not validate.
     *
     * @param text DSL script (may be empty)
     * @return the immutable IR
     * @throws ParseException on the first syntax error
     * @throws SemanticException on the first transform-time error (duplicate or missing id, ...)
     */
    public SubstationIr parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("DSL text cannot be null");
        }
        log.trace("DSL source: {}", text);

        ParseResult parseResult = parser.parseScript(text,
                configService.isEnabled(ConfigService.PARSER_TWO_STAGE, true));
        log.debug("Parsed {} statements ({})", parseResult.getStatementCount(), parseResult.getPredictionMode());

        SubstationIr ir = new SubstationIrBuilder().build(parseResult.getTree());
        log.debug("Built IR: {}", ir);
        return ir;
    }

    /**
     * Validates an IR, adding the strict reference rules when {@code validation.strict-references} is set.
     *
     * @throws ValidationException on the first violated rule
     */
    public void validate(SubstationIr ir) {
        validator.validate(ir, configService.isEnabled(ConfigService.VALIDATION_STRICT_REFERENCES, false));
    }

    /**
     * Compiles a script without AST output.
     */
    public CompilationResult compile(String text) {
        return compile(text, false);
    }

    /**
     * Parses, builds and (when requested) validates a script.
     *
     * <p>Validation runs if the script contains {@code VALIDATE} or {@code validation.always} is set.</p>
     *
     * @param text DSL script
     * @param includeAst Whether to include the syntax tree in the result (for debugging)
     * @return CompilationResult with the IR or the first error; never throws for DSL errors
     */
    public CompilationResult compile(String text, boolean includeAst) {
        if (text == null) {
            return CompilationResult.failure("DSL text cannot be null");
        }

        log.info("Compiling DSL script: {}", preview(text));

        String astTree = null;
        try {
            // STEP 1: Parse
            ParseResult parseResult = parser.parseScript(text,
                    configService.isEnabled(ConfigService.PARSER_TWO_STAGE, true));
            if (includeAst) {
                astTree = AstTreeFormatter.format(parseResult.getTree());
            }

            // STEP 2: Build IR
            SubstationIr ir = new SubstationIrBuilder().build(parseResult.getTree());
            log.debug("Built IR: {}", ir);

            // STEP 3: Validate on request
            boolean validated = false;
            if (ir.isValidateRequested() || configService.isEnabled(ConfigService.VALIDATION_ALWAYS, false)) {
                validate(ir);
                validated = true;
            }

            log.info("Compiled {} objects and {} chains (validated={})", ir.objectCount(), ir.chainCount(), validated);
            return CompilationResult.success(ir, irJsonWriter.write(ir), validated, astTree);

        } catch (ParseException e) {
            log.warn("Syntax error at line {}, column {}", e.getLine(), e.getColumn());
            log.debug("Parse failure detail:\n{}", e.getMessage());
            return CompilationResult.failure(e);

        } catch (SemanticException e) {
            log.warn("Compilation failed: {}", e.getDetailedMessage());
            return CompilationResult.failure(e, astTree);

        } catch (Exception e) {
            log.error("Unexpected error during compilation", e);
            return CompilationResult.failure("Unexpected error: " + e.getMessage());
        }
    }

    private String preview(String text) {
        int max = configService.getConfigValueAsInt(ConfigService.PARSER_MAX_SOURCE_PREVIEW, 100);
        String flat = text.strip().replaceAll("\\s+", " ");
        return flat.length() <= max ? flat : flat.substring(0, Math.max(0, max)) + "...";
    }
}
