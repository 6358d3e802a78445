package io.github.cyfko.texml.spring.controller;

import io.github.cyfko.texml.core.api.CompileResult;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.spring.service.TexmlService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * REST access to the compiler.
 *
 * <pre>
 * POST /texml/compile
 * {"latex": "\\frac{1}{2}", "display": true}
 *
 * 200 {"mathml": "&lt;math ...&gt;...&lt;/math&gt;"}
 * 400 {"kind": "UnexpectedEof", "message": "...", "position": 2, "formatted": "..."}
 * </pre>
 *
 * <p>The base path comes from {@code texml.endpoint.path}.</p>
 */
@RestController
@RequestMapping("${texml.endpoint.path:/texml}")
public class TexmlController {
    private static final Logger LOGGER = Logger.getLogger(TexmlController.class.getName());

    static final String INVALID_REQUEST = "InvalidRequest";

    private final TexmlService texmlService;

    public TexmlController(TexmlService texmlService) {
        this.texmlService = texmlService;
    }

    @PostMapping(path = "/compile", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> compile(@RequestBody CompileRequest request) {
        if (request == null || request.latex() == null) {
            LOGGER.warning("Rejected compile request without latex");
            return ResponseEntity.badRequest()
                    .body(new CompileErrorResponse(INVALID_REQUEST, "Field 'latex' is required", -1, ""));
        }

        boolean display = request.display() != null
                ? request.display()
                : texmlService.defaultOptions().displayStyle();
        MathMLOptions options = MathMLOptions.builder().displayStyle(display).build();

        CompileResult result = texmlService.tryCompile(request.latex(), options);
        if (result.isSuccess()) {
            return ResponseEntity.ok(new CompileResponse(result.getMathml()));
        }
        return ResponseEntity.badRequest().body(CompileErrorResponse.of(result.getError(), request.latex()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CompileErrorResponse> unreadable(HttpMessageNotReadableException e) {
        LOGGER.log(Level.WARNING, "Unreadable compile request", e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new CompileErrorResponse(INVALID_REQUEST, "Malformed JSON body", -1, ""));
    }
}
