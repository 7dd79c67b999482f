package com.constlang.playground.controller;

import com.constlang.playground.dto.SyntaxAnalysisRequest;
import com.constlang.playground.dto.SyntaxAnalysisResponse;
import com.constlang.playground.service.SyntaxAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/syntax")
@Validated
public class SyntaxAnalysisController {
    
    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisController.class);
    
    private final SyntaxAnalysisService syntaxAnalysisService;
    
    public SyntaxAnalysisController(SyntaxAnalysisService syntaxAnalysisService) {
        this.syntaxAnalysisService = syntaxAnalysisService;
    }
    
    @PostMapping("/analyze")
    public ResponseEntity<SyntaxAnalysisResponse> analyzeSyntax(@Valid @RequestBody SyntaxAnalysisRequest request) {
        try {
            logger.debug("Received syntax analysis request for {} characters", 
                request.sourceCode().length());
            
            SyntaxAnalysisResponse response = syntaxAnalysisService.analyzeSyntax(request);
            
            logger.debug("Syntax analysis completed: success={}, tokens={}, diagnostics={}", 
                response.success(), response.tokens().size(), response.diagnostics().size());
            
            return ResponseEntity.ok(response);
            
        } catch (Exception e) {
            logger.error("Unexpected error during syntax analysis", e);
            return ResponseEntity.internalServerError()
                .body(SyntaxAnalysisResponse.error("Internal server error: " + e.getMessage(), 0));
        }
    }
    
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Syntax analysis service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SyntaxAnalysisResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(SyntaxAnalysisResponse.error(errorMessage.toString(), 0));
    }
}
