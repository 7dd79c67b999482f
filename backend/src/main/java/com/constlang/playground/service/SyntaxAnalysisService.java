package com.constlang.playground.service;

import com.constlang.playground.config.AnalysisProperties;
import com.constlang.playground.dto.SyntaxAnalysisRequest;
import com.constlang.playground.dto.SyntaxAnalysisResponse;
import com.constlang.playground.dto.SyntaxDiagnostic;
import com.constlang.playground.dto.SyntaxToken;
import com.constlang.playground.lexer.Diagnostic;
import com.constlang.playground.lexer.ScanResult;
import com.constlang.playground.lexer.Scanner;
import com.constlang.playground.lexer.Token;
import com.constlang.playground.repair.EditOp;
import com.constlang.playground.repair.RepairResult;
import com.constlang.playground.repair.RepairSearchEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

@Service
public class SyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisService.class);

    private final Scanner scanner;
    private final RepairSearchEngine repairSearchEngine;
    private final AnalysisProperties properties;

    public SyntaxAnalysisService(Scanner scanner, RepairSearchEngine repairSearchEngine,
            AnalysisProperties properties) {
        this.scanner = scanner;
        this.repairSearchEngine = repairSearchEngine;
        this.properties = properties;
    }

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();

        try {
            String sourceCode = sanitizeInput(request.sourceCode());
            logger.info("=== Starting syntax analysis for {} characters of code ===", sourceCode.length());

            if (sourceCode.length() > properties.maxSourceCodeLength()) {
                logger.warn("Rejected source of {} characters (limit {})",
                        sourceCode.length(), properties.maxSourceCodeLength());
                return SyntaxAnalysisResponse.error(
                        "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters",
                        System.currentTimeMillis() - startTime);
            }

            ScanResult scan = scanner.tokenize(sourceCode);
            logger.info("Lexical analysis produced {} tokens and {} diagnostics",
                    scan.tokens().size(), scan.diagnostics().size());

            RepairResult repair = repairSearchEngine.validate(scan.tokens());
            logger.info("Repair search finished: edits={}, budgetExceeded={}, branches={}",
                    repair.edits().size(), repair.budgetExceeded(), repair.expandedBranches());

            List<SyntaxToken> tokens = toSyntaxTokens(repair);
            if (logger.isDebugEnabled()) {
                logger.debug("=== FINAL TOKEN MAPPING ===");
                for (int i = 0; i < tokens.size(); i++) {
                    SyntaxToken token = tokens.get(i);
                    logger.debug("Token {}: '{}' -> {} at [{}:{}-{}:{}]{}",
                            i,
                            token.value(),
                            token.tokenType(),
                            token.startLine(),
                            token.startColumn(),
                            token.endLine(),
                            token.endColumn(),
                            token.synthetic() ? " (synthetic)" : "");
                }
                logger.debug("=== END TOKEN MAPPING ===");
            }

            List<Diagnostic> all = new ArrayList<>(scan.diagnostics());
            all.addAll(repair.diagnostics());
            List<SyntaxDiagnostic> diagnostics = all.stream()
                    .map(SyntaxDiagnostic::of)
                    .toList();

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("=== Syntax analysis completed in {}ms with {} tokens and {} diagnostics ===",
                    analysisTime, tokens.size(), diagnostics.size());

            return SyntaxAnalysisResponse.success(
                    tokens,
                    diagnostics,
                    repair.edits().size(),
                    repair.budgetExceeded(),
                    analysisTime);

        } catch (Exception e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Syntax analysis failed", e);
            return SyntaxAnalysisResponse.error(
                    "Syntax analysis failed: " + e.getMessage(),
                    analysisTime);
        }
    }

    private List<SyntaxToken> toSyntaxTokens(RepairResult repair) {
        Set<Token> synthetic = Collections.newSetFromMap(new IdentityHashMap<>());
        for (EditOp edit : repair.edits()) {
            if (edit instanceof EditOp.Insert insert) {
                synthetic.add(insert.token());
            } else if (edit instanceof EditOp.Replace replace) {
                synthetic.add(replace.newToken());
            }
        }
        return repair.tokens().stream()
                .map(token -> SyntaxToken.of(token, synthetic.contains(token)))
                .toList();
    }

    private String sanitizeInput(String input) {
        if (input == null)
            return "";

        return input.replace("\0", "")
                .replace("\r\n", "\n")
                .replace("\r", "\n");
    }
}
