package com.constlang.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxAnalysisResponse(
        boolean success,
        List<SyntaxToken> tokens,
        List<SyntaxDiagnostic> diagnostics,
        int errorCount,
        int repairCount,
        boolean budgetExceeded,
        String summary,
        String error,
        long analysisTimeMs) {

    public static SyntaxAnalysisResponse success(
            List<SyntaxToken> tokens,
            List<SyntaxDiagnostic> diagnostics,
            int repairCount,
            boolean budgetExceeded,
            long analysisTimeMs) {
        return new SyntaxAnalysisResponse(
                true,
                tokens,
                diagnostics,
                diagnostics.size(),
                repairCount,
                budgetExceeded,
                summarize(diagnostics.size(), repairCount),
                null,
                analysisTimeMs);
    }

    public static SyntaxAnalysisResponse error(String error, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(
                false,
                List.of(),
                List.of(),
                0,
                0,
                false,
                null,
                error,
                analysisTimeMs);
    }

    private static String summarize(int errorCount, int repairCount) {
        if (errorCount == 0) {
            return "Analysis completed successfully";
        }
        return "Found " + errorCount + " issue(s), " + repairCount + " auto-repair(s)";
    }
}
