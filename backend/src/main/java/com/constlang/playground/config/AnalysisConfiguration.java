package com.constlang.playground.config;

import com.constlang.playground.grammar.Grammar;
import com.constlang.playground.lexer.KeywordCorrector;
import com.constlang.playground.lexer.Scanner;
import com.constlang.playground.repair.DiagnosticsBuilder;
import com.constlang.playground.repair.RepairSearchEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The scanner, grammar and repair engine are immutable and shared by all requests.
 */
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisConfiguration {

    @Bean
    public Scanner scanner() {
        return new Scanner(new KeywordCorrector());
    }

    @Bean
    public Grammar grammar() {
        return Grammar.constDeclaration();
    }

    @Bean
    public RepairSearchEngine repairSearchEngine(Grammar grammar, AnalysisProperties properties) {
        return new RepairSearchEngine(
            grammar,
            new DiagnosticsBuilder(),
            properties.maxEditCount(),
            properties.maxExpandedBranches()
        );
    }
}
