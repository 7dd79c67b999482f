package com.constlang.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "constlang.analysis")
@Validated
public record AnalysisProperties(
    @Positive
    @DefaultValue("15")
    Integer maxEditCount,

    @Positive
    @DefaultValue("100000")
    Integer maxExpandedBranches,

    @Positive
    @DefaultValue("10000")
    Integer maxSourceCodeLength
) {
}
