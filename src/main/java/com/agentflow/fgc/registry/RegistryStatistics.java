package com.agentflow.fgc.registry;

import java.util.Map;

/** Summary of what a registry can convert. */
public record RegistryStatistics(int totalConverters, int totalAliases, int deprecatedConverters,
        Map<String, Integer> convertersByCategory) {
}
