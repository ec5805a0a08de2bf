package com.agentflow.fgc.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.agentflow.fgc.api.Converter;
import com.agentflow.fgc.api.IssueType;
import com.agentflow.fgc.api.Severity;
import com.agentflow.fgc.api.ValidationIssue;
import com.agentflow.fgc.convert.langchain.LangchainConverters;
import com.agentflow.fgc.ir.IRNode;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable map from node type to {@link Converter}.
 *
 * <p>
 * Built once with {@link Builder} before any conversion runs and shared
 * read-only afterwards, so concurrent lookups need no synchronization.
 * Binding a type or alias twice is a configuration error raised at build time.
 */
@Log4j2
public final class ConverterRegistry {
    private final Map<String, Converter> converters;
    private final Map<String, String> aliases;

    private ConverterRegistry(Map<String, Converter> converters, Map<String, String> aliases) {
        this.converters = Collections.unmodifiableMap(converters);
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Registry holding the built-in LangChain catalog. */
    public static ConverterRegistry builtIns() {
        return builder().registerAll(LangchainConverters.all()).build();
    }

    /** Looks up by primary type, then by alias. Returns null when nothing is bound. */
    public Converter converterFor(String nodeType) {
        if (nodeType == null)
            return null;
        Converter c = converters.get(nodeType);
        if (c != null)
            return c;
        String primary = aliases.get(nodeType);
        return primary == null ? null : converters.get(primary);
    }

    /** Converter for the node, or null if none is bound or the bound one refuses it. */
    public Converter converterFor(IRNode node) {
        Converter c = converterFor(node.type());
        if (c == null || !c.canConvert(node))
            return null;
        if (c.isDeprecated())
            log.warn("Node {} uses deprecated type '{}'{}", node.id(), node.type(),
                    c.replacementType() == null ? "" : ", use '" + c.replacementType() + "'");
        return c;
    }

    public boolean isSupported(String nodeType) {
        return converterFor(nodeType) != null;
    }

    public Set<String> registeredTypes() {
        return converters.keySet();
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    public int size() {
        return converters.size();
    }

    public Map<String, List<String>> convertersByCategory() {
        Map<String, List<String>> byCategory = new TreeMap<>();
        for (Converter c : converters.values())
            byCategory.computeIfAbsent(c.category(), k -> new ArrayList<>()).add(c.nodeType());
        return byCategory;
    }

    /** Primary types and aliases, sorted. */
    public Set<String> supportedTypes() {
        Set<String> all = new TreeSet<>(converters.keySet());
        all.addAll(aliases.keySet());
        return all;
    }

    /** Reports nodes no converter accepts, one {@code UNSUPPORTED_TYPE} warning each. */
    public List<ValidationIssue> checkSupport(List<IRNode> nodes) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (IRNode node : nodes) {
            Converter c = converterFor(node.type());
            if (c == null || !c.canConvert(node))
                issues.add(unsupported(node));
        }
        return issues;
    }

    public static ValidationIssue unsupported(IRNode node) {
        return ValidationIssue.builder()
                .type(IssueType.UNSUPPORTED_TYPE)
                .message("No converter for node type '" + node.type() + "' (node '" + node.id() + "')")
                .nodeId(node.id())
                .severity(Severity.MEDIUM)
                .fixSuggestion("Register a converter for '" + node.type() + "' or remove the node")
                .build();
    }

    public RegistryStatistics statistics() {
        Map<String, Integer> byCategory = new TreeMap<>();
        int deprecated = 0;
        for (Converter c : converters.values()) {
            byCategory.merge(c.category(), 1, Integer::sum);
            if (c.isDeprecated())
                deprecated++;
        }
        return new RegistryStatistics(converters.size(), aliases.size(), deprecated, byCategory);
    }

    /** Collects converters; {@link #build()} freezes them. */
    public static final class Builder {
        private final Map<String, Converter> converters = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();

        public Builder register(Converter converter) {
            String type = converter.nodeType();
            if (type == null || type.isBlank())
                throw new IllegalArgumentException("Converter " + converter.getClass().getName() + " has no node type");
            if (isBound(type))
                throw new IllegalArgumentException("Duplicate converter for node type: " + type);
            for (String alias : converter.aliases())
                if (isBound(alias) || alias.equals(type))
                    throw new IllegalArgumentException("Alias already bound: " + alias + " (for " + type + ")");

            converters.put(type, converter);
            for (String alias : converter.aliases())
                aliases.put(alias, type);
            return this;
        }

        public Builder registerAll(Iterable<? extends Converter> list) {
            for (Converter c : list)
                register(c);
            return this;
        }

        private boolean isBound(String type) {
            return converters.containsKey(type) || aliases.containsKey(type);
        }

        public ConverterRegistry build() {
            log.debug("Converter registry built: {} types, {} aliases", converters.size(), aliases.size());
            return new ConverterRegistry(new LinkedHashMap<>(converters), new LinkedHashMap<>(aliases));
        }
    }
}
