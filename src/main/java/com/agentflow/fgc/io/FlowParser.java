package com.agentflow.fgc.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import lombok.extern.log4j.Log4j2;

/**
 * Turns raw flow JSON into a {@link FlowDefinition}.
 *
 * <p>
 * Parsing happens in two passes over a Jackson tree: a structural pass that
 * collects every missing or mistyped required field, then data binding. The
 * structural pass fails with all issues at once.
 *
 * <p>
 * Thread-safe; one instance may be shared.
 */
@Log4j2
public final class FlowParser {
    public static final int DEFAULT_MAX_INPUT_BYTES = 10 * 1024 * 1024;

    private final ObjectMapper mapper;
    private final ObjectReader treeReader;
    private final int maxInputBytes;

    public FlowParser() {
        this(DEFAULT_MAX_INPUT_BYTES);
    }

    public FlowParser(int maxInputBytes) {
        this(new ObjectMapper(), maxInputBytes);
    }

    public FlowParser(ObjectMapper mapper, int maxInputBytes) {
        if (maxInputBytes <= 0)
            throw new IllegalArgumentException("maxInputBytes must be positive: " + maxInputBytes);
        this.mapper = mapper;
        this.treeReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.maxInputBytes = maxInputBytes;
    }

    public FlowDefinition parseFile(Path path) throws IOException {
        log.debug("Reading flow from {}", path);
        long size = Files.size(path);
        if (size > maxInputBytes)
            throw new FlowParseException(List.of(tooLarge(size)));
        return parse(Files.readAllBytes(path));
    }

    public FlowDefinition parse(String json) {
        return parse(json.getBytes(StandardCharsets.UTF_8));
    }

    public FlowDefinition parse(byte[] raw) {
        if (raw == null || raw.length == 0)
            throw new FlowParseException(List.of(new ParseIssue("$", "input is empty")));
        if (raw.length > maxInputBytes)
            throw new FlowParseException(List.of(tooLarge(raw.length)));

        JsonNode root;
        try {
            root = treeReader.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new FlowParseException(List.of(syntaxIssue(e)), e);
        } catch (IOException e) {
            throw new FlowParseException(List.of(new ParseIssue("$", "unreadable input: " + e.getMessage())), e);
        }

        List<ParseIssue> issues = checkStructure(root);
        if (!issues.isEmpty())
            throw new FlowParseException(issues);

        try {
            FlowDefinition def = mapper.treeToValue(root, FlowDefinition.class);
            log.debug("Parsed flow: {} nodes, {} edges", def.getNodes().size(), def.getEdges().size());
            return def;
        } catch (MismatchedInputException e) {
            throw new FlowParseException(List.of(new ParseIssue(pathOf(e), "unexpected value type")), e);
        } catch (JsonProcessingException e) {
            throw new FlowParseException(List.of(new ParseIssue("$", e.getOriginalMessage())), e);
        }
    }

    /** Collects every violated required field. Returns an empty list for a sound document. */
    static List<ParseIssue> checkStructure(JsonNode root) {
        List<ParseIssue> issues = new ArrayList<>();
        if (root == null || root.isMissingNode() || !root.isObject()) {
            issues.add(new ParseIssue("$", "root must be a JSON object"));
            return issues;
        }

        JsonNode nodes = root.get("nodes");
        if (requireArray(nodes, "$.nodes", issues)) {
            for (int i = 0; i < nodes.size(); i++) {
                JsonNode node = nodes.get(i);
                String path = "$.nodes[" + i + "]";
                if (!node.isObject()) {
                    issues.add(new ParseIssue(path, "node must be an object"));
                    continue;
                }
                requireText(node, "id", path, issues);
                requireText(node, "type", path, issues);
                JsonNode data = node.get("data");
                if (data == null || data.isNull())
                    issues.add(new ParseIssue(path + ".data", "required field is missing"));
                else if (!data.isObject())
                    issues.add(new ParseIssue(path + ".data", "must be an object"));
            }
        }

        JsonNode edges = root.get("edges");
        if (requireArray(edges, "$.edges", issues)) {
            for (int i = 0; i < edges.size(); i++) {
                JsonNode edge = edges.get(i);
                String path = "$.edges[" + i + "]";
                if (!edge.isObject()) {
                    issues.add(new ParseIssue(path, "edge must be an object"));
                    continue;
                }
                requireText(edge, "source", path, issues);
                requireText(edge, "target", path, issues);
            }
        }
        return issues;
    }

    private static boolean requireArray(JsonNode value, String path, List<ParseIssue> issues) {
        if (value == null || value.isNull()) {
            issues.add(new ParseIssue(path, "required array is missing"));
            return false;
        }
        if (!value.isArray()) {
            issues.add(new ParseIssue(path, "must be an array"));
            return false;
        }
        return true;
    }

    private static void requireText(JsonNode parent, String field, String path, List<ParseIssue> issues) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull())
            issues.add(new ParseIssue(path + "." + field, "required field is missing"));
        else if (!value.isTextual() || value.asText().isBlank())
            issues.add(new ParseIssue(path + "." + field, "must be a non-empty string"));
    }

    private ParseIssue tooLarge(long size) {
        return new ParseIssue("$", "input is " + size + " bytes, maximum is " + maxInputBytes);
    }

    private static ParseIssue syntaxIssue(JsonProcessingException e) {
        JsonLocation loc = e.getLocation();
        String where = loc == null ? "" : " at line " + loc.getLineNr() + ", column " + loc.getColumnNr();
        return new ParseIssue("$", "malformed JSON" + where + ": " + e.getOriginalMessage());
    }

    private static String pathOf(MismatchedInputException e) {
        StringBuilder sb = new StringBuilder("$");
        for (var ref : e.getPath()) {
            if (ref.getFieldName() != null)
                sb.append('.').append(ref.getFieldName());
            else if (ref.getIndex() >= 0)
                sb.append('[').append(ref.getIndex()).append(']');
        }
        return sb.toString();
    }
}
