package com.agentflow.fgc.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.IssueType;
import com.agentflow.fgc.api.Severity;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.api.ValidationIssue;
import com.agentflow.fgc.ir.IRConnection;
import com.agentflow.fgc.ir.IRGraph;

/**
 * Replaces {@code {{input:port}}} placeholders with the variable exported by
 * the node(s) connected to that input port.
 *
 * <p>
 * One source yields its variable, several yield a list literal. A required
 * reference with no converted source becomes the null literal plus an
 * {@code UNRESOLVED_REFERENCE} warning; an optional one ({@code {{input?:port}}})
 * with nothing connected removes its whole line.
 */
final class ReferenceResolver {
    static final Pattern REFERENCE = Pattern.compile("\\{\\{input(\\?)?:([A-Za-z0-9_.\\-]+)\\}\\}");

    private final IRGraph graph;
    private final Map<String, String> exportsByNode;
    private final TargetLanguage language;

    ReferenceResolver(IRGraph graph, Map<String, String> exportsByNode, TargetLanguage language) {
        this.graph = graph;
        this.exportsByNode = exportsByNode;
        this.language = language;
    }

    CodeFragment resolve(CodeFragment fragment, List<ValidationIssue> warnings) {
        String content = fragment.getContent();
        if (content == null || fragment.getNodeId() == null || !content.contains("{{input"))
            return fragment;

        String[] lines = content.split("\n", -1);
        StringBuilder out = new StringBuilder(content.length());
        boolean first = true;
        for (String line : lines) {
            String resolved = resolveLine(fragment.getNodeId(), line, warnings);
            if (resolved == null)
                continue;
            if (!first)
                out.append('\n');
            out.append(resolved);
            first = false;
        }
        return fragment.toBuilder().content(out.toString()).build();
    }

    // null drops the line
    private String resolveLine(String nodeId, String line, List<ValidationIssue> warnings) {
        Matcher m = REFERENCE.matcher(line);
        if (!m.find())
            return line;
        m.reset();
        StringBuilder sb = new StringBuilder(line.length());
        while (m.find()) {
            boolean optional = m.group(1) != null;
            String port = m.group(2);
            List<IRConnection> feeding = feeding(nodeId, port);
            List<String> vars = new ArrayList<>(feeding.size());
            for (IRConnection c : feeding) {
                String var = exportsByNode.get(c.source());
                if (var != null)
                    vars.add(var);
            }

            String replacement;
            if (vars.size() == 1) {
                replacement = vars.get(0);
            } else if (!vars.isEmpty()) {
                replacement = language.listLiteral(vars);
            } else {
                if (!feeding.isEmpty() || !optional)
                    warnings.add(unresolved(nodeId, port, feeding));
                if (optional)
                    return null;
                replacement = language.nullLiteral();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private List<IRConnection> feeding(String nodeId, String port) {
        List<IRConnection> result = new ArrayList<>();
        for (IRConnection c : graph.incoming(nodeId))
            if (port.equals(c.targetPort()) && graph.hasNode(c.source()))
                result.add(c);
        return result;
    }

    private static ValidationIssue unresolved(String nodeId, String port, List<IRConnection> feeding) {
        String why = feeding.isEmpty() ? "is not connected" : "is connected only to nodes that were not converted";
        return ValidationIssue.builder()
                .type(IssueType.UNRESOLVED_REFERENCE)
                .message("Input '" + port + "' of node '" + nodeId + "' " + why)
                .nodeId(nodeId)
                .severity(Severity.MEDIUM)
                .fixSuggestion("Connect a supported node to '" + port + "'")
                .build();
    }
}
