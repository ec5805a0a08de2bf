package com.agentflow.fgc.emit;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.FragmentKind;
import com.agentflow.fgc.api.GenerationContext;

/**
 * Shared grouping and formatting for emitters. Fragments arrive already in
 * emission order; grouping by kind keeps that order inside each group.
 */
abstract class AbstractEmitter implements Emitter {
    private static final Pattern ENV_REFERENCE = Pattern
            .compile("process\\.env\\.([A-Za-z_][A-Za-z0-9_]*)|os\\.environ\\[\"([A-Za-z_][A-Za-z0-9_]*)\"\\]");

    protected static Map<FragmentKind, List<CodeFragment>> groupByKind(List<CodeFragment> fragments) {
        Map<FragmentKind, List<CodeFragment>> groups = new EnumMap<>(FragmentKind.class);
        for (FragmentKind kind : FragmentKind.values())
            groups.put(kind, new ArrayList<>());
        for (CodeFragment f : fragments)
            groups.get(f.getKind()).add(f);
        return groups;
    }

    /** Import lines with exact duplicates removed, first occurrence kept. */
    protected static List<String> importLines(List<CodeFragment> imports) {
        Set<String> lines = new LinkedHashSet<>();
        for (CodeFragment f : imports)
            for (String line : f.getContent().split("\n"))
                if (!line.isBlank())
                    lines.add(line);
        return new ArrayList<>(lines);
    }

    /**
     * Content blocks of one kind, each optionally headed by a comment naming
     * the node it came from.
     */
    protected static List<String> blocks(List<CodeFragment> fragments, GenerationContext ctx) {
        List<String> blocks = new ArrayList<>(fragments.size());
        String comment = ctx.getLanguage().lineComment();
        for (CodeFragment f : fragments) {
            if (ctx.isIncludeComments() && f.getDescription() != null) {
                String origin = f.getNodeId() == null ? "" : " (" + f.getNodeId() + ")";
                blocks.add(comment + " " + f.getDescription() + origin + "\n" + f.getContent());
            } else {
                blocks.add(f.getContent());
            }
        }
        return blocks;
    }

    protected static String indent(String block, String prefix) {
        StringBuilder sb = new StringBuilder(block.length() + 16);
        String[] lines = block.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isEmpty())
                sb.append(prefix).append(lines[i]);
            if (i < lines.length - 1)
                sb.append('\n');
        }
        return sb.toString();
    }

    /** Environment variables the generated code reads, sorted. */
    protected static Set<String> environmentVariables(List<CodeFragment> fragments) {
        Set<String> vars = new TreeSet<>();
        for (CodeFragment f : fragments) {
            Matcher m = ENV_REFERENCE.matcher(f.getContent());
            while (m.find())
                vars.add(m.group(1) != null ? m.group(1) : m.group(2));
        }
        return vars;
    }

    protected static String envExample(String projectName, Set<String> vars) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Environment for ").append(projectName).append('\n');
        for (String v : vars)
            sb.append(v).append("=\n");
        return sb.toString();
    }
}
