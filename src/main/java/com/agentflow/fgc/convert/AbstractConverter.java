package com.agentflow.fgc.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.CodeStyle;
import com.agentflow.fgc.api.Converter;
import com.agentflow.fgc.api.FragmentKind;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.ir.IRNode;

/**
 * Base for converters that turn one node into import lines, one body
 * statement and optionally an execution statement.
 *
 * <p>
 * Subclasses only describe what to generate; fragment ids, ordering and
 * dependency tagging are handled here. Cross-node references are written as
 * placeholders ({@link #input(String)}) and resolved by the orchestrator once
 * the upstream variables are known.
 */
public abstract class AbstractConverter implements Converter {
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");

    private final String nodeType;
    private final String category;
    private final List<String> aliases;

    protected AbstractConverter(String nodeType, String category, String... aliases) {
        this.nodeType = nodeType;
        this.category = category;
        this.aliases = List.of(aliases);
    }

    @Override
    public String nodeType() {
        return nodeType;
    }

    @Override
    public String category() {
        return category;
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }

    @Override
    public List<CodeFragment> convert(IRNode node, GenerationContext ctx) {
        String var = ctx.variableFor(node.id());
        if (var == null)
            var = variableName(node, ctx.getLanguage());
        List<CodeFragment> fragments = new ArrayList<>(4);
        List<String> deps = packages(ctx.getLanguage());

        List<String> importLines = imports(node, ctx);
        for (int i = 0; i < importLines.size(); i++) {
            fragments.add(CodeFragment.builder()
                    .id(node.id() + "-import-" + i)
                    .kind(FragmentKind.IMPORT)
                    .content(importLines.get(i))
                    .dependencies(i == 0 ? deps : List.of())
                    .language(ctx.getLanguage())
                    .order(i)
                    .nodeId(node.id())
                    .build());
        }

        fragments.add(CodeFragment.builder()
                .id(node.id() + "-" + bodyKind().code())
                .kind(bodyKind())
                .content(body(node, ctx, var))
                .language(ctx.getLanguage())
                .order(0)
                .nodeId(node.id())
                .export(var)
                .description(node.label())
                .build());

        String exec = execution(node, ctx, var);
        if (exec != null) {
            fragments.add(CodeFragment.builder()
                    .id(node.id() + "-execution")
                    .kind(FragmentKind.EXECUTION)
                    .content(exec)
                    .language(ctx.getLanguage())
                    .order(0)
                    .nodeId(node.id())
                    .export(resultName(var, ctx.getLanguage()))
                    .build());
        }
        return fragments;
    }

    @Override
    public List<String> getDependencies(IRNode node, GenerationContext ctx) {
        return packages(ctx.getLanguage());
    }

    /** Kind of the statement that defines the node's variable. */
    protected FragmentKind bodyKind() {
        return FragmentKind.DECLARATION;
    }

    protected abstract List<String> imports(IRNode node, GenerationContext ctx);

    protected abstract String body(IRNode node, GenerationContext ctx, String var);

    protected abstract List<String> packages(TargetLanguage language);

    /** Statement running the node, or null for nodes that are only wired into others. */
    protected String execution(IRNode node, GenerationContext ctx, String var) {
        return null;
    }

    // ── Rendering helpers ─────────────────────────────────────────────

    /** A constructor argument with per-language names; a null expression is skipped. */
    protected record Arg(String tsName, String pyName, String expression) {
        public static Arg of(String tsName, String pyName, String expression) {
            return new Arg(tsName, pyName, expression);
        }
    }

    /**
     * {@code const var = new Cls({...});} or {@code var = Cls(...)}. Every
     * argument sits on its own line with a trailing comma, which lets the
     * orchestrator drop lines of unconnected optional inputs.
     */
    protected String construct(GenerationContext ctx, String var, String className, List<Arg> args) {
        CodeStyle style = ctx.style();
        List<Arg> present = args.stream().filter(a -> a.expression() != null).toList();
        StringBuilder sb = new StringBuilder(128);
        if (ctx.getLanguage() == TargetLanguage.PYTHON) {
            sb.append(var).append(" = ").append(className).append('(');
            if (!present.isEmpty()) {
                sb.append('\n');
                for (Arg a : present)
                    sb.append(style.indent(1)).append(a.pyName()).append('=').append(a.expression()).append(",\n");
            }
            return sb.append(')').toString();
        }
        sb.append("const ").append(var).append(" = new ").append(className).append('(');
        if (!present.isEmpty()) {
            sb.append("{\n");
            for (Arg a : present)
                sb.append(style.indent(1)).append(a.tsName()).append(": ").append(a.expression()).append(",\n");
            sb.append('}');
        }
        return sb.append(')').append(style.terminator()).toString();
    }

    /** {@code const var = expr;} or {@code var = expr}. */
    protected String assign(GenerationContext ctx, String var, String expression) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return var + " = " + expression;
        return "const " + var + " = " + expression + ctx.style().terminator();
    }

    /** {@code import { Cls } from 'pkg';} */
    protected static String tsImport(GenerationContext ctx, String className, String module) {
        return "import { " + className + " } from " + quote(module, ctx.style().quote()) + ctx.style().terminator();
    }

    /** {@code from module import Cls} */
    protected static String pyImport(String module, String className) {
        return "from " + module + " import " + className;
    }

    /** Placeholder for the variable of the node connected to {@code port}. */
    protected static String input(String port) {
        return "{{input:" + port + "}}";
    }

    /** Like {@link #input(String)}, but the line is dropped when nothing is connected. */
    protected static String optionalInput(String port) {
        return "{{input?:" + port + "}}";
    }

    /** Reads an API key from the environment of the generated program. */
    protected static String env(GenerationContext ctx, String name) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return "os.environ[\"" + name + "\"]";
        return "process.env." + name;
    }

    protected static String stringParam(IRNode node, String name, String fallback) {
        Object v = node.parameterValue(name);
        return v == null ? fallback : v.toString();
    }

    /** Numeric parameter rendered as a literal; flow exports often store numbers as strings. */
    protected static String numberParam(IRNode node, String name) {
        Object v = node.parameterValue(name);
        if (v == null)
            return null;
        if (v instanceof Number n)
            return n.toString();
        String s = v.toString().trim();
        try {
            Double.parseDouble(s);
            return s;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' of node " + node.id()
                    + " is not a number: " + s, e);
        }
    }

    protected static String literal(Object value, GenerationContext ctx) {
        TargetLanguage lang = ctx.getLanguage();
        if (value == null)
            return lang.nullLiteral();
        if (value instanceof Boolean b)
            return lang.booleanLiteral(b);
        if (value instanceof Number n)
            return n.toString();
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>(list.size());
            for (Object o : list)
                items.add(literal(o, ctx));
            return lang.listLiteral(items);
        }
        if (value instanceof Map<?, ?> map) {
            List<String> entries = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> e : map.entrySet()) {
                String key = lang == TargetLanguage.PYTHON ? quote(e.getKey().toString(), '"')
                        : quote(e.getKey().toString(), ctx.style().quote());
                entries.add(key + ": " + literal(e.getValue(), ctx));
            }
            return "{" + String.join(", ", entries) + "}";
        }
        return quote(value.toString(), ctx.style().quote());
    }

    protected static String quote(String s, char q) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append(q);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == q)
                        sb.append('\\');
                    sb.append(c);
                }
            }
        }
        return sb.append(q).toString();
    }

    /** Identifier for the node's variable: the node id, snake_cased for Python. */
    public static String variableName(IRNode node, TargetLanguage language) {
        String base = node.id().replaceAll("[^A-Za-z0-9_]", "_");
        if (base.isEmpty() || Character.isDigit(base.charAt(0)))
            base = "_" + base;
        if (language == TargetLanguage.PYTHON) {
            base = CAMEL_BOUNDARY.matcher(base).replaceAll("$1_$2");
            base = ACRONYM_BOUNDARY.matcher(base).replaceAll("$1_$2");
            base = base.toLowerCase().replaceAll("_+", "_");
        }
        return base;
    }

    protected static String resultName(String var, TargetLanguage language) {
        return language == TargetLanguage.PYTHON ? var + "_result" : var + "Result";
    }
}
