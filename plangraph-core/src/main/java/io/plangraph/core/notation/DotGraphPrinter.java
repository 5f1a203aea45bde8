package io.plangraph.core.notation;

import com.google.common.collect.ImmutableSet;
import io.plangraph.core.graph.Dependency;
import io.plangraph.core.graph.DependencyGraph;

import java.util.Objects;
import java.util.regex.Pattern;

import static java.util.Locale.ENGLISH;

/**
 * Writes a dependency graph as a DOT document: every task on its own line,
 * then every dependency, both in sorted order.
 */
public class DotGraphPrinter
{
    public static final String DEFAULT_GRAPH_NAME = "ExecutionGraph";

    private static final Pattern BARE_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*|[0-9]+");

    // DOT reserves these in any case
    private static final ImmutableSet<String> KEYWORDS = ImmutableSet.of("node", "edge", "graph", "digraph", "subgraph", "strict");

    private final String graphName;

    public DotGraphPrinter()
    {
        this(DEFAULT_GRAPH_NAME);
    }

    public DotGraphPrinter(String graphName)
    {
        this.graphName = Objects.requireNonNull(graphName);
    }

    public String print(DependencyGraph graph)
    {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quoteIfNeeded(graphName)).append(" {\n");
        for (String task : graph.getTasks()) {
            sb.append("  ").append(quoteIfNeeded(task)).append(";\n");
        }
        for (Dependency dep : graph.getDependencies()) {
            sb.append("  ")
                .append(quoteIfNeeded(dep.getFrom()))
                .append(" -> ")
                .append(quoteIfNeeded(dep.getTo()))
                .append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String quoteIfNeeded(String name)
    {
        if (BARE_ID.matcher(name).matches() && !KEYWORDS.contains(name.toLowerCase(ENGLISH))) {
            return name;
        }
        return "\"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
