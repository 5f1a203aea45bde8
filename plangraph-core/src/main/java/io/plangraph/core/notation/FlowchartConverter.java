package io.plangraph.core.notation;

import com.google.common.base.Splitter;
import com.google.common.collect.Multimap;
import com.google.common.collect.TreeMultimap;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented transcoding between the graph-description notation and a
 * Mermaid flowchart. Only simple node and edge lines are recognized; anything
 * else is dropped. This works on text only and doesn't build a graph.
 */
public class FlowchartConverter
{
    private static final Splitter LINES = Splitter.onPattern("\\r?\\n");

    private static final Pattern DOT_NODE = Pattern.compile("\\s*([a-zA-Z0-9_]+)\\s*;");
    private static final Pattern DOT_EDGE = Pattern.compile("\\s*([a-zA-Z0-9_]+)\\s*->\\s*([a-zA-Z0-9_]+)\\s*;");

    private static final Pattern FLOWCHART_HEADER = Pattern.compile("(flowchart|graph)(\\s.*)?");
    private static final Pattern FLOWCHART_LABELED_NODE = Pattern.compile("\\s*([a-zA-Z0-9_]+)\\s*\\[\\s*([^\\]]+)\\s*\\]");
    private static final Pattern FLOWCHART_NODE = Pattern.compile("\\s*([a-zA-Z0-9_]+)\\s*");
    private static final Pattern FLOWCHART_EDGE = Pattern.compile("([a-zA-Z0-9_]+)(?:\\[[^\\]]*\\])?\\s*-->\\s*([a-zA-Z0-9_]+)");

    private final String graphName;

    public FlowchartConverter()
    {
        this(DotGraphPrinter.DEFAULT_GRAPH_NAME);
    }

    public FlowchartConverter(String graphName)
    {
        this.graphName = graphName;
    }

    public String toFlowchart(String dot)
    {
        StringBuilder sb = new StringBuilder("flowchart TD\n");
        for (String rawLine : LINES.split(dot)) {
            String line = rawLine.trim();
            if (line.startsWith("digraph") || line.equals("{") || line.equals("}")) {
                continue;
            }

            Matcher edge = DOT_EDGE.matcher(line);
            if (edge.lookingAt()) {
                sb.append("    ").append(edge.group(1)).append(" --> ").append(edge.group(2)).append('\n');
                continue;
            }

            Matcher node = DOT_NODE.matcher(line);
            if (node.lookingAt()) {
                String name = node.group(1);
                sb.append("    ").append(name).append('[').append(name).append("]\n");
            }
        }
        return sb.toString();
    }

    public String toGraphDescription(String flowchart)
    {
        SortedSet<String> nodes = new TreeSet<>();
        Multimap<String, String> edges = TreeMultimap.create();

        for (String rawLine : LINES.split(flowchart)) {
            String line = rawLine.trim();
            if (FLOWCHART_HEADER.matcher(line).matches()) {
                continue;
            }

            Matcher edge = FLOWCHART_EDGE.matcher(line);
            if (edge.find()) {
                nodes.add(edge.group(1));
                nodes.add(edge.group(2));
                edges.put(edge.group(1), edge.group(2));
                continue;
            }

            Matcher labeled = FLOWCHART_LABELED_NODE.matcher(line);
            if (labeled.lookingAt()) {
                nodes.add(labeled.group(1));
                continue;
            }

            Matcher simple = FLOWCHART_NODE.matcher(line);
            if (simple.matches()) {
                nodes.add(simple.group(1));
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(DotGraphPrinter.quoteIfNeeded(graphName)).append(" {\n");
        for (String node : nodes) {
            sb.append("  ").append(DotGraphPrinter.quoteIfNeeded(node)).append(";\n");
        }
        for (Map.Entry<String, String> edge : edges.entries()) {
            sb.append("  ")
                .append(DotGraphPrinter.quoteIfNeeded(edge.getKey()))
                .append(" -> ")
                .append(DotGraphPrinter.quoteIfNeeded(edge.getValue()))
                .append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }
}
