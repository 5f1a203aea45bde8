package io.plangraph.core.config;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.plangraph.core.notation.DotGraphPrinter;
import io.plangraph.core.notation.StructureNotationPrinter;
import org.immutables.value.Value;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static com.google.common.base.Preconditions.checkState;

/**
 * Tunables shared by the converters, the synchronizer and the command line.
 */
@Value.Immutable
public abstract class ConverterConfig
{
    public static final String PRINTER_INDENT = "printer.indent";
    public static final String GRAPH_NAME = "graph.name";
    public static final String STRUCTURER_THREADS = "structurer.threads";
    public static final String SYNC_DEBOUNCE_MILLIS = "sync.debounce_millis";
    public static final String RENDER_COMMAND = "render.command";

    private static final Splitter COMMAND_SPLITTER = Splitter.on(' ').trimResults().omitEmptyStrings();

    @Value.Default
    public int getIndent()
    {
        return StructureNotationPrinter.DEFAULT_INDENT;
    }

    @Value.Default
    public String getGraphName()
    {
        return DotGraphPrinter.DEFAULT_GRAPH_NAME;
    }

    @Value.Default
    public int getStructurerThreads()
    {
        return 1;
    }

    @Value.Default
    public Duration getSyncDebounce()
    {
        return Duration.ofSeconds(1);
    }

    @Value.Default
    public List<String> getRenderCommand()
    {
        return ImmutableList.of("dot", "-Tpng");
    }

    @Value.Check
    protected void check()
    {
        checkState(getIndent() >= 0, "%s must not be negative", PRINTER_INDENT);
        checkState(!getGraphName().isEmpty(), "%s must not be empty", GRAPH_NAME);
        checkState(getStructurerThreads() >= 1, "%s must be at least 1", STRUCTURER_THREADS);
        checkState(!getSyncDebounce().isNegative(), "%s must not be negative", SYNC_DEBOUNCE_MILLIS);
        checkState(!getRenderCommand().isEmpty(), "%s must not be empty", RENDER_COMMAND);
    }

    public static ConverterConfig defaultConfig()
    {
        return ImmutableConverterConfig.builder().build();
    }

    public static ConverterConfig fromProperties(Properties props)
    {
        ImmutableConverterConfig.Builder builder = ImmutableConverterConfig.builder();

        String indent = props.getProperty(PRINTER_INDENT);
        if (indent != null) {
            builder.indent(parseInt(PRINTER_INDENT, indent));
        }
        String graphName = props.getProperty(GRAPH_NAME);
        if (graphName != null) {
            builder.graphName(graphName.trim());
        }
        String threads = props.getProperty(STRUCTURER_THREADS);
        if (threads != null) {
            builder.structurerThreads(parseInt(STRUCTURER_THREADS, threads));
        }
        String debounce = props.getProperty(SYNC_DEBOUNCE_MILLIS);
        if (debounce != null) {
            builder.syncDebounce(Duration.ofMillis(parseInt(SYNC_DEBOUNCE_MILLIS, debounce)));
        }
        String command = props.getProperty(RENDER_COMMAND);
        if (command != null) {
            builder.renderCommand(COMMAND_SPLITTER.splitToList(command));
        }

        try {
            return builder.build();
        }
        catch (IllegalStateException ex) {
            throw new ConfigException("Invalid configuration: " + ex.getMessage(), ex);
        }
    }

    private static int parseInt(String key, String value)
    {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException ex) {
            throw new ConfigException("Invalid value for " + key + ": '" + value + "' is not an integer", ex);
        }
    }
}
