package io.plangraph.core.sync;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.plangraph.core.config.ConverterConfig;
import io.plangraph.core.graph.DependencyGraph;
import io.plangraph.core.notation.DotGraphParser;
import io.plangraph.core.notation.DotGraphPrinter;
import io.plangraph.core.notation.FlowchartConverter;
import io.plangraph.core.notation.StructureNotationParser;
import io.plangraph.core.notation.StructureNotationPrinter;
import io.plangraph.core.structure.ExpressionTree;
import io.plangraph.core.structure.Flattener;
import io.plangraph.core.structure.Structurer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Keeps the structured notation, the graph description and the flowchart
 * consistent with each other.
 *
 * Edits are debounced: each {@link #edit(Pane, String)} cancels the pending
 * sync and schedules a new one. A sync converts from the last edited pane to
 * the other two. When conversion fails no pane changes and the failure goes to
 * the listener.
 */
public class NotationSynchronizer
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(NotationSynchronizer.class);

    private final SyncListener listener;
    private final Optional<GraphRenderer> renderer;
    private final Duration debounce;
    private final Structurer structurer;

    private final StructureNotationParser structureParser = new StructureNotationParser();
    private final StructureNotationPrinter structurePrinter;
    private final DotGraphParser graphParser = new DotGraphParser();
    private final DotGraphPrinter graphPrinter;
    private final FlowchartConverter flowchartConverter;
    private final Flattener flattener = new Flattener();

    private final Map<Pane, String> texts = new EnumMap<>(Pane.class);
    private final ScheduledExecutorService scheduler;
    private Pane lastEdited = null;
    private ScheduledFuture<?> pending = null;
    // bumped whenever pending is replaced or dropped; a scheduled run only syncs if it still matches
    private long generation = 0;
    private boolean closed = false;

    public NotationSynchronizer(ConverterConfig config, SyncListener listener)
    {
        this(config, new Structurer(), listener, Optional.absent());
    }

    public NotationSynchronizer(ConverterConfig config, Structurer structurer,
            SyncListener listener, Optional<GraphRenderer> renderer)
    {
        this.listener = checkNotNull(listener, "listener");
        this.renderer = checkNotNull(renderer, "renderer");
        this.structurer = checkNotNull(structurer, "structurer");
        this.debounce = config.getSyncDebounce();
        this.structurePrinter = new StructureNotationPrinter(config.getIndent());
        this.graphPrinter = new DotGraphPrinter(config.getGraphName());
        this.flowchartConverter = new FlowchartConverter(config.getGraphName());
        for (Pane pane : Pane.values()) {
            texts.put(pane, "");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("notation-sync-%d")
                .build()
                );
    }

    public synchronized void edit(Pane pane, String text)
    {
        checkState(!closed, "synchronizer is closed");
        texts.put(checkNotNull(pane, "pane"), checkNotNull(text, "text"));
        lastEdited = pane;
        cancelPending();
        long scheduledFor = generation;
        pending = scheduler.schedule(() -> runScheduled(scheduledFor), debounce.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized String getText(Pane pane)
    {
        return texts.get(pane);
    }

    public synchronized Optional<Pane> getLastEdited()
    {
        return Optional.fromNullable(lastEdited);
    }

    public synchronized boolean isSyncPending()
    {
        return pending != null && !pending.isDone();
    }

    /**
     * Converts from the last edited pane right away, dropping any pending
     * debounced sync.
     *
     * @return the new pane contents, or absent if nothing was edited yet or the
     *         conversion failed
     */
    public synchronized Optional<SyncResult> syncNow()
    {
        cancelPending();
        if (lastEdited == null) {
            return Optional.absent();
        }

        Pane source = lastEdited;
        Map<Pane, String> converted;
        try {
            converted = convert(source, texts.get(source));
        }
        catch (RuntimeException ex) {
            logger.debug("Failed to sync from {} pane", source, ex);
            listener.onSyncFailed(source, ex);
            return Optional.absent();
        }
        texts.putAll(converted);

        ImmutableSyncResult.Builder result = SyncResult.builder()
            .source(source)
            .structure(texts.get(Pane.STRUCTURE))
            .graph(texts.get(Pane.GRAPH))
            .flowchart(texts.get(Pane.FLOWCHART));
        String graph = texts.get(Pane.GRAPH);
        if (renderer.isPresent() && !graph.trim().isEmpty()) {
            try {
                renderer.get().render(graph);
            }
            catch (IOException | RuntimeException ex) {
                logger.warn("Failed to render the graph", ex);
                result.renderFailure(String.valueOf(ex.getMessage()));
            }
        }

        SyncResult built = result.build();
        listener.onSynced(built);
        return Optional.of(built);
    }

    private Map<Pane, String> convert(Pane source, String text)
    {
        Map<Pane, String> converted = new EnumMap<>(Pane.class);
        if (text.trim().isEmpty()) {
            for (Pane pane : Pane.values()) {
                converted.put(pane, "");
            }
            converted.put(source, text);
            return converted;
        }
        converted.put(source, text);

        switch (source) {
            case STRUCTURE: {
                ExpressionTree tree = structureParser.parse(text);
                String dot = graphPrinter.print(flattener.flatten(tree));
                converted.put(Pane.GRAPH, dot);
                converted.put(Pane.FLOWCHART, flowchartConverter.toFlowchart(dot));
                break;
            }
            case GRAPH: {
                DependencyGraph graph = graphParser.parse(text);
                converted.put(Pane.STRUCTURE, structurePrinter.print(structurer.structure(graph)));
                converted.put(Pane.FLOWCHART, flowchartConverter.toFlowchart(text));
                break;
            }
            case FLOWCHART: {
                String dot = flowchartConverter.toGraphDescription(text);
                DependencyGraph graph = graphParser.parse(dot);
                converted.put(Pane.STRUCTURE, structurePrinter.print(structurer.structure(graph)));
                converted.put(Pane.GRAPH, dot);
                break;
            }
            default:
                throw new AssertionError("Unknown pane: " + source);
        }
        logger.debug("Synced panes from {}", source);
        return converted;
    }

    @VisibleForTesting
    synchronized long getGeneration()
    {
        return generation;
    }

    @VisibleForTesting
    synchronized void runScheduled(long scheduledFor)
    {
        if (closed || scheduledFor != generation) {
            logger.trace("Skipping superseded sync {} (current {})", scheduledFor, generation);
            return;
        }
        try {
            syncNow();
        }
        catch (RuntimeException ex) {
            logger.error("Uncaught exception during scheduled sync", ex);
        }
    }

    private void cancelPending()
    {
        generation++;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    @Override
    public synchronized void close()
    {
        closed = true;
        cancelPending();
        scheduler.shutdown();
    }
}
