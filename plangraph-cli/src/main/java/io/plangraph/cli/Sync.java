package io.plangraph.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.plangraph.core.config.ConverterConfig;
import io.plangraph.core.structure.Structurer;
import io.plangraph.core.sync.GraphRenderer;
import io.plangraph.core.sync.NotationSynchronizer;
import io.plangraph.core.sync.Pane;
import io.plangraph.core.sync.SyncListener;
import io.plangraph.core.sync.SyncResult;

import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;

import static io.plangraph.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class Sync
    extends Command
{
    @Parameter(names = {"--from"})
    String from = null;

    @Parameter(names = {"-o", "--output"})
    String output = null;

    @Override
    public void main()
            throws Exception
    {
        if (args.size() > 1 || from == null) {
            throw usage(null);
        }

        Pane source;
        try {
            source = Pane.valueOf(from.toUpperCase(ENGLISH));
        }
        catch (IllegalArgumentException ex) {
            throw usage("Unknown pane '" + from + "'; expected structure, graph or flowchart");
        }

        sync(source);
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " sync --from PANE [file] [options...]");
        err.println("  Options:");
        err.println("        --from PANE                  structure, graph or flowchart");
        err.println("    -o, --output PATH.png            also draw the graph to this path");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }

    private void sync(Pane source)
            throws Exception
    {
        ConverterConfig config = loadConfig();
        String text = readInput();

        Optional<GraphRenderer> renderer = Optional.absent();
        if (output != null) {
            renderer = Optional.of(new GraphvizRenderer(config.getRenderCommand(), Paths.get(output)));
        }

        FailureRecorder failures = new FailureRecorder();
        ExecutorService executor = structurerExecutor(config);
        Optional<SyncResult> result;
        try (NotationSynchronizer synchronizer = new NotationSynchronizer(config, new Structurer(executor), failures, renderer)) {
            synchronizer.edit(source, text);
            result = synchronizer.syncNow();
        }
        finally {
            executor.shutdown();
        }

        if (!result.isPresent()) {
            if (failures.failure != null) {
                throw failures.failure;
            }
            throw systemExit("Nothing to sync");
        }

        SyncResult synced = result.get();
        for (Pane pane : Pane.values()) {
            out.println("== " + pane.name().toLowerCase(ENGLISH) + " ==");
            String paneText = synced.getText(pane);
            out.print(paneText);
            if (!paneText.isEmpty() && !paneText.endsWith("\n")) {
                out.println();
            }
        }

        if (synced.getRenderFailure().isPresent()) {
            throw systemExit("Failed to render the graph: " + synced.getRenderFailure().get());
        }
        if (output != null) {
            err.println("Stored PNG file at '" + output + "'");
        }
    }

    private static class FailureRecorder
            implements SyncListener
    {
        private RuntimeException failure;

        @Override
        public void onSynced(SyncResult result)
        { }

        @Override
        public void onSyncFailed(Pane source, RuntimeException cause)
        {
            this.failure = cause;
        }
    }
}
