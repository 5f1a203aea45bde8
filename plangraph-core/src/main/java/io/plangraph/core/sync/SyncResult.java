package io.plangraph.core.sync;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Snapshot of all three panes right after a successful sync.
 */
@Value.Immutable
public abstract class SyncResult
{
    public abstract Pane getSource();

    public abstract String getStructure();

    public abstract String getGraph();

    public abstract String getFlowchart();

    /**
     * Message of the renderer failure, if the renderer was called and failed.
     */
    public abstract Optional<String> getRenderFailure();

    public String getText(Pane pane)
    {
        switch (pane) {
            case STRUCTURE:
                return getStructure();
            case GRAPH:
                return getGraph();
            case FLOWCHART:
                return getFlowchart();
            default:
                throw new AssertionError("Unknown pane: " + pane);
        }
    }

    public static ImmutableSyncResult.Builder builder()
    {
        return ImmutableSyncResult.builder();
    }
}
