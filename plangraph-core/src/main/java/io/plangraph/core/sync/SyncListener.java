package io.plangraph.core.sync;

public interface SyncListener
{
    void onSynced(SyncResult result);

    void onSyncFailed(Pane source, RuntimeException cause);
}
