package io.plangraph.core.sync;

import java.io.IOException;

/**
 * Draws the graph-description text after each successful sync.
 */
public interface GraphRenderer
{
    void render(String graphDescription)
        throws IOException;
}
