package io.plangraph.core.sync;

public enum Pane
{
    STRUCTURE,
    GRAPH,
    FLOWCHART;
}
