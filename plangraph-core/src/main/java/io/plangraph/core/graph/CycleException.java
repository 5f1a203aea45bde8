package io.plangraph.core.graph;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Set;

/**
 * Thrown when a dependency graph can't be layered because it contains a cycle.
 */
public class CycleException
        extends RuntimeException
{
    private final Set<String> unresolvedTasks;

    public CycleException(Set<String> unresolvedTasks)
    {
        super("Graph contains a cycle, which is not supported for execution graphs. Tasks on or behind the cycle: " + ImmutableSortedSet.copyOf(unresolvedTasks));
        this.unresolvedTasks = ImmutableSortedSet.copyOf(unresolvedTasks);
    }

    public Set<String> getUnresolvedTasks()
    {
        return unresolvedTasks;
    }
}
