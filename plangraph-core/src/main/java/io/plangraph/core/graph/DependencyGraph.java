package io.plangraph.core.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Immutable task dependency graph. Tasks, dependencies and neighbours always
 * enumerate in lexicographic order so that every derived structure is reproducible.
 *
 * The graph itself doesn't reject cycles; {@link #topologicalGenerations()} does.
 */
public final class DependencyGraph
{
    private final ImmutableSortedSet<String> tasks;
    private final ImmutableSortedSet<Dependency> dependencies;
    private final ImmutableSortedMap<String, ImmutableSortedSet<String>> successors;
    private final ImmutableSortedMap<String, ImmutableSortedSet<String>> predecessors;

    private DependencyGraph(Collection<String> tasks, Collection<Dependency> dependencies)
    {
        this.tasks = ImmutableSortedSet.copyOf(tasks);
        this.dependencies = ImmutableSortedSet.copyOf(dependencies);

        Map<String, SortedSet<String>> succ = new TreeMap<>();
        Map<String, SortedSet<String>> pred = new TreeMap<>();
        for (String task : this.tasks) {
            checkArgument(!task.isEmpty(), "task name must not be empty");
            succ.put(task, new TreeSet<>());
            pred.put(task, new TreeSet<>());
        }
        for (Dependency dep : this.dependencies) {
            checkArgument(succ.containsKey(dep.getFrom()), "dependency %s refers to unknown task '%s'", dep, dep.getFrom());
            checkArgument(pred.containsKey(dep.getTo()), "dependency %s refers to unknown task '%s'", dep, dep.getTo());
            succ.get(dep.getFrom()).add(dep.getTo());
            pred.get(dep.getTo()).add(dep.getFrom());
        }
        this.successors = freeze(succ);
        this.predecessors = freeze(pred);
    }

    private static ImmutableSortedMap<String, ImmutableSortedSet<String>> freeze(Map<String, SortedSet<String>> map)
    {
        ImmutableSortedMap.Builder<String, ImmutableSortedSet<String>> builder = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<String, SortedSet<String>> entry : map.entrySet()) {
            builder.put(entry.getKey(), ImmutableSortedSet.copyOf(entry.getValue()));
        }
        return builder.build();
    }

    public static DependencyGraph of(Collection<String> tasks, Collection<Dependency> dependencies)
    {
        return new DependencyGraph(tasks, dependencies);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static class Builder
    {
        private final Set<String> tasks = new TreeSet<>();
        private final Set<Dependency> dependencies = new TreeSet<>();

        private Builder()
        { }

        public Builder addTask(String name)
        {
            tasks.add(Objects.requireNonNull(name));
            return this;
        }

        /**
         * Adds a dependency, declaring both of its tasks if they weren't declared yet.
         */
        public Builder addDependency(String from, String to)
        {
            Dependency dep = Dependency.of(from, to);
            tasks.add(from);
            tasks.add(to);
            dependencies.add(dep);
            return this;
        }

        public DependencyGraph build()
        {
            return new DependencyGraph(tasks, dependencies);
        }
    }

    public ImmutableSortedSet<String> getTasks()
    {
        return tasks;
    }

    public ImmutableSortedSet<Dependency> getDependencies()
    {
        return dependencies;
    }

    public boolean isEmpty()
    {
        return tasks.isEmpty();
    }

    public ImmutableSortedSet<String> successors(String task)
    {
        ImmutableSortedSet<String> set = successors.get(task);
        checkArgument(set != null, "unknown task '%s'", task);
        return set;
    }

    public ImmutableSortedSet<String> predecessors(String task)
    {
        ImmutableSortedSet<String> set = predecessors.get(task);
        checkArgument(set != null, "unknown task '%s'", task);
        return set;
    }

    /**
     * Partitions the tasks into weakly-connected components, ignoring edge direction.
     * Components are ordered by their smallest task name.
     */
    public List<ImmutableSortedSet<String>> weaklyConnectedComponents()
    {
        List<ImmutableSortedSet<String>> components = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : tasks) {
            if (!visited.add(start)) {
                continue;
            }
            SortedSet<String> component = new TreeSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                String task = queue.poll();
                component.add(task);
                for (String next : Sets.union(successors.get(task), predecessors.get(task))) {
                    if (visited.add(next)) {
                        queue.add(next);
                    }
                }
            }
            components.add(ImmutableSortedSet.copyOf(component));
        }
        return ImmutableList.copyOf(components);
    }

    /**
     * Returns the subgraph induced by the given tasks.
     */
    public DependencyGraph subgraph(Set<String> subset)
    {
        for (String task : subset) {
            checkArgument(tasks.contains(task), "unknown task '%s'", task);
        }
        List<Dependency> deps = new ArrayList<>();
        for (Dependency dep : dependencies) {
            if (subset.contains(dep.getFrom()) && subset.contains(dep.getTo())) {
                deps.add(dep);
            }
        }
        return new DependencyGraph(subset, deps);
    }

    /**
     * Longest-path layering. Generation 0 holds tasks without predecessors;
     * generation k holds tasks whose predecessors all lie in earlier generations,
     * at least one of them in generation k-1.
     *
     * @throws CycleException if some tasks can never be layered
     */
    public List<ImmutableSortedSet<String>> topologicalGenerations()
    {
        Map<String, Integer> indegree = new HashMap<>();
        for (String task : tasks) {
            indegree.put(task, predecessors.get(task).size());
        }

        List<ImmutableSortedSet<String>> generations = new ArrayList<>();
        SortedSet<String> current = new TreeSet<>();
        for (String task : tasks) {
            if (indegree.get(task) == 0) {
                current.add(task);
            }
        }

        int placed = 0;
        while (!current.isEmpty()) {
            generations.add(ImmutableSortedSet.copyOf(current));
            placed += current.size();
            SortedSet<String> next = new TreeSet<>();
            for (String task : current) {
                for (String succ : successors.get(task)) {
                    int remaining = indegree.get(succ) - 1;
                    indegree.put(succ, remaining);
                    if (remaining == 0) {
                        next.add(succ);
                    }
                }
            }
            current = next;
        }

        if (placed != tasks.size()) {
            Set<String> stuck = new TreeSet<>();
            for (Map.Entry<String, Integer> entry : indegree.entrySet()) {
                if (entry.getValue() > 0) {
                    stuck.add(entry.getKey());
                }
            }
            throw new CycleException(stuck);
        }
        return ImmutableList.copyOf(generations);
    }

    /**
     * Maps every task to the set of tasks reachable from it through one or more dependencies.
     */
    public Map<String, ImmutableSortedSet<String>> transitiveClosure()
    {
        ImmutableSortedMap.Builder<String, ImmutableSortedSet<String>> builder = ImmutableSortedMap.naturalOrder();
        for (String task : tasks) {
            Set<String> reached = new TreeSet<>();
            Deque<String> stack = new ArrayDeque<>(successors.get(task));
            while (!stack.isEmpty()) {
                String next = stack.pop();
                if (reached.add(next)) {
                    stack.addAll(successors.get(next));
                }
            }
            builder.put(task, ImmutableSortedSet.copyOf(reached));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof DependencyGraph)) {
            return false;
        }
        DependencyGraph o = (DependencyGraph) other;
        return tasks.equals(o.tasks) && dependencies.equals(o.dependencies);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(tasks, dependencies);
    }

    @Override
    public String toString()
    {
        return "DependencyGraph{tasks=" + tasks + ", dependencies=" + dependencies + "}";
    }
}
