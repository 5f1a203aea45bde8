package io.plangraph.core.structure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.MoreExecutors;
import io.plangraph.core.graph.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static io.plangraph.core.structure.ExpressionTree.leaf;
import static io.plangraph.core.structure.ExpressionTree.parallel;
import static io.plangraph.core.structure.ExpressionTree.sequence;

/**
 * Infers a sequence/parallel expression tree from a dependency graph.
 *
 * Each weakly-connected component is structured on its own. A component is
 * split recursively: tasks that are not connected run in a
 * {@link ExpressionTree.Parallel}, and a connected part is cut into steps where
 * every task of a step reaches every task of the later steps, giving a
 * {@link ExpressionTree.Sequence}. Series-parallel graphs come back with
 * exactly the same reachability.
 *
 * A part that can be split neither way is not series-parallel. Its tasks are
 * layered by longest path instead: chains of one-to-one dependencies collapse
 * into a Sequence, tasks of a layer run in a Parallel, and the layers run in
 * sequence. That keeps every ordering of the graph and may add some.
 *
 * Several components are composed under a root Parallel ordered by their
 * smallest task name. Components share no state, so they can be structured on
 * any executor; the result doesn't depend on completion order.
 */
public class Structurer
{
    private static final Logger logger = LoggerFactory.getLogger(Structurer.class);

    private final Executor executor;

    public Structurer()
    {
        this(MoreExecutors.directExecutor());
    }

    public Structurer(Executor executor)
    {
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * @throws io.plangraph.core.graph.CycleException if the graph isn't acyclic
     * @throws EmptyGraphException if the graph has no tasks
     */
    public ExpressionTree structure(DependencyGraph graph)
    {
        List<ImmutableSortedSet<String>> components = graph.weaklyConnectedComponents();
        logger.debug("Structuring {} tasks in {} component(s)", graph.getTasks().size(), components.size());

        if (components.isEmpty()) {
            throw new EmptyGraphException();
        }

        List<CompletableFuture<ExpressionTree>> futures = new ArrayList<>();
        for (ImmutableSortedSet<String> component : components) {
            DependencyGraph subgraph = graph.subgraph(component);
            futures.add(CompletableFuture.supplyAsync(() -> structureComponent(subgraph), executor));
        }

        List<ExpressionTree> trees = new ArrayList<>();
        for (CompletableFuture<ExpressionTree> future : futures) {
            trees.add(join(future));
        }

        if (trees.size() == 1) {
            return trees.get(0);
        }
        return parallel(trees);
    }

    private static ExpressionTree join(CompletableFuture<ExpressionTree> future)
    {
        try {
            return future.join();
        }
        catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw ex;
        }
    }

    ExpressionTree structureComponent(DependencyGraph component)
    {
        // fails fast on cycles
        component.topologicalGenerations();
        return decompose(component, component.transitiveClosure());
    }

    private static ExpressionTree decompose(DependencyGraph graph, Map<String, ImmutableSortedSet<String>> reachable)
    {
        if (graph.getTasks().size() == 1) {
            return leaf(graph.getTasks().first());
        }

        List<ImmutableSortedSet<String>> branches = graph.weaklyConnectedComponents();
        if (branches.size() > 1) {
            List<ExpressionTree> children = new ArrayList<>();
            for (ImmutableSortedSet<String> branch : branches) {
                children.add(decompose(graph.subgraph(branch), reachable));
            }
            return parallel(children);
        }

        List<ImmutableSortedSet<String>> steps = seriesSteps(graph, reachable);
        if (steps.size() > 1) {
            List<ExpressionTree> children = new ArrayList<>();
            for (ImmutableSortedSet<String> step : steps) {
                ExpressionTree child = decompose(graph.subgraph(step), reachable);
                if (child instanceof ExpressionTree.Sequence) {
                    children.addAll(((ExpressionTree.Sequence) child).getChildren());
                }
                else {
                    children.add(child);
                }
            }
            return sequence(children);
        }

        logger.debug("{} is not series-parallel; layering by generation", graph.getTasks());
        return structureByGenerations(graph);
    }

    /**
     * Cuts a graph into the finest list of steps such that every task of a
     * step reaches every task of all later steps. Returns a single step when no
     * such cut exists.
     */
    static List<ImmutableSortedSet<String>> seriesSteps(DependencyGraph graph, Map<String, ImmutableSortedSet<String>> reachable)
    {
        List<String> order = new ArrayList<>();
        for (ImmutableSortedSet<String> generation : graph.topologicalGenerations()) {
            order.addAll(generation);
        }

        // every valid cut is a prefix of any topological order
        List<ImmutableSortedSet<String>> steps = new ArrayList<>();
        int start = 0;
        for (int cut = 1; cut <= order.size(); cut++) {
            List<String> later = order.subList(cut, order.size());
            if (cut == order.size() || reachesAll(order.subList(start, cut), later, reachable)) {
                steps.add(ImmutableSortedSet.copyOf(order.subList(start, cut)));
                start = cut;
            }
        }
        return steps;
    }

    private static boolean reachesAll(List<String> from, List<String> to, Map<String, ImmutableSortedSet<String>> reachable)
    {
        for (String task : from) {
            if (!reachable.get(task).containsAll(to)) {
                return false;
            }
        }
        return true;
    }

    private static ExpressionTree structureByGenerations(DependencyGraph graph)
    {
        List<ImmutableSortedSet<String>> generations = graph.topologicalGenerations();

        ImmutableSet<String> remaining = ImmutableSet.copyOf(graph.getTasks());
        List<ExpressionTree> steps = new ArrayList<>();
        for (int i = 0; i < generations.size(); i++) {
            List<String> layer = generations.get(i).stream()
                .filter(remaining::contains)
                .collect(Collectors.toList());
            if (layer.isEmpty()) {
                continue;
            }
            boolean lastGeneration = i == generations.size() - 1;
            LayerStep step = structureLayer(graph, layer, lastGeneration, remaining);
            logger.debug("Generation {}: {} -> {}", i, layer, step.tree);
            steps.add(step.tree);
            remaining = step.remaining;
        }

        if (steps.size() == 1) {
            return steps.get(0);
        }
        return sequence(steps);
    }

    /**
     * Result of structuring one generation, with the tasks still left to place.
     */
    private static class LayerStep
    {
        private final ExpressionTree tree;
        private final ImmutableSet<String> remaining;

        private LayerStep(ExpressionTree tree, ImmutableSet<String> remaining)
        {
            this.tree = tree;
            this.remaining = remaining;
        }
    }

    private static LayerStep structureLayer(DependencyGraph graph, List<String> layer, boolean lastGeneration, ImmutableSet<String> remaining)
    {
        if (layer.size() == 1) {
            String task = layer.get(0);
            List<String> run = lastGeneration ? ImmutableList.of(task) : sequenceRun(graph, task);
            return new LayerStep(runToTree(run), consume(remaining, run));
        }

        // group tasks sharing the same successors, in layer order
        Map<List<String>, List<String>> groups = new LinkedHashMap<>();
        for (String task : layer) {
            List<String> signature = ImmutableList.copyOf(graph.successors(task));
            groups.computeIfAbsent(signature, key -> new ArrayList<>()).add(task);
        }

        List<ExpressionTree> children = new ArrayList<>();
        for (List<String> group : groups.values()) {
            if (group.size() == 1) {
                List<String> run = sequenceRun(graph, group.get(0));
                children.add(runToTree(run));
                remaining = consume(remaining, run);
            }
            else {
                // members with identical successors are symmetric; keep them as sibling leaves
                for (String task : group) {
                    children.add(leaf(task));
                }
                remaining = consume(remaining, group);
            }
        }

        if (children.size() == 1) {
            return new LayerStep(children.get(0), remaining);
        }
        return new LayerStep(parallel(children), remaining);
    }

    /**
     * Follows one-to-one dependencies from {@code start}: while the current task
     * has exactly one successor and that successor has exactly one predecessor.
     * The returned chain always starts with {@code start}.
     */
    static List<String> sequenceRun(DependencyGraph graph, String start)
    {
        ImmutableList.Builder<String> run = ImmutableList.builder();
        run.add(start);
        String current = start;
        while (true) {
            Set<String> successors = graph.successors(current);
            if (successors.size() != 1) {
                break;
            }
            String next = successors.iterator().next();
            if (graph.predecessors(next).size() != 1) {
                break;
            }
            run.add(next);
            current = next;
        }
        return run.build();
    }

    private static ExpressionTree runToTree(List<String> run)
    {
        if (run.size() == 1) {
            return leaf(run.get(0));
        }
        return sequence(run.stream()
                .map(ExpressionTree::leaf)
                .collect(Collectors.toList()));
    }

    private static ImmutableSet<String> consume(ImmutableSet<String> remaining, List<String> tasks)
    {
        return Sets.difference(remaining, ImmutableSet.copyOf(tasks)).immutableCopy();
    }
}
