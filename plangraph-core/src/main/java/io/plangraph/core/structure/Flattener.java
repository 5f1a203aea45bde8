package io.plangraph.core.structure;

import com.google.common.collect.ImmutableSet;
import io.plangraph.core.graph.Dependency;
import io.plangraph.core.graph.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Synthesizes the dependency graph encoded by an expression tree.
 *
 * Every exit point of a Sequence child precedes every entry point of the next
 * child. Parallel children get no edges between them.
 */
public class Flattener
{
    private static final Logger logger = LoggerFactory.getLogger(Flattener.class);

    /**
     * @throws StructureException if a task name appears in more than one leaf
     */
    public DependencyGraph flatten(ExpressionTree tree)
    {
        List<String> names = tree.getTaskNames();
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new StructureException("Task '" + name + "' appears more than once in the structure");
            }
        }

        EdgesAndExits result = edgesAndExits(tree);
        logger.debug("Flattened {} tasks into {} dependencies", names.size(), result.edges.size());
        return DependencyGraph.of(names, result.edges);
    }

    /**
     * Tasks of the tree that have no predecessor inside the tree.
     */
    public static Set<String> entryPoints(ExpressionTree tree)
    {
        return tree.accept(new ExpressionTree.Visitor<Set<String>>()
        {
            @Override
            public Set<String> visitLeaf(ExpressionTree.Leaf leaf)
            {
                return ImmutableSet.of(leaf.getName());
            }

            @Override
            public Set<String> visitSequence(ExpressionTree.Sequence sequence)
            {
                return entryPoints(sequence.getChildren().get(0));
            }

            @Override
            public Set<String> visitParallel(ExpressionTree.Parallel parallel)
            {
                ImmutableSet.Builder<String> builder = ImmutableSet.builder();
                for (ExpressionTree child : parallel.getChildren()) {
                    builder.addAll(entryPoints(child));
                }
                return builder.build();
            }
        });
    }

    /**
     * Tasks of the tree that have no successor inside the tree.
     */
    public static Set<String> exitPoints(ExpressionTree tree)
    {
        return edgesAndExits(tree).exits;
    }

    private static class EdgesAndExits
    {
        private final Set<Dependency> edges;
        private final Set<String> exits;

        private EdgesAndExits(Set<Dependency> edges, Set<String> exits)
        {
            this.edges = edges;
            this.exits = exits;
        }
    }

    private static EdgesAndExits edgesAndExits(ExpressionTree tree)
    {
        return tree.accept(new ExpressionTree.Visitor<EdgesAndExits>()
        {
            @Override
            public EdgesAndExits visitLeaf(ExpressionTree.Leaf leaf)
            {
                return new EdgesAndExits(ImmutableSet.of(), ImmutableSet.of(leaf.getName()));
            }

            @Override
            public EdgesAndExits visitSequence(ExpressionTree.Sequence sequence)
            {
                Set<Dependency> edges = new LinkedHashSet<>();
                Set<String> previousExits = null;
                for (ExpressionTree child : sequence.getChildren()) {
                    EdgesAndExits sub = edgesAndExits(child);
                    edges.addAll(sub.edges);
                    if (previousExits != null) {
                        Set<String> entries = entryPoints(child);
                        for (String from : previousExits) {
                            for (String to : entries) {
                                edges.add(Dependency.of(from, to));
                            }
                        }
                    }
                    previousExits = sub.exits;
                }
                return new EdgesAndExits(edges, previousExits);
            }

            @Override
            public EdgesAndExits visitParallel(ExpressionTree.Parallel parallel)
            {
                Set<Dependency> edges = new LinkedHashSet<>();
                List<String> exits = new ArrayList<>();
                for (ExpressionTree child : parallel.getChildren()) {
                    EdgesAndExits sub = edgesAndExits(child);
                    edges.addAll(sub.edges);
                    exits.addAll(sub.exits);
                }
                return new EdgesAndExits(edges, ImmutableSet.copyOf(exits));
            }
        });
    }
}
