package io.plangraph.core.structure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.plangraph.core.graph.CycleException;
import io.plangraph.core.graph.Dependency;
import io.plangraph.core.graph.DependencyGraph;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.plangraph.core.structure.ExpressionTree.leaf;
import static io.plangraph.core.structure.ExpressionTree.parallel;
import static io.plangraph.core.structure.ExpressionTree.sequence;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class StructurerTest
{
    @Rule public ExpectedException exception = ExpectedException.none();

    private Structurer structurer;
    private Flattener flattener;

    @Before
    public void setUp()
    {
        structurer = new Structurer();
        flattener = new Flattener();
    }

    private static DependencyGraph graph(String... edges)
    {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (String edge : edges) {
            String[] pair = edge.split("->");
            if (pair.length == 1) {
                builder.addTask(pair[0]);
            }
            else {
                builder.addDependency(pair[0], pair[1]);
            }
        }
        return builder.build();
    }

    @Test
    public void singleTask()
    {
        assertThat(structurer.structure(graph("a")), is(leaf("a")));
    }

    @Test
    public void chainBecomesSequence()
    {
        assertThat(structurer.structure(graph("a->b", "b->c")),
                is(sequence(leaf("a"), leaf("b"), leaf("c"))));
    }

    @Test
    public void diamond()
    {
        ExpressionTree tree = structurer.structure(graph("a->b", "a->c", "b->d", "c->d"));
        assertThat(tree, is(sequence(leaf("a"), parallel(leaf("b"), leaf("c")), leaf("d"))));
    }

    @Test
    public void disconnectedComponentsRunInParallel()
    {
        ExpressionTree tree = structurer.structure(graph("a->b", "c"));
        assertThat(tree, is(parallel(sequence(leaf("a"), leaf("b")), leaf("c"))));
        // components ordered by their smallest task
        assertThat(((ExpressionTree.Parallel) tree).getChildren().get(1), is(leaf("c")));
    }

    @Test
    public void independentTasks()
    {
        assertThat(structurer.structure(graph("b", "a", "c")),
                is(parallel(leaf("a"), leaf("b"), leaf("c"))));
    }

    @Test
    public void nestedSequenceInsideParallel()
    {
        DependencyGraph graph = graph("q1->q2", "q1->q3", "q2->q4", "q4->q5", "q3->q5");
        ExpressionTree tree = structurer.structure(graph);
        assertThat(tree, is(sequence(
                        leaf("q1"),
                        parallel(sequence(leaf("q2"), leaf("q4")), leaf("q3")),
                        leaf("q5"))));
        assertThat(flattener.flatten(tree), is(graph));
    }

    @Test
    public void transitiveEdgeIsImplied()
    {
        DependencyGraph graph = graph("a->b", "b->c", "a->c");
        ExpressionTree tree = structurer.structure(graph);
        assertThat(tree, is(sequence(leaf("a"), leaf("b"), leaf("c"))));
        assertThat(flattener.flatten(tree).transitiveClosure(), is(graph.transitiveClosure()));
    }

    @Test
    public void forkWithoutJoin()
    {
        assertThat(structurer.structure(graph("a->b", "a->c")),
                is(sequence(leaf("a"), parallel(leaf("b"), leaf("c")))));
    }

    @Test
    public void joinWithoutFork()
    {
        assertThat(structurer.structure(graph("a->c", "b->c")),
                is(sequence(parallel(leaf("a"), leaf("b")), leaf("c"))));
    }

    @Test
    public void nonSeriesParallelGraphKeepsEveryOrdering()
    {
        // a -> c, b -> c, b -> d can't be expressed exactly; a -> d gets added
        DependencyGraph graph = graph("a->c", "b->c", "b->d");
        ExpressionTree tree = structurer.structure(graph);
        assertThat(tree, is(sequence(parallel(leaf("a"), leaf("b")), parallel(leaf("c"), leaf("d")))));

        DependencyGraph flattened = flattener.flatten(tree);
        assertReachabilityContains(flattened, graph);
        assertTrue(flattened.getDependencies().contains(Dependency.of("a", "d")));
    }

    @Test
    public void everyTaskAppearsExactlyOnce()
    {
        DependencyGraph graph = graph("a->b", "a->c", "b->d", "c->d", "d->e", "c->f", "x->y", "z");
        ExpressionTree tree = structurer.structure(graph);
        assertThat(ImmutableList.sortedCopyOf(tree.getTaskNames()),
                contains("a", "b", "c", "d", "e", "f", "x", "y", "z"));
        assertReachabilityContains(flattener.flatten(tree), graph);
    }

    @Test
    public void cycleIsRejected()
    {
        try {
            structurer.structure(graph("a->b", "b->c", "c->a", "x"));
            fail();
        }
        catch (CycleException ex) {
            assertThat(ex.getUnresolvedTasks(), contains("a", "b", "c"));
        }
    }

    @Test
    public void emptyGraphIsRejected()
    {
        exception.expect(EmptyGraphException.class);
        exception.expectMessage("Empty graph");
        structurer.structure(graph());
    }

    @Test
    public void sequenceRunStopsAtJoin()
    {
        DependencyGraph graph = graph("a->b", "b->c", "x->c", "c->d");
        assertThat(Structurer.sequenceRun(graph, "a"), contains("a", "b"));
        assertThat(Structurer.sequenceRun(graph, "c"), contains("c", "d"));
    }

    @Test
    public void executorDoesNotChangeResult()
    {
        DependencyGraph graph = graph("a->b", "a->c", "b->d", "c->d", "e->f", "g", "h->i", "h->j");
        ExecutorService executor = Executors.newFixedThreadPool(4,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("structurer-test-%d").build());
        try {
            ExpressionTree pooled = new Structurer(executor).structure(graph);
            assertThat(pooled, is(structurer.structure(graph)));
            assertThat(pooled.getTaskNames(), is(structurer.structure(graph).getTaskNames()));
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void cycleIsReportedFromPooledExecutor()
    {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            exception.expect(CycleException.class);
            new Structurer(executor).structure(graph("a->b", "b->a", "c->d"));
        }
        finally {
            executor.shutdownNow();
        }
    }

    private static void assertReachabilityContains(DependencyGraph actual, DependencyGraph expected)
    {
        Map<String, ? extends Set<String>> actualClosure = actual.transitiveClosure();
        for (Map.Entry<String, ? extends Set<String>> entry : expected.transitiveClosure().entrySet()) {
            assertTrue(entry.getKey() + " reaches " + entry.getValue(),
                    actualClosure.get(entry.getKey()).containsAll(entry.getValue()));
        }
    }

    @Test
    public void linearChainOfFour()
    {
        DependencyGraph graph = graph("A->B", "B->C", "C->D");
        ExpressionTree tree = structurer.structure(graph);
        assertThat(tree, is(sequence(leaf("A"), leaf("B"), leaf("C"), leaf("D"))));
        assertThat(flattener.flatten(tree).getDependencies(), contains(
                    Dependency.of("A", "B"),
                    Dependency.of("B", "C"),
                    Dependency.of("C", "D")));
    }

    @Test
    public void branchesOfUnequalLengthStayIndependent()
    {
        ExpressionTree original = sequence(
                leaf("a"),
                parallel(sequence(leaf("b"), parallel(leaf("c"), leaf("d"))), leaf("e")),
                leaf("f"));
        DependencyGraph graph = flattener.flatten(original);

        ExpressionTree tree = structurer.structure(graph);
        assertThat(tree, is(original));
        assertThat(flattener.flatten(tree).transitiveClosure(), is(graph.transitiveClosure()));
    }

    @Test
    public void seriesParallelGraphsKeepTheirReachability()
    {
        List<DependencyGraph> graphs = ImmutableList.of(
                graph("a->b", "a->c", "b->d", "c->d"),
                graph("a->b", "b->c", "c->d", "a->e", "e->f", "f->d"),
                graph("a->b", "a->e", "b->c", "b->d", "c->f", "d->f", "e->f"),
                graph("s->x", "x->y", "y->t", "s->t", "t->u", "t->v"),
                graph("a->c", "b->c", "c->d", "c->e", "d->f", "e->f", "f->g", "p->q"));
        for (DependencyGraph graph : graphs) {
            ExpressionTree tree = structurer.structure(graph);
            DependencyGraph flattened = flattener.flatten(tree);
            assertThat(graph.toString(), flattened.getTasks(), is(graph.getTasks()));
            assertThat(graph.toString(), flattened.transitiveClosure(), is(graph.transitiveClosure()));
        }
    }

    @Test
    public void treeRoundTripKeepsExecutionOrder()
    {
        ExpressionTree tree = parallel(
                sequence(
                    parallel(leaf("a1"), sequence(leaf("a2"), leaf("a3"))),
                    leaf("a4"),
                    parallel(leaf("a5"), leaf("a6"), sequence(leaf("a7"), parallel(leaf("a8"), leaf("a9"))))),
                sequence(leaf("b1"), leaf("b2")));
        DependencyGraph graph = flattener.flatten(tree);
        ExpressionTree structured = structurer.structure(graph);

        assertThat(ImmutableList.sortedCopyOf(structured.getTaskNames()), is(ImmutableList.sortedCopyOf(tree.getTaskNames())));
        assertThat(flattener.flatten(structured).transitiveClosure(), is(graph.transitiveClosure()));
        assertThat(structured, is(tree));
    }

    @Test
    public void seriesStepsCutWhereEverythingBeforeReachesEverythingAfter()
    {
        DependencyGraph graph = graph("a->b", "a->e", "b->c", "b->d", "c->f", "d->f", "e->f");
        List<ImmutableSortedSet<String>> steps = Structurer.seriesSteps(graph, graph.transitiveClosure());
        assertThat(steps, contains(
                    ImmutableSortedSet.of("a"),
                    ImmutableSortedSet.of("b", "c", "d", "e"),
                    ImmutableSortedSet.of("f")));
    }

    @Test
    public void seriesStepsOfNonSeriesParallelGraph()
    {
        DependencyGraph graph = graph("a->c", "b->c", "b->d");
        assertThat(Structurer.seriesSteps(graph, graph.transitiveClosure()),
                contains(ImmutableSortedSet.of("a", "b", "c", "d")));
    }
}
