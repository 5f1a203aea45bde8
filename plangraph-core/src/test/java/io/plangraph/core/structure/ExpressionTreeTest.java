package io.plangraph.core.structure;

import com.google.common.collect.ImmutableList;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static io.plangraph.core.structure.ExpressionTree.leaf;
import static io.plangraph.core.structure.ExpressionTree.parallel;
import static io.plangraph.core.structure.ExpressionTree.sequence;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

public class ExpressionTreeTest
{
    @Rule public ExpectedException exception = ExpectedException.none();

    @Test
    public void parallelEqualityIgnoresChildOrder()
    {
        assertThat(parallel(leaf("a"), leaf("b")), is(parallel(leaf("b"), leaf("a"))));
        assertThat(parallel(leaf("a"), leaf("b")).hashCode(), is(parallel(leaf("b"), leaf("a")).hashCode()));
    }

    @Test
    public void sequenceEqualityIsOrdered()
    {
        assertThat(sequence(leaf("a"), leaf("b")), is(not(sequence(leaf("b"), leaf("a")))));
    }

    @Test
    public void kindsAreDistinct()
    {
        assertThat(sequence(leaf("a"), leaf("b")), is(not((ExpressionTree) parallel(leaf("a"), leaf("b")))));
        assertThat(sequence(leaf("a")).getKind(), is(ExpressionTree.Kind.SEQUENCE));
        assertThat(leaf("a").getKind(), is(ExpressionTree.Kind.LEAF));
    }

    @Test
    public void parallelCountsRepeatedChildren()
    {
        assertThat(parallel(leaf("a"), leaf("a"), leaf("b")), is(not(parallel(leaf("a"), leaf("b"), leaf("b")))));
    }

    @Test
    public void taskNamesInTreeOrder()
    {
        ExpressionTree tree = sequence(leaf("z"), parallel(leaf("b"), sequence(leaf("a"), leaf("c"))));
        assertThat(tree.getTaskNames(), contains("z", "b", "a", "c"));
    }

    @Test
    public void emptySequenceIsRejected()
    {
        exception.expect(StructureException.class);
        exception.expectMessage("Sequence must have at least one child");
        sequence(ImmutableList.<ExpressionTree>of());
    }

    @Test
    public void emptyParallelIsRejected()
    {
        exception.expect(StructureException.class);
        exception.expectMessage("Parallel must have at least one child");
        parallel();
    }

    @Test
    public void emptyLeafNameIsRejected()
    {
        exception.expect(StructureException.class);
        leaf("");
    }

    @Test
    public void visitorDispatch()
    {
        ExpressionTree.Visitor<String> visitor = new ExpressionTree.Visitor<String>()
        {
            @Override
            public String visitLeaf(ExpressionTree.Leaf leaf)
            {
                return "leaf " + leaf.getName();
            }

            @Override
            public String visitSequence(ExpressionTree.Sequence sequence)
            {
                return "sequence of " + sequence.getChildren().size();
            }

            @Override
            public String visitParallel(ExpressionTree.Parallel parallel)
            {
                return "parallel of " + parallel.getChildren().size();
            }
        };
        assertThat(leaf("x").accept(visitor), is("leaf x"));
        assertThat(sequence(leaf("x"), leaf("y")).accept(visitor), is("sequence of 2"));
        assertThat(parallel(leaf("x")).accept(visitor), is("parallel of 1"));
    }

    @Test
    public void readableToString()
    {
        assertThat(sequence(leaf("a"), parallel(leaf("b"), leaf("c"))).toString(), is("Sequence{a, Parallel{b, c}}"));
    }
}
