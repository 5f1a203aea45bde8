package io.plangraph.core.notation;

import io.plangraph.core.structure.ExpressionTree;
import org.junit.Test;

import static io.plangraph.core.structure.ExpressionTree.leaf;
import static io.plangraph.core.structure.ExpressionTree.parallel;
import static io.plangraph.core.structure.ExpressionTree.sequence;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class StructureNotationPrinterTest
{
    @Test
    public void printNested()
    {
        ExpressionTree tree = sequence(leaf("a"), parallel(leaf("b"), leaf("c")), leaf("d"));
        assertThat(new StructureNotationPrinter().print(tree), is(
                    "Sequence {\n" +
                    "  a,\n" +
                    "  Parallel {\n" +
                    "    b,\n" +
                    "    c\n" +
                    "  },\n" +
                    "  d\n" +
                    "}"));
    }

    @Test
    public void printLeaf()
    {
        assertThat(new StructureNotationPrinter().print(leaf("a")), is("a"));
    }

    @Test
    public void customIndent()
    {
        assertThat(new StructureNotationPrinter(4).print(parallel(leaf("a"), leaf("b"))),
                is("Parallel {\n    a,\n    b\n}"));
    }

    @Test
    public void quotesNamesThatNeedIt()
    {
        assertThat(new StructureNotationPrinter().print(sequence(leaf("load data"), leaf("x"))),
                is("Sequence {\n  \"load data\",\n  x\n}"));
    }

    @Test
    public void printedTextParsesBack()
    {
        ExpressionTree tree = parallel(
                sequence(leaf("Sequence"), leaf("a-b"), parallel(leaf("c"), sequence(leaf("d"), leaf("e")))),
                leaf("f"));
        StructureNotationParser parser = new StructureNotationParser();
        assertThat(parser.parse(new StructureNotationPrinter().print(tree)), is(tree));
        assertThat(parser.parse(new StructureNotationPrinter(0).print(tree)), is(tree));
    }
}
