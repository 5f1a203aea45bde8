package io.plangraph.core.notation;

import io.plangraph.core.structure.ExpressionTree;
import io.plangraph.core.structure.StructureException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static io.plangraph.core.structure.ExpressionTree.leaf;
import static io.plangraph.core.structure.ExpressionTree.parallel;
import static io.plangraph.core.structure.ExpressionTree.sequence;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class JsonStructureNotationTest
{
    @Rule public ExpectedException exception = ExpectedException.none();

    private final JsonStructureNotation json = new JsonStructureNotation();

    @Test
    public void readTree()
    {
        ExpressionTree tree = json.parse(
                "{\"type\":\"Sequence\",\"children\":[" +
                "{\"type\":\"Leaf\",\"name\":\"a\"}," +
                "{\"type\":\"Parallel\",\"children\":[{\"type\":\"Leaf\",\"name\":\"b\"},{\"type\":\"Leaf\",\"name\":\"c\"}]}" +
                "]}");
        assertThat(tree, is(sequence(leaf("a"), parallel(leaf("b"), leaf("c")))));
    }

    @Test
    public void writeTree()
    {
        String text = json.print(sequence(leaf("a"), leaf("b")));
        assertThat(text, containsString("\"type\" : \"Sequence\""));
        assertThat(text, containsString("\"name\" : \"a\""));
        assertThat(text, not(containsString("kind")));
        assertThat(text, not(containsString("taskNames")));
    }

    @Test
    public void writtenTextReadsBack()
    {
        ExpressionTree tree = parallel(sequence(leaf("x"), leaf("y z")), leaf("w"));
        assertThat(json.parse(json.print(tree)), is(tree));
    }

    @Test
    public void emptyChildrenIsAStructureError()
    {
        exception.expect(StructureException.class);
        exception.expectMessage("Sequence must have at least one child");
        json.parse("{\"type\":\"Sequence\",\"children\":[]}");
    }

    @Test
    public void malformedJsonReportsPosition()
    {
        try {
            json.parse("{\"type\":\"Leaf\",\n \"name\": }");
            fail();
        }
        catch (NotationException ex) {
            assertThat(ex.getMessage(), containsString("Invalid JSON structure"));
            assertThat(ex.getLine(), is(2));
        }
    }

    @Test
    public void unknownTypeIsRejected()
    {
        exception.expect(NotationException.class);
        json.parse("{\"type\":\"Loop\",\"children\":[]}");
    }

    @Test
    public void nullDocumentIsRejected()
    {
        exception.expect(NotationException.class);
        exception.expectMessage("JSON structure is empty");
        json.parse("null");
    }
}
