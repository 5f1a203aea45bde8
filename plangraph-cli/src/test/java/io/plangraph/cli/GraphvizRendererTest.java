package io.plangraph.cli;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.util.Locale.ENGLISH;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeFalse;

public class GraphvizRendererTest
{
    @Rule public TemporaryFolder folder = new TemporaryFolder();

    @Before
    public void requireShell()
    {
        assumeFalse(System.getProperty("os.name").toLowerCase(ENGLISH).startsWith("windows"));
    }

    @Test
    public void pipesGraphToCommand()
            throws Exception
    {
        Path output = folder.getRoot().toPath().resolve("graph.out");
        // stands in for dot: copies stdin to the path following -o
        GraphvizRenderer renderer = new GraphvizRenderer(
                ImmutableList.of("sh", "-c", "cat > \"$2\"", "sh"), output);

        renderer.render("digraph ExecutionGraph {\n  a;\n}\n");

        assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8),
                is("digraph ExecutionGraph {\n  a;\n}\n"));
    }

    @Test
    public void failingCommandReportsItsOutput()
    {
        GraphvizRenderer renderer = new GraphvizRenderer(
                ImmutableList.of("sh", "-c", "cat > /dev/null; echo 'syntax error in line 1' >&2; exit 3", "sh"),
                folder.getRoot().toPath().resolve("graph.png"));
        try {
            renderer.render("digraph {");
            fail();
        }
        catch (IOException ex) {
            assertThat(ex.getMessage(), containsString("exited with code 3"));
            assertThat(ex.getMessage(), containsString("syntax error in line 1"));
        }
    }
}
