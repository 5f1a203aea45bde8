package io.plangraph.cli;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import io.plangraph.core.sync.GraphRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipes graph-description text to Graphviz and stores the image at a fixed path.
 */
public class GraphvizRenderer
        implements GraphRenderer
{
    private static final Logger logger = LoggerFactory.getLogger(GraphvizRenderer.class);

    private final List<String> commands;
    private final Path output;

    public GraphvizRenderer(List<String> commands, Path output)
    {
        this.commands = ImmutableList.copyOf(commands);
        this.output = output;
    }

    public Path getOutput()
    {
        return output;
    }

    @Override
    public void render(String graphDescription)
            throws IOException
    {
        List<String> c = new ArrayList<>(commands);
        c.add("-o");
        c.add(output.toAbsolutePath().toString());
        logger.debug("Running {}", c);

        ProcessBuilder pb = new ProcessBuilder(c);
        pb.redirectErrorStream(true);

        final Process p = pb.start();

        ByteArrayOutputStream message = new ByteArrayOutputStream();
        Thread t = new Thread(() -> {
            try (InputStream stdout = p.getInputStream()) {
                ByteStreams.copy(stdout, message);
            }
            catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
        t.start();

        try (OutputStream stdin = p.getOutputStream()) {
            stdin.write(graphDescription.getBytes(StandardCharsets.UTF_8));
        }

        int ecode;
        try {
            ecode = p.waitFor();
            t.join();
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            p.destroy();
            throw new InterruptedIOException("Interrupted while waiting for " + commands.get(0));
        }

        if (ecode != 0) {
            throw new IOException(commands.get(0) + " exited with code " + ecode + ": "
                    + new String(message.toByteArray(), StandardCharsets.UTF_8).trim());
        }
    }
}
