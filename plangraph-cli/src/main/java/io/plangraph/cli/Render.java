package io.plangraph.cli;

import com.beust.jcommander.Parameter;
import io.plangraph.core.config.ConverterConfig;
import io.plangraph.core.notation.DotGraphParser;

import java.nio.file.Paths;

import static io.plangraph.cli.SystemExitException.systemExit;

public class Render
    extends Command
{
    @Parameter(names = {"-o", "--output"})
    String output = "plangraph.png";

    @Override
    public void main()
            throws Exception
    {
        if (args.size() > 1) {
            throw usage(null);
        }

        ConverterConfig config = loadConfig();
        String dot = readInput();
        // fail with a line number before handing broken input to graphviz
        new DotGraphParser().parse(dot);

        GraphvizRenderer renderer = new GraphvizRenderer(config.getRenderCommand(), Paths.get(output));
        renderer.render(dot);
        err.println("Stored PNG file at '" + renderer.getOutput() + "'");
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " render [graph.dot] [options...]");
        err.println("  Options:");
        err.println("    -o, --output PATH.png            store a PNG file to this path (default: plangraph.png)");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
