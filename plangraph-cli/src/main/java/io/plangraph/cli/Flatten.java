package io.plangraph.cli;

import com.beust.jcommander.Parameter;
import io.plangraph.core.config.ConverterConfig;
import io.plangraph.core.graph.DependencyGraph;
import io.plangraph.core.notation.DotGraphPrinter;
import io.plangraph.core.notation.JsonStructureNotation;
import io.plangraph.core.notation.StructureNotationParser;
import io.plangraph.core.structure.ExpressionTree;
import io.plangraph.core.structure.Flattener;

import static io.plangraph.cli.SystemExitException.systemExit;

public class Flatten
    extends Command
{
    @Parameter(names = {"--format"})
    String format = "text";

    @Override
    public void main()
            throws Exception
    {
        if (args.size() > 1) {
            throw usage(null);
        }
        if (!format.equals("text") && !format.equals("json")) {
            throw usage("Unknown format '" + format + "'");
        }
        flatten();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " flatten [plan.txt] [options...]");
        err.println("  Options:");
        err.println("        --format text|json           input format (default: text)");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }

    private void flatten()
            throws Exception
    {
        ConverterConfig config = loadConfig();
        String text = readInput();

        ExpressionTree tree;
        if (format.equals("json")) {
            tree = new JsonStructureNotation().parse(text);
        }
        else {
            tree = new StructureNotationParser().parse(text);
        }
        DependencyGraph graph = new Flattener().flatten(tree);

        out.print(new DotGraphPrinter(config.getGraphName()).print(graph));
    }
}
