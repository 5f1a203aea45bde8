package io.plangraph.cli;

import com.beust.jcommander.Parameter;
import io.plangraph.core.config.ConverterConfig;
import io.plangraph.core.graph.DependencyGraph;
import io.plangraph.core.notation.DotGraphParser;
import io.plangraph.core.notation.JsonStructureNotation;
import io.plangraph.core.notation.StructureNotationPrinter;
import io.plangraph.core.structure.EmptyGraphException;
import io.plangraph.core.structure.ExpressionTree;
import io.plangraph.core.structure.Structurer;

import java.util.concurrent.ExecutorService;

import static io.plangraph.cli.SystemExitException.systemExit;

public class Structure
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
        structure();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " structure [graph.dot] [options...]");
        err.println("  Options:");
        err.println("        --format text|json           output format (default: text)");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }

    private void structure()
            throws Exception
    {
        ConverterConfig config = loadConfig();
        DependencyGraph graph = new DotGraphParser().parse(readInput());

        ExpressionTree tree;
        ExecutorService executor = structurerExecutor(config);
        try {
            tree = new Structurer(executor).structure(graph);
        }
        catch (EmptyGraphException ex) {
            err.println(ex.getMessage());
            return;
        }
        finally {
            executor.shutdown();
        }

        if (format.equals("json")) {
            out.println(new JsonStructureNotation().print(tree));
        }
        else {
            out.println(new StructureNotationPrinter(config.getIndent()).print(tree));
        }
    }
}
