package io.plangraph.cli;

import com.beust.jcommander.Parameter;
import io.plangraph.core.config.ConverterConfig;
import io.plangraph.core.notation.FlowchartConverter;

import static io.plangraph.cli.SystemExitException.systemExit;

public class Flowchart
    extends Command
{
    @Parameter(names = {"-r", "--reverse"})
    boolean reverse = false;

    @Override
    public void main()
            throws Exception
    {
        if (args.size() > 1) {
            throw usage(null);
        }

        ConverterConfig config = loadConfig();
        FlowchartConverter converter = new FlowchartConverter(config.getGraphName());
        String text = readInput();
        if (reverse) {
            out.print(converter.toGraphDescription(text));
        }
        else {
            out.print(converter.toFlowchart(text));
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " flowchart [file] [options...]");
        err.println("  Options:");
        err.println("    -r, --reverse                    read a flowchart and write a dependency graph");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
