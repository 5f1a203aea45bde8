package io.plangraph.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Map;

import static io.plangraph.cli.ConfigUtil.defaultConfigPath;
import static io.plangraph.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "plangraph";

    // log level -> print stack traces of failures
    private static final ImmutableMap<String, Boolean> LOG_LEVELS = ImmutableMap.<String, Boolean>builder()
        .put("error", false)
        .put("warn", false)
        .put("info", false)
        .put("debug", true)
        .put("trace", true)
        .build();

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err, InputStream in)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.in = in;
        this.programName = System.getProperty("io.plangraph.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    private static class GlobalOptions
    {
        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    private class CliModule
            extends AbstractModule
    {
        @Override
        protected void configure()
        {
            bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
            bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
            bind(InputStream.class).annotatedWith(StdIn.class).toInstance(in);
            bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
            bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
        }
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err, System.in).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    private JCommander buildCommander(GlobalOptions globals)
    {
        Injector injector = Guice.createInjector(new CliModule());

        JCommander jc = new JCommander(globals);
        jc.setProgramName(programName);
        jc.addCommand("structure", injector.getInstance(Structure.class), "s");
        jc.addCommand("flatten", injector.getInstance(Flatten.class), "f");
        jc.addCommand("flowchart", injector.getInstance(Flowchart.class));
        jc.addCommand("render", injector.getInstance(Render.class));
        jc.addCommand("sync", injector.getInstance(Sync.class));

        // task files are never @-argument files
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));
        return jc;
    }

    public int cli(String... args)
    {
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        GlobalOptions globals = new GlobalOptions();
        JCommander jc = buildCommander(globals);

        boolean verbose = false;
        try {
            Command command = parseCommand(jc, globals, args);
            verbose = prepare(command);
            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getErrorMessage().isPresent()) {
                err.println("error: " + ex.getErrorMessage().get());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            reportFailure(ex, verbose);
            return 1;
        }
    }

    private Command parseCommand(JCommander jc, GlobalOptions globals, String... args)
            throws SystemExitException
    {
        try {
            jc.parse(args);
        }
        catch (MissingCommandException ex) {
            throw usage("available commands are: " + jc.getCommands().keySet());
        }

        String name = jc.getParsedCommand();
        if (globals.help || name == null) {
            throw usage(null);
        }
        return (Command) jc.getCommands().get(name).getObjects().get(0);
    }

    /**
     * Applies the options every command shares. Returns true when failures
     * should be printed with stack traces.
     */
    private boolean prepare(Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        Boolean verbose = LOG_LEVELS.get(command.logLevel);
        if (verbose == null) {
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        configureLogging(command.logLevel, command.logPath);

        // -X entries become converter config properties through the system properties
        command.systemProperties.forEach(System::setProperty);

        return verbose;
    }

    private void reportFailure(Exception ex, boolean verbose)
    {
        String message = formatExceptionMessage(ex);
        if (message.trim().isEmpty()) {
            ex.printStackTrace(err);
            return;
        }
        err.println("error: " + message);
        if (verbose) {
            ex.printStackTrace(err);
        }
    }

    private static void configureLogging(String level, String logPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // the XML resources read these as ${...} variables
        System.setProperty("plangraph.log.level", Level.toLevel(level.toUpperCase(ENGLISH), Level.INFO).toString());

        String resource = "/io/plangraph/cli/logback-console.xml";
        if (!logPath.equals("-")) {
            System.setProperty("plangraph.log.path", logPath);
            resource = "/io/plangraph/cli/logback-file.xml";
        }
        try {
            configurator.doConfigure(Main.class.getResource(resource));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        for (Throwable cause : Throwables.getCausalChain(ex)) {
            String message = cause.getMessage();
            if (message == null || sb.indexOf(message) >= 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(message);
        }
        if (sb.length() == 0) {
            return ex.toString();
        }
        return sb.toString();
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    s[tructure] [graph.dot]            convert a dependency graph to structured notation");
        err.println("    f[latten] [plan.txt]               convert structured notation to a dependency graph");
        err.println("    flowchart [graph.dot]              convert a dependency graph to a Mermaid flowchart");
        err.println("    render [graph.dot]                 draw a dependency graph with Graphviz");
        err.println("    sync --from PANE [file]            convert one notation to all the others");
        err.println("  Input is read from stdin when the file is omitted.");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
        }
        return systemExit(error);
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     add a converter config property");
        err.println("    -c, --config PATH.properties     Configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("");
    }
}
