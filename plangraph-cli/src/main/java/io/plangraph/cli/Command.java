package io.plangraph.cli;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.common.io.CharStreams;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.plangraph.core.config.ConfigException;
import io.plangraph.core.config.ConverterConfig;
import io.plangraph.core.config.PropertyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.plangraph.cli.SystemExitException.systemExit;

public abstract class Command
{
    private static final Logger log = LoggerFactory.getLogger(Command.class);

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdIn protected InputStream in;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    protected Properties loadSystemProperties()
        throws IOException
    {
        // Property order of precedence:
        // 1. Explicit configuration file (if --config was specified)
        // 2. JVM System properties (-D... and -X...)
        // 3. PLANGRAPH_CONFIG env var
        // 4. Default config file (unless --config was specified)

        Properties props = new Properties();

        if (configPath == null) {
            Path defaultConfigPath = ConfigUtil.defaultConfigPath(env);
            try {
                props.putAll(PropertyUtils.loadFile(defaultConfigPath));
            }
            catch (NoSuchFileException ex) {
                log.trace("configuration file not found: {}", defaultConfigPath, ex);
            }
        }

        props.load(new StringReader(env.getOrDefault("PLANGRAPH_CONFIG", "")));

        props.putAll(System.getProperties());

        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }

        return props;
    }

    protected ConverterConfig loadConfig()
        throws IOException, SystemExitException
    {
        try {
            return ConverterConfig.fromProperties(loadSystemProperties());
        }
        catch (NoSuchFileException ex) {
            throw systemExit("Configuration file not found: " + ex.getFile());
        }
        catch (ConfigException ex) {
            throw systemExit(ex.getMessage());
        }
    }

    /**
     * Reads the file named by the only argument, or stdin without arguments.
     */
    protected String readInput()
        throws IOException, SystemExitException
    {
        if (args.isEmpty()) {
            return CharStreams.toString(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        String path = args.get(0);
        try {
            return new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);
        }
        catch (NoSuchFileException ex) {
            throw systemExit("File not found: " + path);
        }
    }

    protected ExecutorService structurerExecutor(ConverterConfig config)
    {
        if (config.getStructurerThreads() <= 1) {
            return MoreExecutors.newDirectExecutorService();
        }
        return Executors.newFixedThreadPool(config.getStructurerThreads(),
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("structurer-%d")
                .build()
                );
    }
}
