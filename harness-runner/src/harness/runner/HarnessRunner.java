/*
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package harness.runner;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import harness.core.Configuration;
import harness.core.ExitCode;
import harness.core.Run;
import harness.model.TestSuite;

/**
 * Command line entry point. Subclasses provide the suites, typically from a {@code main} method:
 *
 * <pre>
 *     public static void main(String... args)
 *     {
 *         new MySuites().run(args);
 *     }
 * </pre>
 *
 * Options given on the command line override the ones read from {@code --config}.
 */
@Command(name = "harness",
         mixinStandardHelpOptions = true,
         description = "Runs test suites. A failing case can be replayed with the --seed and --filter printed at the end of the run.")
public abstract class HarnessRunner implements Callable<Integer>
{
    public static final Logger logger = LoggerFactory.getLogger(HarnessRunner.class);

    @Option(names = "--config", description = "YAML run configuration.")
    File config;

    @Option(names = "--seed", description = "Run seed; a random one is generated when absent.")
    String seed;

    @Option(names = "--exec-key",
            converter = UnsignedLongConverter.class,
            description = "Execution key used for every execution instead of derived ones (unsigned 64 bit).")
    Long execKey;

    @Option(names = "--filter", description = "Name of the suite or case to run, ignoring case.")
    String filter;

    @Option(names = "--iterations", description = "Number of times each case runs.")
    Integer iterations;

    @Option(names = "--timeout", description = "Per-case timeout in seconds.")
    Integer timeout;

    @Option(names = "--no-color", description = "Disable ANSI colors in the output.")
    boolean noColor;

    @Option(names = "--list", description = "List suites and cases, then exit.")
    boolean list;

    protected abstract List<TestSuite> suites();

    /**
     * Parses {@code args}, runs, and exits the JVM with the run's exit code.
     */
    public void run(String... args)
    {
        System.exit(execute(args));
    }

    public int execute(String... args)
    {
        return new CommandLine(this).execute(args);
    }

    public Integer call() throws Exception
    {
        Run run = configuration().createRun();
        try
        {
            RunOrchestrator orchestrator = new RunOrchestrator(run);
            if (list)
            {
                orchestrator.listSuites(suites());
                return ExitCode.PASSED;
            }
            return orchestrator.execute(suites()).exitCode();
        }
        finally
        {
            logger.debug("Shutting down timer..");
            tryRun(run::close);
        }
    }

    /**
     * Run configuration: the {@code --config} file if given, with command line options applied on top.
     */
    public Configuration configuration() throws Exception
    {
        Configuration.ConfigurationBuilder builder = config == null
                                                     ? new Configuration.ConfigurationBuilder()
                                                     : Configuration.fromFile(loadConfig(config)).unbuild();
        if (seed != null)
            builder.setSeed(seed);
        if (execKey != null)
            builder.setExecKey(execKey);
        if (filter != null)
            builder.setFilter(filter);
        if (iterations != null)
            builder.setIterations(iterations);
        if (timeout != null)
            builder.setTestCaseTimeoutSeconds(timeout);
        if (noColor)
            builder.setColoredOutput(false);
        return builder.build();
    }

    public void tryRun(ThrowingRunnable runnable)
    {
        try
        {
            runnable.run();
        }
        catch (Throwable t)
        {
            logger.error("Encountered an error while shutting down, ignoring.", t);
        }
    }

    /**
     * Checks that the configuration YAML exists and is readable.
     * @throws Exception If file is not found or cannot be read.
     */
    public static File loadConfig(File configFile) throws Exception
    {
        if (!configFile.exists())
            throw new FileNotFoundException(configFile.getAbsolutePath());

        if (!configFile.canRead())
            throw new Exception("Cannot read config file, check your permissions on " + configFile.getAbsolutePath());

        return configFile;
    }

    public static class UnsignedLongConverter implements CommandLine.ITypeConverter<Long>
    {
        public Long convert(String value)
        {
            try
            {
                return Long.parseUnsignedLong(value);
            }
            catch (NumberFormatException e)
            {
                throw new CommandLine.TypeConversionException("'" + value + "' is not an unsigned 64 bit execution key");
            }
        }
    }
}
