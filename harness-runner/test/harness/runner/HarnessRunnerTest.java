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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import picocli.CommandLine;

import harness.core.Configuration;
import harness.core.ExitCode;
import harness.model.CaseOutcome;
import harness.model.TestSuite;

public class HarnessRunnerTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final List<String> executed = new ArrayList<>();

    private class Suites extends HarnessRunner
    {
        protected List<TestSuite> suites()
        {
            return Arrays.asList(TestSuite.builder("Arithmetic")
                                          .addCase("addition", "1 + 1", ctx -> {
                                              executed.add("addition");
                                              ctx.asserts().check(1 + 1 == 2, "1 + 1 == 2");
                                              return CaseOutcome.COMPLETED;
                                          })
                                          .addDisabledCase("division", null, ctx -> {
                                              executed.add("division");
                                              ctx.asserts().check(false, "division is broken");
                                              return CaseOutcome.COMPLETED;
                                          })
                                          .build());
        }
    }

    @Test
    public void optionsBuildTheConfiguration() throws Exception
    {
        Suites runner = new Suites();
        new CommandLine(runner).parseArgs("--seed", "0123456789ABCDEF",
                                          "--exec-key", "18446744073709551615",
                                          "--filter", "addition",
                                          "--iterations", "3",
                                          "--timeout", "10",
                                          "--no-color");

        Configuration config = runner.configuration();

        Assert.assertEquals("0123456789ABCDEF", config.seed);
        Assert.assertEquals(-1L, config.exec_key);
        Assert.assertEquals("addition", config.filter);
        Assert.assertEquals(3, config.iterations);
        Assert.assertEquals(10, config.test_case_timeout_seconds);
        Assert.assertFalse(config.colored_output);
    }

    @Test
    public void defaultsWithoutOptions() throws Exception
    {
        Suites runner = new Suites();
        new CommandLine(runner).parseArgs();

        Configuration config = runner.configuration();

        Assert.assertNull(config.seed);
        Assert.assertEquals(0, config.exec_key);
        Assert.assertEquals(Configuration.DEFAULT_ITERATIONS, config.iterations);
        Assert.assertTrue(config.colored_output);
    }

    @Test
    public void optionsOverrideConfigFile() throws Exception
    {
        File file = folder.newFile("run.yaml");
        Files.write(file.toPath(), "seed: FROMFILE\niterations: 7\ncolored_output: false\n".getBytes(StandardCharsets.UTF_8));
        Suites runner = new Suites();
        new CommandLine(runner).parseArgs("--config", file.getPath(), "--seed", "FROMCLI");

        Configuration config = runner.configuration();

        Assert.assertEquals("FROMCLI", config.seed);
        Assert.assertEquals(7, config.iterations);
        Assert.assertFalse(config.colored_output);
    }

    @Test(expected = FileNotFoundException.class)
    public void missingConfigFile() throws Exception
    {
        HarnessRunner.loadConfig(new File(folder.getRoot(), "absent.yaml"));
    }

    @Test
    public void malformedExecKeyIsAUsageError()
    {
        Assert.assertEquals(2, new Suites().execute("--exec-key", "-5"));
        Assert.assertEquals(2, new Suites().execute("--exec-key", "key"));
        Assert.assertTrue(executed.isEmpty());
    }

    @Test
    public void passingRun()
    {
        Assert.assertEquals(ExitCode.PASSED, new Suites().execute("--seed", "0123456789ABCDEF", "--no-color"));
        Assert.assertEquals(Arrays.asList("addition"), executed);
    }

    @Test
    public void filterForcesDisabledCase()
    {
        Assert.assertEquals(ExitCode.FAILED, new Suites().execute("--filter", "DIVISION", "--no-color"));
        Assert.assertEquals(Arrays.asList("division"), executed);
    }

    @Test
    public void unmatchedFilter()
    {
        Assert.assertEquals(ExitCode.SETUP_FAILURE, new Suites().execute("--filter", "subtraction", "--no-color"));
        Assert.assertTrue(executed.isEmpty());
    }

    @Test
    public void listingRunsNothing()
    {
        Assert.assertEquals(ExitCode.PASSED, new Suites().execute("--list"));
        Assert.assertTrue(executed.isEmpty());
    }
}
