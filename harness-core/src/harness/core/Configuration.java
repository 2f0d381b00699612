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

package harness.core;

import java.io.File;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.google.common.base.Preconditions;

/**
 * Settings of a single harness run. Can be round-tripped through YAML, so a failing run can be written out and
 * replayed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Configuration
{
    public static final int DEFAULT_TEST_CASE_TIMEOUT_SECONDS = 3600;
    public static final int DEFAULT_ITERATIONS = 1;

    private static final ObjectMapper mapper;

    static
    {
        mapper = new ObjectMapper(new YAMLFactory()
                                  .disable(YAMLGenerator.Feature.USE_NATIVE_TYPE_ID)
                                  .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                                  .disable(YAMLGenerator.Feature.CANONICAL_OUTPUT)
                                  .enable(YAMLGenerator.Feature.INDENT_ARRAYS));
    }

    /**
     * Run seed; generated when {@code null} or empty.
     */
    public final String seed;

    /**
     * Execution key used for every execution instead of derived ones; 0 when not forced.
     */
    public final long exec_key;

    /**
     * Suite or case name to run; {@code null} or empty runs everything.
     */
    public final String filter;

    public final int iterations;
    public final int test_case_timeout_seconds;
    public final boolean colored_output;

    @JsonCreator
    public Configuration(@JsonProperty("seed") String seed,
                         @JsonProperty("exec_key") long exec_key,
                         @JsonProperty("filter") String filter,
                         @JsonProperty(value = "iterations", defaultValue = "1") Integer iterations,
                         @JsonProperty(value = "test_case_timeout_seconds", defaultValue = "3600") Integer test_case_timeout_seconds,
                         @JsonProperty(value = "colored_output", defaultValue = "true") Boolean colored_output)
    {
        this.seed = seed;
        this.exec_key = exec_key;
        this.filter = filter;
        this.iterations = iterations == null ? DEFAULT_ITERATIONS : iterations;
        this.test_case_timeout_seconds = test_case_timeout_seconds == null ? DEFAULT_TEST_CASE_TIMEOUT_SECONDS : test_case_timeout_seconds;
        this.colored_output = colored_output == null || colored_output;
    }

    public static String toYamlString(Configuration config)
    {
        try
        {
            return mapper.writeValueAsString(config);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static Configuration fromYamlString(String config)
    {
        try
        {
            return mapper.readValue(config, Configuration.class);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static Configuration fromFile(String path)
    {
        return fromFile(new File(path));
    }

    public static Configuration fromFile(File file)
    {
        try
        {
            return mapper.readValue(file, Configuration.class);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static void validate(Configuration config)
    {
        Preconditions.checkArgument(config.test_case_timeout_seconds >= 0,
                                    "Test case timeout should not be negative, but was %s", config.test_case_timeout_seconds);
    }

    public Run createRun()
    {
        return createRun(this);
    }

    public static Run createRun(Configuration snapshot)
    {
        return new Run.Builder(snapshot).build();
    }

    public static class ConfigurationBuilder
    {
        String seed;
        long exec_key;
        String filter;
        int iterations = DEFAULT_ITERATIONS;
        int test_case_timeout_seconds = DEFAULT_TEST_CASE_TIMEOUT_SECONDS;
        boolean colored_output = true;

        public ConfigurationBuilder setSeed(String seed)
        {
            this.seed = seed;
            return this;
        }

        public ConfigurationBuilder setExecKey(long exec_key)
        {
            this.exec_key = exec_key;
            return this;
        }

        public ConfigurationBuilder setFilter(String filter)
        {
            this.filter = filter;
            return this;
        }

        public ConfigurationBuilder setIterations(int iterations)
        {
            this.iterations = iterations;
            return this;
        }

        public ConfigurationBuilder setTestCaseTimeoutSeconds(int test_case_timeout_seconds)
        {
            this.test_case_timeout_seconds = test_case_timeout_seconds;
            return this;
        }

        public ConfigurationBuilder setColoredOutput(boolean colored_output)
        {
            this.colored_output = colored_output;
            return this;
        }

        public Configuration build()
        {
            return new Configuration(seed,
                                     exec_key,
                                     filter,
                                     iterations,
                                     test_case_timeout_seconds,
                                     colored_output);
        }
    }

    public ConfigurationBuilder unbuild()
    {
        ConfigurationBuilder builder = new ConfigurationBuilder();
        builder.seed = seed;
        builder.exec_key = exec_key;
        builder.filter = filter;
        builder.iterations = iterations;
        builder.test_case_timeout_seconds = test_case_timeout_seconds;
        builder.colored_output = colored_output;
        return builder;
    }
}
