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

/**
 * Process exit statuses of a harness run.
 */
public final class ExitCode
{
    /**
     * Every executed test passed.
     */
    public static final int PASSED = 0;

    /**
     * At least one test failed.
     */
    public static final int FAILED = 1;

    /**
     * The run could not be set up: the seed could not be generated, or the filter matched nothing.
     */
    public static final int SETUP_FAILURE = 2;

    /**
     * There were no tests to run.
     */
    public static final int NO_TESTS = -1;

    /**
     * A test case exceeded the timeout and the process was terminated.
     */
    public static final int ABORTED = -1;

    private ExitCode()
    {
    }
}
