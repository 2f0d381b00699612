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

package harness.assertions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import harness.core.LogFormat;

public class AssertSummary implements AssertTracker
{
    private static final Logger logger = LoggerFactory.getLogger(AssertSummary.class);

    private final LogFormat format;

    private int passed;
    private int failed;

    public AssertSummary(LogFormat format)
    {
        this.format = format;
    }

    public boolean check(boolean condition, String messageFormat, Object... args)
    {
        String message = args.length == 0 ? messageFormat : String.format(messageFormat, args);
        if (condition)
        {
            passed++;
            logger.info("Assert '{}': {}", message, format.green("Passed"));
        }
        else
        {
            failed++;
            logger.error("Assert '{}': {}", message, format.red("Failed"));
        }
        return condition;
    }

    public int passed()
    {
        return passed;
    }

    public int failed()
    {
        return failed;
    }

    public void reset()
    {
        passed = 0;
        failed = 0;
    }

    public void logSummary()
    {
        int total = passed + failed;
        if (failed == 0)
            logger.info("Assert Summary: Total={} {} {}", total, format.green("Passed=" + passed), format.green("Failed=" + failed));
        else
            logger.error("Assert Summary: Total={} {} {}", total, format.green("Passed=" + passed), format.red("Failed=" + failed));
    }
}
