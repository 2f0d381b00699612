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
 * Formats of the harness log lines.
 *
 * Log scrapers depend on these shapes:
 * <pre>
 *   &lt;Kind&gt; Summary: Total=N Passed=N Failed=N Skipped=N
 *   &gt;&gt;&gt; &lt;Kind&gt; '&lt;name&gt;': &lt;result&gt;
 *    --seed &lt;seed&gt; --filter &lt;case&gt;
 * </pre>
 * With colors enabled, ANSI escapes are added around individual fields.
 */
public class LogFormat
{
    public static final LogFormat COLORED = new LogFormat(true);
    public static final LogFormat PLAIN = new LogFormat(false);

    private static final String RED = "\033[0;31m";
    private static final String GREEN = "\033[0;32m";
    private static final String YELLOW = "\033[0;93m";
    private static final String BLUE = "\033[0;94m";
    private static final String END = "\033[0m";

    private final boolean colored;

    private LogFormat(boolean colored)
    {
        this.colored = colored;
    }

    public static LogFormat of(boolean colored)
    {
        return colored ? COLORED : PLAIN;
    }

    public String red(String s)
    {
        return color(RED, s);
    }

    public String green(String s)
    {
        return color(GREEN, s);
    }

    public String yellow(String s)
    {
        return color(YELLOW, s);
    }

    public String blue(String s)
    {
        return color(BLUE, s);
    }

    private String color(String color, String s)
    {
        return colored ? color + s + END : s;
    }

    public String finalResult(String kind, String name, String result)
    {
        return yellow(String.format(">>> %s '%s':", kind, name)) + ' ' + result;
    }

    public String summary(String kind, int total, int passed, int failed, int skipped)
    {
        String failedField = "Failed=" + failed;
        return String.format("%s Summary: Total=%d %s %s %s",
                             kind,
                             total,
                             green("Passed=" + passed),
                             failed == 0 ? green(failedField) : red(failedField),
                             blue("Skipped=" + skipped));
    }

    public String reproduction(String seed, String caseName)
    {
        return red(String.format(" --seed %s --filter %s", seed, caseName));
    }
}
