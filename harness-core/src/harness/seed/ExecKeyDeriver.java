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

package harness.seed;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the execution key that seeds the fuzzer for a single (suite, case, iteration) execution.
 *
 * The key is the first 8 bytes (little-endian) of the MD5 digest of the run seed, suite name, case name and
 * decimal iteration number, concatenated without separators and followed by a single zero byte. This layout
 * has to stay stable: recorded {@code --seed}/{@code --filter} pairs rely on it to reproduce failures.
 *
 * Note that fields are not delimited, so suite "AB" with case "C" hashes the same bytes as suite "A" with
 * case "BC".
 */
public final class ExecKeyDeriver
{
    private static final Logger logger = LoggerFactory.getLogger(ExecKeyDeriver.class);

    /**
     * Returned for invalid arguments; callers also pass it to mean "no key forced".
     */
    public static final long NO_KEY = 0L;

    private ExecKeyDeriver()
    {
    }

    /**
     * @return the execution key, or {@link #NO_KEY} (after logging the reason) if an argument is empty or
     *         {@code iteration} is not positive
     */
    public static long derive(String runSeed, String suiteName, String caseName, int iteration)
    {
        if (Strings.isNullOrEmpty(runSeed))
            return invalid("Invalid runSeed string.");
        if (Strings.isNullOrEmpty(suiteName))
            return invalid("Invalid suiteName string.");
        if (Strings.isNullOrEmpty(caseName))
            return invalid("Invalid testName string.");
        if (iteration <= 0)
            return invalid("Invalid iteration count.");

        byte[] input = (runSeed + suiteName + caseName + iteration).getBytes(StandardCharsets.UTF_8);
        MessageDigest md5 = md5();
        md5.update(input);
        md5.update((byte) 0);
        return ByteBuffer.wrap(md5.digest())
                         .order(ByteOrder.LITTLE_ENDIAN)
                         .getLong();
    }

    private static long invalid(String message)
    {
        logger.error(message);
        return NO_KEY;
    }

    private static MessageDigest md5()
    {
        try
        {
            return MessageDigest.getInstance("MD5");
        }
        catch (NoSuchAlgorithmException e)
        {
            throw new IllegalStateException(e);
        }
    }
}
