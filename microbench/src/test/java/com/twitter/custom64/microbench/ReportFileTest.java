/*
 * Copyright 2015 Twitter, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.twitter.custom64.microbench;

import java.io.File;
import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ReportFileTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testEmptyDirectoryIsWorkingDirectory() throws IOException {
        final File file = AbstractMicrobenchmarkBase.reportFile("", "NoSuchBenchmark");
        assertEquals(new File(".", "NoSuchBenchmark.json"), file);
    }

    @Test
    public void testCreatesMissingDirectories() throws IOException {
        final File dir = new File(folder.getRoot(), "a/b");
        final File file = AbstractMicrobenchmarkBase.reportFile(dir.getPath(), "EncoderBenchmark");
        assertTrue(dir.isDirectory());
        assertEquals(new File(dir, "EncoderBenchmark.json"), file);
    }

    @Test
    public void testDeletesStaleReport() throws IOException {
        final File stale = folder.newFile("DecoderBenchmark.json");
        final File file = AbstractMicrobenchmarkBase.reportFile(folder.getRoot().getPath(), "DecoderBenchmark");
        assertEquals(stale, file);
        assertFalse(stale.exists());
    }

    @Test(expected = IOException.class)
    public void testDirectoryIsAFile() throws IOException {
        final File notADir = folder.newFile("report");
        AbstractMicrobenchmarkBase.reportFile(notADir.getPath(), "EncoderBenchmark");
    }
}
