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
import java.util.logging.Logger;

import com.twitter.custom64.Codec;
import com.twitter.custom64.SymbolTables;
import org.junit.Test;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Base class for the codec benchmarks. Iteration counts, forks and the JSON report
 * directory can be overridden with the {@code warmupIterations},
 * {@code measureIterations}, {@code forks} and {@code perfReportDir} system properties.
 */
@Warmup(iterations = AbstractMicrobenchmarkBase.DEFAULT_WARMUP_ITERATIONS)
@Measurement(iterations = AbstractMicrobenchmarkBase.DEFAULT_MEASURE_ITERATIONS)
@Fork(value = AbstractMicrobenchmarkBase.DEFAULT_FORKS)
@State(Scope.Benchmark)
public abstract class AbstractMicrobenchmarkBase {
    private static final Logger logger = Logger.getLogger(AbstractMicrobenchmarkBase.class.getName());

    protected static final int DEFAULT_WARMUP_ITERATIONS = 5;
    protected static final int DEFAULT_MEASURE_ITERATIONS = 5;
    protected static final int DEFAULT_FORKS = 1;
    private static final String[] JVM_ARGS = {"-server", "-dsa", "-da", "-XX:+HeapDumpOnOutOfMemoryError"};

    /**
     * Creates a codec over the bundled symbol table.
     */
    protected static Codec newCodec() throws IOException {
        return new Codec(SymbolTables.defaultTable());
    }

    @Test
    public void run() throws Exception {
        final String className = getClass().getSimpleName();
        final ChainedOptionsBuilder options = new OptionsBuilder()
                .include(".*" + className + ".*")
                .jvmArgs(JVM_ARGS);

        final int warmupIterations = getIntProperty("warmupIterations");
        if (warmupIterations > 0) {
            options.warmupIterations(warmupIterations);
        }
        final int measureIterations = getIntProperty("measureIterations");
        if (measureIterations > 0) {
            options.measurementIterations(measureIterations);
        }
        final int forks = getIntProperty("forks");
        if (forks > 0) {
            options.forks(forks);
        }

        final String reportDir = System.getProperty("perfReportDir");
        if (reportDir != null) {
            options.resultFormat(ResultFormatType.JSON);
            options.result(reportFile(reportDir, className).getPath());
        }

        new Runner(options.build()).run();
    }

    /**
     * Returns the report file for the benchmark, creating its directory if needed.
     * An empty directory name stands for the working directory.
     */
    static File reportFile(final String reportDir, final String className) throws IOException {
        final File dir = new File(reportDir.isEmpty() ? "." : reportDir);
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("Unable to create report directory " + dir);
        }
        final File file = new File(dir, className + ".json");
        if (file.exists() && !file.delete()) {
            throw new IOException("Unable to delete stale report " + file);
        }
        return file;
    }

    // -1 when the property is unset or not a number
    private static int getIntProperty(final String key) {
        final String value = System.getProperty(key);
        if (value == null) {
            return -1;
        }
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            logger.warning("Ignoring system property '" + key + "', not an integer: " + value);
            return -1;
        }
    }
}
