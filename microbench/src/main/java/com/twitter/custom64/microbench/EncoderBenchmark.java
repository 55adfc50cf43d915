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

import com.twitter.custom64.Codec;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;

public class EncoderBenchmark extends AbstractMicrobenchmarkBase {

    @Param
    public TextSize size;

    @Param({"true", "false"})
    public boolean limitToAscii;

    @Param({"6", "5"})
    public int bitWidth;

    private Codec codec;
    private String input;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        codec = newCodec();
        input = size.newText(limitToAscii).value;
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    public void encode(final Blackhole bh) throws IOException {
        bh.consume(codec.encode(input, bitWidth));
    }
}
