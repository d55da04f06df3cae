package io.minterm.benchmarks;

import io.minterm.classifier.MintermClassifier;
import io.minterm.kernel.CharRange;
import io.minterm.kernel.CharRangeSet;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class MintermClassifierBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        private MintermClassifier asciiClassifier;
        private MintermClassifier fullClassifier;
        private String asciiText;
        private String mixedText;
        private int[] destination;

        @Setup(Level.Trial)
        public void setUp() {
            var digits = CharRangeSet.of(CharRange.of('0', '9'));
            var letters = CharRangeSet.of(CharRange.of('A', 'Z'), CharRange.of('a', 'z'));
            var cjk = CharRangeSet.of(CharRange.of(0x4E00, 0x9FFF));
            asciiClassifier = MintermClassifier.of(digits, letters);
            fullClassifier = MintermClassifier.of(digits, letters, cjk);

            var ascii = new StringBuilder();
            var mixed = new StringBuilder();
            for (var i = 0; i < 10_000; i++) {
                ascii.append((char) ('!' + (i % 94)));
                mixed.append(i % 3 == 0 ? (char) (0x4E00 + (i % 0x5200)) : (char) ('!' + (i % 94)));
            }
            asciiText = ascii.toString();
            mixedText = mixed.toString();
            destination = new int[10_000];
        }
    }

    @Benchmark
    public int classifyAsciiTable(BenchmarkState state) {
        return state.asciiClassifier.classify(state.asciiText, state.destination);
    }

    @Benchmark
    public int classifyAsciiTableWithWideInput(BenchmarkState state) {
        return state.asciiClassifier.classify(state.mixedText, state.destination);
    }

    @Benchmark
    public int classifyFullTable(BenchmarkState state) {
        return state.fullClassifier.classify(state.mixedText, state.destination);
    }
}
