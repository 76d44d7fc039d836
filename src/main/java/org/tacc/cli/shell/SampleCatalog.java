package org.tacc.cli.shell;

import org.tacc.compiler.frontend.io.SourceLoader;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * The example programs bundled under {@code samples/} on the classpath.
 */
public class SampleCatalog {

    /**
     * @param number   One-based menu number.
     * @param title    Short description shown in the menu.
     * @param resource Classpath resource holding the program.
     */
    public record Sample(int number, String title, String resource) {}

    private static final List<Sample> DEFAULT_SAMPLES = List.of(
            new Sample(1, "Basic if-else with multiple assignments", "samples/basic-if-else.tac"),
            new Sample(2, "Simple equality check", "samples/equality-check.tac"),
            new Sample(3, "Temperature monitoring system", "samples/temperature-monitor.tac"),
            new Sample(4, "Count and limit checker", "samples/count-limit.tac")
    );

    private final List<Sample> samples;

    public SampleCatalog() {
        this(DEFAULT_SAMPLES);
    }

    public SampleCatalog(List<Sample> samples) {
        this.samples = List.copyOf(samples);
    }

    public List<Sample> samples() {
        return samples;
    }

    /**
     * Looks up a sample by its menu number.
     *
     * @param number The one-based menu number.
     * @return The sample, or empty if no sample has this number.
     */
    public Optional<Sample> find(int number) {
        return samples.stream().filter(s -> s.number() == number).findFirst();
    }

    /**
     * Loads a sample's program text.
     *
     * @param sample The sample.
     * @return The program text.
     * @throws IOException If the resource is missing.
     */
    public String load(Sample sample) throws IOException {
        return SourceLoader.loadClasspath(sample.resource()).content();
    }
}
