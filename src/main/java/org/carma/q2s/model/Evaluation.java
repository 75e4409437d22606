package org.carma.q2s.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * A computed value together with the non-fatal diagnostics raised while computing it.
 *
 * Callers can inspect the diagnostics or ignore them; the value is always usable.
 */
public final class Evaluation<T> {

    private final T value;
    private final List<Diagnostic> diagnostics;

    public Evaluation(T value, List<Diagnostic> diagnostics) {
        this.value = value;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public static <T> Evaluation<T> of(T value) {
        return new Evaluation<>(value, List.of());
    }

    public static <T> Evaluation<T> of(T value, List<Diagnostic> diagnostics) {
        return new Evaluation<>(value, diagnostics);
    }

    public T getValue() {
        return value;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> diagnostics(Diagnostic.Kind kind) {
        List<Diagnostic> matching = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.kind() == kind) {
                matching.add(d);
            }
        }
        return matching;
    }

    public <R> Evaluation<R> map(Function<? super T, ? extends R> mapper) {
        return new Evaluation<>(mapper.apply(value), diagnostics);
    }

    /**
     * Append this evaluation's diagnostics to a collector and return the value.
     */
    public T drainInto(List<Diagnostic> collector) {
        collector.addAll(diagnostics);
        return value;
    }

    @Override
    public String toString() {
        if (diagnostics.isEmpty()) {
            return "Evaluation[" + value + "]";
        }
        return "Evaluation[" + value + ", " + diagnostics.size() + " diagnostics]";
    }
}
