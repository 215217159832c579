package io.shiplog.observability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public final class MetricsRegistry implements MetricsPublisher {
    private final Map<SeriesKey, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    @Override
    public void increment(String metric, long delta) {
        increment(metric, null, null, delta);
    }

    @Override
    public void increment(String metric, String label, String labelValue, long delta) {
        counters.computeIfAbsent(new SeriesKey(metric, label, labelValue), k -> new LongAdder()).add(delta);
    }

    @Override
    public void gauge(String metric, double value) {
        gauges.computeIfAbsent(metric, k -> new AtomicLong()).set(Double.doubleToLongBits(value));
    }

    public long counter(String metric) {
        return counter(metric, null, null);
    }

    public long counter(String metric, String label, String labelValue) {
        LongAdder adder = counters.get(new SeriesKey(metric, label, labelValue));
        return adder == null ? 0L : adder.sum();
    }

    public long counterTotal(String metric) {
        long total = 0L;
        for (Map.Entry<SeriesKey, LongAdder> e : counters.entrySet()) {
            if (e.getKey().metric().equals(metric)) {
                total += e.getValue().sum();
            }
        }
        return total;
    }

    public double gaugeValue(String metric) {
        AtomicLong bits = gauges.get(metric);
        return bits == null ? 0.0d : Double.longBitsToDouble(bits.get());
    }

    public Snapshot snapshot() {
        List<Sample> counterSamples = new ArrayList<>();
        for (Map.Entry<SeriesKey, LongAdder> e : counters.entrySet()) {
            SeriesKey key = e.getKey();
            counterSamples.add(new Sample(key.metric(), key.label(), key.labelValue(), e.getValue().sum()));
        }
        counterSamples.sort(Comparator.comparing(Sample::metric)
                .thenComparing(s -> s.labelValue() == null ? "" : s.labelValue()));
        List<Sample> gaugeSamples = new ArrayList<>();
        for (Map.Entry<String, AtomicLong> e : gauges.entrySet()) {
            gaugeSamples.add(new Sample(e.getKey(), null, null, Double.longBitsToDouble(e.getValue().get())));
        }
        gaugeSamples.sort(Comparator.comparing(Sample::metric));
        return new Snapshot(List.copyOf(counterSamples), List.copyOf(gaugeSamples));
    }

    public record Sample(String metric, String label, String labelValue, double value) {
    }

    public record Snapshot(List<Sample> counters, List<Sample> gauges) {
    }

    private record SeriesKey(String metric, String label, String labelValue) {
    }
}
