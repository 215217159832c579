package io.shiplog.observability;

public interface MetricsPublisher {
    void increment(String metric, long delta);

    void increment(String metric, String label, String labelValue, long delta);

    void gauge(String metric, double value);

    MetricsPublisher NOOP = new MetricsPublisher() {
        @Override
        public void increment(String metric, long delta) {
        }

        @Override
        public void increment(String metric, String label, String labelValue, long delta) {
        }

        @Override
        public void gauge(String metric, double value) {
        }
    };
}
