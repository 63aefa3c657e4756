package io.github.cyfko.mathql.core.channel;

import io.github.cyfko.mathql.core.api.ExpressionEngine;
import io.github.cyfko.mathql.core.impl.BasicExpressionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the per-tick math channel sampler.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
class MathChannelHistoryTest {

    private static final DeviceChannel VOLTAGE = new DeviceChannel("ch-v", "dev-v", "Voltage", "#1f77b4");
    private static final DeviceChannel CURRENT = new DeviceChannel("ch-i", "dev-i", "Current", "#ff7f0e");
    private static final List<DeviceChannel> DEVICE_CHANNELS = List.of(VOLTAGE, CURRENT);

    private static final MathChannelConfig POWER = new MathChannelConfig("math-p", "Power", "W", "a * b", List.of(
            new MathChannelInput("ch-v", "a"),
            new MathChannelInput("ch-i", "b")
    ));

    @Mock
    private ExpressionEngine engine;

    private MathChannelHistory history;

    private Map<String, List<MeasurementSample>> measurements;

    private static MeasurementSample sample(String deviceId, double value, long timestamp) {
        return new MeasurementSample(deviceId, "DMM", deviceId, value, "", timestamp);
    }

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        history = new MathChannelHistory(engine, 3);
        measurements = new HashMap<>();
        measurements.put("dev-v", List.of(sample("dev-v", 1.0, 100L), sample("dev-v", 2.0, 200L)));
        measurements.put("dev-i", List.of(sample("dev-i", 3.0, 150L)));
    }

    @Test
    @DisplayName("Constructor validation")
    void constructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new MathChannelHistory(null));
        assertThrows(IllegalArgumentException.class, () -> new MathChannelHistory(engine, 0));
        assertEquals(MathChannelHistory.DEFAULT_HISTORY_LIMIT, new MathChannelHistory(engine).getLimit());
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("Binds the latest sample of each input and stamps the newest timestamp")
        void bindsLatestSamples() {
            // Given
            when(engine.evaluate(eq("a * b"), anyMap())).thenReturn(6.0);

            // When
            boolean changed = history.update(DEVICE_CHANNELS, List.of(POWER), measurements);

            // Then
            assertTrue(changed);
            verify(engine).evaluate("a * b", Map.of("a", 2.0, "b", 3.0));
            assertEquals(List.of(new MeasurementSample("math-p", "Math", "Power", 6.0, "W", 200L)),
                    history.history("math-p"));
        }

        @Test
        @DisplayName("Missing samples or channels skip the evaluation")
        void missingInputs() {
            measurements.remove("dev-i");

            assertTrue(history.update(DEVICE_CHANNELS, List.of(POWER), measurements));
            assertTrue(history.history("math-p").isEmpty());

            assertFalse(history.update(List.of(VOLTAGE), List.of(POWER), measurements));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("Channels without inputs are never evaluated")
        void noInputs() {
            MathChannelConfig empty = new MathChannelConfig("math-e", "Empty", "", "1 + 1", List.of());

            history.update(DEVICE_CHANNELS, List.of(empty), measurements);

            verifyNoInteractions(engine);
            assertTrue(history.snapshot().containsKey("math-e"));
        }

        @Test
        @DisplayName("A null evaluation keeps the history")
        void nullEvaluation() {
            when(engine.evaluate(anyString(), anyMap())).thenReturn(6.0, (Double) null);
            history.update(DEVICE_CHANNELS, List.of(POWER), measurements);

            measurements.put("dev-i", List.of(sample("dev-i", 0.0, 300L)));
            boolean changed = history.update(DEVICE_CHANNELS, List.of(POWER), measurements);

            assertFalse(changed);
            assertEquals(1, history.history("math-p").size());
        }
    }

    @Nested
    @DisplayName("History maintenance")
    class Maintenance {

        @Test
        @DisplayName("Same timestamp replaces the last sample")
        void sameTimestampReplaces() {
            when(engine.evaluate(anyString(), anyMap())).thenReturn(6.0, 7.0, 7.0);

            history.update(DEVICE_CHANNELS, List.of(POWER), measurements);
            assertTrue(history.update(DEVICE_CHANNELS, List.of(POWER), measurements));
            assertFalse(history.update(DEVICE_CHANNELS, List.of(POWER), measurements));

            List<MeasurementSample> samples = history.history("math-p");
            assertEquals(1, samples.size());
            assertEquals(7.0, samples.get(0).value());
        }

        @Test
        @DisplayName("Oldest samples are dropped beyond the limit")
        void trimmedToLimit() {
            when(engine.evaluate(anyString(), anyMap())).thenReturn(1.0, 2.0, 3.0, 4.0, 5.0);

            for (int tick = 0; tick < 5; tick++) {
                measurements.put("dev-v", List.of(sample("dev-v", tick, 1000L + tick)));
                history.update(DEVICE_CHANNELS, List.of(POWER), measurements);
            }

            List<MeasurementSample> samples = history.history("math-p");
            assertEquals(3, samples.size());
            assertEquals(List.of(3.0, 4.0, 5.0), samples.stream().map(MeasurementSample::value).toList());
            assertEquals(1004L, samples.get(2).timestamp());
        }

        @Test
        @DisplayName("Renaming a channel relabels its history")
        void relabel() {
            when(engine.evaluate(anyString(), anyMap())).thenReturn(6.0, (Double) null);
            history.update(DEVICE_CHANNELS, List.of(POWER), measurements);

            MathChannelConfig renamed = new MathChannelConfig("math-p", "Power (kW)", "kW", "a * b / 1000", POWER.inputs());
            assertTrue(history.update(DEVICE_CHANNELS, List.of(renamed), measurements));

            MeasurementSample relabeled = history.history("math-p").get(0);
            assertEquals("Power (kW)", relabeled.deviceLabel());
            assertEquals("kW", relabeled.unit());
            assertEquals(6.0, relabeled.value());
        }

        @Test
        @DisplayName("Removed channels are discarded")
        void removedChannels() {
            when(engine.evaluate(anyString(), anyMap())).thenReturn(6.0);
            MathChannelConfig ratio = new MathChannelConfig("math-r", "Ratio", "", "a / b", POWER.inputs());
            history.update(DEVICE_CHANNELS, List.of(POWER, ratio), measurements);

            assertTrue(history.update(DEVICE_CHANNELS, List.of(ratio), measurements));
            assertEquals(List.of("math-r"), List.copyOf(history.snapshot().keySet()));

            assertTrue(history.update(DEVICE_CHANNELS, List.of(), measurements));
            assertTrue(history.snapshot().isEmpty());
            assertFalse(history.update(DEVICE_CHANNELS, List.of(), measurements));
        }

        @Test
        @DisplayName("Snapshot is immutable")
        void immutableSnapshot() {
            when(engine.evaluate(anyString(), anyMap())).thenReturn(6.0);
            history.update(DEVICE_CHANNELS, List.of(POWER), measurements);

            Map<String, List<MeasurementSample>> snapshot = history.snapshot();
            assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("math-p"));
            assertThrows(UnsupportedOperationException.class, () -> snapshot.get("math-p").clear());

            history.clear();
            assertEquals(1, snapshot.get("math-p").size());
            assertTrue(history.snapshot().isEmpty());
        }
    }

    @Test
    @DisplayName("Works end to end with the default engine")
    void withDefaultEngine() {
        MathChannelHistory real = new MathChannelHistory(new BasicExpressionEngine());

        real.update(DEVICE_CHANNELS, List.of(POWER), measurements);

        assertEquals(6.0, real.history("math-p").get(0).value());
    }
}
