package io.github.cyfko.mathql.core.channel;

import io.github.cyfko.mathql.core.api.ExpressionEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Bounded per-channel history of computed math channel samples.
 * <p>
 * {@link #update(List, List, Map)} is called on every measurement tick. For each math channel
 * it binds every input variable to the latest sample of the source channel, evaluates the
 * expression and records the result, stamped with the most recent input timestamp.
 * </p>
 *
 * <h2>Update rules</h2>
 * <ul>
 *   <li>a channel with no inputs, an input bound to an unknown channel, an input without
 *       samples, or an expression that evaluates to {@code null} produces no sample this tick;
 *       its history is kept and only relabeled when the channel alias or unit changed</li>
 *   <li>a result with the same timestamp as the last recorded sample replaces it</li>
 *   <li>any other result is appended; the oldest samples are dropped beyond the limit</li>
 *   <li>histories of channels that are no longer configured are discarded</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All public methods are synchronized; {@link #snapshot()} returns an immutable copy.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MathChannelHistory {

    private static final Logger logger = Logger.getLogger(MathChannelHistory.class.getName());

    public static final int DEFAULT_HISTORY_LIMIT = 5000;

    private final ExpressionEngine engine;
    private final int limit;
    private Map<String, List<MeasurementSample>> histories = new LinkedHashMap<>();

    public MathChannelHistory(ExpressionEngine engine) {
        this(engine, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * @param engine engine used to evaluate the expressions
     * @param limit  maximum number of samples kept per channel
     * @throws IllegalArgumentException if engine is null or limit is not positive
     */
    public MathChannelHistory(ExpressionEngine engine, int limit) {
        if (engine == null) {
            throw new IllegalArgumentException("Expression engine is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive, got: " + limit);
        }
        this.engine = engine;
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Processes one measurement tick.
     *
     * @param deviceChannels     configured device channels
     * @param mathChannels       configured math channels
     * @param measurementHistory device samples by device id, oldest first
     * @return {@code true} if any history changed
     */
    public synchronized boolean update(List<DeviceChannel> deviceChannels,
                                       List<MathChannelConfig> mathChannels,
                                       Map<String, List<MeasurementSample>> measurementHistory) {
        Objects.requireNonNull(deviceChannels, "Device channels cannot be null");
        Objects.requireNonNull(mathChannels, "Math channels cannot be null");
        Objects.requireNonNull(measurementHistory, "Measurement history cannot be null");

        if (mathChannels.isEmpty()) {
            boolean changed = !histories.isEmpty();
            histories = new LinkedHashMap<>();
            return changed;
        }

        Map<String, DeviceChannel> channelsById = new HashMap<>();
        Map<String, MeasurementSample> latestByChannel = new HashMap<>();
        for (DeviceChannel channel : deviceChannels) {
            channelsById.put(channel.id(), channel);
            List<MeasurementSample> samples = measurementHistory.getOrDefault(channel.deviceId(), List.of());
            if (!samples.isEmpty()) {
                latestByChannel.put(channel.id(), samples.get(samples.size() - 1));
            }
        }

        Map<String, List<MeasurementSample>> next = new LinkedHashMap<>();
        boolean changed = false;

        for (MathChannelConfig channel : mathChannels) {
            List<MeasurementSample> history = histories.getOrDefault(channel.id(), new ArrayList<>());
            if (!histories.containsKey(channel.id())) {
                changed = true;
            }
            MeasurementSample evaluation = evaluate(channel, channelsById, latestByChannel);
            changed |= evaluation == null ? relabel(channel, history) : record(channel, history, evaluation);
            next.put(channel.id(), history);
        }

        for (String channelId : histories.keySet()) {
            if (!next.containsKey(channelId)) {
                logger.fine(() -> "Discarding history of removed math channel " + channelId);
                changed = true;
            }
        }

        histories = next;
        return changed;
    }

    /**
     * @return an immutable copy of all histories, keyed by math channel id
     */
    public synchronized Map<String, List<MeasurementSample>> snapshot() {
        Map<String, List<MeasurementSample>> copy = new LinkedHashMap<>();
        histories.forEach((id, samples) -> copy.put(id, List.copyOf(samples)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * @return an immutable copy of the history of one channel, empty if unknown
     */
    public synchronized List<MeasurementSample> history(String channelId) {
        List<MeasurementSample> samples = histories.get(channelId);
        return samples == null ? List.of() : List.copyOf(samples);
    }

    public synchronized void clear() {
        histories = new LinkedHashMap<>();
    }

    private MeasurementSample evaluate(MathChannelConfig channel,
                                       Map<String, DeviceChannel> channelsById,
                                       Map<String, MeasurementSample> latestByChannel) {
        if (channel.inputs().isEmpty()) {
            return null;
        }

        Map<String, Double> variables = new HashMap<>();
        long timestamp = Long.MIN_VALUE;
        for (MathChannelInput input : channel.inputs()) {
            if (!channelsById.containsKey(input.channelId())) {
                return null;
            }
            MeasurementSample sample = latestByChannel.get(input.channelId());
            if (sample == null) {
                return null;
            }
            variables.put(input.variable(), sample.value());
            timestamp = Math.max(timestamp, sample.timestamp());
        }

        Double value = engine.evaluate(channel.expression(), variables);
        if (value == null) {
            return null;
        }
        return new MeasurementSample(
                channel.id(), MeasurementSample.MATH_DEVICE_TYPE, channel.alias(), value, channel.unit(), timestamp);
    }

    private boolean relabel(MathChannelConfig channel, List<MeasurementSample> history) {
        if (history.isEmpty()) {
            return false;
        }
        MeasurementSample last = history.get(history.size() - 1);
        if (last.deviceLabel().equals(channel.alias()) && last.unit().equals(channel.unit())) {
            return false;
        }
        history.replaceAll(sample -> sample.relabel(channel.alias(), channel.unit()));
        return true;
    }

    private boolean record(MathChannelConfig channel, List<MeasurementSample> history, MeasurementSample evaluation) {
        if (!history.isEmpty()) {
            int lastIndex = history.size() - 1;
            MeasurementSample last = history.get(lastIndex);
            if (last.timestamp() == evaluation.timestamp()) {
                if (last.value() == evaluation.value()
                        && last.unit().equals(channel.unit())
                        && last.deviceLabel().equals(channel.alias())) {
                    return false;
                }
                history.set(lastIndex, last.withValue(evaluation.value(), channel.alias(), channel.unit()));
                return true;
            }
        }

        history.add(evaluation);
        int overflow = history.size() - limit;
        if (overflow > 0) {
            history.subList(0, overflow).clear();
            logger.fine(() -> String.format(
                    "Trimmed %d sample(s) from math channel %s (limit %d)", overflow, channel.id(), limit));
        }
        return true;
    }
}
