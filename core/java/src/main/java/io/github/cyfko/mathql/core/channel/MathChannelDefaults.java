package io.github.cyfko.mathql.core.channel;

import io.github.cyfko.mathql.core.config.MathAllowList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default values proposed when a math channel is created or edited.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li><strong>Alias</strong>: {@code "<prefix> <n>"} where {@code n} is one more than the
 *       number of existing math channels ({@code "Math 1"}, {@code "Math 2"}, ...)</li>
 *   <li><strong>Inputs</strong>: the first device channels, bound in order to {@code a}, {@code b}, ...
 *       (at most {@link MathAllowList#VARIABLE_ALPHABET_SIZE})</li>
 *   <li><strong>Expression</strong>: sum of the first two variables, the single variable, or empty</li>
 *   <li><strong>Unit</strong>: unit of the latest sample of the first input's channel</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MathChannelDefaults {

    public static final String DEFAULT_ALIAS_PREFIX = "Math";

    private MathChannelDefaults() {}

    public static String defaultAlias(int existingCount) {
        return defaultAlias(existingCount, DEFAULT_ALIAS_PREFIX);
    }

    public static String defaultAlias(int existingCount, String prefix) {
        return prefix + " " + (existingCount + 1);
    }

    /**
     * Binds the first device channels to the variable alphabet, in order.
     *
     * @param deviceChannels available device channels
     * @return one input per channel, at most one per variable
     */
    public static List<MathChannelInput> initialInputs(List<DeviceChannel> deviceChannels) {
        List<String> variables = MathAllowList.VARIABLES;
        int count = Math.min(deviceChannels.size(), variables.size());
        List<MathChannelInput> inputs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            inputs.add(new MathChannelInput(deviceChannels.get(i).id(), variables.get(i)));
        }
        return inputs;
    }

    public static String defaultExpression(List<MathChannelInput> inputs) {
        if (inputs.size() >= 2) {
            return inputs.get(0).variable() + " + " + inputs.get(1).variable();
        }
        if (inputs.size() == 1) {
            return inputs.get(0).variable();
        }
        return "";
    }

    /**
     * Tells whether one more input can be added.
     * <p>
     * An input can be added while a variable is still free and fewer inputs than device
     * channels exist.
     * </p>
     *
     * @param inputs         current inputs
     * @param deviceChannels available device channels
     * @return {@code true} if {@link #nextInput(List, List)} would produce an input
     */
    public static boolean canAddInput(List<MathChannelInput> inputs, List<DeviceChannel> deviceChannels) {
        if (inputs.size() >= MathAllowList.VARIABLE_ALPHABET_SIZE) {
            return false;
        }
        if (nextVariable(inputs).isEmpty()) {
            return false;
        }
        if (inputs.size() >= deviceChannels.size()) {
            return false;
        }
        Set<String> selectedIds = selectedChannelIds(inputs);
        return deviceChannels.stream().anyMatch(channel -> !selectedIds.contains(channel.id()))
                || selectedIds.size() < deviceChannels.size();
    }

    /**
     * Proposes the next input: the first free variable bound to the first channel not yet
     * selected (or to no channel when all are taken).
     *
     * @param inputs         current inputs
     * @param deviceChannels available device channels
     * @return the proposed input, or empty when {@link #canAddInput(List, List)} is false
     */
    public static Optional<MathChannelInput> nextInput(List<MathChannelInput> inputs,
                                                       List<DeviceChannel> deviceChannels) {
        if (!canAddInput(inputs, deviceChannels)) {
            return Optional.empty();
        }
        Set<String> selectedIds = selectedChannelIds(inputs);
        String channelId = deviceChannels.stream()
                .map(DeviceChannel::id)
                .filter(id -> !selectedIds.contains(id))
                .findFirst()
                .orElse("");
        return nextVariable(inputs).map(variable -> new MathChannelInput(channelId, variable));
    }

    /**
     * Resolves the unit of the latest sample of the first input's channel.
     *
     * @param inputs                current inputs
     * @param deviceChannels        device channels by id
     * @param latestSampleByChannel latest sample, keyed by device id or channel id
     * @return the unit, or an empty string when unknown
     */
    public static String defaultUnit(List<MathChannelInput> inputs,
                                     Map<String, DeviceChannel> deviceChannels,
                                     Map<String, MeasurementSample> latestSampleByChannel) {
        if (inputs.isEmpty()) {
            return "";
        }
        DeviceChannel source = deviceChannels.get(inputs.get(0).channelId());
        if (source == null) {
            return "";
        }
        MeasurementSample sample = latestSampleByChannel.get(source.deviceId());
        if (sample == null) {
            sample = latestSampleByChannel.get(source.id());
        }
        return sample == null ? "" : sample.unit();
    }

    /**
     * Builds the configuration proposed for a new math channel.
     *
     * @param id                    id of the new channel
     * @param deviceChannels        available device channels
     * @param latestSampleByChannel latest sample, keyed by device id or channel id
     * @param mathChannelCount      number of existing math channels
     * @return the proposed configuration
     */
    public static MathChannelConfig initialConfig(String id,
                                                  List<DeviceChannel> deviceChannels,
                                                  Map<String, MeasurementSample> latestSampleByChannel,
                                                  int mathChannelCount) {
        Objects.requireNonNull(deviceChannels, "Device channels cannot be null");
        List<MathChannelInput> inputs = initialInputs(deviceChannels);
        Map<String, DeviceChannel> byId = deviceChannels.stream()
                .collect(Collectors.toMap(DeviceChannel::id, Function.identity(), (first, second) -> first, LinkedHashMap::new));

        return new MathChannelConfig(
                id,
                defaultAlias(mathChannelCount),
                defaultUnit(inputs, byId, latestSampleByChannel),
                defaultExpression(inputs),
                inputs
        );
    }

    private static Optional<String> nextVariable(List<MathChannelInput> inputs) {
        Set<String> used = inputs.stream().map(MathChannelInput::variable).collect(Collectors.toSet());
        return MathAllowList.VARIABLES.stream().filter(variable -> !used.contains(variable)).findFirst();
    }

    private static Set<String> selectedChannelIds(List<MathChannelInput> inputs) {
        return inputs.stream()
                .filter(MathChannelInput::hasChannel)
                .map(MathChannelInput::channelId)
                .collect(Collectors.toSet());
    }
}
