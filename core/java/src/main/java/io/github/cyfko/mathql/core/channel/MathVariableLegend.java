package io.github.cyfko.mathql.core.channel;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the variable legend of a math channel.
 *
 * <pre>{@code
 * List<MathVariableLegendItem> legend = MathVariableLegend.build(config.inputs(), channelsById);
 * ExpressionPreview preview = engine.render(config.expression(), MathVariableLegend.toColorMap(legend));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MathVariableLegend {

    private MathVariableLegend() {}

    /**
     * Resolves each input against the known device channels.
     * <p>
     * Inputs bound to an unknown channel are left out. Items are sorted by variable name.
     * </p>
     *
     * @param inputs         variable bindings
     * @param deviceChannels device channels by id
     * @return the legend items
     */
    public static List<MathVariableLegendItem> build(List<MathChannelInput> inputs,
                                                     Map<String, DeviceChannel> deviceChannels) {
        Objects.requireNonNull(inputs, "Inputs cannot be null");
        Objects.requireNonNull(deviceChannels, "Device channels cannot be null");

        return inputs.stream()
                .filter(input -> deviceChannels.containsKey(input.channelId()))
                .map(input -> {
                    DeviceChannel channel = deviceChannels.get(input.channelId());
                    return new MathVariableLegendItem(input.variable(), channel.alias(), channel.color());
                })
                .sorted(Comparator.comparing(MathVariableLegendItem::variable))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Converts a legend into the color map accepted by
     * {@link io.github.cyfko.mathql.core.api.ExpressionEngine#render(String, Map)}.
     * When a variable appears twice, the first item wins.
     */
    public static Map<String, String> toColorMap(List<MathVariableLegendItem> legend) {
        Map<String, String> colors = new LinkedHashMap<>();
        for (MathVariableLegendItem item : legend) {
            colors.putIfAbsent(item.variable(), item.color());
        }
        return colors;
    }
}
