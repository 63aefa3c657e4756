package io.github.cyfko.mathql.core.channel;

import java.util.Objects;

/**
 * Binding of an expression variable to a source channel.
 *
 * @param channelId id of the source {@link DeviceChannel}, empty when not selected yet
 * @param variable  variable name, one of {@link io.github.cyfko.mathql.core.config.MathAllowList#VARIABLES}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MathChannelInput(String channelId, String variable) {

    public MathChannelInput {
        Objects.requireNonNull(variable, "Variable cannot be null");
        channelId = channelId == null ? "" : channelId;
    }

    public boolean hasChannel() {
        return !channelId.isEmpty();
    }
}
