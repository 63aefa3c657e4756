package io.github.cyfko.mathql.core.channel;

import java.util.Objects;

/**
 * A measurement channel fed by a physical device.
 *
 * @param id       channel identifier, referenced by {@link MathChannelInput#channelId()}
 * @param deviceId identifier of the device producing the samples
 * @param alias    display name
 * @param color    display color (any CSS color), used to tint the channel's variable in previews
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DeviceChannel(String id, String deviceId, String alias, String color) {

    public DeviceChannel {
        Objects.requireNonNull(id, "Channel id cannot be null");
        Objects.requireNonNull(deviceId, "Device id cannot be null");
        alias = alias == null ? "" : alias;
        color = color == null ? "" : color;
    }
}
