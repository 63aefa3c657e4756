package io.github.cyfko.mathql.core.channel;

import java.util.List;
import java.util.Objects;

/**
 * A derived channel whose samples are computed from other channels.
 *
 * @param id         channel identifier, also used as the device id of produced samples
 * @param alias      display name, used as the label of produced samples
 * @param unit       unit of produced samples, possibly empty
 * @param expression expression over the input variables
 * @param inputs     variable bindings
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MathChannelConfig(
    String id,
    String alias,
    String unit,
    String expression,
    List<MathChannelInput> inputs
) {

    public MathChannelConfig {
        Objects.requireNonNull(id, "Channel id cannot be null");
        alias = alias == null ? "" : alias;
        unit = unit == null ? "" : unit;
        expression = expression == null ? "" : expression;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
