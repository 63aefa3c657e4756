package io.github.cyfko.mathql.core.channel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MathVariableLegendTest {

    private final Map<String, DeviceChannel> channels = Map.of(
            "ch-1", new DeviceChannel("ch-1", "dev-1", "Voltage", "#1f77b4"),
            "ch-2", new DeviceChannel("ch-2", "dev-2", "Current", "#ff7f0e")
    );

    @Test
    @DisplayName("Resolves inputs, drops unknown channels and sorts by variable")
    void build() {
        List<MathChannelInput> inputs = List.of(
                new MathChannelInput("ch-2", "b"),
                new MathChannelInput("missing", "c"),
                new MathChannelInput("ch-1", "a")
        );

        List<MathVariableLegendItem> legend = MathVariableLegend.build(inputs, channels);

        assertEquals(List.of(
                new MathVariableLegendItem("a", "Voltage", "#1f77b4"),
                new MathVariableLegendItem("b", "Current", "#ff7f0e")
        ), legend);
    }

    @Test
    @DisplayName("Converts the legend into a color map")
    void toColorMap() {
        List<MathVariableLegendItem> legend = List.of(
                new MathVariableLegendItem("a", "Voltage", "#1f77b4"),
                new MathVariableLegendItem("a", "Other", "#000000"),
                new MathVariableLegendItem("b", "Current", "#ff7f0e")
        );

        assertEquals(Map.of("a", "#1f77b4", "b", "#ff7f0e"), MathVariableLegend.toColorMap(legend));
    }

    @Test
    @DisplayName("Empty inputs give an empty legend")
    void empty() {
        assertTrue(MathVariableLegend.build(List.of(), channels).isEmpty());
        assertThrows(NullPointerException.class, () -> MathVariableLegend.build(null, channels));
    }
}
