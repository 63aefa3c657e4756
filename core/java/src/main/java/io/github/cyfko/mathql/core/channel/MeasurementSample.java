package io.github.cyfko.mathql.core.channel;

/**
 * A timestamped measurement.
 *
 * @param deviceId    id of the producing device (the math channel id for derived samples)
 * @param deviceType  kind of producer, {@value #MATH_DEVICE_TYPE} for derived samples
 * @param deviceLabel display label
 * @param value       measured or computed value
 * @param unit        unit, possibly empty
 * @param timestamp   epoch milliseconds
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MeasurementSample(
    String deviceId,
    String deviceType,
    String deviceLabel,
    double value,
    String unit,
    long timestamp
) {

    public static final String MATH_DEVICE_TYPE = "Math";

    public MeasurementSample {
        unit = unit == null ? "" : unit;
        deviceLabel = deviceLabel == null ? "" : deviceLabel;
    }

    /**
     * @return a copy carrying the given label and unit
     */
    public MeasurementSample relabel(String label, String newUnit) {
        return new MeasurementSample(deviceId, deviceType, label, value, newUnit, timestamp);
    }

    /**
     * @return a copy carrying the given value, label and unit
     */
    public MeasurementSample withValue(double newValue, String label, String newUnit) {
        return new MeasurementSample(deviceId, deviceType, label, newValue, newUnit, timestamp);
    }
}
