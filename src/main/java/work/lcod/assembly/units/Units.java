package work.lcod.assembly.units;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import javax.measure.IncommensurableException;
import javax.measure.MeasurementException;
import javax.measure.Unit;
import javax.measure.UnitConverter;
import javax.measure.format.UnitFormat;
import tech.units.indriya.format.SimpleUnitFormat;
import work.lcod.assembly.model.DefaultValue;

/**
 * Unit parsing and value conversion backed by Indriya. A missing unit on either side means the
 * value is passed through unchanged.
 */
public final class Units {
    private static final UnitFormat FORMAT = SimpleUnitFormat.getInstance();
    private static final Map<String, Unit<?>> CACHE = new ConcurrentHashMap<>();

    private Units() {}

    public static Unit<?> parse(String units) {
        Objects.requireNonNull(units, "units");
        var cached = CACHE.get(units);
        if (cached != null) {
            return cached;
        }
        try {
            var parsed = FORMAT.parse(units);
            CACHE.put(units, parsed);
            return parsed;
        } catch (MeasurementException ex) {
            throw new IllegalArgumentException("Unknown units '" + units + "'", ex);
        }
    }

    public static boolean isValid(String units) {
        if (units == null) {
            return true;
        }
        try {
            parse(units);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    public static boolean convertible(String from, String to) {
        if (from == null || to == null || from.equals(to)) {
            return true;
        }
        try {
            return parse(from).isCompatible(parse(to));
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    public static DefaultValue convert(DefaultValue value, String from, String to) {
        if (value == null || value.isDiscrete() || from == null || to == null || from.equals(to)) {
            return value;
        }
        var converter = converter(from, to);
        var values = value.values();
        for (int i = 0; i < values.length; i++) {
            values[i] = converter.convert(values[i]);
        }
        return DefaultValue.continuous(values);
    }

    public static double convert(double value, String from, String to) {
        if (from == null || to == null || from.equals(to)) {
            return value;
        }
        return converter(from, to).convert(value);
    }

    private static UnitConverter converter(String from, String to) {
        try {
            return parse(from).getConverterToAny(parse(to));
        } catch (IncommensurableException ex) {
            throw new IllegalArgumentException("Cannot convert '" + from + "' to '" + to + "'", ex);
        }
    }
}
