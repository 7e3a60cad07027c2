package com.xgraph.units;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.units.indriya.format.SimpleUnitFormat;

import javax.measure.IncommensurableException;
import javax.measure.UnconvertibleException;
import javax.measure.Unit;
import javax.measure.UnitConverter;
import javax.measure.format.MeasurementParseException;
import javax.measure.format.UnitFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves unit strings such as {@code "ms"}, {@code "mV"} or {@code "pA"} and converts
 * values between compatible units. Strings the unit format does not understand
 * ({@code "index"}, {@code "arbitrary"}) are kept as opaque labels: they compare by text and
 * never convert.
 */
public class UnitRegistry {

    private static final Logger logger = LoggerFactory.getLogger(UnitRegistry.class);

    public static final String INDEX_UNITS = "index";

    private final UnitFormat format;
    private final Map<String, Optional<Unit<?>>> cache = new ConcurrentHashMap<>();

    public UnitRegistry() {
        this(SimpleUnitFormat.getInstance());
    }

    public UnitRegistry(UnitFormat format) {
        this.format = format;
    }

    public Optional<Unit<?>> parse(String units) {
        if (isBlank(units)) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(units.trim(), this::doParse);
    }

    private Optional<Unit<?>> doParse(String text) {
        try {
            return Optional.of(format.parse(text));
        } catch (MeasurementParseException | IllegalArgumentException | UnsupportedOperationException e) {
            logger.trace("Treating '{}' as an opaque unit label: {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    /** Canonical symbol for a parseable unit, the trimmed text otherwise, null for no units. */
    public String canonical(String units) {
        if (isBlank(units)) {
            return null;
        }
        return parse(units).map(format::format).orElse(units.trim());
    }

    public boolean sameUnits(String a, String b) {
        return Objects.equals(canonical(a), canonical(b));
    }

    public boolean isCompatible(String a, String b) {
        Optional<Unit<?>> ua = parse(a);
        Optional<Unit<?>> ub = parse(b);
        return ua.isPresent() && ub.isPresent() && ua.get().isCompatible(ub.get());
    }

    /**
     * Factor {@code f} such that {@code value[to] = f * value[from]}. Only linear conversions
     * (no offset units such as degrees Celsius) are supported.
     */
    public double conversionFactor(String from, String to) {
        if (sameUnits(from, to)) {
            return 1.0;
        }
        UnitConverter converter = converter(from, to);
        if (!converter.isLinear()) {
            throw new IncommensurableUnitsException(from, to);
        }
        return converter.convert(1.0);
    }

    public double[] convert(double[] values, String from, String to) {
        double[] out = new double[values.length];
        if (sameUnits(from, to)) {
            System.arraycopy(values, 0, out, 0, values.length);
            return out;
        }
        UnitConverter converter = converter(from, to);
        for (int i = 0; i < values.length; i++) {
            out[i] = converter.convert(values[i]);
        }
        return out;
    }

    /** Converts values to the system unit of their dimension, e.g. ms to s, mV to V. */
    public Converted toBaseUnits(double[] values, String units) {
        Optional<Unit<?>> unit = parse(units);
        if (unit.isEmpty()) {
            return new Converted(values.clone(), units);
        }
        String base = format.format(unit.get().getSystemUnit());
        return new Converted(convert(values, units, base), base);
    }

    private UnitConverter converter(String from, String to) {
        Unit<?> ufrom = parse(from).orElseThrow(() -> new IncommensurableUnitsException(from, to));
        Unit<?> uto = parse(to).orElseThrow(() -> new IncommensurableUnitsException(from, to));
        try {
            return ufrom.getConverterToAny(uto);
        } catch (IncommensurableException | UnconvertibleException e) {
            throw new IncommensurableUnitsException(from, to, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static class Converted {
        private final double[] values;
        private final String units;

        Converted(double[] values, String units) {
            this.values = values;
            this.units = units;
        }

        public double[] getValues() {
            return values.clone();
        }

        public String getUnits() {
            return units;
        }
    }
}
