package idlescope.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * Parser for Kubernetes resource quantity strings.
 *
 * <p>Supports binary suffixes ({@code Ki, Mi, Gi, Ti, Pi, Ei}), decimal suffixes
 * ({@code n, u, m, k, M, G, T, P, E}) and decimal exponents ({@code 1e3}).
 */
public final class ResourceQuantity {

    private static final Map<String, BigDecimal> BINARY = Map.of(
            "Ki", BigDecimal.valueOf(1024L),
            "Mi", BigDecimal.valueOf(1024L * 1024),
            "Gi", BigDecimal.valueOf(1024L * 1024 * 1024),
            "Ti", BigDecimal.valueOf(1024L * 1024 * 1024 * 1024),
            "Pi", BigDecimal.valueOf(1024L * 1024 * 1024 * 1024 * 1024),
            "Ei", BigDecimal.valueOf(1024L * 1024 * 1024 * 1024 * 1024 * 1024));

    private static final Map<String, BigDecimal> DECIMAL = Map.of(
            "n", new BigDecimal("1e-9"),
            "u", new BigDecimal("1e-6"),
            "m", new BigDecimal("1e-3"),
            "k", new BigDecimal("1e3"),
            "M", new BigDecimal("1e6"),
            "G", new BigDecimal("1e9"),
            "T", new BigDecimal("1e12"),
            "P", new BigDecimal("1e15"),
            "E", new BigDecimal("1e18"));

    private ResourceQuantity() {
        // Utility class
    }

    /**
     * Parse a quantity into its base unit (cores for CPU, bytes for memory).
     *
     * @param quantity quantity string such as {@code 250m} or {@code 512Mi}
     * @return the value in base units
     * @throws IllegalArgumentException if the string is not a valid quantity
     */
    public static BigDecimal parse(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            throw new IllegalArgumentException("Quantity cannot be blank");
        }
        var value = quantity.trim();
        try {
            if (value.length() > 2) {
                var binary = BINARY.get(value.substring(value.length() - 2));
                if (binary != null) {
                    return new BigDecimal(value.substring(0, value.length() - 2)).multiply(binary);
                }
            }
            var last = value.substring(value.length() - 1);
            var decimal = DECIMAL.get(last);
            if (decimal != null && value.length() > 1) {
                return new BigDecimal(value.substring(0, value.length() - 1)).multiply(decimal);
            }
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid quantity: " + quantity, e);
        }
    }

    /**
     * Parse a CPU quantity into cores.
     */
    public static double cpuCores(String quantity) {
        return parse(quantity).doubleValue();
    }

    /**
     * Parse a memory quantity into bytes, rounding fractional bytes up.
     */
    public static long bytes(String quantity) {
        return parse(quantity).setScale(0, RoundingMode.CEILING).longValueExact();
    }

    public static Optional<Double> tryCpuCores(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cpuCores(quantity));
    }

    public static Optional<Long> tryBytes(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(bytes(quantity));
    }
}
