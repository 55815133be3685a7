package json.syntax;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/// Formats doubles the way ECMAScript `Number.prototype.toString()` does:
/// the shortest digit string that reads back as the same double, in plain
/// notation for magnitudes in `[1e-6, 1e21)` and exponent notation (`1e+21`,
/// `1.5e-7`) otherwise. Negative zero formats as `0`.
///
/// [Double#toString(double)] differs in both digit selection and layout
/// (`1.0`, `1.0E21`), so it cannot be used for output that must match
/// `JSON.stringify`.
final class EcmaNumberFormat {

    /// Digits beyond which every double is uniquely identified.
    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private static final int MAX_PLAIN_EXPONENT = 21;
    private static final int MIN_PLAIN_EXPONENT = -6;

    /// Nearest first, so it wins ties.
    private static final RoundingMode[] CANDIDATE_ROUNDINGS = {
            RoundingMode.HALF_EVEN, RoundingMode.FLOOR, RoundingMode.CEILING
    };

    /// @throws IllegalArgumentException if `value` is infinite or NaN
    static String format(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite number: " + value);
        }
        if (value == 0) {
            return "0";
        }

        final BigDecimal shortest = shortestRoundTrip(Math.abs(value)).stripTrailingZeros();
        final String digits = shortest.unscaledValue().toString();
        final int k = digits.length();
        // value = 0.d1d2...dk * 10^n
        final int n = k - shortest.scale();

        final var sb = new StringBuilder(k + 8);
        if (value < 0) {
            sb.append('-');
        }
        if (k <= n && n <= MAX_PLAIN_EXPONENT) {
            sb.append(digits).append("0".repeat(n - k));
        } else if (0 < n && n <= MAX_PLAIN_EXPONENT) {
            sb.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (MIN_PLAIN_EXPONENT < n && n <= 0) {
            sb.append("0.").append("0".repeat(-n)).append(digits);
        } else {
            final int exponent = n - 1;
            sb.append(digits.charAt(0));
            if (k > 1) {
                sb.append('.').append(digits, 1, k);
            }
            sb.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
        }
        return sb.toString();
    }

    /// Finds the fewest significant digits that parse back to `magnitude`, and among those
    /// the candidate closest to it. Below a power of two the gap to the next lower double is
    /// half the gap above, so the nearest candidate of a length can miss while its neighbour
    /// on the other side still reads back; both neighbours are tried at every length.
    private static BigDecimal shortestRoundTrip(double magnitude) {
        final BigDecimal exact = new BigDecimal(magnitude);
        for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
            BigDecimal best = null;
            for (RoundingMode mode : CANDIDATE_ROUNDINGS) {
                final BigDecimal candidate = exact.round(new MathContext(precision, mode));
                if (Double.parseDouble(candidate.toString()) == magnitude
                        && (best == null || closer(candidate, best, exact))) {
                    best = candidate;
                }
            }
            if (best != null) {
                return best;
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN));
    }

    private static boolean closer(BigDecimal candidate, BigDecimal best, BigDecimal exact) {
        return candidate.subtract(exact).abs().compareTo(best.subtract(exact).abs()) < 0;
    }

    private EcmaNumberFormat() {}
}
