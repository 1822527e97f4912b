package org.spatial.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads coordinate tuples such as {@code "1,2"}, {@code "(1; 2)"}, {@code "1 2"} or {@code "1,5 2,5"}.
 *
 * Grammar:
 * <pre>
 *   tuple      = coordinate (separator coordinate)*   optionally wrapped in one pair of parentheses
 *   separator  = ' '* (',' | ';' | ' ') ' '*
 *   coordinate = [+-]? digits? ([.,] digits)? ([eE] [+-]? digits)?
 * </pre>
 *
 * Both '.' and ',' are decimal separators, so a comma can also be a list separator.
 * Every way of splitting the text into coordinates is tried and the text is accepted
 * only if exactly one reading exists: {@code "1,5,2,5"} is (1.5, 2.5) but
 * {@code "1,2,3"} is rejected as a pair because it could be (1.2, 3) or (1, 2.3).
 */
public final class CoordinateText {

    private static final Logger log = LoggerFactory.getLogger(CoordinateText.class);

    private static final String NUMBER = "[+-]?\\d*(?:[.,]\\d+)?(?:[eE][+-]?\\d+)?";
    private static final String SEPARATOR = " *[,; ] *";

    private static final Pattern COORDINATE = Pattern.compile(NUMBER);

    // One compiled tuple pattern per dimension
    private static final ConcurrentMap<Integer, Pattern> TUPLE_PATTERNS = new ConcurrentHashMap<>();

    private CoordinateText() {
    }

    /**
     * Parses exactly two coordinates.
     *
     * @return the pair, or empty if the text is blank, malformed or ambiguous
     */
    public static Optional<NumericPair> tryParse2D(String text) {
        return tryParse(text, 2).map(xy -> new NumericPair(xy[0], xy[1]));
    }

    /**
     * @throws CoordinateFormatException if {@link #tryParse2D(String)} finds no match
     */
    public static NumericPair parse2D(String text) {
        return tryParse2D(text).orElseThrow(() -> new CoordinateFormatException(text, 2));
    }

    /**
     * @throws CoordinateFormatException if {@link #tryParse(String, int)} finds no match
     */
    public static double[] parse(String text, int dimension) {
        return tryParse(text, dimension).orElseThrow(() -> new CoordinateFormatException(text, dimension));
    }

    /**
     * Parses exactly {@code dimension} coordinates.
     *
     * @param text      input, may be null
     * @param dimension number of coordinates expected (must be >= 1)
     * @return the coordinates in input order, or empty if there is no single reading
     */
    public static Optional<double[]> tryParse(String text, int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1");
        }
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Matcher m = tuplePattern(dimension).matcher(text.strip());
        if (!m.matches()) {
            log.debug("Rejected '{}': does not match a {}-coordinate tuple", text, dimension);
            return Optional.empty();
        }
        String body = m.group(1) != null ? m.group(1) : m.group(2);

        Set<List<String>> readings = new LinkedHashSet<>();
        collectReadings(body, 0, dimension, new ArrayList<>(), readings);
        if (readings.size() != 1) {
            log.debug("Rejected '{}': {} readings as {} coordinates", text, readings.size(), dimension);
            return Optional.empty();
        }

        List<String> tokens = readings.iterator().next();
        double[] out = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            out[i] = toDouble(tokens.get(i));
        }
        return Optional.of(out);
    }

    private static Pattern tuplePattern(int dimension) {
        return TUPLE_PATTERNS.computeIfAbsent(dimension, d -> {
            String body = NUMBER + ("(?:" + SEPARATOR + NUMBER + ")").repeat(d - 1);
            // Parentheses must be balanced: either both present or neither.
            return Pattern.compile(" *(?:\\((" + body + ")\\)|(" + body + ")) *");
        });
    }

    /**
     * Walks every split of {@code body} into {@code remaining} coordinates starting at {@code from}.
     * Stops once a second reading is found, since that already makes the input ambiguous.
     */
    private static void collectReadings(String body, int from, int remaining,
                                        List<String> current, Set<List<String>> out) {
        if (out.size() > 1) {
            return;
        }
        if (remaining == 1) {
            String last = body.substring(from);
            if (isCoordinate(last, from > 0)) {
                List<String> reading = new ArrayList<>(current);
                reading.add(last);
                out.add(List.copyOf(reading));
            }
            return;
        }

        for (int i = from; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != ',' && c != ';' && c != ' ') {
                continue;
            }
            String head = body.substring(from, i).stripTrailing();
            if (!isCoordinate(head, from > 0)) {
                continue;
            }
            int next = i + 1;
            while (next < body.length() && body.charAt(next) == ' ') {
                next++;
            }
            current.add(head);
            collectReadings(body, next, remaining - 1, current, out);
            current.remove(current.size() - 1);
        }
    }

    /**
     * @param afterSeparator true unless the token opens the tuple; such a token may not start with
     *                       the decimal ',' since that comma belongs to the separator
     */
    private static boolean isCoordinate(String token, boolean afterSeparator) {
        if (token.isEmpty() || !COORDINATE.matcher(token).matches()) {
            return false;
        }
        if (afterSeparator && token.charAt(0) == ',') {
            return false;
        }
        // The grammar also admits "", "+", "e5": those carry no mantissa and cannot be converted.
        // A literal beyond the double range ("1e400") counts as a failed conversion too.
        try {
            return Double.isFinite(toDouble(token));
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static double toDouble(String token) {
        return Double.parseDouble(token.replace(',', '.'));
    }
}
