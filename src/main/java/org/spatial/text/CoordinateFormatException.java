package org.spatial.text;

/**
 * Thrown when text does not describe the expected number of coordinates.
 * The message names the input only; the reason for the rejection is not reported.
 */
public class CoordinateFormatException extends IllegalArgumentException {

    private final String input;

    public CoordinateFormatException(String input, int dimension) {
        super("Could not parse " + (input == null ? "null" : "'" + input + "'")
                + " as " + dimension + " coordinates");
        this.input = input;
    }

    /**
     * @return the rejected text, possibly null
     */
    public String input() {
        return input;
    }
}
