package org.accemu.runtime.services;

/**
 * Thrown when saved emulator state cannot be parsed.
 */
public class StateFormatException extends Exception {

    private final int lineNumber;

    /**
     * Creates a new exception for a problem on a specific line.
     * @param lineNumber The 1-based line number, or 0 if the problem is not tied to a line.
     * @param message The description of the problem.
     */
    public StateFormatException(int lineNumber, String message) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
