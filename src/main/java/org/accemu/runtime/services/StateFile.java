package org.accemu.runtime.services;

import org.accemu.runtime.Config;
import org.accemu.runtime.model.Breakpoint;
import org.accemu.runtime.model.BreakpointTable;
import org.accemu.runtime.model.EmulatorSnapshot;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the line-oriented text form of emulator state.
 * <p>
 * Layout:
 * <pre>
 *   total cycles
 *   accumulator
 *   program counter
 *   memory[0]
 *   ...
 *   memory[MEMORY_SIZE - 1]
 *   address name     (zero or more breakpoints, to end of input)
 * </pre>
 * Every header and memory line holds exactly one decimal integer.
 */
public final class StateFile {

    private StateFile() {}

    /**
     * Parses saved state.
     * @param source The text to read. It is not closed.
     * @return The parsed snapshot. Its breakpoints already satisfy the table invariants.
     * @throws StateFormatException if any line is missing, malformed or out of range.
     * @throws IOException if reading fails.
     */
    public static EmulatorSnapshot read(Reader source) throws StateFormatException, IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        int lineNumber = 0;

        String line = reader.readLine();
        lineNumber++;
        long totalCycles = parseLong(line, lineNumber, "total cycles");
        if (totalCycles < 0) {
            throw new StateFormatException(lineNumber, "total cycles must not be negative: " + totalCycles);
        }

        line = reader.readLine();
        lineNumber++;
        int acc = parseWord(line, lineNumber, "accumulator", Config.MAX_VALUE);

        line = reader.readLine();
        lineNumber++;
        int pc = parseWord(line, lineNumber, "program counter", Config.MEMORY_SIZE - 1);

        int[] memory = new int[Config.MEMORY_SIZE];
        for (int offset = 0; offset < Config.MEMORY_SIZE; offset++) {
            line = reader.readLine();
            lineNumber++;
            memory[offset] = parseWord(line, lineNumber, "memory[" + offset + "]", Config.MAX_VALUE);
        }

        BreakpointTable table = new BreakpointTable();
        String pendingAddress = null;
        int pendingLine = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            for (String token : line.trim().split("\\s+")) {
                if (token.isEmpty()) {
                    continue;
                }
                if (pendingAddress == null) {
                    pendingAddress = token;
                    pendingLine = lineNumber;
                    continue;
                }
                int address = parseBreakpointAddress(pendingAddress, pendingLine);
                if (!table.insert(address, token)) {
                    throw new StateFormatException(lineNumber,
                        "breakpoint '" + token + "' at " + address + " conflicts with an existing one or exceeds capacity");
                }
                pendingAddress = null;
            }
        }
        if (pendingAddress != null) {
            throw new StateFormatException(pendingLine, "breakpoint address '" + pendingAddress + "' has no name");
        }

        return new EmulatorSnapshot(totalCycles, acc, pc, memory, List.copyOf(table.asList()));
    }

    /**
     * Writes state in the format accepted by {@link #read(Reader)}.
     * @param snapshot The state to write.
     * @param target The destination. It is flushed but not closed.
     * @throws IOException if writing fails.
     */
    public static void write(EmulatorSnapshot snapshot, Writer target) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append(snapshot.totalCycles()).append('\n');
        sb.append(snapshot.acc()).append('\n');
        sb.append(snapshot.pc()).append('\n');
        for (int value : snapshot.memory()) {
            sb.append(value).append('\n');
        }
        for (Breakpoint bp : snapshot.breakpoints()) {
            sb.append(bp.address()).append(' ').append(bp.name()).append('\n');
        }
        target.write(sb.toString());
        target.flush();
    }

    private static long parseLong(String line, int lineNumber, String field) throws StateFormatException {
        if (line == null) {
            throw new StateFormatException(lineNumber, "missing " + field);
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            throw new StateFormatException(lineNumber, "empty line where " + field + " was expected");
        }
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new StateFormatException(lineNumber, field + " is not an integer: '" + trimmed + "'");
        }
    }

    private static int parseWord(String line, int lineNumber, String field, int max) throws StateFormatException {
        long value = parseLong(line, lineNumber, field);
        if (value < 0 || value > max) {
            throw new StateFormatException(lineNumber, field + " out of range [0, " + max + "]: " + value);
        }
        return (int) value;
    }

    private static int parseBreakpointAddress(String token, int lineNumber) throws StateFormatException {
        final int address;
        try {
            address = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new StateFormatException(lineNumber, "breakpoint address is not an integer: '" + token + "'");
        }
        if (address < 0 || address >= Config.MEMORY_SIZE) {
            throw new StateFormatException(lineNumber, "breakpoint address out of range: " + address);
        }
        return address;
    }
}
