package org.accemu.runtime.services;

import java.util.Optional;

/**
 * One row of a program listing.
 * @param offset The instruction-aligned memory offset.
 * @param opcode The raw opcode cell.
 * @param address The raw operand cell.
 * @param mnemonic The decoded instruction text, if the pair is a known, non-empty instruction.
 */
public record ListingLine(int offset, int opcode, int address, Optional<String> mnemonic) {

    /**
     * Formats the row as {@code offset:<TAB>opcode<TAB>address}, followed by
     * {@code <TAB>:<TAB>mnemonic} when the pair decodes.
     * @return The printable row without a line terminator.
     */
    public String format() {
        String raw = offset + ":\t" + opcode + "\t" + address;
        return mnemonic.map(text -> raw + "\t:\t" + text).orElse(raw);
    }
}
