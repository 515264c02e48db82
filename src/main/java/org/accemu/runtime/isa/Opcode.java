package org.accemu.runtime.isa;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of operations the machine understands. Each constant carries the
 * numeric code stored in the opcode cell and its three-letter mnemonic.
 */
public enum Opcode {
    ADD(1, "ADD"),
    AND(2, "AND"),
    ORR(3, "ORR"),
    XOR(4, "XOR"),
    LDR(5, "LDR"),
    STR(6, "STR"),
    JMP(7, "JMP"),
    JNE(8, "JNE");

    private static final Map<Integer, Opcode> BY_CODE = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            BY_CODE.put(opcode.code, opcode);
        }
    }

    private final int code;
    private final String mnemonic;

    Opcode(int code, String mnemonic) {
        this.code = code;
        this.mnemonic = mnemonic;
    }

    /**
     * Gets the value stored in the opcode cell for this operation.
     * @return The numeric opcode.
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets the mnemonic of this operation.
     * @return The mnemonic, e.g. "ADD".
     */
    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * Checks whether this operation writes the program counter itself instead of
     * falling through to the next instruction.
     * @return true for JMP and JNE.
     */
    public boolean isJump() {
        return this == JMP || this == JNE;
    }

    /**
     * Renders the listing text for this operation applied to an operand address.
     * @param address The operand address.
     * @return The human-readable form, e.g. {@code "ADD: ACC <- ACC + [10]"}.
     */
    public String describe(int address) {
        return switch (this) {
            case ADD -> mnemonic + ": ACC <- ACC + [" + address + "]";
            case AND -> mnemonic + ": ACC <- ACC & [" + address + "]";
            case ORR -> mnemonic + ": ACC <- ACC | [" + address + "]";
            case XOR -> mnemonic + ": ACC <- ACC ^ [" + address + "]";
            case LDR -> mnemonic + ": ACC <- [" + address + "]";
            case STR -> mnemonic + ": ACC -> [" + address + "]";
            case JMP -> mnemonic + ": PC  <- " + address;
            case JNE -> mnemonic + ": PC  <- " + address + " if ACC != 0";
        };
    }

    /**
     * Looks up an operation by its numeric code.
     * @param code The value read from an opcode cell.
     * @return The matching operation, or empty if the code is not assigned.
     */
    public static Optional<Opcode> fromCode(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
