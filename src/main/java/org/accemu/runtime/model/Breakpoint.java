package org.accemu.runtime.model;

import org.accemu.runtime.Config;

import java.util.Objects;

/**
 * A named address at which automatic execution pauses.
 * @param address The trap address, masked to the word width.
 * @param name The unique label of the breakpoint.
 */
public record Breakpoint(int address, String name) {

    /**
     * Creates a breakpoint and masks its address.
     * @param address The trap address.
     * @param name The label.
     */
    public Breakpoint {
        Objects.requireNonNull(name, "name");
        address &= Config.ARCH_BITMASK;
    }

    /**
     * Checks whether this breakpoint traps the given address.
     * @param address The address to test; it is masked before comparing.
     * @return true on a match.
     */
    public boolean has(int address) {
        return this.address == (address & Config.ARCH_BITMASK);
    }

    /**
     * Checks whether this breakpoint carries the given name.
     * @param name The name to test.
     * @return true on a match.
     */
    public boolean has(String name) {
        return this.name.equals(name);
    }

    /**
     * Checks whether a string can be used as a breakpoint name. Names are written as a
     * single token in saved state, so they must be non-empty and free of whitespace.
     * @param name The candidate name.
     * @return true if the name is usable.
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
