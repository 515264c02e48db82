package org.accemu.runtime.model;

import org.accemu.runtime.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An ordered collection of breakpoints, bounded by {@link Config#MAX_INSTRUCTIONS}.
 * <p>
 * No two entries share an address and no two entries share a name. Entries keep their
 * insertion order; removing one closes the gap so the survivors keep their relative order.
 */
public class BreakpointTable {

    private static final Logger LOG = LoggerFactory.getLogger(BreakpointTable.class);

    private final List<Breakpoint> entries;

    /**
     * Creates an empty table.
     */
    public BreakpointTable() {
        this.entries = new ArrayList<>();
    }

    /**
     * Creates an independent copy of another table.
     * @param other The table to copy.
     */
    public BreakpointTable(BreakpointTable other) {
        this.entries = new ArrayList<>(other.entries);
    }

    /**
     * Appends a breakpoint.
     * @param address The trap address.
     * @param name The unique name.
     * @return false if the table is full, the address or name is already taken, or the
     *         name is not a single non-empty token.
     */
    public boolean insert(int address, String name) {
        if (entries.size() >= Config.MAX_INSTRUCTIONS) {
            LOG.debug("Breakpoint table is full ({} entries), rejecting '{}'", entries.size(), name);
            return false;
        }
        if (!Breakpoint.isValidName(name)) {
            LOG.debug("Rejecting breakpoint with invalid name '{}'", name);
            return false;
        }
        if (indexOf(address) >= 0) {
            LOG.debug("A breakpoint already exists at address {}", address & Config.ARCH_BITMASK);
            return false;
        }
        if (indexOf(name) >= 0) {
            LOG.debug("Breakpoint name '{}' is already in use", name);
            return false;
        }
        entries.add(new Breakpoint(address, name));
        return true;
    }

    /**
     * Finds the position of the breakpoint at an address.
     * @param address The address; it is masked before comparing.
     * @return The index in table order, or -1 if none matches.
     */
    public int indexOf(int address) {
        for (int idx = 0; idx < entries.size(); idx++) {
            if (entries.get(idx).has(address)) {
                return idx;
            }
        }
        return -1;
    }

    /**
     * Finds the position of the breakpoint with a name.
     * @param name The name.
     * @return The index in table order, or -1 if none matches.
     */
    public int indexOf(String name) {
        for (int idx = 0; idx < entries.size(); idx++) {
            if (entries.get(idx).has(name)) {
                return idx;
            }
        }
        return -1;
    }

    public Optional<Breakpoint> findByAddress(int address) {
        int idx = indexOf(address);
        return idx < 0 ? Optional.empty() : Optional.of(entries.get(idx));
    }

    public Optional<Breakpoint> findByName(String name) {
        int idx = indexOf(name);
        return idx < 0 ? Optional.empty() : Optional.of(entries.get(idx));
    }

    /**
     * Removes the breakpoint at an address.
     * @param address The address.
     * @return false if no breakpoint traps this address.
     */
    public boolean deleteByAddress(int address) {
        return removeAt(indexOf(address));
    }

    /**
     * Removes the breakpoint with a name.
     * @param name The name.
     * @return false if no breakpoint has this name.
     */
    public boolean deleteByName(String name) {
        return removeAt(indexOf(name));
    }

    private boolean removeAt(int idx) {
        if (idx < 0) {
            return false;
        }
        // ArrayList shifts the later entries left by one.
        entries.remove(idx);
        return true;
    }

    public int count() {
        return entries.size();
    }

    public boolean isFull() {
        return entries.size() >= Config.MAX_INSTRUCTIONS;
    }

    /**
     * Removes every breakpoint.
     */
    public void clear() {
        entries.clear();
    }

    /**
     * Returns a read-only view of the breakpoints in table order.
     * @return An unmodifiable list backed by this table.
     */
    public List<Breakpoint> asList() {
        return Collections.unmodifiableList(entries);
    }
}
