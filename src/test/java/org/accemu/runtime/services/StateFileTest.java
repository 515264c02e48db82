package org.accemu.runtime.services;

import org.accemu.runtime.Config;
import org.accemu.runtime.model.Breakpoint;
import org.accemu.runtime.model.EmulatorSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the text form of emulator state. The malformed-input tests each
 * start from a valid document and break exactly one thing.
 */
@Tag("unit")
class StateFileTest {

    private static String validState(String cycles, String acc, String pc, String breakpoints) {
        StringBuilder sb = new StringBuilder();
        sb.append(cycles).append('\n').append(acc).append('\n').append(pc).append('\n');
        for (int i = 0; i < Config.MEMORY_SIZE; i++) {
            sb.append(i % 7).append('\n');
        }
        sb.append(breakpoints);
        return sb.toString();
    }

    private static EmulatorSnapshot read(String text) throws Exception {
        return StateFile.read(new StringReader(text));
    }

    @Test
    void readsHeaderMemoryAndBreakpoints() throws Exception {
        EmulatorSnapshot snapshot = read(validState("12", "200", "6", "4 loop\n10 end\n"));

        assertThat(snapshot.totalCycles()).isEqualTo(12);
        assertThat(snapshot.acc()).isEqualTo(200);
        assertThat(snapshot.pc()).isEqualTo(6);
        assertThat(snapshot.memory()).hasSize(Config.MEMORY_SIZE);
        assertThat(snapshot.memory()[13]).isEqualTo(13 % 7);
        assertThat(snapshot.breakpoints()).containsExactly(new Breakpoint(4, "loop"), new Breakpoint(10, "end"));
    }

    @Test
    void acceptsNoBreakpoints() throws Exception {
        assertThat(read(validState("0", "0", "0", "")).breakpoints()).isEmpty();
    }

    @Test
    void toleratesSurroundingWhitespaceAndBlankBreakpointLines() throws Exception {
        EmulatorSnapshot snapshot = read(validState(" 3 ", "\t1", "2 ", "\n  4   loop  \n\n6 end"));
        assertThat(snapshot.totalCycles()).isEqualTo(3);
        assertThat(snapshot.breakpoints()).extracting(Breakpoint::name).containsExactly("loop", "end");
    }

    @Test
    void acceptsLargestValues() throws Exception {
        EmulatorSnapshot snapshot = read(validState("9000000000", String.valueOf(Config.MAX_VALUE),
            String.valueOf(Config.MEMORY_SIZE - 1), String.valueOf(Config.MEMORY_SIZE - 1) + " last"));
        assertThat(snapshot.totalCycles()).isEqualTo(9_000_000_000L);
        assertThat(snapshot.acc()).isEqualTo(Config.MAX_VALUE);
        assertThat(snapshot.pc()).isEqualTo(Config.MEMORY_SIZE - 1);
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> read("")).isInstanceOf(StateFormatException.class)
            .hasMessageContaining("total cycles");
    }

    @Test
    void rejectsNegativeCycles() {
        assertThatThrownBy(() -> read(validState("-1", "0", "0", "")))
            .isInstanceOf(StateFormatException.class)
            .satisfies(e -> assertThat(((StateFormatException) e).getLineNumber()).isEqualTo(1));
    }

    @Test
    void rejectsNonNumericHeader() {
        assertThatThrownBy(() -> read(validState("x", "0", "0", ""))).isInstanceOf(StateFormatException.class);
        assertThatThrownBy(() -> read(validState("1", "zero", "0", ""))).isInstanceOf(StateFormatException.class);
    }

    @Test
    void rejectsAccOutOfRange() {
        assertThatThrownBy(() -> read(validState("0", String.valueOf(Config.MAX_VALUE + 1), "0", "")))
            .isInstanceOf(StateFormatException.class)
            .hasMessageContaining("accumulator");
        assertThatThrownBy(() -> read(validState("0", "-1", "0", ""))).isInstanceOf(StateFormatException.class);
    }

    @Test
    void rejectsPcOutOfRange() {
        assertThatThrownBy(() -> read(validState("0", "0", String.valueOf(Config.MEMORY_SIZE), "")))
            .isInstanceOf(StateFormatException.class)
            .hasMessageContaining("program counter");
    }

    @Test
    void rejectsTrailingGarbageOnMemoryLine() {
        String text = validState("0", "0", "0", "").replaceFirst("\n3\n", "\n3 junk\n");
        assertThatThrownBy(() -> read(text))
            .isInstanceOf(StateFormatException.class)
            .hasMessageContaining("memory[3]");
    }

    @Test
    void rejectsEmptyMemoryLine() {
        String text = validState("0", "0", "0", "").replaceFirst("\n3\n", "\n\n");
        assertThatThrownBy(() -> read(text)).isInstanceOf(StateFormatException.class);
    }

    @Test
    void rejectsMemoryValueOutOfRange() {
        String text = validState("0", "0", "0", "").replaceFirst("\n3\n", "\n256\n");
        assertThatThrownBy(() -> read(text)).isInstanceOf(StateFormatException.class);
    }

    @Test
    void rejectsTruncatedMemory() {
        StringBuilder sb = new StringBuilder("0\n0\n0\n");
        for (int i = 0; i < Config.MEMORY_SIZE - 1; i++) {
            sb.append("0\n");
        }
        assertThatThrownBy(() -> read(sb.toString()))
            .isInstanceOf(StateFormatException.class)
            .hasMessageContaining("missing memory[" + (Config.MEMORY_SIZE - 1) + "]");
    }

    @Test
    void rejectsBreakpointAddressOutOfRange() {
        assertThatThrownBy(() -> read(validState("0", "0", "0", Config.MEMORY_SIZE + " far\n")))
            .isInstanceOf(StateFormatException.class);
        assertThatThrownBy(() -> read(validState("0", "0", "0", "-2 neg\n")))
            .isInstanceOf(StateFormatException.class);
    }

    @Test
    void rejectsNonNumericBreakpointAddress() {
        assertThatThrownBy(() -> read(validState("0", "0", "0", "here name\n")))
            .isInstanceOf(StateFormatException.class);
    }

    @Test
    void rejectsDuplicateBreakpoints() {
        assertThatThrownBy(() -> read(validState("0", "0", "0", "4 a\n4 b\n")))
            .isInstanceOf(StateFormatException.class);
        assertThatThrownBy(() -> read(validState("0", "0", "0", "4 a\n6 a\n")))
            .isInstanceOf(StateFormatException.class);
    }

    @Test
    void rejectsAddressWithoutName() {
        assertThatThrownBy(() -> read(validState("0", "0", "0", "4 a\n6\n")))
            .isInstanceOf(StateFormatException.class)
            .hasMessageContaining("has no name");
    }

    @Test
    void writeProducesOneValuePerLine() throws IOException {
        int[] memory = new int[Config.MEMORY_SIZE];
        memory[0] = 1;
        memory[1] = 10;
        EmulatorSnapshot snapshot = new EmulatorSnapshot(5, 3, 2, memory, List.of(new Breakpoint(4, "here")));

        StringWriter out = new StringWriter();
        StateFile.write(snapshot, out);

        String[] lines = out.toString().split("\n");
        assertThat(lines).hasSize(3 + Config.MEMORY_SIZE + 1);
        assertThat(lines[0]).isEqualTo("5");
        assertThat(lines[1]).isEqualTo("3");
        assertThat(lines[2]).isEqualTo("2");
        assertThat(lines[3]).isEqualTo("1");
        assertThat(lines[4]).isEqualTo("10");
        assertThat(lines[lines.length - 1]).isEqualTo("4 here");
    }
}
