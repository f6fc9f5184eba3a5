package io.luascript.core.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IdGenerator")
class IdGeneratorTest {

    @Test
    @DisplayName("starts at 0 and increases strictly")
    void monotonicFromZero() {
        IdGenerator ids = new IdGenerator();
        List<NodeId> allocated = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            allocated.add(NodeId.of(ids.next("id")));
        }

        assertThat(allocated.get(0).value()).isEqualTo("id_0");
        for (int i = 0; i < allocated.size(); i++) {
            assertThat(allocated.get(i).ordinal()).isEqualTo(i);
        }
        assertThat(allocated).isSorted();
    }

    @Test
    @DisplayName("one counter is shared by every prefix")
    void sharedCounterAcrossPrefixes() {
        IdGenerator ids = new IdGenerator();

        assertThat(ids.next("id")).isEqualTo("id_0");
        assertThat(ids.next("cfg")).isEqualTo("cfg_1");
        assertThat(ids.next("bb")).isEqualTo("bb_1T");
        assertThat(ids.peek()).isEqualTo(3);
    }

    @Test
    @DisplayName("separate instances do not share state")
    void instancesAreIndependent() {
        IdGenerator first = new IdGenerator();
        first.next("id");
        first.next("id");

        assertThat(new IdGenerator().next("id")).isEqualTo("id_0");
        first.reset();
        assertThat(first.next("id")).isEqualTo("id_0");
    }

    @Test
    @DisplayName("rejects prefixes that would break the id format")
    void rejectsBadPrefix() {
        IdGenerator ids = new IdGenerator();

        assertThatThrownBy(() -> ids.next("1abc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ids.next("a_b")).isInstanceOf(IllegalArgumentException.class);
        assertThat(ids.peek()).isZero();
    }
}
