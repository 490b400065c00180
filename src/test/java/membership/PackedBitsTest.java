package membership;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackedBitsTest {

    @Test
    void shouldStartEmpty() {
        PackedBits bits = new PackedBits(100);
        assertThat(bits.length()).isEqualTo(100);
        assertThat(bits.cardinality()).isZero();
        assertThat(bits.get(99)).isFalse();
    }

    @Test
    void shouldSetAndGetAcrossWordBoundaries() {
        PackedBits bits = new PackedBits(130);
        bits.set(0);
        bits.set(63);
        bits.set(64);
        bits.set(129);
        assertThat(bits.get(0)).isTrue();
        assertThat(bits.get(63)).isTrue();
        assertThat(bits.get(64)).isTrue();
        assertThat(bits.get(129)).isTrue();
        assertThat(bits.get(1)).isFalse();
        assertThat(bits.cardinality()).isEqualTo(4);
    }

    @Test
    void shouldReportPreviousValueOnGetAndSet() {
        PackedBits bits = new PackedBits(10);
        assertThat(bits.getAndSet(3)).isFalse();
        assertThat(bits.getAndSet(3)).isTrue();
    }

    @Test
    void shouldRejectOutOfBoundsIndex() {
        PackedBits bits = new PackedBits(10);
        assertThatThrownBy(() -> bits.get(10)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> bits.set(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void shouldWriteLeastSignificantBitFirst() {
        PackedBits bits = new PackedBits(15);
        bits.set(4);
        bits.set(8);
        assertThat(bits.toByteArray()).containsExactly((byte) 0x10, (byte) 0x01);
    }

    @Test
    void shouldRebuildFromBytesAndDropPadding() {
        PackedBits bits = PackedBits.fromByteArray(new byte[]{(byte) 0x10, (byte) 0xFF}, 12);
        assertThat(bits.get(4)).isTrue();
        assertThat(bits.get(11)).isTrue();
        assertThat(bits.cardinality()).isEqualTo(5);
        assertThat(bits.toByteArray()).containsExactly((byte) 0x10, (byte) 0x0F);
    }

    @Test
    void shouldRejectWrongByteCount() {
        assertThatThrownBy(() -> PackedBits.fromByteArray(new byte[3], 12))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCombineWithOrAndAnd() {
        PackedBits a = new PackedBits(70);
        PackedBits b = new PackedBits(70);
        a.set(1);
        a.set(65);
        b.set(65);
        b.set(2);

        PackedBits or = a.copy();
        or.or(b);
        assertThat(or.cardinality()).isEqualTo(3);

        PackedBits and = a.copy();
        and.and(b);
        assertThat(and.cardinality()).isEqualTo(1);
        assertThat(and.get(65)).isTrue();

        assertThat(a.cardinality()).isEqualTo(2);
    }

    @Test
    void shouldRejectCombiningDifferentLengths() {
        assertThatThrownBy(() -> new PackedBits(10).or(new PackedBits(11)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCopyIndependently() {
        PackedBits a = new PackedBits(10);
        PackedBits copy = a.copy();
        copy.set(5);
        assertThat(a.get(5)).isFalse();
        assertThat(copy).isNotEqualTo(a);
    }
}
