package com.sommerph.zkkeyset.commitment;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitmentBuilderTest {

    @Test
    void emptyTagIsKeccakOfNothing() {
        assertThat(new CommitmentBuilder("").finish().toHex())
                .isEqualTo("c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
    }

    @Test
    void hashesTagBytes() {
        assertThat(new CommitmentBuilder("abc").finish().toHex())
                .isEqualTo("4e03657aea45a94fc7d47ba826c8d667c0d1e6e33a64a036ec44f58fa12d6c45");
        assertThat(new CommitmentBuilder("a").constantString("bc").finish())
                .isEqualTo(new CommitmentBuilder("abc").finish());
    }

    @Test
    void varSizeBytesArePrefixedWithLength() {
        byte[] field = {1, 2, 3};

        Commitment expected = new CommitmentBuilder("tag").u64(3).fixedSizeBytes(field).finish();

        assertThat(new CommitmentBuilder("tag").varSizeBytes(field).finish()).isEqualTo(expected);
        assertThat(new CommitmentBuilder("tag").fixedSizeBytes(field).finish()).isNotEqualTo(expected);
    }

    @Test
    void u64IsLittleEndian() {
        assertThat(new CommitmentBuilder("").u64(1).finish())
                .isEqualTo(new CommitmentBuilder("").fixedSizeBytes(new byte[] {1, 0, 0, 0, 0, 0, 0, 0}).finish());
        assertThat(new CommitmentBuilder("").u64(0x0102030405060708L).finish())
                .isEqualTo(new CommitmentBuilder("").fixedSizeBytes(new byte[] {8, 7, 6, 5, 4, 3, 2, 1}).finish());
    }

    @Test
    void hexRoundTrip() {
        Commitment commitment = new CommitmentBuilder("VerifCRS Comm").finish();

        assertThat(Commitment.fromHex(commitment.toHex())).isEqualTo(commitment);
        assertThat(commitment.toString()).isEqualTo(commitment.toHex()).hasSize(64);
        assertThatThrownBy(() -> Commitment.fromHex("abcd")).isInstanceOf(IllegalArgumentException.class);
    }

}
