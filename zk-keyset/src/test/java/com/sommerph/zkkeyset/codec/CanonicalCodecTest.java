package com.sommerph.zkkeyset.codec;

import com.sommerph.zkkeyset.TestKeys;
import com.sommerph.zkkeyset.keyset.KeySet;
import com.sommerph.zkkeyset.keyset.KeySetException;
import com.sommerph.zkkeyset.keyset.OrderByInputs;
import com.sommerph.zkkeyset.keyset.OrderByOutputs;
import com.sommerph.zkkeyset.keyset.VerifierKeySet;
import com.sommerph.zkkeyset.model.key.TransferProvingKey;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.sommerph.zkkeyset.TestKeys.transferPk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalCodecTest {

    private static KeySet<TransferProvingKey> decodeTransferKeys(byte[] bytes) {
        return CanonicalInput.decode(bytes, in -> KeySet.deserialize(in, OrderByInputs.INSTANCE, TransferProvingKey::deserialize));
    }

    @Test
    void writesLittleEndianFixedLayout() throws KeySetException {
        KeySet<TransferProvingKey> keys = KeySet.of(OrderByOutputs.INSTANCE, new TransferProvingKey(1, 2, new byte[] {(byte) 0xAB}));

        byte[] expected = new CanonicalOutput()
                .writeU64(1)                      // entries
                .writeU64(2).writeU64(1)          // sort key: outputs first
                .writeU64(1).writeU64(2)          // key size
                .writeU64(1).writeU8(0xAB)        // key material
                .toByteArray();

        assertThat(keys.toCanonicalBytes()).isEqualTo(expected);
        assertThat(Arrays.copyOf(expected, 8)).containsExactly(1, 0, 0, 0, 0, 0, 0, 0);
    }

    @Test
    void keySetRoundTripsInSortOrder() throws KeySetException {
        KeySet<TransferProvingKey> keys = KeySet.of(OrderByInputs.INSTANCE, transferPk(4, 4), transferPk(1, 2), transferPk(2, 1));

        KeySet<TransferProvingKey> decoded = decodeTransferKeys(keys.toCanonicalBytes());

        assertThat(decoded).isEqualTo(keys);
        assertThat(decoded).containsExactly(transferPk(1, 2), transferPk(2, 1), transferPk(4, 4));
    }

    @Test
    void rejectsTruncatedInput() throws KeySetException {
        byte[] bytes = KeySet.of(OrderByInputs.INSTANCE, transferPk(1, 2)).toCanonicalBytes();

        assertThatThrownBy(() -> decodeTransferKeys(Arrays.copyOf(bytes, bytes.length - 1)))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void rejectsTrailingBytes() throws KeySetException {
        byte[] bytes = KeySet.of(OrderByInputs.INSTANCE, transferPk(1, 2)).toCanonicalBytes();

        assertThatThrownBy(() -> decodeTransferKeys(Arrays.copyOf(bytes, bytes.length + 1)))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("trailing");
    }

    @Test
    void writesU64LittleEndian() {
        assertThat(new CanonicalOutput().writeU64(0x0102030405060708L).toByteArray())
                .containsExactly(8, 7, 6, 5, 4, 3, 2, 1);
        assertThat(new CanonicalOutput().writeU64(-1L).toByteArray())
                .containsExactly(-1, -1, -1, -1, -1, -1, -1, -1);
    }

    @Test
    void rejectsImplausibleEntryCount() {
        byte[] bytes = new CanonicalOutput().writeU64(1_000_000).toByteArray();

        assertThatThrownBy(() -> decodeTransferKeys(bytes))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("1000000 entries");
    }

    @Test
    void rejectsSizesBeyondIntRange() {
        byte[] bytes = new CanonicalOutput().writeU64(-1L).toByteArray();

        assertThatThrownBy(() -> decodeTransferKeys(bytes))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("18446744073709551615");
    }

    @Test
    void rejectsEmptyAndDuplicateEntries() {
        byte[] empty = new CanonicalOutput().writeU64(0).toByteArray();
        CanonicalOutput duplicate = new CanonicalOutput().writeU64(2);
        for (int i = 0; i < 2; i++) {
            duplicate.writeU64(1).writeU64(2).write(transferPk(1, 2));
        }

        assertThatThrownBy(() -> decodeTransferKeys(empty))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("at least one key");
        assertThatThrownBy(() -> decodeTransferKeys(duplicate.toByteArray()))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void rejectsKeySetEncodedUnderAnotherOrder() throws KeySetException {
        VerifierKeySet byOutputs = TestKeys.verifierKeySet(OrderByOutputs.INSTANCE);

        assertThatThrownBy(() -> CanonicalInput.decode(byOutputs.toCanonicalBytes(),
                in -> VerifierKeySet.deserialize(in, OrderByInputs.INSTANCE)))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void rejectsVerifierKeySetWithMisplacedKeys() throws KeySetException {
        VerifierKeySet keySet = TestKeys.verifierKeySet(OrderByInputs.INSTANCE);
        byte[] swapped = new CanonicalOutput()
                .write(keySet.getMint())
                .write(keySet.getFreeze())
                .write(keySet.getXfr())
                .toByteArray();

        assertThatThrownBy(() -> CanonicalInput.decode(swapped, in -> VerifierKeySet.deserialize(in, OrderByInputs.INSTANCE)))
                .isInstanceOf(MalformedKeyDataException.class)
                .hasMessageContaining("Invalid verifier key set");
    }

}
