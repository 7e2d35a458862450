// file: storage/src/test/java/io/strata/storage/tx/JournalCodecTest.java
package io.strata.storage.tx;

import io.strata.storage.Oid;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JournalCodecTest {

    private static final Oid A = Oid.of("1111111111111111111111111111111111111111");
    private static final Oid B = Oid.of("2222222222222222222222222222222222222222");

    @Test
    void prepared_record_keeps_update_order_and_must_not_exist_markers() {
        var prepared = new JournalRecord.Prepared("tx-1", 1234L, List.of(
                new RefUpdate("refs/strata/layers/global", A, B),
                new RefUpdate("refs/strata/layers/project-base/api", null, A)));

        var decoded = JournalCodec.decode(JournalCodec.encodePayload(prepared));

        assertEquals(prepared, decoded);
        assertTrue(((JournalRecord.Prepared) decoded).updates().get(1).mustNotExist());
    }

    @Test
    void outcome_records_decode_to_their_type() {
        assertEquals(new JournalRecord.Committed("tx-2"),
                JournalCodec.decode(JournalCodec.encodePayload(new JournalRecord.Committed("tx-2"))));
        assertEquals(new JournalRecord.Aborted("tx-3"),
                JournalCodec.decode(JournalCodec.encodePayload(new JournalRecord.Aborted("tx-3"))));
    }

    @Test
    void malformed_payloads_are_rejected() {
        byte[] payload = JournalCodec.encodePayload(new JournalRecord.Prepared("tx", 1L, List.of(new RefUpdate("r", A, B))));

        assertThrows(IllegalArgumentException.class, () -> JournalCodec.decode(Arrays.copyOf(payload, payload.length - 3)));
        assertThrows(IllegalArgumentException.class, () -> JournalCodec.decode(new byte[]{9, 0, 0, 0, 0}));
    }
}
