package com.sommerph.attestbackend.util;

import com.sommerph.attestbackend.exception.ErrorCategory;
import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerIdsTest {

    @Test
    @DisplayName("normalises valid addresses to lower case")
    void normalisesAddress() {
        assertThat(LedgerIds.requireAddress("0x00000000000000000000000000000000000000AB"))
                .isEqualTo("0x00000000000000000000000000000000000000ab");
    }

    @Test
    @DisplayName("rejects malformed and zero addresses as validation errors")
    void rejectsBadAddresses() {
        assertThatThrownBy(() -> LedgerIds.requireAddress("0x1234"))
                .isInstanceOfSatisfying(ProtocolException.class, e -> {
                    assertThat(e.getError()).isEqualTo(ProtocolError.INVALID_ADDRESS);
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.VALIDATION);
                    assertThat(e.getIdentifier()).isEqualTo("0x1234");
                });
        assertThatThrownBy(() -> LedgerIds.requireAddress(LedgerIds.ZERO_ADDRESS))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> LedgerIds.requireAddress(null))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    @DisplayName("treats the all-zero qHash as missing")
    void rejectsZeroQHash() {
        assertThatThrownBy(() -> LedgerIds.requireQHash(LedgerIds.ZERO_BYTES32))
                .isInstanceOfSatisfying(ProtocolException.class,
                        e -> assertThat(e.getError()).isEqualTo(ProtocolError.INVALID_QHASH));
        assertThat(LedgerIds.isZeroBytes32(null)).isTrue();
        assertThat(LedgerIds.isZeroAddress(null)).isTrue();
    }

    @Test
    void acceptsWellFormedQHash() {
        String qHash = "0x" + "Aa".repeat(32);

        assertThat(LedgerIds.isBytes32(qHash)).isTrue();
        assertThat(LedgerIds.requireQHash(qHash)).isEqualTo("0x" + "aa".repeat(32));
    }

}
