package com.umitunal.egserial.coercion;

import com.umitunal.egserial.model.BallotBoxState;
import com.umitunal.egserial.model.ElectionType;
import com.umitunal.egserial.model.ProofUsage;
import com.umitunal.egserial.model.WireEnum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WireEnumCoercionTest {

    enum Clashing implements WireEnum {
        FIRST, SECOND;

        @Override
        public String wireValue() {
            return "same";
        }
    }

    @Test
    @DisplayName("Should use wire values instead of constant names")
    void testWireValues() {
        WireEnumCoercion<ElectionType> coercion = new WireEnumCoercion<>(ElectionType.class);

        assertThat(coercion.format(ElectionType.PARTISAN_PRIMARY_CLOSED)).isEqualTo("partisan_primary_closed");
        assertThat(coercion.parse("general")).isEqualTo(ElectionType.GENERAL);
        assertThat(coercion.numeric()).isFalse();
    }

    @Test
    @DisplayName("Should round-trip every constant, including wire values with spaces")
    void testAllConstants() {
        WireEnumCoercion<ProofUsage> coercion = new WireEnumCoercion<>(ProofUsage.class);

        for (ProofUsage usage : ProofUsage.values()) {
            assertThat(coercion.parse(coercion.format(usage))).isEqualTo(usage);
        }
        assertThat(coercion.format(ProofUsage.SELECTION_VALUE)).isEqualTo("Prove selection's value (0 or 1)");
    }

    @Test
    @DisplayName("Should mark integer coded enums as numeric")
    void testNumericEnum() {
        WireEnumCoercion<BallotBoxState> coercion = new WireEnumCoercion<>(BallotBoxState.class);

        assertThat(coercion.numeric()).isTrue();
        assertThat(coercion.format(BallotBoxState.UNKNOWN)).isEqualTo("999");
        assertThat(coercion.parse("2")).isEqualTo(BallotBoxState.SPOILED);
    }

    @Test
    @DisplayName("Should reject unknown wire values and constant names")
    void testUnknownValue() {
        WireEnumCoercion<ElectionType> coercion = new WireEnumCoercion<>(ElectionType.class);

        assertThatThrownBy(() -> coercion.parse("GENERAL"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ElectionType");
    }

    @Test
    @DisplayName("Should refuse an enum with duplicate wire values")
    void testDuplicateWireValues() {
        assertThatThrownBy(() -> new WireEnumCoercion<>(Clashing.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same");
    }
}
