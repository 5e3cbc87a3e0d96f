package com.stablegate.ingestion.adapter.tron;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TronAddressTest {

    private static final String HEX = "0xa614f803b6fd780986a42c78ec9c7f77e6ded13c";

    @Test
    void toHex_acceptsPrefixedAndPlainForms() {
        assertThat(TronAddress.toHex("41a614f803b6fd780986a42c78ec9c7f77e6ded13c")).isEqualTo(HEX);
        assertThat(TronAddress.toHex("0x41A614F803B6FD780986A42C78EC9C7F77E6DED13C")).isEqualTo(HEX);
        assertThat(TronAddress.toHex("a614f803b6fd780986a42c78ec9c7f77e6ded13c")).isEqualTo(HEX);
        assertThat(TronAddress.toHex(HEX)).isEqualTo(HEX);
    }

    @Test
    void toHex_decodesBase58Check() {
        assertThat(TronAddress.toHex("TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t")).isEqualTo(HEX);
        assertThat(TronAddress.toHex(" TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t ")).isEqualTo(HEX);
    }

    @Test
    void toHex_rejectsMalformedInput() {
        assertThatThrownBy(() -> TronAddress.toHex("T0OIl"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("base58");
        assertThatThrownBy(() -> TronAddress.toHex("xyz"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected base58 or hex");
        assertThatThrownBy(() -> TronAddress.toHex("0x1234")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TronAddress.toHex(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
