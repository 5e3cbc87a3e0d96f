package com.stablegate.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablegate.domain.ChainType;
import com.stablegate.ingestion.adapter.ChainClient;
import com.stablegate.ingestion.adapter.evm.EvmChainClient;
import com.stablegate.ingestion.adapter.evm.EvmRpcClient;
import com.stablegate.ingestion.adapter.tron.TronChainClient;
import com.stablegate.ingestion.adapter.tron.TronHttpClient;
import com.stablegate.ingestion.listener.ListenerObserver;
import com.stablegate.ingestion.listener.TransactionListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ChainListenerFactoryTest {

    private ChainListenerFactory factory;

    @BeforeEach
    void setUp() {
        factory = new ChainListenerFactory(mock(EvmRpcClient.class), mock(TronHttpClient.class), new ObjectMapper(),
                new IngestionRetryProperties(), new IngestionRpcProperties(), ListenerObserver.NOOP);
    }

    @Test
    void create_tron_normalizesAddressesAndUppercasesSymbols() {
        ListenerProperties.ChainEntry entry = entry("41a614f803b6fd780986a42c78ec9c7f77e6ded13c",
                "41A1B2C3D4E5F60718293A4B5C6D7E8F9012345678");

        TransactionListener listener = factory.create(ChainType.TRON, entry);

        assertThat(listener.getBlockchainType()).isEqualTo(ChainType.TRON);
        assertThat(listener.getWalletAddress()).isEqualTo("0xa1b2c3d4e5f60718293a4b5c6d7e8f9012345678");
        assertThat(listener.getSupportedTokens()).containsExactly("USDT");
        assertThat(listener.isRunning()).isFalse();
    }

    @Test
    void create_tronBase58Addresses_areDecodedToHex() {
        ListenerProperties.ChainEntry entry = entry("TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t",
                "TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t");

        TransactionListener listener = factory.create(ChainType.TRON, entry);

        assertThat(listener.getWalletAddress()).isEqualTo("0xa614f803b6fd780986a42c78ec9c7f77e6ded13c");
    }

    @Test
    void create_tronMalformedAddress_isRejected() {
        ListenerProperties.ChainEntry entry = entry("41a614f803b6fd780986a42c78ec9c7f77e6ded13c", "not-an-address");

        assertThatThrownBy(() -> factory.create(ChainType.TRON, entry))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected base58 or hex");
    }

    @Test
    void createClient_picksClientPerChain() {
        ListenerProperties.ChainEntry entry = entry("0x55d398326f99059ff775485246999027b3197955", "0xabc");

        ChainClient bsc = factory.createClient(ChainType.BSC, entry);
        ChainClient eth = factory.createClient(ChainType.ETHEREUM, entry);
        ChainClient tron = factory.createClient(ChainType.TRON, entry);

        assertThat(bsc).isInstanceOf(EvmChainClient.class);
        assertThat(bsc.chainType()).isEqualTo(ChainType.BSC);
        assertThat(eth.chainType()).isEqualTo(ChainType.ETHEREUM);
        assertThat(tron).isInstanceOf(TronChainClient.class);
    }

    @Test
    void createClient_solana_isNotSupported() {
        ListenerProperties.ChainEntry entry = entry("mint", "wallet");

        assertThatThrownBy(() -> factory.createClient(ChainType.SOLANA, entry))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SOLANA");
    }

    @Test
    void createClient_withoutRpcUrls_isRejected() {
        ListenerProperties.ChainEntry entry = entry("0x55d398326f99059ff775485246999027b3197955", "0xabc");
        entry.setRpcUrls(List.of());

        assertThatThrownBy(() -> factory.createClient(ChainType.BSC, entry))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeAddress_evmIsLowercasedAndBlankRejected() {
        assertThat(ChainListenerFactory.normalizeAddress(ChainType.BSC, " 0xABCdef "))
                .isEqualTo("0xabcdef");
        assertThatThrownBy(() -> ChainListenerFactory.normalizeAddress(ChainType.BSC, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ListenerProperties.ChainEntry entry(String tokenAddress, String wallet) {
        ListenerProperties.TokenEntry token = new ListenerProperties.TokenEntry();
        token.setAddress(tokenAddress);
        token.setDecimals(6);
        ListenerProperties.ChainEntry entry = new ListenerProperties.ChainEntry();
        entry.setRpcUrls(List.of("https://rpc.example.org"));
        entry.setWalletAddress(wallet);
        entry.setTokens(Map.of("usdt", token));
        entry.setPollIntervalSeconds(60L);
        return entry;
    }
}
