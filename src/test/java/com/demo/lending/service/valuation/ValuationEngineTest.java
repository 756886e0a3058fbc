package com.demo.lending.service.valuation;

import com.demo.lending.domain.Quote;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import com.demo.lending.domain.UsdValue;
import com.demo.lending.exception.StaleQuoteException;
import com.demo.lending.service.TokenRegistry;
import com.demo.lending.support.MutableClock;
import com.demo.lending.support.TestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ValuationEngine")
class ValuationEngineTest {

    private static final BigInteger E8 = BigInteger.TEN.pow(8);
    private static final Token USDC = new Token(1, TokenKind.FUNGIBLE, "0xusdc", "USDC", 6, true, "USDC/USD");
    private static final Token ETH = new Token(0, TokenKind.NATIVE, null, "ETH", 18, true, "ETH/USD");
    private static final Token GOLD = new Token(2, TokenKind.FUNGIBLE, "0xgold", "GOLD", 18, true, null);

    @Mock private TokenRegistry tokens;
    @Mock private PriceOracle oracle;

    private MutableClock clock;
    private ValuationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestConfig.T0);
        engine = new ValuationEngine(tokens, oracle, clock);
        ReflectionTestUtils.setField(engine, "staleBoundSecs", 3600L);
    }

    @Nested
    @DisplayName("conversion")
    class Conversion {

        @Test
        @DisplayName("normalizes token precision so 6- and 18-decimal assets compare directly")
        void normalizesDecimals() {
            // Arrange
            when(tokens.get(1)).thenReturn(USDC);
            when(tokens.get(0)).thenReturn(ETH);
            when(oracle.latestQuote("USDC/USD")).thenReturn(new Quote(E8, 8, clock.instant()));
            when(oracle.latestQuote("ETH/USD")).thenReturn(new Quote(BigInteger.valueOf(2000).multiply(E8), 8, clock.instant()));

            // Act
            BigInteger thousandUsdc = engine.usdValueOf(1, BigInteger.valueOf(1000).multiply(BigInteger.TEN.pow(6)));
            BigInteger halfEth = engine.usdValueOf(0, BigInteger.TEN.pow(18).divide(BigInteger.TWO));

            // Assert
            assertThat(thousandUsdc).isEqualTo(BigInteger.valueOf(1000).multiply(E8));
            assertThat(halfEth).isEqualTo(thousandUsdc);
        }

        @Test
        @DisplayName("handles quotes with their own precision and floors the result")
        void quoteDecimalsAndFlooring() {
            Quote q = new Quote(BigInteger.valueOf(199_999_999L), 6, TestConfig.T0);

            // 3 raw units of a 6-decimal token at 199.999999 USD
            assertThat(ValuationEngine.convert(BigInteger.valueOf(3), 6, q)).isEqualTo(BigInteger.valueOf(59999));
            assertThat(ValuationEngine.convert(BigInteger.ZERO, 18, q)).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("carries the quote timestamp on the value")
        void carriesTimestamp() {
            Instant published = TestConfig.T0.minusSeconds(60);
            when(tokens.get(1)).thenReturn(USDC);
            when(oracle.latestQuote("USDC/USD")).thenReturn(new Quote(E8, 8, published));

            UsdValue v = engine.usdValue(1, BigInteger.ONE);

            assertThat(v.asOf()).isEqualTo(published);
        }
    }

    @Nested
    @DisplayName("stale handling")
    class Staleness {

        @Test
        @DisplayName("a quote exactly at the bound is fresh, one second older is stale")
        void boundary() {
            when(tokens.get(1)).thenReturn(USDC);
            when(oracle.latestQuote("USDC/USD")).thenReturn(new Quote(E8, 8, TestConfig.T0));

            clock.advance(Duration.ofSeconds(3600));
            assertThat(engine.usdValueOf(1, BigInteger.ONE)).isEqualTo(BigInteger.valueOf(100));

            clock.advance(Duration.ofSeconds(1));
            assertThatThrownBy(() -> engine.usdValueOf(1, BigInteger.ONE))
                    .isInstanceOf(StaleQuoteException.class)
                    .hasMessageContaining("3601s old");
        }

        @Test
        @DisplayName("a token without a feed cannot be valued and the oracle is not asked")
        void noFeed() {
            when(tokens.get(2)).thenReturn(GOLD);

            assertThatThrownBy(() -> engine.usdValueOf(2, BigInteger.TEN))
                    .isInstanceOf(StaleQuoteException.class);
            verify(oracle, never()).latestQuote(anyString());
        }

        @Test
        @DisplayName("oracle failures and non-positive prices surface as stale quotes")
        void oracleFailures() {
            when(tokens.get(1)).thenReturn(USDC);
            when(oracle.latestQuote("USDC/USD")).thenThrow(new IllegalStateException("connection reset"));

            assertThatThrownBy(() -> engine.usdValueOf(1, BigInteger.ONE))
                    .isInstanceOf(StaleQuoteException.class)
                    .hasMessageContaining("connection reset")
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("a quote with out-of-range decimals is stale, not an arithmetic failure")
        void malformedDecimals() {
            when(tokens.get(0)).thenReturn(ETH);
            when(oracle.latestQuote("ETH/USD")).thenReturn(new Quote(BigInteger.valueOf(2000).multiply(E8), -1, TestConfig.T0));

            assertThatThrownBy(() -> engine.usdValueOf(0, BigInteger.TEN))
                    .isInstanceOf(StaleQuoteException.class)
                    .hasMessageContaining("-1 decimals");

            when(oracle.latestQuote("ETH/USD")).thenReturn(new Quote(BigInteger.ONE, 1_000_000, TestConfig.T0));

            assertThatThrownBy(() -> engine.usdValueOf(0, BigInteger.TEN))
                    .isInstanceOf(StaleQuoteException.class);
        }

        @Test
        @DisplayName("a zero price is rejected")
        void zeroPrice() {
            when(tokens.get(0)).thenReturn(ETH);
            when(oracle.latestQuote("ETH/USD")).thenReturn(new Quote(BigInteger.ZERO, 8, TestConfig.T0));

            assertThatThrownBy(() -> engine.usdValueOf(0, BigInteger.ONE))
                    .isInstanceOf(StaleQuoteException.class);
        }
    }
}
