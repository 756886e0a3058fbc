package com.demo.lending.controller;

import com.demo.lending.domain.LoanStatus;
import com.demo.lending.support.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
@DisplayName("HTTP API")
class LoanControllerTest extends BaseIntegrationTest {

    private static final String ADMIN = "Bearer test-admin-token";

    @Autowired
    private MockMvc mvc;

    private static String loanRequestJson() {
        return "{\"borrower\":\"" + BORROWER + "\",\"loanTokenId\":1,\"collateralTokenId\":0,"
                + "\"principal\":\"1000\",\"collateralAmount\":\"10\",\"interestRateBps\":1000,"
                + "\"durationSecs\":2592000,\"fundingPeriodSecs\":604800,\"riskScore\":420}";
    }

    @Nested
    @DisplayName("loans")
    class Loans {

        @Test
        @DisplayName("a loan request returns 201 with the stored record")
        void requestLoan() throws Exception {
            fund(BORROWER, ETH, units(10));

            mvc.perform(post("/api/loans").contentType(MediaType.APPLICATION_JSON).content(loanRequestJson()))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value(1))
                    .andExpect(jsonPath("$.status").value("REQUESTED"))
                    .andExpect(jsonPath("$.principal").value("1000"))
                    .andExpect(jsonPath("$.remaining").value("1000"));
        }

        @Test
        @DisplayName("contributions move the loan to ACTIVE and show up in the events")
        void contributeAndRead() throws Exception {
            long id = requestUsdcLoan(1000, 10).id();
            fund(ALICE, USDC, units(1000));

            mvc.perform(post("/api/loans/{id}/contributions", id).contentType(MediaType.APPLICATION_JSON)
                            .content("{\"lender\":\"" + ALICE + "\",\"amount\":\"1000\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("ACTIVE"));

            mvc.perform(get("/api/loans/active"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0]").value(id));
            mvc.perform(get("/api/loans/{id}/repayment-quote", id))
                    .andExpect(jsonPath("$.total").value("1100"));
            mvc.perform(get("/api/loans/{id}/events", id))
                    .andExpect(jsonPath("$.length()").value(3));
        }

        @Test
        @DisplayName("ledger rejections map to HTTP statuses with the reason code")
        void rejectionsMapToStatus() throws Exception {
            long id = requestUsdcLoan(1000, 10).id();
            fund(ALICE, USDC, units(2000));

            mvc.perform(get("/api/loans/99"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.reason").value("LOAN_NOT_FOUND"));
            mvc.perform(post("/api/loans/{id}/contributions", id).contentType(MediaType.APPLICATION_JSON)
                            .content("{\"lender\":\"" + ALICE + "\",\"amount\":\"1001\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.reason").value("EXCEEDS_REMAINING"));
            mvc.perform(post("/api/loans/{id}/contributions", id).contentType(MediaType.APPLICATION_JSON)
                            .content("{\"lender\":\"" + BORROWER + "\",\"amount\":\"1\"}"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.reason").value("BORROWER_CANNOT_LEND"));
            mvc.perform(post("/api/loans/{id}/refund", id).contentType(MediaType.APPLICATION_JSON)
                            .content("{\"lender\":\"" + ALICE + "\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.reason").value("WRONG_STATUS"));
        }

        @Test
        @DisplayName("malformed bodies are rejected with 400")
        void badInput() throws Exception {
            mvc.perform(post("/api/loans/1/contributions").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":\"5\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.reason").value("INVALID_REQUEST"));
            mvc.perform(get("/api/loans/not-a-number"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("settling as the monitor's signing account requires the admin token")
        void liquidatorIdentityGuarded() throws Exception {
            long id = requestUsdcLoan(1000, 10).id();
            contribute(id, ALICE, 1000);
            clock.advance(Duration.ofDays(31));

            mvc.perform(post("/api/loans/{id}/liquidate", id).contentType(MediaType.APPLICATION_JSON)
                            .content("{\"caller\":\" LIQUIDATOR \"}"))
                    .andExpect(status().isUnauthorized());

            assertThat(settlement.nextSequence(LIQUIDATOR)).isZero();
            assertThat(queries.getLoan(id).status()).isEqualTo(LoanStatus.ACTIVE);

            mvc.perform(post("/api/loans/{id}/liquidate", id).header("Authorization", ADMIN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"caller\":\"" + LIQUIDATOR + "\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.outcome").value("VOTING"))
                    .andExpect(jsonPath("$.sequence").value(0));

            mvc.perform(get("/api/loans/sequences/{account}", LIQUIDATOR))
                    .andExpect(jsonPath("$.nextSequence").value(1));
        }

        @Test
        @DisplayName("any other account settles with its own next sequence and no token")
        void otherCallerUsesOwnSequence() throws Exception {
            long id = requestUsdcLoan(1000, 10).id();
            contribute(id, ALICE, 1000);
            clock.advance(Duration.ofDays(31));

            mvc.perform(post("/api/loans/{id}/liquidate", id).contentType(MediaType.APPLICATION_JSON)
                            .content("{\"caller\":\"" + BOB + "\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.outcome").value("VOTING"))
                    .andExpect(jsonPath("$.sequence").value(0));

            assertThat(settlement.nextSequence(LIQUIDATOR)).isZero();
        }
    }

    @Nested
    @DisplayName("operator endpoints")
    class Operator {

        @Test
        @DisplayName("token registration requires the admin token")
        void tokenRegistrationGuarded() throws Exception {
            String body = "{\"id\":5,\"kind\":\"FUNGIBLE\",\"assetRef\":\"0xdai\",\"symbol\":\"DAI\",\"decimals\":18}";

            mvc.perform(post("/api/tokens").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isUnauthorized());
            mvc.perform(post("/api/tokens").header("Authorization", "Bearer wrong")
                            .contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isUnauthorized());
            mvc.perform(post("/api/tokens").header("Authorization", ADMIN)
                            .contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.symbol").value("DAI"));

            assertThat(tokens.get(5).active()).isTrue();
            mvc.perform(get("/api/tokens/5")).andExpect(status().isOk());
        }

        @Test
        @DisplayName("a quote published through the oracle endpoint values tokens")
        void publishQuote() throws Exception {
            mvc.perform(post("/api/oracle/quotes").header("Authorization", ADMIN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"feed\":\"ETH/USD\",\"price\":\"200000000000\",\"decimals\":8}"))
                    .andExpect(status().isOk());

            mvc.perform(get("/api/oracle/value").param("tokenId", "0").param("amount", "500000000000000000"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.value").value("100000000000"));
            mvc.perform(get("/api/oracle/value").param("tokenId", "1").param("amount", "1"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.reason").value("STALE_QUOTE"));

            mvc.perform(post("/api/oracle/quotes").header("Authorization", ADMIN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"feed\":\"ETH/USD\",\"price\":\"200000000000\",\"decimals\":-1}"))
                    .andExpect(status().isBadRequest());

            mvc.perform(delete("/api/oracle/quotes").header("Authorization", ADMIN).param("feed", "ETH/USD"))
                    .andExpect(status().isOk());
            mvc.perform(get("/api/oracle/quotes").param("feed", "ETH/USD"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("the monitor can be inspected without a token but not started")
        void monitorControls() throws Exception {
            mvc.perform(get("/api/liquidation/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.active").value(false));
            mvc.perform(post("/api/liquidation/start"))
                    .andExpect(status().isUnauthorized());
        }
    }
}
