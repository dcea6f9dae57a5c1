package com.example.prism;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full context with every provider disabled and two seeded holdings.
 */
@SpringBootTest(properties = {
    "prism.seed.holdings[0].type=fund",
    "prism.seed.holdings[0].symbol=KUT",
    "prism.seed.holdings[0].quantity=100",
    "prism.seed.holdings[0].cost-basis=1200",
    "prism.seed.holdings[1].type=crypto",
    "prism.seed.holdings[1].symbol=BTCUSDT",
    "prism.seed.holdings[1].quantity=0.5",
    "prism.seed.holdings[1].cost-basis=20000"
})
@AutoConfigureMockMvc
class PrismApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void seededHoldingsAreValuedAsStalePlaceholders() throws Exception {
        mockMvc.perform(get("/api/funds"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.funds", hasSize(1)))
            .andExpect(jsonPath("$.funds[0].symbol").value("KUT"))
            .andExpect(jsonPath("$.funds[0].name").value("Kuveyt Türk Portföy Kısa Vadeli Kira Sertifikaları Katılım Fonu"))
            .andExpect(jsonPath("$.funds[0].price").value(0))
            .andExpect(jsonPath("$.funds[0].stale").value(true));

        mockMvc.perform(get("/api/crypto"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cryptos[0].symbol").value("BTCUSDT"))
            .andExpect(jsonPath("$.cryptos[0].name").value("Bitcoin"));
    }

    @Test
    void summaryCountsCostBasisOfUnpricedHoldings() throws Exception {
        mockMvc.perform(get("/api/portfolio/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_value").value(0))
            .andExpect(jsonPath("$.total_cost_basis").value(21200.0));
    }

    @Test
    void healthIsDegradedWithoutProviders() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isPartialContent())
            .andExpect(jsonPath("$.status").value("degraded"))
            .andExpect(jsonPath("$.providers.fund").value("unhealthy"))
            .andExpect(jsonPath("$.providers.crypto").value("unhealthy"));
    }

    @Test
    void singleLookupWithoutProviderIsNotFound() throws Exception {
        mockMvc.perform(get("/api/funds/kut"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("KUT"));
    }

    @Test
    void exchangeRateWithoutProviderIsUnavailable() throws Exception {
        mockMvc.perform(get("/api/exchange-rate"))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    void duplicateSeededHoldingIsRejected() throws Exception {
        mockMvc.perform(post("/api/holdings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"fund\",\"symbol\":\"kut\",\"quantity\":1}"))
            .andExpect(status().isConflict());
    }

    @Test
    void versionComesFromConfiguration() throws Exception {
        mockMvc.perform(get("/api/version"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value("test"));
    }
}
