package com.example.prism.service;

import com.example.prism.model.AssetType;
import com.example.prism.model.CreateHoldingRequest;
import com.example.prism.model.Holding;
import com.example.prism.model.UpdateHoldingRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
@Import(HoldingService.class)
class HoldingServiceTest {

    @Autowired
    private HoldingService holdingService;

    @Test
    void createNormalizesSymbolAndDefaultsCostBasis() {
        Holding holding = holdingService.createHolding(CreateHoldingRequest.builder()
            .type("crypto")
            .symbol(" btcusdt ")
            .quantity(new BigDecimal("0.5"))
            .build());

        assertThat(holding.getId()).isNotNull();
        assertThat(holding.getSymbol()).isEqualTo("BTCUSDT");
        assertThat(holding.getType()).isEqualTo(AssetType.CRYPTO);
        assertThat(holding.getCostBasis()).isEqualByComparingTo("0");
        assertThat(holding.getCreatedAt()).isNotNull();
    }

    @Test
    void duplicateTypeAndSymbolIsRejected() {
        holdingService.createHolding(request("fund", "KUT", "100", "1200"));

        assertThatThrownBy(() -> holdingService.createHolding(request("fund", "kut", "5", "50")))
            .isInstanceOf(HoldingAlreadyExistsException.class);
    }

    @Test
    void sameSymbolAllowedAcrossTypes() {
        holdingService.createHolding(request("fund", "ABC", "1", "1"));
        holdingService.createHolding(request("crypto", "ABC", "1", "1"));

        assertThat(holdingService.getAllHoldings()).hasSize(2);
    }

    @Test
    void invalidRequestsAreRejected() {
        assertThatThrownBy(() -> holdingService.createHolding(request("stock", "AAPL", "1", "1")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Type must be 'fund' or 'crypto'");
        assertThatThrownBy(() -> holdingService.createHolding(request("fund", " ", "1", "1")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> holdingService.createHolding(request("fund", "KUT", "-1", "1")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> holdingService.createHolding(request("fund", "KUT", "1", "-1")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> holdingService.createHolding(CreateHoldingRequest.builder()
                .type("fund").symbol("KUT").build()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Quantity is required");
    }

    @Test
    void listsAreOrderedByTypeThenSymbol() {
        holdingService.createHolding(request("crypto", "ETHUSDT", "1", "1"));
        holdingService.createHolding(request("fund", "TI2", "1", "1"));
        holdingService.createHolding(request("crypto", "BTCUSDT", "1", "1"));
        holdingService.createHolding(request("fund", "KUT", "1", "1"));

        assertThat(holdingService.getAllHoldings())
            .extracting(Holding::getType, Holding::getSymbol)
            .containsExactly(
                tuple(AssetType.FUND, "KUT"),
                tuple(AssetType.FUND, "TI2"),
                tuple(AssetType.CRYPTO, "BTCUSDT"),
                tuple(AssetType.CRYPTO, "ETHUSDT"));
        assertThat(holdingService.getHoldingsByType(AssetType.CRYPTO))
            .extracting(Holding::getSymbol)
            .containsExactly("BTCUSDT", "ETHUSDT");
    }

    @Test
    void updateIsPartial() {
        Holding created = holdingService.createHolding(request("fund", "KUT", "100", "1200"));

        Holding updated = holdingService.updateHolding(created.getId(),
            UpdateHoldingRequest.builder().quantity(new BigDecimal("150")).build());

        assertThat(updated.getQuantity()).isEqualByComparingTo("150");
        assertThat(updated.getCostBasis()).isEqualByComparingTo("1200");
    }

    @Test
    void updateNeedsAtLeastOneField() {
        Holding created = holdingService.createHolding(request("fund", "KUT", "100", "1200"));

        assertThatThrownBy(() -> holdingService.updateHolding(created.getId(), new UpdateHoldingRequest()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("At least one field (quantity or cost_basis) must be provided");
    }

    @Test
    void missingHoldingIsNotFound() {
        UpdateHoldingRequest update = UpdateHoldingRequest.builder().costBasis(BigDecimal.ONE).build();

        assertThatThrownBy(() -> holdingService.getHolding(999L)).isInstanceOf(HoldingNotFoundException.class);
        assertThatThrownBy(() -> holdingService.updateHolding(999L, update)).isInstanceOf(HoldingNotFoundException.class);
        assertThatThrownBy(() -> holdingService.deleteHolding(999L)).isInstanceOf(HoldingNotFoundException.class);
    }

    @Test
    void deleteRemovesHolding() {
        Holding created = holdingService.createHolding(request("crypto", "SOLUSDT", "10", "1500"));

        holdingService.deleteHolding(created.getId());

        assertThat(holdingService.findHolding(AssetType.CRYPTO, "SOLUSDT")).isEmpty();
    }

    @Test
    void seedOnlyFillsAnEmptyTable() {
        List<CreateHoldingRequest> seed = List.of(
            request("fund", "KUT", "100", "1200"),
            request("fund", "kut", "1", "1"),
            request("bond", "XYZ", "1", "1"),
            request("crypto", "BTCUSDT", "0.5", "20000"));

        assertThat(holdingService.seedIfEmpty(seed)).isEqualTo(2);
        assertThat(holdingService.seedIfEmpty(seed)).isZero();
        assertThat(holdingService.getAllHoldings()).hasSize(2);
    }

    private static CreateHoldingRequest request(String type, String symbol, String quantity, String costBasis) {
        return CreateHoldingRequest.builder()
            .type(type)
            .symbol(symbol)
            .quantity(new BigDecimal(quantity))
            .costBasis(new BigDecimal(costBasis))
            .build();
    }
}
