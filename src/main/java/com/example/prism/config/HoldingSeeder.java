package com.example.prism.config;

import com.example.prism.model.CreateHoldingRequest;
import com.example.prism.service.HoldingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads {@code prism.seed.holdings} into an empty holdings table on startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldingSeeder implements ApplicationRunner {

    private final HoldingService holdingService;
    private final PrismProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        List<CreateHoldingRequest> requests = properties.getSeed().getHoldings().stream()
            .map(seed -> CreateHoldingRequest.builder()
                .type(seed.getType())
                .symbol(seed.getSymbol())
                .quantity(seed.getQuantity())
                .costBasis(seed.getCostBasis())
                .build())
            .toList();

        if (requests.isEmpty()) {
            return;
        }
        int seeded = holdingService.seedIfEmpty(requests);
        if (seeded > 0) {
            log.info("Seeded {} holdings from configuration", seeded);
        }
    }
}
