package com.example.prism.provider;

import com.example.prism.model.ExchangeRate;

/**
 * Optional capability of a price provider: USD/TRY conversion.
 */
public interface ExchangeRateCapable {

    ExchangeRate fetchExchangeRate(Deadline deadline) throws ProviderException;
}
