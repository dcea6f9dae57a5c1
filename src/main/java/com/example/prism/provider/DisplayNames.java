package com.example.prism.provider;

import java.util.Map;

/**
 * Display names for known fund codes and crypto symbols, used whenever a
 * source does not supply one.
 */
public final class DisplayNames {

  private static final Map<String, String> FUNDS = Map.of(
      "KUT", "Kuveyt Türk Portföy Kısa Vadeli Kira Sertifikaları Katılım Fonu",
      "TI2", "TEB Portföy İkinci Değişken Fon",
      "AFT", "Ak Portföy Amerikan Doları Fon Sepeti Fonu",
      "YZG", "Yapı Kredi Portföy Gümüş Fonu",
      "KTV", "Kuveyt Türk Portföy Altın Katılım Fonu",
      "HKH", "Halk Portföy Kısa Vadeli Borçlanma Araçları Fonu",
      "IOG", "İş Portföy Orta Vadeli Borçlanma Araçları Fonu",
      "KGM", "Kuveyt Türk Portföy Gümüş Katılım Fonu"
  );

  private static final Map<String, String> CRYPTOS = Map.of(
      "BTCUSDT", "Bitcoin",
      "ETHUSDT", "Ethereum",
      "SOLUSDT", "Solana",
      "BNBUSDT", "BNB",
      "XRPUSDT", "XRP",
      "ADAUSDT", "Cardano",
      "DOGEUSDT", "Dogecoin",
      "DOTUSDT", "Polkadot",
      "MATICUSDT", "Polygon",
      "AVAXUSDT", "Avalanche"
  );

  private DisplayNames() {
  }

  public static String fund(String code) {
    return FUNDS.getOrDefault(code, code + " Fund");
  }

  public static String crypto(String symbol) {
    return CRYPTOS.getOrDefault(symbol, symbol);
  }
}
