package com.portfoliosync.integration.venues.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.model.SymbolSplitter;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a validated {@link VenueConfig} from an integration's credential columns and its {@code
 * extra_params}. A {@code base_url} option overrides every endpoint of the venue.
 */
public class VenueConfigParser {
  private static final long DEFAULT_RECV_WINDOW_MS = 5_000L;
  private static final double DEFAULT_CRYPTO_RPS = 10.0d;

  public VenueConfig parse(
      Venue venue, IntegrationCredentials credentials, JsonNode extraParams, String walletAddress) {
    ExtraParams extra = new ExtraParams(venue, extraParams);
    IntegrationCredentials creds = credentials == null ? IntegrationCredentials.none() : credentials;
    return switch (venue) {
      case BINANCE -> binance(creds, extra);
      case BYBIT -> bybit(creds, extra);
      case OKX -> okx(creds, extra);
      case TBANK -> tbank(creds, extra);
      case BCS -> bcs(creds, extra);
      case FINAM -> finam(creds, extra);
      case TON -> ton(extra, walletAddress);
    };
  }

  private BinanceConfig binance(IntegrationCredentials creds, ExtraParams extra) {
    boolean testnet = extra.bool("testnet", false);
    URI override = extra.uri("base_url").orElse(null);
    URI spot = firstNonNull(override, testnet ? BinanceConfig.SPOT_TESTNET_URI : BinanceConfig.SPOT_URI);
    URI usdM = firstNonNull(override, testnet ? BinanceConfig.FUTURES_TESTNET_URI : BinanceConfig.USD_M_URI);
    URI coinM = firstNonNull(override, testnet ? BinanceConfig.FUTURES_TESTNET_URI : BinanceConfig.COIN_M_URI);
    return new BinanceConfig(
        spot,
        usdM,
        coinM,
        creds.apiKey(),
        creds.apiSecret(),
        extra.positiveLong("recv_window", DEFAULT_RECV_WINDOW_MS),
        timeout(extra),
        quoteAssets(extra),
        extra.upperList("spot_symbols", List.of()),
        extra.upperList("um_symbols", List.of()),
        extra.upperList("cm_symbols", List.of()),
        extra.rateLimit("requests_per_second", DEFAULT_CRYPTO_RPS));
  }

  private BybitConfig bybit(IntegrationCredentials creds, ExtraParams extra) {
    URI base =
        extra.uri("base_url")
            .orElse(extra.bool("testnet", false) ? BybitConfig.TESTNET_URI : BybitConfig.MAINNET_URI);
    Map<String, String> settleCoins = new LinkedHashMap<>(BybitConfig.DEFAULT_SETTLE_COINS);
    JsonNode configured = extra.node("settle_coins");
    if (configured.isObject()) {
      configured
          .fields()
          .forEachRemaining(
              entry -> settleCoins.put(entry.getKey(), entry.getValue().asText().toUpperCase(Locale.ROOT)));
    }
    return new BybitConfig(
        base,
        creds.apiKey(),
        creds.apiSecret(),
        extra.positiveLong("recv_window", DEFAULT_RECV_WINDOW_MS),
        timeout(extra),
        extra.string("account_type").orElse("UNIFIED").toUpperCase(Locale.ROOT),
        extra.list("categories").stream().map(item -> item.toLowerCase(Locale.ROOT)).toList(),
        settleCoins,
        quoteAssets(extra),
        extra.rateLimit("requests_per_second", DEFAULT_CRYPTO_RPS));
  }

  private OkxConfig okx(IntegrationCredentials creds, ExtraParams extra) {
    return new OkxConfig(
        extra.uri("base_url").orElse(OkxConfig.DEFAULT_URI),
        creds.apiKey(),
        creds.apiSecret(),
        creds.passphrase() != null ? creds.passphrase() : extra.string("passphrase").orElse(null),
        extra.bool("demo", false),
        timeout(extra),
        extra.upperList("inst_types", List.of()),
        extra.upperList("fill_inst_types", List.of()),
        quoteAssets(extra),
        extra.rateLimit("requests_per_second", DEFAULT_CRYPTO_RPS));
  }

  private TBankConfig tbank(IntegrationCredentials creds, ExtraParams extra) {
    URI base =
        extra.uri("base_url")
            .orElse(extra.bool("sandbox", false) ? TBankConfig.SANDBOX_URI : TBankConfig.DEFAULT_URI);
    String token = firstNonBlank(creds.token(), creds.accessToken(), creds.apiKey());
    return new TBankConfig(
        base,
        token,
        firstNonBlank(creds.accountId(), extra.string("account_id").orElse(null)),
        timeout(extra),
        Duration.ofDays(extra.positiveLong("lookback_days", TBankConfig.DEFAULT_LOOKBACK.toDays())),
        (int) extra.rateLimit("operations", 200),
        (int) extra.rateLimit("users", 100));
  }

  private BcsConfig bcs(IntegrationCredentials creds, ExtraParams extra) {
    return new BcsConfig(
        extra.uri("base_url").orElse(BcsConfig.DEFAULT_URI),
        firstNonBlank(creds.clientId(), extra.string("client_id").orElse(null)),
        creds.accessToken(),
        firstNonBlank(creds.refreshToken(), creds.token()),
        creds.tokenExpiresAt(),
        creds.refreshExpiresAt(),
        extra.seconds("token_margin_s", BcsConfig.DEFAULT_REFRESH_MARGIN),
        timeout(extra),
        (int) extra.rateLimit("requests_per_second", 10));
  }

  private FinamConfig finam(IntegrationCredentials creds, ExtraParams extra) {
    return new FinamConfig(
        extra.uri("base_url").orElse(FinamConfig.DEFAULT_URI),
        firstNonBlank(creds.token(), creds.apiSecret(), creds.apiKey()),
        firstNonBlank(creds.accountId(), extra.string("account_id").orElse(null)),
        timeout(extra),
        Duration.ofDays(extra.positiveLong("lookback_days", FinamConfig.DEFAULT_LOOKBACK.toDays())),
        (int) extra.rateLimit("auth", 60),
        (int) extra.rateLimit("accounts", 180),
        (int) extra.rateLimit("market", 300));
  }

  private TonConfig ton(ExtraParams extra, String walletAddress) {
    URI override = extra.uri("base_url").orElse(null);
    URI toncenter = extra.uri("toncenter_base_url").orElse(firstNonNull(override, TonConfig.TONCENTER_URI));
    URI tonapi =
        extra.bool("use_tonapi", true)
            ? extra.uri("tonapi_base_url").orElse(firstNonNull(override, TonConfig.TONAPI_URI))
            : null;
    return new TonConfig(
        firstNonBlank(walletAddress, extra.string("address").orElse(null)),
        toncenter,
        tonapi,
        extra.string("toncenter_api_key").orElse(null),
        extra.string("tonapi_api_key").orElse(null),
        extra.bool("include_jettons", true),
        extra.bool("include_staking", true),
        timeout(extra),
        extra.rateLimit("requests_per_second", 5));
  }

  private static Duration timeout(ExtraParams extra) {
    return extra.seconds("timeout_s", VenueConfig.DEFAULT_TIMEOUT);
  }

  private static List<String> quoteAssets(ExtraParams extra) {
    return extra.upperList("quote_assets", SymbolSplitter.DEFAULT_QUOTE_ASSETS);
  }

  private static URI firstNonNull(URI first, URI second) {
    return first != null ? first : second;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
