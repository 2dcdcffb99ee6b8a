package com.portfoliosync.worker.sync;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

/** Canned JSON per request path; adapters call their endpoints concurrently. */
class VenueStubDispatcher extends Dispatcher {
  private final Map<String, String> bodies = new ConcurrentHashMap<>();

  VenueStubDispatcher json(String path, String body) {
    bodies.put(path, body);
    return this;
  }

  VenueStubDispatcher binance() {
    return json("/api/v3/account", "{\"balances\":[{\"asset\":\"BTC\",\"free\":\"0.5\",\"locked\":\"0\"}]}")
        .json("/fapi/v2/account", "{\"positions\":[]}")
        .json("/dapi/v1/account", "{\"positions\":[]}")
        .json("/fapi/v1/exchangeInfo", "{\"symbols\":[]}")
        .json("/dapi/v1/exchangeInfo", "{\"symbols\":[]}")
        .json(
            "/api/v3/myTrades",
            """
            [{"id":11,"symbol":"BTCUSDT","isBuyer":true,"qty":"0.01","price":"60000",
              "commission":"0","commissionAsset":"BTC","time":1772360000000}]
            """)
        .json(
            "/sapi/v1/capital/deposit/hisrec",
            "[{\"txId\":\"0xabc\",\"coin\":\"USDT\",\"amount\":\"500\",\"insertTime\":1772300000000}]")
        .json("/sapi/v1/capital/withdraw/history", "[]")
        .json("/sapi/v1/convert/tradeFlow", "{\"list\":[]}");
  }

  VenueStubDispatcher toncenter() {
    return json("/getAddressBalance", "{\"ok\":true,\"result\":\"2000000000\"}")
        .json("/getTransactions", "{\"ok\":true,\"result\":[]}");
  }

  @Override
  public MockResponse dispatch(RecordedRequest request) {
    String body = bodies.get(request.getRequestUrl().encodedPath());
    if (body == null) {
      return new MockResponse().setResponseCode(404).setBody("{\"error\":\"not found\"}");
    }
    return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
  }
}
