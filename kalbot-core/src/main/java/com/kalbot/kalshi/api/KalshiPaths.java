package com.kalbot.kalshi.api;

public final class KalshiPaths {

  public static final String EXCHANGE_STATUS = "/exchange/status";
  public static final String EXCHANGE_SCHEDULE = "/exchange/schedule";
  public static final String PORTFOLIO_BALANCE = "/portfolio/balance";
  public static final String PORTFOLIO_ORDERS = "/portfolio/orders";
  public static final String MARKETS = "/markets";

  private KalshiPaths() {
  }
}
