package com.polybot.copytrader.polymarket;

/**
 * A Polymarket HTTP call failed after all retries, or returned something that could not be read.
 */
public class PolymarketApiException extends RuntimeException {

  private final int statusCode;

  public PolymarketApiException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public PolymarketApiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /**
   * Last HTTP status seen, or -1 when no response was received.
   */
  public int statusCode() {
    return statusCode;
  }
}
