package com.ospicorp.growthcurves.curves.service;

public class InsufficientDataException extends RuntimeException {
  private final int available;
  private final int required;

  public InsufficientDataException(int available, int required) {
    super("Insufficient data: " + available + " finite points, at least " + required + " required");
    this.available = available;
    this.required = required;
  }

  public int available() {
    return available;
  }

  public int required() {
    return required;
  }
}
