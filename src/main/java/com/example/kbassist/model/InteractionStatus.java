package com.example.kbassist.model;

import java.util.Locale;

public enum InteractionStatus {
  ANSWERED,
  UNKNOWN,
  ERROR;

  /** Lower-case form used in caller-facing results, e.g. {@code "answered"}. */
  public String apiValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
