package io.doublezero.globalmonitor.domain.probe;

/**
 * Measurement path a probe travels over.
 */
public enum ProbePath {
  PUBLIC_INTERNET("public_internet"),
  DOUBLEZERO("doublezero");

  private final String label;

  ProbePath(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
