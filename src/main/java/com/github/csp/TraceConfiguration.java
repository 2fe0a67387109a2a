package com.github.csp;

/**
 * This class encapsulates all the configuration parameters for a {@link TraceEngine}. Use the
 * {@code TraceConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. maxDepth bounds the number of events, τ included, performed along any one branch of an
 * enumeration. A branch that reaches it is recorded as if it were maximal. 0 means unbounded, which
 * is safe for every process this library can build since none of them recurse.<br>
 * 
 * 2. hideTau is on by default; switching it off records τ events in the traces, which is mostly
 * useful when debugging the semantics of an operator.<br>
 */
public final class TraceConfiguration {
  private final int maxDepth;
  private final boolean hideTau;

  public static TraceConfiguration defaults() {
    return TraceConfigurationBuilder.newBuilder().build();
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public boolean isBounded() {
    return maxDepth > 0;
  }

  public boolean getHideTau() {
    return hideTau;
  }

  public final static class TraceConfigurationBuilder {
    private int maxDepth;
    private boolean hideTau = true;

    public static TraceConfigurationBuilder newBuilder() {
      return new TraceConfigurationBuilder();
    }

    public TraceConfigurationBuilder maxDepth(final int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    public TraceConfigurationBuilder hideTau(final boolean hideTau) {
      this.hideTau = hideTau;
      return this;
    }

    public TraceConfiguration build() {
      final TraceConfiguration config = new TraceConfiguration(maxDepth, hideTau);
      config.validate();
      return config;
    }

    private TraceConfigurationBuilder() {}
  }

  private void validate() {
    final StringBuilder messages = new StringBuilder();
    if (maxDepth < 0) {
      messages.append("maxDepth cannot be negative: ").append(maxDepth).append(". ");
    }
    if (messages.length() > 0) {
      throw new ProcessException(ProcessException.Code.INVALID_CONFIGURATION,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "TraceConfiguration [maxDepth=" + maxDepth + ", hideTau=" + hideTau + "]";
  }

  private TraceConfiguration(final int maxDepth, final boolean hideTau) {
    this.maxDepth = maxDepth;
    this.hideTau = hideTau;
  }

}
