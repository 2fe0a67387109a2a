package com.github.csp;

public interface DeepCloneable<SELF> {
  SELF deepClone();

  static <T extends DeepCloneable<T>> T clone(final T from) {
    return from != null ? from.deepClone() : null;
  }
}
