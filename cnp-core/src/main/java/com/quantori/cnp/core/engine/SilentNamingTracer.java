package com.quantori.cnp.core.engine;

enum SilentNamingTracer implements NamingTracer {
  INSTANCE;

  @Override
  public void debug(String message, Object... arguments) {
    // discarded
  }

  @Override
  public void info(String message, Object... arguments) {
    // discarded
  }

  @Override
  public void warn(String message, Object... arguments) {
    // discarded
  }
}
