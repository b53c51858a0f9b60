package com.quantori.cnp.core.engine;

/**
 * Leveled sink for diagnostic messages of a naming run. Messages use SLF4J style {} placeholders.
 */
public interface NamingTracer {

  void debug(String message, Object... arguments);

  void info(String message, Object... arguments);

  void warn(String message, Object... arguments);

  static NamingTracer silent() {
    return SilentNamingTracer.INSTANCE;
  }

  static NamingTracer slf4j(Class<?> owner) {
    return new Slf4jNamingTracer(owner);
  }
}
