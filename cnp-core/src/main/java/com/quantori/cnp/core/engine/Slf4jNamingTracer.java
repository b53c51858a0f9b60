package com.quantori.cnp.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards tracing to an SLF4J logger.
 */
public class Slf4jNamingTracer implements NamingTracer {

  private final Logger logger;

  public Slf4jNamingTracer(Class<?> owner) {
    this(LoggerFactory.getLogger(owner));
  }

  public Slf4jNamingTracer(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void debug(String message, Object... arguments) {
    logger.debug(message, arguments);
  }

  @Override
  public void info(String message, Object... arguments) {
    logger.info(message, arguments);
  }

  @Override
  public void warn(String message, Object... arguments) {
    logger.warn(message, arguments);
  }
}
