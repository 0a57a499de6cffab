package com.gentoro.aasplan.exception;

/** Invalid application configuration or planning configuration. */
public class ConfigException extends AasPlanException {
  public ConfigException(String message) {
    super(AasPlanErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(AasPlanErrorCode.CONFIG_ERROR, message, cause);
  }
}
