package com.gentoro.aasplan;

import com.gentoro.aasplan.exception.ExceptionUtil;

public class AasPlanApp {

  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(AasPlanApp.class);

  public static void main(String[] args) {
    try {
      AasPlan app = new AasPlan(args);
      app.initialize();
      app.run();
    } catch (Exception e) {
      log.error("Compilation failed {}", ExceptionUtil.describe(e));
      log.debug("Failure stack trace", e);
      System.exit(1);
    }
  }
}
