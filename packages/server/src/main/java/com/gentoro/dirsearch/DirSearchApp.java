package com.gentoro.dirsearch;

public class DirSearchApp {

  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(DirSearchApp.class);

  public static void main(String[] args) {
    int status;
    try {
      status = new DirSearch(args).run(System.out, System.err);
    } catch (Exception e) {
      log.error("Application failed to start", e);
      status = 1;
    }
    if (status != 0) {
      System.exit(status);
    }
  }
}
