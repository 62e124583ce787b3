package com.gentoro.dirsearch;

import com.gentoro.dirsearch.actuator.ActuatorService;
import com.gentoro.dirsearch.exception.DirSearchException;
import com.gentoro.dirsearch.exception.ExecutionException;
import com.gentoro.dirsearch.exception.StateException;
import com.gentoro.dirsearch.http.EmbeddedJettyServer;
import com.gentoro.dirsearch.mcp.McpServer;
import com.gentoro.dirsearch.progress.LoggingProgressSink;
import com.gentoro.dirsearch.search.SearchOutcome;
import com.gentoro.dirsearch.search.SearchPipeline;
import com.gentoro.dirsearch.search.SearchRequest;
import com.gentoro.dirsearch.search.SearchSettings;
import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application root: owns configuration, the search pipeline and, in server mode, the HTTP server
 * with the MCP endpoint.
 */
public class DirSearch {

  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(DirSearch.class);

  private static final String USAGE =
      """
      Usage: dirsearch [--mode server|search|help] [--config-file <location>]
                       [--directory <dir> --keyword <expression>]

        server  start the MCP server (default)
        search  index <dir> once, run <expression> and print the report
        help    print this message
      """;

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private SearchSettings searchSettings;
  private SearchPipeline pipeline;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public DirSearch(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  /** Load configuration, apply logging levels and create the search pipeline. */
  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.dirsearch.logging.LoggingService.applyConfiguration(configuration());
    this.searchSettings = SearchSettings.fromConfiguration(configuration());
    this.pipeline = new SearchPipeline(searchSettings);
    log.info(
        "Search pipeline ready (topK={}, sampleBytes={}, ramBufferMb={}, operator={}, timeout={})",
        searchSettings.topK(),
        searchSettings.sampleBytes(),
        searchSettings.ramBufferMb(),
        searchSettings.defaultOperator(),
        searchSettings.timeout());
  }

  /**
   * Run the selected mode and return the process exit status. Server mode blocks until a shutdown
   * signal is received.
   */
  public int run(PrintStream out, PrintStream err) {
    String mode = startupParameters.mode();
    if ("help".equals(mode)) {
      out.print(USAGE);
      return 0;
    }

    initialize();
    return switch (mode) {
      case "search" -> runSearch(out, err);
      case "server" -> {
        startServer();
        waitShutdownSignal();
        yield 0;
      }
      default -> throw new IllegalArgumentException("Invalid mode: " + mode);
    };
  }

  int runSearch(PrintStream out, PrintStream err) {
    String directory =
        startupParameters.getOptionalParameter("directory", String.class).orElse(null);
    String keyword = startupParameters.getOptionalParameter("keyword", String.class).orElse(null);
    try {
      SearchOutcome outcome =
          pipeline()
              .search(
                  new SearchRequest(directory, keyword),
                  new LoggingProgressSink(
                      log,
                      configuration().getLong("search.progress.min-interval-ms", 1000L),
                      configuration().getLong("search.progress.min-delta", 100L)));
      out.println(outcome.report());
      return 0;
    } catch (DirSearchException e) {
      err.println(e.getMessage());
      return 1;
    }
  }

  /** Start Jetty with the health and MCP endpoints. Non-blocking. */
  public void startServer() {
    this.httpServer = new EmbeddedJettyServer(this);
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "dirsearch-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {} during shutdown", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("DirSearch not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public SearchSettings searchSettings() {
    return searchSettings;
  }

  public SearchPipeline pipeline() {
    if (pipeline == null) {
      throw new StateException("DirSearch not initialized. Call initialize() first.");
    }
    return pipeline;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
