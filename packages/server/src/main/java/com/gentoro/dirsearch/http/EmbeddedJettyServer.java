package com.gentoro.dirsearch.http;

import com.gentoro.dirsearch.DirSearch;
import com.gentoro.dirsearch.exception.ConfigException;
import com.gentoro.dirsearch.exception.ExceptionUtil;
import com.gentoro.dirsearch.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (prepare/start/stop/join) and exposes the context handler so the
 * health and MCP endpoints can register their servlets before start. Binds to {@code
 * http.hostname}:{@code http.port} (default 0.0.0.0:8080).
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private static final String ANY_HOST = "0.0.0.0";

  private final DirSearch app;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(DirSearch app) {
    this.app = app;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      String hostname;
      try {
        port = app.configuration().getInt("http.port", 8080);
        hostname = app.configuration().getString("http.hostname", ANY_HOST);
      } catch (Exception e) {
        throw ExceptionUtil.propagate(
            e, ex -> new ConfigException("Failed to resolve http.port / http.hostname", ex));
      }
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();
      log.trace("Resolved http endpoint {}:{}", hostname, port);

      try {
        if (ANY_HOST.equals(hostname)) {
          server = new Server(port);
        } else {
          server = new Server();
          ServerConnector connector = new ServerConnector(server);
          connector.setHost(hostname);
          connector.setPort(port);
          server.addConnector(connector);
        }

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        server = null;
        throw new NetworkException(
            "Failed to initialize Jetty on %s:%d; check that the address is available"
                .formatted(hostname, port),
            e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.propagate(
            e,
            ex ->
                new NetworkException(
                    "Failed to start Jetty; check that port %d is free"
                        .formatted(app.configuration().getInt("http.port", 8080)),
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        // keep shutting down the remaining services
        log.error("Error stopping Jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return app.configuration().getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
