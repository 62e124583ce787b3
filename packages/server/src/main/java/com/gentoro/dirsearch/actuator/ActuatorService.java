package com.gentoro.dirsearch.actuator;

import com.gentoro.dirsearch.DirSearch;
import com.gentoro.dirsearch.search.SearchSettings;
import com.gentoro.dirsearch.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Actuator-style endpoints on the shared Jetty context.
 *
 * <ul>
 *   <li>{@code GET /actuator/health} returns {@code {"status":"UP"}}
 *   <li>{@code GET /actuator/info} returns server name, version, tool name and search settings
 * </ul>
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(ActuatorService.class);

  private final DirSearch app;

  public ActuatorService(DirSearch app) {
    this.app = app;
  }

  public void register() {
    var context = app.httpServer().getContextHandler();
    context.addServlet(
        new ServletHolder(new JsonServlet(() -> Map.of("status", "UP"))), "/actuator/health");
    context.addServlet(new ServletHolder(new JsonServlet(this::info)), "/actuator/info");
    log.info("Actuator endpoints registered at /actuator/health and /actuator/info");
  }

  Map<String, Object> info() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("name", app.configuration().getString("http.mcp.server.name", "dirsearch"));
    info.put("version", app.configuration().getString("http.mcp.server.version", "1.0.0"));
    info.put("tool", app.configuration().getString("http.mcp.tool.name", "search"));
    SearchSettings settings = app.searchSettings();
    if (settings != null) {
      info.put("topK", settings.topK());
      info.put("sampleBytes", settings.sampleBytes());
      info.put("ramBufferMb", settings.ramBufferMb());
      info.put("defaultOperator", settings.defaultOperator().name());
      info.put("timeout", settings.timeout().toString());
    }
    return info;
  }

  private static class JsonServlet extends HttpServlet {
    private final transient Supplier<Map<String, Object>> body;

    JsonServlet(Supplier<Map<String, Object>> body) {
      this.body = body;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(body.get()));
      }
    }
  }
}
