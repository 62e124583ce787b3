package com.gentoro.dirsearch.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.dirsearch.DirSearch;
import com.gentoro.dirsearch.exception.DirSearchException;
import com.gentoro.dirsearch.exception.ExceptionUtil;
import com.gentoro.dirsearch.progress.McpProgressSink;
import com.gentoro.dirsearch.progress.NoOpProgressSink;
import com.gentoro.dirsearch.progress.ProgressSink;
import com.gentoro.dirsearch.search.SearchOutcome;
import com.gentoro.dirsearch.search.SearchRequest;
import com.gentoro.dirsearch.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Exposes the search pipeline as an MCP tool over the Streamable HTTP transport.
 *
 * <p>The tool takes {@code directory} and {@code keyword}, both required strings, and answers
 * with the text report. Failures are returned as tool results with {@code isError=true} and a
 * stage-tagged message; they never break the session.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> – servlet path; default "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> – reject HTTP DELETE; default false
 *   <li><b>http.mcp.server.name</b> / <b>http.mcp.server.version</b> – reported server info
 *   <li><b>http.mcp.tool.name</b> / <b>http.mcp.tool.description</b> – advertised tool
 *   <li><b>http.mcp.progress.enabled</b>, <b>.min-interval-ms</b>, <b>.min-delta</b> – progress
 *       notifications for callers that send a progress token
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(McpServer.class);

  static final String ARG_DIRECTORY = "directory";
  static final String ARG_KEYWORD = "keyword";
  static final String DEFAULT_TOOL_DESCRIPTION =
      "Search for keywords in text files within the specified directory";
  static final String INSTRUCTIONS =
      "This server searches for keywords in text files within the specified directory.";

  private final DirSearch app;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(DirSearch app) {
    this.app = app;
  }

  /** Register the MCP servlet on the shared Jetty context without managing its lifecycle. */
  public void register() {
    Configuration cfg = app.configuration();
    String endpoint = normalizeEndpoint(cfg.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = cfg.getBoolean("http.mcp.disallow-delete", false);

    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(new JacksonMcpJsonMapper(new ObjectMapper()))
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(
                cfg.getString("http.mcp.server.name", "dirsearch"),
                cfg.getString("http.mcp.server.version", "1.0.0"))
            .instructions(INSTRUCTIONS)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(toolSpecification())
            .build();

    app.httpServer().getContextHandler().addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{}", app.httpServer().getPort(), endpoint);
  }

  McpServerFeatures.SyncToolSpecification toolSpecification() {
    Configuration cfg = app.configuration();
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(cfg.getString("http.mcp.tool.name", "search"))
                .description(cfg.getString("http.mcp.tool.description", DEFAULT_TOOL_DESCRIPTION))
                .inputSchema(inputSchema())
                .build())
        .callHandler(this::handle)
        .build();
  }

  static McpSchema.JsonSchema inputSchema() {
    Map<String, Object> properties = new LinkedHashMap<>();
    properties.put(
        ARG_DIRECTORY,
        Map.of("type", "string", "description", "Path to the directory to search"));
    properties.put(
        ARG_KEYWORD, Map.of("type", "string", "description", "Keyword to search for"));
    return new McpSchema.JsonSchema(
        "object",
        properties,
        List.of(ARG_DIRECTORY, ARG_KEYWORD),
        false,
        Collections.emptyMap(),
        Collections.emptyMap());
  }

  /** Run one tool call; every failure is turned into an error result. */
  McpSchema.CallToolResult handle(
      McpSyncServerExchange exchange, McpSchema.CallToolRequest request) {
    Map<String, Object> arguments =
        Objects.requireNonNullElse(request.arguments(), Collections.emptyMap());
    Object directory = arguments.get(ARG_DIRECTORY);
    Object keyword = arguments.get(ARG_KEYWORD);
    if (directory == null) return missingArgument(ARG_DIRECTORY);
    if (keyword == null) return missingArgument(ARG_KEYWORD);

    try {
      SearchOutcome outcome =
          app.pipeline()
              .search(
                  new SearchRequest(directory.toString(), keyword.toString()),
                  progressSink(exchange, request));
      return new McpSchema.CallToolResult(outcome.report(), false);
    } catch (DirSearchException e) {
      log.warn(
          "Search tool call failed: {}", JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)));
      return new McpSchema.CallToolResult(e.getMessage(), true);
    } catch (Exception e) {
      log.error("Failed to handle MCP tool request", e);
      return new McpSchema.CallToolResult(ExceptionUtil.describe(e), true);
    }
  }

  private ProgressSink progressSink(
      McpSyncServerExchange exchange, McpSchema.CallToolRequest request) {
    Object progressToken =
        Objects.requireNonNullElse(request.meta(), Collections.<String, Object>emptyMap())
            .get("progressToken");
    Configuration cfg = app.configuration();
    if (exchange == null
        || progressToken == null
        || !cfg.getBoolean("http.mcp.progress.enabled", true)) {
      return NoOpProgressSink.INSTANCE;
    }
    return new McpProgressSink(
        log,
        cfg.getLong("http.mcp.progress.min-interval-ms", 300L),
        cfg.getLong("http.mcp.progress.min-delta", 1L),
        exchange,
        progressToken);
  }

  private static McpSchema.CallToolResult missingArgument(String name) {
    return new McpSchema.CallToolResult("Missing required argument '%s'".formatted(name), true);
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
    mcpServer = null;
  }

  static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    String trimmed = endpoint.trim();
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }
}
