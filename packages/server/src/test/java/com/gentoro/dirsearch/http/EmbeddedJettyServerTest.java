package com.gentoro.dirsearch.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.dirsearch.DirSearch;
import com.gentoro.dirsearch.actuator.ActuatorService;
import com.gentoro.dirsearch.search.SearchSettings;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmbeddedJettyServerTest {

  private EmbeddedJettyServer server;

  @BeforeEach
  void setUp() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("http.port", 0);
    configuration.setProperty("http.hostname", "127.0.0.1");
    DirSearch app = mock(DirSearch.class);
    when(app.configuration()).thenReturn(configuration);
    when(app.searchSettings()).thenReturn(SearchSettings.defaults());

    server = new EmbeddedJettyServer(app);
    when(app.httpServer()).thenReturn(server);
    server.prepare();
    new ActuatorService(app).register();
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  private String get(String path) throws Exception {
    HttpResponse<String> response =
        HttpClient.newHttpClient()
            .send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                    .GET()
                    .build(),
                HttpResponse.BodyHandlers.ofString());
    assertEquals(200, response.statusCode());
    return response.body();
  }

  @Test
  void servesActuatorEndpoints() throws Exception {
    assertTrue(server.isRunning());
    assertTrue(server.getPort() > 0);

    assertEquals("{\"status\":\"UP\"}", get("/actuator/health").trim());
    String info = get("/actuator/info");
    assertTrue(info.contains("\"name\":\"dirsearch\""), info);
    assertTrue(info.contains("\"topK\":10"), info);
  }

  @Test
  void stopIsIdempotent() {
    server.stop();
    server.stop();
    assertFalse(server.isRunning());
  }
}
