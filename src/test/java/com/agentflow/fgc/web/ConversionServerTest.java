package com.agentflow.fgc.web;

import static org.junit.Assert.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import com.agentflow.fgc.FlowGraphConverter;
import com.agentflow.fgc.TestGraphs;
import com.agentflow.fgc.api.GenerationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ConversionServerTest {

    private ConversionServer server;
    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    @Before
    public void setUp() {
        ConversionApi api = new ConversionApi(new FlowGraphConverter(), null, GenerationContext.builder().build());
        server = new ConversionServer(api, null);
        server.start(0);
    }

    @After
    public void tearDown() {
        server.stop();
    }

    private HttpResponse<String> post(String path, byte[] body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testConvertOverHttp() throws Exception {
        HttpResponse<String> response = post("/api/convert?language=python&tracing=true",
                TestGraphs.fixture("llm-chain.json"));

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertTrue(body.get("success").asBoolean());
        assertEquals("main.py", body.get("files").get(0).get("path").asText());
        assertTrue(body.get("files").get(0).get("content").asText().contains("ConsoleCallbackHandler"));
    }

    @Test
    public void testBadFlowOverHttp() throws Exception {
        HttpResponse<String> response = post("/api/validate", "not json".getBytes());

        assertEquals(400, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("invalid_flow", body.get("error").asText());
        assertEquals("$", body.get("issues").get(0).get("path").asText());
    }

    @Test
    public void testConverters() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/api/converters"))
                .GET().build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals(10, mapper.readTree(response.body()).get("statistics").get("totalConverters").asInt());
    }

    @Test
    public void testDeleteJobRouteIsMounted() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/api/jobs/j1"))
                .DELETE().build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(503, response.statusCode());
        assertEquals("jobs_disabled", mapper.readTree(response.body()).get("error").asText());
    }
}
