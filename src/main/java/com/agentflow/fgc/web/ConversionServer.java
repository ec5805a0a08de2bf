package com.agentflow.fgc.web;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.agentflow.fgc.wiring.ConversionJob;
import com.agentflow.fgc.wiring.JobTracker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.websocket.WsContext;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * HTTP front end for conversions, plus a WebSocket pushing job status
 * updates.
 *
 * <pre>
 * POST /api/convert      synchronous conversion
 * POST /api/validate     validation only
 * POST /api/analyze      graph statistics
 * POST /api/jobs         queue a conversion (202 + job id)
 * GET  /api/jobs         all jobs
 * GET  /api/jobs/{id}    job status and result
 * GET  /api/converters   registry statistics
 * WS   /ws/jobs          job updates as JSON
 * </pre>
 *
 * Query parameters: {@code language}, {@code tracing}, {@code comments},
 * {@code project}, {@code name}.
 */
public class ConversionServer {
    private static final Logger log = LogManager.getLogger(ConversionServer.class);

    private final ConversionApi api;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Set<WsContext> sessions = ConcurrentHashMap.newKeySet();
    private Javalin app;

    public ConversionServer(ConversionApi api, JobTracker jobs) {
        this.api = api;
        if (jobs != null)
            jobs.addListener(this::onJobUpdate);
    }

    /**
     * Starts the server.
     *
     * @param port The port to listen on; 0 picks a free one.
     */
    public void start(int port) {
        log.info("Starting conversion server on port {}", port);
        app = Javalin.create();

        app.post("/api/convert", ctx -> respond(ctx, api.convert(ctx.bodyAsBytes(), query(ctx))));
        app.post("/api/validate", ctx -> respond(ctx, api.validate(ctx.bodyAsBytes(), query(ctx))));
        app.post("/api/analyze", ctx -> respond(ctx, api.analyze(ctx.bodyAsBytes(), query(ctx))));
        app.post("/api/jobs", ctx -> respond(ctx, api.submitJob(ctx.bodyAsBytes(), query(ctx))));
        app.get("/api/jobs", ctx -> respond(ctx, api.jobs()));
        app.get("/api/jobs/{id}", ctx -> respond(ctx, api.job(ctx.pathParam("id"))));
        app.delete("/api/jobs/{id}", ctx -> respond(ctx, api.deleteJob(ctx.pathParam("id"))));
        app.get("/api/converters", ctx -> respond(ctx, api.converters()));

        app.ws("/ws/jobs", ws -> {
            ws.onConnect(ctx -> {
                log.info("WebSocket Client Connected: {}", ctx.sessionId());
                sessions.add(ctx);
            });
            ws.onClose(ctx -> {
                log.info("WebSocket Client Disconnected: {}", ctx.sessionId());
                sessions.remove(ctx);
            });
            ws.onError(ctx -> {
                log.error("WebSocket Client Error: {}", ctx.sessionId(), ctx.error());
                sessions.remove(ctx);
            });
        });
        app.start(port);
    }

    /** Actual listening port, useful after {@code start(0)}. */
    public int port() {
        if (app == null)
            throw new IllegalStateException("Server not started");
        return app.port();
    }

    private void respond(Context ctx, ConversionApi.ApiResponse response) throws JsonProcessingException {
        ctx.status(response.status());
        ctx.contentType("application/json");
        ctx.result(mapper.writeValueAsString(response.body()));
    }

    private static Map<String, String> query(Context ctx) {
        Map<String, String> flat = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : ctx.queryParamMap().entrySet())
            if (!e.getValue().isEmpty())
                flat.put(e.getKey(), e.getValue().get(0));
        return flat;
    }

    private void onJobUpdate(ConversionJob job) {
        if (sessions.isEmpty())
            return;
        try {
            broadcast(mapper.writeValueAsString(ConversionApi.jobSummary(job)));
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize update for job {}", job.id(), e);
        }
    }

    /**
     * Broadcasts a JSON string payload to all currently connected WebSocket
     * clients.
     */
    public void broadcast(String jsonPayload) {
        for (WsContext ctx : sessions) {
            if (ctx.session.isOpen()) {
                ctx.send(jsonPayload);
            }
        }
    }

    public void stop() {
        if (app != null) {
            app.stop();
            sessions.clear();
        }
    }
}
