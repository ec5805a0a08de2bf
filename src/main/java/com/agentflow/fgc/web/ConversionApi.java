package com.agentflow.fgc.web;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.agentflow.fgc.ConversionReport;
import com.agentflow.fgc.FlowGraphConverter;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.emit.EmittedFile;
import com.agentflow.fgc.engine.ConversionResult;
import com.agentflow.fgc.io.FlowParseException;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.wiring.ConversionDispatcher;
import com.agentflow.fgc.wiring.ConversionJob;

import lombok.extern.log4j.Log4j2;

/**
 * HTTP-independent request handling behind {@link ConversionServer}. Every
 * method returns a status code and a body ready for JSON serialization, so
 * the routes stay one-liners and the logic is testable without a socket.
 */
@Log4j2
public final class ConversionApi {
    static final String DEFAULT_FLOW_NAME = "api-flow";

    private final FlowGraphConverter converter;
    private final ConversionDispatcher dispatcher;
    private final GenerationContext defaults;

    /** Status code plus JSON-serializable body. */
    public record ApiResponse(int status, Object body) {
    }

    public ConversionApi(FlowGraphConverter converter, ConversionDispatcher dispatcher, GenerationContext defaults) {
        this.converter = converter;
        this.dispatcher = dispatcher;
        this.defaults = defaults;
    }

    public ApiResponse convert(byte[] body, Map<String, String> query) {
        return guarded(() -> {
            GenerationContext ctx = context(query);
            ConversionReport report = converter.convert(body, flowName(query), ctx);
            return new ApiResponse(report.conversion().aborted() ? 422 : 200, reportView(report));
        });
    }

    public ApiResponse validate(byte[] body, Map<String, String> query) {
        return guarded(() -> {
            IRGraph graph = converter.load(body, flowName(query));
            return new ApiResponse(200, converter.validate(graph));
        });
    }

    public ApiResponse analyze(byte[] body, Map<String, String> query) {
        return guarded(() -> new ApiResponse(200, converter.analyze(converter.load(body, flowName(query)))));
    }

    /** Queues the conversion; the structural check happens on the consumer thread. */
    public ApiResponse submitJob(byte[] body, Map<String, String> query) {
        if (dispatcher == null)
            return error(503, "jobs_disabled", "Asynchronous jobs are not enabled");
        return guarded(() -> {
            String jobId = dispatcher.submit(body, flowName(query), context(query));
            return new ApiResponse(202, jobView(dispatcher.jobs().get(jobId)));
        });
    }

    public ApiResponse job(String jobId) {
        if (dispatcher == null)
            return error(503, "jobs_disabled", "Asynchronous jobs are not enabled");
        ConversionJob job = dispatcher.jobs().get(jobId);
        if (job == null)
            return error(404, "not_found", "Unknown job: " + jobId);
        return new ApiResponse(200, jobView(job));
    }

    /** Removes a finished job; 409 while it is still queued or running. */
    public ApiResponse deleteJob(String jobId) {
        if (dispatcher == null)
            return error(503, "jobs_disabled", "Asynchronous jobs are not enabled");
        try {
            ConversionJob removed = dispatcher.jobs().remove(jobId);
            if (removed == null)
                return error(404, "not_found", "Unknown job: " + jobId);
            return new ApiResponse(200, jobSummary(removed));
        } catch (IllegalStateException e) {
            return error(409, "job_active", e.getMessage());
        }
    }

    public ApiResponse jobs() {
        if (dispatcher == null)
            return error(503, "jobs_disabled", "Asynchronous jobs are not enabled");
        List<Map<String, Object>> views = new ArrayList<>();
        for (ConversionJob job : dispatcher.jobs().list())
            views.add(jobSummary(job));
        return new ApiResponse(200, views);
    }

    public ApiResponse converters() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("statistics", converter.registry().statistics());
        body.put("byCategory", converter.registry().convertersByCategory());
        body.put("aliases", converter.registry().aliases());
        return new ApiResponse(200, body);
    }

    GenerationContext context(Map<String, String> query) {
        GenerationContext.GenerationContextBuilder b = defaults.toBuilder();
        String v;
        if ((v = query.get("language")) != null)
            b.language(TargetLanguage.fromId(v)).codeStyle(null);
        if ((v = query.get("tracing")) != null)
            b.includeTracing(Boolean.parseBoolean(v));
        if ((v = query.get("comments")) != null)
            b.includeComments(Boolean.parseBoolean(v));
        if ((v = query.get("project")) != null && !v.isBlank())
            b.projectName(v);
        return b.build();
    }

    private static String flowName(Map<String, String> query) {
        String name = query.get("name");
        return name == null || name.isBlank() ? DEFAULT_FLOW_NAME : name;
    }

    static Map<String, Object> reportView(ConversionReport report) {
        ConversionResult result = report.conversion();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("flow", report.graph().metadata().name());
        view.put("success", result.isSuccess());
        view.put("aborted", result.aborted());
        List<Map<String, String>> files = new ArrayList<>();
        if (report.hasOutput()) {
            for (EmittedFile f : report.output().files()) {
                Map<String, String> file = new LinkedHashMap<>();
                file.put("path", f.path());
                file.put("type", f.fileType());
                file.put("content", f.content());
                files.add(file);
            }
        }
        view.put("files", files);
        view.put("dependencies", report.hasOutput() ? report.output().dependencies() : result.dependencies());
        view.put("convertedNodes", result.convertedNodes());
        view.put("skippedNodes", result.skippedNodes());
        view.put("warnings", result.warnings());
        view.put("errors", result.errors());
        return view;
    }

    static Map<String, Object> jobSummary(ConversionJob job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("jobId", job.id());
        view.put("flow", job.flowName());
        view.put("status", job.status());
        view.put("submittedAt", job.submittedAt().toString());
        if (job.finishedAt() != null)
            view.put("finishedAt", job.finishedAt().toString());
        if (!job.errors().isEmpty())
            view.put("errors", job.errors());
        return view;
    }

    static Map<String, Object> jobView(ConversionJob job) {
        Map<String, Object> view = jobSummary(job);
        if (job.report() != null)
            view.put("result", reportView(job.report()));
        return view;
    }

    private ApiResponse guarded(RequestHandler handler) {
        try {
            return handler.handle();
        } catch (FlowParseException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "invalid_flow");
            body.put("message", e.getMessage());
            body.put("issues", e.issues());
            return new ApiResponse(400, body);
        } catch (IllegalArgumentException e) {
            return error(400, "bad_request", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Request failed: {}", e.getMessage(), e);
            return error(500, "internal_error", e.getMessage());
        }
    }

    private static ApiResponse error(int status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return new ApiResponse(status, body);
    }

    @FunctionalInterface
    private interface RequestHandler {
        ApiResponse handle();
    }
}
