package in.riskgov.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.riskgov.application.service.DecisionStream;
import in.riskgov.application.service.RiskEngine;
import in.riskgov.domain.acceptance.CycleDecision;
import in.riskgov.service.governance.AlphaSpendingLedger;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only HTTP views of engine state:
 * - GET /health - liveness
 * - GET /api/governance/ledger - alpha budget and ledger entries
 * - GET /api/governance/policies - policy records and the lifecycle audit trail
 * - GET /api/streams - last decision per stream
 */
public final class GovernanceStatusHandler {
    private static final Logger log = LoggerFactory.getLogger(GovernanceStatusHandler.class);

    private final RiskEngine engine;
    private final ObjectMapper mapper;

    public GovernanceStatusHandler(RiskEngine engine, ObjectMapper mapper) {
        this.engine = engine;
        this.mapper = mapper;
    }

    public void health(HttpServerExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("streams", engine.streams().size());
        sendJson(exchange, body);
    }

    public void ledger(HttpServerExchange exchange) {
        AlphaSpendingLedger ledger = engine.ledger();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalBudget", ledger.totalBudget());
        body.put("cumulativeAlpha", ledger.cumulativeAlpha());
        body.put("remaining", ledger.remaining());
        body.put("entries", ledger.entries());
        sendJson(exchange, body);
    }

    public void policies(HttpServerExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policies", engine.lifecycle().records());
        body.put("auditTrail", engine.lifecycle().auditTrail());
        sendJson(exchange, body);
    }

    public void streams(HttpServerExchange exchange) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (DecisionStream stream : engine.streams()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("streamId", stream.streamId());
            CycleDecision last = stream.lastDecision();
            if (last != null) {
                row.put("timestamp", last.timestamp());
                row.put("posture", last.posture());
                row.put("riskScale", last.riskScale());
                row.put("blockReason", last.blockReason());
                row.put("kappa", last.kappa());
                row.put("kappaPlus", last.kappaPlus());
                row.put("alphaCurrent", last.alphaCurrent());
                row.put("coverageEma", last.coverageEma());
            }
            rows.add(row);
        }
        sendJson(exchange, Map.of("streams", rows));
    }

    private void sendJson(HttpServerExchange exchange, Object data) {
        try {
            String json = mapper.writeValueAsString(data);
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            log.error("[GovernanceStatusHandler] Serialization failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Serialization failed: " + e.getMessage(), StandardCharsets.UTF_8);
        }
    }
}
