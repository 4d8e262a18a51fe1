package com.docweaver.core.health;

import com.docweaver.core.executor.ConcurrencyBudget;
import com.docweaver.core.gateway.AgentGateway;
import com.docweaver.core.gateway.AgentRole;
import com.docweaver.core.state.TaskStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStateStore store;
    private final AgentGateway gateway;
    private final ConcurrencyBudget globalBudget;

    public HealthCheckService(
            @Autowired(required = false) TaskStateStore store,
            @Autowired(required = false) AgentGateway gateway,
            @Autowired(required = false) ConcurrencyBudget globalBudget) {
        this.store = store;
        this.gateway = gateway;
        this.globalBudget = globalBudget;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkAgents());
        results.add(checkBudget());
        return results;
    }

    /** UP only when every component is UP; DOWN if any is DOWN. */
    public HealthStatus.Status overall(List<HealthStatus> checks) {
        boolean degraded = false;
        for (var check : checks) {
            if (check.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            degraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        return degraded ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
    }

    private HealthStatus checkStore() {
        if (store == null) {
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "No task store configured", Map.of());
        }
        try {
            int tasks = store.list().size();
            return new HealthStatus("store", HealthStatus.Status.UP,
                    store.getClass().getSimpleName() + " available",
                    Map.of("tasks", String.valueOf(tasks)));
        } catch (Exception e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkAgents() {
        if (gateway == null) {
            return new HealthStatus("agents", HealthStatus.Status.DOWN,
                    "No agent gateway configured", Map.of());
        }
        var bindings = new TreeMap<String, String>();
        int bound = 0;
        for (var role : AgentRole.values()) {
            boolean isBound = gateway.boundRoles().contains(role);
            bindings.put(role.wireName(), isBound ? "bound" : "unbound");
            if (isBound) {
                bound++;
            }
        }
        if (bound == AgentRole.values().length) {
            return new HealthStatus("agents", HealthStatus.Status.UP, "All agent roles bound", bindings);
        }
        if (bound == 0) {
            return new HealthStatus("agents", HealthStatus.Status.DOWN, "No agent roles bound", bindings);
        }
        return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                (AgentRole.values().length - bound) + " agent role(s) unbound", bindings);
    }

    private HealthStatus checkBudget() {
        if (globalBudget == null) {
            return new HealthStatus("budget", HealthStatus.Status.DOWN,
                    "No concurrency budget configured", Map.of());
        }
        var metadata = Map.of(
                "limit", String.valueOf(globalBudget.limit()),
                "inFlight", String.valueOf(globalBudget.inFlight()),
                "waiting", String.valueOf(globalBudget.waiting()),
                "peak", String.valueOf(globalBudget.peak()));
        return new HealthStatus("budget", HealthStatus.Status.UP,
                globalBudget.inFlight() + "/" + globalBudget.limit() + " units in flight", metadata);
    }
}
