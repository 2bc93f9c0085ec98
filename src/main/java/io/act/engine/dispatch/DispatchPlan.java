package io.act.engine.dispatch;

import io.act.engine.flow.AgentConfig;
import io.act.engine.flow.DeploymentConfig;
import io.act.engine.flow.RouteSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record DispatchPlan(
    DispatchMode mode,
    String reason,
    List<RouteSpec> routes,
    Optional<AgentConfig> agent,
    Optional<DeploymentConfig> deployment
) {
    public DispatchPlan {
        Objects.requireNonNull(mode, "mode");
        reason = reason == null ? "" : reason;
        routes = routes == null ? List.of() : List.copyOf(routes);
        agent = agent == null ? Optional.empty() : agent;
        deployment = deployment == null ? Optional.empty() : deployment;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("mode", mode.name().toLowerCase(Locale.ROOT));
        map.put("reason", reason);
        var routeList = new ArrayList<Map<String, Object>>();
        for (var route : routes) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("step", route.stepId());
            entry.put("path", route.path());
            entry.put("methods", route.methods());
            entry.put("handler", route.handler());
            entry.put("auth_required", route.authRequired());
            routeList.add(entry);
        }
        map.put("routes", routeList);
        agent.ifPresent(config -> map.put("agent", config.host() + ":" + config.port()));
        deployment.ifPresent(config -> map.put("environment", config.environment()));
        return map;
    }
}
