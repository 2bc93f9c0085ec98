package io.act.engine.profile;

import io.act.engine.flow.FlowDefinition;
import io.act.engine.flow.StepSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Applies a credential profile to a flow: steps of an authenticated type receive the profile's
 * defaults and auth references underneath their own parameters.
 */
public final class FlowCredentials {
    private FlowCredentials() {}

    /**
     * Auth values stay as {@code {{.env.X}}} references, so they are resolved when each step runs.
     */
    public static FlowDefinition inject(FlowDefinition flow, CredentialProfile profile) {
        var authenticated = profile.authenticatedTypes();
        if (authenticated.isEmpty()) {
            return flow;
        }
        var steps = new ArrayList<StepSpec>(flow.steps().size());
        for (var step : flow.steps()) {
            if (!authenticated.contains(step.type())) {
                steps.add(step);
                continue;
            }
            var params = new LinkedHashMap<String, Object>(profile.getDefaults(step.type()));
            params.putAll(profile.getAuth(step.type(), false));
            params.putAll(step.params());
            steps.add(new StepSpec(step.id(), step.type(), params));
        }
        return new FlowDefinition(
            flow.name(),
            flow.description(),
            flow.startStep(),
            steps,
            flow.parameters(),
            flow.env(),
            flow.edges(),
            flow.settings(),
            flow.agent(),
            flow.deployment(),
            flow.routes()
        );
    }
}
