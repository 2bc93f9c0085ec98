package io.act.engine.profile;

import io.act.engine.error.ActEngineException;
import io.act.engine.error.CapabilityExecutionException;
import io.act.engine.error.MissingRequiredParameterException;
import io.act.engine.error.NodeNotAuthenticatedException;
import io.act.engine.error.UnknownOperationException;
import io.act.engine.runtime.CapabilityInvoker;
import io.act.engine.runtime.CapabilityRegistry;
import io.act.engine.runtime.CapabilityResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ad-hoc execution of one step type outside any flow, driven by a credential profile.
 *
 * <p>Parameters are merged as profile defaults, then environment-resolved auth, then the
 * caller's parameters, each layer overriding the previous one.
 */
public final class SingleStepExecutor {
    private static final Logger log = LoggerFactory.getLogger(SingleStepExecutor.class);

    private final CapabilityRegistry registry;

    public SingleStepExecutor(CapabilityRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Loads the profile and executes; failures are reported in the returned map, never thrown.
     */
    public Map<String, Object> execute(Path profilePath, String type, String operation, Map<String, Object> params) {
        CredentialProfile profile;
        try {
            profile = CredentialProfile.load(profilePath);
        } catch (ActEngineException ex) {
            return failure(type, operation, ex.getMessage(), ex.code());
        }
        return execute(profile, type, operation, params);
    }

    public Map<String, Object> execute(CredentialProfile profile, String type, String operation, Map<String, Object> params) {
        try {
            var result = invoke(profile, type, operation, params);
            var response = new LinkedHashMap<String, Object>();
            response.put("status", result.status());
            response.put("node_type", type);
            response.put("operation", operation);
            if (result.isSuccess()) {
                response.put("result", result.result());
            } else {
                response.put("error", result.error());
                response.put("error_type", "capability_error");
            }
            return response;
        } catch (ActEngineException ex) {
            log.warn("Single-step execution of {}.{} failed: {}", type, operation, ex.getMessage());
            return failure(type, operation, ex.getMessage(), ex.code());
        }
    }

    /**
     * Executes and returns the raw capability result.
     *
     * @throws NodeNotAuthenticatedException when the profile has no authenticated entry for {@code type}
     * @throws UnknownOperationException when {@code operation} is not listed for {@code type}
     * @throws MissingRequiredParameterException listing every absent required parameter
     */
    public CapabilityResult invoke(CredentialProfile profile, String type, String operation, Map<String, Object> params) {
        var merged = mergeParams(profile, type, operation, params);
        var missing = missingParams(profile.getOperations(type).get(operation), merged);
        if (!missing.isEmpty()) {
            throw new MissingRequiredParameterException(type, operation, missing);
        }
        var capability = registry.resolve(type).create();
        log.debug("Executing {}.{} with parameters {}", type, operation, merged.keySet());
        try {
            var result = CapabilityInvoker.invoke(capability, merged);
            if (result == null) {
                throw new IllegalStateException("capability returned no result");
            }
            return result;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CapabilityExecutionException(type, "Execution of " + type + "." + operation + " was interrupted", ex);
        } catch (ActEngineException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new CapabilityExecutionException(type,
                "Execution of " + type + "." + operation + " failed: " + Objects.requireNonNullElse(ex.getMessage(), ex.toString()), ex);
        }
    }

    /**
     * Defaults, then resolved auth, then runtime parameters, plus {@code operation}.
     */
    public Map<String, Object> mergeParams(CredentialProfile profile, String type, String operation, Map<String, Object> params) {
        requireOperation(profile, type, operation);
        var merged = new LinkedHashMap<String, Object>(profile.getDefaults(type));
        merged.putAll(profile.getAuth(type, true));
        if (params != null) {
            merged.putAll(params);
        }
        merged.put("operation", operation);
        return merged;
    }

    /**
     * Dry run: returns {@code valid}, {@code errors}, {@code warnings} and {@code merged_params}.
     */
    public Map<String, Object> validateParams(CredentialProfile profile, String type, String operation, Map<String, Object> params) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        Map<String, Object> merged = Map.of();
        try {
            merged = mergeParams(profile, type, operation, params);
            var missing = missingParams(profile.getOperations(type).get(operation), merged);
            if (!missing.isEmpty()) {
                errors.add(new MissingRequiredParameterException(type, operation, missing).getMessage());
            }
            profile.getAuth(type, true).forEach((field, value) -> {
                if (CredentialProfile.isEnvReference(value)) {
                    warnings.add("Auth field '" + field + "' references an unset environment variable: " + value);
                }
            });
            if (!registry.isRegistered(type)) {
                warnings.add("No capability registered for type '" + type + "'");
            }
        } catch (ActEngineException ex) {
            errors.add(ex.getMessage());
        }
        var report = new LinkedHashMap<String, Object>();
        report.put("valid", errors.isEmpty());
        report.put("errors", errors);
        report.put("warnings", warnings);
        report.put("merged_params", redact(profile, type, merged));
        return report;
    }

    private static void requireOperation(CredentialProfile profile, String type, String operation) {
        if (!profile.isAuthenticated(type)) {
            throw new NodeNotAuthenticatedException(type);
        }
        var operations = profile.getOperations(type);
        if (!operations.containsKey(operation)) {
            throw new UnknownOperationException(type, operation, new ArrayList<>(operations.keySet()));
        }
    }

    /**
     * An auth value still holding its environment reference counts as absent.
     */
    private static List<String> missingParams(OperationDescriptor descriptor, Map<String, Object> merged) {
        var missing = new ArrayList<String>();
        if (descriptor == null) {
            return missing;
        }
        for (String name : descriptor.requiredParams()) {
            Object value = merged.get(name);
            if (value == null
                || (value instanceof String text && text.isBlank())
                || CredentialProfile.isEnvReference(value)) {
                missing.add(name);
            }
        }
        return missing;
    }

    private static Map<String, Object> redact(CredentialProfile profile, String type, Map<String, Object> merged) {
        if (merged.isEmpty()) {
            return merged;
        }
        var redacted = new LinkedHashMap<>(merged);
        for (String field : profile.getAuth(type, false).keySet()) {
            if (redacted.containsKey(field) && !CredentialProfile.isEnvReference(redacted.get(field))) {
                redacted.put(field, "***");
            }
        }
        return redacted;
    }

    private static Map<String, Object> failure(String type, String operation, String message, String errorType) {
        var response = new LinkedHashMap<String, Object>();
        response.put("status", CapabilityResult.ERROR);
        response.put("node_type", type);
        response.put("operation", operation);
        response.put("error", message);
        response.put("error_type", errorType);
        return response;
    }
}
