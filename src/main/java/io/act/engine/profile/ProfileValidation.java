package io.act.engine.profile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProfileValidation(boolean valid, List<String> errors, List<String> warnings, int authenticatedNodes) {
    public ProfileValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("valid", valid);
        map.put("errors", errors);
        map.put("warnings", warnings);
        map.put("authenticated_nodes", authenticatedNodes);
        return map;
    }
}
