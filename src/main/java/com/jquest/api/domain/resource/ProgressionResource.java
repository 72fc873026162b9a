package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.domain.model.Progression;
import com.jquest.api.domain.model.ProgressionState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The {@code user_progression} resource.
 * The state is written as a code and rendered as its label; an unknown code renders as null.
 */
@Component
public class ProgressionResource extends ModelResource<Progression> {

    public ProgressionResource() {
        super("user_progression", Progression.class);
        readonly("created_at");
        readonly("updated_at");
        field(ResourceField.toOne("mission", "mission", "mission", false));
        field(ResourceField.toOne("user", "user", "user", false));

        override("state", bundle -> {
            Object code = bundle.get("state");
            return ProgressionState.labelOf(code != null ? code.toString() : null).orElse(null);
        });

        alwaysReturnData();
    }

    @Override
    public List<String> validate(Map<String, Object> payload) {
        List<String> errors = new ArrayList<>();
        if (payload.containsKey("state")) {
            Object state = payload.get("state");
            if (state == null || ProgressionState.fromCode(state.toString()).isEmpty()) {
                errors.add("Unknown progression state '" + state + "'");
            }
        }
        return errors;
    }
}
