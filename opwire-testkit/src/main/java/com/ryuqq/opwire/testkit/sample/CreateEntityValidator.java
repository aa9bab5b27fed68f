package com.ryuqq.opwire.testkit.sample;

import com.ryuqq.opwire.core.error.Violation;
import com.ryuqq.opwire.core.guard.Validator;

import java.util.ArrayList;
import java.util.List;

/**
 * Field rules for {@link CreateEntityRequest}.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class CreateEntityValidator implements Validator<CreateEntityRequest> {

    static final int MAX_NAME_LENGTH = 100;

    @Override
    public List<Violation> validate(CreateEntityRequest request) {
        List<Violation> violations = new ArrayList<>();
        if (request == null) {
            violations.add(Violation.of("request", "must not be null"));
            return violations;
        }
        String name = request.name();
        if (name == null || name.isBlank()) {
            violations.add(Violation.of("name", "must not be blank"));
        } else if (name.length() > MAX_NAME_LENGTH) {
            violations.add(Violation.of("name", "must be at most " + MAX_NAME_LENGTH + " characters"));
        }
        return violations;
    }
}
