package com.coagent.workflow.core.engine.rest;

import com.coagent.workflow.core.exception.CoAgentInvalidRequestException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bean Validation of request bodies. Violations become a {@link CoAgentInvalidRequestException}
 * listing the message of every offending property.
 */
public class CoAgentRequestValidator {

    private final Validator validator;

    private CoAgentRequestValidator() {
        ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        this.validator = factory.getValidator();
    }

    private static final class SingletonHelper {
        private static final CoAgentRequestValidator INSTANCE = new CoAgentRequestValidator();
    }

    public static CoAgentRequestValidator getInstance() {
        return SingletonHelper.INSTANCE;
    }

    public <T> T validate(T request) {
        if (request == null) {
            throw new CoAgentInvalidRequestException("request body is required", Map.of());
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return request;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .forEach(violation -> details.put(violation.getPropertyPath().toString(), violation.getMessage()));
        throw new CoAgentInvalidRequestException(
                violations.stream()
                        .map(ConstraintViolation::getMessage)
                        .sorted()
                        .findFirst()
                        .orElse("request is invalid"),
                details);
    }
}
