package com.coinledger.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Chain id of a supported account-based (EVM) network.
 * Error code for API: INVALID_NETWORK.
 */
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = EvmNetworkValidator.class)
public @interface EvmNetwork {

    String message() default "INVALID_NETWORK";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
