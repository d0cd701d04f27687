package com.coinledger.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validates EVM chain ids for Jakarta Bean Validation. Delegates to AddressValidator.
 */
public class EvmNetworkValidator implements ConstraintValidator<EvmNetwork, String> {

    private final AddressValidator addressValidator = new AddressValidator();

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && addressValidator.isSupportedEvmNetwork(value);
    }
}
