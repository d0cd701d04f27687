package com.coinledger.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validates EVM address format for Jakarta Bean Validation. Delegates to AddressValidator.
 */
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private final AddressValidator addressValidator = new AddressValidator();

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && addressValidator.isValidEvmAddress(value);
    }
}
