package com.coinledger.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validates Bitcoin address format for Jakarta Bean Validation. Delegates to AddressValidator.
 */
public class BitcoinAddressValidator implements ConstraintValidator<BitcoinAddress, String> {

    private final AddressValidator addressValidator = new AddressValidator();

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && addressValidator.isValidBitcoinAddress(value);
    }
}
