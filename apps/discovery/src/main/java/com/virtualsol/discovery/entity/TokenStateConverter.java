package com.virtualsol.discovery.entity;

import com.virtualsol.discovery.modules.tokens.state.TokenState;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link TokenState} as its lower-case label.
 */
@Converter(autoApply = true)
public class TokenStateConverter implements AttributeConverter<TokenState, String> {

    @Override
    public String convertToDatabaseColumn(TokenState state) {
        return state == null ? null : state.getValue();
    }

    @Override
    public TokenState convertToEntityAttribute(String value) {
        return TokenState.fromValue(value).orElse(null);
    }
}
