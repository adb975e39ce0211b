package com.virtualsol.discovery.modules.tokens.state;

import com.virtualsol.discovery.entity.TokenStateConverter;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TokenStateTest {

    @Test
    void parsesAnyCasingAndLegacyLabels() {
        assertEquals(Optional.of(TokenState.BONDED), TokenState.fromValue("BONDED"));
        assertEquals(Optional.of(TokenState.ABOUT_TO_BOND), TokenState.fromValue(" about_to_bond "));
        assertEquals(Optional.of(TokenState.LAUNCHING), TokenState.fromValue("new"));
        assertEquals(Optional.of(TokenState.ABOUT_TO_BOND), TokenState.fromValue("Graduating"));
        assertEquals(Optional.empty(), TokenState.fromValue("exploded"));
    }

    @Test
    void persistsLowerCaseValues() {
        TokenStateConverter converter = new TokenStateConverter();

        assertEquals("about_to_bond", converter.convertToDatabaseColumn(TokenState.ABOUT_TO_BOND));
        assertEquals(TokenState.LAUNCHING, converter.convertToEntityAttribute("new"));
        assertNull(converter.convertToDatabaseColumn(null));
    }
}
