package com.chaininsights.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorExceptionTest {

    @Test
    @DisplayName("message carries the failing component")
    void componentPrefix() {
        ValidatorException ex = new ValidatorException("Challenge", "wrong payload");
        assertEquals("Challenge", ex.getComponent());
        assertEquals("[Challenge] wrong payload", ex.getMessage());
    }

    @Test
    @DisplayName("plain failure counts against the miner by default")
    void penalisingByDefault() {
        assertTrue(new ValidatorException("Challenge", "wrong payload").isPenalising());
    }

    @Test
    @DisplayName("dependency failure can opt out of penalising")
    void overridable() {
        ValidatorException ownSide = new ValidatorException("Node:bitcoin", "down", new IllegalStateException()) {
            @Override
            public boolean isPenalising() {
                return false;
            }
        };
        assertFalse(ownSide.isPenalising());
        assertInstanceOf(IllegalStateException.class, ownSide.getCause());
    }
}
