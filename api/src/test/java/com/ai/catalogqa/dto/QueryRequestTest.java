package com.ai.catalogqa.dto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QueryRequestTest {

    private ValidatorFactory factory;
    private Validator validator;

    @BeforeEach
    void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    void testLargeTopKIsValid() {
        QueryRequest request = new QueryRequest("recycled wool", 500, null, null, null, null);

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testTopKBelowOneIsInvalid() {
        Set<ConstraintViolation<QueryRequest>> violations =
                validator.validate(new QueryRequest("recycled wool", 0, null, null, null, null));

        assertEquals(1, violations.size());
        assertEquals("topK", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testMissingTopKDefaultsToFive() {
        assertEquals(5, new QueryRequest("recycled wool", null, null, null, null, null).topK());
    }
}
