package io.addresswatcher.engine.event;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class OperationTest {

    @Test
    void resolvesWireCodes() {
        Assertions.assertEquals(Operation.CREATE, Operation.fromCode("c").orElseThrow());
        Assertions.assertEquals(Operation.READ, Operation.fromCode("r").orElseThrow());
        Assertions.assertEquals(Operation.UPDATE, Operation.fromCode("u").orElseThrow());
        Assertions.assertEquals(Operation.DELETE, Operation.fromCode("d").orElseThrow());
    }

    @Test
    void unknownCodesResolveToEmpty() {
        Assertions.assertTrue(Operation.fromCode("x").isEmpty());
        Assertions.assertTrue(Operation.fromCode("C").isEmpty());
        Assertions.assertTrue(Operation.fromCode(null).isEmpty());
    }

    @Test
    void requiredImagesFollowOperation() {
        Assertions.assertTrue(Operation.CREATE.requiresAfter());
        Assertions.assertFalse(Operation.CREATE.requiresBefore());
        Assertions.assertTrue(Operation.READ.requiresAfter());
        Assertions.assertFalse(Operation.READ.requiresBefore());
        Assertions.assertTrue(Operation.UPDATE.requiresAfter());
        Assertions.assertTrue(Operation.UPDATE.requiresBefore());
        Assertions.assertFalse(Operation.DELETE.requiresAfter());
        Assertions.assertTrue(Operation.DELETE.requiresBefore());
    }
}
