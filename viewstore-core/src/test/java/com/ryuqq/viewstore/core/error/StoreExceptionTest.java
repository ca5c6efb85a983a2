package com.ryuqq.viewstore.core.error;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreExceptionTest {

    @Test
    void subclasses_ReportTheirKind() {
        assertEquals(ErrorKind.DUPLICATE_ID, new DuplicateIdException("a").getKind());
        assertEquals(ErrorKind.NOT_FOUND, new ItemNotFoundException("a").getKind());
        assertEquals(ErrorKind.NOT_SERIALIZABLE, new NotSerializableQueryException("opaque").getKind());
        assertEquals(ErrorKind.PATCH_CONFLICT, new PatchApplicationException("bad path").getKind());
        assertEquals(ErrorKind.INVALID_ITEM, new ItemMappingException("bad item", new RuntimeException()).getKind());
    }

    @Test
    void notFound_CarriesId() {
        ItemNotFoundException exception = new ItemNotFoundException("42");

        assertEquals("42", exception.getId());
        assertTrue(exception.getMessage().contains("'42'"));
    }

    @Test
    void transactionFailed_KeepsCauseAndFailedIndex() {
        // Given
        ItemNotFoundException cause = new ItemNotFoundException("x");

        // When
        TransactionFailedException exception = new TransactionFailedException(List.of(), 0, cause);

        // Then
        assertEquals(ErrorKind.TRANSACTION_PARTIAL_FAILURE, exception.getKind());
        assertSame(cause, exception.getCause());
        assertEquals(0, exception.getFailedIndex());
        assertTrue(exception.getAppliedUpdates().isEmpty());
    }

    @Test
    void nullKind_Throws() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new StoreException(null, "message")
        );
        assertEquals("kind cannot be null", exception.getMessage());
    }
}
