package com.sitecrawler.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void unwrap_stripsFutureWrappers() {
        IOException root = new IOException("disk full");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertSame(root, ErrorUtils.unwrap(wrapped));
        assertSame(root, ErrorUtils.unwrap(root));
    }

    @Test
    void unwrap_keepsWrapperWithoutCause() {
        CompletionException bare = new CompletionException("bare", null);
        assertSame(bare, ErrorUtils.unwrap(bare));
    }

    @Test
    void formatErrorMessage() {
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
        assertEquals("disk full", ErrorUtils.formatErrorMessage(new CompletionException(new IOException("disk full"))));
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
    }
}
