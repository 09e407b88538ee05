package com.planguard.core.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TransientFailureClassifierTest {

    private final TransientFailureClassifier classifier = new TransientFailureClassifier();

    @Test
    void testNetworkExceptionsAreTransient() {
        assertTrue(classifier.isTransient(new ResourceAccessException("I/O error on POST request")));
        assertTrue(classifier.isTransient(new IllegalStateException("wrapped", new SocketTimeoutException("Read timed out"))));
        assertTrue(classifier.isTransient(new RuntimeException(new IOException("stream closed"))));
    }

    @Test
    void testMalformedJsonIsPermanentDespiteBeingAnIOException() {
        JsonProcessingException parseError = assertThrows(JsonProcessingException.class,
                () -> new ObjectMapper().readTree("not json {"));

        assertFalse(classifier.isTransient(new IllegalStateException("Bad response body", parseError)));
        assertEquals(GenerationFailure.Kind.PERMANENT, classifier.classify(parseError).getKind());
    }

    @Test
    void testMalformedJsonQuotingTransientWordsIsStillPermanent() {
        JsonProcessingException parseError = assertThrows(JsonProcessingException.class,
                () -> new ObjectMapper().readTree("{\"error\": \"connection timeout\" "));

        assertFalse(classifier.isTransient(new RuntimeException(parseError)));
    }

    @Test
    void testRateLimitAndUnavailableResponsesAreTransient() {
        HttpClientErrorException tooMany = HttpClientErrorException.create(
                HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
        HttpServerErrorException unavailable = HttpServerErrorException.create(
                HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);

        assertTrue(classifier.isTransient(tooMany));
        assertTrue(classifier.isTransient(unavailable));
    }

    @Test
    void testBadRequestIsPermanent() {
        HttpClientErrorException badRequest = HttpClientErrorException.create(
                HttpStatus.BAD_REQUEST, "Bad Request", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);

        assertFalse(classifier.isTransient(badRequest));
        assertFalse(classifier.isTransient(new IllegalArgumentException("unknown model 'llama9'")));
    }

    @Test
    void testMessageSignals() {
        assertTrue(classifier.isTransientMessage("Connection refused"));
        assertTrue(classifier.isTransientMessage("Deadline exceeded: TIMEOUT"));
        assertTrue(classifier.isTransientMessage("HTTP 429 returned"));
        assertTrue(classifier.isTransientMessage("Rate limit reached for requests"));
        assertTrue(classifier.isTransientMessage("status: ResourceExhausted"));
        assertTrue(classifier.isTransientMessage("quota exceeded"));
        assertTrue(classifier.isTransientMessage("500 Internal Server Error"));

        assertFalse(classifier.isTransientMessage("Invalid API key"));
        assertFalse(classifier.isTransientMessage("Accurate plan"));
        assertFalse(classifier.isTransientMessage(null));
    }

    @Test
    void testClassifyUsesRootCauseMessage() {
        GenerationFailure failure = classifier.classify(
                new IllegalStateException("outer", new SocketTimeoutException("Read timed out")));

        assertTrue(failure.isTransient());
        assertEquals("SocketTimeoutException: Read timed out", failure.getMessage());

        GenerationFailure permanent = classifier.classify(new IllegalArgumentException("unknown model"));
        assertEquals(GenerationFailure.Kind.PERMANENT, permanent.getKind());
    }
}
