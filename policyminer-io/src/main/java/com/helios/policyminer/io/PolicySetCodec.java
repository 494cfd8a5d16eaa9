/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.helios.policyminer.api.exceptions.PolicyValidationException;
import com.helios.policyminer.api.model.PolicySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts {@link PolicySet}s to and from structured documents and JSON text.
 *
 * <p>Documents use the snake_case field names of the model records in a
 * fixed order. Decoding validates every field through the records, so a
 * document that decodes is a valid policy set; any failure surfaces as a
 * {@link PolicyValidationException}.
 */
public class PolicySetCodec {
    private static final Logger logger = LoggerFactory.getLogger(PolicySetCodec.class);

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;

    public PolicySetCodec() {
        this(JsonMappers.create());
    }

    public PolicySetCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.prettyWriter = JsonMappers.prettyWriter(objectMapper);
    }

    public Map<String, Object> toDocument(PolicySet policySet) {
        return objectMapper.convertValue(policySet, DOCUMENT_TYPE);
    }

    public PolicySet fromDocument(Map<String, Object> document) {
        if (document == null) {
            throw new PolicyValidationException("document", "must not be null");
        }
        try {
            return objectMapper.convertValue(document, PolicySet.class);
        } catch (IllegalArgumentException e) {
            throw toValidationException(e);
        }
    }

    /**
     * Renders the set as pretty-printed JSON with two-space indentation.
     */
    public String toJson(PolicySet policySet) {
        try {
            return prettyWriter.writeValueAsString(policySet);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize policy set '" + policySet.name() + "'", e);
        }
    }

    public PolicySet fromJson(String json) {
        PolicySet policySet;
        try {
            policySet = objectMapper.readValue(json, PolicySet.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw toValidationException(e);
        }
        if (policySet == null) {
            throw new PolicyValidationException("document", "must be a JSON object");
        }
        return policySet;
    }

    public void write(PolicySet policySet, Path path) throws IOException {
        Files.writeString(path, toJson(policySet), StandardCharsets.UTF_8);
        logger.info("Wrote {} policies to {}", policySet.policies().size(), path);
    }

    /**
     * @throws IOException               if the file cannot be read
     * @throws PolicyValidationException if the content is not a valid policy set
     */
    public PolicySet read(Path path) throws IOException {
        PolicySet policySet = fromJson(Files.readString(path, StandardCharsets.UTF_8));
        logger.debug("Read policy set '{}' with {} policies from {}",
                policySet.name(), policySet.policies().size(), path);
        return policySet;
    }

    private static PolicyValidationException toValidationException(Exception e) {
        PolicyValidationException validation = JsonMappers.validationCause(e);
        if (validation != null) {
            return validation;
        }
        String message = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
        return new PolicyValidationException("document", message, e);
    }
}
