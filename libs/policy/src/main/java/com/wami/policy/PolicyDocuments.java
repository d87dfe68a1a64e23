package com.wami.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wami.common.InvalidParameterException;

import java.util.List;
import java.util.Optional;

/**
 * JSON codec for {@link PolicyDocument}, using the IAM field names ({@code Version},
 * {@code Statement}, {@code Effect}, {@code Action}, {@code Resource}, {@code Condition}).
 * <p>
 * WHY Jackson: the policy grammar is plain JSON and Jackson binds it straight onto the records.
 * {@code ACCEPT_SINGLE_VALUE_AS_ARRAY} covers the {@code "Action": "iam:GetUser"} shorthand.
 */
public final class PolicyDocuments {

    /** Version tag written into new and substituted documents. */
    public static final String DEFAULT_VERSION = "2012-10-17";

    private static final ObjectMapper MAPPER = createMapper();

    private PolicyDocuments() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Parses a policy document.
     *
     * @throws InvalidParameterException if the text is not a well-formed policy document
     */
    public static PolicyDocument parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidParameterException("Invalid policy document JSON: empty input");
        }
        PolicyDocument document;
        try {
            document = MAPPER.readValue(json, PolicyDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("Invalid policy document JSON", e);
        }
        if (document == null) {
            throw new InvalidParameterException("Invalid policy document JSON: null document");
        }
        return document;
    }

    /** Parses a policy document, returning empty when it is malformed. */
    public static Optional<PolicyDocument> tryParse(String json) {
        try {
            return Optional.of(parse(json));
        } catch (InvalidParameterException e) {
            return Optional.empty();
        }
    }

    /** Serializes a document to its JSON form. */
    public static String toJson(PolicyDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("Failed to serialize policy document", e);
        }
    }

    /** A document with the default version and no statements; it matches nothing. */
    public static PolicyDocument empty() {
        return new PolicyDocument(DEFAULT_VERSION, List.of());
    }
}
