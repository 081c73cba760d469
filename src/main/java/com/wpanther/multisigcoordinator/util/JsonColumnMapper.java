package com.wpanther.multisigcoordinator.util;

import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.multisigcoordinator.dto.OutputSummary;
import com.wpanther.multisigcoordinator.exception.InvalidInputException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts the list-valued columns of proposals and history entries to and from JSON text
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonColumnMapper {

    private static final TypeReference<List<OutputSummary>> OUTPUTS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> SIGNERS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String writeOutputs(List<OutputSummary> outputs) {
        return write(outputs == null ? List.of() : outputs, "outputs");
    }

    public List<OutputSummary> readOutputs(String json) {
        return read(json, OUTPUTS_TYPE, "outputs");
    }

    public String writeSigners(List<String> signers) {
        return write(signers, "signers");
    }

    public List<String> readSigners(String json) {
        return read(json, SIGNERS_TYPE, "signers");
    }

    private String write(Object value, String column) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(InvalidInputException.INVALID_PAYLOAD,
                    "Failed to serialize " + column + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type, String column) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Stored {} column is not valid JSON", column, e);
            throw new IllegalStateException("Failed to deserialize " + column + ": " + e.getOriginalMessage(), e);
        }
    }
}
