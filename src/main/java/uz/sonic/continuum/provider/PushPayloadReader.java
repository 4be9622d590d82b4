package uz.sonic.continuum.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class PushPayloadReader {

    private static final Logger log = LoggerFactory.getLogger(PushPayloadReader.class);

    private final ObjectMapper objectMapper;

    public PushPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <P> ParseResult<P> read(byte[] rawBody, Class<P> type) {
        if (rawBody == null || rawBody.length == 0) {
            return ParseResult.failed("Request body is empty");
        }
        try {
            P payload = objectMapper.readValue(rawBody, type);
            if (payload == null) {
                return ParseResult.failed("Request body is not a JSON object");
            }
            return ParseResult.parsed(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not decode {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return ParseResult.failed("Invalid payload structure: " + e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("Could not read {}", type.getSimpleName(), e);
            return ParseResult.failed("Failed to read request body");
        }
    }
}
