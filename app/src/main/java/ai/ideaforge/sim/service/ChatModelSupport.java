package ai.ideaforge.sim.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;

/**
 * Helpers shared by the chat-model backed services: reading JSON out of a model reply and
 * translating LangChain4j failures into {@link ServiceException}s.
 */
final class ChatModelSupport {

    static final String CODE_RATE_LIMIT = "RATE_LIMIT";
    static final String CODE_TIMEOUT = "TIMEOUT";
    static final String CODE_INVALID_INPUT = "INVALID_INPUT";
    static final String CODE_MODEL_NOT_FOUND = "MODEL_NOT_FOUND";
    static final String CODE_INVALID_RESPONSE = "INVALID_RESPONSE";
    static final String CODE_API_ERROR = "API_ERROR";

    private ChatModelSupport() {
    }

    /**
     * Parses the JSON object of a reply, tolerating Markdown code fences and chatter around it.
     */
    static JsonNode readJson(ObjectMapper objectMapper, String reply) {
        if (reply == null || reply.isBlank()) {
            throw new PayloadFormatException("Model returned an empty reply");
        }
        String text = reply.strip();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new PayloadFormatException("Model reply does not contain a JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            if (!node.isObject()) {
                throw new PayloadFormatException("Model reply is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException ex) {
            throw new PayloadFormatException("Model reply is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    static ServiceException translate(String operation, String providerName, String modelName, RuntimeException ex) {
        if (ex instanceof ServiceException serviceException) {
            return serviceException;
        }
        if (ex instanceof PayloadFormatException) {
            return new ServiceException(operation + " failed: " + ex.getMessage(), CODE_INVALID_RESPONSE, 502, ex);
        }
        if (isCausedBy(ex, ModelNotFoundException.class)) {
            return new ServiceException("%s model '%s' is not available.".formatted(providerName, modelName),
                    CODE_MODEL_NOT_FOUND, 404, ex);
        }
        if (isCausedBy(ex, RateLimitException.class)) {
            return new ServiceException(operation + " failed: rate limit reached at " + providerName, CODE_RATE_LIMIT, 429, ex);
        }
        if (isCausedBy(ex, TimeoutException.class)) {
            return new ServiceException(operation + " failed: timeout waiting for " + providerName, CODE_TIMEOUT, 408, ex);
        }
        if (isCausedBy(ex, InvalidRequestException.class)) {
            return new ServiceException(operation + " failed: invalid input rejected by " + providerName, CODE_INVALID_INPUT, 400, ex);
        }
        return new ServiceException(operation + " failed: API error from " + providerName + ": " + ex.getMessage(),
                CODE_API_ERROR, 500, ex);
    }

    static boolean isCausedBy(Throwable throwable, Class<? extends Throwable> type) {
        Throwable cause = throwable;
        while (cause != null) {
            if (type.isInstance(cause)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
