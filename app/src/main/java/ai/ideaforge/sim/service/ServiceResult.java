package ai.ideaforge.sim.service;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a service call. Failures travel as values so callers branch on {@link #success()}.
 *
 * @param success whether {@code data} is present
 * @param status  HTTP-equivalent status: 200, 206 for partial payloads, or the error's status
 */
public record ServiceResult<T>(boolean success, int status, Optional<T> data, Optional<ServiceException> error) {

    public static final int OK = 200;
    public static final int PARTIAL_CONTENT = 206;

    public ServiceResult {
        data = data == null ? Optional.empty() : data;
        error = error == null ? Optional.empty() : error;
        if (success && (data.isEmpty() || error.isPresent())) {
            throw new IllegalArgumentException("A successful result carries data and no error");
        }
        if (!success && error.isEmpty()) {
            throw new IllegalArgumentException("A failed result carries an error");
        }
    }

    public static <T> ServiceResult<T> ok(T data) {
        return new ServiceResult<>(true, OK, Optional.of(Objects.requireNonNull(data, "data")), Optional.empty());
    }

    public static <T> ServiceResult<T> partial(T data) {
        return new ServiceResult<>(true, PARTIAL_CONTENT, Optional.of(Objects.requireNonNull(data, "data")), Optional.empty());
    }

    public static <T> ServiceResult<T> failure(ServiceException error) {
        Objects.requireNonNull(error, "error");
        return new ServiceResult<>(false, error.httpStatus(), Optional.empty(), Optional.of(error));
    }

    public boolean isPartial() {
        return success && status == PARTIAL_CONTENT;
    }

    public <R> ServiceResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!success) {
            return failure(error.orElseThrow());
        }
        R mapped = mapper.apply(data.orElseThrow());
        return isPartial() ? partial(mapped) : ok(mapped);
    }

    /**
     * Returns the payload or throws the carried error.
     */
    public T orElseThrow() {
        if (!success) {
            throw error.orElseThrow();
        }
        return data.orElseThrow();
    }
}
