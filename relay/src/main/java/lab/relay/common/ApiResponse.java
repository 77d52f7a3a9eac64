package lab.relay.common;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

// Envelope shared by every endpoint: {success, data} or {success:false, error:{code,message,details}}.
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        ApiError error
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> failure(String code, String message, Map<String, Object> details) {
        return new ApiResponse<>(false, null, new ApiError(code, message, details));
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ApiError(
            String code,
            String message,
            Map<String, Object> details
    ) {}
}
