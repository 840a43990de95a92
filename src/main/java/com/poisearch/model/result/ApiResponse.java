package com.poisearch.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Standardized API response wrapper.
 * A failed call names the error kind in {@code code} and explains it in {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    
    private Boolean ok;
    private T data;
    private String code;
    private String error;
    private String elapsed;
    
    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .ok(true)
                .data(data)
                .build();
    }
    
    /**
     * Create successful response with measured elapsed time
     */
    public static <T> ApiResponse<T> success(T data, String elapsed) {
        return ApiResponse.<T>builder()
                .ok(true)
                .data(data)
                .elapsed(elapsed)
                .build();
    }
    
    /**
     * Create error response
     */
    public static <T> ApiResponse<T> error(String code, String error) {
        return ApiResponse.<T>builder()
                .ok(false)
                .code(code)
                .error(error)
                .build();
    }
}
