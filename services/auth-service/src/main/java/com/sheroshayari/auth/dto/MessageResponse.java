package com.sheroshayari.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MessageResponse - {success, message} body shared by the endpoints that
 * return no data, and by {@link com.sheroshayari.auth.web.GlobalExceptionHandler}.
 *
 * Example Response:
 * <pre>
 * {
 *   "success": false,
 *   "message": "Password reset link is invalid or has expired. Please request a new one."
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {
    private boolean success;
    private String message;

    public static MessageResponse ok(String message) {
        return new MessageResponse(true, message);
    }

    public static MessageResponse error(String message) {
        return new MessageResponse(false, message);
    }
}
