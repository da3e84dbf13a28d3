package tokengate.adapter.in.dto;

import java.util.Map;

/**
 * Response body listing every claim of the validated token.
 *
 * @param message fixed success message
 * @param claims  all claims, verbatim
 */
public record TokenInfoResponse(String message, Map<String, Object> claims) {

    public static TokenInfoResponse of(Map<String, Object> claims) {
        return new TokenInfoResponse("Token decoded successfully", claims);
    }
}
