package com.fhirsls.sdk;

/**
 * HTTP status and parsed JSON body of a labeling service call.
 */
public record SlsResponse<T>(
    int statusCode,
    T body
) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
