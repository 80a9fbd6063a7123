package io.crashreport.sdk;

/**
 * Outcome of submitting one event.
 *
 * <p>When {@link #isSuccessful()} the {@link #getEventId() event ID} is the one the server
 * assigned; otherwise {@link #getError()} describes what went wrong. Never both.
 */
public final class CaptureResponse {
    private final boolean successful;
    private final String eventId;
    private final String error;

    private CaptureResponse(boolean successful, String eventId, String error) {
        this.successful = successful;
        this.eventId = eventId;
        this.error = error;
    }

    public static CaptureResponse success(String eventId) {
        return new CaptureResponse(true, eventId, null);
    }

    public static CaptureResponse failure(String error) {
        return new CaptureResponse(false, null, error);
    }

    public boolean isSuccessful() { return successful; }
    public String getEventId() { return eventId; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return successful ? "CaptureResponse{eventId=" + eventId + "}" : "CaptureResponse{error=" + error + "}";
    }
}
