package pl.marcinmilkowski.word_finder.api;

/**
 * Malformed query parameters or tool input. Answered with a 4xx for that request only.
 */
public class BadRequestException extends RuntimeException {

    private final int status;

    public BadRequestException(String message) {
        this(400, message);
    }

    public BadRequestException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
