package jsontime.codec;

public class EncodeException extends Exception {

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }

}
