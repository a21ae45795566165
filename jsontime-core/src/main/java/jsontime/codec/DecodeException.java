package jsontime.codec;

public class DecodeException extends Exception {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

}
