package jsontime;

import java.time.format.DateTimeParseException;

public final class Helpers {

    private Helpers() {
        // Only static helpers
    }

    /**
     * Flatten the messages of an exception and its causes.
     * @param t the exception to describe
     * @return the chained messages
     */
    public static String resolveThrowableException(Throwable t) {
        StringBuilder builder = new StringBuilder();
        while (t.getCause() != null && ! (t instanceof DateTimeParseException)) {
            String message = t.getMessage();
            if (message == null) {
                message = t.getClass().getSimpleName();
            }
            // Skip repeated messages
            if (! message.equals(t.getCause().getMessage())) {
                builder.append(message).append(": ");
            }
            t = t.getCause();
        }
        String message = t.getMessage();
        if (t instanceof NullPointerException && message == null) {
            message = "Null pointer exception";
        } else if (message == null) {
            message = t.getClass().getSimpleName();
        }
        builder.append(message);
        return builder.toString();
    }

}
