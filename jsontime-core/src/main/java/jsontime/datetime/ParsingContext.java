package jsontime.datetime;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

class ParsingContext {
    // Year.MAX_VALUE has 9 digits
    private static final int MAX_YEAR_DIGITS = 9;
    private static final int MIN_YEAR_DIGITS = 4;

    int offset;
    final int length;
    final String datetime;

    ParsingContext(String datetime) {
        this.offset = 0;
        this.length = datetime.length();
        this.datetime = datetime;
    }

    boolean hasMore() {
        return offset < length;
    }

    char current() {
        return datetime.charAt(offset);
    }

    /**
     * Read a number of exactly {@code lengthDigit} digits.
     */
    int parseInt(int lengthDigit) {
        int startNumber = offset;
        while (offset < length && Character.isDigit(datetime.charAt(offset)) && (offset - startNumber) < lengthDigit) {
            offset++;
        }
        if (startNumber == offset) {
            throw parseException("Failed to parse number");
        } else if (offset - startNumber != lengthDigit) {
            throw parseException("Expected " + lengthDigit + " digits at index " + startNumber);
        }
        return digitsValue(startNumber);
    }

    /**
     * Read a year with an optional sign, from 4 to 9 digits.
     */
    int parseYear() {
        int sign = 1;
        if (offset < length && (datetime.charAt(offset) == '-' || datetime.charAt(offset) == '+')) {
            sign = datetime.charAt(offset) == '-' ? -1 : 1;
            offset++;
        }
        int startNumber = offset;
        while (offset < length && Character.isDigit(datetime.charAt(offset))) {
            offset++;
            if (offset - startNumber > MAX_YEAR_DIGITS) {
                throw parseException("Year out of range");
            }
        }
        if (startNumber == offset) {
            throw parseException("Failed to parse number");
        } else if (offset - startNumber < MIN_YEAR_DIGITS) {
            throw parseException("Expected at least " + MIN_YEAR_DIGITS + " digits for year at index " + startNumber);
        }
        return sign * digitsValue(startNumber);
    }

    private int digitsValue(int startNumber) {
        int result = resolveDigitByCode(startNumber);
        for (int i = startNumber + 1; i < offset; ++i) {
            result = result * 10 + resolveDigitByCode(i);
        }
        return result;
    }

    int parseNano() {
        int nanos;
        if (offset < length && (datetime.charAt(offset) == '.' || datetime.charAt(offset) == ',')) {
            int startPos = ++offset;
            if (offset == length) {
                throw parseException("Missing fraction of second");
            }
            int endPosExcl = Math.min(offset + 9, length);
            int frac = resolveDigitByCode(offset++);
            while (offset < endPosExcl) {
                int digit = datetime.charAt(offset) - '0';
                if (digit < 0 || digit > 9) {
                    break;
                }
                frac = frac * 10 + digit;
                ++offset;
            }
            nanos = DatetimeProcessorUtil.parseNanos(frac, offset - startPos);
        } else {
            nanos = 0;
        }
        return nanos;
    }

    /**
     * Read a numeric zone offset, or a single 'Z' for UTC.
     * @param offsetType the expected offset printer, null if the layout has no zone
     * @param defaultZone the zone to use when no offset is present
     */
    ZoneId extractOffset(AppendOffset offsetType, ZoneId defaultZone) {
        if (offset == length) {
            if (offsetType != null || defaultZone == null) {
                throw parseException("Zone offset required");
            }
            return defaultZone;
        } else if (offsetType == null) {
            throw parseException("Zone offset unexpected");
        } else if (offset == length - 1 && datetime.charAt(offset) == 'Z') {
            offset++;
            return ZoneOffset.UTC;
        }
        int sign;
        char signChar = datetime.charAt(offset++);
        if (signChar == '+') {
            sign = 1;
        } else if (signChar == '-') {
            sign = -1;
        } else {
            throw parseException("Invalid zone offset");
        }
        int hour = parseInt(2);
        int minute = 0;
        if (offset < length) {
            if (datetime.charAt(offset) == ':') {
                offset++;
            }
            minute = parseInt(2);
        }
        int second = 0;
        if (offset < length) {
            if (datetime.charAt(offset) == ':') {
                offset++;
            }
            second = parseInt(2);
        }
        try {
            return ZoneOffset.ofHoursMinutesSeconds(sign * hour, sign * minute, sign * second);
        } catch (DateTimeException ex) {
            throw parseException(ex.getMessage(), ex);
        }
    }

    void checkOffset(char expected) {
        if (offset == length) {
            throw parseException("At end of parsing");
        }
        char found = datetime.charAt(offset++);
        if (found != expected) {
            throw parseException("Expected '" + expected + "' character but found '" + found + "'");
        }
    }

    void checkEnd() {
        if (offset != length) {
            throw parseException("Unparsed text found at index " + offset);
        }
    }

    DateTimeParseException parseException(String message) {
        return new DateTimeParseException(String.format("Failed to parse date \"%s\": %s", datetime, message), datetime, offset);
    }

    DateTimeParseException parseException(String message, Throwable ex) {
        return new DateTimeParseException(String.format("Failed to parse date \"%s\": %s", datetime, message), datetime, offset, ex);
    }

    private int resolveDigitByCode(int index) {
        char c = datetime.charAt(index);
        int result = c - '0';
        if (result < 0 || result > 9) {
            throw parseException("Failed to parse number at index " + index);
        }
        return result;
    }

}
