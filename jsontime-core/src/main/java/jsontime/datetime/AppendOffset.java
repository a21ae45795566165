package jsontime.datetime;

import java.time.ZonedDateTime;

@FunctionalInterface
interface AppendOffset {

    StringBuilder append(StringBuilder sb, ZonedDateTime dateTime);

}
