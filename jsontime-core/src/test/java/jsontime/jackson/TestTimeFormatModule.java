package jsontime.jackson;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.json.JsonMapper;

import jsontime.LogUtils;
import jsontime.TimeFormat;
import jsontime.TimeLocation;
import jsontime.Tools;
import jsontime.configuration.TimeFormatConfig;
import jsontime.datetime.NamedPatterns;
import lombok.Data;

public class TestTimeFormatModule {

    private static Logger logger;

    private static final ZoneId SHANGHAI = ZoneId.of("Asia/Shanghai");
    private static final ZonedDateTime NEW_YEAR = ZonedDateTime.of(2018, 1, 1, 0, 0, 0, 0, SHANGHAI);

    @BeforeClass
    public static void configure() {
        Tools.configure();
        logger = LogManager.getLogger();
        LogUtils.setLevel(logger, Level.TRACE, "jsontime.jackson", "jsontime.configuration");
    }

    @Data
    @JsonPropertyOrder({"id", "published_at", "updated_at", "created_at"})
    public static class Book {
        private int id;
        @JsonProperty("published_at")
        private ZonedDateTime publishedAt;
        @JsonProperty("updated_at")
        private ZonedDateTime updatedAt;
        @JsonProperty("created_at")
        private ZonedDateTime createdAt;
    }

    @Data
    @JsonPropertyOrder({"id", "published_at", "updated_at", "created_at"})
    public static class LocatedBook {
        private int id;
        @JsonProperty("published_at")
        @TimeLocation("UTC")
        private ZonedDateTime publishedAt;
        @JsonProperty("updated_at")
        @TimeLocation("shanghai")
        private ZonedDateTime updatedAt;
        @JsonProperty("created_at")
        @TimeLocation("shanghai")
        private ZonedDateTime createdAt;
    }

    @Data
    @JsonPropertyOrder({"id", "published_at", "updated_at", "created_at"})
    public static class SqlBook {
        private int id;
        @JsonProperty("published_at")
        @TimeFormat("sql_datetime")
        private ZonedDateTime publishedAt;
        @JsonProperty("updated_at")
        @TimeFormat("sql_datetime")
        private ZonedDateTime updatedAt;
        @JsonProperty("created_at")
        @TimeFormat("sql_datetime")
        private ZonedDateTime createdAt;
    }

    @Data
    @JsonPropertyOrder({"start", "end"})
    @TimeFormat(NamedPatterns.DATE_TIME)
    @TimeLocation("UTC")
    public static class Period {
        private ZonedDateTime start;
        @TimeLocation("shanghai")
        private ZonedDateTime end;
    }

    @Data
    @JsonPropertyOrder({"meeting", "deadline"})
    public static class Agenda {
        @JsonFormat(pattern = "dd/MM/yyyy HH:mm", timezone = "Europe/Paris")
        private ZonedDateTime meeting;
        @TimeFormat(NamedPatterns.DATE_TIME)
        @JsonFormat(pattern = "dd/MM/yyyy", timezone = "UTC")
        private ZonedDateTime deadline;
    }

    @Data
    public static class Optionals {
        @TimeLocation("UTC")
        private Optional<ZonedDateTime> published = Optional.empty();
    }

    @Data
    @JsonPropertyOrder({"zoned", "offset", "instant", "local", "day", "date"})
    public static class Event {
        private ZonedDateTime zoned;
        private OffsetDateTime offset;
        private Instant instant;
        private LocalDateTime local;
        private LocalDate day;
        private Date date;
    }

    @Data
    public static class Epoch {
        @TimeFormat(NamedPatterns.SECONDS)
        private Instant when;
    }

    @Data
    public static class Releases {
        @TimeFormat("yyyyMMdd")
        @TimeLocation("UTC")
        private List<ZonedDateTime> dates;
    }

    @Data
    public static class French {
        @TimeFormat(value = "d MMMM uuuu", locale = "fr")
        private LocalDate day;
    }

    @Data
    public static class Martian {
        @TimeLocation("Mars/Olympus")
        private ZonedDateTime when;
    }

    private JsonMapper getMapper(TimeFormatConfig config) {
        return JacksonBuilder.get(JsonMapper.class).timeFormats(config).getMapper();
    }

    @Test
    public void testTimeFormat() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI).build());
        Book book = new Book();
        book.setId(1);
        book.setUpdatedAt(NEW_YEAR);
        book.setCreatedAt(NEW_YEAR);
        String json = mapper.writeValueAsString(book);
        Assert.assertEquals("{\"id\":1,\"published_at\":null,\"updated_at\":\"2018-01-01T00:00:00+08:00\",\"created_at\":\"2018-01-01T00:00:00+08:00\"}", json);
        Assert.assertEquals(book, mapper.readValue(json, Book.class));
    }

    @Test
    public void testLocation() throws IOException {
        TimeFormatConfig config = TimeFormatConfig.builder()
                                                  .defaultTimeFormat(NamedPatterns.RFC3339, ZoneId.of("Europe/Paris"))
                                                  .zoneAlias("shanghai", SHANGHAI)
                                                  .build();
        JsonMapper mapper = getMapper(config);
        LocatedBook book = new LocatedBook();
        book.setPublishedAt(NEW_YEAR);
        book.setCreatedAt(NEW_YEAR);
        String json = mapper.writeValueAsString(book);
        Assert.assertEquals("{\"id\":0,\"published_at\":\"2017-12-31T16:00:00Z\",\"updated_at\":null,\"created_at\":\"2018-01-01T00:00:00+08:00\"}", json);
        LocatedBook read = mapper.readValue(json, LocatedBook.class);
        Assert.assertEquals(NEW_YEAR.withZoneSameInstant(ZoneOffset.UTC), read.getPublishedAt());
        Assert.assertEquals(NEW_YEAR, read.getCreatedAt());
        Assert.assertNull(read.getUpdatedAt());
    }

    @Test
    public void testUnmarshalZero() {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, ZoneOffset.UTC).build());
        String json = "{\"id\":0,\"updated_at\":null,\"created_at\":\"0000-00-00 00:00:00\"}";
        InvalidFormatException ex = Assert.assertThrows(InvalidFormatException.class, () -> mapper.readValue(json, Book.class));
        logger.debug(ex.getMessage());
        Assert.assertEquals("0000-00-00 00:00:00", ex.getValue());
        Assert.assertEquals(ZonedDateTime.class, ex.getTargetType());

        JsonMapper sqlMapper = getMapper(TimeFormatConfig.builder()
                                                         .defaultTimeFormat(NamedPatterns.RFC3339, ZoneOffset.UTC)
                                                         .formatAlias("sql_datetime", "yyyy-MM-dd HH:mm:ss")
                                                         .build());
        ex = Assert.assertThrows(InvalidFormatException.class, () -> sqlMapper.readValue("{\"id\":0,\"created_at\":\"0000-00-00 00:00:00\"}", SqlBook.class));
        Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("MonthOfYear"));

        ex = Assert.assertThrows(InvalidFormatException.class, () -> mapper.readValue("{\"id\":0,\"created_at\":\"4294969314-01-01T00:00:00Z\"}", Book.class));
        Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("Year out of range"));
    }

    @Test
    public void testAlias() throws IOException {
        TimeFormatConfig config = TimeFormatConfig.builder()
                                                  .defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI)
                                                  .formatAlias("sql_datetime", "yyyy-MM-dd HH:mm:ss")
                                                  .build();
        JsonMapper mapper = getMapper(config);
        SqlBook book = new SqlBook();
        book.setId(1);
        book.setUpdatedAt(NEW_YEAR);
        book.setCreatedAt(NEW_YEAR);
        String json = mapper.writeValueAsString(book);
        Assert.assertEquals("{\"id\":1,\"published_at\":null,\"updated_at\":\"2018-01-01 00:00:00\",\"created_at\":\"2018-01-01 00:00:00\"}", json);
        Assert.assertEquals(book, mapper.readValue(json, SqlBook.class));
    }

    @Test
    public void testUnknownFormatAliasIsPattern() {
        // Not registered, so used as a pattern that can't be parsed
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI).build());
        SqlBook book = new SqlBook();
        book.setCreatedAt(NEW_YEAR);
        JsonMappingException ex = Assert.assertThrows(JsonMappingException.class, () -> mapper.writeValueAsString(book));
        Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("sql_datetime"));
    }

    @Test
    public void testClassAnnotations() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder()
                                                      .defaultTimeFormat(NamedPatterns.ISO, ZoneId.of("Europe/Paris"))
                                                      .zoneAlias("shanghai", SHANGHAI)
                                                      .build());
        Period period = new Period();
        period.setStart(NEW_YEAR);
        period.setEnd(NEW_YEAR);
        String json = mapper.writeValueAsString(period);
        Assert.assertEquals("{\"start\":\"2017-12-31 16:00:00\",\"end\":\"2018-01-01 00:00:00\"}", json);
        Period read = mapper.readValue(json, Period.class);
        Assert.assertEquals(NEW_YEAR.withZoneSameInstant(ZoneOffset.UTC), read.getStart());
        Assert.assertEquals(NEW_YEAR, read.getEnd());
    }

    @Test
    public void testJsonFormat() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.ISO, SHANGHAI).build());
        Agenda agenda = new Agenda();
        agenda.setMeeting(ZonedDateTime.of(2024, 5, 3, 14, 30, 0, 0, ZoneId.of("Europe/Paris")));
        agenda.setDeadline(NEW_YEAR);
        String json = mapper.writeValueAsString(agenda);
        Assert.assertEquals("{\"meeting\":\"03/05/2024 14:30\",\"deadline\":\"2017-12-31 16:00:00\"}", json);
        Agenda read = mapper.readValue(json, Agenda.class);
        Assert.assertEquals(agenda.getMeeting(), read.getMeeting());
        Assert.assertEquals(NEW_YEAR.withZoneSameInstant(ZoneOffset.UTC), read.getDeadline());
    }

    @Test
    public void testOptional() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI).build());
        Optionals empty = new Optionals();
        String json = mapper.writeValueAsString(empty);
        Assert.assertEquals("{\"published\":null}", json);
        Assert.assertEquals(Optional.empty(), mapper.readValue(json, Optionals.class).getPublished());

        Optionals present = new Optionals();
        present.setPublished(Optional.of(NEW_YEAR));
        json = mapper.writeValueAsString(present);
        Assert.assertEquals("{\"published\":\"2017-12-31T16:00:00Z\"}", json);
        Assert.assertEquals(Optional.of(NEW_YEAR.withZoneSameInstant(ZoneOffset.UTC)), mapper.readValue(json, Optionals.class).getPublished());
    }

    @Test
    public void testTemporalTypes() throws IOException {
        TimeFormatConfig config = TimeFormatConfig.builder()
                                                  .defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI)
                                                  .typeLayout(LocalDate.class, NamedPatterns.DATE_ONLY)
                                                  .typeLayout(LocalDateTime.class, NamedPatterns.DATE_TIME)
                                                  .typeLayout(Date.class, NamedPatterns.ISO)
                                                  .build();
        JsonMapper mapper = getMapper(config);
        Event event = new Event();
        event.setZoned(NEW_YEAR);
        event.setOffset(NEW_YEAR.toOffsetDateTime());
        event.setInstant(Instant.parse("2018-01-01T00:00:00Z"));
        event.setLocal(LocalDateTime.of(2018, 1, 1, 12, 30));
        event.setDay(LocalDate.of(2018, 1, 1));
        event.setDate(Date.from(Instant.parse("2018-01-01T00:00:00.250Z")));
        String json = mapper.writeValueAsString(event);
        Assert.assertEquals("{\"zoned\":\"2018-01-01T00:00:00+08:00\","
                          + "\"offset\":\"2018-01-01T00:00:00+08:00\","
                          + "\"instant\":\"2018-01-01T08:00:00+08:00\","
                          + "\"local\":\"2018-01-01 12:30:00\","
                          + "\"day\":\"2018-01-01\","
                          + "\"date\":\"2018-01-01T08:00:00.25+08:00\"}", json);
        Assert.assertEquals(event, mapper.readValue(json, Event.class));
    }

    @Test
    public void testRootValue() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.DATE_TIME, SHANGHAI).build());
        Assert.assertEquals("\"2018-01-01 00:00:00\"", mapper.writeValueAsString(NEW_YEAR));
        Assert.assertEquals(NEW_YEAR, mapper.readValue("\"2018-01-01 00:00:00\"", ZonedDateTime.class));
    }

    @Test
    public void testNumeric() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI).build());
        Epoch epoch = new Epoch();
        epoch.setWhen(Instant.ofEpochSecond(1514736000));
        String json = mapper.writeValueAsString(epoch);
        Assert.assertEquals("{\"when\":1514736000}", json);
        Assert.assertEquals(epoch, mapper.readValue(json, Epoch.class));

        epoch.setWhen(Instant.ofEpochSecond(1514736000, 500_000_000));
        json = mapper.writeValueAsString(epoch);
        Assert.assertEquals("{\"when\":1514736000.5}", json);
        Assert.assertEquals(epoch, mapper.readValue(json, Epoch.class));
        Assert.assertEquals(epoch, mapper.readValue("{\"when\":\"1514736000.5\"}", Epoch.class));
    }

    @Test
    public void testNumberForTextLayout() {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI).build());
        Assert.assertThrows(MismatchedInputException.class, () -> mapper.readValue("{\"id\":1,\"created_at\":1514736000}", Book.class));
    }

    @Test
    public void testList() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, SHANGHAI).build());
        Releases releases = new Releases();
        releases.setDates(List.of(ZonedDateTime.of(2018, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC),
                                  ZonedDateTime.of(2022, 11, 10, 0, 0, 0, 0, ZoneOffset.UTC)));
        String json = mapper.writeValueAsString(releases);
        Assert.assertEquals("{\"dates\":[\"20180101\",\"20221110\"]}", json);
        Assert.assertEquals(releases, mapper.readValue(json, Releases.class));
    }

    @Test
    public void testLocale() throws IOException {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, ZoneOffset.UTC).build());
        French french = new French();
        french.setDay(LocalDate.of(2024, 5, 3));
        String json = mapper.writeValueAsString(french);
        Assert.assertEquals("{\"day\":\"3 mai 2024\"}", json);
        Assert.assertEquals(french, mapper.readValue(json, French.class));
    }

    @Test
    public void testUnknownZone() {
        JsonMapper mapper = getMapper(TimeFormatConfig.builder().defaultTimeFormat(NamedPatterns.RFC3339, ZoneOffset.UTC).build());
        Martian martian = new Martian();
        martian.setWhen(NEW_YEAR);
        JsonMappingException ex = Assert.assertThrows(JsonMappingException.class, () -> mapper.writeValueAsString(martian));
        logger.debug(ex.getMessage());
        Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("Mars/Olympus"));
        ex = Assert.assertThrows(JsonMappingException.class, () -> mapper.readValue("{\"when\":\"2018-01-01T00:00:00Z\"}", Martian.class));
        Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("Mars/Olympus"));
    }

}
