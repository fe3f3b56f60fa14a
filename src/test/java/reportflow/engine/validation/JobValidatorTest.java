package reportflow.engine.validation;

import reportflow.engine.exception.ValidationException;
import reportflow.engine.model.Job;
import reportflow.engine.model.OutputFormat;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class JobValidatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T08:00:00Z"), ZoneId.of("America/New_York"));

    private Job.Builder validJob() {
        return Job.builder()
                .id("job-1")
                .name("Daily sales")
                .query("SELECT * FROM sales")
                .schedule("0 9 * * 1-5");
    }

    @Test
    void acceptsValidJob() {
        assertDoesNotThrow(() -> JobValidator.validate(validJob().build(), CLOCK));
    }

    @Test
    void rejectsBlankName() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> JobValidator.validate(validJob().name("  ").build(), CLOCK));
        assertEquals("name", e.field());
    }

    @Test
    void rejectsOverlongName() {
        assertThrows(ValidationException.class,
                () -> JobValidator.validate(validJob().name("x".repeat(256)).build(), CLOCK));
    }

    @Test
    void scheduleErrorsNameTheCronField() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> JobValidator.validate(validJob().schedule("99 0 * * *").build(), CLOCK));
        assertEquals("minute", e.field());
    }

    @Test
    void rejectsScheduleThatNeverFires() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> JobValidator.validateSchedule("0 0 31 2 *", CLOCK));
        assertEquals("schedule", e.field());
        assertDoesNotThrow(() -> JobValidator.validateSchedule("0 0 29 2 *", CLOCK));
    }

    @Test
    void scheduleInsideSpringForwardGapStillFires() {
        // 02:30 does not exist on the March change day in New York but does on every other day
        assertEquals("30 2 * * *", JobValidator.validateSchedule("30 2 * * *", CLOCK).expression());
        assertEquals("30 2 10 3 *", JobValidator.validateSchedule("30 2 10 3 *", CLOCK).expression());
    }

    @Test
    void queryErrors() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> JobValidator.validate(validJob().query("INSERT INTO t VALUES (1)").build(), CLOCK));
        assertEquals("query", e.field());
    }

    @Test
    void outputFormat() {
        assertEquals(OutputFormat.CSV, JobValidator.parseOutputFormat(null));
        assertEquals(OutputFormat.JSON, JobValidator.parseOutputFormat("json"));
        assertEquals(OutputFormat.CSV, JobValidator.parseOutputFormat(" Csv "));

        ValidationException e = assertThrows(ValidationException.class,
                () -> JobValidator.parseOutputFormat("xlsx"));
        assertEquals("outputFormat", e.field());
    }
}
