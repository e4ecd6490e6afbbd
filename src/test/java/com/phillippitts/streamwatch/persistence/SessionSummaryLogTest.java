package com.phillippitts.streamwatch.persistence;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.phillippitts.streamwatch.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SessionSummaryLogTest {

    @TempDir
    Path dir;

    private final MutableClock clock = MutableClock.atEpoch();

    @Test
    void shouldWriteHeaderOnceAndOneRowPerRecord() throws IOException {
        SessionSummaryLog log = new SessionSummaryLog(dir.resolve("logs"), new CsvMapper(), clock);

        log.append(new SummaryRecord(clock.instant(), "@alice", SummaryRecord.ACTION_STARTED, SummaryRecord.SUCCESS,
                0.0, Map.of(), List.of("music", "nightly"), "evening host", ""));
        log.append(new SummaryRecord(clock.instant().plusSeconds(150), "@alice",
                SummaryRecord.ACTION_STOPPED_PREFIX + "official_end", SummaryRecord.SUCCESS, 2.5,
                Map.of(EventKind.CHAT, 12L, EventKind.GIFT, 3L), List.of(), null, null));

        assertThat(log.currentFile().getFileName().toString()).isEqualTo("monitoring_sessions_20250701.csv");
        List<String> lines = Files.readAllLines(log.currentFile());
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("timestamp,username,action,status,duration_minutes,comments_count,"
                + "gifts_count,follows_count,shares_count,joins_count,likes_count,tags,notes,error_message");
        assertThat(lines.get(1)).isEqualTo("2025-07-01T07:53:47,@alice,recording_started,success,0.0,"
                + "0,0,0,0,0,0,music;nightly,\"evening host\",");
        assertThat(lines.get(2)).startsWith("2025-07-01T07:56:17,@alice,recording_stopped_official_end,success,2.5,12,3,0");
    }

    @Test
    void rollsOverToANewFileEachDay() {
        SessionSummaryLog log = new SessionSummaryLog(dir, new CsvMapper(), clock);
        Path first = log.currentFile();

        clock.advance(Duration.ofDays(1));

        assertThat(log.currentFile()).isNotEqualTo(first);
        assertThat(log.currentFile().getFileName().toString()).isEqualTo("monitoring_sessions_20250702.csv");
    }

    @Test
    void writeFailureIsNotThrown() throws IOException {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");
        SessionSummaryLog log = new SessionSummaryLog(blocker, new CsvMapper(), clock);

        log.append(new SummaryRecord(clock.instant(), "@bob", SummaryRecord.ACTION_ATTEMPT, SummaryRecord.FAILED,
                0.0, null, null, null, "disk full"));

        assertThat(Files.isRegularFile(blocker)).isTrue();
    }
}
