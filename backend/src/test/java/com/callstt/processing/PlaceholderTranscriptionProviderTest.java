package com.callstt.processing;

import com.callstt.processing.adapter.PlaceholderTranscriptionProvider;
import com.callstt.processing.adapter.TranscriptFiles;
import com.callstt.processing.model.SttJob;
import com.callstt.processing.service.TranscriptionResult;
import com.callstt.support.TestProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PlaceholderTranscriptionProviderTest {

    @TempDir
    Path transcriptsDir;

    @Test
    void writesPlaceholderTranscriptNamedAfterCall() throws Exception {
        PlaceholderTranscriptionProvider provider = provider();

        TranscriptionResult result = provider.transcribe(new SttJob(1, "CALL-1", "http://x/1.wav", "stub", "ru"));

        Path transcript = Path.of(result.transcriptPath());
        assertThat(transcript).isEqualTo(transcriptsDir.resolve("CALL-1.txt"));
        assertThat(Files.readString(transcript)).startsWith("Transcription placeholder");
        assertThat(result.language()).isEqualTo("ru");
    }

    @Test
    void keepsExistingTranscript() throws Exception {
        Files.writeString(transcriptsDir.resolve("CALL-2.txt"), "real text\n");

        TranscriptionResult result = provider().transcribe(new SttJob(2, "CALL-2", "http://x/2.wav", "stub", null));

        assertThat(Files.readString(Path.of(result.transcriptPath()))).isEqualTo("real text\n");
    }

    @Test
    void unsafeCallIdsAreSanitisedIntoTranscriptsDir() {
        TranscriptionResult result = provider().transcribe(new SttJob(3, "../a b/c", "http://x/3.wav", "stub", null));

        assertThat(Path.of(result.transcriptPath()).getParent()).isEqualTo(transcriptsDir);
        assertThat(Path.of(result.transcriptPath()).getFileName().toString()).isEqualTo("a_b_c.txt");
    }

    private PlaceholderTranscriptionProvider provider() {
        return new PlaceholderTranscriptionProvider(new TranscriptFiles(
                TestProperties.create(3, Duration.ofSeconds(2), transcriptsDir.toString())));
    }
}
