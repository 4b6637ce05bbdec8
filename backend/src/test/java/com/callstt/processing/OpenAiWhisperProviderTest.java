package com.callstt.processing;

import com.callstt.config.AppProperties;
import com.callstt.processing.adapter.OpenAiWhisperProvider;
import com.callstt.processing.adapter.RecordingDownloader;
import com.callstt.processing.adapter.TranscriptFiles;
import com.callstt.processing.model.SttJob;
import com.callstt.processing.service.TranscriptionException;
import com.callstt.processing.service.TranscriptionResult;
import com.callstt.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiWhisperProviderTest {

    private static final String ENDPOINT = "https://api.test/v1/audio/transcriptions";

    @TempDir
    Path workDir;

    private MockRestServiceServer server;
    private RestClient restClient;
    private Path recording;

    @BeforeEach
    void setUp() throws Exception {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
        recording = workDir.resolve("call-1.wav");
        Files.writeString(recording, "RIFF-audio");
    }

    @Test
    void uploadsRecordingAndStoresTranscript() throws Exception {
        OpenAiWhisperProvider provider = provider(25, "sk-test");
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andExpect(content().string(containsString("whisper-1")))
                .andExpect(content().string(containsString("name=\"response_format\"")))
                .andExpect(content().string(containsString("name=\"file\"")))
                .andRespond(withSuccess("{\"text\":\"  hello there \",\"language\":\"en\"}", MediaType.APPLICATION_JSON));

        TranscriptionResult result = provider.transcribe(job(recording.toString()));

        server.verify();
        assertThat(result.language()).isEqualTo("en");
        assertThat(Files.readString(Path.of(result.transcriptPath()))).isEqualTo("hello there\n");
        assertThat(Path.of(result.transcriptPath()).getParent()).isEqualTo(workDir.resolve("transcripts"));
    }

    @Test
    void providerRejectionCarriesStatusAndLimitHint() {
        OpenAiWhisperProvider provider = provider(25, "sk-test");
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.PAYLOAD_TOO_LARGE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"file too big\"}}"));

        assertThatThrownBy(() -> provider.transcribe(job(recording.toString())))
                .isInstanceOf(TranscriptionException.class)
                .hasMessage("file too big. Split the recording (max 25 MB)")
                .satisfies(error -> assertThat(((TranscriptionException) error).getStatusCode()).isEqualTo(413));
    }

    @Test
    void serverErrorKeepsStatusForRetryDecision() {
        OpenAiWhisperProvider provider = provider(25, "sk-test");
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError().body("upstream down"));

        assertThatThrownBy(() -> provider.transcribe(job(recording.toString())))
                .isInstanceOf(TranscriptionException.class)
                .hasMessage("upstream down")
                .satisfies(error -> assertThat(((TranscriptionException) error).getStatusCode()).isEqualTo(500));
    }

    @Test
    void oversizedRecordingIsRejectedBeforeUpload() throws Exception {
        OpenAiWhisperProvider provider = provider(1, "sk-test");
        Path large = workDir.resolve("large.wav");
        Files.write(large, new byte[1024 * 1024 + 1]);

        assertThatThrownBy(() -> provider.transcribe(job(large.toString())))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("exceeds 1 MB limit")
                .hasMessageEndingWith("Split the recording (max 1 MB)")
                .satisfies(error -> assertThat(((TranscriptionException) error).getStatusCode()).isEqualTo(413));
        server.verify();
    }

    @Test
    void overlongRecordingIsRejectedBeforeUpload() throws Exception {
        OpenAiWhisperProvider provider = provider(25, 1, "sk-test");
        Path longCall = silentWav("long.wav", 61);

        assertThatThrownBy(() -> provider.transcribe(job(longCall.toString())))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageStartingWith("Recording duration exceeds configured limit")
                .hasMessageContaining("> 1 min")
                .hasMessageEndingWith("Split the recording (max 25 MB)")
                .satisfies(error -> assertThat(((TranscriptionException) error).getStatusCode()).isEqualTo(413));
        server.verify();
    }

    @Test
    void recordingWithinDurationLimitIsUploaded() throws Exception {
        OpenAiWhisperProvider provider = provider(25, 1, "sk-test");
        Path shortCall = silentWav("short.wav", 30);
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"text\":\"short call\"}", MediaType.APPLICATION_JSON));

        TranscriptionResult result = provider.transcribe(job(shortCall.toString()));

        server.verify();
        assertThat(Files.readString(Path.of(result.transcriptPath()))).isEqualTo("short call\n");
    }

    @Test
    void unreadableAudioSkipsDurationLimit() {
        OpenAiWhisperProvider provider = provider(25, 1, "sk-test");
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"text\":\"ok\"}", MediaType.APPLICATION_JSON));

        provider.transcribe(job(recording.toString()));

        server.verify();
    }

    @Test
    void createdResponseCountsAsSuccess() throws Exception {
        OpenAiWhisperProvider provider = provider(25, "sk-test");
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.CREATED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"text\":\"created\",\"language\":\"so\"}"));

        TranscriptionResult result = provider.transcribe(job(recording.toString()));

        server.verify();
        assertThat(result.language()).isEqualTo("so");
        assertThat(Files.readString(Path.of(result.transcriptPath()))).isEqualTo("created\n");
    }

    @Test
    void downloadsHttpRecordingBeforeUpload() {
        OpenAiWhisperProvider provider = provider(25, "sk-test");
        server.expect(requestTo("http://files.test/rec/2.wav"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(new byte[]{1, 2, 3}, MediaType.APPLICATION_OCTET_STREAM));
        server.expect(requestTo(ENDPOINT))
                .andExpect(content().string(containsString("filename=\"2.wav\"")))
                .andRespond(withSuccess("{\"text\":\"ok\"}", MediaType.APPLICATION_JSON));

        TranscriptionResult result = provider.transcribe(job("http://files.test/rec/2.wav"));

        server.verify();
        assertThat(result.language()).isEqualTo("ru");
    }

    @Test
    void missingRecordingDownloadIsClientError() {
        OpenAiWhisperProvider provider = provider(25, "sk-test");
        server.expect(requestTo("http://files.test/rec/404.wav"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body("{\"message\":\"no such recording\"}"));

        assertThatThrownBy(() -> provider.transcribe(job("http://files.test/rec/404.wav")))
                .isInstanceOf(TranscriptionException.class)
                .hasMessage("no such recording")
                .satisfies(error -> assertThat(((TranscriptionException) error).getStatusCode()).isEqualTo(404));
    }

    @Test
    void unavailableWithoutApiKey() {
        assertThat(provider(25, "").isAvailable()).isFalse();
        assertThat(provider(25, "sk-test").isAvailable()).isTrue();
    }

    private OpenAiWhisperProvider provider(int maxFileSizeMb, String apiKey) {
        return provider(maxFileSizeMb, 0, apiKey);
    }

    private OpenAiWhisperProvider provider(int maxFileSizeMb, int maxFileMinutes, String apiKey) {
        AppProperties properties = TestProperties.create(
                3,
                Duration.ofSeconds(2),
                workDir.resolve("transcripts").toString(),
                maxFileSizeMb,
                maxFileMinutes,
                new AppProperties.OpenAi(true, apiKey, "https://api.test/v1/", "whisper-1"),
                new AppProperties.LocalStt(false, "", "")
        );
        return new OpenAiWhisperProvider(
                restClient,
                new ObjectMapper(),
                properties,
                new RecordingDownloader(restClient, new ObjectMapper()),
                new TranscriptFiles(properties)
        );
    }

    private Path silentWav(String name, int seconds) throws Exception {
        AudioFormat format = new AudioFormat(8000f, 16, 1, true, false);
        int frameCount = 8000 * seconds;
        byte[] samples = new byte[frameCount * format.getFrameSize()];
        Path target = workDir.resolve(name);
        try (AudioInputStream stream = new AudioInputStream(new ByteArrayInputStream(samples), format, frameCount)) {
            AudioSystem.write(stream, AudioFileFormat.Type.WAVE, target.toFile());
        }
        return target;
    }

    private SttJob job(String recordingUrl) {
        return new SttJob(1, "C1", recordingUrl, OpenAiWhisperProvider.ENGINE, "ru");
    }
}
