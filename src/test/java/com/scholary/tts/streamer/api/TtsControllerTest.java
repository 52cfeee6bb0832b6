package com.scholary.tts.streamer.api;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.tts.streamer.cache.AudioJob;
import com.scholary.tts.streamer.engine.SynthesisException;
import com.scholary.tts.streamer.protocol.StreamMarkers;
import com.scholary.tts.streamer.protocol.WavHeader;
import com.scholary.tts.streamer.protocol.WavWriter;
import com.scholary.tts.streamer.service.SynthesisService;
import com.scholary.tts.streamer.streaming.StreamOutcome;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TtsControllerTest {

  private static final String JOB_ID = "7c9e6679-7425-40de-944b-e07fc1f90ae7";

  @Mock private SynthesisService synthesisService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    SynthesisRequestValidator validator = new SynthesisRequestValidator(5000, 500);
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new TtsController(synthesisService, validator),
                new HistoryController(synthesisService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void streamWritesWhatTheServiceProduces() throws Exception {
    byte[] header = WavHeader.streaming(24000).toBytes();
    byte[] marker = StreamMarkers.jobId(JOB_ID);
    doAnswer(
            invocation -> {
              OutputStream out = invocation.getArgument(2);
              out.write(header);
              out.write(marker);
              return StreamOutcome.completed(JOB_ID, 24000, 0, 0);
            })
        .when(synthesisService)
        .stream(eq(SynthesisMode.CUSTOM), any(), any());

    MvcResult started =
        mockMvc
            .perform(
                post("/api/tts/custom/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"text\":\"Hello\",\"speaker\":\"Ryan\"}"))
            .andExpect(request().asyncStarted())
            .andReturn();

    byte[] expected = new byte[header.length + marker.length];
    System.arraycopy(header, 0, expected, 0, header.length);
    System.arraycopy(marker, 0, expected, header.length, marker.length);
    mockMvc
        .perform(asyncDispatch(started))
        .andExpect(status().isOk())
        .andExpect(header().string("Cache-Control", "no-cache"))
        .andExpect(content().contentType("audio/wav"))
        .andExpect(content().bytes(expected));
  }

  @Test
  void invalidStreamRequestIsRejectedBeforeStreaming() throws Exception {
    mockMvc
        .perform(
            post("/api/tts/custom/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Hello\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Speaker is required"));

    verifyNoInteractions(synthesisService);
  }

  @Test
  void missingTextIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/tts/design/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"instruct\":\"warm\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("text is required"));
  }

  @Test
  void malformedJsonIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/tts/custom/stream").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid JSON"));
  }

  @Test
  void unknownModeIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/tts/sing/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Hello\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Unknown mode: sing"));
  }

  @Test
  void oneShotGenerationReturnsWavWithJobId() throws Exception {
    AudioJob job = new AudioJob(JOB_ID, new short[] {1, 2}, 24000, Instant.now());
    when(synthesisService.synthesize(eq(SynthesisMode.DESIGN), any())).thenReturn(job);

    mockMvc
        .perform(
            post("/api/tts/design")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Hello\",\"instruct\":\"warm and slow\"}"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Job-Id", JOB_ID))
        .andExpect(header().string("Content-Disposition", "inline; filename=\"output.wav\""))
        .andExpect(content().bytes(WavWriter.write(new short[] {1, 2}, 24000)));
  }

  @Test
  void oneShotFailureIsServerError() throws Exception {
    when(synthesisService.synthesize(any(), any()))
        .thenThrow(new SynthesisException("Inference server unavailable after 3 attempts"));

    mockMvc
        .perform(
            post("/api/tts/custom")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Hello\",\"speaker\":\"Ryan\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Inference server unavailable after 3 attempts"));
  }

  @Test
  void downloadServesAttachment() throws Exception {
    AudioJob job = new AudioJob(JOB_ID, new short[] {7}, 16000, Instant.now());
    when(synthesisService.findJob(JOB_ID)).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/tts/download/" + JOB_ID))
        .andExpect(status().isOk())
        .andExpect(content().contentType("audio/wav"))
        .andExpect(
            header()
                .string("Content-Disposition", "attachment; filename=\"generated_7c9e6679.wav\""))
        .andExpect(content().bytes(WavWriter.write(new short[] {7}, 16000)));
  }

  @Test
  void downloadOfExpiredJobIsNotFound() throws Exception {
    when(synthesisService.findJob(JOB_ID)).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/tts/download/" + JOB_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Audio not found or expired"));
  }

  @Test
  void downloadWithMalformedIdIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/tts/download/not-a-job"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid job ID"));

    verifyNoInteractions(synthesisService);
  }

  @Test
  void historyReplaysCachedAudio() throws Exception {
    AudioJob job = new AudioJob(JOB_ID, new short[] {3, 4}, 24000, Instant.now());
    when(synthesisService.findJob(JOB_ID)).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/history/audio/" + JOB_ID))
        .andExpect(status().isOk())
        .andExpect(content().bytes(WavWriter.write(new short[] {3, 4}, 24000)));
  }

  @Test
  void clientDisconnectMidStreamLeavesTheAudioResponseAlone() throws Exception {
    byte[] header = WavHeader.streaming(24000).toBytes();
    doAnswer(
            invocation -> {
              OutputStream out = invocation.getArgument(2);
              out.write(header);
              throw new IOException("Broken pipe");
            })
        .when(synthesisService)
        .stream(eq(SynthesisMode.CUSTOM), any(), any());

    MvcResult started =
        mockMvc
            .perform(
                post("/api/tts/custom/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"text\":\"Hello\",\"speaker\":\"Ryan\"}"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(started))
        .andExpect(status().isOk())
        .andExpect(content().bytes(header));
  }

  @Test
  void speakersAreListedWithDescriptions() throws Exception {
    mockMvc
        .perform(get("/api/tts/speakers"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(9))
        .andExpect(jsonPath("$[0].name").value("Vivian"))
        .andExpect(jsonPath("$[0].language").value("Chinese"))
        .andExpect(jsonPath("$[5].name").value("Ryan"))
        .andExpect(jsonPath("$[5].description").isNotEmpty());
  }

  @Test
  void languagesAreListed() throws Exception {
    mockMvc
        .perform(get("/api/tts/languages"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[1]").value("English"))
        .andExpect(jsonPath("$[-1:]", contains("Auto")));
  }
}
