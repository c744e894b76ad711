package com.phillippitts.voicestream.presentation.controller;

import com.phillippitts.voicestream.domain.OutputFormat;
import com.phillippitts.voicestream.domain.SpeechRequest;
import com.phillippitts.voicestream.exception.SynthesisException;
import com.phillippitts.voicestream.service.pool.WorkerPool;
import com.phillippitts.voicestream.service.stream.SpeechStream;
import com.phillippitts.voicestream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.Map;

/**
 * HTTP front end for the worker pool.
 *
 * <p>{@code GET /api/speech} admits the request before the response starts, so busy and
 * unsupported-format errors still map to proper status codes. The audio itself is then
 * written chunk by chunk as the worker produces it. A synthesis failure after that point is only
 * logged and cuts the audio short.
 */
@RestController
@RequestMapping("/api/speech")
class SpeechController {

    private static final Logger LOG = LogManager.getLogger(SpeechController.class);

    private final WorkerPool pool;

    SpeechController(WorkerPool pool) {
        this.pool = pool;
    }

    @GetMapping
    ResponseEntity<StreamingResponseBody> say(@RequestParam String text,
                                              @RequestParam(required = false) String voice,
                                              @RequestParam(required = false) String format,
                                              @RequestParam(required = false) Integer chunkSize) {
        SpeechRequest request = pool.newRequest(text, voice, format, chunkSize);
        LOG.info("Speech requested: voice={}, format={}, text='{}'", request.voice(), request.format().id(),
                LogSanitizer.preview(request.text()));

        SpeechStream stream = pool.say(request);
        StreamingResponseBody body = out -> {
            try (SpeechStream s = stream) {
                long written = s.transferTo(out);
                LOG.debug("Streamed {} bytes of {}", written, request.format().id());
            } catch (SynthesisException e) {
                // Status and audio content type are already committed; the response ends truncated
                LOG.error("Synthesis failed mid-stream: stage={}, format={}", e.getStage(), request.format().id(), e);
            }
        };

        OutputFormat outputFormat = request.format();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(outputFormat.mediaType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.inline()
                        .filename("speech." + outputFormat.fileExtension())
                        .build()
                        .toString())
                .body(body);
    }

    @GetMapping("/formats")
    ResponseEntity<Map<String, Object>> formats() {
        return ResponseEntity.ok(Map.of(
                "formats", pool.supportedFormatIds(),
                "default", pool.defaultFormat().id()
        ));
    }
}
