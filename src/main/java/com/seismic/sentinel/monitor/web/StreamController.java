package com.seismic.sentinel.monitor.web;

import com.seismic.sentinel.monitor.service.pipeline.PipelineOrchestrator;
import com.seismic.sentinel.monitor.service.streaming.StreamGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StreamController {

    private static final List<String> DEFAULT_TOPICS = Arrays.asList(
            PipelineOrchestrator.TOPIC_SNAPSHOT,
            PipelineOrchestrator.TOPIC_STATE
    );

    private final StreamGateway stream;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(name = "timeoutMs", required = false) Long timeoutMs,
                             @RequestParam(name = "topics", required = false) String topicsCsv) {

        // blank or "*" subscribes to every pipeline topic
        if (!StringUtils.hasText(topicsCsv) || "*".equals(topicsCsv.trim())) {
            return stream.subscribe(timeoutMs, DEFAULT_TOPICS);
        }
        return stream.subscribe(timeoutMs, Arrays.asList(topicsCsv.split(",")));
    }
}
