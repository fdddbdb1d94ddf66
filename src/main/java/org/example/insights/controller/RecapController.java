package org.example.insights.controller;

import org.example.insights.config.AutoRecapProperties;
import org.example.insights.entity.RecapOptionsEntity;
import org.example.insights.model.RecapActionRequest;
import org.example.insights.model.RecapOptionsResponse;
import org.example.insights.model.RecapStatusResponse;
import org.example.insights.service.AutoRecapScheduler;
import org.example.insights.service.RecapCapsuleQueue;
import org.example.insights.service.RecapMetricsService;
import org.example.insights.service.RecapOptionsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/recaps")
public class RecapController {

    private final RecapOptionsService optionsService;
    private final AutoRecapScheduler autoRecapScheduler;
    private final RecapCapsuleQueue capsuleQueue;
    private final RecapMetricsService metricsService;
    private final AutoRecapProperties properties;

    public RecapController(
            RecapOptionsService optionsService,
            AutoRecapScheduler autoRecapScheduler,
            RecapCapsuleQueue capsuleQueue,
            RecapMetricsService metricsService,
            AutoRecapProperties properties) {
        this.optionsService = optionsService;
        this.autoRecapScheduler = autoRecapScheduler;
        this.capsuleQueue = capsuleQueue;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    @GetMapping("/status")
    public RecapStatusResponse getStatus() {
        return new RecapStatusResponse(
                properties.isEnabled(),
                optionsService.countEnabledChats(),
                capsuleQueue.pendingCount(),
                autoRecapScheduler.inFlightCount(),
                properties.getMaxConcurrentRuns(),
                metricsService.snapshot()
        );
    }

    @GetMapping("/chats/{chatId}/options")
    public ResponseEntity<RecapOptionsResponse> getOptions(@PathVariable long chatId) {
        return optionsService.findOptions(chatId)
                .map(options -> ResponseEntity.ok(toResponse(options)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/chats/{chatId}/trigger")
    public ResponseEntity<Map<String, Object>> trigger(
            @PathVariable long chatId,
            @RequestParam(defaultValue = "6") int hours,
            @RequestParam(required = false) String requester,
            @RequestParam(required = false) Long replyChatId) {
        boolean queued;
        try {
            queued = autoRecapScheduler.triggerOnDemand(chatId, hours, requester, replyChatId == null ? chatId : replyChatId);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (!queued) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("queued", false, "reason", "A recap for this chat is already running"));
        }
        return ResponseEntity.accepted().body(Map.of("queued", true, "chatId", chatId, "hours", hours));
    }

    @PostMapping("/chats/{chatId}/actions")
    public RecapOptionsResponse applyAction(@PathVariable long chatId, @RequestBody RecapActionRequest request) {
        try {
            return toResponse(optionsService.apply(request.toAction(chatId)));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @PutMapping("/chats/{chatId}/subscribers/{userId}")
    public Map<String, Object> subscribe(@PathVariable long chatId, @PathVariable long userId) {
        boolean created = optionsService.subscribe(chatId, userId);
        return Map.of("subscribed", true, "created", created);
    }

    @DeleteMapping("/chats/{chatId}/subscribers/{userId}")
    public ResponseEntity<Void> unsubscribe(@PathVariable long chatId, @PathVariable long userId) {
        if (!optionsService.unsubscribe(chatId, userId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    private RecapOptionsResponse toResponse(RecapOptionsEntity options) {
        return RecapOptionsResponse.from(
                options,
                optionsService.findSubscriberIds(options.getChatId()).size(),
                capsuleQueue.nextDueAt(options.getChatId()).orElse(null));
    }
}
