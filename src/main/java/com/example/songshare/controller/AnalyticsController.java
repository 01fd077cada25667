package com.example.songshare.controller;

import com.example.songshare.exception.InvalidInputException;
import com.example.songshare.model.AnalyticsOverview;
import com.example.songshare.model.EventType;
import com.example.songshare.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private static final String ALL_TYPES = "all";

    private final AnalyticsService analyticsService;

    @GetMapping("/overview")
    public AnalyticsOverview overview(
        @RequestParam(defaultValue = "10") int limit,
        @RequestParam(defaultValue = "download") String type
    ) {
        if (ALL_TYPES.equalsIgnoreCase(type)) {
            return analyticsService.overview(limit, null);
        }
        EventType eventType = EventType.fromValue(type)
            .orElseThrow(() -> new InvalidInputException("Unknown event type: " + type));
        return analyticsService.overview(limit, eventType);
    }
}
