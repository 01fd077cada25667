package com.example.songshare.controller;

import com.example.songshare.model.StatusReport;
import com.example.songshare.service.StatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class StatusController {

    private final StatusService statusService;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "SongShare backend running");
    }

    @GetMapping("/api/status")
    public StatusReport status() {
        return statusService.check();
    }
}
