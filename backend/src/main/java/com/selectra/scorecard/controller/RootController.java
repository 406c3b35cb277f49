package com.selectra.scorecard.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Landing endpoint. The browser front end is served separately, so this
 * only advertises the API.
 */
@RestController
public class RootController {

    private static final List<String> ENDPOINTS = List.of(
            "GET /api/questions",
            "POST /api/evaluate",
            "POST /api/final-report",
            "POST /api/reset");

    @Value("${selectra.app-name:Selectra}")
    private String appName;

    @Value("${selectra.tagline:Where interviews meet insight.}")
    private String tagline;

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", appName + " is running. " + tagline);
        body.put("appName", appName);
        body.put("tagline", tagline);
        body.put("endpoints", ENDPOINTS);
        return body;
    }
}
