package com.ai.jobmatch.controller;

import com.ai.jobmatch.dto.GeoPlace;
import com.ai.jobmatch.service.GeoLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/locations")
@RequiredArgsConstructor
public class LocationController {

    private final GeoLookupService geoLookupService;

    // 도시 자동완성 (이름 또는 우편번호)
    @GetMapping("/cities")
    public ResponseEntity<List<GeoPlace>> searchCities(@RequestParam String query) {
        return ResponseEntity.ok(geoLookupService.searchCities(query));
    }
}
