package com.birdopedia.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.birdopedia.dto.ApiResponse;
import com.birdopedia.dto.TripBatchRequest;
import com.birdopedia.dto.TripBatchResponse;
import com.birdopedia.service.TripService;
import com.birdopedia.trips.TripBatch;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/trips")
@Validated
public class TripController {

    private final TripService tripService;

    public TripController(TripService tripService) {
        this.tripService = tripService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<TripBatchResponse>> build(@RequestBody @Valid TripBatchRequest request) {
        TripBatch batch = tripService.buildTrips(
            request.getCaptures(),
            request.getFirstSeenDayBySpecies(),
            request.getClusterRadiusKm()
        );
        return ResponseEntity.ok(respond(batch));
    }

    @GetMapping("/archive")
    public ResponseEntity<ApiResponse<TripBatchResponse>> archive() {
        TripBatch batch = tripService.buildArchive().getBatch();
        return ResponseEntity.ok(respond(batch));
    }

    private ApiResponse<TripBatchResponse> respond(TripBatch batch) {
        ApiResponse<TripBatchResponse> response = ApiResponse.ok(new TripBatchResponse(batch), batch.getTrips().size());
        if (batch.getSkippedCaptures() > 0) {
            response.warn(batch.getSkippedCaptures() + " captures skipped: no resolvable capture time");
        }
        if (batch.getUnattachedCaptures() > 0) {
            response.warn(batch.getUnattachedCaptures() + " captures without location on days with no geotagged trip");
        }
        return response;
    }
}
