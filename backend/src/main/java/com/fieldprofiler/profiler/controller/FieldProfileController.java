package com.fieldprofiler.profiler.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fieldprofiler.profiler.dto.profile.ProfileRequest;
import com.fieldprofiler.profiler.dto.profile.ProfileResponse;
import com.fieldprofiler.profiler.service.ProfileRunService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Field Profiling", description = "Descriptive statistics for dataset fields")
public class FieldProfileController {

  private final ProfileRunService profileRunService;

  @PostMapping(
      value = "/profile",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Profile dataset fields",
      description =
          "Computes per-field statistics for the rows in the request and stores the result")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful analysis",
            content = @Content(schema = @Schema(implementation = ProfileResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid or rejected request",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<ProfileResponse> profile(@Valid @RequestBody ProfileRequest request) {
    log.info(
        "Received profile request for dataset '{}': {} field(s), {} row(s)",
        request.getDatasetName(),
        request.getFields().size(),
        request.getRows().size());
    return ResponseEntity.ok(profileRunService.profile(request));
  }
}
