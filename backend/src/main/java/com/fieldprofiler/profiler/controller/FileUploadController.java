package com.fieldprofiler.profiler.controller;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldprofiler.profiler.dto.profile.AnalysisOptionsRequest;
import com.fieldprofiler.profiler.dto.profile.ProfileResponse;
import com.fieldprofiler.profiler.model.FieldKind;
import com.fieldprofiler.profiler.service.ProfileRunService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "File Upload", description = "Profile the columns of an uploaded CSV file")
public class FileUploadController {

  @Value("${app.upload.max-file-size:10485760}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv,txt}")
  private Set<String> allowedExtensions;

  private final ProfileRunService profileRunService;
  private final ObjectMapper objectMapper;

  @PostMapping(
      value = "/profile/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Profile uploaded file",
      description =
          "Profiles the columns of an uploaded CSV file. Column kinds are inferred unless given.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful analysis",
            content = @Content(schema = @Schema(implementation = ProfileResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or request",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<ProfileResponse> profileFile(
      @Parameter(description = "CSV file with a header row", required = true)
          @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "Columns to profile, in order; all columns when omitted")
          @RequestParam(value = "fields", required = false)
          List<String> fields,
      @Parameter(description = "Explicit column kinds as column:kind, e.g. price:numeric")
          @RequestParam(value = "kinds", required = false)
          List<String> kinds,
      @Parameter(description = "Analysis options as a JSON object")
          @RequestParam(value = "options", required = false)
          String options)
      throws IOException {
    validateFile(file);

    String fileName = file.getOriginalFilename();
    log.info("Received upload '{}' ({} bytes)", fileName, file.getSize());

    ProfileResponse response =
        profileRunService.profileCsv(
            file.getInputStream(), fileName, parseKinds(kinds), fields, parseOptions(options));
    return ResponseEntity.ok(response);
  }

  static Map<String, FieldKind> parseKinds(List<String> kinds) {
    Map<String, FieldKind> parsed = new LinkedHashMap<>();
    if (kinds == null) {
      return parsed;
    }
    for (String entry : kinds) {
      int separator = entry.lastIndexOf(':');
      if (separator <= 0 || separator == entry.length() - 1) {
        throw new IllegalArgumentException("Invalid kind mapping, expected column:kind: " + entry);
      }
      parsed.put(
          entry.substring(0, separator).trim(),
          FieldKind.fromString(entry.substring(separator + 1).trim()));
    }
    return parsed;
  }

  private AnalysisOptionsRequest parseOptions(String options) {
    if (options == null || options.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(options, AnalysisOptionsRequest.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid options JSON: " + e.getOriginalMessage(), e);
    }
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
