package com.ospicorp.recordsapi.records;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/records")
@Tag(name = "Records")
public class RecordController {
  private static final Logger log = LoggerFactory.getLogger(RecordController.class);

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

  private final RecordRepository repository;

  public RecordController(RecordRepository repository) {
    this.repository = repository;
  }

  @PostMapping
  @Operation(summary = "Create record", description = "Store a JSON object under a calendar date.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Created"),
      @ApiResponse(responseCode = "400", description = "Malformed date or payload"),
      @ApiResponse(responseCode = "500", description = "Storage failure",
          content = @Content(mediaType = "text/plain"))
  })
  public ResponseEntity<Void> create(@Valid @RequestBody CreateRecordRequest request) {
    LocalDate date = parseDate(request.date());
    ObjectNode data = requireObject(request.data());

    DataRecord saved = repository.create(DataRecord.unsaved(date, data));
    log.info("Created record {} for {}", saved.id(), saved.date());
    return ResponseEntity.status(HttpStatus.CREATED).build();
  }

  @GetMapping
  @Operation(summary = "List records by date", description = "All records stored for exactly the given date.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Matching records, possibly none",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = DataRecord.class)))),
      @ApiResponse(responseCode = "500", description = "Storage failure",
          content = @Content(mediaType = "text/plain"))
  })
  public List<DataRecord> getByDate(
      @RequestParam @Parameter(description = "Calendar date", example = "2024-03-01") String date) {
    return repository.findByDate(date);
  }

  private static LocalDate parseDate(String value) {
    try {
      return LocalDate.parse(value, DATE_FORMAT);
    } catch (DateTimeParseException ex) {
      throw new InvalidParameterException(
          "Invalid date '" + value + "'. Expected format: YYYY-MM-DD.",
          InvalidParameterException.INVALID_DATE);
    }
  }

  private static ObjectNode requireObject(JsonNode data) {
    if (data instanceof ObjectNode object) {
      return object;
    }
    throw new InvalidParameterException("Invalid data. Expected a JSON object.",
        InvalidParameterException.INVALID_DATA);
  }
}
