package com.ospicorp.recordsapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
class RecordsApiApplicationTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  private TestRestTemplate restTemplate;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM records");
  }

  @Test
  void createdRecordIsReturnedByDate() {
    ResponseEntity<String> created = postRecord("{\"date\":\"2024-03-01\",\"data\":{\"temp\":21.5}}");

    assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(created.getBody()).isNull();

    ResponseEntity<List<Map<String, Object>>> response = getRecords("2024-03-01");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> body = response.getBody();
    assertThat(body).hasSize(1);
    Map<String, Object> record = body.get(0);
    assertThat(record).containsKeys("id", "date", "data", "created_at");
    assertThat(record.get("date")).isEqualTo("2024-03-01T00:00:00Z");
    assertThat(record.get("data")).isEqualTo(Map.of("temp", 21.5));
    assertThat((String) record.get("created_at")).endsWith("Z");
  }

  @Test
  void unknownDateReturnsEmptyArray() {
    ResponseEntity<String> response = restTemplate.getForEntity("/records?date=1999-01-01", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo("[]");
  }

  @Test
  void malformedDateIsRejectedAndNothingIsPersisted() {
    ResponseEntity<String> response = postRecord("{\"date\":\"2024-13-01\",\"data\":{\"temp\":1}}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    Integer count = jdbcTemplate.queryForObject("SELECT count(*) FROM records", Integer.class);
    assertThat(count).isZero();
  }

  @Test
  void unparseableQueryDateIsReportedAsServerError() {
    ResponseEntity<String> response = restTemplate.getForEntity("/records?date=not-a-date", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody()).contains("not-a-date");
  }

  private ResponseEntity<String> postRecord(String json) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return restTemplate.postForEntity("/records", new HttpEntity<>(json, headers), String.class);
  }

  private ResponseEntity<List<Map<String, Object>>> getRecords(String date) {
    return restTemplate.exchange(
        "/records?date=" + date,
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});
  }
}
