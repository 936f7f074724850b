package com.ospicorp.recordsapi.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.swagger.v3.oas.models.OpenAPI;
import org.junit.jupiter.api.Test;

class OpenApiConfigTest {

  @Test
  void documentDescribesRecordsApi() {
    OpenAPI api = new OpenApiConfig().apiInfo();

    assertThat(api.getInfo().getTitle()).isEqualTo("Records API");
    assertThat(api.getInfo().getContact().getName()).isEqualTo("Records API Team");
    assertThat(api.getInfo().getContact().getEmail()).isEqualTo("records-api@example.com");
  }
}
