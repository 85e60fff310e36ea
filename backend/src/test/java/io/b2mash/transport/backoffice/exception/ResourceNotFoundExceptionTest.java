package io.b2mash.transport.backoffice.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ResourceNotFoundExceptionTest {

  @Test
  void problemNamesResourceInPlainWords() {
    var id = UUID.fromString("0b6d1f7e-8c1a-4a55-9a8e-3f1f2a7c9d10");

    var ex = new ResourceNotFoundException("VehicleCategory", id);

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(ex.getBody().getTitle()).isEqualTo("VehicleCategory not found");
    assertThat(ex.getBody().getDetail())
        .isEqualTo("No vehicle category with id " + id + " in this organization");
    assertThat(ex.getBody().getProperties()).containsEntry("code", "not_found");
  }
}
