package dev.coursecrawl.course;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ChangeStatusTest {

  @Test
  void fromMarkerMatchesImageSource() {
    assertThat(ChangeStatus.fromMarker("images/cancel.gif")).contains(ChangeStatus.CANCELLED);
    assertThat(ChangeStatus.fromMarker("images/space.gif")).isEmpty();
  }

  @Test
  void serializesAsCatalogLabel() throws Exception {
    assertThat(new ObjectMapper().writeValueAsString(ChangeStatus.MODIFIED)).isEqualTo("\"異動\"");
  }
}
