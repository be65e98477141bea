package dev.coursecrawl.semester;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SemesterTest {

  @Test
  void parseReadsYearAndTerm() {
    Semester semester = Semester.parse("104-1");

    assertThat(semester.year()).isEqualTo(104);
    assertThat(semester.term()).isEqualTo(1);
    assertThat(semester.id()).isEqualTo("104-1");
    assertThat(semester).hasToString("104-1");
  }

  @Test
  void parseToleratesSurroundingWhitespace() {
    assertThat(Semester.parse(" 98-2 ")).isEqualTo(new Semester(98, 2));
  }

  @Test
  void parseKeepsIdentifierAsWritten() {
    Semester padded = Semester.parse(" 099-1 ");

    assertThat(padded.id()).isEqualTo("099-1");
    assertThat(padded.year()).isEqualTo(99);
    assertThat(padded.compareTo(Semester.parse("99-1"))).isZero();
    assertThat(padded.era()).isEqualTo(Era.MODERN);
  }

  @Test
  void numericConstructorDerivesIdentifier() {
    assertThat(new Semester(98, 2).id()).isEqualTo("98-2");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "104", "104-", "-1", "104-1-2", "abc-1", "104-5", "104-0"})
  void parseRejectsMalformedIds(String id) {
    assertThatThrownBy(() -> Semester.parse(id)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parseRejectsNull() {
    assertThatThrownBy(() -> Semester.parse(null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("null");
  }

  @Test
  void compareToOrdersByYearThenTerm() {
    assertThat(new Semester(98, 2)).isLessThan(new Semester(99, 1));
    assertThat(new Semester(99, 1)).isLessThan(new Semester(99, 2));
    assertThat(new Semester(100, 1)).isGreaterThan(new Semester(99, 2));
    assertThat(new Semester(99, 1).compareTo(Semester.parse("99-1"))).isZero();
  }

  @Test
  void eraSwitchesAtFirstModernSemester() {
    assertThat(Semester.parse("98-2").era()).isEqualTo(Era.LEGACY);
    assertThat(Semester.parse("99-1").era()).isEqualTo(Era.MODERN);
    assertThat(Semester.parse("104-1").era()).isEqualTo(Era.MODERN);
  }
}
