package combinator.futarchy.service.readiness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.organization.OrganizationKind;
import combinator.futarchy.global.error.exception.ReadinessCheckFailedException;
import combinator.futarchy.support.TestLogicExecutors;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReadinessGate 테스트")
class ReadinessGateTest {

  @Mock private ReadinessCheck first;
  @Mock private ReadinessCheck second;
  @Mock private ReadinessCheck third;

  private ReadinessGate gate;
  private ReadinessContext context;

  @BeforeEach
  void setUp() {
    gate = new ReadinessGate(List.of(first, second, third), TestLogicExecutors.real());
    Organization organization =
        Organization.builder()
            .address("org-ACME")
            .name("ACME")
            .kind(OrganizationKind.ROOT)
            .adminWallet("admin-0")
            .build();
    context =
        new ReadinessContext(
            organization, organization, "caller", Instant.parse("2026-03-02T09:00:00Z"), false);
  }

  @Test
  @DisplayName("모든 검사가 통과하면 실행 순서대로 통과 목록을 돌려준다")
  void allPassed() {
    // given
    stub(first, "first", ReadinessResult.passed());
    stub(second, "second", ReadinessResult.passed());
    stub(third, "third", ReadinessResult.passed());

    // when
    ReadinessReport report = gate.evaluate(context);

    // then
    assertThat(report.ready()).isTrue();
    assertThat(report.passed()).containsExactly("first", "second", "third");
    assertThat(report.failedCheck()).isNull();
  }

  @Test
  @DisplayName("첫 실패에서 멈추고 이후 검사는 실행하지 않는다")
  void stopsAtFirstFailure() {
    // given
    stub(first, "first", ReadinessResult.passed());
    stub(second, "second", ReadinessResult.notReady("Token mint not found: mint-ACME"));

    // when
    ReadinessReport report = gate.evaluate(context);

    // then
    assertThat(report.ready()).isFalse();
    assertThat(report.failedCheck()).isEqualTo("second");
    assertThat(report.reason()).isEqualTo("Token mint not found: mint-ACME");
    assertThat(report.passed()).containsExactly("first");
    verify(third, never()).check(any());
  }

  @Test
  @DisplayName("적용되지 않는 검사는 건너뛴다")
  void skipsNonApplicableCheck() {
    // given
    stub(first, "first", ReadinessResult.passed());
    given(second.appliesTo(context)).willReturn(false);
    stub(third, "third", ReadinessResult.passed());

    // when
    ReadinessReport report = gate.evaluate(context);

    // then
    assertThat(report.passed()).containsExactly("first", "third");
    verify(second, never()).check(any());
  }

  @Test
  @DisplayName("검사 도중 예외가 나면 해당 검사의 실패로 취급한다")
  void collaboratorFailureFailsClosed() {
    // given
    given(first.appliesTo(any())).willReturn(true);
    given(first.name()).willReturn("first");
    given(first.check(context)).willThrow(new IllegalStateException("rpc down"));

    // when
    ReadinessReport report = gate.evaluate(context);

    // then
    assertThat(report.ready()).isFalse();
    assertThat(report.failedCheck()).isEqualTo("first");
    assertThat(report.reason()).startsWith("Failed to run first");
    verify(second, never()).check(any());
  }

  @Test
  @DisplayName("verify는 실패한 검사 이름과 사유를 담아 예외를 던진다")
  void verifyThrowsWithCheckName() {
    // given
    stub(first, "active_proposal", ReadinessResult.notReady("Active proposal 0 in progress."));

    // when & then
    assertThatThrownBy(() -> gate.verify(context))
        .isInstanceOf(ReadinessCheckFailedException.class)
        .hasMessage("Active proposal 0 in progress.")
        .extracting("check")
        .isEqualTo("active_proposal");
  }

  private void stub(ReadinessCheck check, String name, ReadinessResult result) {
    given(check.appliesTo(any())).willReturn(true);
    given(check.name()).willReturn(name);
    given(check.check(context)).willReturn(result);
  }
}
