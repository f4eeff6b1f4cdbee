package combinator.futarchy.service.readiness;

import java.util.List;

/**
 * 게이트 평가 결과
 *
 * @param passed 통과한 검사 (실행 순서)
 * @param failedCheck 실패한 검사 이름 (통과면 null)
 */
public record ReadinessReport(List<String> passed, String failedCheck, String reason) {

  public ReadinessReport {
    passed = List.copyOf(passed);
  }

  public static ReadinessReport allPassed(List<String> passed) {
    return new ReadinessReport(passed, null, null);
  }

  public static ReadinessReport failed(List<String> passed, String check, String reason) {
    return new ReadinessReport(passed, check, reason);
  }

  public boolean ready() {
    return failedCheck == null;
  }
}
