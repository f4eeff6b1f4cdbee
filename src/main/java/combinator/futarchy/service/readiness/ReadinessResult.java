package combinator.futarchy.service.readiness;

/** 검사 한 건의 결과. reason은 사용자에게 그대로 보여지는 진단입니다. */
public record ReadinessResult(boolean ready, String reason) {

  private static final ReadinessResult READY = new ReadinessResult(true, null);

  public static ReadinessResult passed() {
    return READY;
  }

  public static ReadinessResult notReady(String reason) {
    return new ReadinessResult(false, reason);
  }
}
